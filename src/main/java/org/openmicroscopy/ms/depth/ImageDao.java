/*
 * Copyright (C) 2024 University of Dundee & Open Microscopy Environment.
 * All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package org.openmicroscopy.ms.depth;

import org.openmicroscopy.ms.depth.image.ColorMap;
import org.openmicroscopy.ms.depth.image.ColorMaps;
import org.openmicroscopy.ms.depth.image.PixelConverter;
import org.openmicroscopy.ms.depth.image.PixelMatrix;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import javax.sql.DataSource;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Data Access Object for the tables of depth-tagged image rows.
 * Each operation uses its own connection from the data source.
 * @author The Open Microscopy Environment
 */
public class ImageDao {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageDao.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

    /**
     * A database operation that may fail with an {@link SQLException}.
     * @param <X> the type of the operation's result
     * @author The Open Microscopy Environment
     */
    @FunctionalInterface
    private interface ConnectionOperation<X> {
        X apply(Connection connection) throws SQLException;
    }

    private final DataSource dataSource;

    /**
     * @param dataSource the source of database connections
     */
    public ImageDao(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Provide a database connection to an operation.
     * @param <X> the type of the operation's result
     * @param failureKind the kind of failure to report if the operation fails
     * @param action a description of the operation, for use in the failure message
     * @param operation the operation
     * @return the result of the operation
     * @throws ImageServiceException if a connection could not be obtained or the operation failed
     */
    private <X> X withConnection(ImageServiceException.Kind failureKind, String action, ConnectionOperation<X> operation)
            throws ImageServiceException {
        final Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException sqle) {
            LOGGER.warn("failed to connect to database", sqle);
            throw new ImageServiceException(ImageServiceException.Kind.CONNECTION,
                    "failed to connect to database: " + sqle.getMessage(), sqle);
        }
        try (final Connection autoClosed = connection) {
            return operation.apply(autoClosed);
        } catch (SQLException sqle) {
            LOGGER.warn("failed to {}", action, sqle);
            throw new ImageServiceException(failureKind, "failed to " + action + ": " + sqle.getMessage(), sqle);
        }
    }

    /**
     * @param tableName a table name
     * @throws ImageServiceException if the name is not a plain identifier
     */
    private static void checkTableName(String tableName) throws ImageServiceException {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new ImageServiceException(ImageServiceException.Kind.SCHEMA,
                    "table name must be letters, digits and underscores, not " + tableName);
        }
    }

    /**
     * @param connection a database connection
     * @param identifier a table or column name
     * @return the name quoted for use in SQL
     * @throws SQLException if the database metadata could not be read
     */
    private static String quote(Connection connection, String identifier) throws SQLException {
        String quote = connection.getMetaData().getIdentifierQuoteString();
        if (quote == null || quote.trim().isEmpty()) {
            quote = "";
        }
        return quote + identifier + quote;
    }

    /**
     * Create the table unless it already exists. An existing table is not altered to match the schema.
     * @param tableName the name of the table
     * @param schema the columns of the table, which must include {@link TableSchema#COLUMN_IMAGE_NAME}
     * @throws ImageServiceException if the table could not be created
     */
    public void ensureTable(String tableName, TableSchema schema) throws ImageServiceException {
        checkTableName(tableName);
        if (!schema.hasColumn(TableSchema.COLUMN_IMAGE_NAME)) {
            throw new ImageServiceException(ImageServiceException.Kind.SCHEMA,
                    "table schema lacks column " + TableSchema.COLUMN_IMAGE_NAME);
        }
        withConnection(ImageServiceException.Kind.SCHEMA, "create table " + tableName, connection -> {
            final List<String> definitions = new ArrayList<>();
            for (final TableSchema.Column column : schema.getColumns()) {
                String definition = quote(connection, column.getName()) + ' ' + column.getType().getSqlType();
                if (TableSchema.COLUMN_IMAGE_NAME.equals(column.getName()) ||
                        TableSchema.COLUMN_ROW_INDEX.equals(column.getName())) {
                    definition += " NOT NULL";
                }
                definitions.add(definition);
            }
            final List<String> primaryKey = new ArrayList<>();
            primaryKey.add(quote(connection, TableSchema.COLUMN_IMAGE_NAME));
            if (schema.hasColumn(TableSchema.COLUMN_ROW_INDEX)) {
                primaryKey.add(quote(connection, TableSchema.COLUMN_ROW_INDEX));
            }
            definitions.add("PRIMARY KEY (" + Joiner.on(", ").join(primaryKey) + ")");
            final String sql = "CREATE TABLE IF NOT EXISTS " + quote(connection, tableName) +
                    " (" + Joiner.on(", ").join(definitions) + ")";
            LOGGER.debug("ensure table {} with {} columns", tableName, schema.getColumns().size());
            try (final Statement statement = connection.createStatement()) {
                statement.execute(sql);
            }
            return null;
        });
    }

    /**
     * @param tableName the name of an existing table
     * @return the names of the table's columns, in order
     * @throws ImageServiceException if the table could not be read
     */
    private List<String> getColumnNames(String tableName) throws ImageServiceException {
        return withConnection(ImageServiceException.Kind.SCHEMA, "read columns of table " + tableName, connection -> {
            final List<String> names = new ArrayList<>();
            try (final Statement statement = connection.createStatement();
                 final ResultSet resultSet = statement.executeQuery(
                         "SELECT * FROM " + quote(connection, tableName) + " WHERE 1 = 0")) {
                final ResultSetMetaData metaData = resultSet.getMetaData();
                for (int column = 1; column <= metaData.getColumnCount(); column++) {
                    names.add(metaData.getColumnName(column));
                }
            }
            return names;
        });
    }

    /**
     * @param tableName the name of the table to drop
     * @throws ImageServiceException if the table could not be dropped
     */
    private void dropTable(String tableName) throws ImageServiceException {
        withConnection(ImageServiceException.Kind.SCHEMA, "drop table " + tableName, connection -> {
            try (final Statement statement = connection.createStatement()) {
                statement.execute("DROP TABLE " + quote(connection, tableName));
            }
            return null;
        });
    }

    /**
     * Replace the whole content of the table with the given rows, creating the table if necessary.
     * Rows of other images previously in the table are removed too.
     * A table whose columns do not fit the rows is dropped and created anew.
     * @param tableName the name of the table
     * @param rows the rows to store
     * @throws ImageServiceException if the table could not be created or the rows could not be written
     */
    public void replaceInsert(String tableName, List<ImageRow> rows) throws ImageServiceException {
        final TableSchema schema = TableSchema.forRows(rows);
        ensureTable(tableName, schema);
        final List<String> expectedColumns = new ArrayList<>();
        for (final TableSchema.Column column : schema.getColumns()) {
            expectedColumns.add(column.getName());
        }
        if (!expectedColumns.equals(getColumnNames(tableName))) {
            LOGGER.info("recreating table {} with {} columns", tableName, expectedColumns.size());
            dropTable(tableName);
            ensureTable(tableName, schema);
        }
        LOGGER.debug("replace content of table {} with {} rows", tableName, rows.size());
        withConnection(ImageServiceException.Kind.WRITE, "write rows to table " + tableName, connection -> {
            final String table = quote(connection, tableName);
            final List<String> columnNames = new ArrayList<>();
            final List<String> placeholders = new ArrayList<>();
            for (final TableSchema.Column column : schema.getColumns()) {
                columnNames.add(quote(connection, column.getName()));
                placeholders.add("?");
            }
            final String insert = "INSERT INTO " + table + " (" + Joiner.on(", ").join(columnNames) + ") VALUES (" +
                    Joiner.on(", ").join(placeholders) + ")";
            connection.setAutoCommit(false);
            try (final Statement delete = connection.createStatement();
                 final PreparedStatement statement = connection.prepareStatement(insert)) {
                delete.executeUpdate("DELETE FROM " + table);
                for (final ImageRow row : rows) {
                    int parameter = 1;
                    statement.setInt(parameter++, row.getRowIndex());
                    for (final int pixel : row.getPixels()) {
                        statement.setInt(parameter++, pixel);
                    }
                    statement.setInt(parameter++, row.getChannels());
                    statement.setDouble(parameter++, row.getDepth());
                    statement.setString(parameter, row.getImageName());
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException sqle) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackFailure) {
                    sqle.addSuppressed(rollbackFailure);
                }
                throw sqle;
            }
            return null;
        });
        LOGGER.info("stored {} rows in table {}", rows.size(), tableName);
    }

    /**
     * The stored samples of some rows of an image.
     * @author The Open Microscopy Environment
     */
    private static class StoredRows {

        final List<int[]> pixels = new ArrayList<>();
        int channels = 1;
    }

    /**
     * Fetch an image's rows from a depth range and colorize them.
     * @param tableName the name of the table
     * @param depthMin the minimum depth, inclusive
     * @param depthMax the maximum depth, inclusive
     * @param colorMapName the name of the color map to apply
     * @param imageName the name of the image
     * @return the colorized rows, as a three-channel image in blue, green, red order
     * @throws ImageServiceException if the color map is unknown, the query failed or no rows matched
     */
    public PixelMatrix queryImage(String tableName, double depthMin, double depthMax, String colorMapName, String imageName)
            throws ImageServiceException {
        final ColorMap colorMap = ColorMaps.forName(colorMapName);
        checkTableName(tableName);
        LOGGER.debug("fetch rows of image {} with depth from {} to {}", imageName, depthMin, depthMax);
        final StoredRows rows = withConnection(ImageServiceException.Kind.QUERY, "query table " + tableName, connection -> {
            final String sql = "SELECT * FROM " + quote(connection, tableName) +
                    " WHERE " + quote(connection, TableSchema.COLUMN_DEPTH) + " BETWEEN ? AND ?" +
                    " AND " + quote(connection, TableSchema.COLUMN_IMAGE_NAME) + " = ?" +
                    " ORDER BY " + quote(connection, TableSchema.COLUMN_ROW_INDEX);
            try (final PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setDouble(1, depthMin);
                statement.setDouble(2, depthMax);
                statement.setString(3, imageName);
                try (final ResultSet resultSet = statement.executeQuery()) {
                    return readRows(resultSet);
                }
            }
        });
        if (rows.pixels.isEmpty()) {
            throw new ImageServiceException(ImageServiceException.Kind.QUERY,
                    "no data found for image " + imageName + " with depth from " + depthMin + " to " + depthMax);
        }
        LOGGER.debug("fetched {} rows of image {}", rows.pixels.size(), imageName);
        final PixelMatrix image = PixelConverter.rowsToMatrix(rows.pixels, rows.channels == 3);
        return colorMap.apply(image);
    }

    /**
     * Read the samples from the rows of a query result, skipping the tag columns.
     * @param resultSet the query result
     * @return the samples of each row
     * @throws SQLException if the result could not be read
     */
    private static StoredRows readRows(ResultSet resultSet) throws SQLException {
        final ResultSetMetaData metadata = resultSet.getMetaData();
        final ImmutableList.Builder<Integer> pixelColumnsBuilder = ImmutableList.builder();
        Integer channelsColumn = null;
        for (int column = 1; column <= metadata.getColumnCount(); column++) {
            final String name = metadata.getColumnLabel(column);
            if (TableSchema.COLUMN_CHANNELS.equalsIgnoreCase(name)) {
                channelsColumn = column;
            } else if (!TableSchema.isTagColumn(name)) {
                pixelColumnsBuilder.add(column);
            }
        }
        final List<Integer> pixelColumns = pixelColumnsBuilder.build();
        final StoredRows rows = new StoredRows();
        while (resultSet.next()) {
            if (rows.pixels.isEmpty() && channelsColumn != null) {
                rows.channels = resultSet.getInt(channelsColumn);
            }
            final int[] pixels = new int[pixelColumns.size()];
            for (int index = 0; index < pixels.length; index++) {
                pixels[index] = resultSet.getInt(pixelColumns.get(index));
            }
            rows.pixels.add(pixels);
        }
        return rows;
    }
}
