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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The ordered columns of a table of image rows.
 * @author The Open Microscopy Environment
 */
public class TableSchema {

    public static final String COLUMN_ROW_INDEX = "row_index";
    public static final String COLUMN_CHANNELS = "channels";
    public static final String COLUMN_DEPTH = "depth";
    public static final String COLUMN_IMAGE_NAME = "image_name";

    /**
     * The types of value that a column may hold.
     * @author The Open Microscopy Environment
     */
    public enum ColumnType {
        INTEGER("INTEGER"),
        FLOAT("DOUBLE"),
        TEXT("VARCHAR(255)");

        private final String sqlType;

        ColumnType(String sqlType) {
            this.sqlType = sqlType;
        }

        /**
         * @return the SQL type with which to declare the column
         */
        public String getSqlType() {
            return sqlType;
        }
    }

    /**
     * A named, typed column.
     * @author The Open Microscopy Environment
     */
    public static class Column {

        private final String name;
        private final ColumnType type;

        public Column(String name, ColumnType type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public ColumnType getType() {
            return type;
        }

        @Override
        public String toString() {
            return name + " " + type;
        }
    }

    private final List<Column> columns;

    /**
     * @param columns the columns of the table, in order
     */
    public TableSchema(List<Column> columns) {
        this.columns = ImmutableList.copyOf(columns);
    }

    /**
     * The schema for image rows with the given number of samples.
     * Pixel columns are named by their position.
     * @param pixelCount the number of samples in each row
     * @return the schema
     */
    public static TableSchema forPixelCount(int pixelCount) {
        final ImmutableList.Builder<Column> columns = ImmutableList.builder();
        columns.add(new Column(COLUMN_ROW_INDEX, ColumnType.INTEGER));
        for (int index = 0; index < pixelCount; index++) {
            columns.add(new Column(Integer.toString(index), ColumnType.INTEGER));
        }
        columns.add(new Column(COLUMN_CHANNELS, ColumnType.INTEGER));
        columns.add(new Column(COLUMN_DEPTH, ColumnType.FLOAT));
        columns.add(new Column(COLUMN_IMAGE_NAME, ColumnType.TEXT));
        return new TableSchema(columns.build());
    }

    /**
     * Compute the schema for the given rows.
     * @param rows some image rows
     * @return the schema for those rows
     * @throws ImageServiceException if there are no rows or if they differ in sample count
     */
    public static TableSchema forRows(List<ImageRow> rows) throws ImageServiceException {
        if (rows.isEmpty()) {
            throw new ImageServiceException(ImageServiceException.Kind.WRITE, "no image rows to store");
        }
        final int pixelCount = rows.get(0).getPixels().length;
        for (final ImageRow row : rows) {
            if (row.getPixels().length != pixelCount) {
                throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                        "dimension mismatch: rows of " + pixelCount + " and " + row.getPixels().length + " samples");
            }
        }
        return forPixelCount(pixelCount);
    }

    /**
     * @param name a column name
     * @return if the name is of a column that tags rows rather than holding samples
     */
    public static boolean isTagColumn(String name) {
        return COLUMN_ROW_INDEX.equalsIgnoreCase(name) || COLUMN_CHANNELS.equalsIgnoreCase(name) ||
                COLUMN_DEPTH.equalsIgnoreCase(name) || COLUMN_IMAGE_NAME.equalsIgnoreCase(name);
    }

    /**
     * @return the columns of the table, in order
     */
    public List<Column> getColumns() {
        return columns;
    }

    /**
     * @param name a column name
     * @return if this schema has a column of that name
     */
    public boolean hasColumn(String name) {
        return columns.stream().anyMatch(column -> column.getName().equals(name));
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
