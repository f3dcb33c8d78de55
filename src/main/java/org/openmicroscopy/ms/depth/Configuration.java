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
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the configuration of this microservice.
 * @author The Open Microscopy Environment
 */
public class Configuration {

    private static final Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

    /* Prefix of the Java system properties from which configuration may be drawn. */
    public final static String PROPERTY_PREFIX = "ms.depth.";

    /* Configuration keys for the map provided to the constructor. */
    public final static String CONF_DB_HOST = "db.host";
    public final static String CONF_DB_PORT = "db.port";
    public final static String CONF_DB_USER = "db.user";
    public final static String CONF_DB_PASS = "db.pass";
    public final static String CONF_DB_NAME = "db.name";
    public final static String CONF_IMAGE_NAME = "image.name";
    public final static String CONF_IMAGE_SOURCE = "image.source";
    public final static String CONF_IMAGE_WIDTH = "image.width";
    public final static String CONF_NET_PORT = "net.port";
    public final static String CONF_STARTUP_LOAD = "startup.load";
    public final static String CONF_TABLE_NAME = "table.name";

    /* Settings that have no default value. */
    private final static List<String> REQUIRED =
            ImmutableList.of(CONF_DB_HOST, CONF_DB_PORT, CONF_DB_USER, CONF_DB_PASS, CONF_DB_NAME);

    private final static Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private String dbHost;
    private int dbPort;
    private String dbUser;
    private String dbPass;
    private String dbName;

    /* Configuration initialized to default values. */
    private String imageName = "test_image";
    private String imageSource = "image/img.csv";
    private int imageWidth = 150;
    private int netPort = 8080;
    private boolean startupLoad = true;
    private String tableName = "images";

    /**
     * Construct a new read-only configuration drawn from system properties of the form {@code ms.depth.*}.
     * @throws ImageServiceException if the configuration is incomplete or invalid
     */
    public Configuration() throws ImageServiceException {
        this(fromProperties(System.getProperties()));
    }

    /**
     * Construct a new read-only configuration.
     * @param configuration a map of configuration keys and values, must not be {@code null}
     * @throws ImageServiceException if the configuration is incomplete or invalid
     */
    public Configuration(Map<String, String> configuration) throws ImageServiceException {
        setConfiguration(configuration);
    }

    /**
     * Extract the configuration from properties of the form {@code ms.depth.*}.
     * @param properties some properties
     * @return the configuration keys and values found among the properties
     */
    public static Map<String, String> fromProperties(Properties properties) {
        final ImmutableMap.Builder<String, String> configuration = ImmutableMap.builder();
        for (final Map.Entry<Object, Object> property : properties.entrySet()) {
            final Object keyObject = property.getKey();
            final Object valueObject = property.getValue();
            if (keyObject instanceof String && valueObject instanceof String) {
                final String key = (String) keyObject;
                final String value = (String) valueObject;
                if (key.startsWith(PROPERTY_PREFIX)) {
                    configuration.put(key.substring(PROPERTY_PREFIX.length()), value);
                }
            }
        }
        return configuration.build();
    }

    /**
     * @param message a description of the invalid configuration
     * @return an exception to throw for that configuration
     */
    private static ImageServiceException invalid(String message) {
        LOGGER.error(message);
        return new ImageServiceException(ImageServiceException.Kind.CONFIGURATION, message);
    }

    /**
     * @param key a configuration key
     * @param value the value for that key
     * @return the value as a positive integer
     * @throws ImageServiceException if the value is not a positive integer
     */
    private static int parsePositive(String key, String value) throws ImageServiceException {
        final int number;
        try {
            number = Integer.parseInt(value.trim());
        } catch (NumberFormatException nfe) {
            throw invalid(key + " must be an integer, not " + value);
        }
        if (number <= 0) {
            throw invalid(key + " must be positive, not " + value);
        }
        return number;
    }

    /**
     * @param configuration the configuration keys and values to apply over the current state.
     * @throws ImageServiceException if the configuration is incomplete or invalid
     */
    private void setConfiguration(Map<String, String> configuration) throws ImageServiceException {
        final ImmutableList.Builder<String> missingBuilder = ImmutableList.builder();
        for (final String key : REQUIRED) {
            final String value = configuration.get(key);
            if (value == null || value.trim().isEmpty()) {
                missingBuilder.add(key);
            }
        }
        final List<String> missing = missingBuilder.build();
        if (!missing.isEmpty()) {
            throw invalid("missing configuration for database connection: " + String.join(", ", missing));
        }

        this.dbHost = configuration.get(CONF_DB_HOST).trim();
        this.dbPort = parsePositive(CONF_DB_PORT, configuration.get(CONF_DB_PORT));
        this.dbUser = configuration.get(CONF_DB_USER);
        this.dbPass = configuration.get(CONF_DB_PASS);
        this.dbName = configuration.get(CONF_DB_NAME).trim();

        final String imageName = configuration.get(CONF_IMAGE_NAME);
        final String imageSource = configuration.get(CONF_IMAGE_SOURCE);
        final String imageWidth = configuration.get(CONF_IMAGE_WIDTH);
        final String netPort = configuration.get(CONF_NET_PORT);
        final String startupLoad = configuration.get(CONF_STARTUP_LOAD);
        final String tableName = configuration.get(CONF_TABLE_NAME);

        if (imageName != null) {
            this.imageName = imageName;
        }

        if (imageSource != null) {
            this.imageSource = imageSource;
        }

        if (imageWidth != null) {
            this.imageWidth = parsePositive(CONF_IMAGE_WIDTH, imageWidth);
        }

        if (netPort != null) {
            this.netPort = parsePositive(CONF_NET_PORT, netPort);
        }

        if (startupLoad != null) {
            this.startupLoad = Boolean.parseBoolean(startupLoad.trim());
        }

        if (tableName != null) {
            if (TABLE_NAME.matcher(tableName).matches()) {
                this.tableName = tableName;
            } else {
                throw invalid("table name must be letters, digits and underscores, not " + tableName);
            }
        }

        if (LOGGER.isInfoEnabled()) {
            for (final Map.Entry<String, String> setting : configuration.entrySet()) {
                if (CONF_DB_PASS.equals(setting.getKey())) {
                    LOGGER.info("configured: {} = ****", setting.getKey());
                } else {
                    LOGGER.info("configured: {} = {}", setting.getKey(), setting.getValue());
                }
            }
        }
    }

    /**
     * @return the JDBC URL of the database
     */
    public String getDatabaseUrl() {
        return "jdbc:mysql://" + dbHost + ':' + dbPort + '/' + dbName;
    }

    public String getDatabaseHost() {
        return dbHost;
    }

    public int getDatabasePort() {
        return dbPort;
    }

    public String getDatabaseUser() {
        return dbUser;
    }

    public String getDatabasePassword() {
        return dbPass;
    }

    public String getDatabaseName() {
        return dbName;
    }

    /**
     * @return the name given to the image loaded at startup
     */
    public String getImageName() {
        return imageName;
    }

    /**
     * @return the path of the file from which the image is loaded at startup
     */
    public String getImageSource() {
        return imageSource;
    }

    /**
     * @return the width to which stored images are resized
     */
    public int getImageWidth() {
        return imageWidth;
    }

    /**
     * @return the configured TCP port for HTTP
     */
    public int getServerPort() {
        return netPort;
    }

    /**
     * @return if the image should be loaded into the database at startup
     */
    public boolean isStartupLoadEnabled() {
        return startupLoad;
    }

    /**
     * @return the name of the database table that holds the images
     */
    public String getTableName() {
        return tableName;
    }
}
