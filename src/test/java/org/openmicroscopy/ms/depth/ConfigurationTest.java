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

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Check that the configuration is read and validated as expected.
 * @author The Open Microscopy Environment
 */
public class ConfigurationTest {

    /**
     * @return settings for connecting to a database, and nothing else
     */
    static Map<String, String> getDatabaseSettings() {
        return ImmutableMap.of(
                Configuration.CONF_DB_HOST, "db.example.org",
                Configuration.CONF_DB_PORT, "3306",
                Configuration.CONF_DB_USER, "depth",
                Configuration.CONF_DB_PASS, "secret",
                Configuration.CONF_DB_NAME, "depthdb");
    }

    /**
     * Check the default values of optional settings.
     * @throws ImageServiceException unexpected
     */
    @Test
    public void testDefaults() throws ImageServiceException {
        final Configuration configuration = new Configuration(getDatabaseSettings());
        Assertions.assertEquals("jdbc:mysql://db.example.org:3306/depthdb", configuration.getDatabaseUrl());
        Assertions.assertEquals("depth", configuration.getDatabaseUser());
        Assertions.assertEquals("secret", configuration.getDatabasePassword());
        Assertions.assertEquals("test_image", configuration.getImageName());
        Assertions.assertEquals("image/img.csv", configuration.getImageSource());
        Assertions.assertEquals(150, configuration.getImageWidth());
        Assertions.assertEquals(8080, configuration.getServerPort());
        Assertions.assertEquals("images", configuration.getTableName());
        Assertions.assertTrue(configuration.isStartupLoadEnabled());
    }

    /**
     * Check that optional settings may be overridden.
     * @throws ImageServiceException unexpected
     */
    @Test
    public void testOverrides() throws ImageServiceException {
        final Map<String, String> settings = new HashMap<>(getDatabaseSettings());
        settings.put(Configuration.CONF_IMAGE_NAME, "core_7");
        settings.put(Configuration.CONF_IMAGE_SOURCE, "/data/core_7.csv");
        settings.put(Configuration.CONF_IMAGE_WIDTH, "300");
        settings.put(Configuration.CONF_NET_PORT, "9090");
        settings.put(Configuration.CONF_TABLE_NAME, "core_images");
        settings.put(Configuration.CONF_STARTUP_LOAD, "false");
        final Configuration configuration = new Configuration(settings);
        Assertions.assertEquals("core_7", configuration.getImageName());
        Assertions.assertEquals("/data/core_7.csv", configuration.getImageSource());
        Assertions.assertEquals(300, configuration.getImageWidth());
        Assertions.assertEquals(9090, configuration.getServerPort());
        Assertions.assertEquals("core_images", configuration.getTableName());
        Assertions.assertFalse(configuration.isStartupLoadEnabled());
    }

    /**
     * Check that each database setting is required.
     * @param key the key of a database setting
     */
    @ParameterizedTest
    @ValueSource(strings = {Configuration.CONF_DB_HOST, Configuration.CONF_DB_PORT, Configuration.CONF_DB_USER,
            Configuration.CONF_DB_PASS, Configuration.CONF_DB_NAME})
    public void testMissingDatabaseSetting(String key) {
        final Map<String, String> settings = new HashMap<>(getDatabaseSettings());
        settings.remove(key);
        final ImageServiceException exception =
                Assertions.assertThrows(ImageServiceException.class, () -> new Configuration(settings));
        Assertions.assertEquals(ImageServiceException.Kind.CONFIGURATION, exception.getKind());
        Assertions.assertTrue(exception.getMessage().contains(key));
    }

    /**
     * Check that numeric settings must be positive integers.
     * @param value an invalid value for the image width
     */
    @ParameterizedTest
    @ValueSource(strings = {"wide", "0", "-150", "1.5"})
    public void testInvalidWidth(String value) {
        final Map<String, String> settings = new HashMap<>(getDatabaseSettings());
        settings.put(Configuration.CONF_IMAGE_WIDTH, value);
        final ImageServiceException exception =
                Assertions.assertThrows(ImageServiceException.class, () -> new Configuration(settings));
        Assertions.assertEquals(ImageServiceException.Kind.CONFIGURATION, exception.getKind());
    }

    /**
     * Check that table names are restricted to plain identifiers.
     */
    @Test
    public void testInvalidTableName() {
        final Map<String, String> settings = new HashMap<>(getDatabaseSettings());
        settings.put(Configuration.CONF_TABLE_NAME, "images`; --");
        final ImageServiceException exception =
                Assertions.assertThrows(ImageServiceException.class, () -> new Configuration(settings));
        Assertions.assertEquals(ImageServiceException.Kind.CONFIGURATION, exception.getKind());
    }

    /**
     * Check that only the prefixed properties are taken as configuration.
     */
    @Test
    public void testFromProperties() {
        final Properties properties = new Properties();
        properties.put("ms.depth.db.host", "localhost");
        properties.put("ms.depth.image.width", "75");
        properties.put("java.home", "/usr/lib/jvm");
        properties.put("ms.other.net.port", "8081");
        final Map<String, String> expected = ImmutableMap.of(
                Configuration.CONF_DB_HOST, "localhost",
                Configuration.CONF_IMAGE_WIDTH, "75");
        Assertions.assertEquals(expected, Configuration.fromProperties(properties));
    }
}
