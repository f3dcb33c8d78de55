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

import java.io.IOException;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableMap;

public class ConfigEnv {

    /* Environment variables that directly name database settings. */
    static final Map<String, String> DATABASE_VARIABLES = ImmutableMap.of(
            "DB_HOST", Configuration.CONF_DB_HOST,
            "DB_PORT", Configuration.CONF_DB_PORT,
            "DB_USER", Configuration.CONF_DB_USER,
            "DB_PASS", Configuration.CONF_DB_PASS,
            "DB_NAME", Configuration.CONF_DB_NAME);

    /**
     * Convert environment variables to configuration properties.
     * The {@code DB_*} variables become the database settings.
     * Variables beginning with "CONFIG_" are converted to configuration properties:
     * since "." is not allowed in a variable name "." must be replaced by "_", and "_" by "__".
     * For example "CONFIG_ms_depth_image_width=300" will become "ms.depth.image.width=300".
     * @param environment the environment variables
     * @return the corresponding configuration properties
     */
    public static Properties toProperties(Map<String, String> environment) {
        final Properties properties = new Properties();
        for (final Map.Entry<String, String> e : environment.entrySet()) {
            if (e.getKey().startsWith("CONFIG_")) {
                String key = e.getKey().substring(7);
                key = key.replaceAll("([^_])_([^_])", "$1.$2").replaceAll("__", "_");
                properties.put(key, e.getValue());
            }
        }
        for (final Map.Entry<String, String> variable : DATABASE_VARIABLES.entrySet()) {
            final String value = environment.get(variable.getKey());
            if (value != null) {
                properties.put(Configuration.PROPERTY_PREFIX + variable.getValue(), value);
            }
        }
        return properties;
    }

    /**
     * Converts configuration environment variables to configuration properties and runs the microservice.
     * @param argv filename(s) from which to read configuration beyond current Java system properties
     * @throws IOException if the configuration could not be loaded
     * @throws ImageServiceException if the configuration is incomplete or invalid
     */
    public static void main(String[] argv) throws IOException, ImageServiceException {
        DepthImageService.run(argv, toProperties(System.getenv()));
    }
}
