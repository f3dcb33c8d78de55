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

import java.io.FileInputStream;
import java.io.InputStream;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import javax.sql.DataSource;

import com.google.common.collect.ImmutableList;
import com.mysql.cj.jdbc.MysqlDataSource;

import io.vertx.core.AsyncResult;
import io.vertx.core.Verticle;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Microservice storing depth-indexed images and providing colorized depth ranges over a HTTP endpoint.
 * @author The Open Microscopy Environment
 */
public class DepthImageService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DepthImageService.class);

    /**
     * @param configuration the configuration of this microservice
     * @return a source of connections to the configured database
     */
    public static DataSource createDataSource(Configuration configuration) {
        final MysqlDataSource dataSource = new MysqlDataSource();
        dataSource.setUrl(configuration.getDatabaseUrl());
        dataSource.setUser(configuration.getDatabaseUser());
        dataSource.setPassword(configuration.getDatabasePassword());
        return dataSource;
    }

    /**
     * Construct the handlers for the HTTP endpoints.
     * @param configuration the configuration of this microservice
     * @param imageDao the data access object for the image tables
     * @return the request handlers
     */
    static List<HttpHandler> createRequestHandlers(Configuration configuration, ImageDao imageDao) {
        final ImageIngester ingester = new ImageIngester(configuration);
        return ImmutableList.of(
                new RequestHandlerForStatus(),
                new RequestHandlerForDepthRange(configuration, imageDao),
                new RequestHandlerForUpload(configuration, imageDao, ingester));
    }

    /**
     * Reads configuration from Java system properties, which may be loaded from configuration files named in arguments,
     * then starts a verticle that loads the startup image into the database and listens on HTTP for queries.
     * @param argv filename(s) from which to read configuration beyond current Java system properties
     * @throws IOException if the configuration could not be loaded
     * @throws ImageServiceException if the configuration is incomplete or invalid
     */
    public static void main(String[] argv) throws IOException, ImageServiceException {
        run(argv, new Properties());
    }

    /**
     * Run the microservice.
     * @param argv filename(s) from which to read configuration beyond current Java system properties
     * @param overrides configuration properties that override those from the system and files
     * @throws IOException if the configuration could not be loaded
     * @throws ImageServiceException if the configuration is incomplete or invalid
     */
    static void run(String[] argv, Properties overrides) throws IOException, ImageServiceException {
        /* set system properties from named configuration files */
        final Properties propertiesSystem = System.getProperties();
        for (final String filename : argv) {
            final Properties propertiesNew = new Properties();
            try (final InputStream filestream = new FileInputStream(filename)) {
                propertiesNew.load(filestream);
            }
            propertiesSystem.putAll(propertiesNew);
        }
        propertiesSystem.putAll(overrides);
        /* determine microservice configuration from system properties */
        final Configuration configuration = new Configuration(Configuration.fromProperties(propertiesSystem));
        final ImageDao imageDao = new ImageDao(createDataSource(configuration));
        final StartupImageLoader startupLoader = new StartupImageLoader(configuration, imageDao,
                new CsvImageSource(Paths.get(configuration.getImageSource())), new ImageIngester(configuration));
        /* deploy the verticle which uses the database */
        final Vertx vertx = Vertx.vertx();
        final Verticle verticle = new DepthImageVerticle(configuration, startupLoader,
                createRequestHandlers(configuration, imageDao));
        vertx.deployVerticle(verticle, (AsyncResult<String> result) -> {
            if (result.failed()) {
                LOGGER.error("failed to deploy microservice", result.cause());
                vertx.close();
            }
        });
    }
}
