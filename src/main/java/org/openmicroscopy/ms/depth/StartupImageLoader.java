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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the configured image file into the database when the microservice starts.
 * @author The Open Microscopy Environment
 */
public class StartupImageLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(StartupImageLoader.class);

    private final boolean isEnabled;
    private final String tableName;
    private final String imageName;
    private final ImageDao imageDao;
    private final CsvImageSource source;
    private final ImageIngester ingester;

    /**
     * @param configuration the configuration of this microservice
     * @param imageDao the data access object for the image tables
     * @param source the file from which to read the image
     * @param ingester prepares the image for storage
     */
    public StartupImageLoader(Configuration configuration, ImageDao imageDao, CsvImageSource source, ImageIngester ingester) {
        this.isEnabled = configuration.isStartupLoadEnabled();
        this.tableName = configuration.getTableName();
        this.imageName = configuration.getImageName();
        this.imageDao = imageDao;
        this.source = source;
        this.ingester = ingester;
    }

    /**
     * Read, resize and store the image, replacing the content of the table.
     * Does nothing if loading at startup is disabled.
     * @throws ImageServiceException if the image could not be read or stored
     */
    public void load() throws ImageServiceException {
        if (!isEnabled) {
            LOGGER.info("image loading at startup is disabled");
            return;
        }
        final TabularImage image = source.read();
        final List<ImageRow> rows = ingester.ingest(image, false, imageName);
        imageDao.replaceInsert(tableName, rows);
        LOGGER.info("loaded image {} into table {}", imageName, tableName);
    }
}
