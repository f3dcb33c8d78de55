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

import org.openmicroscopy.ms.depth.image.ColorMaps;
import org.openmicroscopy.ms.depth.image.PixelMatrix;
import org.openmicroscopy.ms.depth.stub.H2DataSources;

import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import org.mockito.Mockito;

/**
 * Check that the configured image is loaded into the database at startup.
 * @author The Open Microscopy Environment
 */
public class StartupImageLoaderTest {

    /**
     * @param isEnabled if loading at startup is enabled
     * @return a configuration for loading into the {@code startup} table
     * @throws ImageServiceException unexpected
     */
    private static Configuration getConfiguration(boolean isEnabled) throws ImageServiceException {
        final Map<String, String> settings = new HashMap<>(ConfigurationTest.getDatabaseSettings());
        settings.put(Configuration.CONF_TABLE_NAME, "startup");
        settings.put(Configuration.CONF_IMAGE_WIDTH, "2");
        settings.put(Configuration.CONF_STARTUP_LOAD, Boolean.toString(isEnabled));
        return new Configuration(settings);
    }

    /**
     * Check that the sample file is resized and stored with its depths resampled.
     * @throws ImageServiceException unexpected
     * @throws URISyntaxException unexpected
     */
    @Test
    public void testLoad() throws ImageServiceException, URISyntaxException {
        final Configuration configuration = getConfiguration(true);
        final ImageDao dao = new ImageDao(H2DataSources.create());
        final CsvImageSource source = new CsvImageSource(Paths.get(getClass().getResource("/img-sample.csv").toURI()));
        new StartupImageLoader(configuration, dao, source, new ImageIngester(configuration)).load();
        /* three rows of four become two rows of two */
        final PixelMatrix all = dao.queryImage("startup", 9000, 9001, ColorMaps.DEFAULT_NAME, "test_image");
        Assertions.assertEquals(2, all.getHeight());
        Assertions.assertEquals(2, all.getWidth());
        /* the first resized row covers the first row and half the second so is at depth 9000.1333… */
        final PixelMatrix first = dao.queryImage("startup", 9000.13, 9000.14, ColorMaps.DEFAULT_NAME, "test_image");
        Assertions.assertEquals(1, first.getHeight());
    }

    /**
     * Check that nothing is loaded when loading at startup is disabled.
     * @throws ImageServiceException unexpected
     */
    @Test
    public void testLoadDisabled() throws ImageServiceException {
        final CsvImageSource source = Mockito.mock(CsvImageSource.class);
        final ImageDao dao = Mockito.mock(ImageDao.class);
        new StartupImageLoader(getConfiguration(false), dao, source, new ImageIngester(2)).load();
        Mockito.verifyNoInteractions(source, dao);
    }

    /**
     * Check that a failure to read the image is reported.
     * @throws ImageServiceException unexpected
     */
    @Test
    public void testLoadFailure() throws ImageServiceException {
        final CsvImageSource source = Mockito.mock(CsvImageSource.class);
        Mockito.when(source.read()).thenThrow(
                new ImageServiceException(ImageServiceException.Kind.CONVERSION, "image file does not exist"));
        final ImageDao dao = Mockito.mock(ImageDao.class);
        final StartupImageLoader loader = new StartupImageLoader(getConfiguration(true), dao, source, new ImageIngester(2));
        final ImageServiceException exception = Assertions.assertThrows(ImageServiceException.class, loader::load);
        Assertions.assertEquals(ImageServiceException.Kind.CONVERSION, exception.getKind());
        Mockito.verifyNoInteractions(dao);
    }
}
