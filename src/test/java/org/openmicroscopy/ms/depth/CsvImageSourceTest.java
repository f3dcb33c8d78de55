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
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Check that images are read from comma-separated files as expected.
 * @author The Open Microscopy Environment
 */
public class CsvImageSourceTest {

    @TempDir
    Path directory;

    /**
     * @param content the content of a CSV file
     * @return a source reading a file of that content
     * @throws IOException unexpected
     */
    private CsvImageSource sourceOf(String content) throws IOException {
        final Path file = directory.resolve("image.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return new CsvImageSource(file);
    }

    /**
     * Check that the sample file is read with the lines that have missing values skipped.
     * @throws ImageServiceException unexpected
     * @throws URISyntaxException unexpected
     */
    @Test
    public void testSampleFile() throws ImageServiceException, URISyntaxException {
        final Path file = Paths.get(getClass().getResource("/img-sample.csv").toURI());
        final TabularImage image = new CsvImageSource(file).read();
        Assertions.assertArrayEquals(new double[] {9000.1, 9000.2, 9000.4}, image.getDepths());
        Assertions.assertEquals(3, image.getPixelRows().size());
        Assertions.assertArrayEquals(new int[] {10, 20, 30, 40}, image.getPixelRows().get(0));
        Assertions.assertArrayEquals(new int[] {130, 140, 150, 160}, image.getPixelRows().get(2));
    }

    /**
     * Check that the depth column need not be the first.
     * @throws ImageServiceException unexpected
     * @throws IOException unexpected
     */
    @Test
    public void testDepthColumnPosition() throws ImageServiceException, IOException {
        final TabularImage image = sourceOf("0, 1, depth, 2\n1, 2, 0.5, 3\n4, 5, 0.75, 6\n").read();
        Assertions.assertArrayEquals(new double[] {0.5, 0.75}, image.getDepths());
        Assertions.assertArrayEquals(new int[] {4, 5, 6}, image.getPixelRows().get(1));
    }

    /**
     * Check that malformed files are rejected.
     * @param content the content of a malformed file
     * @throws IOException unexpected
     */
    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "0,1,2\n1,2,3\n",
            "depth,0,1\n1.0,2\n",
            "depth,0,1\n1.0,2,three\n",
            "depth,0,1\n1.0,2,300\n",
            "depth,0,1\n1.0,2,2.5\n"})
    public void testMalformedFile(String content) throws IOException {
        final CsvImageSource source = sourceOf(content);
        final ImageServiceException exception = Assertions.assertThrows(ImageServiceException.class, source::read);
        Assertions.assertEquals(ImageServiceException.Kind.CONVERSION, exception.getKind());
    }

    /**
     * Check that a missing file is reported.
     */
    @Test
    public void testMissingFile() {
        final CsvImageSource source = new CsvImageSource(directory.resolve("absent.csv"));
        final ImageServiceException exception = Assertions.assertThrows(ImageServiceException.class, source::read);
        Assertions.assertEquals(ImageServiceException.Kind.CONVERSION, exception.getKind());
        Assertions.assertTrue(exception.getMessage().contains("absent.csv"));
    }
}
