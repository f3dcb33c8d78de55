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

import org.openmicroscopy.ms.depth.image.PixelConverter;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an image from a comma-separated file with a header line.
 * One column holds the depth of each row, the others hold its samples.
 * Lines with a missing value are skipped.
 * @author The Open Microscopy Environment
 */
public class CsvImageSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvImageSource.class);

    private static final Splitter CELLS = Splitter.on(',').trimResults();

    private final Path path;

    /**
     * @param path the file from which to read
     */
    public CsvImageSource(Path path) {
        this.path = path;
    }

    /**
     * @param cell the text of a cell
     * @return if the cell holds no value
     */
    private static boolean isMissing(String cell) {
        return cell.isEmpty() || "nan".equalsIgnoreCase(cell) || "na".equalsIgnoreCase(cell);
    }

    /**
     * Read the image from the file.
     * @return the rows of the image with their depths
     * @throws ImageServiceException if the file could not be read or its content is not an image
     */
    public TabularImage read() throws ImageServiceException {
        LOGGER.info("reading image from {}", path);
        final List<String> header;
        final List<int[]> pixelRows = new ArrayList<>();
        final List<Double> depths = new ArrayList<>();
        int skipped = 0;
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "image file is empty: " + path);
            }
            header = CELLS.splitToList(headerLine);
            final int depthColumn = header.indexOf(TableSchema.COLUMN_DEPTH);
            if (depthColumn < 0) {
                throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                        "image file lacks a " + TableSchema.COLUMN_DEPTH + " column: " + path);
            }
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                final List<String> cells = CELLS.splitToList(line);
                if (cells.size() != header.size()) {
                    throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                            "line " + lineNumber + " has " + cells.size() + " values for " + header.size() + " columns");
                }
                if (cells.stream().anyMatch(CsvImageSource::isMissing)) {
                    skipped++;
                    continue;
                }
                final int[] pixels = new int[cells.size() - 1];
                int index = 0;
                for (int column = 0; column < cells.size(); column++) {
                    final Double value = Doubles.tryParse(cells.get(column));
                    if (value == null) {
                        throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                                "line " + lineNumber + " has non-numeric value " + cells.get(column));
                    }
                    if (column == depthColumn) {
                        depths.add(value);
                    } else {
                        pixels[index++] = PixelConverter.toPixelValue(value);
                    }
                }
                pixelRows.add(pixels);
            }
        } catch (NoSuchFileException nsfe) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "image file does not exist: " + path, nsfe);
        } catch (IOException ioe) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "failed to read image file: " + path, ioe);
        }
        if (skipped > 0) {
            LOGGER.info("skipped {} lines with missing values", skipped);
        }
        LOGGER.debug("read {} rows of {} columns", pixelRows.size(), header.size());
        return new TabularImage(pixelRows, depths.stream().mapToDouble(Double::doubleValue).toArray());
    }
}
