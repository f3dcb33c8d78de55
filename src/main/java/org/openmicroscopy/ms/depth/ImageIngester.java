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
import org.openmicroscopy.ms.depth.image.PixelMatrix;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares tabular images for storage: assembles the image, resizes it to the configured width
 * then tabulates it again with depths and the image name.
 * @author The Open Microscopy Environment
 */
public class ImageIngester {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageIngester.class);

    private final int width;

    /**
     * @param configuration the configuration of this microservice
     */
    public ImageIngester(Configuration configuration) {
        this(configuration.getImageWidth());
    }

    /**
     * @param width the width to which images are resized
     */
    public ImageIngester(int width) {
        this.width = width;
    }

    /**
     * Resize an image, resampling its depths in the same way as its rows.
     * @param image the image rows with their depths
     * @param isColor if the rows interleave three channels
     * @param imageName the name of the image
     * @return the resized rows ready for storage
     * @throws ImageServiceException if the rows do not form an image
     */
    public List<ImageRow> ingest(TabularImage image, boolean isColor, String imageName) throws ImageServiceException {
        final PixelMatrix resized = resize(image, isColor);
        final double[] depths = resampleDepths(image.getDepths(), resized.getHeight());
        return toImageRows(resized, depths, imageName);
    }

    /**
     * Resize an image, assigning the same depth to every row.
     * @param image the image rows, their depths are ignored
     * @param isColor if the rows interleave three channels
     * @param imageName the name of the image
     * @param depth the depth of every row
     * @return the resized rows ready for storage
     * @throws ImageServiceException if the rows do not form an image
     */
    public List<ImageRow> ingestAtDepth(TabularImage image, boolean isColor, String imageName, double depth)
            throws ImageServiceException {
        final PixelMatrix resized = resize(image, isColor);
        final double[] depths = new double[resized.getHeight()];
        Arrays.fill(depths, depth);
        return toImageRows(resized, depths, imageName);
    }

    /**
     * @param image the image rows
     * @param isColor if the rows interleave three channels
     * @return the assembled image shrunk to the configured width, images no wider are not enlarged
     * @throws ImageServiceException if the rows do not form an image
     */
    private PixelMatrix resize(TabularImage image, boolean isColor) throws ImageServiceException {
        final PixelMatrix matrix = PixelConverter.rowsToMatrix(image.getPixelRows(), isColor);
        if (matrix.getWidth() <= width) {
            LOGGER.debug("kept {} at its own size", matrix);
            return matrix;
        }
        final PixelMatrix resized = PixelConverter.resizeWidth(matrix, width);
        LOGGER.debug("resized {} to {}", matrix, resized);
        return resized;
    }

    /**
     * Resample depths to a new number of rows. Each new depth is the mean of the old depths that the new row covers,
     * weighted by the extent of the coverage.
     * @param depths the depths of the original rows
     * @param newHeight the new number of rows
     * @return the depths of the new rows
     */
    static double[] resampleDepths(double[] depths, int newHeight) {
        final int height = depths.length;
        if (height == newHeight) {
            return depths.clone();
        }
        final double scale = (double) height / newHeight;
        final double[] resampled = new double[newHeight];
        for (int row = 0; row < newHeight; row++) {
            final double start = row * scale;
            final double end = Math.min(height, start + scale);
            double sum = 0;
            double weight = 0;
            for (int source = (int) Math.floor(start); source < end && source < height; source++) {
                final double overlap = Math.min(end, source + 1) - Math.max(start, source);
                if (overlap > 0) {
                    sum += depths[source] * overlap;
                    weight += overlap;
                }
            }
            resampled[row] = weight > 0 ? sum / weight : depths[Math.min(height - 1, (int) start)];
        }
        return resampled;
    }

    /**
     * @param matrix an image
     * @param depths the depth of each row of the image
     * @param imageName the name of the image
     * @return the rows of the image ready for storage
     */
    static List<ImageRow> toImageRows(PixelMatrix matrix, double[] depths, String imageName) {
        final List<int[]> pixelRows = PixelConverter.matrixToRows(matrix);
        final ImmutableList.Builder<ImageRow> rows = ImmutableList.builder();
        for (int index = 0; index < pixelRows.size(); index++) {
            rows.add(new ImageRow(imageName, index, depths[index], matrix.getChannels(), pixelRows.get(index)));
        }
        return rows.build();
    }
}
