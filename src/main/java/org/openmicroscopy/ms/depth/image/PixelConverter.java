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

package org.openmicroscopy.ms.depth.image;

import org.openmicroscopy.ms.depth.ImageServiceException;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between pixel matrices and the flat rows in which they are tabulated.
 * A row of a three-channel matrix is tabulated as the channel values of each column in turn.
 * @author The Open Microscopy Environment
 */
public final class PixelConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PixelConverter.class);

    private PixelConverter() {
    }

    /**
     * Convert a raw numeric value into a pixel sample.
     * @param value a value read from tabular data
     * @return the value as a sample
     * @throws ImageServiceException if the value is not finite, not integral or not from {@code 0} to {@code 255}
     */
    public static int toPixelValue(double value) throws ImageServiceException {
        if (!Double.isFinite(value)) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "non-finite pixel value: " + value);
        }
        if (value != Math.rint(value)) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "non-integral pixel value: " + value);
        }
        if (value < 0 || value > 255) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "pixel value out of range: " + value);
        }
        return (int) value;
    }

    /**
     * Flatten each row of a matrix.
     * @param matrix a pixel matrix
     * @return one array of length {@code width × channels} for each row of the matrix
     */
    public static List<int[]> matrixToRows(PixelMatrix matrix) {
        final int rowLength = matrix.getWidth() * matrix.getChannels();
        final byte[] data = matrix.getData();
        final ImmutableList.Builder<int[]> rows = ImmutableList.builder();
        for (int y = 0; y < matrix.getHeight(); y++) {
            final int[] row = new int[rowLength];
            final int offset = y * rowLength;
            for (int x = 0; x < rowLength; x++) {
                row[x] = data[offset + x] & 0xFF;
            }
            rows.add(row);
        }
        return rows.build();
    }

    /**
     * Assemble a matrix from flattened rows.
     * @param rows the rows of the image, each of the same length
     * @param isColor if the rows interleave three channels rather than holding one
     * @return the assembled matrix
     * @throws ImageServiceException if there are no rows, the rows differ in length or a value is not a sample
     */
    public static PixelMatrix rowsToMatrix(List<int[]> rows, boolean isColor) throws ImageServiceException {
        if (rows.isEmpty()) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "no rows from which to assemble an image");
        }
        final int channels = isColor ? 3 : 1;
        final int rowLength = rows.get(0).length;
        if (rowLength % channels != 0) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                    "dimension mismatch: row length " + rowLength + " is not a multiple of " + channels + " channels");
        }
        final byte[] data = new byte[rows.size() * rowLength];
        int index = 0;
        for (final int[] row : rows) {
            if (row.length != rowLength) {
                throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                        "dimension mismatch: rows of length " + rowLength + " and " + row.length);
            }
            for (final int value : row) {
                if (value < 0 || value > 255) {
                    throw new ImageServiceException(ImageServiceException.Kind.CONVERSION, "pixel value out of range: " + value);
                }
                data[index++] = (byte) value;
            }
        }
        return new PixelMatrix(rows.size(), rowLength / channels, channels, data);
    }

    /**
     * Resize a matrix to the given width, scaling the height to preserve the aspect ratio.
     * Uses area interpolation so down-sampling by an integral factor averages each block of pixels.
     * @param matrix a pixel matrix
     * @param newWidth the width of the resized matrix
     * @return the resized matrix, or the given matrix if it is already of the new size
     * @throws ImageServiceException if either width is not positive
     */
    public static PixelMatrix resizeWidth(PixelMatrix matrix, int newWidth) throws ImageServiceException {
        final int width = matrix.getWidth();
        final int height = matrix.getHeight();
        if (newWidth <= 0 || width <= 0) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                    "invalid dimensions: cannot resize from width " + width + " to width " + newWidth);
        }
        final int newHeight = (int) Math.max(1, Math.round((double) newWidth * height / width));
        if (newWidth == width && newHeight == height) {
            return matrix;
        }
        LOGGER.debug("resizing {}×{} to {}×{}", height, width, newHeight, newWidth);
        final Mat source = OpenCvLibrary.toMat(matrix);
        final Mat resized = new Mat();
        try {
            Imgproc.resize(source, resized, new Size(newWidth, newHeight), 0, 0, Imgproc.INTER_AREA);
            return OpenCvLibrary.fromMat(resized);
        } finally {
            source.release();
            resized.release();
        }
    }

    /**
     * Convert a color matrix to luminance. Color samples are taken to be in red, green, blue order.
     * @param matrix a pixel matrix
     * @return a single-channel matrix, or the given matrix if it is already single-channel
     * @throws ImageServiceException unexpected
     */
    public static PixelMatrix toGrayscale(PixelMatrix matrix) throws ImageServiceException {
        if (!matrix.isColor()) {
            return matrix;
        }
        final Mat source = OpenCvLibrary.toMat(matrix);
        final Mat gray = new Mat();
        try {
            Imgproc.cvtColor(source, gray, Imgproc.COLOR_RGB2GRAY);
            return OpenCvLibrary.fromMat(gray);
        } finally {
            source.release();
            gray.release();
        }
    }
}
