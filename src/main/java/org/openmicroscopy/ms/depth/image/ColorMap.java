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

/**
 * A lookup table from intensity to a color in blue, green, red order.
 * @author The Open Microscopy Environment
 */
public class ColorMap {

    private final String name;
    private final byte[] table;

    /**
     * @param name the name of this color map
     * @param table the colors for intensities {@code 0} to {@code 255}, three samples for each
     */
    ColorMap(String name, byte[] table) {
        if (table.length != 256 * 3) {
            throw new IllegalArgumentException("color map table must have 256 entries");
        }
        this.name = name;
        this.table = table;
    }

    public String getName() {
        return name;
    }

    /**
     * @param intensity an intensity from {@code 0} to {@code 255}
     * @return the blue, green and red samples for that intensity
     */
    public int[] lookup(int intensity) {
        final int offset = intensity * 3;
        return new int[] {table[offset] & 0xFF, table[offset + 1] & 0xFF, table[offset + 2] & 0xFF};
    }

    /**
     * Colorize an image. A color image is first converted to luminance.
     * @param matrix a pixel matrix
     * @return a three-channel matrix of the same height and width
     * @throws ImageServiceException if the image could not be converted to luminance
     */
    public PixelMatrix apply(PixelMatrix matrix) throws ImageServiceException {
        final byte[] intensities = PixelConverter.toGrayscale(matrix).getData();
        final byte[] colors = new byte[intensities.length * 3];
        int index = 0;
        for (final byte intensity : intensities) {
            final int offset = (intensity & 0xFF) * 3;
            colors[index++] = table[offset];
            colors[index++] = table[offset + 1];
            colors[index++] = table[offset + 2];
        }
        return new PixelMatrix(matrix.getHeight(), matrix.getWidth(), 3, colors);
    }

    @Override
    public String toString() {
        return name;
    }
}
