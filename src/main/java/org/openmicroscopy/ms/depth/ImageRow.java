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

/**
 * One stored row of an image: its flattened pixels tagged with the image name and a depth.
 * @author The Open Microscopy Environment
 */
public class ImageRow {

    private final String imageName;
    private final int rowIndex;
    private final double depth;
    private final int channels;
    private final int[] pixels;

    /**
     * @param imageName the name of the image to which the row belongs
     * @param rowIndex the position of the row in its image
     * @param depth the depth at which the row was sampled
     * @param channels the number of channels interleaved in the pixels
     * @param pixels the samples of the row
     */
    public ImageRow(String imageName, int rowIndex, double depth, int channels, int[] pixels) {
        this.imageName = imageName;
        this.rowIndex = rowIndex;
        this.depth = depth;
        this.channels = channels;
        this.pixels = pixels;
    }

    public String getImageName() {
        return imageName;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public double getDepth() {
        return depth;
    }

    public int getChannels() {
        return channels;
    }

    public int[] getPixels() {
        return pixels;
    }

    @Override
    public String toString() {
        return "ImageRow{" + imageName + ":" + rowIndex + " depth=" + depth + " samples=" + pixels.length + "}";
    }
}
