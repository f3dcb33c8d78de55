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

import java.util.Arrays;

/**
 * An image of 8-bit samples, either grayscale or with three channels per pixel.
 * Samples are held row by row, the channels of each pixel adjacent.
 * @author The Open Microscopy Environment
 */
public class PixelMatrix {

    private final int height, width, channels;
    private final byte[] data;

    /**
     * Construct a new pixel matrix over the given samples, which are not copied.
     * @param height the number of rows
     * @param width the number of columns
     * @param channels the number of channels, {@code 1} or {@code 3}
     * @param data the samples, of length {@code height × width × channels}
     * @throws ImageServiceException if the shape is not that of a grayscale or three-channel image
     */
    public PixelMatrix(int height, int width, int channels, byte[] data) throws ImageServiceException {
        if (channels != 1 && channels != 3) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                    "invalid shape: images must have one or three channels, not " + channels);
        }
        if (height < 0 || width < 0 || (long) height * width * channels != data.length) {
            throw new ImageServiceException(ImageServiceException.Kind.CONVERSION,
                    "invalid shape: " + height + "×" + width + "×" + channels + " does not fit " + data.length + " samples");
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.data = data;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getChannels() {
        return channels;
    }

    public boolean isColor() {
        return channels == 3;
    }

    /**
     * @param row a row index
     * @param column a column index
     * @param channel a channel index
     * @return the sample at that position, from {@code 0} to {@code 255}
     */
    public int get(int row, int column, int channel) {
        return data[(row * width + column) * channels + channel] & 0xFF;
    }

    /**
     * @return the samples of this matrix, not a copy
     */
    public byte[] getData() {
        return data;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof PixelMatrix)) {
            return false;
        }
        final PixelMatrix other = (PixelMatrix) object;
        return height == other.height && width == other.width && channels == other.channels &&
                Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return ((height * 31 + width) * 31 + channels) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PixelMatrix " + height + "×" + width + "×" + channels;
    }
}
