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

import com.google.common.collect.ImmutableList;

/**
 * Image rows as read from tabular input, each with the depth at which it was sampled.
 * @author The Open Microscopy Environment
 */
public class TabularImage {

    private final List<int[]> pixelRows;
    private final double[] depths;

    /**
     * @param pixelRows the samples of each row
     * @param depths the depth of each row
     */
    public TabularImage(List<int[]> pixelRows, double[] depths) {
        if (pixelRows.size() != depths.length) {
            throw new IllegalArgumentException("must have one depth for each row");
        }
        this.pixelRows = ImmutableList.copyOf(pixelRows);
        this.depths = depths;
    }

    public List<int[]> getPixelRows() {
        return pixelRows;
    }

    public double[] getDepths() {
        return depths;
    }
}
