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

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableMap;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The named color maps that OpenCV provides, looked up case-insensitively.
 * @author The Open Microscopy Environment
 */
public final class ColorMaps {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColorMaps.class);

    public static final String DEFAULT_NAME = "COLORMAP_JET";

    private static final Map<String, Integer> CODES = ImmutableMap.<String, Integer>builder()
            .put("COLORMAP_AUTUMN", Imgproc.COLORMAP_AUTUMN)
            .put("COLORMAP_BONE", Imgproc.COLORMAP_BONE)
            .put("COLORMAP_JET", Imgproc.COLORMAP_JET)
            .put("COLORMAP_WINTER", Imgproc.COLORMAP_WINTER)
            .put("COLORMAP_RAINBOW", Imgproc.COLORMAP_RAINBOW)
            .put("COLORMAP_OCEAN", Imgproc.COLORMAP_OCEAN)
            .put("COLORMAP_SUMMER", Imgproc.COLORMAP_SUMMER)
            .put("COLORMAP_SPRING", Imgproc.COLORMAP_SPRING)
            .put("COLORMAP_COOL", Imgproc.COLORMAP_COOL)
            .put("COLORMAP_HSV", Imgproc.COLORMAP_HSV)
            .put("COLORMAP_PINK", Imgproc.COLORMAP_PINK)
            .put("COLORMAP_HOT", Imgproc.COLORMAP_HOT)
            .put("COLORMAP_PARULA", Imgproc.COLORMAP_PARULA)
            .put("COLORMAP_MAGMA", Imgproc.COLORMAP_MAGMA)
            .put("COLORMAP_INFERNO", Imgproc.COLORMAP_INFERNO)
            .put("COLORMAP_PLASMA", Imgproc.COLORMAP_PLASMA)
            .put("COLORMAP_VIRIDIS", Imgproc.COLORMAP_VIRIDIS)
            .put("COLORMAP_CIVIDIS", Imgproc.COLORMAP_CIVIDIS)
            .put("COLORMAP_TWILIGHT", Imgproc.COLORMAP_TWILIGHT)
            .put("COLORMAP_TWILIGHT_SHIFTED", Imgproc.COLORMAP_TWILIGHT_SHIFTED)
            .put("COLORMAP_TURBO", Imgproc.COLORMAP_TURBO)
            .put("COLORMAP_DEEPGREEN", Imgproc.COLORMAP_DEEPGREEN)
            .build();

    /* Tables are built on first use. */
    private static final LoadingCache<String, ColorMap> TABLES = CacheBuilder.newBuilder()
            .build(new CacheLoader<String, ColorMap>() {
                @Override
                public ColorMap load(String name) {
                    return buildColorMap(name, CODES.get(name));
                }
            });

    private ColorMaps() {
    }

    /**
     * @return the names of the available color maps
     */
    public static Set<String> getNames() {
        return CODES.keySet();
    }

    /**
     * Look up a color map by name.
     * @param name the name of a color map, case-insensitive
     * @return the color map
     * @throws ImageServiceException if no color map has that name
     */
    public static ColorMap forName(String name) throws ImageServiceException {
        final String key = name == null ? null : name.toUpperCase(Locale.ROOT);
        if (key == null || !CODES.containsKey(key)) {
            throw new ImageServiceException(ImageServiceException.Kind.UNKNOWN_COLOR_MAP, "unknown color map: " + name);
        }
        return TABLES.getUnchecked(key);
    }

    /**
     * Tabulate an OpenCV color map by applying it to every intensity.
     * @param name the name of the color map
     * @param code the OpenCV color map code
     * @return the color map
     */
    private static ColorMap buildColorMap(String name, int code) {
        OpenCvLibrary.load();
        final byte[] ramp = new byte[256];
        for (int intensity = 0; intensity < ramp.length; intensity++) {
            ramp[intensity] = (byte) intensity;
        }
        final Mat source = new Mat(1, ramp.length, CvType.CV_8UC1);
        final Mat colored = new Mat();
        try {
            source.put(0, 0, ramp);
            Imgproc.applyColorMap(source, colored, code);
            final byte[] table = new byte[ramp.length * 3];
            colored.get(0, 0, table);
            LOGGER.debug("tabulated color map {}", name);
            return new ColorMap(name, table);
        } finally {
            source.release();
            colored.release();
        }
    }
}
