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

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

/**
 * Loads the OpenCV native library and moves samples between {@link PixelMatrix} and {@link Mat}.
 * @author The Open Microscopy Environment
 */
final class OpenCvLibrary {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenCvLibrary.class);

    private static boolean isLoaded = false;

    private OpenCvLibrary() {
    }

    /**
     * Load the native library if not already loaded.
     */
    static synchronized void load() {
        if (!isLoaded) {
            OpenCV.loadLocally();
            isLoaded = true;
            LOGGER.info("loaded OpenCV {}", Core.VERSION);
        }
    }

    /**
     * @param matrix a pixel matrix
     * @return a new 8-bit OpenCV matrix holding a copy of the samples
     */
    static Mat toMat(PixelMatrix matrix) {
        load();
        final Mat mat = new Mat(matrix.getHeight(), matrix.getWidth(), matrix.isColor() ? CvType.CV_8UC3 : CvType.CV_8UC1);
        mat.put(0, 0, matrix.getData());
        return mat;
    }

    /**
     * @param mat an 8-bit OpenCV matrix with one or three channels
     * @return a new pixel matrix holding a copy of the samples
     * @throws ImageServiceException if the matrix has an unsupported shape
     */
    static PixelMatrix fromMat(Mat mat) throws ImageServiceException {
        final byte[] data = new byte[(int) mat.total() * mat.channels()];
        mat.get(0, 0, data);
        return new PixelMatrix(mat.rows(), mat.cols(), mat.channels(), data);
    }
}
