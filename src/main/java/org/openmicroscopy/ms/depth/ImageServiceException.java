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
 * A failure of this microservice, classified by the kind of operation that failed.
 * @author The Open Microscopy Environment
 */
public class ImageServiceException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The kinds of failure that may be reported.
     * @author The Open Microscopy Environment
     */
    public enum Kind {
        /** A database connection could not be obtained. */
        CONNECTION,
        /** Required configuration was absent or malformed. */
        CONFIGURATION,
        /** A table could not be created. */
        SCHEMA,
        /** Rows could not be written. */
        WRITE,
        /** A query failed or matched no rows. */
        QUERY,
        /** A color map name did not resolve. */
        UNKNOWN_COLOR_MAP,
        /** Pixel data was malformed. */
        CONVERSION,
        /** Any other failure. */
        SERVICE
    }

    private final Kind kind;

    /**
     * Construct a new exception.
     * @param kind the kind of failure
     * @param message a description of the failure
     */
    public ImageServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Construct a new exception.
     * @param kind the kind of failure
     * @param message a description of the failure
     * @param cause the cause of the failure
     */
    public ImageServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return the kind of failure
     */
    public Kind getKind() {
        return kind;
    }
}
