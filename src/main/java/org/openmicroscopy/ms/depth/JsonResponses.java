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

import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the JSON responses of the HTTP endpoints.
 * @author The Open Microscopy Environment
 */
final class JsonResponses {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonResponses.class);

    static final String MEDIA_TYPE_JSON = "application/json; charset=utf-8";

    /* The HTTP status code with which each kind of failure is reported. */
    static final Map<ImageServiceException.Kind, Integer> STATUS_CODES =
            ImmutableMap.<ImageServiceException.Kind, Integer>builder()
            .put(ImageServiceException.Kind.CONNECTION, 500)
            .put(ImageServiceException.Kind.CONFIGURATION, 500)
            .put(ImageServiceException.Kind.SCHEMA, 500)
            .put(ImageServiceException.Kind.WRITE, 500)
            .put(ImageServiceException.Kind.QUERY, 400)
            .put(ImageServiceException.Kind.UNKNOWN_COLOR_MAP, 400)
            .put(ImageServiceException.Kind.CONVERSION, 400)
            .put(ImageServiceException.Kind.SERVICE, 500)
            .build();

    private JsonResponses() {
    }

    /**
     * @param kind a kind of failure
     * @return the HTTP status code for reporting that kind of failure
     */
    static int getStatusCode(ImageServiceException.Kind kind) {
        return STATUS_CODES.getOrDefault(kind, 500);
    }

    /**
     * Set the given JSON data as the given HTTP response.
     * @param response a HTTP response
     * @param code the HTTP response code
     * @param data some JSON data
     */
    static void respondWithJson(HttpServerResponse response, int code, JsonObject data) {
        final String responseText = data.encode();
        final int responseSize = responseText.getBytes(StandardCharsets.UTF_8).length;
        LOGGER.debug("constructed JSON response of size {}", responseSize);
        response.setStatusCode(code);
        response.putHeader("Content-Type", MEDIA_TYPE_JSON);
        response.putHeader("Content-Length", Integer.toString(responseSize));
        response.end(responseText);
    }

    /**
     * Construct a HTTP failure response.
     * @param response the HTTP response that is to bear the failure
     * @param code the HTTP response code
     * @param message a message that describes the failure
     */
    static void fail(HttpServerResponse response, int code, String message) {
        LOGGER.debug("responding with code {} failure: {}", code, message);
        respondWithJson(response, code, new JsonObject().put("message", message));
    }

    /**
     * Construct a HTTP failure response for the given exception.
     * @param response the HTTP response that is to bear the failure
     * @param exception the failure
     */
    static void fail(HttpServerResponse response, ImageServiceException exception) {
        fail(response, getStatusCode(exception.getKind()), exception.getMessage());
    }
}
