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

import org.openmicroscopy.ms.depth.image.ColorMaps;
import org.openmicroscopy.ms.depth.image.PixelMatrix;

import com.google.common.io.BaseEncoding;

import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provide colorized image rows from a depth range via HTTP endpoint.
 * Parameters are taken from the JSON request body or, if there is no body, from the query.
 * @author The Open Microscopy Environment
 */
public class RequestHandlerForDepthRange implements HttpHandler, Handler<RoutingContext> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestHandlerForDepthRange.class);

    public static final String PATH = "/image-depth-range";

    public static final String PARAM_DEPTH_MIN = "depth_min";
    public static final String PARAM_DEPTH_MAX = "depth_max";
    public static final String PARAM_COLORMAP = "colormap";
    public static final String PARAM_IMAGE_NAME = "image_name";

    private final String tableName;
    private final String defaultImageName;
    private final ImageDao imageDao;

    /**
     * Create the HTTP request handler.
     * @param configuration the configuration of this microservice
     * @param imageDao the data access object for the image tables
     */
    public RequestHandlerForDepthRange(Configuration configuration, ImageDao imageDao) {
        this.tableName = configuration.getTableName();
        this.defaultImageName = configuration.getImageName();
        this.imageDao = imageDao;
    }

    @Override
    public void handleFor(Router router) {
        LOGGER.info("handling GET requests for {}", PATH);
        router.get(PATH).handler(BodyHandler.create()).blockingHandler(this);
    }

    /**
     * A request parameter that is absent or of the wrong type.
     * @author The Open Microscopy Environment
     */
    private static class BadParameterException extends Exception {

        private static final long serialVersionUID = 1L;

        BadParameterException(String message) {
            super(message);
        }
    }

    /**
     * The parameters of a depth range request, from either the body or the query.
     * @author The Open Microscopy Environment
     */
    private static class Parameters {

        private final JsonObject body;
        private final HttpServerRequest request;

        Parameters(JsonObject body, HttpServerRequest request) {
            this.body = body;
            this.request = request;
        }

        /**
         * @param name the name of a numeric parameter
         * @return the value of that parameter
         * @throws BadParameterException if the parameter is absent or not a number
         */
        double getNumber(String name) throws BadParameterException {
            if (body != null) {
                final Object value = body.getValue(name);
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                throw new BadParameterException("must provide " + name + " as a number");
            }
            final String value = request.getParam(name);
            if (value == null) {
                throw new BadParameterException("must provide " + name + " as a number");
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException nfe) {
                throw new BadParameterException("must provide " + name + " as a number, not " + value);
            }
        }

        /**
         * @param name the name of a text parameter
         * @param defaultValue the value to use if the parameter is absent
         * @return the value of that parameter
         * @throws BadParameterException if the parameter is not text
         */
        String getText(String name, String defaultValue) throws BadParameterException {
            final Object value = body == null ? request.getParam(name) : body.getValue(name);
            if (value == null) {
                return defaultValue;
            }
            if (value instanceof String) {
                return (String) value;
            }
            throw new BadParameterException(name + " must be text");
        }
    }

    /**
     * Handle incoming requests for image rows from a depth range.
     * @param context the routing context
     */
    @Override
    public void handle(RoutingContext context) {
        final HttpServerResponse response = context.response();
        /* get parameters from body or query */
        final double depthMin, depthMax;
        final String colorMapName, imageName;
        try {
            final Buffer bodyBuffer = context.getBody();
            final JsonObject body = bodyBuffer == null || bodyBuffer.length() == 0 ? null : context.getBodyAsJson();
            final Parameters parameters = new Parameters(body, context.request());
            depthMin = parameters.getNumber(PARAM_DEPTH_MIN);
            depthMax = parameters.getNumber(PARAM_DEPTH_MAX);
            colorMapName = parameters.getText(PARAM_COLORMAP, ColorMaps.DEFAULT_NAME);
            imageName = parameters.getText(PARAM_IMAGE_NAME, defaultImageName);
        } catch (DecodeException de) {
            JsonResponses.fail(response, 400, "request body must be a JSON object");
            return;
        } catch (BadParameterException bpe) {
            JsonResponses.fail(response, 400, bpe.getMessage());
            return;
        }
        /* query image from database */
        final PixelMatrix image;
        try {
            image = imageDao.queryImage(tableName, depthMin, depthMax, colorMapName, imageName);
        } catch (ImageServiceException ise) {
            LOGGER.debug("failed to fetch image {}", imageName, ise);
            JsonResponses.fail(response, ise);
            return;
        } catch (RuntimeException re) {
            LOGGER.warn("unexpected failure fetching image {}", imageName, re);
            JsonResponses.fail(response, 500, "internal error: " + re.getMessage());
            return;
        }
        LOGGER.debug("providing {} of image {}", image, imageName);
        /* return image in JSON by HTTP */
        final JsonObject result = new JsonObject().put("image", BaseEncoding.base64().encode(image.getData()));
        JsonResponses.respondWithJson(response, 200, result);
    }
}
