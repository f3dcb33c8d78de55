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

import org.openmicroscopy.ms.depth.image.PixelConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.vertx.core.Handler;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store an uploaded image via HTTP endpoint.
 * The request body holds the image column by column:
 * <pre>{"data": {"image_name": [...], "depth": [...], "0": [...], ...}, "channels": 1}</pre>
 * @author The Open Microscopy Environment
 */
public class RequestHandlerForUpload implements HttpHandler, Handler<RoutingContext> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestHandlerForUpload.class);

    public static final String PATH = "/upload-image";

    static final String MESSAGE_SUCCESS = "Data uploaded and stored successfully.";

    private final String tableName;
    private final ImageDao imageDao;
    private final ImageIngester ingester;

    /**
     * Create the HTTP request handler.
     * @param configuration the configuration of this microservice
     * @param imageDao the data access object for the image tables
     * @param ingester prepares uploaded images for storage
     */
    public RequestHandlerForUpload(Configuration configuration, ImageDao imageDao, ImageIngester ingester) {
        this.tableName = configuration.getTableName();
        this.imageDao = imageDao;
        this.ingester = ingester;
    }

    @Override
    public void handleFor(Router router) {
        LOGGER.info("handling POST requests for {}", PATH);
        router.post(PATH).handler(BodyHandler.create()).blockingHandler(this);
    }

    /**
     * @param message a description of the malformed upload
     * @return an exception to throw for that upload
     */
    private static ImageServiceException malformed(String message) {
        return new ImageServiceException(ImageServiceException.Kind.CONVERSION, message);
    }

    /**
     * An image as uploaded, before resizing.
     * @author The Open Microscopy Environment
     */
    private static class Upload {

        final String imageName;
        final double depth;
        final boolean isColor;
        final TabularImage image;

        Upload(String imageName, double depth, boolean isColor, TabularImage image) {
            this.imageName = imageName;
            this.depth = depth;
            this.isColor = isColor;
            this.image = image;
        }
    }

    /**
     * Parse the uploaded image from the request body.
     * @param body the request body
     * @return the uploaded image
     * @throws ImageServiceException if the body does not describe an image
     */
    private static Upload parseUpload(JsonObject body) throws ImageServiceException {
        if (body == null) {
            throw malformed("request body must be a JSON object");
        }
        final Object channelsValue = body.getValue("channels");
        if (channelsValue != null && !(channelsValue instanceof Integer || channelsValue instanceof Long)) {
            throw malformed("channels must be 1 or 3");
        }
        final long channels = channelsValue == null ? 1 : ((Number) channelsValue).longValue();
        if (channels != 1 && channels != 3) {
            throw malformed("channels must be 1 or 3, not " + channels);
        }
        final Object dataValue = body.getValue("data");
        if (!(dataValue instanceof JsonObject)) {
            throw malformed("request body must have a data object of columns");
        }
        final JsonObject data = (JsonObject) dataValue;
        final List<JsonArray> pixelColumns = new ArrayList<>();
        JsonArray names = null;
        JsonArray depths = null;
        for (final Map.Entry<String, Object> column : data) {
            if (!(column.getValue() instanceof JsonArray)) {
                throw malformed("column " + column.getKey() + " must be a list of values");
            }
            final JsonArray values = (JsonArray) column.getValue();
            if (TableSchema.COLUMN_IMAGE_NAME.equals(column.getKey())) {
                names = values;
            } else if (TableSchema.COLUMN_DEPTH.equals(column.getKey())) {
                depths = values;
            } else {
                pixelColumns.add(values);
            }
        }
        if (names == null || depths == null) {
            throw malformed("data must have " + TableSchema.COLUMN_IMAGE_NAME + " and " + TableSchema.COLUMN_DEPTH + " columns");
        }
        final int rowCount = depths.size();
        if (rowCount == 0) {
            throw malformed("data must have at least one row");
        }
        if (names.size() != rowCount || pixelColumns.stream().anyMatch(column -> column.size() != rowCount)) {
            throw malformed("every column of data must have the same number of values");
        }
        final Object imageName = names.getValue(0);
        if (!(imageName instanceof String)) {
            throw malformed(TableSchema.COLUMN_IMAGE_NAME + " must be text");
        }
        final double[] depthValues = new double[rowCount];
        final List<int[]> pixelRows = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            depthValues[row] = toNumber(depths.getValue(row), TableSchema.COLUMN_DEPTH);
            final int[] pixels = new int[pixelColumns.size()];
            for (int column = 0; column < pixels.length; column++) {
                pixels[column] = PixelConverter.toPixelValue(toNumber(pixelColumns.get(column).getValue(row), "pixel"));
            }
            pixelRows.add(pixels);
        }
        return new Upload((String) imageName, depthValues[0], channels == 3, new TabularImage(pixelRows, depthValues));
    }

    /**
     * @param value a value from the uploaded data
     * @param description what the value is, for the error message
     * @return the value as a number
     * @throws ImageServiceException if the value is not a number
     */
    private static double toNumber(Object value, String description) throws ImageServiceException {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw malformed(description + " value must be a number, not " + value);
    }

    /**
     * Respond with the outcome of an upload.
     * @param response the HTTP response
     * @param code the HTTP response code
     * @param message a description of the outcome
     */
    private static void respond(HttpServerResponse response, int code, String message) {
        final JsonObject result = new JsonObject().put("message", message).put("success", code == 200);
        JsonResponses.respondWithJson(response, code, result);
    }

    /**
     * Handle incoming image uploads.
     * @param context the routing context
     */
    @Override
    public void handle(RoutingContext context) {
        final HttpServerResponse response = context.response();
        try {
            final JsonObject body;
            try {
                body = context.getBodyAsJson();
            } catch (DecodeException de) {
                throw malformed("request body must be a JSON object");
            }
            final Upload upload = parseUpload(body);
            final List<ImageRow> rows = ingester.ingestAtDepth(upload.image, upload.isColor, upload.imageName, upload.depth);
            imageDao.replaceInsert(tableName, rows);
            LOGGER.info("stored uploaded image {} as {} rows", upload.imageName, rows.size());
            respond(response, 200, MESSAGE_SUCCESS);
        } catch (ImageServiceException ise) {
            LOGGER.warn("failed to store uploaded image", ise);
            respond(response, JsonResponses.getStatusCode(ise.getKind()), "Error occurred: " + ise.getMessage());
        } catch (RuntimeException re) {
            LOGGER.error("unexpected failure storing uploaded image", re);
            respond(response, 500, "Error occurred: " + re.getMessage());
        }
    }
}
