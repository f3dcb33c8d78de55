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

import com.google.common.collect.ImmutableMap;

import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;

/**
 * Provide the greeting and health endpoints.
 * @author The Open Microscopy Environment
 */
public class RequestHandlerForStatus implements HttpHandler {

    public static final String PATH_ROOT = "/";
    public static final String PATH_HEALTH = "/health";

    @Override
    public void handleFor(Router router) {
        final JsonObject greeting = new JsonObject(ImmutableMap.of("message", "Hello, world!"));
        final JsonObject health = new JsonObject(ImmutableMap.of("status", "OK"));
        router.get(PATH_ROOT).handler(context -> JsonResponses.respondWithJson(context.response(), 200, greeting));
        router.get(PATH_HEALTH).handler(context -> JsonResponses.respondWithJson(context.response(), 200, health));
    }
}
