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

package org.openmicroscopy.ms.depth.stub;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.vertx.core.Handler;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Route;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import org.junit.jupiter.api.Assertions;
import org.mockito.Mockito;

/**
 * A fake router allowing unit tests to verify the handling of mock HTTP requests.
 * Routes may be added by HTTP method and exact path. Body handlers are skipped because tests provide the body directly.
 * @author The Open Microscopy Environment
 */
public class RouterFake {

    private final Map<String, List<Handler<RoutingContext>>> routes = new LinkedHashMap<>();

    private final Router router = Mockito.mock(Router.class);

    public RouterFake() {
        Mockito.when(router.get(Mockito.anyString()))
               .thenAnswer(invocation -> addRoute(HttpMethod.GET, invocation.getArgument(0)));
        Mockito.when(router.post(Mockito.anyString()))
               .thenAnswer(invocation -> addRoute(HttpMethod.POST, invocation.getArgument(0)));
    }

    /**
     * @param method a HTTP method
     * @param path a URI path
     * @return the key for the route
     */
    private static String getKey(HttpMethod method, String path) {
        return method + " " + path;
    }

    /**
     * Add a route that notes the handlers that are set on it.
     * @param method the HTTP method of the route
     * @param path the URI path of the route
     * @return the route
     */
    private Route addRoute(HttpMethod method, String path) {
        final String key = getKey(method, path);
        if (routes.containsKey(key)) {
            throw new IllegalArgumentException("route already exists");
        }
        final List<Handler<RoutingContext>> handlers = new ArrayList<>();
        routes.put(key, handlers);
        final Route route = Mockito.mock(Route.class);
        Mockito.when(route.handler(Mockito.any())).thenAnswer(invocation -> {
            handlers.add(invocation.getArgument(0));
            return route;
        });
        Mockito.when(route.blockingHandler(Mockito.any())).thenAnswer(invocation -> {
            handlers.add(invocation.getArgument(0));
            return route;
        });
        return route;
    }

    /**
     * @return the router on which request handlers may set routes
     */
    public Router getRouter() {
        return router;
    }

    /**
     * Pass a request to the handlers of its route.
     * @param method the HTTP method of the request
     * @param path the URI path of the request
     * @param context the routing context of the request
     */
    public void handle(HttpMethod method, String path, RoutingContext context) {
        final List<Handler<RoutingContext>> handlers = routes.get(getKey(method, path));
        if (handlers == null) {
            Assertions.fail("HTTP request path is unhandled: " + method + " " + path);
        }
        Assertions.assertFalse(handlers.isEmpty(), "route has no handler");
        for (final Handler<RoutingContext> handler : handlers) {
            if (!(handler instanceof BodyHandler)) {
                handler.handle(context);
            }
        }
    }
}
