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

import org.openmicroscopy.ms.depth.stub.H2DataSources;
import org.openmicroscopy.ms.depth.stub.RouterFake;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;

import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

/**
 * Base class providing a database, fakes and utilities for testing microservice endpoints.
 * @author The Open Microscopy Environment
 */
public abstract class DepthEndpointsTestBase {

    protected static final String MEDIA_TYPE_JSON = "application/json; charset=utf-8";

    protected Configuration configuration;
    protected ImageDao imageDao;

    private RouterFake router;

    /**
     * Set up the HTTP request handlers atop a new empty database.
     * @throws ImageServiceException unexpected
     */
    @BeforeEach
    protected void endpointSetup() throws ImageServiceException {
        final Map<String, String> settings = new HashMap<>(ConfigurationTest.getDatabaseSettings());
        settings.put(Configuration.CONF_IMAGE_WIDTH, "2");
        configuration = new Configuration(settings);
        setImageDao(new ImageDao(H2DataSources.create()));
    }

    /**
     * Set up the HTTP request handlers atop the given data access object.
     * @param imageDao the data access object for the image tables
     */
    protected void setImageDao(ImageDao imageDao) {
        this.imageDao = imageDao;
        router = new RouterFake();
        for (final HttpHandler handler : DepthImageService.createRequestHandlers(configuration, imageDao)) {
            handler.handleFor(router.getRouter());
        }
    }

    /**
     * Make a request of the microservice and check that the response is of JSON with the expected status code.
     * @param method the HTTP method of the request
     * @param path the URI path of the request
     * @param body the JSON body of the request, may be {@code null}
     * @param query the query parameters of the request
     * @param expectedStatus the expected HTTP status code of the response
     * @return the microservice's response as JSON
     */
    protected JsonObject getResponseAsJson(HttpMethod method, String path, JsonObject body, Map<String, String> query,
            int expectedStatus) {
        final HttpServerRequest httpRequest = Mockito.mock(HttpServerRequest.class);
        final HttpServerResponse httpResponse = Mockito.mock(HttpServerResponse.class);
        final RoutingContext context = Mockito.mock(RoutingContext.class);
        Mockito.when(httpRequest.method()).thenReturn(method);
        Mockito.when(httpRequest.path()).thenReturn(path);
        Mockito.when(httpRequest.response()).thenReturn(httpResponse);
        Mockito.when(httpRequest.getParam(Mockito.anyString())).thenAnswer(invocation -> query.get(invocation.getArgument(0)));
        Mockito.when(context.request()).thenReturn(httpRequest);
        Mockito.when(context.response()).thenReturn(httpResponse);
        if (body != null) {
            Mockito.when(context.getBody()).thenReturn(Buffer.buffer(body.encode()));
            Mockito.when(context.getBodyAsJson()).thenReturn(body);
        }
        router.handle(method, path, context);
        final ArgumentCaptor<String> responseLengthCaptor = ArgumentCaptor.forClass(String.class);
        final ArgumentCaptor<String> responseContentCaptor = ArgumentCaptor.forClass(String.class);
        Mockito.verify(httpResponse, Mockito.times(1)).setStatusCode(Mockito.eq(expectedStatus));
        Mockito.verify(httpResponse, Mockito.times(1)).putHeader(Mockito.eq("Content-Type"), Mockito.eq(MEDIA_TYPE_JSON));
        Mockito.verify(httpResponse, Mockito.times(1)).putHeader(Mockito.eq("Content-Length"), responseLengthCaptor.capture());
        Mockito.verify(httpResponse, Mockito.times(1)).end(responseContentCaptor.capture());
        final int responseLength = Integer.parseInt(responseLengthCaptor.getValue());
        final String responseContent = responseContentCaptor.getValue();
        Assertions.assertEquals(responseLength, responseContent.getBytes(StandardCharsets.UTF_8).length);
        return new JsonObject(responseContent);
    }

    /**
     * Make a GET request of the microservice with a JSON body.
     * @param path the URI path of the request
     * @param body the JSON body of the request
     * @param expectedStatus the expected HTTP status code of the response
     * @return the microservice's response as JSON
     */
    protected JsonObject get(String path, JsonObject body, int expectedStatus) {
        return getResponseAsJson(HttpMethod.GET, path, body, new HashMap<>(), expectedStatus);
    }

    /**
     * Make a POST request of the microservice with a JSON body.
     * @param path the URI path of the request
     * @param body the JSON body of the request
     * @param expectedStatus the expected HTTP status code of the response
     * @return the microservice's response as JSON
     */
    protected JsonObject post(String path, JsonObject body, int expectedStatus) {
        return getResponseAsJson(HttpMethod.POST, path, body, new HashMap<>(), expectedStatus);
    }
}
