/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.zephyr.agent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.core.JsonMapping;
import dev.mars.zephyr.core.exceptions.RemoteServiceException;
import dev.mars.zephyr.core.exceptions.UnauthorizedException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for clients of the remote backend.
 *
 * <p>Owns the Vert.x {@link WebClient}, adds the bearer token to every request
 * and maps responses: 2xx succeeds with the JSON body (empty object when the
 * body is empty), 401 fails with {@link UnauthorizedException}, anything else
 * and every transport error fails with {@link RemoteServiceException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public abstract class RemoteApiClient {

    private static final Logger logger = LoggerFactory.getLogger(RemoteApiClient.class);

    protected final AgentConfiguration config;
    protected final WebClient webClient;
    protected final ObjectMapper mapper = JsonMapping.mapper();

    protected RemoteApiClient(Vertx vertx, AgentConfiguration config) {
        this.config = config;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout(config.getHttpConnectionTimeout())
            .setIdleTimeout(config.getHttpIdleTimeout())
            .setUserAgent(config.getUserAgent()));
        logger.debug("{} initialized with Vert.x WebClient (base={}, connectTimeout={}ms, idleTimeout={}s)",
            getClass().getSimpleName(), config.getApiUrl(), config.getHttpConnectionTimeout(), config.getHttpIdleTimeout());
    }

    protected Future<JsonObject> get(String path) {
        return send(HttpMethod.GET, path, null);
    }

    protected Future<JsonObject> post(String path, JsonObject body) {
        return send(HttpMethod.POST, path, body);
    }

    protected Future<JsonObject> put(String path, JsonObject body) {
        return send(HttpMethod.PUT, path, body);
    }

    protected Future<JsonObject> patch(String path, JsonObject body) {
        return send(HttpMethod.PATCH, path, body);
    }

    protected Future<JsonObject> delete(String path) {
        return send(HttpMethod.DELETE, path, null);
    }

    /**
     * Send a request relative to the API base URL and map the response.
     */
    protected Future<JsonObject> send(HttpMethod method, String path, JsonObject body) {
        String endpoint = method.name() + " " + path;
        HttpRequest<Buffer> request = webClient.requestAbs(method, config.getApiUrl() + path)
            .putHeader("Accept", "application/json")
            .putHeader("Authorization", "Bearer " + config.getApiToken());

        Future<HttpResponse<Buffer>> response = body == null
            ? request.send()
            : request.putHeader("Content-Type", "application/json").sendJsonObject(body);

        return response.transform(ar -> {
            if (ar.failed()) {
                logger.debug("{} transport failure: {}", endpoint, ar.cause().getMessage());
                return Future.failedFuture(new RemoteServiceException(endpoint, ar.cause()));
            }
            return mapResponse(endpoint, ar.result());
        });
    }

    private Future<JsonObject> mapResponse(String endpoint, HttpResponse<Buffer> response) {
        int statusCode = response.statusCode();
        if (statusCode == 401) {
            logger.warn("{} rejected credentials (HTTP 401)", endpoint);
            return Future.failedFuture(new UnauthorizedException(endpoint));
        }
        if (statusCode < 200 || statusCode >= 300) {
            String text = response.bodyAsString();
            logger.debug("{} returned HTTP {}: {}", endpoint, statusCode, text);
            return Future.failedFuture(new RemoteServiceException(endpoint, statusCode,
                text == null || text.isBlank() ? response.statusMessage() : text));
        }
        Buffer buffer = response.body();
        if (buffer == null || buffer.length() == 0) {
            return Future.succeededFuture(new JsonObject());
        }
        try {
            return Future.succeededFuture(buffer.toJsonObject());
        } catch (DecodeException e) {
            return Future.failedFuture(new RemoteServiceException(endpoint, statusCode,
                "response is not a JSON object: " + e.getMessage()));
        }
    }

    /**
     * Convert a JSON object to a model type through the shared Jackson mapper.
     */
    protected <T> T decode(JsonObject json, Class<T> type) {
        try {
            return mapper.readValue(json.encode(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode the object stored under {@code key}; fails when it is missing.
     */
    protected <T> Future<T> decodeField(JsonObject body, String key, Class<T> type, String endpoint) {
        JsonObject value = body.getJsonObject(key);
        if (value == null) {
            return Future.failedFuture(new RemoteServiceException(endpoint, 200, "response has no '" + key + "'"));
        }
        try {
            return Future.succeededFuture(decode(value, type));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new RemoteServiceException(endpoint, 200, e.getMessage()));
        }
    }

    /**
     * Decode every element of the array under {@code key}, skipping and
     * logging elements that do not parse.
     */
    protected <T> List<T> decodeList(JsonObject body, String key, Class<T> type) {
        List<T> items = new ArrayList<>();
        JsonArray array = body.getJsonArray(key);
        if (array == null) {
            return items;
        }
        for (int i = 0; i < array.size(); i++) {
            Object element = array.getValue(i);
            if (!(element instanceof JsonObject)) {
                logger.warn("Skipping non-object entry {} in '{}'", i, key);
                continue;
            }
            try {
                items.add(decode((JsonObject) element, type));
            } catch (IllegalArgumentException e) {
                logger.warn("Failed to parse {} entry {}: {}", type.getSimpleName(), i, e.getMessage());
            }
        }
        return items;
    }

    protected JsonObject encode(Object value) {
        try {
            return new JsonObject(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + value.getClass().getSimpleName(), e);
        }
    }

    protected static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Shuts down the WebClient.
     *
     * @return Future that completes when shutdown is done
     */
    public Future<Void> shutdown() {
        logger.debug("Shutting down {} WebClient", getClass().getSimpleName());
        webClient.close();
        return Future.succeededFuture();
    }
}
