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

package dev.mars.zephyr.agent.provider;

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.core.TaskResult;
import dev.mars.zephyr.core.TokenUsage;
import dev.mars.zephyr.core.exceptions.ProviderExecutionException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Executes tasks through the Anthropic messages API.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ClaudeCapabilityProvider implements CapabilityProvider {

    private static final Logger logger = LoggerFactory.getLogger(ClaudeCapabilityProvider.class);

    static final String API_VERSION = "2023-06-01";

    private final AgentConfiguration config;
    private final WebClient webClient;

    public ClaudeCapabilityProvider(Vertx vertx, AgentConfiguration config) {
        this.config = config;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout(config.getHttpConnectionTimeout())
            .setIdleTimeout(config.getHttpIdleTimeout())
            .setUserAgent(config.getUserAgent()));
        logger.debug("ClaudeCapabilityProvider initialized (url={}, model={}, maxTokens={})",
            config.getProviderUrl(), config.getProviderModel(), config.getProviderMaxTokens());
    }

    @Override
    public String getName() {
        return "claude-api";
    }

    @Override
    public Future<TaskResult> execute(String description, Map<String, Object> context) {
        if (config.getProviderApiKey().isEmpty()) {
            return Future.failedFuture(new ProviderExecutionException("No API key configured for the messages API"));
        }

        String model = config.getProviderModel();
        JsonObject request = new JsonObject()
            .put("model", model)
            .put("max_tokens", config.getProviderMaxTokens())
            .put("messages", new JsonArray().add(new JsonObject()
                .put("role", "user")
                .put("content", PromptBuilder.build(description, context))));

        logger.info("Sending task to messages API (model: {})", model);
        long started = System.nanoTime();

        return webClient.postAbs(config.getProviderUrl())
            .putHeader("Content-Type", "application/json")
            .putHeader("x-api-key", config.getProviderApiKey())
            .putHeader("anthropic-version", API_VERSION)
            .timeout(config.getTaskTimeout().toMillis())
            .sendJsonObject(request)
            .transform(ar -> {
                if (ar.failed()) {
                    return Future.failedFuture(new ProviderExecutionException(
                        "Messages API request failed: " + ar.cause().getMessage(), ar.cause()));
                }
                double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
                return toResult(ar.result(), model, seconds);
            });
    }

    private Future<TaskResult> toResult(HttpResponse<Buffer> response, String model, double seconds) {
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            logger.error("Messages API error: HTTP {} {}", statusCode, response.bodyAsString());
            return Future.failedFuture(new ProviderExecutionException(
                "Messages API returned HTTP " + statusCode + ": " + errorMessage(response), statusCode));
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException e) {
            return Future.failedFuture(new ProviderExecutionException("Messages API returned invalid JSON", e));
        }
        if (body == null) {
            return Future.failedFuture(new ProviderExecutionException("Messages API returned an empty body"));
        }

        StringBuilder text = new StringBuilder();
        JsonArray content = body.getJsonArray("content", new JsonArray());
        for (int i = 0; i < content.size(); i++) {
            JsonObject block = content.getJsonObject(i);
            if (block != null && "text".equals(block.getString("type", "text")) && block.getString("text") != null) {
                text.append(block.getString("text"));
            }
        }

        JsonObject usageJson = body.getJsonObject("usage", new JsonObject());
        TokenUsage usage = new TokenUsage(
            usageJson.getLong("input_tokens", 0L),
            usageJson.getLong("output_tokens", 0L));
        String usedModel = body.getString("model", model);
        double cost = CostCalculator.calculate(usedModel, usage);

        logger.info("Task executed successfully. Tokens used: {}", usage.getTotalTokens());
        return Future.succeededFuture(new TaskResult(text.toString(), usage, usedModel, seconds, cost));
    }

    private static String errorMessage(HttpResponse<Buffer> response) {
        try {
            JsonObject body = response.bodyAsJsonObject();
            if (body != null && body.getJsonObject("error") != null) {
                return body.getJsonObject("error").getString("message", response.statusMessage());
            }
        } catch (DecodeException e) {
            logger.debug("Error body is not JSON: {}", e.getMessage());
        }
        String raw = response.bodyAsString();
        return raw == null || raw.isBlank() ? response.statusMessage() : raw;
    }

    @Override
    public Future<Void> shutdown() {
        logger.debug("Shutting down ClaudeCapabilityProvider WebClient");
        webClient.close();
        return Future.succeededFuture();
    }
}
