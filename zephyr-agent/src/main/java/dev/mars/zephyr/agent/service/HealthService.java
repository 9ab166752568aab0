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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.agent.device.DeviceRegistry;
import dev.mars.zephyr.agent.engine.EngineStatus;
import dev.mars.zephyr.agent.engine.ExecutorSnapshot;
import dev.mars.zephyr.agent.engine.TaskExecutionEngine;
import dev.mars.zephyr.agent.workspace.WorkspaceLifecycleManager;
import dev.mars.zephyr.core.JsonMapping;
import dev.mars.zephyr.device.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local HTTP endpoints for health checks and a status overview of the agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class HealthService {

    private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

    private final AgentConfiguration config;
    private final TaskExecutionEngine engine;
    private final DeviceRegistry registry;
    private final WorkspaceLifecycleManager workspaces;
    private final ObjectMapper objectMapper = JsonMapping.mapper();
    private final Instant startTime;
    private HttpServer server;

    public HealthService(AgentConfiguration config, TaskExecutionEngine engine,
                         DeviceRegistry registry, WorkspaceLifecycleManager workspaces) {
        this.config = config;
        this.engine = engine;
        this.registry = registry;
        this.workspaces = workspaces;
        this.startTime = Instant.now();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(config.getAgentPort()), 0);
        server.createContext("/health", new HealthHandler());
        server.createContext("/status", new StatusHandler());
        server.setExecutor(null);
        server.start();

        logger.info("Health service started on port {}", getPort());
    }

    /**
     * Port actually bound, which differs from the configured one when that is 0.
     */
    public int getPort() {
        return server == null ? config.getAgentPort() : server.getAddress().getPort();
    }

    public void shutdown() {
        if (server != null) {
            server.stop(0);
            server = null;
            logger.info("Health service stopped");
        }
    }

    private void respond(HttpExchange exchange, int status, Map<String, Object> body) throws IOException {
        byte[] response = objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            EngineStatus status = engine.getStatus();
            boolean up = status != EngineStatus.SIGNED_OUT && status != EngineStatus.ERROR;

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", up ? "UP" : "DOWN");
            health.put("engine", status);
            health.put("agent", config.getAgentName());
            health.put("device_registered", registry.isRegistered());
            health.put("timestamp", Instant.now());
            health.put("uptime", Instant.now().toEpochMilli() - startTime.toEpochMilli());
            respond(exchange, up ? 200 : 503, health);
        }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            ExecutorSnapshot snapshot = engine.snapshot();
            Device device = registry.currentDevice();

            Map<String, Object> status = new LinkedHashMap<>();
            status.put("version", config.getVersion());
            status.put("executor", snapshot);
            if (device != null) {
                Map<String, Object> deviceInfo = new LinkedHashMap<>();
                deviceInfo.put("id", device.getId());
                deviceInfo.put("device_id", device.getDeviceId());
                deviceInfo.put("device_name", device.getDeviceName());
                deviceInfo.put("available_slots", device.getAvailableSlots());
                deviceInfo.put("heartbeats_sent", registry.getHeartbeatService().getSentCount());
                deviceInfo.put("heartbeats_failed", registry.getHeartbeatService().getFailedCount());
                status.put("device", deviceInfo);
            }
            status.put("active_workspaces", workspaces.getActiveCount());
            status.put("start_time", startTime);
            status.put("current_time", Instant.now());

            Runtime runtime = Runtime.getRuntime();
            Map<String, Object> runtimeInfo = new LinkedHashMap<>();
            runtimeInfo.put("total_memory", runtime.totalMemory());
            runtimeInfo.put("free_memory", runtime.freeMemory());
            runtimeInfo.put("max_memory", runtime.maxMemory());
            runtimeInfo.put("available_processors", runtime.availableProcessors());
            status.put("runtime", runtimeInfo);

            respond(exchange, 200, status);
        }
    }
}
