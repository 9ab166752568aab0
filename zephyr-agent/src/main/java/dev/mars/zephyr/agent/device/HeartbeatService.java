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

package dev.mars.zephyr.agent.device;

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.agent.scheduler.PeriodicTicker;
import dev.mars.zephyr.agent.service.ExecutorApiClient;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends device heartbeats to the backend. A failed heartbeat is logged and
 * counted; it never stops the agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class HeartbeatService {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatService.class);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final ExecutorApiClient client;
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile String deviceId;
    private volatile Instant lastHeartbeat;
    private PeriodicTicker ticker;

    public HeartbeatService(Vertx vertx, AgentConfiguration config, ExecutorApiClient client) {
        this.vertx = vertx;
        this.config = config;
        this.client = client;
    }

    /**
     * Start beating for the given device, first beat immediately. A second
     * call while running does nothing.
     */
    public synchronized void start(String deviceId) {
        if (ticker != null && ticker.isActive()) {
            return;
        }
        this.deviceId = deviceId;
        ticker = new PeriodicTicker(vertx, "heartbeat", config.getHeartbeatIntervalMs(), true, this::sendHeartbeat);
        ticker.start();
    }

    public synchronized void stop() {
        if (ticker != null) {
            ticker.cancel();
            ticker = null;
        }
    }

    public synchronized boolean isActive() {
        return ticker != null && ticker.isActive();
    }

    /**
     * Sends one heartbeat.
     *
     * @return Future that completes with true if successful, false otherwise
     */
    public Future<Boolean> sendHeartbeat() {
        String id = deviceId;
        if (id == null) {
            logger.debug("No device registered, skipping heartbeat");
            return Future.succeededFuture(false);
        }
        return client.sendDeviceHeartbeat(id)
            .map(v -> {
                sent.incrementAndGet();
                lastHeartbeat = Instant.now();
                logger.debug("Heartbeat sent for device {}", id);
                return true;
            })
            .recover(err -> {
                failed.incrementAndGet();
                logger.warn("Heartbeat failed for device {}: {}", id, err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    public long getSentCount() {
        return sent.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }
}
