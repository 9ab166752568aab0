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
import dev.mars.zephyr.agent.service.ExecutorApiClient;
import dev.mars.zephyr.agent.support.FakeExecutorBackend;
import dev.mars.zephyr.agent.support.TestConfigurations;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Path;
import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatService.
 * Uses real HTTP server (no mocking) following project testing principles.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class HeartbeatServiceTest {

    private FakeExecutorBackend backend;
    private AgentConfiguration config;
    private ExecutorApiClient client;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        backend = new FakeExecutorBackend(vertx);
        backend.start().onComplete(testContext.succeeding(port -> {
            config = TestConfigurations.forBackend(backend, Path.of("build", "hb")).heartbeatIntervalMs(100).build();
            client = new ExecutorApiClient(vertx, config);
            testContext.completeNow();
        }));
    }

    @BeforeEach
    void resetBackend() {
        backend.reset();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        backend.stop().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("Should return false when no device is registered")
    void testHeartbeatWithoutDevice(Vertx vertx, VertxTestContext testContext) {
        HeartbeatService service = new HeartbeatService(vertx, config, client);

        service.sendHeartbeat().onComplete(testContext.succeeding(result -> {
            testContext.verify(() -> {
                assertFalse(result);
                assertEquals(0, backend.heartbeats.get(), "No heartbeat should be sent");
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("Should count a failed heartbeat without failing")
    void testFailedHeartbeat(Vertx vertx, VertxTestContext testContext) {
        backend.failWith("heartbeat", 500, -1);
        HeartbeatService service = new HeartbeatService(vertx, config, client);
        service.start("dev-x");
        service.stop();

        service.sendHeartbeat().onComplete(testContext.succeeding(result -> {
            testContext.verify(() -> {
                assertFalse(result, "Heartbeat should report failure");
                assertTrue(service.getFailedCount() >= 1);
                assertEquals(0, service.getSentCount());
                assertNull(service.getLastHeartbeat());
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("Should beat immediately and then periodically until stopped")
    void testPeriodicHeartbeats(Vertx vertx) {
        backend.addDevice("test-machine-id", 5, 0);
        HeartbeatService service = new HeartbeatService(vertx, config, client);

        service.start("dev-1");
        service.start("dev-1");
        assertTrue(service.isActive());

        await().atMost(Duration.ofSeconds(5)).until(() -> service.getSentCount() >= 3);
        service.stop();
        assertFalse(service.isActive());

        long sent = backend.heartbeats.get();
        assertTrue(sent >= 3);
        assertNotNull(service.getLastHeartbeat());
    }
}
