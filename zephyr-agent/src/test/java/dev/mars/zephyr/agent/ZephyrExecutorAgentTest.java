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

package dev.mars.zephyr.agent;

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.agent.config.ProviderMode;
import dev.mars.zephyr.agent.engine.EngineStatus;
import dev.mars.zephyr.agent.provider.ClaudeCapabilityProvider;
import dev.mars.zephyr.agent.provider.CommandLineCapabilityProvider;
import dev.mars.zephyr.agent.support.FakeExecutorBackend;
import dev.mars.zephyr.agent.support.RecordingProcessRunner;
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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end startup and shutdown of the agent against an in-memory backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ZephyrExecutorAgentTest {

    private Vertx vertx;
    private FakeExecutorBackend backend;

    @TempDir
    Path tempDir;

    @BeforeAll
    void startBackend(Vertx vertx, VertxTestContext testContext) {
        this.vertx = vertx;
        backend = new FakeExecutorBackend(vertx);
        backend.start().onComplete(testContext.succeedingThenComplete());
    }

    @BeforeEach
    void resetBackend() {
        backend.reset();
    }

    @AfterAll
    void stopBackend(VertxTestContext testContext) {
        backend.stop().onComplete(ar -> testContext.completeNow());
    }

    private ZephyrExecutorAgent newAgent(AgentConfiguration.Builder builder) {
        return new ZephyrExecutorAgent(vertx, builder.build(), new RecordingProcessRunner());
    }

    @Test
    @DisplayName("Should register the device and start polling")
    void testStartAndShutdown() throws Exception {
        ZephyrExecutorAgent agent = newAgent(TestConfigurations.forBackend(backend, tempDir));

        agent.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(EngineStatus.RUNNING, agent.getEngine().getStatus());
        assertTrue(agent.getDeviceRegistry().isRegistered());
        assertEquals(1, backend.deviceRegistrations.get());
        assertTrue(agent.getHealthService().getPort() > 0);
        await().atMost(Duration.ofSeconds(5)).until(() -> backend.pollCount.get() >= 1);

        agent.shutdown();
        agent.awaitShutdown();
        assertEquals(EngineStatus.IDLE, agent.getEngine().getStatus());
        assertFalse(agent.getDeviceRegistry().getHeartbeatService().isActive());
    }

    @Test
    @DisplayName("Should fail to start when the task queue is unreachable")
    void testUnreachableTaskQueue(VertxTestContext testContext) {
        backend.failWith("health", 503, -1);
        ZephyrExecutorAgent agent = newAgent(TestConfigurations.forBackend(backend, tempDir));

        agent.start().onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertEquals(EngineStatus.ERROR, agent.getEngine().getStatus());
            assertEquals(0, backend.pollCount.get());
            agent.shutdown();
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Registration failure is fatal only when tasks need workspaces")
    void testRegistrationFailure(VertxTestContext testContext) {
        backend.failWith("devices.list", 500, -1);
        ZephyrExecutorAgent lenient = newAgent(TestConfigurations.forBackend(backend, tempDir));
        ZephyrExecutorAgent strict = newAgent(TestConfigurations.forBackend(backend, tempDir).workspacePerTask(true));

        lenient.start()
            .compose(v -> {
                testContext.verify(() -> assertEquals(EngineStatus.RUNNING, lenient.getEngine().getStatus()));
                lenient.shutdown();
                return strict.start();
            })
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                assertNotEquals(EngineStatus.RUNNING, strict.getEngine().getStatus());
                strict.shutdown();
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should shut down after the backend rejects the token")
    void testSignOutShutsDown() throws Exception {
        backend.failWith("pending", 401, -1);
        ZephyrExecutorAgent agent = newAgent(TestConfigurations.forBackend(backend, tempDir));

        agent.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> agent.getEngine().getStatus() == EngineStatus.SIGNED_OUT);
        agent.awaitShutdown();
        assertThrows(IllegalStateException.class, agent.getEngine()::start);
    }

    @Test
    @DisplayName("Should pick the provider from the configured mode")
    void testCreateProvider() {
        AgentConfiguration api = TestConfigurations.forBackend(backend, tempDir).build();
        AgentConfiguration terminal = TestConfigurations.forBackend(backend, tempDir).providerMode(ProviderMode.TERMINAL).build();

        assertInstanceOf(ClaudeCapabilityProvider.class,
            ZephyrExecutorAgent.createProvider(vertx, api, new RecordingProcessRunner()));
        assertInstanceOf(CommandLineCapabilityProvider.class,
            ZephyrExecutorAgent.createProvider(vertx, terminal, new RecordingProcessRunner()));
    }
}
