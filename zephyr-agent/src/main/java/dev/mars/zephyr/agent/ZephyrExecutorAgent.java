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

import dev.mars.zephyr.agent.config.AgentConfig;
import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.agent.config.ProviderMode;
import dev.mars.zephyr.agent.device.DeviceRegistry;
import dev.mars.zephyr.agent.engine.ExecutorListener;
import dev.mars.zephyr.agent.engine.TaskExecutionEngine;
import dev.mars.zephyr.agent.observability.AgentMetrics;
import dev.mars.zephyr.agent.observability.AgentTelemetryConfig;
import dev.mars.zephyr.agent.provider.CapabilityProvider;
import dev.mars.zephyr.agent.provider.ClaudeCapabilityProvider;
import dev.mars.zephyr.agent.provider.CommandLineCapabilityProvider;
import dev.mars.zephyr.agent.service.ExecutorApiClient;
import dev.mars.zephyr.agent.service.HealthService;
import dev.mars.zephyr.agent.service.TaskQueueClient;
import dev.mars.zephyr.agent.workspace.WorkspaceLifecycleManager;
import dev.mars.zephyr.process.ProcessRunner;
import dev.mars.zephyr.process.SystemProcessRunner;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for the Zephyr executor agent.
 *
 * <p>Wires the task queue client, the capability provider, the device registry
 * and the workspace manager into a {@link TaskExecutionEngine}, starts the
 * local health endpoint and runs until shut down or signed out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ZephyrExecutorAgent {

    private static final Logger logger = LoggerFactory.getLogger(ZephyrExecutorAgent.class);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final TaskQueueClient taskQueueClient;
    private final ExecutorApiClient executorApiClient;
    private final CapabilityProvider provider;
    private final DeviceRegistry deviceRegistry;
    private final WorkspaceLifecycleManager workspaceManager;
    private final TaskExecutionEngine engine;
    private final HealthService healthService;
    private final AgentMetrics metrics;

    // Shutdown coordination
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Creates the agent with the system process runner.
     *
     * @param vertx the Vert.x instance (must not be null)
     * @param config the agent configuration (must not be null)
     */
    public ZephyrExecutorAgent(Vertx vertx, AgentConfiguration config) {
        this(vertx, config, new SystemProcessRunner());
    }

    ZephyrExecutorAgent(Vertx vertx, AgentConfiguration config, ProcessRunner processRunner) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "AgentConfiguration cannot be null");

        this.taskQueueClient = new TaskQueueClient(vertx, config);
        this.executorApiClient = new ExecutorApiClient(vertx, config);
        this.provider = createProvider(vertx, config, processRunner);
        this.deviceRegistry = new DeviceRegistry(vertx, config, executorApiClient);
        this.workspaceManager = new WorkspaceLifecycleManager(vertx, config, executorApiClient, deviceRegistry, processRunner);
        this.engine = new TaskExecutionEngine(vertx, config, taskQueueClient, provider, workspaceManager);
        this.healthService = new HealthService(config, engine, deviceRegistry, workspaceManager);

        this.metrics = new AgentMetrics(config.getAgentName(), System.currentTimeMillis());
        metrics.bindActiveTasks(engine::getActiveTaskCount);
        metrics.bindActiveWorkspaces(workspaceManager::getActiveCount);
        metrics.bindHeartbeats(deviceRegistry.getHeartbeatService()::getSentCount,
            deviceRegistry.getHeartbeatService()::getFailedCount);
        engine.addListener(metrics);
        workspaceManager.addListener(metrics::recordWorkspace);
        engine.addListener(new ExecutorListener() {
            @Override
            public void onSignedOut(String reason) {
                logger.error("Agent signed out ({}), shutting down", reason);
                shutdown();
            }
        });

        logger.info("Zephyr executor agent initialized: {} (provider: {})", config.getAgentName(), provider.getName());
    }

    static CapabilityProvider createProvider(Vertx vertx, AgentConfiguration config, ProcessRunner processRunner) {
        if (config.getProviderMode() == ProviderMode.TERMINAL) {
            return new CommandLineCapabilityProvider(vertx, config, processRunner);
        }
        return new ClaudeCapabilityProvider(vertx, config);
    }

    public static void main(String[] args) {
        logger.info("Starting Zephyr executor agent...");

        AgentConfig agentConfig = AgentConfig.get();
        Vertx vertx = Vertx.vertx(AgentTelemetryConfig.configure(new VertxOptions(), agentConfig.getAgentName()));

        int exitCode = 0;
        AtomicBoolean startFailed = new AtomicBoolean(false);
        try {
            agentConfig.validate();
            AgentConfiguration config = AgentConfiguration.fromEnvironment();
            ZephyrExecutorAgent agent = new ZephyrExecutorAgent(vertx, config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                agent.shutdown();
            }));

            agent.start().onFailure(err -> {
                logger.error("Failed to start Zephyr executor agent: {}", err.getMessage(), err);
                startFailed.set(true);
                agent.shutdown();
            });

            agent.awaitShutdown();
            if (startFailed.get()) {
                exitCode = 1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for shutdown");
        } catch (Exception e) {
            logger.error("Failed to start Zephyr executor agent", e);
            exitCode = 1;
        } finally {
            vertx.close().onComplete(ar -> {
                if (ar.succeeded()) {
                    logger.info("Vert.x instance closed successfully");
                } else {
                    logger.error("Error closing Vert.x instance", ar.cause());
                }
            });
        }

        logger.info("Zephyr executor agent stopped");
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Starts the health endpoint, checks the task queue, registers the device
     * and starts polling.
     *
     * @return completes once polling has started; fails when the task queue
     *         is unreachable, or the device cannot be registered while tasks
     *         need workspaces
     */
    public Future<Void> start() {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Agent is closed, cannot start"));
        }
        logger.info("Starting Zephyr executor agent services...");
        running = true;

        try {
            healthService.start();
        } catch (IOException e) {
            return Future.failedFuture(e);
        }

        return taskQueueClient.testConnection()
            .compose(connected -> {
                if (!connected) {
                    engine.fail("Task queue at " + config.getApiUrl() + " is unreachable");
                    return Future.failedFuture(new IllegalStateException("Task queue is unreachable: " + config.getApiUrl()));
                }
                return registerDevice();
            })
            .map(v -> {
                engine.start();
                logger.info("Zephyr executor agent started");
                return (Void) null;
            });
    }

    private Future<Void> registerDevice() {
        return deviceRegistry.ensureRegistered()
            .onSuccess(device -> metrics.recordRegistration(true))
            .compose(device -> workspaceManager.refreshActiveWorkspaces()
                .<Void>mapEmpty()
                .recover(err -> {
                    logger.warn("Could not load existing workspaces: {}", err.getMessage());
                    return Future.succeededFuture();
                }))
            .recover(err -> {
                metrics.recordRegistration(false);
                if (config.isWorkspacePerTask()) {
                    return Future.failedFuture(err);
                }
                logger.warn("Continuing without device registration: {}", err.getMessage());
                return Future.succeededFuture();
            });
    }

    public void shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return;
        }

        if (!running) {
            logger.info("Agent not running, performing cleanup only");
            shutdownLatch.countDown();
            return;
        }

        logger.info("Shutting down Zephyr executor agent...");
        running = false;

        try {
            engine.stop();
            deviceRegistry.shutdown();
            healthService.shutdown();
            provider.shutdown();
            taskQueueClient.shutdown();
            executorApiClient.shutdown();
            logger.info("Zephyr executor agent shutdown complete");
        } catch (RuntimeException e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    TaskExecutionEngine getEngine() {
        return engine;
    }

    DeviceRegistry getDeviceRegistry() {
        return deviceRegistry;
    }

    HealthService getHealthService() {
        return healthService;
    }
}
