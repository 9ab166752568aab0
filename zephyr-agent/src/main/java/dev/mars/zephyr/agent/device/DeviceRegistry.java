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
import dev.mars.zephyr.core.exceptions.DeviceNotRegisteredException;
import dev.mars.zephyr.device.Device;
import dev.mars.zephyr.device.DeviceStatus;
import dev.mars.zephyr.storage.WorkspaceFileManager;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

/**
 * Owns this machine's executor device record.
 *
 * <p>{@link #ensureRegistered()} adopts the backend record whose
 * {@code device_id} matches the local hardware id, or registers a new one,
 * creates the workspace root and starts the heartbeat. Concurrent callers
 * share one in-flight registration, so a machine never ends up with two
 * device records.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class DeviceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final ExecutorApiClient client;
    private final HeartbeatService heartbeatService;
    private final String hardwareId;

    private volatile Device currentDevice;
    private Future<Device> inFlight;
    private Future<Device> countUpdates = Future.succeededFuture();

    public DeviceRegistry(Vertx vertx, AgentConfiguration config, ExecutorApiClient client) {
        this(vertx, config, client, new HeartbeatService(vertx, config, client));
    }

    public DeviceRegistry(Vertx vertx, AgentConfiguration config, ExecutorApiClient client,
                          HeartbeatService heartbeatService) {
        this.vertx = vertx;
        this.config = config;
        this.client = client;
        this.heartbeatService = heartbeatService;
        this.hardwareId = DeviceIdentity.resolve(config.getDeviceId());
    }

    /**
     * Returns the device for this machine, registering it on first use.
     */
    public Future<Device> ensureRegistered() {
        Device device = currentDevice;
        if (device != null) {
            return Future.succeededFuture(device);
        }
        Promise<Device> promise;
        synchronized (this) {
            if (currentDevice != null) {
                return Future.succeededFuture(currentDevice);
            }
            if (inFlight != null) {
                return inFlight;
            }
            promise = Promise.promise();
            inFlight = promise.future();
        }
        lookupOrRegister()
            .compose(this::prepareRoot)
            .onComplete(ar -> {
                synchronized (this) {
                    if (ar.succeeded()) {
                        currentDevice = ar.result();
                    }
                    inFlight = null;
                }
                if (ar.succeeded()) {
                    Device registered = ar.result();
                    heartbeatService.start(registered.getId());
                    promise.complete(registered);
                } else {
                    logger.error("Device registration failed: {}", ar.cause().getMessage());
                    promise.fail(ar.cause());
                }
            });
        return promise.future();
    }

    private Future<Device> lookupOrRegister() {
        return client.listDevices(null, null).compose(devices -> {
            for (Device existing : devices) {
                if (hardwareId.equals(existing.getDeviceId())) {
                    logger.info("Adopting existing device record {} ({})", existing.getId(), existing.getDeviceName());
                    return Future.succeededFuture(existing);
                }
            }
            logger.info("No device record for hardware id {}, registering", hardwareId);
            return client.registerDevice(newDevice());
        });
    }

    private Device newDevice() {
        Device device = new Device(hardwareId, config.getDeviceName());
        device.setPlatform(DeviceIdentity.platform());
        device.setOsVersion(DeviceIdentity.osVersion());
        device.setExecutorVersion(config.getVersion());
        device.setRootWorkspacePath(config.getWorkspaceRoot().toString());
        device.setMaxConcurrentWorkspaces(config.getMaxConcurrentWorkspaces());
        device.setMaxDiskUsageGb(config.getMaxDiskUsageGb());
        device.setDefaultShell(DeviceIdentity.defaultShell());
        device.setDefaultTimeoutMinutes(Device.DEFAULT_TIMEOUT_MINUTES);
        device.setStatus(DeviceStatus.ACTIVE);
        device.setOnline(true);
        device.setLastHeartbeatAt(Instant.now());
        return device;
    }

    private Future<Device> prepareRoot(Device device) {
        Path root = workspaceRoot(device);
        return vertx.executeBlocking(() -> {
            WorkspaceFileManager.ensureDirectoryExists(root);
            return device;
        }, false);
    }

    /**
     * Root directory for workspaces: the registered device's path, or the
     * configured one before registration.
     */
    public Path workspaceRoot() {
        return workspaceRoot(currentDevice);
    }

    private Path workspaceRoot(Device device) {
        if (device != null && device.getRootWorkspacePath() != null && !device.getRootWorkspacePath().isBlank()) {
            return Paths.get(device.getRootWorkspacePath());
        }
        return config.getWorkspaceRoot();
    }

    /**
     * Sparse update of the device record. Only the keys present in
     * {@code changes} are sent; the cached copy is replaced by the backend's.
     */
    public Future<Device> updateDevice(JsonObject changes) {
        Device device = currentDevice;
        if (device == null) {
            return Future.failedFuture(new DeviceNotRegisteredException());
        }
        return client.updateDevice(device.getId(), changes)
            .onSuccess(updated -> currentDevice = updated);
    }

    /**
     * Moves {@code current_workspaces_count} by {@code delta}, never below zero.
     * Updates run one after another so concurrent adjustments are not lost.
     */
    public synchronized Future<Device> adjustWorkspaceCount(int delta) {
        Future<Device> next = countUpdates.transform(ignored -> {
            Device device = currentDevice;
            if (device == null) {
                return Future.failedFuture(new DeviceNotRegisteredException());
            }
            int count = Math.max(0, device.getCurrentWorkspacesCount() + delta);
            device.setCurrentWorkspacesCount(count);
            return updateDevice(new JsonObject().put("current_workspaces_count", count));
        });
        countUpdates = next;
        return next.onFailure(err -> logger.warn("Could not update workspace count: {}", err.getMessage()));
    }

    public Device currentDevice() {
        return currentDevice;
    }

    public boolean isRegistered() {
        return currentDevice != null;
    }

    public HeartbeatService getHeartbeatService() {
        return heartbeatService;
    }

    public void shutdown() {
        heartbeatService.stop();
    }
}
