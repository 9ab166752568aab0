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

import dev.mars.zephyr.agent.support.FakeExecutorBackend;
import dev.mars.zephyr.agent.support.TestConfigurations;
import dev.mars.zephyr.core.exceptions.RemoteServiceException;
import dev.mars.zephyr.core.exceptions.UnauthorizedException;
import dev.mars.zephyr.device.Device;
import dev.mars.zephyr.device.DeviceStatus;
import dev.mars.zephyr.workspace.EventLevel;
import dev.mars.zephyr.workspace.Workspace;
import dev.mars.zephyr.workspace.WorkspaceConfig;
import dev.mars.zephyr.workspace.WorkspaceEvent;
import dev.mars.zephyr.workspace.WorkspaceStatus;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutorApiClient.
 * Uses real HTTP server (no mocking) following project testing principles.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ExecutorApiClientTest {

    private FakeExecutorBackend backend;
    private ExecutorApiClient client;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        backend = new FakeExecutorBackend(vertx);
        backend.start().onComplete(testContext.succeeding(port -> {
            client = new ExecutorApiClient(vertx, TestConfigurations.forBackend(backend, Path.of("build", "api")).build());
            testContext.completeNow();
        }));
    }

    @BeforeEach
    void resetBackend() {
        backend.reset();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        client.shutdown();
        backend.stop().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("Should register, list and update a device")
    void testDeviceRoundTrip(VertxTestContext testContext) {
        Device device = new Device("machine-1", "laptop");
        device.setPlatform("linux");
        device.setStatus(DeviceStatus.ACTIVE);

        client.registerDevice(device)
            .compose(registered -> {
                testContext.verify(() -> {
                    assertNotNull(registered.getId());
                    assertEquals("machine-1", registered.getDeviceId());
                    assertEquals("linux", backend.devices.get(registered.getId()).getString("platform"));
                });
                return client.updateDevice(registered.getId(), new JsonObject().put("current_workspaces_count", 2));
            })
            .compose(updated -> client.listDevices(null, null))
            .onComplete(testContext.succeeding(devices -> testContext.verify(() -> {
                assertEquals(1, devices.size());
                assertEquals(2, devices.get(0).getCurrentWorkspacesCount());
                assertEquals("laptop", devices.get(0).getDeviceName());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should fetch a device and delete a workspace by id")
    void testGetDeviceAndDeleteWorkspace(VertxTestContext testContext) {
        backend.devices.put("dev-7", new JsonObject().put("id", "dev-7").put("device_id", "machine-7")
            .put("device_name", "build-box").put("max_concurrent_workspaces", 3));
        backend.workspaces.put("ws-gone", new JsonObject().put("id", "ws-gone").put("status", "archived"));

        client.getDevice("dev-7")
            .compose(device -> {
                testContext.verify(() -> {
                    assertEquals("machine-7", device.getDeviceId());
                    assertEquals(3, device.getMaxConcurrentWorkspaces());
                });
                return client.deleteWorkspace("ws-gone");
            })
            .onComplete(testContext.succeeding(v -> testContext.verify(() -> {
                assertFalse(backend.workspaces.containsKey("ws-gone"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should send only the changed fields on a sparse update")
    void testSparseWorkspaceUpdate(VertxTestContext testContext) {
        Workspace workspace = Workspace.fromConfig("dev-1", "agent-1",
            WorkspaceConfig.empty().withPath("/tmp/ws", "ws"));

        client.createWorkspace(workspace)
            .compose(created -> client.updateWorkspace(created.getId(),
                new JsonObject().put("status", "initializing").put("progress_percentage", 10)))
            .onComplete(testContext.succeeding(updated -> testContext.verify(() -> {
                assertEquals(WorkspaceStatus.INITIALIZING, updated.getStatus());
                assertEquals(10, updated.getProgressPercentage());
                JsonObject changes = backend.workspaceUpdates.get(0).getJsonObject("changes");
                assertEquals(2, changes.size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should filter workspaces by device")
    void testListWorkspacesForDevice(VertxTestContext testContext) {
        backend.workspaces.put("ws-a", new JsonObject().put("id", "ws-a").put("executor_device_id", "dev-1").put("status", "ready"));
        backend.workspaces.put("ws-b", new JsonObject().put("id", "ws-b").put("executor_device_id", "dev-2").put("status", "ready"));

        client.listWorkspaces(ExecutorApiClient.WorkspaceFilter.forDevice("dev-1"))
            .onComplete(testContext.succeeding(list -> testContext.verify(() -> {
                assertEquals(1, list.size());
                assertEquals("ws-a", list.get(0).getId());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Should report a missing workspace as not found")
    void testWorkspaceNotFound(VertxTestContext testContext) {
        client.getWorkspace("missing").onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(RemoteServiceException.class, err);
            assertTrue(((RemoteServiceException) err).isNotFound());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Should post workspace events with snake_case fields")
    void testLogEvent(VertxTestContext testContext) {
        WorkspaceEvent event = WorkspaceEvent.task("ws-1", "task_started", EventLevel.INFO, "started")
            .withWorkspaceTask("wt-1");

        client.logEvent(event).onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            JsonObject posted = backend.events.get(0);
            assertEquals("ws-1", posted.getString("workspace_id"));
            assertEquals("wt-1", posted.getString("workspace_task_id"));
            assertEquals("task", posted.getString("event_category"));
            assertEquals("info", posted.getString("level"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Should map heartbeat rejections")
    void testHeartbeatErrors(VertxTestContext testContext) {
        backend.failWith("heartbeat", 401, 1);

        client.sendDeviceHeartbeat("dev-1")
            .recover(err -> {
                testContext.verify(() -> assertInstanceOf(UnauthorizedException.class, err));
                return client.sendDeviceHeartbeat("dev-1");
            })
            .onComplete(testContext.succeeding(v -> testContext.verify(() -> {
                assertEquals(1, backend.heartbeats.get());
                testContext.completeNow();
            })));
    }
}
