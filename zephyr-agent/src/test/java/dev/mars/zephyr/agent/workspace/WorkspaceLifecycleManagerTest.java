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

package dev.mars.zephyr.agent.workspace;

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.agent.device.DeviceRegistry;
import dev.mars.zephyr.agent.service.ExecutorApiClient;
import dev.mars.zephyr.agent.support.FakeExecutorBackend;
import dev.mars.zephyr.agent.support.RecordingProcessRunner;
import dev.mars.zephyr.agent.support.TestConfigurations;
import dev.mars.zephyr.core.exceptions.CapacityExceededException;
import dev.mars.zephyr.core.exceptions.InvalidTransitionException;
import dev.mars.zephyr.core.exceptions.WorkspaceSetupException;
import dev.mars.zephyr.process.CommandResult;
import dev.mars.zephyr.storage.WorkspaceFileManager;
import dev.mars.zephyr.workspace.Workspace;
import dev.mars.zephyr.workspace.WorkspaceConfig;
import dev.mars.zephyr.workspace.WorkspaceStatus;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkspaceLifecycleManager: setup, failure, capacity, cleanup and
 * archiving, against an in-memory backend and a recording process runner.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WorkspaceLifecycleManagerTest {

    private static final String REPO = "https://example.com/acme/app.git";

    private FakeExecutorBackend backend;
    private RecordingProcessRunner runner;
    private DeviceRegistry registry;
    private WorkspaceLifecycleManager manager;
    private Path root;

    @TempDir
    Path tempDir;

    @BeforeAll
    void startBackend(Vertx vertx, VertxTestContext testContext) {
        backend = new FakeExecutorBackend(vertx);
        backend.start().onComplete(testContext.succeedingThenComplete());
    }

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        backend.reset();
        root = Files.createTempDirectory(tempDir, "root");
        runner = new RecordingProcessRunner();
        AgentConfiguration config = TestConfigurations.forBackend(backend, root).build();
        ExecutorApiClient client = new ExecutorApiClient(vertx, config);
        registry = new DeviceRegistry(vertx, config, client);
        manager = new WorkspaceLifecycleManager(vertx, config, client, registry, runner);
    }

    @AfterEach
    void stopHeartbeat() {
        registry.shutdown();
    }

    @AfterAll
    void stopBackend(VertxTestContext testContext) {
        backend.stop().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("Workspace without a repository skips cloning and becomes ready")
    void testSetupWithoutRepository(VertxTestContext testContext) {
        List<Workspace> changes = new CopyOnWriteArrayList<>();
        manager.addListener(changes::add);

        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> {
                testContext.verify(() -> {
                    assertEquals(WorkspaceStatus.CREATING, created.getStatus());
                    assertTrue(created.getPath().startsWith(root));
                    assertTrue(created.getRelativePath().startsWith("task-"));
                });
                return manager.awaitReady(created.getId());
            })
            .onComplete(testContext.succeeding(ready -> {
                testContext.verify(() -> {
                    assertEquals(WorkspaceStatus.READY, ready.getStatus());
                    assertEquals(100, ready.getProgressPercentage());
                    assertEquals(List.of("initializing", "ready"), backend.statusUpdatesFor(ready.getId()));
                    assertTrue(runner.commandsFor("git").isEmpty(), "No git command without a repository");
                    for (String dir : WorkspaceFileManager.LAYOUT) {
                        assertTrue(Files.isDirectory(ready.getPath().resolve(dir)), dir);
                    }
                    assertEquals(ready.getId(), WorkspaceFileManager.readDescriptor(ready.getPath()).getWorkspaceId());
                    assertEquals(1, registry.currentDevice().getCurrentWorkspacesCount());
                    assertEquals(WorkspaceStatus.CREATING, changes.get(0).getStatus());
                    assertEquals(WorkspaceStatus.READY, changes.get(changes.size() - 1).getStatus());
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Workspace on the default branch clones without checkout")
    void testSetupWithRepository(VertxTestContext testContext) {
        WorkspaceConfig config = new WorkspaceConfig.Builder().repositoryUrl(REPO).build();

        manager.createWorkspace("agent-1", config)
            .compose(created -> manager.awaitReady(created.getId()))
            .onComplete(testContext.succeeding(ready -> {
                testContext.verify(() -> {
                    assertEquals(List.of("initializing", "cloning", "ready"), backend.statusUpdatesFor(ready.getId()));
                    List<List<String>> git = runner.commandsFor("git");
                    assertEquals(1, git.size());
                    assertEquals(List.of("git", "clone", REPO, ready.getPath().resolve("src").toString()), git.get(0));
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Feature branch is checked out after cloning")
    void testSetupChecksOutBranch(VertxTestContext testContext) {
        WorkspaceConfig config = new WorkspaceConfig.Builder().repositoryUrl(REPO).repositoryBranch("feature/x").build();

        manager.createWorkspace("agent-1", config)
            .compose(created -> manager.awaitReady(created.getId()))
            .onComplete(testContext.succeeding(ready -> {
                testContext.verify(() -> {
                    List<List<String>> git = runner.commandsFor("git");
                    assertEquals(2, git.size());
                    assertEquals(List.of("git", "-C", ready.getPath().resolve("src").toString(), "checkout", "feature/x"),
                        git.get(1));
                    List<Integer> progress = backend.workspaceUpdates.stream()
                        .filter(u -> ready.getId().equals(u.getString("id")))
                        .map(u -> u.getJsonObject("changes").getInteger("progress_percentage"))
                        .filter(p -> p != null)
                        .collect(Collectors.toList());
                    assertEquals(List.of(10, 30, 40, 70, 80, 100), progress);
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Clone failure marks the workspace failed with the git output")
    void testCloneFailure(VertxTestContext testContext) {
        Checkpoint setupFailed = testContext.checkpoint();
        Checkpoint eventLogged = testContext.checkpoint();
        runner.respond("git clone", new CommandResult(128, "fatal: repository not found\n"));
        WorkspaceConfig config = new WorkspaceConfig.Builder().repositoryUrl(REPO).build();

        manager.createWorkspace("agent-1", config)
            .compose(created -> manager.awaitReady(created.getId()))
            .onComplete(testContext.failing(err -> {
                testContext.verify(() -> {
                    assertInstanceOf(WorkspaceSetupException.class, err);
                    assertEquals("Failed to clone repository: fatal: repository not found", err.getMessage());
                    Workspace failed = manager.getActiveWorkspaces().get(0);
                    assertEquals(WorkspaceStatus.FAILED, failed.getStatus());
                    assertEquals(40, failed.getProgressPercentage(), "Progress should stay where it failed");
                    assertEquals(List.of("initializing", "cloning", "failed"), backend.statusUpdatesFor(failed.getId()));
                });
                setupFailed.flag();
            }));

        await().atMost(5, TimeUnit.SECONDS).until(() -> backend.events.stream()
            .anyMatch(e -> "status_failed".equals(e.getString("event_type")) && "error".equals(e.getString("level"))));
        eventLogged.flag();
    }

    @Test
    @DisplayName("No free slot fails with CapacityExceededException and creates nothing")
    void testCapacityExceeded(VertxTestContext testContext) {
        backend.addDevice("test-machine-id", 1, 1);

        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .onComplete(testContext.failing(err -> {
                testContext.verify(() -> {
                    assertInstanceOf(CapacityExceededException.class, err);
                    assertTrue(backend.workspaces.isEmpty(), "No workspace record should be created");
                    assertEquals(0, manager.getActiveCount());
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Cleanup deletes the directory and archives the record")
    void testCleanup(VertxTestContext testContext) {
        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.cleanupWorkspace(ready.getId()).map(v -> ready))
            .onComplete(testContext.succeeding(ws -> {
                testContext.verify(() -> {
                    assertFalse(Files.exists(ws.getPath()), "Workspace directory should be deleted");
                    assertEquals(List.of("initializing", "ready", "cleanup", "archived"), backend.statusUpdatesFor(ws.getId()));
                    assertNull(manager.getWorkspace(ws.getId()));
                    assertEquals(0, registry.currentDevice().getCurrentWorkspacesCount());
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Archive packs the workspace and uploads an artifact")
    void testArchive(VertxTestContext testContext) {
        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.archiveWorkspace(ready.getId()))
            .onComplete(testContext.succeeding(artifact -> {
                testContext.verify(() -> {
                    List<String> tar = runner.commandsFor("tar").get(0);
                    assertEquals("-czf", tar.get(1));
                    Path archive = Path.of(tar.get(2));
                    assertEquals(root.resolve("archives"), archive.getParent());
                    assertTrue(archive.getFileName().toString().matches("workspace-ws-\\d+-.*\\.tar\\.gz"));
                    assertFalse(archive.getFileName().toString().contains(":"));

                    JsonObject uploaded = backend.artifacts.get(0);
                    assertEquals("other", uploaded.getString("artifact_type"));
                    assertEquals("application/gzip", uploaded.getString("mime_type"));
                    assertEquals("reference", uploaded.getString("storage_type"));
                    assertEquals(List.of("archive", "workspace"), uploaded.getJsonArray("tags").getList());
                    assertEquals(4L, artifact.getFileSizeBytes());
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("A failed archive marks the workspace failed and returns the error")
    void testArchiveFailure(VertxTestContext testContext) {
        runner.respond("tar", new CommandResult(2, "tar: write error"));

        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.archiveWorkspace(ready.getId()))
            .onComplete(testContext.failing(err -> {
                testContext.verify(() -> {
                    assertTrue(err.getMessage().startsWith("Failed to create workspace archive"));
                    assertEquals(WorkspaceStatus.FAILED, manager.getActiveWorkspaces().get(0).getStatus());
                    assertTrue(backend.artifacts.isEmpty());
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("A failed archive leaves a completed workspace completed")
    void testArchiveFailureAfterCompletion(VertxTestContext testContext) {
        runner.respond("tar", new CommandResult(2, "tar: write error"));

        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.assignTask(ready.getId(), "t1", Map.of()).map(task -> ready))
            .compose(ws -> manager.updateStatus(ws.getId(), WorkspaceStatus.RUNNING, null))
            .compose(ws -> manager.updateStatus(ws.getId(), WorkspaceStatus.COMPLETED, null))
            .compose(done -> manager.archiveWorkspace(done.getId()))
            .onComplete(testContext.failing(err -> {
                testContext.verify(() -> {
                    assertTrue(err.getMessage().startsWith("Failed to create workspace archive"));
                    Workspace ws = manager.getActiveWorkspaces().get(0);
                    assertEquals(WorkspaceStatus.COMPLETED, ws.getStatus());
                    assertFalse(backend.statusUpdatesFor(ws.getId()).contains("failed"));
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Archive then cleanup keeps the archive and removes the workspace directory")
    void testArchiveThenCleanup(VertxTestContext testContext) {
        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.archiveWorkspace(ready.getId())
                .compose(artifact -> manager.cleanupWorkspace(ready.getId()).map(v -> ready)))
            .onComplete(testContext.succeeding(ws -> {
                testContext.verify(() -> {
                    assertFalse(Files.exists(ws.getPath()), "Workspace directory should be deleted");
                    assertEquals(1, backend.artifacts.size());
                    Path archive = Path.of(backend.artifacts.get(0).getString("file_path"));
                    assertEquals(Path.of(runner.commandsFor("tar").get(0).get(2)), archive);
                    assertTrue(Files.exists(archive), "Archive should survive cleanup");
                    assertEquals(List.of("initializing", "ready", "cleanup", "archived"),
                        backend.statusUpdatesFor(ws.getId()));
                    assertEquals(0, registry.currentDevice().getCurrentWorkspacesCount());
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Invalid transitions are rejected before reaching the backend")
    void testInvalidTransition(VertxTestContext testContext) {
        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.updateStatus(ready.getId(), WorkspaceStatus.PAUSED, null))
            .onComplete(testContext.failing(err -> {
                testContext.verify(() -> {
                    assertInstanceOf(InvalidTransitionException.class, err);
                    String id = manager.getActiveWorkspaces().get(0).getId();
                    assertEquals(List.of("initializing", "ready"), backend.statusUpdatesFor(id));
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Assigning a task moves a ready workspace to assigned")
    void testAssignTask(VertxTestContext testContext) {
        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> manager.assignTask(ready.getId(), "task-42", Map.of("priority", "high")))
            .onComplete(testContext.succeeding(task -> {
                testContext.verify(() -> {
                    assertEquals("task-42", task.getAiTaskId());
                    assertEquals(WorkspaceStatus.ASSIGNED, manager.getWorkspace(task.getWorkspaceId()).getStatus());
                    assertEquals("high", backend.assignedTasks.get(0).getJsonObject("config").getString("priority"));
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Refresh keeps only workspaces that are not cleaned up or archived")
    void testRefreshActiveWorkspaces(VertxTestContext testContext) {
        registry.ensureRegistered()
            .compose(device -> {
                String deviceId = device.getId();
                backend.workspaces.put("ws-a", new JsonObject().put("id", "ws-a").put("executor_device_id", deviceId).put("status", "ready"));
                backend.workspaces.put("ws-b", new JsonObject().put("id", "ws-b").put("executor_device_id", deviceId).put("status", "archived"));
                backend.workspaces.put("ws-c", new JsonObject().put("id", "ws-c").put("executor_device_id", deviceId).put("status", "cleanup"));
                backend.workspaces.put("ws-d", new JsonObject().put("id", "ws-d").put("executor_device_id", "other").put("status", "ready"));
                return manager.refreshActiveWorkspaces();
            })
            .onComplete(testContext.succeeding(live -> {
                testContext.verify(() -> {
                    assertEquals(1, live.size());
                    assertEquals("ws-a", live.get(0).getId());
                    assertNotNull(manager.getWorkspace("ws-a"));
                });
                testContext.completeNow();
            }));
    }

    @Test
    @DisplayName("Usage snapshot measures the tree and posts metrics")
    void testRecordUsage(VertxTestContext testContext) {
        manager.createWorkspace("agent-1", WorkspaceConfig.empty())
            .compose(created -> manager.awaitReady(created.getId()))
            .compose(ready -> {
                try {
                    Files.writeString(ready.getPath().resolve("output").resolve("result.txt"), "hello");
                } catch (IOException e) {
                    return Future.failedFuture(e);
                }
                return manager.recordUsage(ready.getId());
            })
            .onComplete(testContext.succeeding(metrics -> {
                testContext.verify(() -> {
                    assertTrue(metrics.getDiskUsageBytes() >= 5);
                    assertTrue(metrics.getFileCount() >= 2, "descriptor and result file");
                    assertEquals("snapshot", backend.metrics.get(0).getString("metric_type"));
                });
                testContext.completeNow();
            }));
    }
}
