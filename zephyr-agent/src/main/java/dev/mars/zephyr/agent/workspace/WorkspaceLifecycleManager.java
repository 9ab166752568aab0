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
import dev.mars.zephyr.agent.service.ExecutorApiClient.WorkspaceFilter;
import dev.mars.zephyr.core.exceptions.CapacityExceededException;
import dev.mars.zephyr.core.exceptions.InvalidTransitionException;
import dev.mars.zephyr.core.exceptions.WorkspaceNotFoundException;
import dev.mars.zephyr.core.exceptions.WorkspaceSetupException;
import dev.mars.zephyr.core.exceptions.ZephyrException;
import dev.mars.zephyr.device.Device;
import dev.mars.zephyr.process.CommandResult;
import dev.mars.zephyr.process.ProcessRunner;
import dev.mars.zephyr.storage.WorkspaceDescriptor;
import dev.mars.zephyr.storage.WorkspaceFileManager;
import dev.mars.zephyr.workspace.EventCategory;
import dev.mars.zephyr.workspace.EventLevel;
import dev.mars.zephyr.workspace.Workspace;
import dev.mars.zephyr.workspace.WorkspaceArtifact;
import dev.mars.zephyr.workspace.WorkspaceConfig;
import dev.mars.zephyr.workspace.WorkspaceEvent;
import dev.mars.zephyr.workspace.WorkspaceMetrics;
import dev.mars.zephyr.workspace.WorkspaceStatus;
import dev.mars.zephyr.workspace.WorkspaceTask;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Creates, sets up, tracks and tears down the workspaces of this device.
 *
 * <p>Every status change is sent to the backend first; the local copy is
 * replaced with the backend's answer only after that call succeeds. Changes
 * to one workspace are applied one at a time in the order they were requested,
 * and each one is checked against the {@link WorkspaceStatus} transition table
 * at the moment it runs.</p>
 *
 * <p>Setup (directories, clone, branch checkout) runs in the background after
 * {@link #createWorkspace(String, WorkspaceConfig)} returns. Filesystem work
 * and git/tar processes run on worker threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkspaceLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceLifecycleManager.class);

    static final String ARCHIVE_DIR = "archives";

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final ExecutorApiClient client;
    private final DeviceRegistry registry;
    private final ProcessRunner processRunner;

    private final Map<String, Workspace> active = new ConcurrentHashMap<>();
    private final Map<String, Future<Workspace>> pendingChanges = new ConcurrentHashMap<>();
    private final Map<String, List<Promise<Workspace>>> readyWaiters = new ConcurrentHashMap<>();
    private final List<Consumer<Workspace>> listeners = new CopyOnWriteArrayList<>();
    private int creationsInFlight;

    public WorkspaceLifecycleManager(Vertx vertx, AgentConfiguration config, ExecutorApiClient client,
                                     DeviceRegistry registry, ProcessRunner processRunner) {
        this.vertx = vertx;
        this.config = config;
        this.client = client;
        this.registry = registry;
        this.processRunner = processRunner;
    }

    // ---------------------------------------------------------------- creation

    /**
     * Creates a workspace record and starts its setup in the background.
     *
     * @param ownerId agent or task that owns the workspace
     * @param workspaceConfig repository, limits and optional explicit path
     * @return the workspace as created by the backend, in status {@code creating};
     *         failed with {@link CapacityExceededException} when the device has no free slot
     */
    public Future<Workspace> createWorkspace(String ownerId, WorkspaceConfig workspaceConfig) {
        return registry.ensureRegistered().compose(device -> {
            if (!reserveSlot(device)) {
                int inUse = device.getCurrentWorkspacesCount() + creationsInFlight();
                logger.warn("No available workspace slots on this device ({} of {} in use)",
                    inUse, device.getMaxConcurrentWorkspaces());
                return Future.failedFuture(new CapacityExceededException(device.getMaxConcurrentWorkspaces(), inUse));
            }
            WorkspaceConfig resolved = resolvePath(workspaceConfig);
            Workspace record = Workspace.fromConfig(device.getId(), ownerId, resolved);
            return client.createWorkspace(record)
                .compose(created -> {
                    active.put(created.getId(), created);
                    logger.info("Workspace {} created at {}", created.getId(), created.getWorkspacePath());
                    return registry.adjustWorkspaceCount(1).transform(ar -> Future.succeededFuture(created));
                })
                .onComplete(ar -> releaseSlot())
                .onSuccess(created -> {
                    emit(WorkspaceEvent.lifecycle(created.getId(), WorkspaceStatus.CREATING, "Workspace created"));
                    notifyListeners(created);
                    setUp(created.getId());
                });
        });
    }

    private synchronized boolean reserveSlot(Device device) {
        if (device.getAvailableSlots() - creationsInFlight <= 0) {
            return false;
        }
        creationsInFlight++;
        return true;
    }

    private synchronized void releaseSlot() {
        creationsInFlight--;
    }

    private synchronized int creationsInFlight() {
        return creationsInFlight;
    }

    private WorkspaceConfig resolvePath(WorkspaceConfig workspaceConfig) {
        Path root = registry.workspaceRoot();
        if (workspaceConfig.getWorkspacePath() != null && !workspaceConfig.getWorkspacePath().isBlank()) {
            Path path = Path.of(workspaceConfig.getWorkspacePath());
            String relative = path.startsWith(root) ? root.relativize(path).toString() : path.toString();
            return workspaceConfig.withPath(path.toString(), relative);
        }
        String name = "task-" + UUID.randomUUID() + "-" + fileTimestamp();
        return workspaceConfig.withPath(root.resolve(name).toString(), name);
    }

    static String fileTimestamp() {
        return Instant.now().toString().replace(':', '-');
    }

    // ---------------------------------------------------------------- setup

    private void setUp(String id) {
        transition(id, WorkspaceStatus.INITIALIZING, "Creating directories", 10, null)
            .compose(ws -> blocking(() -> {
                WorkspaceFileManager.createLayout(ws.getPath(),
                    new WorkspaceDescriptor(ws.getId(), ws.getCreatedAt(), ws.getRepoUrl(), ws.getRepoBranch()));
                return ws;
            }))
            .compose(ws -> updateProgress(id, "Directories created", 30))
            .compose(ws -> ws.hasRepository() ? cloneRepository(ws) : Future.succeededFuture(ws))
            .compose(ws -> updateStatus(id, WorkspaceStatus.READY, null))
            .onSuccess(ws -> logger.info("Workspace {} is ready", id))
            .onFailure(err -> {
                logger.error("Setup of workspace {} failed: {}", id, err.getMessage());
                markFailed(id, err.getMessage());
            });
    }

    private Future<Workspace> cloneRepository(Workspace ws) {
        String id = ws.getId();
        Path source = ws.getPath().resolve(WorkspaceFileManager.SOURCE_DIR);
        Future<Workspace> cloned = transition(id, WorkspaceStatus.CLONING, "Cloning repository", 40, null)
            .compose(w -> run(id, "clone", List.of("git", "clone", ws.getRepoUrl(), source.toString()),
                ws.getPath(), "Failed to clone repository: "))
            .compose(result -> updateProgress(id, "Repository cloned", 70));
        if (!ws.needsBranchCheckout()) {
            return cloned;
        }
        return cloned
            .compose(w -> updateProgress(id, "Checking out branch " + ws.getRepoBranch(), 80))
            .compose(w -> run(id, "checkout",
                List.of("git", "-C", source.toString(), "checkout", ws.getRepoBranch()),
                ws.getPath(), "Failed to checkout branch: " + ws.getRepoBranch() + ": "))
            .map(result -> active.get(id));
    }

    private Future<CommandResult> run(String id, String step, List<String> command, Path workingDir, String failurePrefix) {
        return blocking(() -> {
            logger.debug("Workspace {} {}: {}", id, step, command);
            CommandResult result = processRunner.run(command, workingDir, config.getProcessTimeout());
            if (!result.isSuccess()) {
                throw new WorkspaceSetupException(id, step, result.getExitCode(), failurePrefix + result.getOutput().trim());
            }
            return result;
        });
    }

    // ---------------------------------------------------------------- updates

    /**
     * Sparse progress update. The status is left as it is.
     */
    public Future<Workspace> updateProgress(String id, String phase, int percent) {
        return transition(id, null, phase, percent, null);
    }

    /**
     * Moves a workspace to {@code status}. {@code ready} also sets progress to
     * 100; a failure keeps the last progress.
     */
    public Future<Workspace> updateStatus(String id, WorkspaceStatus status, String errorMessage) {
        Integer progress = status == WorkspaceStatus.READY ? Integer.valueOf(100) : null;
        return transition(id, status, null, progress, errorMessage);
    }

    private Future<Workspace> transition(String id, WorkspaceStatus target, String phase, Integer progress, String error) {
        return enqueue(id, () -> {
            Workspace current = active.get(id);
            if (current == null) {
                return Future.failedFuture(new WorkspaceNotFoundException(id));
            }
            WorkspaceStatus from = current.getStatus();
            if (target != null && !from.canTransitionTo(target)) {
                return Future.failedFuture(new InvalidTransitionException(id, from, target, from.getValidTransitions()));
            }
            JsonObject changes = new JsonObject();
            if (target != null) {
                changes.put("status", target.getValue());
                timestampFor(target).ifPresent(field -> changes.put(field, Instant.now().toString()));
            }
            if (phase != null) {
                changes.put("current_phase", phase);
            }
            if (progress != null) {
                changes.put("progress_percentage", progress);
            }
            if (error != null) {
                changes.put("error_message", error);
            }
            return client.updateWorkspace(id, changes).map(updated -> {
                if (updated.getStatus() == WorkspaceStatus.ARCHIVED) {
                    active.remove(id);
                } else {
                    active.put(id, updated);
                }
                if (target != null) {
                    logger.info("Workspace {}: {} -> {}", id, from, target);
                    emit(WorkspaceEvent.lifecycle(id, target,
                        error != null ? error : "Workspace status: " + target.getValue()));
                    notifyListeners(updated);
                    settleWaiters(updated);
                } else {
                    logger.debug("Workspace {} progress {}% ({})", id, progress, phase);
                }
                return updated;
            });
        });
    }

    private static Optional<String> timestampFor(WorkspaceStatus status) {
        switch (status) {
            case INITIALIZING:
                return Optional.of("initialized_at");
            case READY:
                return Optional.of("ready_at");
            case ARCHIVED:
                return Optional.of("archived_at");
            default:
                return Optional.empty();
        }
    }

    private Future<Workspace> enqueue(String id, Supplier<Future<Workspace>> change) {
        synchronized (pendingChanges) {
            Future<Workspace> previous = pendingChanges.getOrDefault(id, Future.succeededFuture());
            Future<Workspace> next = previous.transform(ignored -> change.get());
            pendingChanges.put(id, next);
            return next;
        }
    }

    private Future<Workspace> markFailed(String id, String message) {
        Workspace current = active.get(id);
        if (current == null || !current.getStatus().canTransitionTo(WorkspaceStatus.FAILED)) {
            return Future.succeededFuture(current);
        }
        return updateStatus(id, WorkspaceStatus.FAILED, message)
            .onFailure(err -> logger.error("Could not mark workspace {} failed: {}", id, err.getMessage()));
    }

    // ---------------------------------------------------------------- tasks

    /**
     * Assigns a task to a ready workspace: the workspace task is created
     * remotely, then the workspace moves to {@code assigned}.
     */
    public Future<WorkspaceTask> assignTask(String workspaceId, String taskId, Map<String, Object> taskConfig) {
        Workspace current = active.get(workspaceId);
        if (current == null) {
            return Future.failedFuture(new WorkspaceNotFoundException(workspaceId));
        }
        if (!current.getStatus().canTransitionTo(WorkspaceStatus.ASSIGNED)) {
            return Future.failedFuture(new InvalidTransitionException(workspaceId, current.getStatus(),
                WorkspaceStatus.ASSIGNED, current.getStatus().getValidTransitions()));
        }
        return client.assignTask(workspaceId, taskId, taskConfig)
            .compose(task -> updateStatus(workspaceId, WorkspaceStatus.ASSIGNED, null).map(ws -> task))
            .onSuccess(task -> emit(WorkspaceEvent.task(workspaceId, "task_assigned", EventLevel.INFO,
                    "Task " + taskId + " assigned")
                .withWorkspaceTask(task.getId())));
    }

    /**
     * Completes when the workspace has finished setup; fails when setup failed
     * or the workspace was cleaned up first.
     */
    public Future<Workspace> awaitReady(String id) {
        synchronized (readyWaiters) {
            Workspace current = active.get(id);
            if (current == null) {
                return Future.failedFuture(new WorkspaceNotFoundException(id));
            }
            if (!current.getStatus().isSettingUp()) {
                return settledOutcome(current);
            }
            Promise<Workspace> promise = Promise.promise();
            readyWaiters.computeIfAbsent(id, k -> new ArrayList<>()).add(promise);
            return promise.future();
        }
    }

    private void settleWaiters(Workspace workspace) {
        if (workspace.getStatus().isSettingUp()) {
            return;
        }
        List<Promise<Workspace>> waiting;
        synchronized (readyWaiters) {
            waiting = readyWaiters.remove(workspace.getId());
        }
        if (waiting != null) {
            Future<Workspace> outcome = settledOutcome(workspace);
            waiting.forEach(p -> outcome.onComplete(ar -> {
                if (ar.succeeded()) {
                    p.complete(ar.result());
                } else {
                    p.fail(ar.cause());
                }
            }));
        }
    }

    private static Future<Workspace> settledOutcome(Workspace workspace) {
        switch (workspace.getStatus()) {
            case FAILED:
            case CLEANUP:
            case ARCHIVED:
                String reason = workspace.getErrorMessage() != null
                    ? workspace.getErrorMessage() : "workspace is " + workspace.getStatus();
                return Future.failedFuture(new WorkspaceSetupException(workspace.getId(), "setup", reason, null));
            default:
                return Future.succeededFuture(workspace);
        }
    }

    // ---------------------------------------------------------------- teardown

    /**
     * Moves the workspace through {@code cleanup} to {@code archived}, deleting
     * its directory on the way. A directory that is already gone is fine.
     */
    public Future<Void> cleanupWorkspace(String id) {
        Workspace current = active.get(id);
        if (current == null) {
            return Future.failedFuture(new WorkspaceNotFoundException(id));
        }
        Future<Workspace> inCleanup = current.getStatus() == WorkspaceStatus.CLEANUP
            ? Future.succeededFuture(current)
            : updateStatus(id, WorkspaceStatus.CLEANUP, null);
        Path root = registry.workspaceRoot();
        return inCleanup
            .compose(ws -> blocking(() -> {
                Path path = ws.getPath();
                if (path == null) {
                    return false;
                }
                if (!WorkspaceFileManager.isWithin(root, path)) {
                    throw new ZephyrException("Refusing to delete " + path + ": outside workspace root " + root);
                }
                return WorkspaceFileManager.deleteTree(path);
            }))
            .compose(deleted -> {
                logger.debug("Workspace {} directory deleted: {}", id, deleted);
                return updateStatus(id, WorkspaceStatus.ARCHIVED, null);
            })
            .compose(ws -> {
                pendingChanges.remove(id);
                logger.info("Workspace {} cleaned up", id);
                return registry.adjustWorkspaceCount(-1).<Void>transform(ar -> Future.succeededFuture());
            });
    }

    /**
     * Packs the workspace directory into {@code <root>/archives} and uploads
     * the archive as an artifact. A failed archive marks the workspace failed
     * unless it already completed; the error is returned either way.
     */
    public Future<WorkspaceArtifact> archiveWorkspace(String id) {
        Workspace current = active.get(id);
        if (current == null) {
            return Future.failedFuture(new WorkspaceNotFoundException(id));
        }
        Path archiveDir = registry.workspaceRoot().resolve(ARCHIVE_DIR);
        Path archive = archiveDir.resolve("workspace-" + id + "-" + fileTimestamp() + ".tar.gz");
        return this.<WorkspaceArtifact>blocking(() -> {
                WorkspaceFileManager.ensureDirectoryExists(archiveDir);
                CommandResult result = processRunner.run(
                    List.of("tar", "-czf", archive.toString(), "-C", current.getWorkspacePath(), "."),
                    archiveDir, config.getProcessTimeout());
                if (!result.isSuccess() || !Files.exists(archive)) {
                    throw new WorkspaceSetupException(id, "archive", result.getExitCode(),
                        "Failed to create workspace archive: " + result.getOutput().trim());
                }
                return WorkspaceArtifact.archiveOf(id, archive, Files.size(archive));
            })
            .compose(client::uploadArtifact)
            .onSuccess(artifact -> {
                logger.info("Workspace {} archived to {}", id, archive);
                emit(WorkspaceEvent.of(id, "archive_created", EventCategory.RESOURCE,
                    EventLevel.INFO, "Workspace archive created").withDetail("file_path", archive.toString()));
            })
            .recover(err -> {
                logger.error("Archiving workspace {} failed: {}", id, err.getMessage());
                return markFailed(id, err.getMessage()).<WorkspaceArtifact>transform(ignored -> Future.failedFuture(err));
            });
    }

    // ---------------------------------------------------------------- queries

    /**
     * Reloads this device's workspaces from the backend, skipping those in
     * cleanup or archived.
     */
    public Future<List<Workspace>> refreshActiveWorkspaces() {
        return registry.ensureRegistered()
            .compose(device -> client.listWorkspaces(WorkspaceFilter.forDevice(device.getId())))
            .map(all -> {
                List<Workspace> live = all.stream()
                    .filter(ws -> ws.getStatus().isActive())
                    .collect(Collectors.toList());
                live.forEach(ws -> active.put(ws.getId(), ws));
                logger.info("Loaded {} active workspaces ({} listed)", live.size(), all.size());
                return live;
            });
    }

    /**
     * Measures the workspace tree and posts a snapshot metrics record.
     */
    public Future<WorkspaceMetrics> recordUsage(String id) {
        Workspace current = active.get(id);
        if (current == null) {
            return Future.failedFuture(new WorkspaceNotFoundException(id));
        }
        return blocking(() -> WorkspaceFileManager.measure(current.getPath()))
            .compose(usage -> {
                current.setDiskUsageBytes(usage.getBytes());
                current.setFileCount(usage.getFileCount());
                WorkspaceMetrics metrics = WorkspaceMetrics.snapshot(id, usage.getBytes(), usage.getFileCount());
                return client.recordMetrics(metrics).map(v -> metrics);
            });
    }

    public Workspace getWorkspace(String id) {
        return active.get(id);
    }

    public List<Workspace> getActiveWorkspaces() {
        return List.copyOf(active.values());
    }

    public int getActiveCount() {
        return active.size();
    }

    /**
     * Registers a callback for every status change of any workspace.
     */
    public void addListener(Consumer<Workspace> listener) {
        listeners.add(listener);
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Sends a workspace event. Delivery failures are logged and dropped.
     */
    public void emit(WorkspaceEvent event) {
        client.logEvent(event)
            .onFailure(err -> logger.warn("Could not deliver {} event for workspace {}: {}",
                event.getEventType(), event.getWorkspaceId(), err.getMessage()));
    }

    private void notifyListeners(Workspace workspace) {
        for (Consumer<Workspace> listener : listeners) {
            try {
                listener.accept(workspace);
            } catch (RuntimeException e) {
                logger.warn("Workspace listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private <T> Future<T> blocking(Callable<T> work) {
        return vertx.executeBlocking(work, false);
    }
}
