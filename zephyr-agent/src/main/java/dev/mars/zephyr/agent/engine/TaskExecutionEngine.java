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

package dev.mars.zephyr.agent.engine;

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.agent.provider.CapabilityProvider;
import dev.mars.zephyr.agent.scheduler.PeriodicTicker;
import dev.mars.zephyr.agent.service.TaskQueueClient;
import dev.mars.zephyr.agent.workspace.WorkspaceLifecycleManager;
import dev.mars.zephyr.core.Task;
import dev.mars.zephyr.core.TaskResult;
import dev.mars.zephyr.core.TaskStatus;
import dev.mars.zephyr.core.exceptions.RemoteServiceException;
import dev.mars.zephyr.core.exceptions.UnauthorizedException;
import dev.mars.zephyr.workspace.EventLevel;
import dev.mars.zephyr.workspace.Workspace;
import dev.mars.zephyr.workspace.WorkspaceConfig;
import dev.mars.zephyr.workspace.WorkspaceEvent;
import dev.mars.zephyr.workspace.WorkspaceStatus;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Polls the task queue, claims tasks up to the concurrency limit and drives
 * each claimed task through accept, execution and the final report.
 *
 * <p>A claimed task runs independently of the poll loop. Every task that got
 * past accept ends with exactly one report: complete, or fail. A 401 from any
 * backend call signs the engine out; nothing is reported after that.</p>
 *
 * <p>Fail reports that could not be delivered are kept and retried at the
 * start of later poll ticks, up to the configured number of attempts.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class TaskExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(TaskExecutionEngine.class);

    static final int RECENT_TASK_LIMIT = 10;
    static final String REPO_URL_KEY = "repo_url";
    static final String REPO_BRANCH_KEY = "repo_branch";

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final TaskQueueClient queue;
    private final CapabilityProvider provider;
    private final WorkspaceLifecycleManager workspaces;

    private final AtomicReference<EngineStatus> status = new AtomicReference<>(EngineStatus.IDLE);
    private final Map<String, Task> activeTasks = new ConcurrentHashMap<>();
    private final Deque<Task> recentTasks = new ArrayDeque<>();
    private final Map<String, UndeliveredFailure> undelivered = new ConcurrentHashMap<>();
    private final List<ExecutorListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean pollInFlight = new AtomicBoolean(false);

    private final AtomicLong totalTasks = new AtomicLong();
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();
    private final AtomicLong totalTokens = new AtomicLong();
    private final DoubleAdder totalCost = new DoubleAdder();

    private volatile Instant lastSyncTime;
    private PeriodicTicker pollTicker;

    /**
     * @param workspaces null when tasks never get a workspace of their own
     */
    public TaskExecutionEngine(Vertx vertx, AgentConfiguration config, TaskQueueClient queue,
                               CapabilityProvider provider, WorkspaceLifecycleManager workspaces) {
        this.vertx = vertx;
        this.config = config;
        this.queue = queue;
        this.provider = provider;
        this.workspaces = workspaces;
    }

    // ---------------------------------------------------------------- control

    /**
     * Starts polling: one poll now, then one per polling interval.
     *
     * @throws IllegalStateException after a sign-out
     */
    public synchronized void start() {
        EngineStatus current = status.get();
        if (current == EngineStatus.SIGNED_OUT) {
            throw new IllegalStateException("Engine was signed out and cannot be restarted");
        }
        if (current == EngineStatus.RUNNING) {
            return;
        }
        changeStatus(EngineStatus.RUNNING);
        pollTicker = new PeriodicTicker(vertx, "task-poll", config.getPollingIntervalSeconds() * 1000L, true, this::poll);
        pollTicker.start();
        logger.info("Task engine started (agent={}, provider={}, maxConcurrent={})",
            config.getAgentName(), provider.getName(), config.getMaxConcurrentTasks());
    }

    /**
     * Stops polling. Tasks already claimed run to completion and are reported.
     */
    public synchronized void stop() {
        cancelTicker();
        if (status.get() != EngineStatus.SIGNED_OUT) {
            changeStatus(EngineStatus.IDLE);
        }
        logger.info("Task engine stopped ({} tasks still in flight)", activeTasks.size());
    }

    /**
     * Stops claiming new tasks; in-flight tasks carry on.
     */
    public void pause() {
        if (status.compareAndSet(EngineStatus.RUNNING, EngineStatus.PAUSED)) {
            logger.info("Task engine paused");
            notifyStatus(EngineStatus.RUNNING, EngineStatus.PAUSED);
        }
    }

    public void resume() {
        if (status.compareAndSet(EngineStatus.PAUSED, EngineStatus.RUNNING)) {
            logger.info("Task engine resumed");
            notifyStatus(EngineStatus.PAUSED, EngineStatus.RUNNING);
        }
    }

    /**
     * Stops polling because a required service is unreachable. {@link #start()}
     * may be called again later.
     */
    public synchronized void fail(String reason) {
        if (status.get() == EngineStatus.SIGNED_OUT) {
            return;
        }
        cancelTicker();
        changeStatus(EngineStatus.ERROR);
        logger.error("Task engine error: {}", reason);
    }

    /**
     * Stops the engine for good after the backend rejected the credentials.
     */
    public void signOut(String reason) {
        EngineStatus previous = status.getAndSet(EngineStatus.SIGNED_OUT);
        if (previous == EngineStatus.SIGNED_OUT) {
            return;
        }
        synchronized (this) {
            cancelTicker();
        }
        logger.error("Signed out: {}", reason);
        notifyStatus(previous, EngineStatus.SIGNED_OUT);
        for (ExecutorListener listener : listeners) {
            try {
                listener.onSignedOut(reason);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on sign-out: {}", e.getMessage(), e);
            }
        }
    }

    private void cancelTicker() {
        if (pollTicker != null) {
            pollTicker.cancel();
            pollTicker = null;
        }
    }

    // ---------------------------------------------------------------- polling

    /**
     * One poll tick: retries undelivered fail reports, fetches pending tasks
     * and claims as many as there are free slots. Skipped while a previous
     * tick is still in flight.
     *
     * @return the tasks claimed by this tick
     */
    public Future<List<Task>> poll() {
        if (!status.get().isClaiming()) {
            return Future.succeededFuture(Collections.emptyList());
        }
        if (!pollInFlight.compareAndSet(false, true)) {
            logger.debug("Previous poll still running, skipping tick");
            return Future.succeededFuture(Collections.emptyList());
        }
        return retryUndeliveredFailures()
            .compose(v -> queue.pollPendingTasks())
            .map(tasks -> {
                lastSyncTime = Instant.now();
                List<Task> claimed = new ArrayList<>();
                for (Task task : tasks) {
                    if (claim(task)) {
                        claimed.add(task);
                    }
                }
                if (!tasks.isEmpty()) {
                    logger.info("Polled {} pending tasks, claimed {}", tasks.size(), claimed.size());
                }
                for (ExecutorListener listener : listeners) {
                    try {
                        listener.onPoll(tasks.size(), claimed.size());
                    } catch (RuntimeException e) {
                        logger.warn("Listener failed on poll: {}", e.getMessage(), e);
                    }
                }
                return claimed;
            })
            .recover(err -> {
                if (err instanceof UnauthorizedException) {
                    signOut("Task queue rejected the API token");
                } else {
                    logger.warn("Polling for tasks failed: {}", err.getMessage());
                }
                return Future.succeededFuture(Collections.<Task>emptyList());
            })
            .onComplete(ar -> pollInFlight.set(false));
    }

    /**
     * Takes a slot for the task and starts its lifecycle.
     *
     * @return false when the engine is not claiming, all slots are taken, or
     *         the task is already in flight
     */
    synchronized boolean claim(Task task) {
        if (!status.get().isClaiming()) {
            return false;
        }
        if (activeTasks.size() >= config.getMaxConcurrentTasks()) {
            logger.debug("All {} task slots busy, leaving {} pending", config.getMaxConcurrentTasks(), task.getId());
            return false;
        }
        if (activeTasks.putIfAbsent(task.getId(), task) != null) {
            return false;
        }
        totalTasks.incrementAndGet();
        logger.info("Claimed task {}: {}", task.getId(), abbreviate(task.getDescription()));
        runTask(task);
        return true;
    }

    // ---------------------------------------------------------------- lifecycle

    private Future<Task> runTask(Task task) {
        String id = task.getId();
        return queue.acceptTask(id)
            .transform(accepted -> {
                if (accepted.failed()) {
                    return acceptFailed(task, accepted.cause());
                }
                Task acceptedTask = transition(task, TaskStatus.ACCEPTED);
                return queue.updateTaskStatus(id, TaskStatus.RUNNING, 0)
                    .map(v -> transition(current(id, acceptedTask), TaskStatus.RUNNING))
                    .compose(this::execute)
                    .compose(done -> queue.completeTask(id, done.getResult()).map(v -> finishCompleted(done)))
                    .recover(err -> finishFailed(current(id, acceptedTask), err));
            })
            .onComplete(ar -> release(id, ar));
    }

    private Future<Task> acceptFailed(Task task, Throwable err) {
        if (err instanceof UnauthorizedException) {
            signOut("Task queue rejected the API token on accept");
        } else {
            logger.warn("Could not accept task {}, leaving it pending: {}", task.getId(), err.getMessage());
        }
        totalTasks.decrementAndGet();
        return Future.failedFuture(err);
    }

    private Future<Task> execute(Task running) {
        if (workspaces == null || !config.isWorkspacePerTask()) {
            return invoke(running, running.getContext());
        }
        Map<String, Object> context = running.getContext();
        WorkspaceConfig workspaceConfig = new WorkspaceConfig.Builder()
            .projectName("task-" + running.getId())
            .repositoryUrl(stringValue(context.get(REPO_URL_KEY)))
            .repositoryBranch(stringValue(context.get(REPO_BRANCH_KEY)))
            .build();
        return workspaces.createWorkspace(config.getAgentName(), workspaceConfig)
            .compose(created -> workspaces.awaitReady(created.getId())
                .compose(ws -> workspaces.assignTask(ws.getId(), running.getId(), context).map(assigned -> ws))
                .compose(ws -> workspaces.updateStatus(ws.getId(), WorkspaceStatus.RUNNING, null))
                .compose(ws -> runInWorkspace(running, ws))
                .transform(outcome -> tearDown(created.getId())
                    .transform(ignored -> outcome.succeeded()
                        ? Future.succeededFuture(outcome.result())
                        : Future.<Task>failedFuture(outcome.cause()))));
    }

    /**
     * Releases the task's workspace slot, archiving the tree first when
     * configured. Never fails.
     */
    private Future<Void> tearDown(String workspaceId) {
        Future<Void> archived = config.isArchiveWorkspaces()
            ? workspaces.archiveWorkspace(workspaceId)
                .<Void>transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Could not archive workspace {}: {}", workspaceId, ar.cause().getMessage());
                    }
                    return Future.succeededFuture();
                })
            : Future.succeededFuture();
        return archived
            .compose(v -> workspaces.cleanupWorkspace(workspaceId))
            .<Void>transform(ar -> {
                if (ar.failed()) {
                    logger.warn("Could not clean up workspace {}: {}", workspaceId, ar.cause().getMessage());
                } else {
                    logger.debug("Workspace {} released", workspaceId);
                }
                return Future.succeededFuture();
            });
    }

    private Future<Task> runInWorkspace(Task running, Workspace workspace) {
        Task bound = running.withWorkspace(workspace.getId());
        activeTasks.put(bound.getId(), bound);
        Map<String, Object> context = new LinkedHashMap<>(running.getContext());
        context.put(CapabilityProvider.WORKSPACE_PATH, workspace.getWorkspacePath());
        return invoke(bound, context).transform(ar -> {
            WorkspaceStatus outcome = ar.succeeded() ? WorkspaceStatus.COMPLETED : WorkspaceStatus.FAILED;
            String error = ar.succeeded() ? null : ar.cause().getMessage();
            return workspaces.updateStatus(workspace.getId(), outcome, error)
                .transform(ignored -> {
                    if (ignored.failed()) {
                        logger.warn("Could not mark workspace {} {}: {}", workspace.getId(), outcome,
                            ignored.cause().getMessage());
                    }
                    return ar.succeeded() ? Future.succeededFuture(ar.result()) : Future.failedFuture(ar.cause());
                });
        });
    }

    private Future<Task> invoke(Task task, Map<String, Object> context) {
        Future<TaskResult> result;
        try {
            result = provider.execute(task.getDescription(), context);
        } catch (RuntimeException e) {
            logger.error("Provider {} threw while starting task {}", provider.getName(), task.getId(), e);
            result = Future.failedFuture(e);
        }
        return result.map(task::withResult);
    }

    private Task finishCompleted(Task done) {
        Task completed = transition(done, TaskStatus.COMPLETED);
        TaskResult result = done.getResult();
        completedTasks.incrementAndGet();
        totalTokens.addAndGet(result.getUsage().getTotalTokens());
        totalCost.add(result.getCostUsd());
        logger.info("Task {} completed in {}s ({} tokens, ${})", done.getId(),
            String.format("%.1f", result.getExecutionTimeSeconds()),
            result.getUsage().getTotalTokens(), String.format("%.4f", result.getCostUsd()));
        return completed;
    }

    private Future<Task> finishFailed(Task current, Throwable err) {
        if (err instanceof UnauthorizedException) {
            signOut("Backend rejected the API token while running task " + current.getId());
            return Future.succeededFuture(current);
        }
        String message = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
        logger.error("Task {} failed: {}", current.getId(), message);
        return queue.failTask(current.getId(), message)
            .transform(reported -> {
                if (reported.failed()) {
                    Throwable cause = reported.cause();
                    if (cause instanceof UnauthorizedException) {
                        signOut("Backend rejected the API token while reporting task " + current.getId());
                        return Future.succeededFuture(current);
                    }
                    logger.error("Could not report failure of task {}: {}", current.getId(), cause.getMessage());
                    rememberUndelivered(current.getId(), message);
                }
                failedTasks.incrementAndGet();
                return Future.succeededFuture(transition(current.withError(message), TaskStatus.FAILED));
            });
    }

    private void release(String id, AsyncResult<Task> outcome) {
        Task last = activeTasks.remove(id);
        Task finished = outcome.succeeded() ? outcome.result() : last;
        if (finished != null && finished.getStatus() != TaskStatus.PENDING) {
            synchronized (recentTasks) {
                recentTasks.addFirst(finished);
                while (recentTasks.size() > RECENT_TASK_LIMIT) {
                    recentTasks.removeLast();
                }
            }
        }
    }

    private Task current(String id, Task fallback) {
        return activeTasks.getOrDefault(id, fallback);
    }

    /**
     * Applies a local status change, logs it, tells listeners and, for tasks
     * bound to a workspace, records a workspace event.
     */
    private Task transition(Task task, TaskStatus target) {
        if (!task.getStatus().canTransitionTo(target)) {
            logger.warn("Ignoring task {} transition {} -> {}", task.getId(), task.getStatus(), target);
            return task;
        }
        Task next = task.withStatus(target, Instant.now());
        activeTasks.computeIfPresent(next.getId(), (k, v) -> next);
        logger.info("Task {}: {} -> {}", next.getId(), task.getStatus(), target);
        if (workspaces != null && next.getWorkspaceId() != null) {
            workspaces.emit(WorkspaceEvent.task(next.getWorkspaceId(), "task_" + target.getValue(),
                target == TaskStatus.FAILED ? EventLevel.ERROR : EventLevel.INFO,
                target == TaskStatus.FAILED ? next.getError() : "Task " + next.getId() + " " + target.getDescription().toLowerCase()));
        }
        for (ExecutorListener listener : listeners) {
            try {
                listener.onTaskTransition(next);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on task transition: {}", e.getMessage(), e);
            }
        }
        return next;
    }

    // ---------------------------------------------------------------- reconciliation

    private void rememberUndelivered(String taskId, String error) {
        if (config.getFailureReportRetries() <= 0) {
            return;
        }
        undelivered.put(taskId, new UndeliveredFailure(error));
    }

    private Future<Void> retryUndeliveredFailures() {
        if (undelivered.isEmpty()) {
            return Future.succeededFuture();
        }
        List<Future<Void>> retries = new ArrayList<>();
        for (Map.Entry<String, UndeliveredFailure> entry : undelivered.entrySet()) {
            String taskId = entry.getKey();
            UndeliveredFailure failure = entry.getValue();
            retries.add(queue.failTask(taskId, failure.error)
                .onSuccess(v -> {
                    undelivered.remove(taskId);
                    logger.info("Delivered earlier failure report for task {}", taskId);
                })
                .onFailure(err -> {
                    if (err instanceof RemoteServiceException && ((RemoteServiceException) err).isNotFound()) {
                        undelivered.remove(taskId);
                        logger.warn("Task {} no longer exists, dropping its failure report", taskId);
                    } else if (failure.attempts.incrementAndGet() >= config.getFailureReportRetries()) {
                        undelivered.remove(taskId);
                        logger.error("Giving up on failure report for task {} after {} attempts: {}",
                            taskId, failure.attempts.get(), err.getMessage());
                    }
                }));
        }
        return Future.join(retries).transform(ar -> Future.succeededFuture());
    }

    // ---------------------------------------------------------------- state

    public EngineStatus getStatus() {
        return status.get();
    }

    public int getActiveTaskCount() {
        return activeTasks.size();
    }

    public int getUndeliveredFailureCount() {
        return undelivered.size();
    }

    public Instant getLastSyncTime() {
        return lastSyncTime;
    }

    public UsageStatistics getStatistics() {
        return new UsageStatistics(totalTasks.get(), completedTasks.get(), failedTasks.get(),
            totalTokens.get(), totalCost.sum());
    }

    public ExecutorSnapshot snapshot() {
        List<Task> recent;
        synchronized (recentTasks) {
            recent = new ArrayList<>(recentTasks);
        }
        return new ExecutorSnapshot(config.getAgentName(), status.get(), lastSyncTime,
            new ArrayList<>(activeTasks.values()), recent, getStatistics(), provider.getName());
    }

    public void addListener(ExecutorListener listener) {
        listeners.add(listener);
    }

    private void changeStatus(EngineStatus next) {
        EngineStatus previous = status.getAndSet(next);
        if (previous != next) {
            notifyStatus(previous, next);
        }
    }

    private void notifyStatus(EngineStatus previous, EngineStatus current) {
        for (ExecutorListener listener : listeners) {
            try {
                listener.onStatusChange(previous, current);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on status change: {}", e.getMessage(), e);
            }
        }
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }

    private static final class UndeliveredFailure {
        private final String error;
        private final AtomicLong attempts = new AtomicLong();

        private UndeliveredFailure(String error) {
            this.error = error;
        }
    }
}
