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

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.core.Task;
import dev.mars.zephyr.core.TaskResult;
import dev.mars.zephyr.core.TaskStatus;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Client for the remote task queue.
 *
 * <p>Every operation fails with {@code UnauthorizedException} on HTTP 401 and
 * with {@code RemoteServiceException} otherwise; deciding what a failure
 * means is left to the caller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class TaskQueueClient extends RemoteApiClient {

    private static final Logger logger = LoggerFactory.getLogger(TaskQueueClient.class);

    public TaskQueueClient(Vertx vertx, AgentConfiguration config) {
        super(vertx, config);
    }

    /**
     * Fetch tasks eligible for this agent, in the order the backend returns them.
     * Entries that do not parse are skipped.
     */
    public Future<List<Task>> pollPendingTasks() {
        String path = "/tasks/pending?agent=" + urlEncode(config.getAgentName());
        return get(path).map(body -> {
            List<Task> tasks = decodeList(body, "tasks", Task.class);
            logger.debug("Polled for tasks: found {} pending", tasks.size());
            return tasks;
        });
    }

    /**
     * Claim a task for this agent.
     */
    public Future<Void> acceptTask(String taskId) {
        JsonObject request = new JsonObject().put("agent", config.getAgentName());
        return post("/tasks/" + taskId + "/accept", request)
            .onSuccess(v -> logger.debug("Task {} accepted by {}", taskId, config.getAgentName()))
            .mapEmpty();
    }

    public Future<Void> updateTaskStatus(String taskId, TaskStatus status, Integer progress) {
        JsonObject request = new JsonObject().put("status", status.getValue());
        if (progress != null) {
            request.put("progress", progress);
        }
        return patch("/tasks/" + taskId + "/status", request)
            .onSuccess(v -> logger.debug("Task status reported: {} -> {}", taskId, status))
            .mapEmpty();
    }

    public Future<Void> completeTask(String taskId, TaskResult result) {
        JsonObject request = new JsonObject()
            .put("result", encode(result))
            .put("completed_at", Instant.now().toString());
        return post("/tasks/" + taskId + "/complete", request)
            .onSuccess(v -> logger.debug("Task {} reported complete", taskId))
            .mapEmpty();
    }

    public Future<Void> failTask(String taskId, String error) {
        JsonObject request = new JsonObject()
            .put("error", error == null ? "Unknown error" : error)
            .put("failed_at", Instant.now().toString());
        return post("/tasks/" + taskId + "/fail", request)
            .onSuccess(v -> logger.debug("Task {} reported failed", taskId))
            .mapEmpty();
    }

    /**
     * Checks the backend health endpoint. Never fails: any error reads as false.
     */
    public Future<Boolean> testConnection() {
        return get("/health")
            .map(body -> true)
            .recover(err -> {
                logger.warn("Connection test against {} failed: {}", config.getApiUrl(), err.getMessage());
                return Future.succeededFuture(false);
            });
    }
}
