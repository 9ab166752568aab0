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

package dev.mars.zephyr.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work handed out by the remote task queue.
 *
 * <p>Tasks are created by the backend. The executor only changes the status,
 * result, error and timestamps, and never in place: every local change goes
 * through {@link #withStatus(TaskStatus, Instant)} or the other {@code with*}
 * methods, so an instance published in a snapshot is never modified again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {

    @JsonProperty("id")
    private String id;

    @JsonProperty("description")
    @JsonAlias({"objective", "prompt"})
    private String description;

    @JsonProperty("context")
    private Map<String, Object> context = new LinkedHashMap<>();

    @JsonProperty("status")
    private TaskStatus status = TaskStatus.PENDING;

    @JsonProperty("priority")
    private TaskPriority priority = TaskPriority.NORMAL;

    @JsonProperty("progress")
    private int progress;

    @JsonProperty("mode")
    private ExecutionMode mode = ExecutionMode.EXECUTE;

    @JsonProperty("guardrails")
    private TaskGuardrails guardrails;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("max_retries")
    private int maxRetries;

    @JsonProperty("estimated_cost_usd")
    private Double estimatedCostUsd;

    @JsonProperty("actual_cost_usd")
    private Double actualCostUsd;

    @JsonProperty("workspace_id")
    private String workspaceId;

    @JsonProperty("agent")
    private String agent;

    @JsonProperty("result")
    private TaskResult result;

    @JsonProperty("error")
    private String error;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("accepted_at")
    private Instant acceptedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("failed_at")
    private Instant failedAt;

    /**
     * Default constructor for JSON deserialization.
     */
    public Task() {
    }

    public Task(String id, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.description = description;
        this.createdAt = Instant.now();
    }

    private Task(Task other) {
        this.id = other.id;
        this.description = other.description;
        this.context = other.context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(other.context);
        this.status = other.status;
        this.priority = other.priority;
        this.progress = other.progress;
        this.mode = other.mode;
        this.guardrails = other.guardrails;
        this.retryCount = other.retryCount;
        this.maxRetries = other.maxRetries;
        this.estimatedCostUsd = other.estimatedCostUsd;
        this.actualCostUsd = other.actualCostUsd;
        this.workspaceId = other.workspaceId;
        this.agent = other.agent;
        this.result = other.result;
        this.error = other.error;
        this.createdAt = other.createdAt;
        this.acceptedAt = other.acceptedAt;
        this.completedAt = other.completedAt;
        this.failedAt = other.failedAt;
    }

    // ── Copy-on-write updates ──────────────────────────────────────────

    /**
     * Copy of this task in the given status, stamping the matching timestamp.
     */
    public Task withStatus(TaskStatus newStatus, Instant at) {
        Task copy = new Task(this);
        copy.status = newStatus;
        switch (newStatus) {
            case ACCEPTED -> copy.acceptedAt = at;
            case COMPLETED -> {
                copy.completedAt = at;
                copy.progress = 100;
            }
            case FAILED -> copy.failedAt = at;
            default -> {
                // no timestamp for the remaining states
            }
        }
        return copy;
    }

    public Task withResult(TaskResult taskResult) {
        Task copy = new Task(this);
        copy.result = taskResult;
        copy.actualCostUsd = taskResult.getCostUsd();
        return copy;
    }

    public Task withError(String message) {
        Task copy = new Task(this);
        copy.error = message;
        return copy;
    }

    public Task withWorkspace(String id) {
        Task copy = new Task(this);
        copy.workspaceId = id;
        return copy;
    }

    // ── Accessors ──────────────────────────────────────────────────────

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, Object> getContext() {
        return context == null ? Collections.emptyMap() : Collections.unmodifiableMap(context);
    }

    public void setContext(Map<String, Object> context) {
        this.context = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public void setPriority(TaskPriority priority) {
        this.priority = priority;
    }

    public int getProgress() {
        return progress;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public void setMode(ExecutionMode mode) {
        this.mode = mode;
    }

    public TaskGuardrails getGuardrails() {
        return guardrails;
    }

    public void setGuardrails(TaskGuardrails guardrails) {
        this.guardrails = guardrails;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Whether the backend still has retry budget for this task.
     */
    @JsonIgnore
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public Double getEstimatedCostUsd() {
        return estimatedCostUsd;
    }

    public Double getActualCostUsd() {
        return actualCostUsd;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getAgent() {
        return agent;
    }

    public TaskResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    /**
     * Time since acceptance, up to completion or failure when finished.
     *
     * @return elapsed time, or null if the task was never accepted
     */
    @JsonIgnore
    public Duration getElapsed() {
        if (acceptedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : failedAt != null ? failedAt : Instant.now();
        return Duration.between(acceptedAt, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task)) return false;
        Task task = (Task) o;
        return Objects.equals(id, task.id) && status == task.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", mode=" + mode + ", workspaceId=" + workspaceId + "}";
    }
}
