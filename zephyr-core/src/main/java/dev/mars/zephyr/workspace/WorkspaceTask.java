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

package dev.mars.zephyr.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assignment of a queue task into a workspace.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceTask {

    @JsonProperty("id")
    private String id;

    @JsonProperty("workspace_id")
    private String workspaceId;

    @JsonProperty("ai_task_id")
    private String aiTaskId;

    @JsonProperty("status")
    private WorkspaceTaskStatus status = WorkspaceTaskStatus.ASSIGNED;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("max_retries")
    private int maxRetries;

    @JsonProperty("config")
    private Map<String, Object> config = new LinkedHashMap<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    public WorkspaceTask() {
    }

    public String getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getAiTaskId() {
        return aiTaskId;
    }

    public WorkspaceTaskStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "WorkspaceTask{id='" + id + "', workspaceId='" + workspaceId + "', aiTaskId='" + aiTaskId
                + "', status=" + status + "}";
    }
}
