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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An entry in a workspace's event log. The agent only ever writes these.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceEvent {

    @JsonProperty("workspace_id")
    private String workspaceId;

    @JsonProperty("workspace_task_id")
    private String workspaceTaskId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("event_category")
    private EventCategory category;

    @JsonProperty("message")
    private String message;

    @JsonProperty("level")
    private EventLevel level;

    @JsonProperty("source")
    private String source;

    @JsonProperty("details")
    private Map<String, Object> details;

    @JsonProperty("created_at")
    private Instant createdAt;

    public WorkspaceEvent() {
    }

    private WorkspaceEvent(String workspaceId, String eventType, EventCategory category,
                           EventLevel level, String message) {
        this.workspaceId = Objects.requireNonNull(workspaceId, "workspaceId");
        this.eventType = eventType;
        this.category = category;
        this.level = level;
        this.message = message;
        this.source = "executor";
        this.createdAt = Instant.now();
    }

    public static WorkspaceEvent lifecycle(String workspaceId, WorkspaceStatus status, String message) {
        EventLevel level = status == WorkspaceStatus.FAILED ? EventLevel.ERROR : EventLevel.INFO;
        return new WorkspaceEvent(workspaceId, "status_" + status.getValue(), EventCategory.LIFECYCLE, level, message);
    }

    public static WorkspaceEvent task(String workspaceId, String eventType, EventLevel level, String message) {
        return new WorkspaceEvent(workspaceId, eventType, EventCategory.TASK, level, message);
    }

    public static WorkspaceEvent of(String workspaceId, String eventType, EventCategory category,
                                    EventLevel level, String message) {
        return new WorkspaceEvent(workspaceId, eventType, category, level, message);
    }

    public WorkspaceEvent withWorkspaceTask(String workspaceTaskId) {
        this.workspaceTaskId = workspaceTaskId;
        return this;
    }

    public WorkspaceEvent withDetail(String key, Object value) {
        if (details == null) {
            details = new LinkedHashMap<>();
        }
        details.put(key, value);
        return this;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getWorkspaceTaskId() {
        return workspaceTaskId;
    }

    public String getEventType() {
        return eventType;
    }

    public EventCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public EventLevel getLevel() {
        return level;
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getDetails() {
        return details == null ? Collections.emptyMap() : Collections.unmodifiableMap(details);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "WorkspaceEvent{" + workspaceId + " " + category + "/" + eventType + " [" + level + "] " + message + "}";
    }
}
