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
import dev.mars.zephyr.device.Device;
import dev.mars.zephyr.device.DeviceStatus;
import dev.mars.zephyr.workspace.Workspace;
import dev.mars.zephyr.workspace.WorkspaceArtifact;
import dev.mars.zephyr.workspace.WorkspaceEvent;
import dev.mars.zephyr.workspace.WorkspaceMetrics;
import dev.mars.zephyr.workspace.WorkspaceStatus;
import dev.mars.zephyr.workspace.WorkspaceTask;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for the executor resources of the backend: devices, workspaces and
 * their tasks, events, artifacts and metrics.
 *
 * <p>Single resources come back wrapped ({@code {"device": {...}}}), lists
 * under the plural key.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ExecutorApiClient extends RemoteApiClient {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorApiClient.class);

    private static final String DEVICES = "/executor/devices";
    private static final String WORKSPACES = "/executor/workspaces";

    public ExecutorApiClient(Vertx vertx, AgentConfiguration config) {
        super(vertx, config);
    }

    // ── Devices ────────────────────────────────────────────────────────

    public Future<Device> registerDevice(Device device) {
        return post(DEVICES, encode(device))
            .compose(body -> decodeField(body, "device", Device.class, "POST " + DEVICES))
            .onSuccess(d -> logger.info("Registered device {} ({})", d.getId(), d.getDeviceId()));
    }

    public Future<Device> getDevice(String id) {
        String path = DEVICES + "/" + id;
        return get(path).compose(body -> decodeField(body, "device", Device.class, "GET " + path));
    }

    /**
     * List devices, optionally filtered by status and online flag (null means no filter).
     */
    public Future<List<Device>> listDevices(DeviceStatus status, Boolean online) {
        List<String> query = new ArrayList<>();
        if (status != null) {
            query.add("status=" + status.getValue());
        }
        if (online != null) {
            query.add("is_online=" + online);
        }
        return get(DEVICES + queryString(query)).map(body -> decodeList(body, "devices", Device.class));
    }

    /**
     * Sparse update: only the fields in {@code changes} are sent.
     */
    public Future<Device> updateDevice(String id, JsonObject changes) {
        String path = DEVICES + "/" + id;
        return put(path, changes).compose(body -> decodeField(body, "device", Device.class, "PUT " + path));
    }

    public Future<Void> sendDeviceHeartbeat(String id) {
        return post(DEVICES + "/" + id + "/heartbeat", new JsonObject()).mapEmpty();
    }

    // ── Workspaces ─────────────────────────────────────────────────────

    public Future<Workspace> createWorkspace(Workspace workspace) {
        return post(WORKSPACES, encode(workspace))
            .compose(body -> decodeField(body, "workspace", Workspace.class, "POST " + WORKSPACES));
    }

    public Future<Workspace> getWorkspace(String id) {
        String path = WORKSPACES + "/" + id;
        return get(path).compose(body -> decodeField(body, "workspace", Workspace.class, "GET " + path));
    }

    public Future<List<Workspace>> listWorkspaces(WorkspaceFilter filter) {
        return get(WORKSPACES + queryString(filter.toQuery()))
            .map(body -> decodeList(body, "workspaces", Workspace.class));
    }

    /**
     * Sparse update: only the fields in {@code changes} are sent. The backend
     * answers with the full, updated record.
     */
    public Future<Workspace> updateWorkspace(String id, JsonObject changes) {
        String path = WORKSPACES + "/" + id;
        return put(path, changes).compose(body -> decodeField(body, "workspace", Workspace.class, "PUT " + path));
    }

    public Future<Void> deleteWorkspace(String id) {
        return delete(WORKSPACES + "/" + id).mapEmpty();
    }

    public Future<WorkspaceTask> assignTask(String workspaceId, String taskId, Map<String, Object> taskConfig) {
        String path = WORKSPACES + "/" + workspaceId + "/tasks";
        JsonObject request = new JsonObject()
            .put("ai_task_id", taskId)
            .put("config", new JsonObject(taskConfig == null ? Map.of() : taskConfig));
        return post(path, request).compose(body -> decodeField(body, "task", WorkspaceTask.class, "POST " + path));
    }

    public Future<Void> logEvent(WorkspaceEvent event) {
        return post(WORKSPACES + "/" + event.getWorkspaceId() + "/events", encode(event)).mapEmpty();
    }

    public Future<WorkspaceArtifact> uploadArtifact(WorkspaceArtifact artifact) {
        String path = WORKSPACES + "/" + artifact.getWorkspaceId() + "/artifacts";
        return post(path, encode(artifact))
            .compose(body -> decodeField(body, "artifact", WorkspaceArtifact.class, "POST " + path));
    }

    public Future<Void> recordMetrics(WorkspaceMetrics metrics) {
        return post(WORKSPACES + "/" + metrics.getWorkspaceId() + "/metrics", encode(metrics)).mapEmpty();
    }

    private static String queryString(List<String> params) {
        return params.isEmpty() ? "" : "?" + String.join("&", params);
    }

    /**
     * Query parameters for listing workspaces. Unset fields are not sent.
     */
    public static class WorkspaceFilter {
        private String executorDeviceId;
        private String agentId;
        private WorkspaceStatus status;
        private int limit = 100;
        private int offset;

        public static WorkspaceFilter forDevice(String executorDeviceId) {
            return new WorkspaceFilter().executorDeviceId(executorDeviceId);
        }

        public WorkspaceFilter executorDeviceId(String executorDeviceId) {
            this.executorDeviceId = executorDeviceId;
            return this;
        }

        public WorkspaceFilter agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public WorkspaceFilter status(WorkspaceStatus status) {
            this.status = status;
            return this;
        }

        public WorkspaceFilter limit(int limit) {
            this.limit = limit;
            return this;
        }

        public WorkspaceFilter offset(int offset) {
            this.offset = offset;
            return this;
        }

        List<String> toQuery() {
            List<String> query = new ArrayList<>();
            if (executorDeviceId != null) {
                query.add("executor_device_id=" + urlEncode(executorDeviceId));
            }
            if (agentId != null) {
                query.add("agent_id=" + urlEncode(agentId));
            }
            if (status != null) {
                query.add("status=" + status.getValue());
            }
            query.add("limit=" + limit);
            query.add("offset=" + offset);
            return query;
        }
    }
}
