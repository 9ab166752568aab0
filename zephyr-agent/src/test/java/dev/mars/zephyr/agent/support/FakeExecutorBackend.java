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

package dev.mars.zephyr.agent.support;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory task queue and executor backend served by a real Vert.x HTTP
 * server. Records every call so tests can assert on what the agent sent,
 * and can be told to answer a given operation with an error status.
 *
 * <p>Operation keys for {@link #failWith(String, int, int)}: {@code pending},
 * {@code accept}, {@code status}, {@code complete}, {@code fail},
 * {@code health}, {@code devices.list}, {@code devices.register},
 * {@code devices.update}, {@code heartbeat}, {@code workspaces.create},
 * {@code workspaces.update}, {@code workspaces.list}, {@code tasks.assign},
 * {@code events}, {@code artifacts}, {@code metrics}.</p>
 */
public class FakeExecutorBackend {

    private final Vertx vertx;
    private HttpServer server;

    // Task queue
    public final List<JsonObject> pendingTasks = new CopyOnWriteArrayList<>();
    public final List<String> taskCalls = new CopyOnWriteArrayList<>();
    public final Map<String, JsonObject> completions = new ConcurrentHashMap<>();
    public final Map<String, List<JsonObject>> failures = new ConcurrentHashMap<>();
    public final AtomicInteger pollCount = new AtomicInteger();

    // Executor
    public final Map<String, JsonObject> devices = new ConcurrentHashMap<>();
    public final Map<String, JsonObject> workspaces = new ConcurrentHashMap<>();
    public final List<JsonObject> workspaceUpdates = new CopyOnWriteArrayList<>();
    public final List<JsonObject> events = new CopyOnWriteArrayList<>();
    public final List<JsonObject> artifacts = new CopyOnWriteArrayList<>();
    public final List<JsonObject> metrics = new CopyOnWriteArrayList<>();
    public final List<JsonObject> assignedTasks = new CopyOnWriteArrayList<>();
    public final AtomicInteger deviceRegistrations = new AtomicInteger();
    public final AtomicInteger deviceListCalls = new AtomicInteger();
    public final AtomicInteger heartbeats = new AtomicInteger();

    private final Map<String, int[]> forcedStatus = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private volatile long deviceListDelayMs;
    private volatile long pendingDelayMs;

    public FakeExecutorBackend(Vertx vertx) {
        this.vertx = vertx;
    }

    public Future<Integer> start() {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());

        router.get("/health").handler(ctx -> {
            if (!forced(ctx, "health")) {
                json(ctx, 200, new JsonObject().put("status", "ok"));
            }
        });
        router.get("/tasks/pending").handler(this::pending);
        router.post("/tasks/:id/accept").handler(ctx -> taskCall(ctx, "accept"));
        router.patch("/tasks/:id/status").handler(ctx -> taskCall(ctx, "status"));
        router.post("/tasks/:id/complete").handler(ctx -> taskCall(ctx, "complete"));
        router.post("/tasks/:id/fail").handler(ctx -> taskCall(ctx, "fail"));

        router.post("/executor/devices").handler(this::registerDevice);
        router.get("/executor/devices").handler(this::listDevices);
        router.get("/executor/devices/:id").handler(ctx -> single(ctx, devices, "device"));
        router.put("/executor/devices/:id").handler(ctx -> update(ctx, devices, "device", "devices.update"));
        router.post("/executor/devices/:id/heartbeat").handler(ctx -> {
            if (!forced(ctx, "heartbeat")) {
                heartbeats.incrementAndGet();
                json(ctx, 200, new JsonObject().put("ok", true));
            }
        });

        router.post("/executor/workspaces").handler(this::createWorkspace);
        router.get("/executor/workspaces").handler(this::listWorkspaces);
        router.get("/executor/workspaces/:id").handler(ctx -> single(ctx, workspaces, "workspace"));
        router.put("/executor/workspaces/:id").handler(ctx -> update(ctx, workspaces, "workspace", "workspaces.update"));
        router.delete("/executor/workspaces/:id").handler(ctx -> {
            workspaces.remove(ctx.pathParam("id"));
            ctx.response().setStatusCode(204).end();
        });
        router.post("/executor/workspaces/:id/tasks").handler(this::assignTask);
        router.post("/executor/workspaces/:id/events").handler(ctx -> record(ctx, events, "events", null));
        router.post("/executor/workspaces/:id/artifacts").handler(ctx -> record(ctx, artifacts, "artifacts", "artifact"));
        router.post("/executor/workspaces/:id/metrics").handler(ctx -> record(ctx, metrics, "metrics", null));

        return vertx.createHttpServer()
            .requestHandler(router)
            .listen(0)
            .map(s -> {
                server = s;
                return s.actualPort();
            });
    }

    public Future<Void> stop() {
        return server == null ? Future.succeededFuture() : server.close();
    }

    public String baseUrl() {
        return "http://localhost:" + server.actualPort();
    }

    public void reset() {
        pendingTasks.clear();
        taskCalls.clear();
        completions.clear();
        failures.clear();
        pollCount.set(0);
        devices.clear();
        workspaces.clear();
        workspaceUpdates.clear();
        events.clear();
        artifacts.clear();
        metrics.clear();
        assignedTasks.clear();
        deviceRegistrations.set(0);
        deviceListCalls.set(0);
        heartbeats.set(0);
        forcedStatus.clear();
        deviceListDelayMs = 0;
        pendingDelayMs = 0;
    }

    // ---------------------------------------------------------------- test controls

    /**
     * Answer the next {@code times} calls of {@code operation} with
     * {@code status}; a negative count means every call.
     */
    public void failWith(String operation, int status, int times) {
        forcedStatus.put(operation, new int[]{status, times});
    }

    public void clearFailures() {
        forcedStatus.clear();
    }

    public void delayDeviceList(long millis) {
        this.deviceListDelayMs = millis;
    }

    public void delayPending(long millis) {
        this.pendingDelayMs = millis;
    }

    public JsonObject addPendingTask(String id, String description) {
        JsonObject task = new JsonObject()
            .put("id", id)
            .put("description", description)
            .put("status", "pending")
            .put("context", new JsonObject())
            .put("created_at", Instant.now().toString());
        pendingTasks.add(task);
        return task;
    }

    public JsonObject addDevice(String deviceId, int maxWorkspaces, int currentWorkspaces) {
        JsonObject device = new JsonObject()
            .put("id", "dev-" + ids.incrementAndGet())
            .put("device_id", deviceId)
            .put("device_name", "existing")
            .put("status", "active")
            .put("is_online", true)
            .put("max_concurrent_workspaces", maxWorkspaces)
            .put("current_workspaces_count", currentWorkspaces)
            .put("created_at", Instant.now().toString());
        devices.put(device.getString("id"), device);
        return device;
    }

    /**
     * Calls recorded for one task, e.g. {@code [accept, status:in_progress, complete]}.
     */
    public List<String> callsFor(String taskId) {
        String prefix = taskId + ":";
        return taskCalls.stream()
            .filter(c -> c.startsWith(prefix))
            .map(c -> c.substring(prefix.length()))
            .collect(Collectors.toList());
    }

    /**
     * Status values sent for one workspace, in order.
     */
    public List<String> statusUpdatesFor(String workspaceId) {
        return workspaceUpdates.stream()
            .filter(u -> workspaceId.equals(u.getString("id")))
            .map(u -> u.getJsonObject("changes").getString("status"))
            .filter(s -> s != null)
            .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------- handlers

    private boolean forced(RoutingContext ctx, String operation) {
        int[] entry = forcedStatus.get(operation);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry[1] == 0) {
                return false;
            }
            if (entry[1] > 0) {
                entry[1]--;
            }
        }
        ctx.response().setStatusCode(entry[0])
            .putHeader("content-type", "application/json")
            .end(new JsonObject().put("error", "forced " + entry[0]).encode());
        return true;
    }

    private void pending(RoutingContext ctx) {
        pollCount.incrementAndGet();
        Runnable answer = () -> {
            if (forced(ctx, "pending")) {
                return;
            }
            json(ctx, 200, new JsonObject().put("tasks", new JsonArray(List.copyOf(pendingTasks))));
        };
        if (pendingDelayMs > 0) {
            vertx.setTimer(pendingDelayMs, id -> answer.run());
        } else {
            answer.run();
        }
    }

    private void taskCall(RoutingContext ctx, String operation) {
        String id = ctx.pathParam("id");
        JsonObject body = ctx.body().asJsonObject();
        String call = operation.equals("status") ? "status:" + body.getString("status") : operation;
        taskCalls.add(id + ":" + call);
        if (forced(ctx, operation)) {
            return;
        }
        switch (operation) {
            case "accept" -> pendingTasks.removeIf(t -> id.equals(t.getString("id")));
            case "complete" -> completions.put(id, body);
            case "fail" -> failures.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(body);
            default -> {
            }
        }
        json(ctx, 200, new JsonObject().put("success", true));
    }

    private void registerDevice(RoutingContext ctx) {
        if (forced(ctx, "devices.register")) {
            return;
        }
        deviceRegistrations.incrementAndGet();
        JsonObject device = ctx.body().asJsonObject().copy()
            .put("id", "dev-" + ids.incrementAndGet())
            .put("current_workspaces_count", 0)
            .put("created_at", Instant.now().toString());
        devices.put(device.getString("id"), device);
        json(ctx, 201, new JsonObject().put("device", device));
    }

    private void listDevices(RoutingContext ctx) {
        deviceListCalls.incrementAndGet();
        Runnable answer = () -> {
            if (!forced(ctx, "devices.list")) {
                json(ctx, 200, new JsonObject().put("devices", new JsonArray(List.copyOf(devices.values()))));
            }
        };
        if (deviceListDelayMs > 0) {
            vertx.setTimer(deviceListDelayMs, id -> answer.run());
        } else {
            answer.run();
        }
    }

    private void createWorkspace(RoutingContext ctx) {
        if (forced(ctx, "workspaces.create")) {
            return;
        }
        JsonObject workspace = ctx.body().asJsonObject().copy()
            .put("id", "ws-" + ids.incrementAndGet())
            .put("progress_percentage", 0);
        workspaces.put(workspace.getString("id"), workspace);
        json(ctx, 201, new JsonObject().put("workspace", workspace));
    }

    private void listWorkspaces(RoutingContext ctx) {
        if (forced(ctx, "workspaces.list")) {
            return;
        }
        String deviceId = ctx.queryParams().get("executor_device_id");
        List<JsonObject> matching = workspaces.values().stream()
            .filter(ws -> deviceId == null || deviceId.equals(ws.getString("executor_device_id")))
            .collect(Collectors.toList());
        json(ctx, 200, new JsonObject().put("workspaces", new JsonArray(matching)));
    }

    private void single(RoutingContext ctx, Map<String, JsonObject> store, String key) {
        JsonObject value = store.get(ctx.pathParam("id"));
        if (value == null) {
            json(ctx, 404, new JsonObject().put("error", key + " not found"));
        } else {
            json(ctx, 200, new JsonObject().put(key, value));
        }
    }

    private void update(RoutingContext ctx, Map<String, JsonObject> store, String key, String operation) {
        if (forced(ctx, operation)) {
            return;
        }
        String id = ctx.pathParam("id");
        JsonObject changes = ctx.body().asJsonObject();
        JsonObject value = store.get(id);
        if (value == null) {
            json(ctx, 404, new JsonObject().put("error", key + " not found"));
            return;
        }
        if (key.equals("workspace")) {
            workspaceUpdates.add(new JsonObject().put("id", id).put("changes", changes.copy()));
        }
        value.mergeIn(changes).put("updated_at", Instant.now().toString());
        json(ctx, 200, new JsonObject().put(key, value));
    }

    private void assignTask(RoutingContext ctx) {
        if (forced(ctx, "tasks.assign")) {
            return;
        }
        JsonObject body = ctx.body().asJsonObject();
        JsonObject task = new JsonObject()
            .put("id", "wt-" + ids.incrementAndGet())
            .put("workspace_id", ctx.pathParam("id"))
            .put("ai_task_id", body.getString("ai_task_id"))
            .put("status", "assigned")
            .put("config", body.getJsonObject("config"))
            .put("created_at", Instant.now().toString());
        assignedTasks.add(task);
        json(ctx, 201, new JsonObject().put("task", task));
    }

    private void record(RoutingContext ctx, List<JsonObject> store, String operation, String wrapKey) {
        if (forced(ctx, operation)) {
            return;
        }
        JsonObject body = ctx.body().asJsonObject().copy();
        store.add(body);
        if (wrapKey == null) {
            json(ctx, 201, new JsonObject().put("success", true));
        } else {
            json(ctx, 201, new JsonObject().put(wrapKey, body.put("id", operation + "-" + ids.incrementAndGet())));
        }
    }

    private static void json(RoutingContext ctx, int status, JsonObject body) {
        ctx.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(body.encode());
    }
}
