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

package dev.mars.zephyr.agent.observability;

import dev.mars.zephyr.agent.engine.EngineStatus;
import dev.mars.zephyr.agent.engine.ExecutorListener;
import dev.mars.zephyr.core.Task;
import dev.mars.zephyr.core.TaskResult;
import dev.mars.zephyr.workspace.Workspace;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleCounter;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * OpenTelemetry metrics for the executor agent.
 *
 * Metrics:
 * - zephyr.agent.status (gauge) - Engine status (0=idle, 1=running, 2=paused, 3=error, 4=signed out)
 * - zephyr.agent.tasks.polled / claimed / completed / failed (counters)
 * - zephyr.agent.tasks.active (gauge) - Tasks currently in flight
 * - zephyr.agent.tokens.total (counter) - Provider tokens used
 * - zephyr.agent.cost.usd (counter) - Estimated provider cost
 * - zephyr.agent.heartbeats.total / failed (observable counters)
 * - zephyr.agent.registrations.total / success (counters)
 * - zephyr.agent.workspaces.created / failed / archived (counters)
 * - zephyr.agent.workspaces.active (gauge)
 * - zephyr.agent.uptime.seconds (gauge)
 *
 * <p>Task and status metrics are fed through {@link ExecutorListener};
 * workspace metrics through {@link #recordWorkspace(Workspace)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0 (OpenTelemetry)
 */
public class AgentMetrics implements ExecutorListener {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "zephyr-agent";

    private static final AttributeKey<String> AGENT_KEY = AttributeKey.stringKey("agent.name");
    private static final AttributeKey<String> MODEL_KEY = AttributeKey.stringKey("model");

    private final LongCounter tasksPolled;
    private final LongCounter tasksClaimed;
    private final LongCounter tasksCompleted;
    private final LongCounter tasksFailed;
    private final LongCounter tokensTotal;
    private final DoubleCounter costUsd;
    private final LongCounter registrationsTotal;
    private final LongCounter registrationsSuccess;
    private final LongCounter workspacesCreated;
    private final LongCounter workspacesFailed;
    private final LongCounter workspacesArchived;

    private final AtomicLong engineStatus = new AtomicLong(0);
    private volatile LongSupplier activeTasks = () -> 0;
    private volatile LongSupplier activeWorkspaces = () -> 0;
    private volatile LongSupplier heartbeatsSent = () -> 0;
    private volatile LongSupplier heartbeatsFailed = () -> 0;

    private final String agentName;
    private final Attributes agentAttributes;

    /**
     * @param agentName       name this agent polls under
     * @param startTimeMillis agent start time in milliseconds
     */
    public AgentMetrics(String agentName, long startTimeMillis) {
        this.agentName = agentName;
        this.agentAttributes = Attributes.of(AGENT_KEY, agentName);

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        tasksPolled = counter(meter, "zephyr.agent.tasks.polled", "Pending tasks seen by polling");
        tasksClaimed = counter(meter, "zephyr.agent.tasks.claimed", "Tasks claimed by this agent");
        tasksCompleted = counter(meter, "zephyr.agent.tasks.completed", "Tasks completed");
        tasksFailed = counter(meter, "zephyr.agent.tasks.failed", "Tasks failed");
        tokensTotal = counter(meter, "zephyr.agent.tokens.total", "Provider tokens used");
        registrationsTotal = counter(meter, "zephyr.agent.registrations.total", "Device registration attempts");
        registrationsSuccess = counter(meter, "zephyr.agent.registrations.success", "Successful device registrations");
        workspacesCreated = counter(meter, "zephyr.agent.workspaces.created", "Workspaces created");
        workspacesFailed = counter(meter, "zephyr.agent.workspaces.failed", "Workspaces that failed");
        workspacesArchived = counter(meter, "zephyr.agent.workspaces.archived", "Workspaces cleaned up and archived");

        costUsd = meter.counterBuilder("zephyr.agent.cost.usd")
                .setDescription("Estimated provider cost")
                .setUnit("USD")
                .ofDoubles()
                .build();

        meter.counterBuilder("zephyr.agent.heartbeats.total")
                .setDescription("Heartbeats sent to the backend")
                .setUnit("1")
                .buildWithCallback(m -> m.record(heartbeatsSent.getAsLong() + heartbeatsFailed.getAsLong(), agentAttributes));

        meter.counterBuilder("zephyr.agent.heartbeats.failed")
                .setDescription("Failed heartbeat attempts")
                .setUnit("1")
                .buildWithCallback(m -> m.record(heartbeatsFailed.getAsLong(), agentAttributes));

        meter.gaugeBuilder("zephyr.agent.status")
                .setDescription("Engine status (0=idle, 1=running, 2=paused, 3=error, 4=signed out)")
                .ofLongs()
                .buildWithCallback(m -> m.record(engineStatus.get(), agentAttributes));

        meter.gaugeBuilder("zephyr.agent.tasks.active")
                .setDescription("Tasks currently in flight")
                .ofLongs()
                .buildWithCallback(m -> m.record(activeTasks.getAsLong(), agentAttributes));

        meter.gaugeBuilder("zephyr.agent.workspaces.active")
                .setDescription("Workspaces not yet archived")
                .ofLongs()
                .buildWithCallback(m -> m.record(activeWorkspaces.getAsLong(), agentAttributes));

        meter.gaugeBuilder("zephyr.agent.uptime.seconds")
                .setDescription("Agent uptime in seconds")
                .ofLongs()
                .buildWithCallback(m -> m.record((System.currentTimeMillis() - startTimeMillis) / 1000, agentAttributes));

        logger.info("AgentMetrics initialized for agent: {}", agentName);
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name).setDescription(description).setUnit("1").build();
    }

    public void bindActiveTasks(LongSupplier supplier) {
        this.activeTasks = supplier;
    }

    public void bindActiveWorkspaces(LongSupplier supplier) {
        this.activeWorkspaces = supplier;
    }

    public void bindHeartbeats(LongSupplier sent, LongSupplier failed) {
        this.heartbeatsSent = sent;
        this.heartbeatsFailed = failed;
    }

    public void recordRegistration(boolean success) {
        registrationsTotal.add(1, agentAttributes);
        if (success) {
            registrationsSuccess.add(1, agentAttributes);
        }
    }

    /**
     * Counts workspace status changes that matter for capacity planning.
     */
    public void recordWorkspace(Workspace workspace) {
        switch (workspace.getStatus()) {
            case CREATING -> workspacesCreated.add(1, agentAttributes);
            case FAILED -> workspacesFailed.add(1, agentAttributes);
            case ARCHIVED -> workspacesArchived.add(1, agentAttributes);
            default -> {
                // intermediate states are visible through the workspace events
            }
        }
    }

    @Override
    public void onPoll(int pending, int claimed) {
        tasksPolled.add(pending, agentAttributes);
        tasksClaimed.add(claimed, agentAttributes);
    }

    @Override
    public void onTaskTransition(Task task) {
        switch (task.getStatus()) {
            case COMPLETED -> {
                TaskResult result = task.getResult();
                Attributes attrs = result != null && result.getModel() != null
                        ? Attributes.of(AGENT_KEY, agentName, MODEL_KEY, result.getModel())
                        : agentAttributes;
                tasksCompleted.add(1, attrs);
                if (result != null) {
                    tokensTotal.add(result.getUsage().getTotalTokens(), attrs);
                    costUsd.add(result.getCostUsd(), attrs);
                }
            }
            case FAILED -> tasksFailed.add(1, agentAttributes);
            default -> {
                // accepted and running are counted through the active gauge
            }
        }
    }

    @Override
    public void onStatusChange(EngineStatus previous, EngineStatus current) {
        engineStatus.set(current.ordinal());
    }

    long getEngineStatusCode() {
        return engineStatus.get();
    }
}
