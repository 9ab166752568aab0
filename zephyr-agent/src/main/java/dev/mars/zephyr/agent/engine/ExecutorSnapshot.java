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

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.zephyr.core.Task;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of the engine at one point in time, for the status
 * endpoint and for tests.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ExecutorSnapshot {

    private final String agentName;
    private final EngineStatus status;
    private final Instant lastSyncTime;
    private final List<Task> activeTasks;
    private final List<Task> recentTasks;
    private final UsageStatistics statistics;
    private final String provider;

    public ExecutorSnapshot(String agentName, EngineStatus status, Instant lastSyncTime, List<Task> activeTasks,
                            List<Task> recentTasks, UsageStatistics statistics, String provider) {
        this.agentName = agentName;
        this.status = status;
        this.lastSyncTime = lastSyncTime;
        this.activeTasks = List.copyOf(activeTasks);
        this.recentTasks = List.copyOf(recentTasks);
        this.statistics = statistics;
        this.provider = provider;
    }

    @JsonProperty("agent")
    public String getAgentName() {
        return agentName;
    }

    @JsonProperty("status")
    public EngineStatus getStatus() {
        return status;
    }

    @JsonProperty("last_sync_time")
    public Instant getLastSyncTime() {
        return lastSyncTime;
    }

    @JsonProperty("active_tasks")
    public List<Task> getActiveTasks() {
        return activeTasks;
    }

    @JsonProperty("recent_tasks")
    public List<Task> getRecentTasks() {
        return recentTasks;
    }

    @JsonProperty("statistics")
    public UsageStatistics getStatistics() {
        return statistics;
    }

    @JsonProperty("provider")
    public String getProvider() {
        return provider;
    }
}
