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

/**
 * Running totals over every task this engine finished.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class UsageStatistics {

    public static final UsageStatistics EMPTY = new UsageStatistics(0, 0, 0, 0, 0.0);

    private final long totalTasks;
    private final long completedTasks;
    private final long failedTasks;
    private final long totalTokens;
    private final double totalCostUsd;

    public UsageStatistics(long totalTasks, long completedTasks, long failedTasks,
                           long totalTokens, double totalCostUsd) {
        this.totalTasks = totalTasks;
        this.completedTasks = completedTasks;
        this.failedTasks = failedTasks;
        this.totalTokens = totalTokens;
        this.totalCostUsd = totalCostUsd;
    }

    @JsonProperty("total_tasks")
    public long getTotalTasks() {
        return totalTasks;
    }

    @JsonProperty("completed_tasks")
    public long getCompletedTasks() {
        return completedTasks;
    }

    @JsonProperty("failed_tasks")
    public long getFailedTasks() {
        return failedTasks;
    }

    @JsonProperty("total_tokens")
    public long getTotalTokens() {
        return totalTokens;
    }

    @JsonProperty("total_cost_usd")
    public double getTotalCostUsd() {
        return totalCostUsd;
    }

    /**
     * Completed share of finished tasks, 0.0 before anything finished.
     */
    @JsonProperty("success_rate")
    public double getSuccessRate() {
        long finished = completedTasks + failedTasks;
        return finished == 0 ? 0.0 : (double) completedTasks / finished;
    }

    @Override
    public String toString() {
        return String.format("UsageStatistics{total=%d, completed=%d, failed=%d, tokens=%d, cost=%.4f}",
                totalTasks, completedTasks, failedTasks, totalTokens, totalCostUsd);
    }
}
