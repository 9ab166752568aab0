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

/**
 * Resource usage of a workspace at a point in time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceMetrics {

    @JsonProperty("workspace_id")
    private String workspaceId;

    @JsonProperty("metric_type")
    private MetricType metricType = MetricType.SNAPSHOT;

    @JsonProperty("disk_usage_bytes")
    private long diskUsageBytes;

    @JsonProperty("file_count")
    private int fileCount;

    @JsonProperty("memory_usage_mb")
    private Double memoryUsageMb;

    @JsonProperty("recorded_at")
    private Instant recordedAt;

    public WorkspaceMetrics() {
    }

    public static WorkspaceMetrics snapshot(String workspaceId, long diskUsageBytes, int fileCount) {
        WorkspaceMetrics metrics = new WorkspaceMetrics();
        metrics.workspaceId = workspaceId;
        metrics.metricType = MetricType.SNAPSHOT;
        metrics.diskUsageBytes = diskUsageBytes;
        metrics.fileCount = fileCount;
        metrics.recordedAt = Instant.now();
        return metrics;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public long getDiskUsageBytes() {
        return diskUsageBytes;
    }

    public int getFileCount() {
        return fileCount;
    }

    public Double getMemoryUsageMb() {
        return memoryUsageMb;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
