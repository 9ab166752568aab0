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

package dev.mars.zephyr.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A machine registered with the backend as a host for workspaces.
 *
 * <p>{@code id} is the backend record id, {@code deviceId} the stable hardware
 * identifier the agent derives locally and uses to find its own record again
 * after a restart.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Device {

    public static final int DEFAULT_MAX_CONCURRENT_WORKSPACES = 5;
    public static final int DEFAULT_MAX_DISK_USAGE_GB = 100;
    public static final int DEFAULT_TIMEOUT_MINUTES = 60;

    private static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

    @JsonProperty("id")
    private String id;

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("device_name")
    private String deviceName;

    @JsonProperty("platform")
    private String platform;

    @JsonProperty("os_version")
    private String osVersion;

    @JsonProperty("executor_version")
    private String executorVersion;

    @JsonProperty("root_workspace_path")
    private String rootWorkspacePath;

    @JsonProperty("max_concurrent_workspaces")
    private int maxConcurrentWorkspaces = DEFAULT_MAX_CONCURRENT_WORKSPACES;

    @JsonProperty("max_disk_usage_gb")
    private int maxDiskUsageGb = DEFAULT_MAX_DISK_USAGE_GB;

    @JsonProperty("default_shell")
    private String defaultShell;

    @JsonProperty("default_timeout_minutes")
    private int defaultTimeoutMinutes = DEFAULT_TIMEOUT_MINUTES;

    @JsonProperty("status")
    private DeviceStatus status = DeviceStatus.ACTIVE;

    @JsonProperty("is_online")
    private boolean online;

    @JsonProperty("last_heartbeat_at")
    private Instant lastHeartbeatAt;

    @JsonProperty("current_workspaces_count")
    private int currentWorkspacesCount;

    @JsonProperty("current_disk_usage_gb")
    private double currentDiskUsageGb;

    @JsonProperty("created_at")
    private Instant createdAt;

    public Device() {
    }

    public Device(String deviceId, String deviceName) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.deviceName = deviceName;
    }

    /**
     * Workspace slots left on this device. Never negative, even when the
     * backend count overshoots the configured maximum.
     */
    @JsonIgnore
    public int getAvailableSlots() {
        return Math.max(0, maxConcurrentWorkspaces - currentWorkspacesCount);
    }

    @JsonIgnore
    public long getMaxDiskUsageBytes() {
        return maxDiskUsageGb * BYTES_PER_GB;
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status != null && status.canAcceptWork() && online;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(String platform) {
        this.platform = platform;
    }

    public String getOsVersion() {
        return osVersion;
    }

    public void setOsVersion(String osVersion) {
        this.osVersion = osVersion;
    }

    public String getExecutorVersion() {
        return executorVersion;
    }

    public void setExecutorVersion(String executorVersion) {
        this.executorVersion = executorVersion;
    }

    public String getRootWorkspacePath() {
        return rootWorkspacePath;
    }

    public void setRootWorkspacePath(String rootWorkspacePath) {
        this.rootWorkspacePath = rootWorkspacePath;
    }

    public int getMaxConcurrentWorkspaces() {
        return maxConcurrentWorkspaces;
    }

    public void setMaxConcurrentWorkspaces(int maxConcurrentWorkspaces) {
        this.maxConcurrentWorkspaces = maxConcurrentWorkspaces;
    }

    public int getMaxDiskUsageGb() {
        return maxDiskUsageGb;
    }

    public void setMaxDiskUsageGb(int maxDiskUsageGb) {
        this.maxDiskUsageGb = maxDiskUsageGb;
    }

    public String getDefaultShell() {
        return defaultShell;
    }

    public void setDefaultShell(String defaultShell) {
        this.defaultShell = defaultShell;
    }

    public int getDefaultTimeoutMinutes() {
        return defaultTimeoutMinutes;
    }

    public void setDefaultTimeoutMinutes(int defaultTimeoutMinutes) {
        this.defaultTimeoutMinutes = defaultTimeoutMinutes;
    }

    public DeviceStatus getStatus() {
        return status;
    }

    public void setStatus(DeviceStatus status) {
        this.status = status;
    }

    public boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public void setLastHeartbeatAt(Instant lastHeartbeatAt) {
        this.lastHeartbeatAt = lastHeartbeatAt;
    }

    public int getCurrentWorkspacesCount() {
        return currentWorkspacesCount;
    }

    public void setCurrentWorkspacesCount(int currentWorkspacesCount) {
        this.currentWorkspacesCount = currentWorkspacesCount;
    }

    public double getCurrentDiskUsageGb() {
        return currentDiskUsageGb;
    }

    public void setCurrentDiskUsageGb(double currentDiskUsageGb) {
        this.currentDiskUsageGb = currentDiskUsageGb;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Device)) return false;
        Device device = (Device) o;
        return Objects.equals(id, device.id) && Objects.equals(deviceId, device.deviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, deviceId);
    }

    @Override
    public String toString() {
        return "Device{id='" + id + "', deviceId='" + deviceId + "', name='" + deviceName
                + "', status=" + status + ", workspaces=" + currentWorkspacesCount
                + "/" + maxConcurrentWorkspaces + "}";
    }
}
