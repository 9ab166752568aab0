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

package dev.mars.zephyr.agent.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Immutable settings handed to every agent service.
 *
 * <p>Production code builds it from {@link AgentConfig} with
 * {@link #fromEnvironment()}; tests use the {@link Builder} directly and point
 * {@code apiUrl} at a local server.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class AgentConfiguration {

    private final String agentName;
    private final String version;
    private final String apiUrl;
    private final String apiToken;
    private final int pollingIntervalSeconds;
    private final int maxConcurrentTasks;
    private final int taskTimeoutSeconds;
    private final boolean workspacePerTask;
    private final boolean archiveWorkspaces;
    private final int failureReportRetries;
    private final long heartbeatIntervalMs;
    private final int processTimeoutSeconds;
    private final int agentPort;
    private final int httpConnectionTimeout;
    private final int httpIdleTimeout;
    private final ProviderMode providerMode;
    private final String providerUrl;
    private final String providerApiKey;
    private final String providerModel;
    private final int providerMaxTokens;
    private final String cliPath;
    private final String deviceId;
    private final String deviceName;
    private final String workspaceRoot;
    private final int maxConcurrentWorkspaces;
    private final int maxDiskUsageGb;

    private AgentConfiguration(Builder b) {
        this.agentName = b.agentName;
        this.version = b.version;
        this.apiUrl = stripTrailingSlash(b.apiUrl);
        this.apiToken = b.apiToken;
        this.pollingIntervalSeconds = b.pollingIntervalSeconds;
        this.maxConcurrentTasks = b.maxConcurrentTasks;
        this.taskTimeoutSeconds = b.taskTimeoutSeconds;
        this.workspacePerTask = b.workspacePerTask;
        this.archiveWorkspaces = b.archiveWorkspaces;
        this.failureReportRetries = b.failureReportRetries;
        this.heartbeatIntervalMs = b.heartbeatIntervalMs;
        this.processTimeoutSeconds = b.processTimeoutSeconds;
        this.agentPort = b.agentPort;
        this.httpConnectionTimeout = b.httpConnectionTimeout;
        this.httpIdleTimeout = b.httpIdleTimeout;
        this.providerMode = b.providerMode;
        this.providerUrl = b.providerUrl;
        this.providerApiKey = b.providerApiKey;
        this.providerModel = b.providerModel;
        this.providerMaxTokens = b.providerMaxTokens;
        this.cliPath = b.cliPath;
        this.deviceId = b.deviceId;
        this.deviceName = b.deviceName;
        this.workspaceRoot = b.workspaceRoot;
        this.maxConcurrentWorkspaces = b.maxConcurrentWorkspaces;
        this.maxDiskUsageGb = b.maxDiskUsageGb;
    }

    /**
     * Build from the layered properties loader.
     *
     * @throws IllegalArgumentException if a value is out of bounds
     */
    public static AgentConfiguration fromEnvironment() {
        AgentConfig config = AgentConfig.get();
        return new Builder()
                .agentName(config.getAgentName())
                .version(config.getVersion())
                .apiUrl(config.getApiUrl())
                .apiToken(config.getApiToken())
                .pollingIntervalSeconds(config.getPollingIntervalSeconds())
                .maxConcurrentTasks(config.getMaxConcurrentTasks())
                .taskTimeoutSeconds(config.getTaskTimeoutSeconds())
                .workspacePerTask(config.isWorkspacePerTask())
                .archiveWorkspaces(config.isArchiveWorkspaces())
                .failureReportRetries(config.getFailureReportRetries())
                .heartbeatIntervalMs(config.getHeartbeatIntervalMs())
                .processTimeoutSeconds(config.getProcessTimeoutSeconds())
                .agentPort(config.getAgentPort())
                .httpConnectionTimeout(config.getHttpConnectionTimeoutMs())
                .httpIdleTimeout(config.getHttpIdleTimeoutSeconds())
                .providerMode(ProviderMode.fromValue(config.getProviderMode()))
                .providerUrl(config.getProviderUrl())
                .providerApiKey(config.getProviderApiKey())
                .providerModel(config.getProviderModel())
                .providerMaxTokens(config.getProviderMaxTokens())
                .cliPath(config.getCliPath())
                .deviceId(config.getDeviceId())
                .deviceName(config.getDeviceName())
                .workspaceRoot(config.getWorkspaceRoot())
                .maxConcurrentWorkspaces(config.getMaxConcurrentWorkspaces())
                .maxDiskUsageGb(config.getMaxDiskUsageGb())
                .build();
    }

    public String getAgentName() {
        return agentName;
    }

    public String getVersion() {
        return version;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public int getPollingIntervalSeconds() {
        return pollingIntervalSeconds;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public int getTaskTimeoutSeconds() {
        return taskTimeoutSeconds;
    }

    public Duration getTaskTimeout() {
        return Duration.ofSeconds(taskTimeoutSeconds);
    }

    public boolean isWorkspacePerTask() {
        return workspacePerTask;
    }

    public boolean isArchiveWorkspaces() {
        return archiveWorkspaces;
    }

    public int getFailureReportRetries() {
        return failureReportRetries;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public Duration getProcessTimeout() {
        return Duration.ofSeconds(processTimeoutSeconds);
    }

    public int getAgentPort() {
        return agentPort;
    }

    /**
     * Connect timeout for remote calls, in milliseconds.
     */
    public int getHttpConnectionTimeout() {
        return httpConnectionTimeout;
    }

    /**
     * Idle timeout for pooled connections, in seconds.
     */
    public int getHttpIdleTimeout() {
        return httpIdleTimeout;
    }

    public ProviderMode getProviderMode() {
        return providerMode;
    }

    public String getProviderUrl() {
        return providerUrl;
    }

    public String getProviderApiKey() {
        return providerApiKey;
    }

    public String getProviderModel() {
        return providerModel;
    }

    public int getProviderMaxTokens() {
        return providerMaxTokens;
    }

    public String getCliPath() {
        return cliPath;
    }

    /**
     * Configured hardware id override; empty when it should be derived.
     */
    public String getDeviceId() {
        return deviceId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public Path getWorkspaceRoot() {
        return Paths.get(workspaceRoot);
    }

    public int getMaxConcurrentWorkspaces() {
        return maxConcurrentWorkspaces;
    }

    public int getMaxDiskUsageGb() {
        return maxDiskUsageGb;
    }

    public String getUserAgent() {
        return "ZephyrExecutor/" + version;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "AgentConfiguration{agentName='" + agentName + "', apiUrl='" + apiUrl
                + "', pollingIntervalSeconds=" + pollingIntervalSeconds
                + ", maxConcurrentTasks=" + maxConcurrentTasks
                + ", providerMode=" + providerMode
                + ", workspaceRoot='" + workspaceRoot + "'}";
    }

    /**
     * Builder for agent configurations. Defaults match the properties defaults.
     */
    public static class Builder {
        private String agentName = "zephyr-executor-1";
        private String version = "1.0.0";
        private String apiUrl = "http://localhost:3001/api";
        private String apiToken = "";
        private int pollingIntervalSeconds = 30;
        private int maxConcurrentTasks = 2;
        private int taskTimeoutSeconds = 600;
        private boolean workspacePerTask;
        private boolean archiveWorkspaces;
        private int failureReportRetries = 3;
        private long heartbeatIntervalMs = 30000;
        private int processTimeoutSeconds = 300;
        private int agentPort = 8090;
        private int httpConnectionTimeout = 5000;
        private int httpIdleTimeout = 30;
        private ProviderMode providerMode = ProviderMode.API;
        private String providerUrl = "https://api.anthropic.com/v1/messages";
        private String providerApiKey = "";
        private String providerModel = "claude-sonnet-4-20250514";
        private int providerMaxTokens = 4096;
        private String cliPath = "/usr/local/bin/claude";
        private String deviceId = "";
        private String deviceName = "zephyr-device";
        private String workspaceRoot = Paths.get(System.getProperty("user.home"), ".zephyros", "workspaces").toString();
        private int maxConcurrentWorkspaces = 5;
        private int maxDiskUsageGb = 100;

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder pollingIntervalSeconds(int pollingIntervalSeconds) {
            this.pollingIntervalSeconds = pollingIntervalSeconds;
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder taskTimeoutSeconds(int taskTimeoutSeconds) {
            this.taskTimeoutSeconds = taskTimeoutSeconds;
            return this;
        }

        public Builder workspacePerTask(boolean workspacePerTask) {
            this.workspacePerTask = workspacePerTask;
            return this;
        }

        public Builder archiveWorkspaces(boolean archiveWorkspaces) {
            this.archiveWorkspaces = archiveWorkspaces;
            return this;
        }

        public Builder failureReportRetries(int failureReportRetries) {
            this.failureReportRetries = failureReportRetries;
            return this;
        }

        public Builder heartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
            return this;
        }

        public Builder processTimeoutSeconds(int processTimeoutSeconds) {
            this.processTimeoutSeconds = processTimeoutSeconds;
            return this;
        }

        public Builder agentPort(int agentPort) {
            this.agentPort = agentPort;
            return this;
        }

        public Builder httpConnectionTimeout(int httpConnectionTimeout) {
            this.httpConnectionTimeout = httpConnectionTimeout;
            return this;
        }

        public Builder httpIdleTimeout(int httpIdleTimeout) {
            this.httpIdleTimeout = httpIdleTimeout;
            return this;
        }

        public Builder providerMode(ProviderMode providerMode) {
            this.providerMode = providerMode;
            return this;
        }

        public Builder providerUrl(String providerUrl) {
            this.providerUrl = providerUrl;
            return this;
        }

        public Builder providerApiKey(String providerApiKey) {
            this.providerApiKey = providerApiKey;
            return this;
        }

        public Builder providerModel(String providerModel) {
            this.providerModel = providerModel;
            return this;
        }

        public Builder providerMaxTokens(int providerMaxTokens) {
            this.providerMaxTokens = providerMaxTokens;
            return this;
        }

        public Builder cliPath(String cliPath) {
            this.cliPath = cliPath;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder deviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder workspaceRoot(String workspaceRoot) {
            this.workspaceRoot = workspaceRoot;
            return this;
        }

        public Builder maxConcurrentWorkspaces(int maxConcurrentWorkspaces) {
            this.maxConcurrentWorkspaces = maxConcurrentWorkspaces;
            return this;
        }

        public Builder maxDiskUsageGb(int maxDiskUsageGb) {
            this.maxDiskUsageGb = maxDiskUsageGb;
            return this;
        }

        public AgentConfiguration build() {
            require(agentName != null && !agentName.isBlank(), "agentName must not be empty");
            require(apiUrl != null && (apiUrl.startsWith("http://") || apiUrl.startsWith("https://")),
                    "apiUrl must start with http:// or https://, got: " + apiUrl);
            require(pollingIntervalSeconds >= 10 && pollingIntervalSeconds <= 300,
                    "pollingIntervalSeconds must be between 10 and 300, got: " + pollingIntervalSeconds);
            require(maxConcurrentTasks >= 1 && maxConcurrentTasks <= 10,
                    "maxConcurrentTasks must be between 1 and 10, got: " + maxConcurrentTasks);
            require(taskTimeoutSeconds > 0, "taskTimeoutSeconds must be positive");
            require(failureReportRetries >= 0, "failureReportRetries must not be negative");
            require(heartbeatIntervalMs > 0, "heartbeatIntervalMs must be positive");
            require(processTimeoutSeconds > 0, "processTimeoutSeconds must be positive");
            require(agentPort >= 0 && agentPort <= 65535, "agentPort must be between 0 and 65535");
            require(httpConnectionTimeout > 0, "httpConnectionTimeout must be positive");
            require(httpIdleTimeout > 0, "httpIdleTimeout must be positive");
            require(providerMode != null, "providerMode must be set");
            require(providerMaxTokens >= 100, "providerMaxTokens must be at least 100, got: " + providerMaxTokens);
            require(workspaceRoot != null && !workspaceRoot.isBlank(), "workspaceRoot must not be empty");
            require(maxConcurrentWorkspaces >= 1, "maxConcurrentWorkspaces must be at least 1");
            require(maxDiskUsageGb >= 1, "maxDiskUsageGb must be at least 1");
            if (apiToken == null) {
                apiToken = "";
            }
            if (deviceId == null) {
                deviceId = "";
            }
            return new AgentConfiguration(this);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
