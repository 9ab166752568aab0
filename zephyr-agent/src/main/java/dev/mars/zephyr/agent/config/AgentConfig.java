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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Centralized configuration loader for the Zephyr executor agent.
 *
 * <p>Loads {@code zephyr-agent.properties} from the classpath. Every key can be
 * overridden by an environment variable ({@code zephyr.api.url} becomes
 * {@code ZEPHYR_API_URL}) or a system property.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    static final String CONFIG_FILE = "zephyr-agent.properties";
    private static final AgentConfig INSTANCE = new AgentConfig();

    private final Properties properties;

    private AgentConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    AgentConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AgentConfig get() {
        return INSTANCE;
    }

    // ==================== Agent Identity ====================

    public String getAgentName() {
        String name = getString("zephyr.agent.name", "");
        if (name.isEmpty()) {
            name = "zephyr-executor-1";
        }
        return name;
    }

    public String getVersion() {
        return getString("zephyr.agent.version", "1.0.0");
    }

    // ==================== Remote API ====================

    public String getApiUrl() {
        return getString("zephyr.api.url", "http://localhost:3001/api");
    }

    public String getApiToken() {
        return getString("zephyr.api.token", "");
    }

    // ==================== Task Execution ====================

    public int getPollingIntervalSeconds() {
        return getInt("zephyr.agent.polling.interval-seconds", 30);
    }

    public int getMaxConcurrentTasks() {
        return getInt("zephyr.agent.tasks.max-concurrent", 2);
    }

    public int getTaskTimeoutSeconds() {
        return getInt("zephyr.agent.tasks.timeout-seconds", 600);
    }

    public boolean isWorkspacePerTask() {
        return getBoolean("zephyr.agent.tasks.workspace-per-task", false);
    }

    /**
     * Pack a task's workspace into an archive before it is cleaned up.
     */
    public boolean isArchiveWorkspaces() {
        return getBoolean("zephyr.agent.tasks.archive-workspaces", false);
    }

    public int getFailureReportRetries() {
        return getInt("zephyr.agent.tasks.failure-report-retries", 3);
    }

    public long getHeartbeatIntervalMs() {
        return getLong("zephyr.agent.heartbeat.interval-ms", 30000);
    }

    public int getProcessTimeoutSeconds() {
        return getInt("zephyr.agent.process.timeout-seconds", 300);
    }

    public int getAgentPort() {
        return getInt("zephyr.agent.port", 8090);
    }

    public int getHttpConnectionTimeoutMs() {
        return getInt("zephyr.agent.http.connect-timeout-ms", 5000);
    }

    public int getHttpIdleTimeoutSeconds() {
        return getInt("zephyr.agent.http.idle-timeout-seconds", 30);
    }

    // ==================== Capability Provider ====================

    public String getProviderMode() {
        return getString("zephyr.provider.mode", "api");
    }

    public String getProviderUrl() {
        return getString("zephyr.provider.url", "https://api.anthropic.com/v1/messages");
    }

    public String getProviderApiKey() {
        return getString("zephyr.provider.api-key", "");
    }

    public String getProviderModel() {
        return getString("zephyr.provider.model", "claude-sonnet-4-20250514");
    }

    public int getProviderMaxTokens() {
        return getInt("zephyr.provider.max-tokens", 4096);
    }

    public String getCliPath() {
        return getString("zephyr.provider.cli-path", "/usr/local/bin/claude");
    }

    // ==================== Device ====================

    /**
     * Configured hardware id override, empty when the id is derived from the machine.
     */
    public String getDeviceId() {
        return getString("zephyr.device.id", "");
    }

    public String getDeviceName() {
        String name = getString("zephyr.device.name", "");
        return name.isEmpty() ? deriveHostname() : name;
    }

    public String getWorkspaceRoot() {
        String root = getString("zephyr.device.workspace-root", "");
        if (root.isEmpty()) {
            return Paths.get(System.getProperty("user.home"), ".zephyros", "workspaces").toString();
        }
        if (root.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), root.substring(2)).toString();
        }
        return root;
    }

    public int getMaxConcurrentWorkspaces() {
        return getInt("zephyr.device.workspaces.max-concurrent", 5);
    }

    public int getMaxDiskUsageGb() {
        return getInt("zephyr.device.disk.max-usage-gb", 100);
    }

    // ==================== Telemetry Configuration ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("zephyr.agent.telemetry.enabled", true);
    }

    public int getPrometheusPort() {
        return getInt("zephyr.agent.telemetry.prometheus.port", 9465);
    }

    public String getOtlpEndpoint() {
        return getString("zephyr.agent.telemetry.otlp.endpoint", "http://localhost:4317");
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., ZEPHYR_API_URL)</li>
     *   <li>System property (e.g., -Dzephyr.api.url=...)</li>
     *   <li>Properties file (zephyr-agent.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that required configuration is present and values are sensible.
     * Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if required configuration is invalid
     */
    public void validate() {
        String apiUrl = getApiUrl();
        if (!apiUrl.startsWith("http://") && !apiUrl.startsWith("https://")) {
            throw new IllegalStateException("API URL must start with http:// or https://, got: " + apiUrl);
        }

        int port = getAgentPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("Agent port must be between 0 and 65535, got: " + port);
        }

        int polling = getPollingIntervalSeconds();
        if (polling < 10 || polling > 300) {
            throw new IllegalStateException("Polling interval must be between 10 and 300 seconds, got: " + polling);
        }
        int maxTasks = getMaxConcurrentTasks();
        if (maxTasks < 1 || maxTasks > 10) {
            throw new IllegalStateException("Max concurrent tasks must be between 1 and 10, got: " + maxTasks);
        }
        if (getHeartbeatIntervalMs() <= 0) {
            throw new IllegalStateException("Heartbeat interval must be positive, got: " + getHeartbeatIntervalMs());
        }
        if (getProviderMaxTokens() < 100) {
            throw new IllegalStateException("Provider max tokens must be at least 100, got: " + getProviderMaxTokens());
        }
        try {
            ProviderMode mode = ProviderMode.fromValue(getProviderMode());
            if (mode == ProviderMode.API && getProviderApiKey().isEmpty()) {
                logger.warn("Provider mode is 'api' but zephyr.provider.api-key is not set; executions will be rejected");
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        if (getApiToken().isEmpty()) {
            logger.warn("zephyr.api.token is not set; the task API will answer 401 and the agent will sign out");
        }

        logger.info("Agent configuration validated successfully");
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    private static String deriveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname, using pid-based device name");
            return "device-" + ProcessHandle.current().pid();
        }
    }

    private void logConfiguration() {
        logger.info("=== Zephyr Executor Configuration ===");
        logger.info("  Agent Name:           {}", getAgentName());
        logger.info("  Version:              {}", getVersion());
        logger.info("  API URL:              {}", getApiUrl());
        logger.info("  API Token:            {}", getApiToken().isEmpty() ? "(not set)" : "****");
        logger.info("  Health Port:          {}", getAgentPort());
        logger.info("  --- Tasks ---");
        logger.info("  Poll Interval:        {}s", getPollingIntervalSeconds());
        logger.info("  Max Concurrent:       {}", getMaxConcurrentTasks());
        logger.info("  Task Timeout:         {}s", getTaskTimeoutSeconds());
        logger.info("  Workspace Per Task:   {}", isWorkspacePerTask());
        logger.info("  Archive Workspaces:   {}", isArchiveWorkspaces());
        logger.info("  --- Provider ---");
        logger.info("  Mode:                 {}", getProviderMode());
        logger.info("  Model:                {}", getProviderModel());
        logger.info("  Max Tokens:           {}", getProviderMaxTokens());
        logger.info("  CLI Path:             {}", getCliPath());
        logger.info("  --- Device ---");
        logger.info("  Device Name:          {}", getDeviceName());
        logger.info("  Workspace Root:       {}", getWorkspaceRoot());
        logger.info("  Max Workspaces:       {}", getMaxConcurrentWorkspaces());
        logger.info("  Max Disk:             {} GB", getMaxDiskUsageGb());
        logger.info("  Heartbeat Interval:   {}ms", getHeartbeatIntervalMs());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  Prometheus Port:      {}", getPrometheusPort());
        logger.info("  OTLP Endpoint:        {}", getOtlpEndpoint());
        logger.info("=====================================");
    }
}
