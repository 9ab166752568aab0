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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgentConfig property resolution and validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class AgentConfigTest {

    private static AgentConfig configWith(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new AgentConfig(properties);
    }

    @Test
    @DisplayName("Should fall back to defaults when nothing is set")
    void testDefaults() {
        AgentConfig config = configWith();

        assertEquals("zephyr-executor-1", config.getAgentName());
        assertEquals("http://localhost:3001/api", config.getApiUrl());
        assertEquals(30, config.getPollingIntervalSeconds());
        assertEquals(2, config.getMaxConcurrentTasks());
        assertEquals(30000L, config.getHeartbeatIntervalMs());
        assertEquals("api", config.getProviderMode());
        assertFalse(config.isWorkspacePerTask());
        assertFalse(config.isArchiveWorkspaces());
        assertEquals(Paths.get(System.getProperty("user.home"), ".zephyros", "workspaces").toString(),
            config.getWorkspaceRoot());
    }

    @Test
    @DisplayName("Should read values from properties")
    void testPropertiesValues() {
        AgentConfig config = configWith(
            "zephyr.agent.name", "builder-7",
            "zephyr.agent.polling.interval-seconds", "45",
            "zephyr.agent.tasks.workspace-per-task", "true",
            "zephyr.agent.tasks.archive-workspaces", "true",
            "zephyr.provider.mode", "terminal");

        assertEquals("builder-7", config.getAgentName());
        assertEquals(45, config.getPollingIntervalSeconds());
        assertTrue(config.isWorkspacePerTask());
        assertTrue(config.isArchiveWorkspaces());
        assertEquals("terminal", config.getProviderMode());
    }

    @Test
    @DisplayName("Should expand a home-relative workspace root")
    void testHomeRelativeRoot() {
        AgentConfig config = configWith("zephyr.device.workspace-root", "~/ws");

        assertEquals(Paths.get(System.getProperty("user.home"), "ws").toString(), config.getWorkspaceRoot());
    }

    @Test
    @DisplayName("Should use the default for unparseable numbers")
    void testInvalidNumber() {
        AgentConfig config = configWith("zephyr.agent.tasks.max-concurrent", "lots");

        assertEquals(2, config.getMaxConcurrentTasks());
    }

    @Test
    @DisplayName("System properties should override the file")
    void testSystemPropertyOverride() {
        AgentConfig config = configWith("zephyr.provider.model", "from-file");
        System.setProperty("zephyr.provider.model", "from-sysprop");
        try {
            assertEquals("from-sysprop", config.getProviderModel());
        } finally {
            System.clearProperty("zephyr.provider.model");
        }
    }

    @Test
    @DisplayName("Validation should reject out-of-range values")
    void testValidate() {
        assertDoesNotThrow(() -> configWith().validate());
        assertThrows(IllegalStateException.class, () -> configWith("zephyr.api.url", "ftp://x").validate());
        assertThrows(IllegalStateException.class,
            () -> configWith("zephyr.agent.polling.interval-seconds", "5").validate());
        assertThrows(IllegalStateException.class,
            () -> configWith("zephyr.agent.tasks.max-concurrent", "11").validate());
        assertThrows(IllegalStateException.class, () -> configWith("zephyr.provider.mode", "gui").validate());
    }
}
