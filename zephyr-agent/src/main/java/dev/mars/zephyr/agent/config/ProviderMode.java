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

/**
 * How tasks are executed: against the hosted messages API, or by running the
 * CLI inside a workspace.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ProviderMode {

    API("api"),
    TERMINAL("terminal");

    private final String value;

    ProviderMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ProviderMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return API;
        }
        for (ProviderMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown provider mode: " + value + " (expected api or terminal)");
    }

    @Override
    public String toString() {
        return value;
    }
}
