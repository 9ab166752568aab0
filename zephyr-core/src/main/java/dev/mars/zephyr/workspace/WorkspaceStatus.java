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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a workspace on an executor device.
 *
 * <pre>
 *   CREATING     → INITIALIZING
 *   INITIALIZING → CLONING, READY
 *   CLONING      → READY
 *   READY        → ASSIGNED
 *   ASSIGNED     → RUNNING
 *   RUNNING      → PAUSED, COMPLETED
 *   PAUSED       → RUNNING
 *   any of the above → FAILED, CLEANUP
 *   COMPLETED, FAILED → CLEANUP (a workspace ends in one or the other, never both)
 *   CLEANUP      → ARCHIVED
 *   ARCHIVED     → (terminal)
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum WorkspaceStatus {

    CREATING("creating", "Record created, setup not started"),
    INITIALIZING("initializing", "Creating directory layout"),
    CLONING("cloning", "Cloning repository"),
    READY("ready", "Ready to accept a task"),
    ASSIGNED("assigned", "Task assigned"),
    RUNNING("running", "Task running"),
    PAUSED("paused", "Task paused"),
    COMPLETED("completed", "Task finished"),
    FAILED("failed", "Setup or execution failed"),
    CLEANUP("cleanup", "Removing workspace files"),
    ARCHIVED("archived", "Removed and archived");

    private static final Map<WorkspaceStatus, Set<WorkspaceStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<WorkspaceStatus, Set<WorkspaceStatus>>(WorkspaceStatus.class);
        map.put(CREATING, EnumSet.of(INITIALIZING, FAILED, CLEANUP));
        map.put(INITIALIZING, EnumSet.of(CLONING, READY, FAILED, CLEANUP));
        map.put(CLONING, EnumSet.of(READY, FAILED, CLEANUP));
        map.put(READY, EnumSet.of(ASSIGNED, FAILED, CLEANUP));
        map.put(ASSIGNED, EnumSet.of(RUNNING, FAILED, CLEANUP));
        map.put(RUNNING, EnumSet.of(PAUSED, COMPLETED, FAILED, CLEANUP));
        map.put(PAUSED, EnumSet.of(RUNNING, FAILED, CLEANUP));
        map.put(COMPLETED, EnumSet.of(CLEANUP));
        map.put(FAILED, EnumSet.of(CLEANUP));
        map.put(CLEANUP, EnumSet.of(ARCHIVED));
        map.put(ARCHIVED, EnumSet.noneOf(WorkspaceStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    WorkspaceStatus(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Still occupying a slot on the device.
     */
    public boolean isActive() {
        return this != CLEANUP && this != ARCHIVED;
    }

    /**
     * Setup still in progress.
     */
    public boolean isSettingUp() {
        return this == CREATING || this == INITIALIZING || this == CLONING;
    }

    public boolean canTransitionTo(WorkspaceStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(WorkspaceStatus.class)).contains(target);
    }

    public Set<WorkspaceStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    @JsonCreator
    public static WorkspaceStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Workspace status value must not be null");
        }
        for (WorkspaceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown workspace status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
