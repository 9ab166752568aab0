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

package dev.mars.zephyr.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a task as seen by the executor.
 *
 * <pre>
 *   PENDING   → ACCEPTED, CANCELLED
 *   ACCEPTED  → RUNNING, FAILED, CANCELLED
 *   RUNNING   → COMPLETED, FAILED, CANCELLED, PAUSED
 *   PAUSED    → RUNNING, FAILED, CANCELLED
 *   COMPLETED, FAILED, CANCELLED → (terminal)
 * </pre>
 *
 * <p>{@code FAILED} is terminal locally: retries are owned by the backend, which
 * may hand the task out again as a new pending entry.</p>
 *
 * <p>The wire value of {@link #RUNNING} is {@code in_progress}, matching the
 * task API vocabulary; {@code running} is accepted on input as well.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum TaskStatus {

    PENDING("pending", "Waiting to be claimed"),
    ACCEPTED("accepted", "Claimed by an executor"),
    RUNNING("in_progress", "Executing"),
    PAUSED("paused", "Execution paused"),
    COMPLETED("completed", "Finished successfully"),
    FAILED("failed", "Finished with an error"),
    CANCELLED("cancelled", "Cancelled before completion");

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<TaskStatus, Set<TaskStatus>>(TaskStatus.class);
        map.put(PENDING, EnumSet.of(ACCEPTED, CANCELLED));
        map.put(ACCEPTED, EnumSet.of(RUNNING, FAILED, CANCELLED));
        map.put(RUNNING, EnumSet.of(COMPLETED, FAILED, CANCELLED, PAUSED));
        map.put(PAUSED, EnumSet.of(RUNNING, FAILED, CANCELLED));
        map.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        map.put(FAILED, EnumSet.noneOf(TaskStatus.class));
        map.put(CANCELLED, EnumSet.noneOf(TaskStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    TaskStatus(String value, String description) {
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
     * Claimed and not yet finished.
     */
    public boolean isInFlight() {
        return this == ACCEPTED || this == RUNNING || this == PAUSED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(TaskStatus.class)).contains(target);
    }

    public Set<TaskStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    /**
     * Parse a status from its wire value.
     *
     * @throws IllegalArgumentException if the value is null or unknown
     */
    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status value must not be null");
        }
        if ("running".equalsIgnoreCase(value)) {
            return RUNNING;
        }
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
