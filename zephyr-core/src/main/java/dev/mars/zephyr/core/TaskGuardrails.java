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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Policy limits attached to a task by the backend. They are carried through
 * to the provider context, not enforced by the scheduling logic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskGuardrails {

    @JsonProperty("cost_cap_usd")
    private Double costCapUsd;

    @JsonProperty("time_cap_minutes")
    private Integer timeCapMinutes;

    @JsonProperty("requires_approval")
    private boolean requiresApproval;

    public TaskGuardrails() {
    }

    public TaskGuardrails(Double costCapUsd, Integer timeCapMinutes, boolean requiresApproval) {
        this.costCapUsd = costCapUsd;
        this.timeCapMinutes = timeCapMinutes;
        this.requiresApproval = requiresApproval;
    }

    public Double getCostCapUsd() {
        return costCapUsd;
    }

    public Integer getTimeCapMinutes() {
        return timeCapMinutes;
    }

    public boolean isRequiresApproval() {
        return requiresApproval;
    }

    @Override
    public String toString() {
        return "TaskGuardrails{costCapUsd=" + costCapUsd + ", timeCapMinutes=" + timeCapMinutes
                + ", requiresApproval=" + requiresApproval + "}";
    }
}
