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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Structured outcome of a successful task execution, sent to the complete endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TaskResult {

    private final String response;
    private final TokenUsage usage;
    private final String model;
    private final double executionTimeSeconds;
    private final double costUsd;

    @JsonCreator
    public TaskResult(@JsonProperty("response") String response,
                      @JsonProperty("usage") TokenUsage usage,
                      @JsonProperty("model") String model,
                      @JsonProperty("execution_time_seconds") double executionTimeSeconds,
                      @JsonProperty("cost_usd") double costUsd) {
        this.response = response == null ? "" : response;
        this.usage = usage == null ? TokenUsage.NONE : usage;
        this.model = model;
        this.executionTimeSeconds = executionTimeSeconds;
        this.costUsd = costUsd;
    }

    @JsonProperty("response")
    public String getResponse() {
        return response;
    }

    @JsonProperty("usage")
    public TokenUsage getUsage() {
        return usage;
    }

    @JsonProperty("model")
    public String getModel() {
        return model;
    }

    @JsonProperty("execution_time_seconds")
    public double getExecutionTimeSeconds() {
        return executionTimeSeconds;
    }

    @JsonProperty("cost_usd")
    public double getCostUsd() {
        return costUsd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskResult)) return false;
        TaskResult that = (TaskResult) o;
        return Double.compare(that.executionTimeSeconds, executionTimeSeconds) == 0
                && Double.compare(that.costUsd, costUsd) == 0
                && response.equals(that.response)
                && usage.equals(that.usage)
                && Objects.equals(model, that.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(response, usage, model, executionTimeSeconds, costUsd);
    }

    @Override
    public String toString() {
        return "TaskResult{model=" + model + ", usage=" + usage
                + ", executionTimeSeconds=" + executionTimeSeconds + ", costUsd=" + costUsd + "}";
    }
}
