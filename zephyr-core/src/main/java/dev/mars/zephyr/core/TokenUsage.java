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
 * Token counts reported by a capability provider for one execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TokenUsage {

    public static final TokenUsage NONE = new TokenUsage(0, 0);

    private final long inputTokens;
    private final long outputTokens;

    @JsonCreator
    public TokenUsage(@JsonProperty("input_tokens") long inputTokens,
                      @JsonProperty("output_tokens") long outputTokens) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
    }

    @JsonProperty("input_tokens")
    public long getInputTokens() {
        return inputTokens;
    }

    @JsonProperty("output_tokens")
    public long getOutputTokens() {
        return outputTokens;
    }

    @JsonProperty("total_tokens")
    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenUsage)) return false;
        TokenUsage that = (TokenUsage) o;
        return inputTokens == that.inputTokens && outputTokens == that.outputTokens;
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputTokens, outputTokens);
    }

    @Override
    public String toString() {
        return "TokenUsage{input=" + inputTokens + ", output=" + outputTokens + "}";
    }
}
