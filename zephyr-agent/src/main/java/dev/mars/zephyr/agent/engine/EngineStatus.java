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

package dev.mars.zephyr.agent.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall state of the task execution engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum EngineStatus {

    IDLE("idle"),
    RUNNING("running"),
    PAUSED("paused"),
    ERROR("error"),
    SIGNED_OUT("signed_out");

    private final String value;

    EngineStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether new tasks may be claimed in this state.
     */
    public boolean isClaiming() {
        return this == RUNNING;
    }

    @Override
    public String toString() {
        return value;
    }
}
