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

/**
 * Kind of file recorded as a workspace artifact.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ArtifactType {

    SOURCE_CODE("source_code"),
    CONFIG("config"),
    DOCUMENTATION("documentation"),
    TEST("test"),
    BUILD_OUTPUT("build_output"),
    LOG("log"),
    RESULT("result"),
    PROMPT("prompt"),
    SCREENSHOT("screenshot"),
    DATA("data"),
    OTHER("other");

    private final String value;

    ArtifactType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ArtifactType fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        for (ArtifactType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ArtifactType: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
