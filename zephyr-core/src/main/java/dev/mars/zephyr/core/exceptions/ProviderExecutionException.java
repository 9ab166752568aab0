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

package dev.mars.zephyr.core.exceptions;

/**
 * The capability provider (LLM API or CLI tool) failed to execute a task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ProviderExecutionException extends ZephyrException {

    private final int statusCode;

    public ProviderExecutionException(String message) {
        this(message, -1);
    }

    public ProviderExecutionException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status (API provider) or exit code (CLI provider), -1 when unknown.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
