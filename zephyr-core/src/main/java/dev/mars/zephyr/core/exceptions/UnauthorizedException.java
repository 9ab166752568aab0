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
 * Raised when the remote backend answers HTTP 401.
 *
 * <p>Unauthorized is fatal to the whole session: callers must stop polling and
 * sign the agent out rather than retrying.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class UnauthorizedException extends ZephyrException {

    private final String endpoint;

    public UnauthorizedException(String endpoint) {
        super("Unauthorized - check API credentials (" + endpoint + ")");
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
