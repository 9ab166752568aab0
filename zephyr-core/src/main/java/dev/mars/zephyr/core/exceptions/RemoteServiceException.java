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
 * Network or server side failure talking to the remote backend.
 * The operation is abandoned for this cycle and retried by the next poll or tick.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class RemoteServiceException extends ZephyrException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final String endpoint;
    private final int statusCode;

    public RemoteServiceException(String endpoint, int statusCode, String message) {
        super(String.format("%s failed (HTTP %d): %s", endpoint, statusCode, message));
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public RemoteServiceException(String endpoint, Throwable cause) {
        super(String.format("%s failed: %s", endpoint, cause.getMessage()), cause);
        this.endpoint = endpoint;
        this.statusCode = NO_RESPONSE;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
