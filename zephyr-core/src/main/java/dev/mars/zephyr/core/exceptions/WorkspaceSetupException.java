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
 * Failure of a workspace subprocess step (clone, checkout, archive).
 *
 * <p>The exception message is the captured process output, so it can be stored
 * verbatim as the workspace error message.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkspaceSetupException extends ZephyrException {

    private final String workspaceId;
    private final String step;
    private final int exitCode;

    public WorkspaceSetupException(String workspaceId, String step, int exitCode, String output) {
        super(output);
        this.workspaceId = workspaceId;
        this.step = step;
        this.exitCode = exitCode;
    }

    public WorkspaceSetupException(String workspaceId, String step, String message, Throwable cause) {
        super(message, cause);
        this.workspaceId = workspaceId;
        this.step = step;
        this.exitCode = -1;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getStep() {
        return step;
    }

    public int getExitCode() {
        return exitCode;
    }
}
