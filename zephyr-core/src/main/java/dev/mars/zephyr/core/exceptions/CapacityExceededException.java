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
 * Thrown when a workspace is requested but the device has no free slot.
 * Not retried automatically; the caller decides when to try again.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class CapacityExceededException extends ZephyrException {

    private final int maxConcurrentWorkspaces;
    private final int currentWorkspaces;

    public CapacityExceededException(int maxConcurrentWorkspaces, int currentWorkspaces) {
        super(String.format("No available workspace slots (%d of %d in use)",
                currentWorkspaces, maxConcurrentWorkspaces));
        this.maxConcurrentWorkspaces = maxConcurrentWorkspaces;
        this.currentWorkspaces = currentWorkspaces;
    }

    public int getMaxConcurrentWorkspaces() {
        return maxConcurrentWorkspaces;
    }

    public int getCurrentWorkspaces() {
        return currentWorkspaces;
    }
}
