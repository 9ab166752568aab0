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

import dev.mars.zephyr.core.Task;

/**
 * Callbacks for engine state changes. All methods default to no-ops so
 * listeners override only what they need.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface ExecutorListener {

    /**
     * A poll tick fetched {@code pending} tasks and claimed {@code claimed} of them.
     */
    default void onPoll(int pending, int claimed) {
    }

    default void onTaskTransition(Task task) {
    }

    default void onStatusChange(EngineStatus previous, EngineStatus current) {
    }

    /**
     * The backend rejected the credentials; the engine has stopped for good.
     */
    default void onSignedOut(String reason) {
    }
}
