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

package dev.mars.zephyr.agent.provider;

import dev.mars.zephyr.core.TaskResult;
import io.vertx.core.Future;

import java.util.Map;

/**
 * Something that can carry out a task description and report what it did.
 *
 * <p>Implementations fail the returned future with
 * {@code ProviderExecutionException} when execution does not succeed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public interface CapabilityProvider {

    /**
     * Context key under which the engine passes the workspace directory.
     */
    String WORKSPACE_PATH = "workspace_path";

    /**
     * Execute a task.
     *
     * @param description what to do
     * @param context     additional key/value context, possibly empty
     * @return the result, with usage and cost filled in where known
     */
    Future<TaskResult> execute(String description, Map<String, Object> context);

    /**
     * Short name for logs and the status endpoint.
     */
    String getName();

    default Future<Void> shutdown() {
        return Future.succeededFuture();
    }
}
