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

import dev.mars.zephyr.agent.config.AgentConfiguration;
import dev.mars.zephyr.core.TaskResult;
import dev.mars.zephyr.core.TokenUsage;
import dev.mars.zephyr.core.exceptions.ProviderExecutionException;
import dev.mars.zephyr.process.CommandResult;
import dev.mars.zephyr.process.ProcessRunner;
import dev.mars.zephyr.storage.WorkspaceFileManager;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Executes tasks by running the CLI non-interactively ({@code <cli> -p <prompt>})
 * inside the task's workspace.
 *
 * <p>Without a {@code workspace_path} in the context the command runs in a
 * scratch directory under the workspace root.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class CommandLineCapabilityProvider implements CapabilityProvider {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineCapabilityProvider.class);

    static final String SCRATCH_DIR = "scratch";

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final ProcessRunner processRunner;

    public CommandLineCapabilityProvider(Vertx vertx, AgentConfiguration config, ProcessRunner processRunner) {
        this.vertx = vertx;
        this.config = config;
        this.processRunner = processRunner;
    }

    @Override
    public String getName() {
        return "cli";
    }

    @Override
    public Future<TaskResult> execute(String description, Map<String, Object> context) {
        Path workingDir = resolveWorkingDir(context);
        List<String> command = List.of(config.getCliPath(), "-p", PromptBuilder.build(description, context));
        logger.info("Running {} in {}", config.getCliPath(), workingDir);

        return vertx.executeBlocking(() -> {
            WorkspaceFileManager.ensureDirectoryExists(workingDir);
            long started = System.nanoTime();
            CommandResult result;
            try {
                result = processRunner.run(command, workingDir, config.getTaskTimeout());
            } catch (IOException e) {
                throw new ProviderExecutionException("Could not start " + config.getCliPath() + ": " + e.getMessage(), e);
            }
            double seconds = (System.nanoTime() - started) / 1_000_000_000.0;

            if (result.isTimedOut()) {
                throw new ProviderExecutionException("CLI timed out after " + config.getTaskTimeoutSeconds()
                    + "s: " + result.getOutput().trim());
            }
            if (!result.isSuccess()) {
                throw new ProviderExecutionException("CLI exited with code " + result.getExitCode() + ": "
                    + result.getOutput().trim(), result.getExitCode());
            }
            return new TaskResult(result.getOutput(), TokenUsage.NONE, getName(), seconds, 0.0);
        }, false);
    }

    private Path resolveWorkingDir(Map<String, Object> context) {
        Object path = context == null ? null : context.get(WORKSPACE_PATH);
        if (path != null && !path.toString().isBlank()) {
            return Paths.get(path.toString());
        }
        return config.getWorkspaceRoot().resolve(SCRATCH_DIR);
    }
}
