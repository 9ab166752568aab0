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

package dev.mars.zephyr.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion. Implementations block the calling
 * thread, so callers on an event loop must hand the call to a worker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public interface ProcessRunner {

    /**
     * Exit code reported when the command did not finish within its timeout.
     */
    int TIMEOUT_EXIT_CODE = 124;

    /**
     * Run a command.
     *
     * @param command    program and arguments, not interpreted by a shell
     * @param workingDir directory to run in, or null for the current one
     * @param timeout    maximum run time; null or zero waits indefinitely
     * @return exit code and combined stdout/stderr
     * @throws IOException          if the process could not be started
     * @throws InterruptedException if the caller was interrupted while waiting
     */
    CommandResult run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, InterruptedException;
}
