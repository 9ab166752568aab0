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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stderr is merged into stdout. Output is drained on a daemon thread and
 * capped at {@value #MAX_OUTPUT_CHARS} characters. A command that outlives its
 * timeout is destroyed and reported with exit code
 * {@value ProcessRunner#TIMEOUT_EXIT_CODE} and a trailing {@code [timeout]}
 * marker.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(SystemProcessRunner.class);

    static final int MAX_OUTPUT_CHARS = 32_000;
    private static final long DRAIN_WAIT_MS = 500;
    private static final long KILL_WAIT_MS = 200;

    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-io");
        t.setDaemon(true);
        return t;
    });

    @Override
    public CommandResult run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, InterruptedException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }

        logger.debug("Running {} in {}", command, workingDir);
        Process process = pb.start();
        process.getOutputStream().close();

        StringBuffer out = new StringBuffer();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> drain(process, out), ioPool);

        long ms = timeout == null ? 0 : timeout.toMillis();
        boolean finished;
        if (ms <= 0) {
            process.waitFor();
            finished = true;
        } else {
            finished = process.waitFor(ms, TimeUnit.MILLISECONDS);
        }

        if (!finished) {
            logger.warn("Command {} exceeded timeout of {} ms, destroying", command.get(0), ms);
            process.destroy();
            if (!process.waitFor(KILL_WAIT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(KILL_WAIT_MS, TimeUnit.MILLISECONDS);
            }
            awaitDrain(reader, KILL_WAIT_MS, command);
            return new CommandResult(TIMEOUT_EXIT_CODE, out + "\n[timeout]");
        }

        awaitDrain(reader, DRAIN_WAIT_MS, command);
        int exitCode = process.exitValue();
        logger.debug("Command {} exited with {}", command.get(0), exitCode);
        return new CommandResult(exitCode, out.toString());
    }

    private static void drain(Process process, StringBuffer out) {
        try (BufferedReader r = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                if (out.length() < MAX_OUTPUT_CHARS) {
                    out.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void awaitDrain(CompletableFuture<Void> reader, long waitMs, List<String> command)
            throws InterruptedException {
        try {
            reader.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.debug("Output of {} still draining after {} ms, returning what was read", command.get(0), waitMs);
        } catch (ExecutionException e) {
            // stream closed under us when the process was killed
            logger.debug("Output reader for {} stopped: {}", command.get(0), e.getCause().getMessage());
        }
    }
}
