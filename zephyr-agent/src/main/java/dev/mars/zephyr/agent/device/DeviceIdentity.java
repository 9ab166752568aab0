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

package dev.mars.zephyr.agent.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Derives the stable identifiers and platform facts of the local machine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class DeviceIdentity {

    private static final Logger logger = LoggerFactory.getLogger(DeviceIdentity.class);

    static final List<Path> MACHINE_ID_FILES = List.of(
            Paths.get("/etc/machine-id"),
            Paths.get("/var/lib/dbus/machine-id"));

    private DeviceIdentity() {
    }

    /**
     * Hardware id used to find this machine's device record again after a restart.
     *
     * @param configured explicit override, used when non-empty
     */
    public static String resolve(String configured) {
        return resolve(configured, MACHINE_ID_FILES);
    }

    static String resolve(String configured, List<Path> candidates) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        for (Path file : candidates) {
            if (!Files.isReadable(file)) {
                continue;
            }
            try {
                String id = Files.readString(file).trim();
                if (!id.isEmpty()) {
                    logger.debug("Device id read from {}", file);
                    return id;
                }
            } catch (IOException e) {
                logger.warn("Could not read machine id from {}: {}", file, e.getMessage());
            }
        }
        return "host-" + hostname();
    }

    public static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname, using pid");
            return "pid-" + ProcessHandle.current().pid();
        }
    }

    public static String platform() {
        String os = System.getProperty("os.name", "unknown").toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return "macos";
        }
        if (os.contains("win")) {
            return "windows";
        }
        if (os.contains("nux") || os.contains("nix")) {
            return "linux";
        }
        return os;
    }

    public static String osVersion() {
        return System.getProperty("os.name", "unknown") + " " + System.getProperty("os.version", "");
    }

    public static String defaultShell() {
        String shell = System.getenv("SHELL");
        return shell == null || shell.isBlank() ? "/bin/sh" : shell;
    }
}
