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

package dev.mars.zephyr.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.zephyr.core.JsonMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

/**
 * File-system operations on workspace trees.
 *
 * <p>Every method blocks; callers on a Vert.x event loop run them through
 * {@code executeBlocking}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class WorkspaceFileManager {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceFileManager.class);

    public static final String DESCRIPTOR_FILE = ".workspace";
    public static final String SOURCE_DIR = "src";
    public static final List<String> LAYOUT = List.of(SOURCE_DIR, "output", "logs", "artifacts", "temp");

    private WorkspaceFileManager() {
    }

    public static void ensureDirectoryExists(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            logger.info("Created directory: {}", dir);
        }
    }

    /**
     * Create the standard subdirectories and write the descriptor file.
     * Safe to call on a tree that already has some of them.
     */
    public static void createLayout(Path root, WorkspaceDescriptor descriptor) throws IOException {
        ensureDirectoryExists(root);
        for (String name : LAYOUT) {
            Files.createDirectories(root.resolve(name));
        }
        ObjectMapper mapper = JsonMapping.mapper();
        Files.writeString(root.resolve(DESCRIPTOR_FILE),
                mapper.writerWithDefaultPrettyPrinter().writeValueAsString(descriptor));
        logger.debug("Workspace layout created at {}", root);
    }

    public static WorkspaceDescriptor readDescriptor(Path root) throws IOException {
        return JsonMapping.mapper().readValue(root.resolve(DESCRIPTOR_FILE).toFile(), WorkspaceDescriptor.class);
    }

    /**
     * Recursively delete a tree. A path that does not exist counts as deleted.
     *
     * @return true if anything was removed
     */
    public static boolean deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            logger.debug("Nothing to delete at {}", root);
            return false;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
        logger.info("Deleted workspace tree {}", root);
        return true;
    }

    /**
     * Total size and number of regular files under a tree. Files that vanish
     * or cannot be read while walking are skipped.
     */
    public static DiskUsage measure(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return new DiskUsage(0, 0);
        }
        long[] totals = new long[2];
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    totals[0] += attrs.size();
                    totals[1]++;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.debug("Skipping {} while measuring: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return new DiskUsage(totals[0], (int) Math.min(Integer.MAX_VALUE, totals[1]));
    }

    /**
     * Whether {@code candidate} resolves to a location inside {@code root}.
     */
    public static boolean isWithin(Path root, Path candidate) {
        if (root == null || candidate == null) {
            return false;
        }
        return candidate.toAbsolutePath().normalize().startsWith(root.toAbsolutePath().normalize());
    }

    /**
     * Bytes and file count of a tree.
     */
    public static final class DiskUsage {
        private final long bytes;
        private final int fileCount;

        public DiskUsage(long bytes, int fileCount) {
            this.bytes = bytes;
            this.fileCount = fileCount;
        }

        public long getBytes() {
            return bytes;
        }

        public int getFileCount() {
            return fileCount;
        }

        @Override
        public String toString() {
            return "DiskUsage{bytes=" + bytes + ", files=" + fileCount + "}";
        }
    }
}
