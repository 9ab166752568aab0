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

package dev.mars.zephyr.workspace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters for creating a workspace. Everything is optional: without a
 * path one is generated under the device workspace root, and without a
 * repository URL setup skips cloning.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkspaceConfig {

    public static final int DEFAULT_TIMEOUT_MINUTES = 60;
    public static final long DEFAULT_MAX_DISK_USAGE_MB = 10240;

    private final String workspacePath;
    private final String relativePath;
    private final String projectName;
    private final String projectType;
    private final String repositoryUrl;
    private final String repositoryBranch;
    private final String systemPrompt;
    private final List<String> allowedCommands;
    private final Map<String, String> environmentVars;
    private final int executionTimeoutMinutes;
    private final long maxDiskUsageMb;
    private final boolean enableNetwork;
    private final boolean enableGit;

    private WorkspaceConfig(Builder builder) {
        this.workspacePath = builder.workspacePath;
        this.relativePath = builder.relativePath;
        this.projectName = builder.projectName;
        this.projectType = builder.projectType;
        this.repositoryUrl = builder.repositoryUrl;
        this.repositoryBranch = builder.repositoryBranch;
        this.systemPrompt = builder.systemPrompt;
        this.allowedCommands = Collections.unmodifiableList(new ArrayList<>(builder.allowedCommands));
        this.environmentVars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environmentVars));
        this.executionTimeoutMinutes = builder.executionTimeoutMinutes;
        this.maxDiskUsageMb = builder.maxDiskUsageMb;
        this.enableNetwork = builder.enableNetwork;
        this.enableGit = builder.enableGit;
    }

    public static WorkspaceConfig empty() {
        return new Builder().build();
    }

    /**
     * Copy of this config pinned to a concrete path.
     */
    public WorkspaceConfig withPath(String path, String relative) {
        return toBuilder().workspacePath(path).relativePath(relative).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .workspacePath(workspacePath)
                .relativePath(relativePath)
                .projectName(projectName)
                .projectType(projectType)
                .repositoryUrl(repositoryUrl)
                .repositoryBranch(repositoryBranch)
                .systemPrompt(systemPrompt)
                .allowedCommands(allowedCommands)
                .environmentVars(environmentVars)
                .executionTimeoutMinutes(executionTimeoutMinutes)
                .maxDiskUsageMb(maxDiskUsageMb)
                .enableNetwork(enableNetwork)
                .enableGit(enableGit);
    }

    public String getWorkspacePath() {
        return workspacePath;
    }

    public String getRelativePath() {
        return relativePath;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getProjectType() {
        return projectType;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public String getRepositoryBranch() {
        return repositoryBranch;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public List<String> getAllowedCommands() {
        return allowedCommands;
    }

    public Map<String, String> getEnvironmentVars() {
        return environmentVars;
    }

    public int getExecutionTimeoutMinutes() {
        return executionTimeoutMinutes;
    }

    public long getMaxDiskUsageMb() {
        return maxDiskUsageMb;
    }

    public boolean isEnableNetwork() {
        return enableNetwork;
    }

    public boolean isEnableGit() {
        return enableGit;
    }

    @Override
    public String toString() {
        return "WorkspaceConfig{path='" + workspacePath + "', repo='" + repositoryUrl
                + "', branch='" + repositoryBranch + "'}";
    }

    /**
     * Builder for workspace configurations.
     */
    public static class Builder {
        private String workspacePath;
        private String relativePath;
        private String projectName;
        private String projectType;
        private String repositoryUrl;
        private String repositoryBranch = Workspace.DEFAULT_BRANCH;
        private String systemPrompt;
        private List<String> allowedCommands = new ArrayList<>();
        private Map<String, String> environmentVars = new LinkedHashMap<>();
        private int executionTimeoutMinutes = DEFAULT_TIMEOUT_MINUTES;
        private long maxDiskUsageMb = DEFAULT_MAX_DISK_USAGE_MB;
        private boolean enableNetwork = true;
        private boolean enableGit = true;

        public Builder workspacePath(String workspacePath) {
            this.workspacePath = workspacePath;
            return this;
        }

        public Builder relativePath(String relativePath) {
            this.relativePath = relativePath;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder projectType(String projectType) {
            this.projectType = projectType;
            return this;
        }

        public Builder repositoryUrl(String repositoryUrl) {
            this.repositoryUrl = repositoryUrl;
            return this;
        }

        public Builder repositoryBranch(String repositoryBranch) {
            this.repositoryBranch = repositoryBranch;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder allowedCommands(List<String> allowedCommands) {
            this.allowedCommands = allowedCommands == null ? new ArrayList<>() : new ArrayList<>(allowedCommands);
            return this;
        }

        public Builder environmentVars(Map<String, String> environmentVars) {
            this.environmentVars = environmentVars == null ? new LinkedHashMap<>() : new LinkedHashMap<>(environmentVars);
            return this;
        }

        public Builder executionTimeoutMinutes(int executionTimeoutMinutes) {
            this.executionTimeoutMinutes = executionTimeoutMinutes;
            return this;
        }

        public Builder maxDiskUsageMb(long maxDiskUsageMb) {
            this.maxDiskUsageMb = maxDiskUsageMb;
            return this;
        }

        public Builder enableNetwork(boolean enableNetwork) {
            this.enableNetwork = enableNetwork;
            return this;
        }

        public Builder enableGit(boolean enableGit) {
            this.enableGit = enableGit;
            return this;
        }

        public WorkspaceConfig build() {
            if (executionTimeoutMinutes <= 0) {
                throw new IllegalArgumentException("executionTimeoutMinutes must be positive");
            }
            if (maxDiskUsageMb <= 0) {
                throw new IllegalArgumentException("maxDiskUsageMb must be positive");
            }
            if (repositoryBranch == null || repositoryBranch.isBlank()) {
                repositoryBranch = Workspace.DEFAULT_BRANCH;
            }
            return new WorkspaceConfig(this);
        }
    }
}
