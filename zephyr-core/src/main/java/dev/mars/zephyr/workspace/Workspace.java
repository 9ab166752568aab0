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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An isolated directory tree on an executor device in which one task runs.
 *
 * <p>The backend owns the record. The agent keeps a cached copy per active
 * workspace and replaces it with the backend's answer after every successful
 * update, so instances are treated as values and never edited after caching.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Workspace {

    public static final String DEFAULT_BRANCH = "main";

    @JsonProperty("id")
    private String id;

    @JsonProperty("executor_device_id")
    private String executorDeviceId;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("workspace_path")
    private String workspacePath;

    @JsonProperty("relative_path")
    private String relativePath;

    @JsonProperty("repo_url")
    private String repoUrl;

    @JsonProperty("repo_branch")
    private String repoBranch = DEFAULT_BRANCH;

    @JsonProperty("project_name")
    private String projectName;

    @JsonProperty("project_type")
    private String projectType;

    @JsonProperty("allowed_commands")
    private List<String> allowedCommands = new ArrayList<>();

    @JsonProperty("environment_vars")
    private Map<String, String> environmentVars = new LinkedHashMap<>();

    @JsonProperty("system_prompt")
    private String systemPrompt;

    @JsonProperty("execution_timeout_minutes")
    private int executionTimeoutMinutes = WorkspaceConfig.DEFAULT_TIMEOUT_MINUTES;

    @JsonProperty("enable_network")
    private boolean enableNetwork = true;

    @JsonProperty("enable_git")
    private boolean enableGit = true;

    @JsonProperty("max_disk_usage_mb")
    private long maxDiskUsageMb = WorkspaceConfig.DEFAULT_MAX_DISK_USAGE_MB;

    @JsonProperty("status")
    private WorkspaceStatus status = WorkspaceStatus.CREATING;

    @JsonProperty("progress_percentage")
    private int progressPercentage;

    @JsonProperty("current_phase")
    private String currentPhase;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("disk_usage_bytes")
    private long diskUsageBytes;

    @JsonProperty("file_count")
    private int fileCount;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("initialized_at")
    private Instant initializedAt;

    @JsonProperty("ready_at")
    private Instant readyAt;

    @JsonProperty("archived_at")
    private Instant archivedAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public Workspace() {
    }

    /**
     * Build the record posted to the backend for a new workspace.
     */
    public static Workspace fromConfig(String deviceId, String agentId, WorkspaceConfig config) {
        Workspace workspace = new Workspace();
        workspace.executorDeviceId = deviceId;
        workspace.agentId = agentId;
        workspace.workspacePath = config.getWorkspacePath();
        workspace.relativePath = config.getRelativePath();
        workspace.repoUrl = config.getRepositoryUrl();
        workspace.repoBranch = config.getRepositoryBranch();
        workspace.projectName = config.getProjectName();
        workspace.projectType = config.getProjectType();
        workspace.allowedCommands = new ArrayList<>(config.getAllowedCommands());
        workspace.environmentVars = new LinkedHashMap<>(config.getEnvironmentVars());
        workspace.systemPrompt = config.getSystemPrompt();
        workspace.executionTimeoutMinutes = config.getExecutionTimeoutMinutes();
        workspace.enableNetwork = config.isEnableNetwork();
        workspace.enableGit = config.isEnableGit();
        workspace.maxDiskUsageMb = config.getMaxDiskUsageMb();
        workspace.status = WorkspaceStatus.CREATING;
        workspace.createdAt = Instant.now();
        return workspace;
    }

    /**
     * Whether setup has to clone a repository.
     */
    @JsonIgnore
    public boolean hasRepository() {
        return repoUrl != null && !repoUrl.isBlank();
    }

    /**
     * Branches that a fresh clone already has checked out.
     */
    @JsonIgnore
    public boolean needsBranchCheckout() {
        return repoBranch != null && !repoBranch.isBlank()
                && !"main".equals(repoBranch) && !"master".equals(repoBranch);
    }

    @JsonIgnore
    public Path getPath() {
        return workspacePath == null ? null : Paths.get(workspacePath);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getExecutorDeviceId() {
        return executorDeviceId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getWorkspacePath() {
        return workspacePath;
    }

    public String getRelativePath() {
        return relativePath;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public String getRepoBranch() {
        return repoBranch;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getProjectType() {
        return projectType;
    }

    public List<String> getAllowedCommands() {
        return allowedCommands;
    }

    public Map<String, String> getEnvironmentVars() {
        return environmentVars;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public int getExecutionTimeoutMinutes() {
        return executionTimeoutMinutes;
    }

    public boolean isEnableNetwork() {
        return enableNetwork;
    }

    public boolean isEnableGit() {
        return enableGit;
    }

    public long getMaxDiskUsageMb() {
        return maxDiskUsageMb;
    }

    public WorkspaceStatus getStatus() {
        return status;
    }

    public void setStatus(WorkspaceStatus status) {
        this.status = status;
    }

    public int getProgressPercentage() {
        return progressPercentage;
    }

    public void setProgressPercentage(int progressPercentage) {
        this.progressPercentage = progressPercentage;
    }

    public String getCurrentPhase() {
        return currentPhase;
    }

    public void setCurrentPhase(String currentPhase) {
        this.currentPhase = currentPhase;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public long getDiskUsageBytes() {
        return diskUsageBytes;
    }

    public void setDiskUsageBytes(long diskUsageBytes) {
        this.diskUsageBytes = diskUsageBytes;
    }

    public int getFileCount() {
        return fileCount;
    }

    public void setFileCount(int fileCount) {
        this.fileCount = fileCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getInitializedAt() {
        return initializedAt;
    }

    public void setInitializedAt(Instant initializedAt) {
        this.initializedAt = initializedAt;
    }

    public Instant getReadyAt() {
        return readyAt;
    }

    public void setReadyAt(Instant readyAt) {
        this.readyAt = readyAt;
    }

    public Instant getArchivedAt() {
        return archivedAt;
    }

    public void setArchivedAt(Instant archivedAt) {
        this.archivedAt = archivedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workspace)) return false;
        Workspace that = (Workspace) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Workspace{id='" + id + "', status=" + status + ", progress=" + progressPercentage
                + ", path='" + workspacePath + "'}";
    }
}
