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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Contents of the {@code .workspace} file written at the root of every
 * workspace tree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkspaceDescriptor {

    private final String workspaceId;
    private final Instant createdAt;
    private final String repositoryUrl;
    private final String branch;

    @JsonCreator
    public WorkspaceDescriptor(@JsonProperty("workspace_id") String workspaceId,
                               @JsonProperty("created_at") Instant createdAt,
                               @JsonProperty("repository_url") String repositoryUrl,
                               @JsonProperty("branch") String branch) {
        this.workspaceId = workspaceId;
        this.createdAt = createdAt;
        this.repositoryUrl = repositoryUrl;
        this.branch = branch;
    }

    @JsonProperty("workspace_id")
    public String getWorkspaceId() {
        return workspaceId;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("repository_url")
    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    @JsonProperty("branch")
    public String getBranch() {
        return branch;
    }
}
