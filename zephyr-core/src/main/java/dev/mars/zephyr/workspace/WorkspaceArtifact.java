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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A file produced in (or derived from) a workspace and recorded with the
 * backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceArtifact {

    @JsonProperty("id")
    private String id;

    @JsonProperty("workspace_id")
    private String workspaceId;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("file_extension")
    private String fileExtension;

    @JsonProperty("artifact_type")
    private ArtifactType artifactType = ArtifactType.OTHER;

    @JsonProperty("file_size_bytes")
    private long fileSizeBytes;

    @JsonProperty("mime_type")
    private String mimeType;

    @JsonProperty("storage_type")
    private StorageType storageType = StorageType.REFERENCE;

    @JsonProperty("description")
    private String description;

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("is_output")
    private boolean output;

    public WorkspaceArtifact() {
    }

    /**
     * Reference to a gzip archive of a workspace tree.
     */
    public static WorkspaceArtifact archiveOf(String workspaceId, Path archive, long sizeBytes) {
        WorkspaceArtifact artifact = new WorkspaceArtifact();
        artifact.workspaceId = workspaceId;
        artifact.filePath = archive.toString();
        artifact.fileName = archive.getFileName().toString();
        artifact.fileExtension = "tar.gz";
        artifact.artifactType = ArtifactType.OTHER;
        artifact.fileSizeBytes = sizeBytes;
        artifact.mimeType = "application/gzip";
        artifact.storageType = StorageType.REFERENCE;
        artifact.description = "Workspace archive";
        artifact.tags = new ArrayList<>(List.of("archive", "workspace"));
        artifact.output = true;
        return artifact;
    }

    public String getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getFileName() {
        return fileName;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public ArtifactType getArtifactType() {
        return artifactType;
    }

    public long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public String getMimeType() {
        return mimeType;
    }

    public StorageType getStorageType() {
        return storageType;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isOutput() {
        return output;
    }
}
