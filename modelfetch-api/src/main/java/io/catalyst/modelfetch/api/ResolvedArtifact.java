package io.catalyst.modelfetch.api;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.List;
import java.util.Objects;

/// A request resolved by its registry client into concrete download targets.
///
/// @param request the request this artifact was resolved from
/// @param category the category directory the artifact is placed into
/// @param name the placement name inside the category directory: the file name for a
///     single file, the relative directory (for example `org/model-a`) for a snapshot
/// @param layout whether the artifact is one file or a directory tree
/// @param files the files to transfer, never empty
/// @param credentialScope the credential policy for every transfer of this artifact
public record ResolvedArtifact(
    AcquisitionRequest request,
    ArtifactCategory category,
    String name,
    ArtifactLayout layout,
    List<ArtifactFile> files,
    CredentialScope credentialScope
) {

    public ResolvedArtifact {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(credentialScope, "credentialScope");
        files = List.copyOf(files);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("artifact " + name + " has no files");
        }
        if (layout == ArtifactLayout.SINGLE_FILE && files.size() != 1) {
            throw new IllegalArgumentException("single file artifact " + name + " has " + files.size() + " files");
        }
    }

    /// Creates a single file artifact.
    public static ResolvedArtifact singleFile(AcquisitionRequest request, ArtifactCategory category,
                                              ArtifactFile file, CredentialScope scope) {
        return new ResolvedArtifact(request, category, file.relativePath(), ArtifactLayout.SINGLE_FILE,
            List.of(file), scope);
    }

    /// @return the download URL of the first (for single file artifacts, only) file
    public String downloadUrl() {
        return files.get(0).downloadUrl();
    }

    /// @return the sum of the known file sizes, or -1 if any size is unknown
    public long expectedSize() {
        long total = 0;
        for (ArtifactFile file : files) {
            if (!file.hasExpectedSize()) {
                return -1;
            }
            total += file.expectedSize();
        }
        return total;
    }

    @Override
    public String toString() {
        return request.key() + " -> " + category.directoryName() + "/" + name + " (" + files.size() + " file"
            + (files.size() == 1 ? "" : "s") + ")";
    }
}
