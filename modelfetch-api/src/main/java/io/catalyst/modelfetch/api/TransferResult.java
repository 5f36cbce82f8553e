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

import java.nio.file.Path;
import java.util.List;

/// The output of the transfer engine for one artifact. The staged files are complete but
/// not yet verified; only integrity verification and placement consume them.
///
/// @param artifact the resolved artifact
/// @param stagingDirectory the temp-dir scoped directory owned by this transfer
/// @param files one staged file per artifact file, in artifact order
/// @param verified true once every file carrying an expected hash has been checked and
///     every file carried one
public record TransferResult(ResolvedArtifact artifact, Path stagingDirectory, List<StagedFile> files, boolean verified) {

    public TransferResult {
        files = List.copyOf(files);
    }

    /// @return the total bytes moved over the network in this run
    public long bytesTransferred() {
        return files.stream().mapToLong(StagedFile::bytesTransferred).sum();
    }

    /// @return the staged path of a single file artifact, or the staging root of a snapshot
    public Path localTempPath() {
        return artifact.layout() == ArtifactLayout.SINGLE_FILE ? files.get(0).path() : stagingDirectory;
    }

    /// @param verified the verification outcome
    /// @return a copy carrying the verification outcome
    public TransferResult withVerified(boolean verified) {
        return new TransferResult(artifact, stagingDirectory, files, verified);
    }
}
