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

import java.util.Objects;
import java.util.Optional;

/// One downloadable file of a resolved artifact.
///
/// @param relativePath the path of the file inside the artifact; a bare file name for
///     single file artifacts, a repository relative path for snapshots
/// @param downloadUrl the concrete URL to transfer from, after redirect resolution where
///     the registry client performed it
/// @param expectedSize the declared size in bytes, or -1 when unknown
/// @param expectedHash the declared digest, or null when the registry omitted it
public record ArtifactFile(String relativePath, String downloadUrl, long expectedSize, ExpectedHash expectedHash) {

    public ArtifactFile {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(downloadUrl, "downloadUrl");
    }

    /// @return the expected hash, when the registry supplied one
    public Optional<ExpectedHash> hash() {
        return Optional.ofNullable(expectedHash);
    }

    /// @return true when the size is known
    public boolean hasExpectedSize() {
        return expectedSize >= 0;
    }
}
