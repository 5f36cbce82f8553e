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

/// A fully transferred file in the staging directory.
///
/// @param file the artifact file this was transferred for
/// @param path the complete (no longer partial) staged file
/// @param bytesTransferred bytes moved over the network in this run; 0 when a complete
///     staged file from an earlier attempt was reused
/// @param reused true when a previous complete staged file short-circuited the transfer
public record StagedFile(ArtifactFile file, Path path, long bytesTransferred, boolean reused) {
}
