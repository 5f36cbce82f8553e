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

/// A completed, immutable artifact in its category directory.
///
/// @param finalPath the placed file, or the placed directory of a snapshot
/// @param sourceIdentifier the request key the artifact was acquired for
/// @param verified false when the registry supplied no hash and placement proceeded on trust
/// @param bytes the size of the placed artifact
public record PlacedFile(Path finalPath, String sourceIdentifier, boolean verified, long bytes) {
}
