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

/// How a resolved artifact is laid out in its category directory.
public enum ArtifactLayout {
    /// A single file placed directly in the category directory
    SINGLE_FILE,
    /// A directory tree (a repository snapshot) placed as one unit
    DIRECTORY
}
