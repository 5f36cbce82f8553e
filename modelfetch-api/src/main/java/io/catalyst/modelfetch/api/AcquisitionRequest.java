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

/// One configured identifier to acquire, tagged with its registry and the
/// category declared by the configuration list it came from.
///
/// Duplicates are legal; each instance is acquired independently.
///
/// @param registry the registry which serves the identifier
/// @param identifier the marketplace id (`123` or `123@456`) or hub repository name
/// @param declaredCategory the category named by the configuration list, or null when
///     the list leaves it to the registry metadata
public record AcquisitionRequest(Registry registry, String identifier, ArtifactCategory declaredCategory) {

    public AcquisitionRequest {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(identifier, "identifier");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }

    /// @return the declared category, when the configuration named one
    public Optional<ArtifactCategory> category() {
        return Optional.ofNullable(declaredCategory);
    }

    /// A key which is equal for every request naming the same artifact.
    /// Work for equal keys is serialized.
    /// @return `label:identifier`
    public String key() {
        return registry.label() + ":" + identifier;
    }

    @Override
    public String toString() {
        return key() + (declaredCategory != null ? " (" + declaredCategory.directoryName() + ")" : "");
    }
}
