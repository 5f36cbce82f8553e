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

import java.util.Locale;
import java.util.Objects;

/// A registry supplied digest which the downloaded bytes must match.
///
/// @param algorithm how the digest is computed
/// @param hex the lower case hex digest
public record ExpectedHash(HashAlgorithm algorithm, String hex) {

    public ExpectedHash {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(hex, "hex");
        hex = hex.trim().toLowerCase(Locale.ROOT);
        if (hex.isEmpty()) {
            throw new IllegalArgumentException("hash must not be empty");
        }
    }

    /// @param hex a SHA-256 hex digest in any case, possibly null or blank
    /// @return the expected hash, or null when the registry gave none
    public static ExpectedHash sha256OrNull(String hex) {
        return (hex == null || hex.isBlank()) ? null : new ExpectedHash(HashAlgorithm.SHA256, hex);
    }

    /// @param actualHex a computed digest
    /// @return true when the digest matches, ignoring case
    public boolean matches(String actualHex) {
        return actualHex != null && hex.equalsIgnoreCase(actualHex.trim());
    }

    @Override
    public String toString() {
        return algorithm + ":" + hex;
    }
}
