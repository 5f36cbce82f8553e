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

/// Digest algorithms used by registries to describe artifact contents.
public enum HashAlgorithm {
    /// Plain SHA-256 over the file bytes
    SHA256("SHA-256"),
    /// Git blob id: SHA-1 over `blob <size>\0` followed by the file bytes
    GIT_BLOB_SHA1("SHA-1");

    private final String jcaName;

    HashAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    /// @return the name understood by {@link java.security.MessageDigest#getInstance(String)}
    public String jcaName() {
        return jcaName;
    }
}
