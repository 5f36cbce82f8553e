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

/// Resolves acquisition requests for one registry into concrete download targets.
///
/// Implementations are thread safe; the pipeline resolves different identifiers
/// concurrently and serializes requests for the same identifier.
public interface RegistryClient extends AutoCloseable {

    /// @return the registry this client serves
    Registry registry();

    /// Resolves one request.
    ///
    /// @param request a request for {@link #registry()}
    /// @return the resolved artifact
    /// @throws ResolveException when the identifier is unknown, malformed, or the metadata is unusable
    /// @throws AuthException when the registry rejects the credential or requires one
    /// @throws AcquisitionException for transient failures of the metadata lookup
    ResolvedArtifact resolve(AcquisitionRequest request) throws AcquisitionException;

    /// Lightweight reachability check of the registry origin.
    ///
    /// @return true when the registry answered at all, regardless of status
    boolean probe();

    /// Validates the configured credential with a cheap authenticated call. Never throws.
    ///
    /// @return the credential state
    CredentialStatus validateCredential();

    @Override
    default void close() {
    }

    /// Outcome of {@link #validateCredential()}.
    enum CredentialStatus {
        /// no credential configured
        ABSENT,
        /// the registry accepted the credential
        VALID,
        /// the registry rejected the credential
        REJECTED,
        /// the check could not be completed
        UNKNOWN
    }
}
