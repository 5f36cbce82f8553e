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

/// Classification of per-request failures. Every kind except {@link #TRANSIENT} is
/// terminal for the request; transient failures are retried by the transfer engine up to
/// its attempt bound and then escalated as terminal.
public enum FailureKind {
    /// API error or malformed metadata
    RESOLVE,
    /// the identifier, version or file does not exist
    NOT_FOUND,
    /// credential missing or rejected
    AUTH,
    /// connection reset, server error, timeout
    TRANSIENT,
    /// downloaded bytes do not match the expected hash
    INTEGRITY,
    /// the verified artifact could not be moved into its category directory
    PLACEMENT,
    /// the temp filesystem cannot hold the artifact
    INSUFFICIENT_SPACE,
    /// the run deadline expired while the request was in flight
    CANCELLED
}
