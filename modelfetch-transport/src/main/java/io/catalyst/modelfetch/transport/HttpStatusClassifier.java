package io.catalyst.modelfetch.transport;

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

import io.catalyst.modelfetch.api.AcquisitionException;
import io.catalyst.modelfetch.api.AuthException;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.TransferCancelledException;
import io.catalyst.modelfetch.api.TransientTransferException;

import java.io.IOException;
import java.io.InterruptedIOException;

/// Maps HTTP statuses and I/O failures onto the acquisition error taxonomy.
public final class HttpStatusClassifier {

    private HttpStatusClassifier() {
    }

    /// @param code an HTTP status code
    /// @return true for the redirect statuses that carry a `Location`
    public static boolean isRedirect(int code) {
        return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
    }

    /// @param code an HTTP status code
    /// @return true for statuses worth retrying
    public static boolean isTransient(int code) {
        return code == 408 || code == 429 || code >= 500;
    }

    /// @param code a non-successful HTTP status code
    /// @param what a description of the request
    /// @param credentialPresent whether the request carried a credential
    /// @return the matching failure
    public static AcquisitionException forStatus(int code, String what, boolean credentialPresent) {
        if (code == 401 || code == 403) {
            return new AuthException(what + " rejected with HTTP " + code, code, credentialPresent);
        }
        if (code == 404 || code == 410) {
            return ResolveException.notFound(what + " (HTTP " + code + ")");
        }
        if (isTransient(code)) {
            return new TransientTransferException(what + " failed with HTTP " + code);
        }
        return new ResolveException(what + " failed with HTTP " + code);
    }

    /// Classifies an I/O failure. Failures already classified pass through unchanged, failures
    /// observed after cancellation become [TransferCancelledException], and the rest are transient.
    ///
    /// @param what a description of the operation
    /// @param e the failure
    /// @param token the token governing the operation
    /// @return the classified failure
    public static AcquisitionException forIoFailure(String what, IOException e, CancellationToken token) {
        if (e instanceof AcquisitionException) {
            return (AcquisitionException) e;
        }
        if (token.isCancelled() || (e instanceof InterruptedIOException && Thread.currentThread().isInterrupted())) {
            return new TransferCancelledException(what + " cancelled: " + token.reason(), e);
        }
        return new TransientTransferException(what + ": " + e, e);
    }
}
