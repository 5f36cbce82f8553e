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

/// A registry refused the request because the credential is missing or rejected.
/// Kept distinct from {@link ResolveException} so operators can tell "not authorized"
/// from "does not exist".
public class AuthException extends AcquisitionException {

    private final int status;
    private final boolean credentialPresent;

    public AuthException(String message, int status, boolean credentialPresent) {
        super(FailureKind.AUTH, message);
        this.status = status;
        this.credentialPresent = credentialPresent;
    }

    /// @return the HTTP status, 401 or 403
    public int status() {
        return status;
    }

    /// @return true when a credential was sent and rejected, false when none was configured
    public boolean credentialPresent() {
        return credentialPresent;
    }
}
