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

/// An identifier could not be resolved: unknown identifier, API error or malformed metadata.
public class ResolveException extends AcquisitionException {

    public ResolveException(String message) {
        super(FailureKind.RESOLVE, message);
    }

    public ResolveException(String message, Throwable cause) {
        super(FailureKind.RESOLVE, message, cause);
    }

    protected ResolveException(FailureKind kind, String message) {
        super(kind, message);
    }

    /// @param what the missing thing, for example `model 123`
    /// @return a resolve failure of kind {@link FailureKind#NOT_FOUND}
    public static ResolveException notFound(String what) {
        return new ResolveException(FailureKind.NOT_FOUND, what + " not found");
    }
}
