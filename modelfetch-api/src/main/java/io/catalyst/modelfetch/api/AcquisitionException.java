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

import java.io.IOException;
import java.util.Objects;

/// Base of all per-request acquisition failures.
public class AcquisitionException extends IOException {

    private final FailureKind kind;

    public AcquisitionException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AcquisitionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /// @return the failure classification
    public FailureKind kind() {
        return kind;
    }

    /// @return true when another attempt may succeed
    public boolean isRetryable() {
        return kind == FailureKind.TRANSIENT;
    }
}
