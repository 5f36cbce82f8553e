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

/// The run deadline expired while the request was waiting or in flight.
public class TransferCancelledException extends AcquisitionException {

    public TransferCancelledException(String message) {
        super(FailureKind.CANCELLED, message);
    }

    public TransferCancelledException(String message, Throwable cause) {
        super(FailureKind.CANCELLED, message, cause);
    }
}
