package io.catalyst.modelfetch.pipeline;

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

/// When the completion marker is written after a run.
///
/// Whatever the policy, a hard failure deletes the marker and a timed-out run leaves it as it was.
public enum MarkerPolicy {
    /// Write the marker after a successful or partially failed run.
    TOLERATE_PARTIAL,
    /// Write the marker only after a fully successful run; delete it after a partial failure.
    SUCCESS_ONLY;

    /// @param status how the run ended
    /// @return true if the marker should be written
    public boolean shouldWrite(RunStatus status) {
        switch (status) {
            case SUCCESS:
                return true;
            case PARTIAL_FAILURE:
                return this == TOLERATE_PARTIAL;
            default:
                return false;
        }
    }

    /// @param status how the run ended
    /// @return true if an existing marker should be deleted
    public boolean shouldDelete(RunStatus status) {
        switch (status) {
            case HARD_FAILURE:
                return true;
            case PARTIAL_FAILURE:
                return this == SUCCESS_ONLY;
            default:
                return false;
        }
    }
}
