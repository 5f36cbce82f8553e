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

/// The terminal state of a pipeline run and the process exit code it maps to.
public enum RunStatus {
    /// Every request placed its artifact or found it already present.
    SUCCESS(0),
    /// The completion marker matched; nothing was attempted.
    SKIPPED(0),
    /// No request succeeded, or no registry was reachable.
    HARD_FAILURE(1),
    /// Some requests succeeded and some failed.
    PARTIAL_FAILURE(2),
    /// The run deadline expired before every request finished.
    TIMED_OUT(124);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
