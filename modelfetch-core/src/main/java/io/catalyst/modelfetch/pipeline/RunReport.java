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

import io.catalyst.modelfetch.api.PlacedFile;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/// The aggregate result of a pipeline run.
///
/// @param status how the run ended
/// @param fingerprint the fingerprint of the configuration the run was for
/// @param outcomes one outcome per request, in request order
/// @param elapsed wall-clock time of the run
public record RunReport(RunStatus status, RunFingerprint fingerprint, List<RequestOutcome> outcomes, Duration elapsed) {

    public RunReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(OutcomeStatus outcomeStatus) {
        return outcomes.stream().filter(o -> o.status() == outcomeStatus).count();
    }

    /// @return every file placed by this run, excluding ones that were already present
    public List<PlacedFile> placedFiles() {
        return outcomes.stream()
            .filter(o -> o.status() == OutcomeStatus.PLACED)
            .flatMap(o -> o.placedFiles().stream())
            .collect(Collectors.toList());
    }

    /// @return the aggregate line logged at the end of a run
    public String summaryLine() {
        return String.format("%s: %d placed, %d already present, %d failed, %d abandoned in %d s (fingerprint %s)",
            status, count(OutcomeStatus.PLACED), count(OutcomeStatus.ALREADY_PRESENT), count(OutcomeStatus.FAILED),
            count(OutcomeStatus.ABANDONED), elapsed.toSeconds(), fingerprint);
    }
}
