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

import io.catalyst.modelfetch.api.AcquisitionRequest;
import io.catalyst.modelfetch.api.FailureKind;
import io.catalyst.modelfetch.api.PlacedFile;

import java.time.Duration;
import java.util.List;

/// The result of one acquisition request.
///
/// @param request the request
/// @param status how it ended
/// @param placedFiles the files now in storage; for [OutcomeStatus#ALREADY_PRESENT] the existing ones
/// @param failureKind the failure category, null unless [OutcomeStatus#FAILED]
/// @param message a one-line description for the summary
/// @param elapsed time spent on the request
public record RequestOutcome(
    AcquisitionRequest request,
    OutcomeStatus status,
    List<PlacedFile> placedFiles,
    FailureKind failureKind,
    String message,
    Duration elapsed
) {
    public RequestOutcome {
        placedFiles = List.copyOf(placedFiles);
    }

    public static RequestOutcome placed(AcquisitionRequest request, List<PlacedFile> files, Duration elapsed) {
        return new RequestOutcome(request, OutcomeStatus.PLACED, files, null, describe(files), elapsed);
    }

    public static RequestOutcome alreadyPresent(AcquisitionRequest request, List<PlacedFile> files, Duration elapsed) {
        return new RequestOutcome(request, OutcomeStatus.ALREADY_PRESENT, files, null,
            "already present: " + describe(files), elapsed);
    }

    public static RequestOutcome failed(AcquisitionRequest request, FailureKind kind, String message, Duration elapsed) {
        return new RequestOutcome(request, OutcomeStatus.FAILED, List.of(), kind, message, elapsed);
    }

    public static RequestOutcome abandoned(AcquisitionRequest request, String message) {
        return new RequestOutcome(request, OutcomeStatus.ABANDONED, List.of(), null, message, Duration.ZERO);
    }

    /// @return the log line for the per-identifier summary
    public String summaryLine() {
        switch (status) {
            case PLACED:
                return "[OK] " + request.key() + " -> " + message;
            case ALREADY_PRESENT:
                return "[SKIP] " + request.key() + " " + message;
            case FAILED:
                return "[FAIL] " + request.key() + " (" + failureKind + "): " + message;
            default:
                return "[ABANDONED] " + request.key() + ": " + message;
        }
    }

    private static String describe(List<PlacedFile> files) {
        if (files.size() == 1) {
            PlacedFile file = files.get(0);
            return file.finalPath() + (file.verified() ? " (verified)" : " (unverified)");
        }
        long unverified = files.stream().filter(f -> !f.verified()).count();
        return files.size() + " files" + (unverified == 0 ? " (verified)" : " (" + unverified + " unverified)");
    }
}
