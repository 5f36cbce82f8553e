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

import io.catalyst.modelfetch.api.AcquisitionException;
import io.catalyst.modelfetch.api.AuthException;
import io.catalyst.modelfetch.api.PlacementException;
import io.catalyst.modelfetch.api.Registry;

/// Operator hints for failed requests.
final class FailureHints {

    private FailureHints() {
    }

    static String hintFor(Registry registry, AcquisitionException failure) {
        switch (failure.kind()) {
            case AUTH:
                boolean credentialPresent = failure instanceof AuthException && ((AuthException) failure).credentialPresent();
                String variable = registry == Registry.HUB_REPOSITORY ? "HUGGINGFACE_TOKEN" : "CIVITAI_TOKEN";
                return credentialPresent
                    ? "the " + variable + " credential was rejected; check the token and its access to this item"
                    : "this item requires authentication; provide " + variable;
            case NOT_FOUND:
                return "the item may not exist or was removed; check the identifier";
            case TRANSIENT:
                return "network or server trouble; a later run may succeed";
            case INTEGRITY:
                return "the downloaded bytes did not match the published hash and were discarded";
            case INSUFFICIENT_SPACE:
                return "free disk space in the temp directory";
            case PLACEMENT:
                return failure instanceof PlacementException && ((PlacementException) failure).preservedStaging() != null
                    ? "staged files kept for inspection in " + ((PlacementException) failure).preservedStaging()
                    : "check permissions of the models directory";
            default:
                return "see the log above for details";
        }
    }
}
