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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/// Turns the raw comma-separated identifier lists into acquisition requests.
///
/// Elements are trimmed and empty elements are dropped. Duplicates are kept: each one is its own request.
public final class IdentifierParser {

    private IdentifierParser() {
    }

    /// @param rawValues raw configuration values by list; absent or blank lists contribute nothing
    /// @return the requests in [IdentifierList] order, then configuration order
    public static List<AcquisitionRequest> parse(Map<IdentifierList, String> rawValues) {
        List<AcquisitionRequest> requests = new ArrayList<>();
        for (IdentifierList list : IdentifierList.values()) {
            for (String identifier : split(rawValues.get(list))) {
                requests.add(new AcquisitionRequest(list.registry(), identifier, list.declaredCategory()));
            }
        }
        return Collections.unmodifiableList(requests);
    }

    /// @param raw a comma-separated list, possibly null
    /// @return the trimmed, non-empty elements
    public static List<String> split(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> elements = new ArrayList<>();
        for (String element : raw.split(",")) {
            String trimmed = element.trim();
            if (!trimmed.isEmpty()) {
                elements.add(trimmed);
            }
        }
        return elements;
    }
}
