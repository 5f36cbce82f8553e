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

/// The external registries an artifact can be acquired from.
public enum Registry {
    /// Identifier-keyed community marketplace with versioned model metadata
    MARKETPLACE_MODEL("civitai"),
    /// Repository-name keyed hub serving whole repository snapshots
    HUB_REPOSITORY("huggingface");

    private final String label;

    Registry(String label) {
        this.label = label;
    }

    /// @return the short label used in log lines and staging directory names
    public String label() {
        return label;
    }
}
