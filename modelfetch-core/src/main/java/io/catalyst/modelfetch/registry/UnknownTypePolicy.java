package io.catalyst.modelfetch.registry;

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

/// What to do with a marketplace model whose type maps to no known category.
public enum UnknownTypePolicy {
    /// Place the artifact under `other/` and log a warning.
    ROUTE_TO_OTHER,
    /// Fail the request with a resolve error.
    REJECT
}
