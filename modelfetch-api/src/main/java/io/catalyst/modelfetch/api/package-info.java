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

/// Data model and contracts of the model acquisition pipeline.
///
/// Data flows one way:
///
/// ```
/// configuration -> AcquisitionRequest -> ResolvedArtifact -> TransferResult -> PlacedFile
/// ```
///
/// - {@link io.catalyst.modelfetch.api.RegistryClient} resolves requests for one registry
/// - {@link io.catalyst.modelfetch.api.CredentialScope} limits where bearer credentials go
/// - {@link io.catalyst.modelfetch.api.AcquisitionException} and its subclasses form the
///   per-request error taxonomy
package io.catalyst.modelfetch.api;
