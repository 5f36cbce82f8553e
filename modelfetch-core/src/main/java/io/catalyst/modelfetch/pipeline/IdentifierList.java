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

import io.catalyst.modelfetch.api.ArtifactCategory;
import io.catalyst.modelfetch.api.Registry;

/// The configured identifier lists, each bound to its environment variable, registry and declared category.
public enum IdentifierList {
    CHECKPOINTS("CIVITAI_CHECKPOINTS_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, ArtifactCategory.CHECKPOINTS),
    LORAS("CIVITAI_LORAS_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, ArtifactCategory.LORAS),
    VAES("CIVITAI_VAES_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, ArtifactCategory.VAE),
    EMBEDDINGS("CIVITAI_EMBEDDINGS_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, ArtifactCategory.EMBEDDINGS),
    CONTROLNETS("CIVITAI_CONTROLNETS_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, ArtifactCategory.CONTROLNET),
    UPSCALERS("CIVITAI_UPSCALERS_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, ArtifactCategory.UPSCALE_MODELS),
    /// Marketplace models whose category comes from their metadata.
    MODELS("CIVITAI_MODELS_TO_DOWNLOAD", Registry.MARKETPLACE_MODEL, null),
    HUB_REPOSITORIES("HF_REPOS_TO_DOWNLOAD", Registry.HUB_REPOSITORY, ArtifactCategory.HUB_SNAPSHOT);

    private final String environmentName;
    private final Registry registry;
    private final ArtifactCategory declaredCategory;

    IdentifierList(String environmentName, Registry registry, ArtifactCategory declaredCategory) {
        this.environmentName = environmentName;
        this.registry = registry;
        this.declaredCategory = declaredCategory;
    }

    public String environmentName() {
        return environmentName;
    }

    public Registry registry() {
        return registry;
    }

    /// @return the category every identifier of this list is placed in, or null when metadata decides
    public ArtifactCategory declaredCategory() {
        return declaredCategory;
    }
}
