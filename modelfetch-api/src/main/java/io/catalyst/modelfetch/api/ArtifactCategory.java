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

import java.util.Locale;
import java.util.Optional;

/// Content categories of the storage root. Each category owns one
/// subdirectory, named by {@link #directoryName()}.
public enum ArtifactCategory {
    CHECKPOINTS("checkpoints"),
    LORAS("loras"),
    VAE("vae"),
    EMBEDDINGS("embeddings"),
    CONTROLNET("controlnet"),
    UPSCALE_MODELS("upscale_models"),
    DIFFUSERS("diffusers"),
    HUB_SNAPSHOT("hub_snapshot"),
    OTHER("other");

    private final String directoryName;

    ArtifactCategory(String directoryName) {
        this.directoryName = directoryName;
    }

    /// @return the subdirectory of the storage root holding this category
    public String directoryName() {
        return directoryName;
    }

    /// Maps a marketplace model type (as reported by its metadata API) to a category.
    ///
    /// @param marketplaceType the declared type, for example `Checkpoint` or `LORA`
    /// @return the matching category, or empty when the type is not recognized
    public static Optional<ArtifactCategory> forMarketplaceType(String marketplaceType) {
        if (marketplaceType == null) {
            return Optional.empty();
        }
        switch (marketplaceType.trim().toLowerCase(Locale.ROOT)) {
            case "checkpoint":
                return Optional.of(CHECKPOINTS);
            case "lora":
            case "locon":
            case "dora":
            case "lycoris":
                return Optional.of(LORAS);
            case "vae":
                return Optional.of(VAE);
            case "textualinversion":
            case "embedding":
                return Optional.of(EMBEDDINGS);
            case "controlnet":
                return Optional.of(CONTROLNET);
            case "upscaler":
                return Optional.of(UPSCALE_MODELS);
            case "diffusers":
                return Optional.of(DIFFUSERS);
            default:
                return Optional.empty();
        }
    }
}
