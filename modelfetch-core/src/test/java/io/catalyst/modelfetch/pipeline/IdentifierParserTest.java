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
import io.catalyst.modelfetch.api.ArtifactCategory;
import io.catalyst.modelfetch.api.Registry;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierParserTest {

    @Test
    void parsesEveryListWithItsRegistryAndCategory() {
        Map<IdentifierList, String> raw = new EnumMap<>(IdentifierList.class);
        raw.put(IdentifierList.CHECKPOINTS, " 1569593 , 12@34,");
        raw.put(IdentifierList.VAES, "55");
        raw.put(IdentifierList.MODELS, "77");
        raw.put(IdentifierList.HUB_REPOSITORIES, "org/model-a");

        List<AcquisitionRequest> requests = IdentifierParser.parse(raw);

        assertThat(requests).containsExactly(
            new AcquisitionRequest(Registry.MARKETPLACE_MODEL, "1569593", ArtifactCategory.CHECKPOINTS),
            new AcquisitionRequest(Registry.MARKETPLACE_MODEL, "12@34", ArtifactCategory.CHECKPOINTS),
            new AcquisitionRequest(Registry.MARKETPLACE_MODEL, "55", ArtifactCategory.VAE),
            new AcquisitionRequest(Registry.MARKETPLACE_MODEL, "77", null),
            new AcquisitionRequest(Registry.HUB_REPOSITORY, "org/model-a", ArtifactCategory.HUB_SNAPSHOT));
    }

    @Test
    void keepsDuplicates() {
        List<AcquisitionRequest> requests = IdentifierParser.parse(Map.of(IdentifierList.LORAS, "9,9"));

        assertThat(requests).hasSize(2).allMatch(r -> r.key().equals("civitai:9"));
    }

    @Test
    void emptyAndUnsetListsContributeNothing() {
        Map<IdentifierList, String> raw = new EnumMap<>(IdentifierList.class);
        raw.put(IdentifierList.CHECKPOINTS, "");
        raw.put(IdentifierList.LORAS, " , ,");

        assertThat(IdentifierParser.parse(raw)).isEmpty();
        assertThat(IdentifierParser.split(null)).isEmpty();
    }
}
