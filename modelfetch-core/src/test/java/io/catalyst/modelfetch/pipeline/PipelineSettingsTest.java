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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineSettingsTest {

    @TempDir
    Path root;

    @Test
    void acceptsHttpAndHttpsBaseUrls() {
        PipelineSettings settings = builder()
            .marketplaceBaseUrl("http://127.0.0.1:8080")
            .hubBaseUrl("https://hub.example.org/")
            .build();

        assertThat(settings.marketplaceBaseUrl()).isEqualTo("http://127.0.0.1:8080");
    }

    @Test
    void rejectsBaseUrlsWithoutSchemeOrHost() {
        assertThatThrownBy(() -> builder().marketplaceBaseUrl("civitai.com").build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("marketplace base URL");
        assertThatThrownBy(() -> builder().hubBaseUrl("ftp://huggingface.co").build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("hub base URL");
        assertThatThrownBy(() -> builder().hubBaseUrl("https://").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder().hubBaseUrl("http://bad host").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOutOfRangeNumbers() {
        assertThatThrownBy(() -> builder().timeout(Duration.ZERO).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder().maxConcurrent(0).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder().networkWait(Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringDescribesTokensWithoutRevealingThem() {
        String text = builder().marketplaceToken("abcdef").build().toString();

        assertThat(text).doesNotContain("abcdef").contains("set (6 chars)");
    }

    private PipelineSettings.Builder builder() {
        return PipelineSettings.builder().storageRoot(root.resolve("models")).tempDir(root.resolve("tmp"));
    }
}
