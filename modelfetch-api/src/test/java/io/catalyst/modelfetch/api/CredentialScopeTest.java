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

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialScopeTest {

    @Test
    void attachesTokenOnlyToRegistryAuthorities() {
        CredentialScope scope = CredentialScope.of("secret", "https://civitai.com");

        assertThat(scope.authorizationFor(URI.create("https://civitai.com/api/v1/models/1")))
            .contains("Bearer secret");
        assertThat(scope.authorizationFor(URI.create("https://CIVITAI.com:443/api/download/models/2")))
            .contains("Bearer secret");
        assertThat(scope.authorizationFor(URI.create("https://b2.civitai.com/file?X-Amz-Signature=x"))).isEmpty();
        assertThat(scope.authorizationFor(URI.create("http://civitai.com/api/v1/models/1"))).isEmpty();
    }

    @Test
    void portIsPartOfTheAuthority() {
        CredentialScope scope = CredentialScope.of("secret", "http://127.0.0.1:8080");

        assertThat(scope.covers(URI.create("http://127.0.0.1:8080/x"))).isTrue();
        assertThat(scope.covers(URI.create("http://127.0.0.1:8081/x"))).isFalse();
    }

    @Test
    void blankTokenIsAnonymous() {
        CredentialScope scope = CredentialScope.of("  ", "https://huggingface.co");

        assertThat(scope.hasCredential()).isFalse();
        assertThat(scope.covers(URI.create("https://huggingface.co/api/whoami-v2"))).isTrue();
        assertThat(scope.authorizationFor(URI.create("https://huggingface.co/api/whoami-v2"))).isEmpty();
        assertThat(CredentialScope.anonymous().authorities()).isEmpty();
    }

    @Test
    void toStringNeverShowsTheToken() {
        assertThat(CredentialScope.of("hf_abcdef", "https://huggingface.co").toString())
            .doesNotContain("hf_abcdef")
            .contains("9 chars");
    }
}
