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

import io.catalyst.modelfetch.api.AcquisitionRequest;
import io.catalyst.modelfetch.api.ArtifactCategory;
import io.catalyst.modelfetch.api.ArtifactFile;
import io.catalyst.modelfetch.api.ArtifactLayout;
import io.catalyst.modelfetch.api.AuthException;
import io.catalyst.modelfetch.api.HashAlgorithm;
import io.catalyst.modelfetch.api.Registry;
import io.catalyst.modelfetch.api.RegistryClient.CredentialStatus;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import io.catalyst.modelfetch.testserver.Handlers;
import io.catalyst.modelfetch.testserver.TestWebServerFixture;
import io.catalyst.modelfetch.transport.TransportClients;
import io.catalyst.modelfetch.transport.TransportSettings;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HubClientTest {

    private TestWebServerFixture hub;
    private OkHttpClient http;

    @BeforeEach
    void setUp() throws IOException {
        hub = new TestWebServerFixture();
        hub.start();
        http = TransportClients.create(TransportSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        TransportClients.shutdown(http);
        hub.close();
    }

    @Test
    void resolvesSnapshotPinnedToCommit() throws Exception {
        Map<String, byte[]> files = new LinkedHashMap<>();
        files.put("config.json", "{\"dim\": 8}".getBytes(StandardCharsets.UTF_8));
        files.put("unet/model.safetensors", new byte[] {1, 2, 3, 4});
        RegistryStubs.hubRepository(hub, null, "org/model-a", files);

        ResolvedArtifact artifact = client(null).resolve(request("org/model-a"));

        assertThat(artifact.category()).isEqualTo(ArtifactCategory.HUB_SNAPSHOT);
        assertThat(artifact.layout()).isEqualTo(ArtifactLayout.DIRECTORY);
        assertThat(artifact.name()).isEqualTo("org/model-a");
        assertThat(artifact.files()).extracting(ArtifactFile::relativePath)
            .containsExactly("config.json", "unet/model.safetensors");
        ArtifactFile config = artifact.files().get(0);
        assertThat(config.downloadUrl())
            .isEqualTo(hub.baseUrl() + "/org/model-a/resolve/" + RegistryStubs.HUB_COMMIT + "/config.json");
        assertThat(config.hash()).hasValueSatisfying(h -> assertThat(h.algorithm()).isEqualTo(HashAlgorithm.GIT_BLOB_SHA1));
        ArtifactFile weights = artifact.files().get(1);
        assertThat(weights.expectedSize()).isEqualTo(4);
        assertThat(weights.hash()).hasValueSatisfying(h -> {
            assertThat(h.algorithm()).isEqualTo(HashAlgorithm.SHA256);
            assertThat(h.hex()).isEqualTo(RegistryStubs.sha256(new byte[] {1, 2, 3, 4}));
        });
    }

    @Test
    void gatedRepositoryWithoutTokenIsAnAuthFailure() throws Exception {
        RegistryStubs.hubRepository(hub, "hf_secret", "org/gated", Map.of("a.txt", new byte[] {1}));

        assertThatThrownBy(() -> client(null).resolve(request("org/gated")))
            .isInstanceOfSatisfying(AuthException.class, e -> assertThat(e.credentialPresent()).isFalse());
        assertThat(client("hf_secret").resolve(request("org/gated")).files()).hasSize(1);
    }

    @Test
    void explicitRevisionIsRequested() throws Exception {
        hub.route("/api/models/org/model-b/revision/v2", Handlers.json(200,
            "{\"sha\":\"abc\",\"siblings\":[{\"rfilename\":\"weights bin\",\"size\":3}]}"));

        ResolvedArtifact artifact = client(null).resolve(request("org/model-b@v2"));

        assertThat(artifact.downloadUrl()).isEqualTo(hub.baseUrl() + "/org/model-b/resolve/abc/weights%20bin");
        assertThat(artifact.files().get(0).hash()).isEmpty();
    }

    @Test
    void rejectsNonRepositoryNames() {
        assertThatThrownBy(() -> client(null).resolve(request("../etc/passwd")))
            .isInstanceOf(ResolveException.class);
        assertThatThrownBy(() -> client(null).resolve(request("a/b/c")))
            .isInstanceOf(ResolveException.class);
        assertThat(hub.requests()).isEmpty();
    }

    @Test
    void emptyRepositoryFailsToResolve() {
        hub.route("/api/models/org/empty/revision/main", Handlers.json(200, "{\"sha\":\"abc\",\"siblings\":[]}"));

        assertThatThrownBy(() -> client(null).resolve(request("org/empty")))
            .isInstanceOf(ResolveException.class)
            .hasMessageContaining("no files");
    }

    @Test
    void validatesTokenWithWhoami() {
        hub.route("/api/whoami-v2", Handlers.requireBearer("hf_ok", Handlers.json(200, "{\"name\":\"me\"}")));

        assertThat(client("hf_ok").validateCredential()).isEqualTo(CredentialStatus.VALID);
        assertThat(client("hf_bad").validateCredential()).isEqualTo(CredentialStatus.REJECTED);
    }

    private HubClient client(String token) {
        return new HubClient(http, hub.baseUrl(), token, "main");
    }

    private static AcquisitionRequest request(String identifier) {
        return new AcquisitionRequest(Registry.HUB_REPOSITORY, identifier, ArtifactCategory.HUB_SNAPSHOT);
    }
}
