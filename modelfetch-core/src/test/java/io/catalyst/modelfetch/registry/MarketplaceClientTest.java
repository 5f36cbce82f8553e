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
import io.catalyst.modelfetch.api.AuthException;
import io.catalyst.modelfetch.api.FailureKind;
import io.catalyst.modelfetch.api.HashAlgorithm;
import io.catalyst.modelfetch.api.Registry;
import io.catalyst.modelfetch.api.RegistryClient.CredentialStatus;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import io.catalyst.modelfetch.testserver.Handlers;
import io.catalyst.modelfetch.testserver.RecordedRequest;
import io.catalyst.modelfetch.testserver.TestWebServerFixture;
import io.catalyst.modelfetch.transport.TransportClients;
import io.catalyst.modelfetch.transport.TransportSettings;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketplaceClientTest {

    private static final byte[] DATA = "checkpoint bytes".repeat(100).getBytes(StandardCharsets.UTF_8);

    private TestWebServerFixture api;
    private TestWebServerFixture storage;
    private OkHttpClient http;

    @BeforeEach
    void setUp() throws IOException {
        api = new TestWebServerFixture();
        api.start();
        storage = new TestWebServerFixture();
        storage.start();
        http = TransportClients.create(TransportSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        TransportClients.shutdown(http);
        api.close();
        storage.close();
    }

    @Test
    void resolvesLatestVersionPrimaryFile() throws Exception {
        RegistryStubs.marketplace(api, storage, "tok", new RegistryStubs.MarketplaceModel(1569593, 1776890,
            "dreamshaper.safetensors", DATA));

        ResolvedArtifact artifact = client("tok", UnknownTypePolicy.ROUTE_TO_OTHER)
            .resolve(request("1569593", ArtifactCategory.CHECKPOINTS));

        assertThat(artifact.category()).isEqualTo(ArtifactCategory.CHECKPOINTS);
        assertThat(artifact.name()).isEqualTo("dreamshaper.safetensors");
        ArtifactFile file = artifact.files().get(0);
        assertThat(file.downloadUrl()).isEqualTo(api.baseUrl() + "/api/download/models/1776890");
        assertThat(file.expectedSize()).isEqualTo(DATA.length);
        assertThat(file.hash()).hasValueSatisfying(hash -> {
            assertThat(hash.algorithm()).isEqualTo(HashAlgorithm.SHA256);
            assertThat(hash.hex()).isEqualTo(RegistryStubs.sha256(DATA));
        });
        assertThat(artifact.credentialScope().covers(URI.create(file.downloadUrl()))).isTrue();
        assertThat(artifact.credentialScope().covers(URI.create(storage.baseUrl()))).isFalse();
        assertThat(api.requests()).allMatch(RecordedRequest::hasAuthorization);
    }

    @Test
    void pinnedVersionIsUsed() throws Exception {
        RegistryStubs.marketplace(api, storage, null, new RegistryStubs.MarketplaceModel(10, 22, "old.safetensors", DATA));

        ResolvedArtifact artifact = client(null, UnknownTypePolicy.ROUTE_TO_OTHER)
            .resolve(request("10@22", null));

        assertThat(artifact.downloadUrl()).endsWith("/api/download/models/22");
        assertThat(api.requestsTo("/api/v1/model-versions/22")).hasSize(1);
    }

    @Test
    void unknownModelIdFallsBackToVersionId() throws Exception {
        RegistryStubs.marketplace(api, storage, null, new RegistryStubs.MarketplaceModel(5, 77, "lora.safetensors", DATA)
            .type("LORA"));

        ResolvedArtifact artifact = client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("77", null));

        assertThat(artifact.category()).isEqualTo(ArtifactCategory.LORAS);
        assertThat(api.requestsTo("/api/v1/models/77")).hasSize(1);
    }

    @Test
    void categoryComesFromMetadataForGenericList() throws Exception {
        RegistryStubs.marketplace(api, storage, null, new RegistryStubs.MarketplaceModel(3, 4, "ti.pt", DATA)
            .type("TextualInversion"));

        assertThat(client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("3", null)).category())
            .isEqualTo(ArtifactCategory.EMBEDDINGS);
    }

    @Test
    void declaredCategoryWinsOverMetadata() throws Exception {
        RegistryStubs.marketplace(api, storage, null, new RegistryStubs.MarketplaceModel(3, 4, "vae.safetensors", DATA)
            .type("Checkpoint"));

        assertThat(client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("3", ArtifactCategory.VAE)).category())
            .isEqualTo(ArtifactCategory.VAE);
    }

    @Test
    void unknownTypeRoutesToOtherOrIsRejected() throws Exception {
        RegistryStubs.marketplace(api, storage, null, new RegistryStubs.MarketplaceModel(8, 9, "pose.zip", DATA)
            .type("Poses"));

        assertThat(client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("8", null)).category())
            .isEqualTo(ArtifactCategory.OTHER);
        assertThatThrownBy(() -> client(null, UnknownTypePolicy.REJECT).resolve(request("8", null)))
            .isInstanceOfSatisfying(ResolveException.class, e -> {
                assertThat(e.kind()).isEqualTo(FailureKind.RESOLVE);
                assertThat(e).hasMessageContaining("Poses");
            });
    }

    @Test
    void missingDownloadUrlFallsBackToDownloadEndpoint() throws Exception {
        RegistryStubs.marketplace(api, storage, null, new RegistryStubs.MarketplaceModel(1, 2, "m.safetensors", DATA)
            .withoutDownloadUrl().sha256(null));

        ResolvedArtifact artifact = client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("1", null));

        assertThat(artifact.downloadUrl()).isEqualTo(api.baseUrl() + "/api/download/models/2");
        assertThat(artifact.files().get(0).hash()).isEmpty();
    }

    @Test
    void missingModelIsNotFound() {
        assertThatThrownBy(() -> client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("404404", null)))
            .isInstanceOfSatisfying(ResolveException.class, e -> assertThat(e.kind()).isEqualTo(FailureKind.NOT_FOUND));
    }

    @Test
    void rejectedTokenIsAnAuthFailure() {
        RegistryStubs.marketplace(api, storage, "right", new RegistryStubs.MarketplaceModel(1, 2, "m.safetensors", DATA));

        assertThatThrownBy(() -> client("wrong", UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("1", null)))
            .isInstanceOfSatisfying(AuthException.class, e -> assertThat(e.credentialPresent()).isTrue());
    }

    @Test
    void malformedIdentifierIsRejectedWithoutNetwork() {
        assertThatThrownBy(() -> client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("abc", null)))
            .isInstanceOf(ResolveException.class)
            .hasMessageContaining("not a marketplace identifier");
        assertThat(api.requests()).isEmpty();
    }

    @Test
    void malformedMetadataIsAResolveFailure() {
        api.route("/api/v1/models/6", Handlers.json(200, "{\"type\": \"Checkpoint\", "));

        assertThatThrownBy(() -> client(null, UnknownTypePolicy.ROUTE_TO_OTHER).resolve(request("6", null)))
            .isInstanceOf(ResolveException.class)
            .hasMessageContaining("malformed JSON");
    }

    @Test
    void validatesCredential() {
        api.route("/api/v1/models", Handlers.requireBearer("tok", Handlers.json(200, "{\"items\":[]}")));

        assertThat(client("tok", UnknownTypePolicy.ROUTE_TO_OTHER).validateCredential()).isEqualTo(CredentialStatus.VALID);
        assertThat(client("bad", UnknownTypePolicy.ROUTE_TO_OTHER).validateCredential()).isEqualTo(CredentialStatus.REJECTED);
        assertThat(client(null, UnknownTypePolicy.ROUTE_TO_OTHER).validateCredential()).isEqualTo(CredentialStatus.ABSENT);
        assertThat(client(null, UnknownTypePolicy.ROUTE_TO_OTHER).probe()).isTrue();
    }

    private MarketplaceClient client(String token, UnknownTypePolicy policy) {
        return new MarketplaceClient(http, api.baseUrl(), token, policy);
    }

    private static AcquisitionRequest request(String identifier, ArtifactCategory category) {
        return new AcquisitionRequest(Registry.MARKETPLACE_MODEL, identifier, category);
    }
}
