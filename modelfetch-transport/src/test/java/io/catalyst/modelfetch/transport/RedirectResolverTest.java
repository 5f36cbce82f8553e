package io.catalyst.modelfetch.transport;

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

import io.catalyst.modelfetch.api.AuthException;
import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.FailureKind;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.testserver.Handlers;
import io.catalyst.modelfetch.testserver.RecordedRequest;
import io.catalyst.modelfetch.testserver.TestWebServerFixture;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedirectResolverTest {

    private static final byte[] DATA = "model weights".getBytes(StandardCharsets.UTF_8);

    private TestWebServerFixture origin;
    private TestWebServerFixture storage;
    private OkHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        origin = new TestWebServerFixture();
        origin.start();
        storage = new TestWebServerFixture();
        storage.start();
        client = TransportClients.create(TransportSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        TransportClients.shutdown(client);
        origin.close();
        storage.close();
    }

    @Test
    void credentialIsNotForwardedToCrossAuthorityRedirectTarget() throws Exception {
        storage.route("/presigned/model.safetensors", Handlers.bytes(DATA));
        origin.route("/api/download/models/42", Handlers.requireBearer("secret",
            Handlers.redirect(302, storage.baseUrl() + "/presigned/model.safetensors?X-Signature=abc")));
        CredentialScope scope = CredentialScope.of("secret", origin.baseUrl());

        RemoteResource resource = new RedirectResolver(client)
            .resolve(origin.baseUrl() + "/api/download/models/42", scope, CancellationToken.create());

        assertThat(CredentialScope.authorityOf(resource.uri()))
            .isNotEqualTo(CredentialScope.authorityOf(java.net.URI.create(origin.baseUrl())));
        assertThat(resource.uri().getQuery()).isEqualTo("X-Signature=abc");
        assertThat(resource.size()).isEqualTo(DATA.length);
        assertThat(resource.rangesSupported()).isTrue();
        assertThat(resource.redirects()).isEqualTo(1);
        assertThat(origin.requests()).allMatch(RecordedRequest::hasAuthorization);
        assertThat(storage.requests()).isNotEmpty().noneMatch(RecordedRequest::hasAuthorization);
    }

    @Test
    void credentialIsKeptOnSameAuthorityRedirect() throws Exception {
        origin.route("/api/download/models/7", Handlers.redirect(307, "/files/7.bin"));
        origin.route("/files/7.bin", Handlers.requireBearer("secret", Handlers.bytes(DATA)));
        CredentialScope scope = CredentialScope.of("secret", origin.baseUrl());

        RemoteResource resource = new RedirectResolver(client)
            .resolve(origin.baseUrl() + "/api/download/models/7", scope, CancellationToken.create());

        assertThat(resource.uri().getPath()).isEqualTo("/files/7.bin");
        assertThat(origin.requestsTo("/files/7.bin")).hasSize(1).allMatch(RecordedRequest::hasAuthorization);
    }

    @Test
    void serverWithoutRangesReportsLengthOnly() throws Exception {
        origin.route("/plain", Handlers.bytesWithoutRanges(DATA));

        RemoteResource resource = new RedirectResolver(client)
            .resolve(origin.baseUrl() + "/plain", CredentialScope.anonymous(), CancellationToken.create());

        assertThat(resource.rangesSupported()).isFalse();
        assertThat(resource.size()).isEqualTo(DATA.length);
    }

    @Test
    void redirectLoopIsBounded() {
        origin.route("/loop", Handlers.redirect(302, "/loop"));

        assertThatThrownBy(() -> new RedirectResolver(client)
            .resolve(origin.baseUrl() + "/loop", CredentialScope.anonymous(), CancellationToken.create()))
            .isInstanceOf(ResolveException.class)
            .hasMessageContaining("too many redirects");
        assertThat(origin.requestsTo("/loop")).hasSize(RedirectResolver.MAX_REDIRECTS + 1);
    }

    @Test
    void missingCredentialIsReportedAsAuthFailure() {
        origin.route("/gated", Handlers.requireBearer("secret", Handlers.bytes(DATA)));

        assertThatThrownBy(() -> new RedirectResolver(client)
            .resolve(origin.baseUrl() + "/gated", CredentialScope.anonymous(), CancellationToken.create()))
            .isInstanceOfSatisfying(AuthException.class, e -> {
                assertThat(e.status()).isEqualTo(401);
                assertThat(e.credentialPresent()).isFalse();
            });
    }

    @Test
    void missingResourceIsNotFound() {
        assertThatThrownBy(() -> new RedirectResolver(client)
            .resolve(origin.baseUrl() + "/nothing", CredentialScope.anonymous(), CancellationToken.create()))
            .isInstanceOfSatisfying(ResolveException.class, e -> assertThat(e.kind()).isEqualTo(FailureKind.NOT_FOUND));
    }

    @Test
    void parsesContentRangeTotals() {
        assertThat(RedirectResolver.totalFromContentRange("bytes 0-0/1234")).isEqualTo(1234);
        assertThat(RedirectResolver.totalFromContentRange("bytes */99")).isEqualTo(99);
        assertThat(RedirectResolver.totalFromContentRange("bytes 0-0/*")).isEqualTo(-1);
        assertThat(RedirectResolver.totalFromContentRange(null)).isEqualTo(-1);
    }
}
