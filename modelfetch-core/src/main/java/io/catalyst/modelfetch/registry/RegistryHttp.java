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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.catalyst.modelfetch.api.AcquisitionException;
import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.TransientTransferException;
import io.catalyst.modelfetch.transport.HttpStatusClassifier;
import io.catalyst.modelfetch.transport.RedirectResolver;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/// JSON GETs against registry APIs, following redirects by hand so the credential only goes
/// where its [CredentialScope] allows.
final class RegistryHttp {
    private static final Logger logger = LogManager.getLogger(RegistryHttp.class);

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    RegistryHttp(OkHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    /// @param url the API URL
    /// @param scope where the credential may be sent
    /// @param what a description used in errors
    /// @return the parsed JSON document
    JsonNode getJson(String url, CredentialScope scope, String what) throws AcquisitionException {
        URI current = URI.create(url);
        for (int hops = 0; hops <= RedirectResolver.MAX_REDIRECTS; hops++) {
            Request.Builder builder = new Request.Builder().url(current.toString()).header("Accept", "application/json");
            Optional<String> authorization = scope.authorizationFor(current);
            authorization.ifPresent(value -> builder.header("Authorization", value));
            logger.debug("GET {}", RedirectResolver.redact(current));
            try (Response response = client.newCall(builder.build()).execute()) {
                int code = response.code();
                if (HttpStatusClassifier.isRedirect(code) && response.header("Location") != null) {
                    current = current.resolve(response.header("Location").trim());
                    continue;
                }
                if (code < 200 || code >= 300) {
                    throw HttpStatusClassifier.forStatus(code, what, authorization.isPresent());
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new ResolveException(what + " returned no body");
                }
                return mapper.readTree(body.byteStream());
            } catch (JsonProcessingException e) {
                throw new ResolveException(what + " returned malformed JSON: " + e.getOriginalMessage(), e);
            } catch (AcquisitionException e) {
                throw e;
            } catch (IOException e) {
                throw new TransientTransferException(what + ": " + e, e);
            }
        }
        throw new ResolveException("too many redirects for " + what);
    }

    /// @param url any URL of the registry
    /// @return true if the server answered at all, whatever the status
    boolean reachable(String url) {
        Request request = new Request.Builder().url(url).head().build();
        try (Response response = client.newCall(request).execute()) {
            logger.debug("Reachability probe {} answered {}", url, response.code());
            return true;
        } catch (IOException e) {
            logger.debug("Reachability probe {} failed: {}", url, e.toString());
            return false;
        }
    }

    /// @return the HTTP status of an authenticated GET, or -1 if the request failed
    int status(String url, CredentialScope scope) {
        URI uri = URI.create(url);
        Request.Builder builder = new Request.Builder().url(url);
        scope.authorizationFor(uri).ifPresent(value -> builder.header("Authorization", value));
        try (Response response = client.newCall(builder.build()).execute()) {
            return response.code();
        } catch (IOException e) {
            logger.debug("GET {} failed: {}", url, e.toString());
            return -1;
        }
    }

    static String trimSlash(String baseUrl) {
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
