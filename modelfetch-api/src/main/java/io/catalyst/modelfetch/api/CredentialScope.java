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

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/// Decides, per request URL, whether a registry bearer credential may be attached.
///
/// The credential is only ever sent to the authorities (host and effective port) of the
/// registry itself. Presigned storage hosts reached through a redirect are outside the
/// scope and receive no `Authorization` header.
public final class CredentialScope {

    private static final CredentialScope ANONYMOUS = new CredentialScope(null, Set.of());

    private final String token;
    private final Set<String> authorities;

    private CredentialScope(String token, Set<String> authorities) {
        this.token = token;
        this.authorities = authorities;
    }

    /// @return a scope which never attaches a credential
    public static CredentialScope anonymous() {
        return ANONYMOUS;
    }

    /// Creates a scope for the given registry origins.
    ///
    /// @param token the bearer token, may be null or blank for anonymous access
    /// @param origins the base URLs whose authorities may receive the token
    /// @return the scope
    public static CredentialScope of(String token, String... origins) {
        Set<String> authorities = new LinkedHashSet<>();
        for (String origin : origins) {
            authorities.add(authorityOf(URI.create(origin)));
        }
        String trimmed = token == null ? null : token.trim();
        return new CredentialScope(trimmed == null || trimmed.isEmpty() ? null : trimmed,
            Collections.unmodifiableSet(authorities));
    }

    /// @return true when a token is configured
    public boolean hasCredential() {
        return token != null;
    }

    /// @param uri a request target
    /// @return true when the target belongs to the registry origins
    public boolean covers(URI uri) {
        return authorities.contains(authorityOf(uri));
    }

    /// @param uri a request target
    /// @return the `Authorization` header value for the target, or empty when the target is
    ///     out of scope or no token is configured
    public Optional<String> authorizationFor(URI uri) {
        if (token == null || !covers(uri)) {
            return Optional.empty();
        }
        return Optional.of("Bearer " + token);
    }

    /// @return the authorities which may receive the credential
    public Set<String> authorities() {
        return authorities;
    }

    /// @param uri an absolute http or https URI
    /// @return the lower case `host:port`, with the scheme default port filled in
    public static String authorityOf(URI uri) {
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("URI has no host: " + uri);
        }
        int port = uri.getPort();
        if (port < 0) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return host.toLowerCase(Locale.ROOT) + ":" + port;
    }

    @Override
    public String toString() {
        return "CredentialScope{" + authorities + (token != null ? ", token set (" + token.length() + " chars)" : ", anonymous") + "}";
    }
}
