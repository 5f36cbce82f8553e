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

import io.catalyst.modelfetch.registry.UnknownTypePolicy;
import io.catalyst.modelfetch.transport.TransportSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Everything a pipeline run needs, folded from command line options and environment variables.
/// The core never reads the environment itself.
public final class PipelineSettings {

    private final Map<IdentifierList, String> identifiers;
    private final Path storageRoot;
    private final Path tempDir;
    private final Duration timeout;
    private final Duration networkWait;
    private final Duration cancellationGrace;
    private final int maxConcurrent;
    private final boolean force;
    private final MarkerPolicy markerPolicy;
    private final UnknownTypePolicy unknownTypePolicy;
    private final String marketplaceBaseUrl;
    private final String marketplaceToken;
    private final String hubBaseUrl;
    private final String hubToken;
    private final String hubRevision;
    private final TransportSettings transport;

    private PipelineSettings(Builder builder) {
        this.identifiers = Collections.unmodifiableMap(new EnumMap<>(builder.identifiers));
        this.storageRoot = Objects.requireNonNull(builder.storageRoot, "storageRoot");
        this.tempDir = Objects.requireNonNull(builder.tempDir, "tempDir");
        this.timeout = builder.timeout;
        this.networkWait = builder.networkWait;
        this.cancellationGrace = builder.cancellationGrace;
        this.maxConcurrent = builder.maxConcurrent;
        this.force = builder.force;
        this.markerPolicy = builder.markerPolicy;
        this.unknownTypePolicy = builder.unknownTypePolicy;
        this.marketplaceBaseUrl = builder.marketplaceBaseUrl;
        this.marketplaceToken = builder.marketplaceToken;
        this.hubBaseUrl = builder.hubBaseUrl;
        this.hubToken = builder.hubToken;
        this.hubRevision = builder.hubRevision;
        this.transport = builder.transport;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return raw identifier list values, as configured
    public Map<IdentifierList, String> identifiers() {
        return identifiers;
    }

    public Path storageRoot() {
        return storageRoot;
    }

    public Path tempDir() {
        return tempDir;
    }

    /// @return the wall-clock budget for the whole run
    public Duration timeout() {
        return timeout;
    }

    /// @return how long to wait for a registry to become reachable
    public Duration networkWait() {
        return networkWait;
    }

    /// @return how long cancelled transfers get to wind down after the deadline
    public Duration cancellationGrace() {
        return cancellationGrace;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public boolean force() {
        return force;
    }

    public MarkerPolicy markerPolicy() {
        return markerPolicy;
    }

    public UnknownTypePolicy unknownTypePolicy() {
        return unknownTypePolicy;
    }

    public String marketplaceBaseUrl() {
        return marketplaceBaseUrl;
    }

    public String marketplaceToken() {
        return marketplaceToken;
    }

    public String hubBaseUrl() {
        return hubBaseUrl;
    }

    public String hubToken() {
        return hubToken;
    }

    public String hubRevision() {
        return hubRevision;
    }

    public TransportSettings transport() {
        return transport;
    }

    @Override
    public String toString() {
        return "PipelineSettings{storageRoot=" + storageRoot + ", tempDir=" + tempDir + ", timeout=" + timeout
            + ", maxConcurrent=" + maxConcurrent + ", force=" + force + ", markerPolicy=" + markerPolicy
            + ", unknownTypePolicy=" + unknownTypePolicy + ", marketplace=" + marketplaceBaseUrl
            + " (token " + describeToken(marketplaceToken) + "), hub=" + hubBaseUrl + "@" + hubRevision
            + " (token " + describeToken(hubToken) + "), " + transport + "}";
    }

    static String describeToken(String token) {
        return token == null || token.isBlank() ? "not set" : "set (" + token.trim().length() + " chars)";
    }

    public static final class Builder {
        private final Map<IdentifierList, String> identifiers = new EnumMap<>(IdentifierList.class);
        private Path storageRoot;
        private Path tempDir;
        private Duration timeout = Duration.ofHours(1);
        private Duration networkWait = Duration.ofSeconds(60);
        private Duration cancellationGrace = Duration.ofSeconds(10);
        private int maxConcurrent = 2;
        private boolean force;
        private MarkerPolicy markerPolicy = MarkerPolicy.TOLERATE_PARTIAL;
        private UnknownTypePolicy unknownTypePolicy = UnknownTypePolicy.ROUTE_TO_OTHER;
        private String marketplaceBaseUrl = "https://civitai.com";
        private String marketplaceToken;
        private String hubBaseUrl = "https://huggingface.co";
        private String hubToken;
        private String hubRevision = "main";
        private TransportSettings transport = TransportSettings.defaults();

        private Builder() {
        }

        public Builder identifiers(IdentifierList list, String rawValue) {
            if (rawValue == null) {
                identifiers.remove(list);
            } else {
                identifiers.put(list, rawValue);
            }
            return this;
        }

        public Builder storageRoot(Path storageRoot) {
            this.storageRoot = storageRoot;
            return this;
        }

        public Builder tempDir(Path tempDir) {
            this.tempDir = tempDir;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder networkWait(Duration networkWait) {
            this.networkWait = networkWait;
            return this;
        }

        public Builder cancellationGrace(Duration cancellationGrace) {
            this.cancellationGrace = cancellationGrace;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder markerPolicy(MarkerPolicy markerPolicy) {
            this.markerPolicy = markerPolicy;
            return this;
        }

        public Builder unknownTypePolicy(UnknownTypePolicy unknownTypePolicy) {
            this.unknownTypePolicy = unknownTypePolicy;
            return this;
        }

        public Builder marketplaceBaseUrl(String marketplaceBaseUrl) {
            this.marketplaceBaseUrl = marketplaceBaseUrl;
            return this;
        }

        public Builder marketplaceToken(String marketplaceToken) {
            this.marketplaceToken = marketplaceToken;
            return this;
        }

        public Builder hubBaseUrl(String hubBaseUrl) {
            this.hubBaseUrl = hubBaseUrl;
            return this;
        }

        public Builder hubToken(String hubToken) {
            this.hubToken = hubToken;
            return this;
        }

        public Builder hubRevision(String hubRevision) {
            this.hubRevision = hubRevision;
            return this;
        }

        public Builder transport(TransportSettings transport) {
            this.transport = transport;
            return this;
        }

        /// @return the settings
        /// @throws IllegalArgumentException if a value is out of range
        public PipelineSettings build() {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            if (networkWait == null || networkWait.isNegative()) {
                throw new IllegalArgumentException("network wait must not be negative: " + networkWait);
            }
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("max concurrent downloads must be at least 1: " + maxConcurrent);
            }
            requireHttpUrl("marketplace base URL", marketplaceBaseUrl);
            requireHttpUrl("hub base URL", hubBaseUrl);
            return new PipelineSettings(this);
        }

        private static void requireHttpUrl(String what, String url) {
            URI uri;
            try {
                uri = new URI(url == null ? "" : url.trim());
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException(what + " is not a valid URL: " + url, e);
            }
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
                throw new IllegalArgumentException(what + " must be an http or https URL with a host: " + url);
            }
        }
    }
}
