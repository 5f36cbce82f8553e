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

import java.time.Duration;

/// Immutable transfer tuning: timeouts, per-file connections, segment size and retry policy.
///
/// ```java
/// TransportSettings settings = TransportSettings.builder()
///     .connections(4)
///     .segmentSize(64L << 20)
///     .retryPolicy(RetryPolicy.of(3))
///     .build();
/// ```
public final class TransportSettings {

    public static final String DEFAULT_USER_AGENT = "Catalyst/1.0";
    public static final long DEFAULT_SEGMENT_SIZE = 64L * 1024 * 1024;

    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int connections;
    private final long segmentSize;
    private final RetryPolicy retryPolicy;
    private final String userAgent;

    private TransportSettings(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
        this.connections = builder.connections;
        this.segmentSize = builder.segmentSize;
        this.retryPolicy = builder.retryPolicy;
        this.userAgent = builder.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TransportSettings defaults() {
        return builder().build();
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    /// @return the number of segments of one file fetched in parallel
    public int connections() {
        return connections;
    }

    public long segmentSize() {
        return segmentSize;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public String userAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        return "TransportSettings{connections=" + connections + ", segmentSize=" + segmentSize + ", " + retryPolicy
            + ", connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout + "}";
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private int connections = 4;
        private long segmentSize = DEFAULT_SEGMENT_SIZE;
        private RetryPolicy retryPolicy = RetryPolicy.of(3);
        private String userAgent = DEFAULT_USER_AGENT;

        private Builder() {
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder connections(int connections) {
            this.connections = connections;
            return this;
        }

        public Builder segmentSize(long segmentSize) {
            this.segmentSize = segmentSize;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public TransportSettings build() {
            if (connections < 1) {
                throw new IllegalArgumentException("connections must be at least 1: " + connections);
            }
            if (segmentSize < 1) {
                throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
            }
            return new TransportSettings(this);
        }
    }
}
