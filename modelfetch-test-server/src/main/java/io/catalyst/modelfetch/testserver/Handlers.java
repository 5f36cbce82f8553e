package io.catalyst.modelfetch.testserver;

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

import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.HttpRequestHandler;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/// Request handlers for {@link TestWebServerFixture} routes.
public final class Handlers {

    private Handlers() {
    }

    /// @param status the status to answer
    /// @param json the body, served as `application/json`
    /// @return a handler answering every request with the JSON body
    public static HttpRequestHandler json(int status, String json) {
        return (request, response, context) -> {
            response.setCode(status);
            response.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));
        };
    }

    /// @param status the status to answer
    /// @return a handler answering with the status and a short text body
    public static HttpRequestHandler status(int status) {
        return (request, response, context) -> {
            response.setCode(status);
            response.setEntity(new StringEntity("status " + status, ContentType.TEXT_PLAIN));
        };
    }

    /// @param status a 3xx status
    /// @param location the absolute or relative redirect target
    /// @return a handler answering with a redirect
    public static HttpRequestHandler redirect(int status, String location) {
        return (request, response, context) -> {
            response.setCode(status);
            response.setHeader("Location", location);
        };
    }

    /// Serves the bytes with `Range` support and `Accept-Ranges: bytes`, like a static file.
    ///
    /// @param data the content
    /// @return the handler
    public static HttpRequestHandler bytes(byte[] data) {
        return (request, response, context) -> serveBytes(request, response, data, true, null, 0);
    }

    /// Serves the bytes as a plain `200` body, ignoring `Range` and without `Accept-Ranges`.
    ///
    /// @param data the content
    /// @return the handler
    public static HttpRequestHandler bytesWithoutRanges(byte[] data) {
        return (request, response, context) -> serveBytes(request, response, data, false, null, 0);
    }

    /// Serves the bytes slowly: at most `chunkSize` bytes per `delay`.
    ///
    /// @param data the content
    /// @param chunkSize bytes released per step
    /// @param delay the pause between steps
    /// @return the handler
    public static HttpRequestHandler throttledBytes(byte[] data, int chunkSize, Duration delay) {
        return (request, response, context) -> serveBytes(request, response, data, true, delay, chunkSize);
    }

    /// Fails the first `failures` requests with `status`, then delegates.
    ///
    /// @param failures the number of failing requests
    /// @param status the failure status
    /// @param then the handler for later requests
    /// @return the handler
    public static HttpRequestHandler failingFirst(int failures, int status, HttpRequestHandler then) {
        AtomicInteger seen = new AtomicInteger();
        return (request, response, context) -> {
            if (seen.getAndIncrement() < failures) {
                response.setCode(status);
                response.setEntity(new StringEntity("induced failure", ContentType.TEXT_PLAIN));
                return;
            }
            then.handle(request, response, context);
        };
    }

    /// Answers 401 unless the request carries `Authorization: Bearer <token>`.
    ///
    /// @param token the accepted token
    /// @param then the handler for authorized requests
    /// @return the handler
    public static HttpRequestHandler requireBearer(String token, HttpRequestHandler then) {
        return (request, response, context) -> {
            Header authorization = request.getFirstHeader("Authorization");
            if (authorization == null || !("Bearer " + token).equals(authorization.getValue())) {
                response.setCode(HttpStatus.SC_UNAUTHORIZED);
                response.setEntity(new StringEntity("unauthorized", ContentType.TEXT_PLAIN));
                return;
            }
            then.handle(request, response, context);
        };
    }

    private static void serveBytes(ClassicHttpRequest request, ClassicHttpResponse response,
                                   byte[] data, boolean ranges, Duration delay, int chunkSize) {
        Header rangeHeader = ranges ? request.getFirstHeader("Range") : null;
        int start = 0;
        int end = data.length - 1;
        if (rangeHeader != null) {
            String value = rangeHeader.getValue();
            if (!value.startsWith("bytes=")) {
                response.setCode(HttpStatus.SC_REQUESTED_RANGE_NOT_SATISFIABLE);
                return;
            }
            String[] bounds = value.substring("bytes=".length()).split("-", -1);
            if (!bounds[0].isEmpty()) {
                start = Integer.parseInt(bounds[0]);
            }
            if (bounds.length > 1 && !bounds[1].isEmpty()) {
                end = Math.min(Integer.parseInt(bounds[1]), data.length - 1);
            }
            if (start >= data.length || start > end) {
                response.setCode(HttpStatus.SC_REQUESTED_RANGE_NOT_SATISFIABLE);
                response.setHeader("Content-Range", "bytes */" + data.length);
                return;
            }
            response.setCode(HttpStatus.SC_PARTIAL_CONTENT);
            response.setHeader("Content-Range", "bytes " + start + "-" + end + "/" + data.length);
        } else {
            response.setCode(HttpStatus.SC_OK);
        }
        if (ranges) {
            response.setHeader("Accept-Ranges", "bytes");
        }
        int length = end - start + 1;
        if (delay == null) {
            response.setEntity(new ByteArrayEntity(data, start, length, ContentType.APPLICATION_OCTET_STREAM));
        } else {
            response.setEntity(new InputStreamEntity(new ThrottledInputStream(data, start, length, chunkSize, delay),
                length, ContentType.APPLICATION_OCTET_STREAM));
        }
    }

    private static final class ThrottledInputStream extends InputStream {
        private final byte[] data;
        private final int end;
        private final int chunkSize;
        private final Duration delay;
        private int position;

        private ThrottledInputStream(byte[] data, int start, int length, int chunkSize, Duration delay) {
            this.data = data;
            this.position = start;
            this.end = start + length;
            this.chunkSize = Math.max(1, chunkSize);
            this.delay = delay;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (position >= end) {
                return -1;
            }
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("throttled stream interrupted");
            }
            int n = Math.min(Math.min(length, chunkSize), end - position);
            System.arraycopy(data, position, buffer, offset, n);
            position += n;
            return n;
        }
    }
}
