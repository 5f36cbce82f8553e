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
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.impl.bootstrap.HttpServer;
import org.apache.hc.core5.http.impl.bootstrap.ServerBootstrap;
import org.apache.hc.core5.http.io.HttpRequestHandler;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/// A test fixture that starts a local HTTP server with programmable routes and records
/// every request it receives, so tests can assert on headers such as `Authorization`.
///
/// Routes are matched on the path without query string: exact routes first, then the
/// longest prefix route registered with a trailing `*`. Unmatched paths answer 404.
///
/// Example usage:
/// ```java
/// try (TestWebServerFixture server = new TestWebServerFixture()) {
///     server.start();
///     server.route("/api/v1/models/1", Handlers.json(200, "{...}"));
///     String base = server.baseUrl();
///     // Use base in your tests
/// }
/// ```
public class TestWebServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TestWebServerFixture.class);

    private final Map<String, HttpRequestHandler> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private int port;

    /// Starts the web server on a random available loopback port.
    ///
    /// @throws IOException If the server cannot be started
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = ServerBootstrap.bootstrap()
            .setLocalAddress(InetAddress.getLoopbackAddress())
            .setListenerPort(port)
            .setSocketConfig(SocketConfig.custom().setSoTimeout(Timeout.ofSeconds(30)).build())
            .register("*", this::dispatch)
            .create();
        server.start();
        logger.info("Test web server started on port {}", port);
    }

    /// Registers or replaces a route.
    ///
    /// @param pathPattern an exact path, or a prefix ending in `*`
    /// @param handler the handler answering matching requests
    /// @return this fixture
    public TestWebServerFixture route(String pathPattern, HttpRequestHandler handler) {
        routes.put(pathPattern, handler);
        return this;
    }

    /// @return the base URL, without trailing slash, for example `http://127.0.0.1:41234`
    public String baseUrl() {
        return "http://127.0.0.1:" + port;
    }

    /// @return the port the server listens on
    public int port() {
        return port;
    }

    /// @return every request received so far, in arrival order
    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    /// @param pathPrefix a path prefix
    /// @return the requests whose path starts with the prefix
    public List<RecordedRequest> requestsTo(String pathPrefix) {
        return requests.stream().filter(r -> r.path().startsWith(pathPrefix)).collect(Collectors.toList());
    }

    /// Forgets the recorded requests.
    public void clearRequests() {
        requests.clear();
    }

    /// Stops the server and releases resources.
    @Override
    public void close() {
        if (server != null) {
            server.close(CloseMode.IMMEDIATE);
            logger.info("Test web server stopped");
        }
    }

    private void dispatch(ClassicHttpRequest request, ClassicHttpResponse response, HttpContext context)
        throws HttpException, IOException {
        String path = request.getPath();
        requests.add(record(request));

        String pathOnly = path.contains("?") ? path.substring(0, path.indexOf('?')) : path;
        HttpRequestHandler handler = routes.get(pathOnly);
        if (handler == null) {
            String bestPrefix = null;
            for (String pattern : routes.keySet()) {
                if (pattern.endsWith("*")) {
                    String prefix = pattern.substring(0, pattern.length() - 1);
                    if (pathOnly.startsWith(prefix) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                        bestPrefix = prefix;
                    }
                }
            }
            if (bestPrefix != null) {
                handler = routes.get(bestPrefix + "*");
            }
        }
        if (handler == null) {
            logger.debug("No route for {} {}", request.getMethod(), path);
            response.setCode(HttpStatus.SC_NOT_FOUND);
            if (!"HEAD".equalsIgnoreCase(request.getMethod())) {
                response.setEntity(new StringEntity("No route: " + path));
            }
            return;
        }
        handler.handle(request, response, context);
    }

    private RecordedRequest record(ClassicHttpRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : request.getHeaders()) {
            headers.put(header.getName().toLowerCase(Locale.ROOT), header.getValue());
        }
        return new RecordedRequest(request.getMethod(), request.getPath(), headers, "127.0.0.1:" + port);
    }

    /// Finds an available port to use for the server.
    ///
    /// @return An available port number
    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }
}
