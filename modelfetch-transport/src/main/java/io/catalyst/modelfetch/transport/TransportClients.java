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

import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/// Builds the OkHttp client shared by the registry clients and the transfer engine.
///
/// Redirects are never followed by OkHttp itself: its default redirect handling would carry
/// request headers to whatever host the redirect names. [RedirectResolver] follows them instead,
/// deciding per hop whether the credential may be sent.
public final class TransportClients {

    private TransportClients() {
    }

    /// @param settings the transfer settings
    /// @return a configured client
    public static OkHttpClient create(TransportSettings settings) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(64);
        dispatcher.setMaxRequestsPerHost(Math.max(5, settings.connections() * 4));

        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(32, 5, TimeUnit.MINUTES))
            .dispatcher(dispatcher)
            .connectTimeout(settings.connectTimeout())
            .readTimeout(settings.readTimeout())
            .writeTimeout(settings.readTimeout())
            .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
            .retryOnConnectionFailure(true)
            .followRedirects(false)
            .followSslRedirects(false)
            .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                .header("User-Agent", settings.userAgent())
                .build()))
            .build();
    }

    /// Releases the client's threads and pooled connections.
    ///
    /// @param client a client from [#create(TransportSettings)]
    public static void shutdown(OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
