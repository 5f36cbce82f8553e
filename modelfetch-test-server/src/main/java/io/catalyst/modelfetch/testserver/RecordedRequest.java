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

import java.util.Locale;
import java.util.Map;

/// A request as seen by {@link TestWebServerFixture}.
///
/// @param method the HTTP method
/// @param path the request path including any query string
/// @param headers request headers, names in lower case
/// @param authority the `host:port` the server answered on
public record RecordedRequest(String method, String path, Map<String, String> headers, String authority) {

    /// @param name a header name in any case
    /// @return the header value, or null when absent
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /// @return true when an `Authorization` header was sent
    public boolean hasAuthorization() {
        return headers.containsKey("authorization");
    }
}
