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

import java.net.URI;

/// The final location of a download after redirects, with what the server told us about it.
///
/// @param uri the URI that serves the bytes
/// @param size the total size in bytes, or -1 if the server did not say
/// @param rangesSupported whether the server answered a range request with 206
/// @param redirects the number of redirect hops followed to reach [#uri()]
public record RemoteResource(URI uri, long size, boolean rangesSupported, int redirects) {

    public boolean hasSize() {
        return size >= 0;
    }

    /// @return the URI without query or fragment, safe for log lines when the URI is presigned
    public String redacted() {
        return RedirectResolver.redact(uri);
    }
}
