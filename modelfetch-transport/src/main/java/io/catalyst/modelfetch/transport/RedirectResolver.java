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

import io.catalyst.modelfetch.api.AcquisitionException;
import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.ResolveException;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/// Follows download redirects explicitly, attaching the credential only to hops whose
/// authority is inside the [CredentialScope].
///
/// Each hop is probed with `GET` and `Range: bytes=0-0`, which presigned storage hosts accept
/// (they often reject `HEAD` because the signature covers the method) and which also reveals
/// the total size and range support from the `206` answer. The response body is at most one
/// byte and is discarded.
public class RedirectResolver {
    private static final Logger logger = LogManager.getLogger(RedirectResolver.class);

    public static final int MAX_REDIRECTS = 5;

    private final OkHttpClient client;

    public RedirectResolver(OkHttpClient client) {
        this.client = client;
    }

    /// @param url the download URL published by the registry
    /// @param scope where the credential may be sent
    /// @param token the cancellation token
    /// @return the final resource
    /// @throws AcquisitionException if a hop fails, too many redirects occur, or the token is cancelled
    public RemoteResource resolve(String url, CredentialScope scope, CancellationToken token)
        throws AcquisitionException {
        URI current = parse(url);
        for (int hops = 0; ; hops++) {
            token.throwIfCancelled("resolving " + redact(current));
            Request.Builder builder = new Request.Builder().url(current.toString()).get().header("Range", "bytes=0-0");
            Optional<String> authorization = scope.authorizationFor(current);
            authorization.ifPresent(value -> builder.header("Authorization", value));
            logger.debug("Probing {} (credential {})", redact(current), authorization.isPresent() ? "attached" : "withheld");

            Call call = token.track(client.newCall(builder.build()));
            try (Response response = call.execute()) {
                int code = response.code();
                if (HttpStatusClassifier.isRedirect(code)) {
                    String location = response.header("Location");
                    if (location == null || location.isBlank()) {
                        throw new ResolveException("redirect " + code + " from " + redact(current) + " has no Location");
                    }
                    if (hops + 1 > MAX_REDIRECTS) {
                        throw new ResolveException("too many redirects resolving " + redact(parse(url)));
                    }
                    URI next = parse(current.resolve(location.trim()).toString());
                    if (authorization.isPresent() && !scope.covers(next)) {
                        logger.info("Redirect from {} leaves the credential scope; not forwarding credential to {}",
                            CredentialScope.authorityOf(current), CredentialScope.authorityOf(next));
                    }
                    current = next;
                    continue;
                }
                if (code == 206) {
                    long total = totalFromContentRange(response.header("Content-Range"));
                    return new RemoteResource(current, total, true, hops);
                }
                if (code == 200) {
                    ResponseBody body = response.body();
                    long length = body != null ? body.contentLength() : -1;
                    return new RemoteResource(current, length, false, hops);
                }
                if (code == 416) {
                    long total = totalFromContentRange(response.header("Content-Range"));
                    if (total == 0 || total == -1) {
                        return new RemoteResource(current, 0, false, hops);
                    }
                }
                throw HttpStatusClassifier.forStatus(code, "download " + redact(current), authorization.isPresent());
            } catch (IOException e) {
                throw HttpStatusClassifier.forIoFailure("resolving " + redact(current), e, token);
            } finally {
                token.untrack(call);
            }
        }
    }

    /// Parses the total from `bytes a-b/total` or `bytes * /total`.
    ///
    /// @param contentRange the header value, possibly null
    /// @return the total, or -1 if absent or `*`
    static long totalFromContentRange(String contentRange) {
        if (contentRange == null) {
            return -1;
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0) {
            return -1;
        }
        String total = contentRange.substring(slash + 1).trim();
        if (total.equals("*")) {
            return -1;
        }
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed Content-Range '{}'", contentRange);
            return -1;
        }
    }

    /// @param uri any URI
    /// @return scheme, authority and path only; presigned query strings are credentials too
    public static String redact(URI uri) {
        return uri.getScheme() + "://" + uri.getRawAuthority() + (uri.getRawPath() == null ? "" : uri.getRawPath());
    }

    private static URI parse(String url) throws ResolveException {
        try {
            URI uri = URI.create(url);
            if (uri.getHost() == null || !("http".equalsIgnoreCase(uri.getScheme())
                || "https".equalsIgnoreCase(uri.getScheme()))) {
                throw new ResolveException("not an http(s) URL: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ResolveException("malformed URL: " + url, e);
        }
    }
}
