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

import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.TransientTransferException;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/// Streams one byte range, or a whole body, of a [RemoteResource] into a file with positional writes.
///
/// Bytes go straight from the socket to the file; nothing larger than the copy buffer is held in memory.
final class SegmentFetcher {
    private static final Logger logger = LogManager.getLogger(SegmentFetcher.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final OkHttpClient client;

    SegmentFetcher(OkHttpClient client) {
        this.client = client;
    }

    /// Fetches `[offset, offset + length)` into the channel at the same position.
    ///
    /// @return the number of bytes written, always `length` on success
    long fetchRange(RemoteResource resource, CredentialScope scope, FileChannel channel, long offset, long length,
                    CancellationToken token) throws IOException {
        long end = offset + length - 1;
        Request.Builder builder = new Request.Builder().url(resource.uri().toString())
            .header("Range", "bytes=" + offset + "-" + end);
        Optional<String> authorization = scope.authorizationFor(resource.uri());
        authorization.ifPresent(value -> builder.header("Authorization", value));

        Call call = token.track(client.newCall(builder.build()));
        try (Response response = call.execute()) {
            int code = response.code();
            if (code != 206) {
                if (code == 200) {
                    throw new ResolveException("server ignored range request for " + resource.redacted());
                }
                throw HttpStatusClassifier.forStatus(code, "segment " + offset + "-" + end + " of " + resource.redacted(),
                    authorization.isPresent());
            }
            validateContentRange(response.header("Content-Range"), offset, end);
            long written = copy(response.body(), channel, offset, length);
            if (written != length) {
                throw new TransientTransferException("segment " + offset + "-" + end + " ended after " + written
                    + " of " + length + " bytes");
            }
            logger.debug("Segment {}-{} of {} complete", offset, end, resource.redacted());
            return written;
        } finally {
            token.untrack(call);
        }
    }

    /// Fetches the whole body into `target`, replacing its contents.
    ///
    /// @return the number of bytes written
    long fetchWhole(RemoteResource resource, CredentialScope scope, Path target, CancellationToken token)
        throws IOException {
        Request.Builder builder = new Request.Builder().url(resource.uri().toString());
        Optional<String> authorization = scope.authorizationFor(resource.uri());
        authorization.ifPresent(value -> builder.header("Authorization", value));

        Call call = token.track(client.newCall(builder.build()));
        try (Response response = call.execute();
             FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                 StandardOpenOption.TRUNCATE_EXISTING)) {
            if (response.code() != 200) {
                throw HttpStatusClassifier.forStatus(response.code(), "download " + resource.redacted(),
                    authorization.isPresent());
            }
            long written = copy(response.body(), channel, 0, Long.MAX_VALUE);
            if (resource.hasSize() && written != resource.size()) {
                throw new TransientTransferException("download of " + resource.redacted() + " ended after " + written
                    + " of " + resource.size() + " bytes");
            }
            return written;
        } finally {
            token.untrack(call);
        }
    }

    private static void validateContentRange(String contentRange, long offset, long end) throws IOException {
        if (contentRange == null) {
            throw new ResolveException("206 response without Content-Range");
        }
        String expected = "bytes " + offset + "-" + end + "/";
        if (!contentRange.startsWith(expected)) {
            throw new ResolveException("Content-Range mismatch: expected " + expected + "* but got " + contentRange);
        }
    }

    private static long copy(ResponseBody body, FileChannel channel, long position, long limit) throws IOException {
        if (body == null) {
            throw new TransientTransferException("response body is null");
        }
        long written = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = body.byteStream()) {
            int n;
            while (written < limit && (n = in.read(buffer, 0, (int) Math.min(buffer.length, limit - written))) != -1) {
                ByteBuffer chunk = ByteBuffer.wrap(buffer, 0, n);
                while (chunk.hasRemaining()) {
                    written += channel.write(chunk, position + written);
                }
            }
        }
        return written;
    }
}
