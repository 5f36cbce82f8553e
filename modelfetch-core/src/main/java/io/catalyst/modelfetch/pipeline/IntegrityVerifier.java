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

import io.catalyst.modelfetch.api.AcquisitionException;
import io.catalyst.modelfetch.api.ExpectedHash;
import io.catalyst.modelfetch.api.FailureKind;
import io.catalyst.modelfetch.api.HashAlgorithm;
import io.catalyst.modelfetch.api.IntegrityException;
import io.catalyst.modelfetch.api.StagedFile;
import io.catalyst.modelfetch.api.TransferResult;
import io.catalyst.modelfetch.transport.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/// Checks staged files against the hashes their registry published.
///
/// A mismatching file is deleted before [IntegrityException] is thrown, so it can never be placed.
/// Files without a published hash pass through and the result is marked unverified.
public class IntegrityVerifier {
    private static final Logger logger = LogManager.getLogger(IntegrityVerifier.class);
    private static final int BUFFER_SIZE = 1024 * 1024;

    /// @param transfer the staged transfer
    /// @param token cancels hashing of large files at the run deadline
    /// @return the transfer, marked verified when every file had a hash and matched it
    /// @throws AcquisitionException on a mismatch, a read failure, or cancellation
    public TransferResult verify(TransferResult transfer, CancellationToken token) throws AcquisitionException {
        boolean allVerified = true;
        for (StagedFile staged : transfer.files()) {
            Optional<ExpectedHash> expected = staged.file().hash();
            if (expected.isEmpty()) {
                allVerified = false;
                logger.warn("{}: no published hash for {}; it will be placed unverified",
                    transfer.artifact().request().key(), staged.file().relativePath());
                continue;
            }
            String actual;
            try {
                actual = digest(staged.path(), expected.get().algorithm(), token);
            } catch (IOException e) {
                throw new AcquisitionException(FailureKind.INTEGRITY, "cannot hash " + staged.path() + ": " + e, e);
            }
            if (!expected.get().matches(actual)) {
                deleteQuietly(staged.path());
                throw new IntegrityException(staged.path(), expected.get(), actual);
            }
            logger.debug("Verified {} ({})", staged.path().getFileName(), expected.get());
        }
        return transfer.withVerified(allVerified);
    }

    /// Hashes a file. [HashAlgorithm#GIT_BLOB_SHA1] hashes the git blob header `blob <size>\0` first.
    ///
    /// @param file the file
    /// @param algorithm the algorithm
    /// @param token checked between buffers
    /// @return the lower case hex digest
    public static String digest(Path file, HashAlgorithm algorithm, CancellationToken token) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm.jcaName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm.jcaName() + " not available", e);
        }
        if (algorithm == HashAlgorithm.GIT_BLOB_SHA1) {
            digest.update(("blob " + Files.size(file) + "\0").getBytes(StandardCharsets.US_ASCII));
        }
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                token.throwIfCancelled("hashing " + file.getFileName());
                digest.update(buffer, 0, n);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
            logger.info("Discarded {} after checksum mismatch", file);
        } catch (IOException e) {
            logger.error("Cannot delete corrupt file {}: {}", file, e.getMessage());
        }
    }
}
