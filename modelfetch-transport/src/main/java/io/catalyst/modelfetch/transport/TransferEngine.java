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
import io.catalyst.modelfetch.api.ArtifactFile;
import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.PlacementException;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import io.catalyst.modelfetch.api.StagedFile;
import io.catalyst.modelfetch.api.TransferCancelledException;
import io.catalyst.modelfetch.api.TransferResult;
import io.catalyst.modelfetch.api.TransientTransferException;
import io.catalyst.modelfetch.api.fileio.FilesystemSpaceChecker;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Moves the bytes of a [ResolvedArtifact] into a per-request staging directory.
///
/// ## Transfer strategy
/// - Every file is written through `<name>.part` and renamed to `<name>` only once complete, so a
///   staged file under its final name is always whole.
/// - A file already staged under its final name, with the expected size when one is known, is reused
///   without network traffic. Its hash is still checked downstream.
/// - When the server supports ranges and the size is known, the file is split into segments of
///   [TransportSettings#segmentSize()] fetched by up to [TransportSettings#connections()] parallel
///   requests. Completed segments are recorded in a [SegmentLedger], so an interrupted transfer
///   resumes where it stopped.
/// - Otherwise the body is streamed in one request.
///
/// Each network operation is retried under the [RetryPolicy]; cancellation of the
/// [CancellationToken] aborts in-flight requests and surfaces as [TransferCancelledException].
public class TransferEngine {
    private static final Logger logger = LogManager.getLogger(TransferEngine.class);

    private final TransportSettings settings;
    private final RedirectResolver redirectResolver;
    private final SegmentFetcher segmentFetcher;

    public TransferEngine(OkHttpClient client, TransportSettings settings) {
        this.settings = settings;
        this.redirectResolver = new RedirectResolver(client);
        this.segmentFetcher = new SegmentFetcher(client);
    }

    /// Stages every file of the artifact.
    ///
    /// @param artifact the resolved artifact
    /// @param tempDir the temp working directory; a staging directory for the request is created inside it
    /// @param token the run's cancellation token
    /// @return the staged files, not yet verified
    /// @throws AcquisitionException if any file cannot be transferred
    public TransferResult fetch(ResolvedArtifact artifact, Path tempDir, CancellationToken token)
        throws AcquisitionException {
        Path stagingDirectory = StagingPaths.stagingDirectory(tempDir, artifact.request());
        try {
            Files.createDirectories(stagingDirectory);
        } catch (IOException e) {
            throw new PlacementException("cannot create staging directory " + stagingDirectory, stagingDirectory, e);
        }
        List<StagedFile> staged = new ArrayList<>();
        for (ArtifactFile file : artifact.files()) {
            staged.add(fetchFile(artifact, file, stagingDirectory, token));
        }
        removeUnlisted(stagingDirectory, staged);
        TransferResult result = new TransferResult(artifact, stagingDirectory, staged, false);
        logger.info("Staged {} ({} bytes transferred) in {}", artifact.name(), result.bytesTransferred(),
            stagingDirectory);
        return result;
    }

    private StagedFile fetchFile(ResolvedArtifact artifact, ArtifactFile file, Path stagingDirectory,
                                 CancellationToken token) throws AcquisitionException {
        String what = artifact.request().key() + " " + file.relativePath();
        token.throwIfCancelled(what);
        Path target = StagingPaths.resolveWithin(stagingDirectory, file.relativePath());
        if (isReusable(target, file)) {
            logger.info("Reusing staged file {}", target);
            return new StagedFile(file, target, 0, true);
        }

        CredentialScope scope = artifact.credentialScope();
        RetryPolicy retry = settings.retryPolicy();
        RemoteResource remote = retry.execute("resolve " + what,
            attempt -> redirectResolver.resolve(file.downloadUrl(), scope, token), token);
        long size = remote.hasSize() ? remote.size() : file.expectedSize();
        if (remote.hasSize() && file.hasExpectedSize() && remote.size() != file.expectedSize()) {
            logger.warn("{}: registry declared {} bytes but server reports {}", what, file.expectedSize(),
                remote.size());
        }

        Path part = StagingPaths.partFileFor(target);
        long start = System.nanoTime();
        long transferred;
        try {
            Files.createDirectories(target.getParent());
            if (remote.rangesSupported() && remote.hasSize() && remote.size() > 0) {
                transferred = fetchSegmented(what, remote, scope, part, token);
            } else {
                FilesystemSpaceChecker.checkSpaceAvailable(part, size);
                transferred = retry.execute("download " + what,
                    attempt -> segmentFetcher.fetchWhole(remote, scope, part, token), token);
            }
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw HttpStatusClassifier.forIoFailure(what, e, token);
        }
        double seconds = Math.max((System.nanoTime() - start) / 1e9, 0.001);
        logger.info("Fetched {} ({} bytes in {} s, {} MB/s, {} redirect(s))", what, transferred,
            String.format("%.1f", seconds), String.format("%.2f", transferred / seconds / (1024 * 1024)),
            remote.redirects());
        return new StagedFile(file, target, transferred, false);
    }

    private long fetchSegmented(String what, RemoteResource remote, CredentialScope scope, Path part,
                                CancellationToken token) throws IOException {
        SegmentLedger ledger = SegmentLedger.open(part, remote.size(), settings.segmentSize());
        boolean resuming = ledger.completedCount() > 0;
        if (resuming) {
            logger.info("Resuming {} with {}/{} segments already complete", what, ledger.completedCount(),
                ledger.segmentCount());
        }
        FilesystemSpaceChecker.checkSpaceAvailable(part, remote.size() - ledger.completedBytes());
        List<Integer> pending = ledger.pending();
        AtomicLong transferred = new AtomicLong();

        try (FileChannel channel = FileChannel.open(part, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            if (!resuming) {
                channel.truncate(0);
            }
            if (!pending.isEmpty()) {
                runSegments(what, remote, scope, channel, ledger, pending, transferred, token);
            }
            channel.force(false);
        }
        ledger.delete();
        return transferred.get();
    }

    private void runSegments(String what, RemoteResource remote, CredentialScope scope, FileChannel channel,
                             SegmentLedger ledger, List<Integer> pending, AtomicLong transferred,
                             CancellationToken token) throws AcquisitionException {
        CancellationToken fileToken = token.child();
        int threads = Math.min(settings.connections(), pending.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, segmentThreads(remote));
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int index : pending) {
                futures.add(pool.submit(() -> {
                    long offset = ledger.offsetOf(index);
                    long length = ledger.lengthOf(index);
                    settings.retryPolicy().execute("segment " + index + " of " + what,
                        attempt -> segmentFetcher.fetchRange(remote, scope, channel, offset, length, fileToken),
                        fileToken);
                    ledger.markComplete(index);
                    transferred.addAndGet(length);
                    return null;
                }));
            }
            AcquisitionException failure = null;
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = unwrap(what, e.getCause(), fileToken);
                        fileToken.cancel("segment of " + what + " failed");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    fileToken.cancel("interrupted");
                    throw new TransferCancelledException(what + " interrupted", e);
                }
            }
            if (failure != null) {
                if (token.isCancelled() && !(failure instanceof TransferCancelledException)) {
                    throw new TransferCancelledException(what + " cancelled: " + token.reason(), failure);
                }
                throw failure;
            }
        } finally {
            pool.shutdownNow();
            token.release(fileToken);
        }
    }

    /// Deletes whatever an earlier run left in the staging directory that the artifact no longer lists,
    /// so placement moves exactly the fetched files.
    private static void removeUnlisted(Path stagingDirectory, List<StagedFile> staged) throws PlacementException {
        Set<Path> listed = new HashSet<>();
        for (StagedFile file : staged) {
            listed.add(file.path().toAbsolutePath().normalize());
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(stagingDirectory)) {
            entries = walk.filter(p -> !p.equals(stagingDirectory))
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PlacementException("cannot scan staging directory " + stagingDirectory, stagingDirectory, e);
        }
        try {
            for (Path entry : entries) {
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (!hasListedDescendant(entry, listed)) {
                        Files.deleteIfExists(entry);
                    }
                } else if (!listed.contains(entry.toAbsolutePath().normalize())) {
                    logger.info("Removing stale staged file {}", entry);
                    Files.deleteIfExists(entry);
                }
            }
        } catch (IOException e) {
            throw new PlacementException("cannot clean staging directory " + stagingDirectory, stagingDirectory, e);
        }
    }

    private static boolean hasListedDescendant(Path directory, Set<Path> listed) {
        Path normalized = directory.toAbsolutePath().normalize();
        return listed.stream().anyMatch(p -> p.startsWith(normalized));
    }

    private static AcquisitionException unwrap(String what, Throwable cause, CancellationToken token) {
        if (cause instanceof IOException) {
            return HttpStatusClassifier.forIoFailure(what, (IOException) cause, token);
        }
        return new TransientTransferException(what + " failed: " + cause, cause);
    }

    private static boolean isReusable(Path target, ArtifactFile file) {
        if (!Files.isRegularFile(target)) {
            return false;
        }
        if (!file.hasExpectedSize()) {
            return true;
        }
        try {
            return Files.size(target) == file.expectedSize();
        } catch (IOException e) {
            logger.debug("Cannot stat staged file {}: {}", target, e.getMessage());
            return false;
        }
    }

    private static ThreadFactory segmentThreads(RemoteResource remote) {
        AtomicInteger counter = new AtomicInteger();
        String host = remote.uri().getHost();
        return runnable -> {
            Thread thread = new Thread(runnable, "segment-" + host + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
