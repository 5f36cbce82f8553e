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
import io.catalyst.modelfetch.api.AcquisitionRequest;
import io.catalyst.modelfetch.api.FailureKind;
import io.catalyst.modelfetch.api.PlacedFile;
import io.catalyst.modelfetch.api.Registry;
import io.catalyst.modelfetch.api.RegistryClient;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import io.catalyst.modelfetch.api.TransferResult;
import io.catalyst.modelfetch.registry.HubClient;
import io.catalyst.modelfetch.registry.MarketplaceClient;
import io.catalyst.modelfetch.transport.CancellationToken;
import io.catalyst.modelfetch.transport.TransferEngine;
import io.catalyst.modelfetch.transport.TransportClients;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Runs one acquisition pass: gate, resolve, transfer, verify, place, then record completion.
///
/// ## Run sequence
/// 1. Create the storage root and temp directory. Failing that is the only error that escapes [#run()].
/// 2. Fingerprint the raw identifier configuration and parse it into requests.
/// 3. Skip everything when the completion marker matches the fingerprint, unless forced. No network
///    request is made in that case.
/// 4. Wait up to the network wait for each needed registry to answer, then log credential validity.
/// 5. Run requests on a pool of [PipelineSettings#maxConcurrent()] workers. Requests with the same
///    key run one after the other. Every per-request failure becomes a [RequestOutcome].
/// 6. At the run deadline, cancel in-flight transfers, give them a short grace period, and report
///    whatever had not finished as abandoned.
/// 7. Aggregate a [RunStatus], apply the [MarkerPolicy], log the summary and prune empty staging
///    directories.
public class PipelineOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(PipelineOrchestrator.class);
    private static final Duration PROBE_INTERVAL = Duration.ofSeconds(2);

    private final PipelineSettings settings;
    private final OkHttpClient httpClient;
    private final Map<Registry, RegistryClient> clients = new EnumMap<>(Registry.class);
    private final TransferEngine transferEngine;
    private final IntegrityVerifier verifier = new IntegrityVerifier();
    private final ArtifactPlacer placer;
    private final CompletionMarkerStore markerStore;
    private final Map<String, ReentrantLock> requestLocks = new ConcurrentHashMap<>();

    public PipelineOrchestrator(PipelineSettings settings) {
        this.settings = settings;
        this.httpClient = TransportClients.create(settings.transport());
        clients.put(Registry.MARKETPLACE_MODEL, new MarketplaceClient(httpClient, settings.marketplaceBaseUrl(),
            settings.marketplaceToken(), settings.unknownTypePolicy()));
        clients.put(Registry.HUB_REPOSITORY, new HubClient(httpClient, settings.hubBaseUrl(), settings.hubToken(),
            settings.hubRevision()));
        this.transferEngine = new TransferEngine(httpClient, settings.transport());
        this.placer = new ArtifactPlacer(settings.storageRoot());
        this.markerStore = new CompletionMarkerStore(settings.storageRoot());
    }

    /// Runs the pipeline to a terminal state.
    ///
    /// @return the run report; per-request failures are inside it, never thrown
    /// @throws UncheckedIOException if the storage root or temp directory cannot be prepared
    public RunReport run() {
        Instant started = Instant.now();
        prepareDirectories();
        RunFingerprint fingerprint = RunFingerprint.of(settings.identifiers());
        List<AcquisitionRequest> requests = IdentifierParser.parse(settings.identifiers());
        logger.info("Model acquisition: {} request(s), fingerprint {}", requests.size(), fingerprint);
        logger.debug("Settings: {}", settings);

        if (requests.isEmpty()) {
            logger.info("No model identifiers configured; nothing to acquire");
            return new RunReport(RunStatus.SUCCESS, fingerprint, List.of(), elapsedSince(started));
        }
        if (settings.force()) {
            logger.info("Force enabled; ignoring completion marker {}", markerStore.path());
        } else {
            Optional<CompletionMarker> marker = markerStore.read();
            if (marker.isPresent() && fingerprint.matches(marker.get())) {
                logger.info("Configuration unchanged since {} ({}); acquisition already satisfied",
                    marker.get().timestamp(), marker.get().status());
                return new RunReport(RunStatus.SKIPPED, fingerprint, List.of(), elapsedSince(started));
            }
        }

        Instant deadline = started.plus(settings.timeout());
        Set<Registry> needed = requests.stream().map(AcquisitionRequest::registry)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Registry.class)));
        Set<Registry> reachable = awaitRegistries(needed, deadline);
        if (reachable.isEmpty()) {
            logger.error("No registry reachable within {} s; giving up", settings.networkWait().toSeconds());
            List<RequestOutcome> outcomes = requests.stream()
                .map(r -> RequestOutcome.failed(r, FailureKind.TRANSIENT, r.registry().label() + " unreachable",
                    Duration.ZERO))
                .collect(Collectors.toList());
            return complete(new RunReport(RunStatus.HARD_FAILURE, fingerprint, outcomes, elapsedSince(started)));
        }
        for (Registry registry : reachable) {
            RegistryClient.CredentialStatus credential = clients.get(registry).validateCredential();
            if (credential == RegistryClient.CredentialStatus.REJECTED) {
                logger.warn("{} credential was rejected; gated items will fail", registry.label());
            } else {
                logger.info("{} credential: {}", registry.label(), credential);
            }
        }

        CancellationToken token = CancellationToken.create();
        List<RequestOutcome> outcomes = new ArrayList<>();
        boolean timedOut = execute(requests, reachable, deadline, token, outcomes);
        return complete(new RunReport(aggregate(outcomes, timedOut), fingerprint, outcomes, elapsedSince(started)));
    }

    private boolean execute(List<AcquisitionRequest> requests, Set<Registry> reachable, Instant deadline,
                            CancellationToken token, List<RequestOutcome> outcomes) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(settings.maxConcurrent(), requests.size()),
            workerThreads());
        List<CompletableFuture<RequestOutcome>> futures = new ArrayList<>();
        for (AcquisitionRequest request : requests) {
            if (!reachable.contains(request.registry())) {
                futures.add(CompletableFuture.completedFuture(RequestOutcome.failed(request, FailureKind.TRANSIENT,
                    request.registry().label() + " unreachable", Duration.ZERO)));
            } else {
                futures.add(CompletableFuture.supplyAsync(() -> acquire(request, token), pool));
            }
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));

        boolean timedOut = false;
        try {
            all.get(Math.max(0, Duration.between(Instant.now(), deadline).toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            timedOut = true;
            logger.warn("Run deadline of {} s reached; cancelling in-flight transfers", settings.timeout().toSeconds());
            token.cancel("run deadline exceeded");
            awaitGrace(all);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timedOut = true;
            token.cancel("interrupted");
        } catch (ExecutionException e) {
            logger.error("Acquisition worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < requests.size(); i++) {
            CompletableFuture<RequestOutcome> future = futures.get(i);
            if (future.isDone() && !future.isCompletedExceptionally()) {
                outcomes.add(future.join());
            } else {
                outcomes.add(RequestOutcome.abandoned(requests.get(i), "not finished before the run deadline"));
            }
        }
        return timedOut;
    }

    private RequestOutcome acquire(AcquisitionRequest request, CancellationToken token) {
        Instant start = Instant.now();
        ReentrantLock lock = requestLocks.computeIfAbsent(request.key(), key -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RequestOutcome.abandoned(request, "interrupted while waiting for a duplicate request");
        }
        try {
            token.throwIfCancelled(request.key());
            RegistryClient client = clients.get(request.registry());
            ResolvedArtifact artifact = settings.transport().retryPolicy()
                .execute("resolve " + request.key(), attempt -> client.resolve(request), token);

            Optional<List<PlacedFile>> existing = placer.existingPlacement(artifact, token);
            if (existing.isPresent()) {
                logger.info("{} already present at {}", request.key(), placer.destinationFor(artifact));
                return RequestOutcome.alreadyPresent(request, existing.get(), elapsedSince(start));
            }

            TransferResult transfer = transferEngine.fetch(artifact, settings.tempDir(), token);
            TransferResult verified = verifier.verify(transfer, token);
            List<PlacedFile> placed = placer.place(verified);
            return RequestOutcome.placed(request, placed, elapsedSince(start));
        } catch (AcquisitionException e) {
            if (e.kind() == FailureKind.CANCELLED || token.isCancelled()) {
                logger.info("{} abandoned: {}", request.key(), e.getMessage());
                return RequestOutcome.abandoned(request, e.getMessage());
            }
            logger.error("{} failed: {}", request.key(), e.getMessage());
            logger.info("{} hint: {}", request.key(), FailureHints.hintFor(request.registry(), e));
            return RequestOutcome.failed(request, e.kind(), e.getMessage(), elapsedSince(start));
        } catch (RuntimeException e) {
            logger.error("{} failed unexpectedly", request.key(), e);
            return RequestOutcome.failed(request, FailureKind.RESOLVE, e.toString(), elapsedSince(start));
        } finally {
            lock.unlock();
        }
    }

    private Set<Registry> awaitRegistries(Set<Registry> needed, Instant deadline) {
        Instant waitUntil = Instant.now().plus(settings.networkWait());
        if (waitUntil.isAfter(deadline)) {
            waitUntil = deadline;
        }
        Set<Registry> reachable = EnumSet.noneOf(Registry.class);
        while (true) {
            for (Registry registry : needed) {
                if (!reachable.contains(registry) && clients.get(registry).probe()) {
                    logger.info("{} is reachable", registry.label());
                    reachable.add(registry);
                }
            }
            Duration remaining = Duration.between(Instant.now(), waitUntil);
            if (reachable.size() == needed.size() || remaining.isNegative() || remaining.isZero()) {
                break;
            }
            try {
                Thread.sleep(Math.min(PROBE_INTERVAL.toMillis(), remaining.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the network");
                break;
            }
        }
        for (Registry registry : needed) {
            if (!reachable.contains(registry)) {
                logger.warn("{} is not reachable; its requests will fail", registry.label());
            }
        }
        return reachable;
    }

    private void awaitGrace(CompletableFuture<Void> all) {
        try {
            all.get(settings.cancellationGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Some transfers did not stop within {} ms of cancellation",
                settings.cancellationGrace().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for cancelled transfers");
        } catch (ExecutionException e) {
            logger.error("Acquisition worker failed unexpectedly", e.getCause());
        }
    }

    static RunStatus aggregate(List<RequestOutcome> outcomes, boolean timedOut) {
        if (timedOut) {
            return RunStatus.TIMED_OUT;
        }
        long succeeded = outcomes.stream().filter(o -> o.status().isSuccess()).count();
        if (succeeded == outcomes.size()) {
            return RunStatus.SUCCESS;
        }
        return succeeded == 0 ? RunStatus.HARD_FAILURE : RunStatus.PARTIAL_FAILURE;
    }

    private RunReport complete(RunReport report) {
        for (RequestOutcome outcome : report.outcomes()) {
            if (outcome.status().isSuccess()) {
                logger.info(outcome.summaryLine());
            } else {
                logger.warn(outcome.summaryLine());
            }
        }
        applyMarkerPolicy(report);
        pruneEmptyStagingDirectories();
        if (report.status() == RunStatus.SUCCESS) {
            logger.info(report.summaryLine());
        } else {
            logger.warn(report.summaryLine());
        }
        return report;
    }

    private void applyMarkerPolicy(RunReport report) {
        MarkerPolicy policy = settings.markerPolicy();
        try {
            if (policy.shouldWrite(report.status())) {
                markerStore.write(new CompletionMarker(report.fingerprint().hex(), Instant.now().toString(),
                    report.status().name()));
                logger.info("Completion marker written to {}", markerStore.path());
            } else if (policy.shouldDelete(report.status())) {
                markerStore.delete();
                logger.info("Completion marker cleared; the next start will retry ({} policy)", policy);
            } else {
                logger.info("Completion marker left unchanged after {}", report.status());
            }
        } catch (UncheckedIOException e) {
            logger.error("Completion marker could not be updated: {}", e.getMessage());
        }
    }

    private void prepareDirectories() {
        for (Path dir : List.of(settings.storageRoot(), settings.tempDir())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot create directory " + dir, e);
            }
            if (!Files.isWritable(dir)) {
                throw new UncheckedIOException(new IOException("directory is not writable: " + dir));
            }
        }
    }

    private void pruneEmptyStagingDirectories() {
        Path tempDir = settings.tempDir();
        if (!Files.isDirectory(tempDir)) {
            return;
        }
        List<Path> directories;
        try (Stream<Path> walk = Files.walk(tempDir)) {
            directories = walk.filter(Files::isDirectory).filter(p -> !p.equals(tempDir))
                .sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Cannot scan {} for cleanup: {}", tempDir, e.getMessage());
            return;
        }
        for (Path dir : directories) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isEmpty()) {
                    Files.delete(dir);
                    logger.debug("Removed empty staging directory {}", dir);
                }
            } catch (IOException e) {
                logger.warn("Cannot remove staging directory {}: {}", dir, e.getMessage());
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "acquire-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static Duration elapsedSince(Instant start) {
        return Duration.between(start, Instant.now());
    }

    @Override
    public void close() {
        clients.values().forEach(RegistryClient::close);
        TransportClients.shutdown(httpClient);
    }
}
