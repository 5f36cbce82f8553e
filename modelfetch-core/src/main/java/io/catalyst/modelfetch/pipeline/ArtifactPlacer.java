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
import io.catalyst.modelfetch.api.ArtifactFile;
import io.catalyst.modelfetch.api.ArtifactLayout;
import io.catalyst.modelfetch.api.PlacedFile;
import io.catalyst.modelfetch.api.PlacementException;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import io.catalyst.modelfetch.api.StagedFile;
import io.catalyst.modelfetch.api.TransferResult;
import io.catalyst.modelfetch.transport.CancellationToken;
import io.catalyst.modelfetch.transport.StagingPaths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/// Moves verified artifacts from staging into `<storageRoot>/<category>/<name>`.
///
/// Every placement ends in one atomic rename inside the destination directory, so the final name
/// never refers to a partial artifact. When staging and storage are on different filesystems the
/// bytes are first copied to a hidden sibling (`.<name>.incoming-<uuid>`) and renamed from there.
/// A snapshot directory that already exists is moved aside, replaced, and then deleted.
///
/// On failure the staging directory is kept and its path is reported in the [PlacementException].
public class ArtifactPlacer {
    private static final Logger logger = LogManager.getLogger(ArtifactPlacer.class);

    private final Path storageRoot;

    public ArtifactPlacer(Path storageRoot) {
        this.storageRoot = storageRoot;
    }

    /// @param artifact a resolved artifact
    /// @return where the artifact is placed
    public Path destinationFor(ResolvedArtifact artifact) throws AcquisitionException {
        Path categoryDir = storageRoot.resolve(artifact.category().directoryName());
        return StagingPaths.resolveWithin(categoryDir, artifact.name());
    }

    /// Checks whether the artifact is already in place, by hash when one is published, else by size,
    /// else by the file being non-empty.
    ///
    /// @param artifact the resolved artifact
    /// @param token cancels hashing
    /// @return the placed files when every file is present and matches
    public Optional<List<PlacedFile>> existingPlacement(ResolvedArtifact artifact, CancellationToken token)
        throws AcquisitionException {
        Path destination = destinationFor(artifact);
        List<PlacedFile> present = new ArrayList<>();
        for (ArtifactFile file : artifact.files()) {
            Path path = artifact.layout() == ArtifactLayout.SINGLE_FILE
                ? destination : StagingPaths.resolveWithin(destination, file.relativePath());
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            try {
                long size = Files.size(path);
                if (file.hash().isPresent()) {
                    String actual = IntegrityVerifier.digest(path, file.hash().get().algorithm(), token);
                    if (!file.hash().get().matches(actual)) {
                        logger.info("{} exists but its hash differs; it will be downloaded again", path);
                        return Optional.empty();
                    }
                } else if (file.hasExpectedSize() ? size != file.expectedSize() : size == 0) {
                    logger.info("{} exists but its size {} does not match; it will be downloaded again", path, size);
                    return Optional.empty();
                }
                present.add(new PlacedFile(path, artifact.request().identifier(), file.hash().isPresent(), size));
            } catch (AcquisitionException e) {
                throw e;
            } catch (IOException e) {
                logger.warn("Cannot inspect existing {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(present);
    }

    /// @param transfer a verified transfer
    /// @return the placed files
    /// @throws PlacementException if the artifact cannot be moved into place
    public List<PlacedFile> place(TransferResult transfer) throws AcquisitionException {
        ResolvedArtifact artifact = transfer.artifact();
        Path destination = destinationFor(artifact);
        try {
            Files.createDirectories(destination.getParent());
            if (artifact.layout() == ArtifactLayout.SINGLE_FILE) {
                moveIntoPlace(transfer.localTempPath(), destination);
            } else {
                replaceDirectory(transfer.stagingDirectory(), destination);
            }
        } catch (IOException e) {
            logger.error("Placement of {} failed; staged files kept in {}", artifact.name(), transfer.stagingDirectory());
            throw new PlacementException("cannot place " + artifact.name() + " at " + destination + ": " + e,
                transfer.stagingDirectory(), e);
        }

        List<PlacedFile> placed = new ArrayList<>();
        for (StagedFile staged : transfer.files()) {
            Path finalPath = artifact.layout() == ArtifactLayout.SINGLE_FILE
                ? destination : StagingPaths.resolveWithin(destination, staged.file().relativePath());
            placed.add(new PlacedFile(finalPath, artifact.request().identifier(), staged.file().hash().isPresent(),
                sizeOf(finalPath)));
        }
        if (artifact.layout() == ArtifactLayout.SINGLE_FILE) {
            deleteRecursively(transfer.stagingDirectory());
        }
        logger.info("Placed {} at {}{}", artifact.request().key(), destination, transfer.verified() ? "" : " (unverified)");
        return placed;
    }

    private static void moveIntoPlace(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Path incoming = hiddenSibling(destination, "incoming");
            logger.debug("Cross-filesystem placement of {} via {}", destination, incoming);
            try {
                if (Files.isDirectory(source)) {
                    copyTree(source, incoming);
                } else {
                    Files.copy(source, incoming, StandardCopyOption.REPLACE_EXISTING);
                }
                Files.move(incoming, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException copyFailure) {
                deleteRecursively(incoming);
                throw copyFailure;
            }
            deleteRecursively(source);
        }
    }

    private static void replaceDirectory(Path source, Path destination) throws IOException {
        if (!Files.exists(destination)) {
            moveIntoPlace(source, destination);
            return;
        }
        Path previous = hiddenSibling(destination, "old");
        Files.move(destination, previous, StandardCopyOption.ATOMIC_MOVE);
        try {
            moveIntoPlace(source, destination);
        } catch (IOException e) {
            Files.move(previous, destination, StandardCopyOption.ATOMIC_MOVE);
            throw e;
        }
        deleteRecursively(previous);
    }

    private static Path hiddenSibling(Path destination, String purpose) {
        return destination.resolveSibling("." + destination.getFileName() + "." + purpose + "-" + UUID.randomUUID());
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()), StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static void deleteRecursively(Path path) {
        if (path == null || !Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.warn("Cannot delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Cannot clean up {}: {}", path, e.getMessage());
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            logger.debug("Cannot stat {}: {}", path, e.getMessage());
            return -1;
        }
    }
}
