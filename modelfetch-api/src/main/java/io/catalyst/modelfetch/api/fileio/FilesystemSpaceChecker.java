package io.catalyst.modelfetch.api.fileio;

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
import io.catalyst.modelfetch.api.FailureKind;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks filesystem space availability before a transfer reserves disk space.
 *
 * <p>Usage:</p>
 * <pre>
 * // default 10% margin
 * FilesystemSpaceChecker.checkSpaceAvailable(stagingDir, expectedBytes);
 *
 * // custom margin
 * FilesystemSpaceChecker.checkSpaceAvailable(stagingDir, expectedBytes, 0.25);
 * </pre>
 */
public final class FilesystemSpaceChecker {

    private static final double DEFAULT_MARGIN = 0.10;
    private static final double GIB = 1024.0 * 1024.0 * 1024.0;

    private FilesystemSpaceChecker() {
    }

    /**
     * Checks that the filesystem holding {@code path} can take {@code sizeBytes} more bytes,
     * with the default 10% safety margin.
     *
     * @param path the file or directory about to be written, need not exist yet
     * @param sizeBytes the bytes still to be written
     * @throws InsufficientSpaceException if there is not enough space available
     */
    public static void checkSpaceAvailable(Path path, long sizeBytes) throws InsufficientSpaceException {
        checkSpaceAvailable(path, sizeBytes, DEFAULT_MARGIN);
    }

    /**
     * Checks that the filesystem holding {@code path} can take {@code sizeBytes} more bytes.
     *
     * @param path the file or directory about to be written, need not exist yet
     * @param sizeBytes the bytes still to be written
     * @param marginPercent the safety margin as a fraction (0.10 for 10%)
     * @throws InsufficientSpaceException if there is not enough space available
     */
    public static void checkSpaceAvailable(Path path, long sizeBytes, double marginPercent)
        throws InsufficientSpaceException {
        if (sizeBytes <= 0) {
            return;
        }
        try {
            FileStore fileStore = getFileStoreForPath(path);
            long usableSpace = fileStore.getUsableSpace();
            double requiredSpace = sizeBytes * (1.0 + marginPercent);
            if (usableSpace < requiredSpace) {
                throw new InsufficientSpaceException(String.format(
                    "Insufficient disk space on filesystem %s for %s. Required: %.2f GB (%.2f GB + %.0f%% margin), "
                        + "Available: %.2f GB",
                    fileStore.name(), path, requiredSpace / GIB, sizeBytes / GIB, marginPercent * 100,
                    usableSpace / GIB));
            }
        } catch (IOException e) {
            throw new InsufficientSpaceException("Failed to check disk space for path: " + path, e);
        }
    }

    /**
     * Gets the FileStore for a path, walking up the directory tree to the nearest
     * existing ancestor.
     */
    private static FileStore getFileStoreForPath(Path path) throws IOException {
        Path currentPath = path.toAbsolutePath();
        while (currentPath != null) {
            if (Files.exists(currentPath)) {
                return Files.getFileStore(currentPath);
            }
            currentPath = currentPath.getParent();
        }
        return Files.getFileStore(path.toAbsolutePath().getRoot());
    }

    /**
     * Thrown when there is insufficient disk space for a transfer.
     */
    public static class InsufficientSpaceException extends AcquisitionException {

        public InsufficientSpaceException(String message) {
            super(FailureKind.INSUFFICIENT_SPACE, message);
        }

        public InsufficientSpaceException(String message, Throwable cause) {
            super(FailureKind.INSUFFICIENT_SPACE, message, cause);
        }
    }
}
