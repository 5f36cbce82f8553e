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

import io.catalyst.modelfetch.api.AcquisitionRequest;
import io.catalyst.modelfetch.api.ResolveException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/// Names for staging locations and safe resolution of registry-supplied relative paths.
public final class StagingPaths {

    public static final String PART_SUFFIX = ".part";

    private StagingPaths() {
    }

    /// A staging directory unique to the request, stable across runs so partial transfers resume.
    ///
    /// @param tempDir the temp working directory
    /// @param request the request
    /// @return `<tempDir>/<registry>-<identifier>-<hash8>`
    public static Path stagingDirectory(Path tempDir, AcquisitionRequest request) {
        String id = request.identifier().replaceAll("[^A-Za-z0-9._-]", "_");
        if (id.length() > 80) {
            id = id.substring(0, 80);
        }
        return tempDir.resolve(request.registry().label() + "-" + id + "-" + shortHash(request.key()));
    }

    /// Resolves a registry-supplied relative path under `base`, refusing anything that would escape it.
    ///
    /// @param base the directory the path must stay in
    /// @param relativePath a `/`-separated relative path
    /// @return the resolved path
    /// @throws ResolveException if the path is empty, absolute, or has `.`/`..` or empty components
    public static Path resolveWithin(Path base, String relativePath) throws ResolveException {
        if (relativePath == null || relativePath.isBlank() || relativePath.startsWith("/")
            || relativePath.contains("\\") || relativePath.indexOf('\0') >= 0) {
            throw new ResolveException("unsafe file path: " + relativePath);
        }
        Path resolved = base;
        for (String component : relativePath.split("/", -1)) {
            if (component.isEmpty() || component.equals(".") || component.equals("..")) {
                throw new ResolveException("unsafe file path: " + relativePath);
            }
            resolved = resolved.resolve(component);
        }
        if (!resolved.normalize().startsWith(base.normalize())) {
            throw new ResolveException("file path escapes its directory: " + relativePath);
        }
        return resolved;
    }

    /// @param file a staged file
    /// @return the sibling `.part` file it is written through
    public static Path partFileFor(Path file) {
        return file.resolveSibling(file.getFileName() + PART_SUFFIX);
    }

    private static String shortHash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
