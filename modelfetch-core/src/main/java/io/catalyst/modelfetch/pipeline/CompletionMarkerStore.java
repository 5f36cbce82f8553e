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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/// Reads and writes the completion marker, `<storageRoot>/.modelfetch_complete`, as JSON.
///
/// Writes go to a temp file that is then renamed over the marker, so a reader sees either the old
/// marker or the new one. The store is used by one thread at the end of a run; it does no locking.
public class CompletionMarkerStore {
    private static final Logger logger = LogManager.getLogger(CompletionMarkerStore.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final String FILE_NAME = ".modelfetch_complete";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path path;

    public CompletionMarkerStore(Path storageRoot) {
        this.path = storageRoot.resolve(FILE_NAME);
    }

    public Path path() {
        return path;
    }

    /// @return the marker, or empty if absent or unreadable
    public Optional<CompletionMarker> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CompletionMarker marker = GSON.fromJson(reader, CompletionMarker.class);
            if (marker == null || marker.fingerprint() == null) {
                logger.warn("Ignoring empty completion marker {}", path);
                return Optional.empty();
            }
            return Optional.of(marker);
        } catch (IOException | JsonParseException e) {
            logger.warn("Ignoring unreadable completion marker {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /// @param marker the marker to persist, replacing any previous one
    public void write(CompletionMarker marker) {
        Path tempPath = path.resolveSibling(FILE_NAME + TEMP_SUFFIX);
        try {
            try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
                GSON.toJson(marker, writer);
            }
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Wrote completion marker {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write completion marker " + path, e);
        }
    }

    /// Removes the marker so the next run starts over.
    public void delete() {
        try {
            if (Files.deleteIfExists(path)) {
                logger.debug("Deleted completion marker {}", path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot delete completion marker " + path, e);
        }
    }
}
