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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/// Persistent record of which fixed-size segments of a `.part` file are complete.
///
/// The ledger sits next to the partial file as `<name>.part.segments` and is rewritten atomically
/// (temp file then rename) after every completed segment, so an interrupted transfer resumes at
/// segment granularity on the next run. A ledger whose total or segment size differs from the
/// current transfer, or that cannot be parsed, is discarded and the transfer starts over.
final class SegmentLedger {
    private static final Logger logger = LogManager.getLogger(SegmentLedger.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    static final String SUFFIX = ".segments";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path path;
    private final long totalSize;
    private final long segmentSize;
    private final int segmentCount;
    private final BitSet completed;

    private SegmentLedger(Path path, long totalSize, long segmentSize, BitSet completed) {
        this.path = path;
        this.totalSize = totalSize;
        this.segmentSize = segmentSize;
        this.segmentCount = (int) ((totalSize + segmentSize - 1) / segmentSize);
        this.completed = completed;
    }

    /// Opens the ledger for a partial file, resuming its recorded progress when it still applies.
    ///
    /// @param partFile the partial file the ledger describes
    /// @param totalSize the total size of the transfer
    /// @param segmentSize the segment size of the transfer
    /// @return the ledger, empty unless a matching one was found and the partial file exists
    static SegmentLedger open(Path partFile, long totalSize, long segmentSize) throws IOException {
        Path ledgerPath = ledgerPathFor(partFile);
        if (Files.exists(ledgerPath) && Files.exists(partFile)) {
            try (Reader reader = Files.newBufferedReader(ledgerPath, StandardCharsets.UTF_8)) {
                State state = GSON.fromJson(reader, State.class);
                if (state != null && state.totalSize == totalSize && state.segmentSize == segmentSize
                    && state.completed != null) {
                    BitSet done = new BitSet();
                    for (int index : state.completed) {
                        done.set(index);
                    }
                    return new SegmentLedger(ledgerPath, totalSize, segmentSize, done);
                }
                logger.info("Discarding segment ledger {}: transfer parameters changed", ledgerPath.getFileName());
            } catch (JsonParseException e) {
                logger.warn("Discarding unreadable segment ledger {}: {}", ledgerPath, e.getMessage());
            }
        }
        return new SegmentLedger(ledgerPath, totalSize, segmentSize, new BitSet());
    }

    static Path ledgerPathFor(Path partFile) {
        return partFile.resolveSibling(partFile.getFileName() + SUFFIX);
    }

    int segmentCount() {
        return segmentCount;
    }

    long offsetOf(int index) {
        return index * segmentSize;
    }

    long lengthOf(int index) {
        return Math.min(segmentSize, totalSize - offsetOf(index));
    }

    synchronized boolean isComplete(int index) {
        return completed.get(index);
    }

    synchronized int completedCount() {
        return completed.cardinality();
    }

    synchronized long completedBytes() {
        long bytes = 0;
        for (int i = completed.nextSetBit(0); i >= 0 && i < segmentCount; i = completed.nextSetBit(i + 1)) {
            bytes += lengthOf(i);
        }
        return bytes;
    }

    synchronized List<Integer> pending() {
        List<Integer> pending = new ArrayList<>();
        for (int i = completed.nextClearBit(0); i < segmentCount; i = completed.nextClearBit(i + 1)) {
            pending.add(i);
        }
        return pending;
    }

    /// Records a segment as complete and persists the ledger.
    synchronized void markComplete(int index) throws IOException {
        completed.set(index);
        State state = new State();
        state.totalSize = totalSize;
        state.segmentSize = segmentSize;
        state.completed = new ArrayList<>();
        for (int i = completed.nextSetBit(0); i >= 0; i = completed.nextSetBit(i + 1)) {
            state.completed.add(i);
        }
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            GSON.toJson(state, writer);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    void delete() throws IOException {
        Files.deleteIfExists(path);
    }

    private static final class State {
        long totalSize;
        long segmentSize;
        List<Integer> completed;
    }
}
