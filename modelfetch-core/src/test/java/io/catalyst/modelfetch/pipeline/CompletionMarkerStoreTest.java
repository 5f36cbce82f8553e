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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionMarkerStoreTest {

    @TempDir
    Path storageRoot;

    @Test
    void writesAndReadsMarker() throws Exception {
        CompletionMarkerStore store = new CompletionMarkerStore(storageRoot);
        CompletionMarker marker = new CompletionMarker("abc123", "2026-10-17T12:00:00Z", "PARTIAL_FAILURE");

        store.write(marker);

        assertThat(store.path()).isEqualTo(storageRoot.resolve(".modelfetch_complete"));
        assertThat(store.read()).contains(marker);
        assertThat(Files.readString(store.path())).contains("\"fingerprint\": \"abc123\"");
        assertThat(Files.list(storageRoot)).hasSize(1);
    }

    @Test
    void deleteRemovesMarker() {
        CompletionMarkerStore store = new CompletionMarkerStore(storageRoot);
        store.write(new CompletionMarker("abc", "t", "SUCCESS"));

        store.delete();
        store.delete();

        assertThat(store.read()).isEmpty();
    }

    @Test
    void unreadableMarkerIsTreatedAsAbsent() throws Exception {
        CompletionMarkerStore store = new CompletionMarkerStore(storageRoot);
        Files.writeString(store.path(), "fingerprint=abc");

        assertThat(store.read()).isEmpty();
    }
}
