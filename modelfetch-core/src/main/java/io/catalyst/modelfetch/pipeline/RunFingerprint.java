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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/// A SHA-256 over the configured identifiers.
///
/// Each list contributes one `NAME=a,b,c\n` line, with its identifiers trimmed, de-duplicated
/// and sorted, and the lines ordered by environment variable name. Reordering a list keeps the
/// fingerprint; moving an identifier to another list changes it.
public record RunFingerprint(String hex) {

    /// @param rawValues raw configuration values by list
    /// @return the fingerprint
    public static RunFingerprint of(Map<IdentifierList, String> rawValues) {
        Map<String, String> sorted = new TreeMap<>();
        rawValues.forEach((list, value) -> {
            SortedSet<String> identifiers = new TreeSet<>(IdentifierParser.split(value));
            if (!identifiers.isEmpty()) {
                sorted.put(list.environmentName(), String.join(",", identifiers));
            }
        });
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (Map.Entry<String, String> entry : sorted.entrySet()) {
                digest.update((entry.getKey() + "=" + entry.getValue() + "\n").getBytes(StandardCharsets.UTF_8));
            }
            return new RunFingerprint(HexFormat.of().formatHex(digest.digest()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean matches(CompletionMarker marker) {
        return marker != null && hex.equals(marker.fingerprint());
    }

    @Override
    public String toString() {
        return hex.substring(0, 12);
    }
}
