package io.catalyst.modelfetch.api;

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

import java.nio.file.Path;

/// Downloaded bytes did not match the registry supplied hash. The bytes are discarded and
/// never placed.
public class IntegrityException extends AcquisitionException {

    private final Path file;
    private final ExpectedHash expected;
    private final String actual;

    public IntegrityException(Path file, ExpectedHash expected, String actual) {
        super(FailureKind.INTEGRITY, "checksum mismatch for " + file.getFileName() + ": expected "
            + expected.hex() + " but computed " + actual);
        this.file = file;
        this.expected = expected;
        this.actual = actual;
    }

    public Path file() {
        return file;
    }

    public ExpectedHash expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
