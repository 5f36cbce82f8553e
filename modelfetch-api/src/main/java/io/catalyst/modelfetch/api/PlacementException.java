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

/// The verified artifact could not be moved into its category directory. The staging
/// directory is left in place for inspection.
public class PlacementException extends AcquisitionException {

    private final Path preservedStaging;

    public PlacementException(String message, Path preservedStaging, Throwable cause) {
        super(FailureKind.PLACEMENT, message, cause);
        this.preservedStaging = preservedStaging;
    }

    /// @return the staging directory which was kept
    public Path preservedStaging() {
        return preservedStaging;
    }
}
