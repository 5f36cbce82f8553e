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

import static org.assertj.core.api.Assertions.assertThat;

class MarkerPolicyTest {

    @Test
    void tolerantPolicyWritesAfterPartialFailure() {
        assertThat(MarkerPolicy.TOLERATE_PARTIAL.shouldWrite(RunStatus.SUCCESS)).isTrue();
        assertThat(MarkerPolicy.TOLERATE_PARTIAL.shouldWrite(RunStatus.PARTIAL_FAILURE)).isTrue();
        assertThat(MarkerPolicy.TOLERATE_PARTIAL.shouldDelete(RunStatus.PARTIAL_FAILURE)).isFalse();
    }

    @Test
    void strictPolicyDeletesAfterPartialFailure() {
        assertThat(MarkerPolicy.SUCCESS_ONLY.shouldWrite(RunStatus.SUCCESS)).isTrue();
        assertThat(MarkerPolicy.SUCCESS_ONLY.shouldWrite(RunStatus.PARTIAL_FAILURE)).isFalse();
        assertThat(MarkerPolicy.SUCCESS_ONLY.shouldDelete(RunStatus.PARTIAL_FAILURE)).isTrue();
    }

    @Test
    void hardFailureDeletesAndTimeoutLeavesMarkerAlone() {
        for (MarkerPolicy policy : MarkerPolicy.values()) {
            assertThat(policy.shouldWrite(RunStatus.HARD_FAILURE)).isFalse();
            assertThat(policy.shouldDelete(RunStatus.HARD_FAILURE)).isTrue();
            assertThat(policy.shouldWrite(RunStatus.TIMED_OUT)).isFalse();
            assertThat(policy.shouldDelete(RunStatus.TIMED_OUT)).isFalse();
        }
    }

    @Test
    void exitCodesDistinguishOutcomes() {
        assertThat(RunStatus.SUCCESS.exitCode()).isZero();
        assertThat(RunStatus.SKIPPED.exitCode()).isZero();
        assertThat(RunStatus.HARD_FAILURE.exitCode()).isEqualTo(1);
        assertThat(RunStatus.PARTIAL_FAILURE.exitCode()).isEqualTo(2);
        assertThat(RunStatus.TIMED_OUT.exitCode()).isEqualTo(124);
    }
}
