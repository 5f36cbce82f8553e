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

import io.catalyst.modelfetch.api.AuthException;
import io.catalyst.modelfetch.api.TransferCancelledException;
import io.catalyst.modelfetch.api.TransientTransferException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20));

    @Test
    void retriesIoFailuresUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("flaky", attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new SocketTimeoutException("read timed out");
            }
            return "done";
        }, CancellationToken.create());

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
    }

    @Test
    void stopsAtMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("down", attempt -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, CancellationToken.create()))
            .isInstanceOf(TransientTransferException.class)
            .hasMessageContaining("connection reset");
        assertThat(calls).hasValue(3);
    }

    @Test
    void singleAttemptPolicyNeverRetries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryPolicy.of(1).execute("once", attempt -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, CancellationToken.create()))
            .isInstanceOf(TransientTransferException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void doesNotRetryTerminalFailures() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("gated", attempt -> {
            calls.incrementAndGet();
            throw new AuthException("rejected", 403, true);
        }, CancellationToken.create()))
            .isInstanceOf(AuthException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void cancellationInterruptsBackoff() {
        RetryPolicy slow = new RetryPolicy(5, Duration.ofSeconds(30), Duration.ofSeconds(30));
        CancellationToken token = CancellationToken.create();
        CompletableFuture.runAsync(() -> token.cancel("deadline"),
            CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));

        long start = System.nanoTime();
        assertThatThrownBy(() -> slow.execute("slow", attempt -> {
            throw new IOException("reset");
        }, token)).isInstanceOf(TransferCancelledException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void backoffDoublesUpToCap() {
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(5));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(10));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.backoffAfter(9)).isEqualTo(Duration.ofMillis(20));
    }

    @Test
    void cancelledChildTokensFollowTheirParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();
        CancellationToken sibling = parent.child();

        child.cancel("segment failed");
        assertThat(parent.isCancelled()).isFalse();
        assertThat(sibling.isCancelled()).isFalse();

        parent.cancel("deadline");
        assertThat(sibling.isCancelled()).isTrue();
        assertThat(parent.child().isCancelled()).isTrue();
    }

    @Test
    void releasedChildIsDetachedFromItsParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken kept = parent.child();
        CancellationToken released = parent.child();

        parent.release(released);
        assertThat(parent.childCount()).isEqualTo(1);

        parent.cancel("deadline");
        assertThat(kept.isCancelled()).isTrue();
        assertThat(released.isCancelled()).isFalse();
    }
}
