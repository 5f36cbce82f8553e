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

import io.catalyst.modelfetch.api.AcquisitionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;

/// Bounded retry with exponential backoff for one request's transfer operations.
///
/// Only failures classified as transient are retried. This bound is independent of the run
/// deadline, which acts through the [CancellationToken] passed to [#execute].
public final class RetryPolicy {
    private static final Logger logger = LogManager.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    /// @param maxAttempts total attempts including the first, at least 1
    /// @param initialBackoff the pause after the first failure, doubled after each further one
    /// @param maxBackoff the upper bound of a single pause
    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /// @param maxAttempts total attempts including the first
    /// @return a policy starting at a 2 second backoff, capped at one minute
    public static RetryPolicy of(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ofSeconds(2), Duration.ofMinutes(1));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /// @param failedAttempts the number of attempts that failed so far, at least 1
    /// @return the pause before the next attempt
    public Duration backoffAfter(int failedAttempts) {
        long millis = initialBackoff.toMillis();
        for (int i = 1; i < failedAttempts && millis < maxBackoff.toMillis(); i++) {
            millis *= 2;
        }
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    /// Runs the attempt until it succeeds, fails terminally, runs out of attempts, or the token is cancelled.
    ///
    /// @param what a description for log lines
    /// @param attempt the operation, given its 1-based attempt number
    /// @param token the cancellation token of the run or file
    /// @param <T> the result type
    /// @return the first successful result
    /// @throws AcquisitionException the classified failure of the last attempt
    public <T> T execute(String what, Attempt<T> attempt, CancellationToken token) throws AcquisitionException {
        for (int n = 1; ; n++) {
            token.throwIfCancelled(what);
            try {
                return attempt.run(n);
            } catch (IOException e) {
                AcquisitionException failure = HttpStatusClassifier.forIoFailure(what, e, token);
                if (!failure.isRetryable()) {
                    throw failure;
                }
                if (n >= maxAttempts) {
                    logger.warn("{} failed after {} attempt(s): {}", what, n, failure.getMessage());
                    throw failure;
                }
                Duration pause = backoffAfter(n);
                logger.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", what, n, maxAttempts,
                    pause.toMillis(), failure.getMessage());
                token.sleep(pause);
            }
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", initialBackoff=" + initialBackoff + "}";
    }

    /// One attempt of a retried operation.
    ///
    /// @param <T> the result type
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNumber) throws IOException;
    }
}
