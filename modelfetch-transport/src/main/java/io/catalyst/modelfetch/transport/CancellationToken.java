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

import io.catalyst.modelfetch.api.TransferCancelledException;
import okhttp3.Call;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation shared by every transfer of a run.
///
/// In-flight OkHttp calls are tracked so that [#cancel(String)] aborts their sockets; blocked
/// readers then fail with an [java.io.IOException], which callers translate into
/// [TransferCancelledException] by checking [#isCancelled()]. Child tokens are cancelled with
/// their parent and can also be cancelled on their own, which is how sibling segments of one
/// file are stopped when one of them fails.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Set<Call> calls = ConcurrentHashMap.newKeySet();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /// @return a fresh, uncancelled token
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /// @return a token cancelled whenever this one is
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        children.add(child);
        if (isCancelled()) {
            child.cancel(reason);
        }
        return child;
    }

    /// Detaches a child once its work is over, so a long-lived token does not accumulate them.
    ///
    /// @param child a token obtained from [#child()]
    public void release(CancellationToken child) {
        children.remove(child);
    }

    int childCount() {
        return children.size();
    }

    /// Cancels this token, its children and every tracked call. Later calls are no-ops.
    ///
    /// @param why a short reason, used in exception messages
    public void cancel(String why) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        this.reason = why;
        cancelledLatch.countDown();
        for (Call call : calls) {
            call.cancel();
        }
        for (CancellationToken child : children) {
            child.cancel(why);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// @return the reason given to [#cancel(String)], or null while not cancelled
    public String reason() {
        return reason;
    }

    /// Tracks a call until [#untrack(Call)]. A call tracked after cancellation is cancelled at once.
    ///
    /// @param call the call about to be executed
    /// @return the same call
    public Call track(Call call) {
        calls.add(call);
        if (isCancelled()) {
            call.cancel();
        }
        return call;
    }

    public void untrack(Call call) {
        calls.remove(call);
    }

    /// @param what the operation about to start
    /// @throws TransferCancelledException if this token has been cancelled
    public void throwIfCancelled(String what) throws TransferCancelledException {
        if (isCancelled()) {
            throw new TransferCancelledException(what + " cancelled: " + reason);
        }
    }

    /// Sleeps for the given duration unless cancelled first.
    ///
    /// @param duration how long to sleep
    /// @throws TransferCancelledException if the token is or becomes cancelled, or the thread is interrupted
    public void sleep(Duration duration) throws TransferCancelledException {
        try {
            if (cancelledLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransferCancelledException("backoff interrupted: " + reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("backoff interrupted", e);
        }
    }
}
