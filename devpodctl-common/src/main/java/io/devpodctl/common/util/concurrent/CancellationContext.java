/*
 * Copyright 2021 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.devpodctl.common.util.concurrent;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cooperative cancellation signal shared by a group of tasks. A context may have child contexts, which are
 * cancelled together with their parent. Cancelling a child never affects the parent.
 * <p>
 * Tasks are expected to observe the signal at their blocking points, either by polling {@link #isCancelled()},
 * by waiting with {@link #await(Duration)}, or by racing {@link #whenCancelled()} against other signals.
 */
public class CancellationContext {

    private final CancellationContext parent;
    private final Set<CancellationContext> children = ConcurrentHashMap.newKeySet();

    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Sinks.Empty<Void> cancelledSink = Sinks.empty();

    private final Object lock = new Object();
    private volatile boolean cancelled;
    private volatile Throwable cause;

    private CancellationContext(CancellationContext parent) {
        this.parent = parent;
    }

    /**
     * Creates a child context, which is cancelled when this context is cancelled. If this context is already
     * cancelled, the child is returned in the cancelled state.
     */
    public CancellationContext newChild() {
        CancellationContext child = new CancellationContext(this);
        children.add(child);
        if (cancelled) {
            child.cancel(cause);
        }
        return child;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Returns the cause given to the first {@link #cancel(Throwable)} call, if it was not null.
     */
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Cancels this context and all its descendants. Only the first invocation has an effect.
     */
    public void cancel(Throwable cause) {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            this.cause = cause;
            this.cancelled = true;
        }
        cancelledLatch.countDown();
        cancelledSink.tryEmitEmpty();

        for (CancellationContext child : children) {
            child.cancel(cause);
        }
        children.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    /**
     * Completes (empty) when the context is cancelled. Late subscribers get the completion signal immediately.
     */
    public Mono<Void> whenCancelled() {
        return cancelledSink.asMono();
    }

    /**
     * Waits up to the given amount of time for the cancellation.
     *
     * @return true if the context is cancelled, false if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelledLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void awaitCancellation() throws InterruptedException {
        cancelledLatch.await();
    }

    @Override
    public String toString() {
        return "CancellationContext{" +
                "cancelled=" + cancelled +
                ", cause=" + cause +
                '}';
    }

    public static CancellationContext root() {
        return new CancellationContext(null);
    }
}
