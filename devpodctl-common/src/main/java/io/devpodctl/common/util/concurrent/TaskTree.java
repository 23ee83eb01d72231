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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured concurrency scope. A tree owns a cancellation context derived from its parent, and a set of member
 * tasks running concurrently on the provided executor. The first member failure is recorded and cancels the
 * tree context, so all the other members are asked to terminate. {@link #join()} returns only after every
 * member returned.
 * <p>
 * The tree completes when it has no running members, and either {@link #join()} was requested or its context
 * was cancelled. From that point, as well as from the moment the context is cancelled, the tree is sealed and
 * no new members are accepted. The parent context is never cancelled by the tree.
 */
public class TaskTree {

    private static final Logger logger = LoggerFactory.getLogger(TaskTree.class);

    private final String name;
    private final CancellationContext context;
    private final Executor executor;

    private final AtomicReference<Throwable> firstError = new AtomicReference<>();
    private final CompletableFuture<Optional<Throwable>> joinedFuture = new CompletableFuture<>();

    private final Object lock = new Object();
    private int activeMembers;
    private boolean joinRequested;
    private boolean sealed;

    private TaskTree(String name, CancellationContext parentContext, Executor executor) {
        this.name = name;
        this.context = parentContext.newChild();
        this.executor = executor;
    }

    public String getName() {
        return name;
    }

    /**
     * Cancellation context shared by all members of this tree.
     */
    public CancellationContext getContext() {
        return context;
    }

    /**
     * Starts the given task as a member of this tree.
     *
     * @return false if the tree is sealed, and the task was not started
     */
    public boolean spawn(SupervisedTask task) {
        Preconditions.checkNotNull(task, "Task is null");
        synchronized (lock) {
            if (sealed || context.isCancelled()) {
                logger.debug("[{}] Task tree sealed; new member rejected", name);
                return false;
            }
            activeMembers++;
        }
        try {
            executor.execute(() -> runMember(task));
        } catch (RejectedExecutionException e) {
            recordError(e);
            memberFinished();
            return false;
        }
        return true;
    }

    /**
     * Cancels the tree. If the cause is not null, and no error was recorded yet, the cause becomes the tree error.
     */
    public void cancel(Throwable cause) {
        if (cause != null) {
            recordError(cause);
        } else {
            context.cancel(null);
        }
        tryComplete();
    }

    /**
     * Blocks until all members completed, and returns the first recorded error.
     */
    public Optional<Throwable> join() throws InterruptedException {
        synchronized (lock) {
            joinRequested = true;
        }
        tryComplete();
        try {
            return joinedFuture.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected task tree join failure", e.getCause());
        }
    }

    /**
     * Completes with the first recorded error when the tree completes. Unlike {@link #join()}, subscribing does
     * not request the tree completion.
     */
    public CompletionStage<Optional<Throwable>> whenJoined() {
        return joinedFuture.thenApply(error -> error);
    }

    public boolean isAlive() {
        return !joinedFuture.isDone();
    }

    public Optional<Throwable> getFirstError() {
        return Optional.ofNullable(firstError.get());
    }

    private void runMember(SupervisedTask task) {
        try {
            task.run(context);
        } catch (InterruptedException e) {
            if (!context.isCancelled()) {
                recordError(e);
            }
            Thread.currentThread().interrupt();
        } catch (Throwable e) {
            recordError(e);
        } finally {
            memberFinished();
        }
    }

    private void recordError(Throwable error) {
        if (firstError.compareAndSet(null, error)) {
            logger.debug("[{}] Task tree failed: {}", name, error.getMessage());
        } else {
            logger.debug("[{}] Ignoring subsequent task tree error: {}", name, error.getMessage());
        }
        context.cancel(error);
    }

    private void memberFinished() {
        synchronized (lock) {
            activeMembers--;
        }
        tryComplete();
    }

    private void tryComplete() {
        synchronized (lock) {
            if (sealed || activeMembers > 0 || !(joinRequested || context.isCancelled())) {
                return;
            }
            sealed = true;
        }
        // Releases the context from its parent.
        context.cancel(null);
        joinedFuture.complete(Optional.ofNullable(firstError.get()));
    }

    @Override
    public String toString() {
        return "TaskTree{" +
                "name='" + name + '\'' +
                ", alive=" + isAlive() +
                ", firstError=" + firstError.get() +
                '}';
    }

    public static TaskTree newTree(String name, CancellationContext parentContext, Executor executor) {
        Preconditions.checkNotNull(parentContext, "Parent context is null");
        Preconditions.checkNotNull(executor, "Executor is null");
        TaskTree tree = new TaskTree(name, parentContext, executor);
        // A tree without members completes as soon as its context is cancelled, including a context cancelled
        // before the tree was created.
        tree.context.whenCancelled().subscribe(
                next -> {
                },
                e -> logger.warn("[{}] Unexpected cancellation signal error", name, e),
                tree::tryComplete
        );
        return tree;
    }
}
