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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Test;

import static com.jayway.awaitility.Awaitility.await;
import static org.assertj.core.api.Assertions.assertThat;

public class TaskTreeTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    private final CancellationContext rootContext = CancellationContext.root();

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testJoinWaitsForAllMembers() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < 5; i++) {
            tree.spawn(context -> {
                Thread.sleep(20);
                completed.incrementAndGet();
            });
        }

        assertThat(tree.join()).isEmpty();
        assertThat(completed).hasValue(5);
        assertThat(tree.isAlive()).isFalse();
        assertThat(rootContext.isCancelled()).isFalse();
    }

    @Test
    public void testFirstFailureCancelsSiblings() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        CountDownLatch siblingCancelled = new CountDownLatch(1);
        tree.spawn(context -> {
            context.awaitCancellation();
            siblingCancelled.countDown();
        });
        RuntimeException failure = new RuntimeException("simulated");
        tree.spawn(context -> {
            throw failure;
        });

        Optional<Throwable> error = tree.join();
        assertThat(error).contains(failure);
        assertThat(siblingCancelled.getCount()).isZero();
        assertThat(rootContext.isCancelled()).isFalse();
    }

    @Test
    public void testOnlyFirstErrorIsRecorded() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        RuntimeException first = new RuntimeException("first");
        tree.spawn(context -> {
            throw first;
        });
        await().until(() -> tree.getFirstError().isPresent());
        tree.spawn(context -> {
            throw new RuntimeException("second");
        });

        assertThat(tree.join()).contains(first);
    }

    @Test
    public void testCancelWithCause() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        tree.spawn(CancellationContext::awaitCancellation);

        IllegalStateException cause = new IllegalStateException("manual");
        tree.cancel(cause);

        assertThat(tree.join()).contains(cause);
        assertThat(tree.getContext().getCause()).contains(cause);
    }

    @Test
    public void testCancelWithoutCauseIsNotAnError() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        tree.spawn(CancellationContext::awaitCancellation);
        tree.spawn(context -> {
            // Interruption after cancellation is a regular termination.
            context.awaitCancellation();
            throw new InterruptedException();
        });

        tree.cancel(null);
        assertThat(tree.join()).isEmpty();
    }

    @Test
    public void testParentCancellationTerminatesTree() throws Exception {
        CancellationContext parent = rootContext.newChild();
        TaskTree tree = TaskTree.newTree("test", parent, executor);
        tree.spawn(CancellationContext::awaitCancellation);

        parent.cancel(null);

        await().until(() -> !tree.isAlive());
        assertThat(tree.join()).isEmpty();
    }

    @Test
    public void testSealedTreeRejectsNewMembers() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        tree.spawn(context -> {
        });
        tree.join();

        assertThat(tree.spawn(context -> {
        })).isFalse();
    }

    @Test
    public void testMemberCanSpawnMoreMembers() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        AtomicInteger nestedRuns = new AtomicInteger();
        tree.spawn(context -> tree.spawn(nested -> {
            Thread.sleep(50);
            nestedRuns.incrementAndGet();
        }));

        assertThat(tree.join()).isEmpty();
        assertThat(nestedRuns).hasValue(1);
    }

    @Test
    public void testWhenJoinedDoesNotRequestCompletion() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        tree.spawn(context -> {
        });
        CountDownLatch joined = new CountDownLatch(1);
        tree.whenJoined().thenAccept(error -> joined.countDown());

        // With no join requested and no cancellation, an idle tree stays open.
        assertThat(joined.await(100, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(tree.spawn(CancellationContext::awaitCancellation)).isTrue();

        tree.cancel(null);
        assertThat(joined.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    public void testTreeOnCancelledContextCompletesImmediately() throws Exception {
        rootContext.cancel(null);
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);

        assertThat(tree.spawn(CancellationContext::awaitCancellation)).isFalse();
        assertThat(tree.isAlive()).isFalse();
        assertThat(tree.whenJoined().toCompletableFuture().get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    public void testIdleTreeCompletesOnParentCancellation() throws Exception {
        TaskTree tree = TaskTree.newTree("test", rootContext, executor);
        CountDownLatch joined = new CountDownLatch(1);
        tree.whenJoined().thenAccept(error -> joined.countDown());

        rootContext.cancel(null);

        assertThat(joined.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(tree.isAlive()).isFalse();
    }
}
