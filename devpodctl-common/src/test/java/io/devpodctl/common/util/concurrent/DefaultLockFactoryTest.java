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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultLockFactoryTest {

    private final DefaultLockFactory lockFactory = new DefaultLockFactory();

    @Test
    public void testSameKeyReturnsSameLock() {
        Lock first = lockFactory.getLock("api");
        assertThat(lockFactory.getLock("api")).isSameAs(first);
        assertThat(lockFactory.getLock("web")).isNotSameAs(first);
        assertThat(lockFactory.size()).isEqualTo(2);
    }

    @Test
    public void testLockIsReentrant() {
        Lock lock = lockFactory.getLock("api");
        lock.lock();
        try {
            assertThat(lockFactory.getLock("api").tryLock()).isTrue();
            lockFactory.getLock("api").unlock();
        } finally {
            lock.unlock();
        }
    }

    @Test
    public void testConcurrentFirstAccessPublishesSingleLock() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch startLatch = new CountDownLatch(1);
            List<Lock> locks = new CopyOnWriteArrayList<>();
            CountDownLatch doneLatch = new CountDownLatch(threads);
            for (int i = 0; i < threads; i++) {
                executor.execute(() -> {
                    try {
                        startLatch.await();
                        locks.add(lockFactory.getLock("shared"));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertThat(doneLatch.await(5, TimeUnit.SECONDS)).isTrue();

            Lock expected = lockFactory.getLock("shared");
            assertThat(locks).hasSize(threads).allMatch(lock -> lock == expected);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(expected = NullPointerException.class)
    public void testNullKeyIsRejected() {
        lockFactory.getLock(null);
    }
}
