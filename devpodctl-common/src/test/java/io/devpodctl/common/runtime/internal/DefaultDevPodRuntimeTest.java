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

package io.devpodctl.common.runtime.internal;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.netflix.spectator.api.DefaultRegistry;
import io.devpodctl.common.runtime.SystemAbortEvent;
import io.devpodctl.common.runtime.SystemAbortListener;
import io.devpodctl.common.util.time.Clocks;
import org.junit.After;
import org.junit.Test;

import static com.jayway.awaitility.Awaitility.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class DefaultDevPodRuntimeTest {

    private final SystemAbortListener abortListener = mock(SystemAbortListener.class);

    private final DefaultDevPodRuntime runtime = new DefaultDevPodRuntime(abortListener, new DefaultRegistry(), Clocks.system(), false);

    @After
    public void tearDown() {
        runtime.getWorkerPool().shutdownNow();
    }

    @Test
    public void testBeforeAbortNotifiesListener() {
        SystemAbortEvent event = newAbortEvent();
        runtime.beforeAbort(event);
        verify(abortListener).onSystemAbortEvent(event);
    }

    @Test
    public void testListenerFailureDoesNotPropagate() {
        SystemAbortEvent event = newAbortEvent();
        doThrow(new IllegalStateException("simulated")).when(abortListener).onSystemAbortEvent(event);
        runtime.beforeAbort(event);
        verify(abortListener).onSystemAbortEvent(event);
    }

    @Test
    public void testWorkerPoolRunsTasks() {
        AtomicBoolean executed = new AtomicBoolean();
        runtime.getWorkerPool().execute(() -> executed.set(true));
        await().atMost(5, TimeUnit.SECONDS).until(executed::get);
        assertThat(runtime.isSystemExitOnFailure()).isFalse();
    }

    private SystemAbortEvent newAbortEvent() {
        return SystemAbortEvent.newBuilder()
                .withFailureId("test")
                .withReason("simulated")
                .withTimestamp(System.currentTimeMillis())
                .build();
    }
}
