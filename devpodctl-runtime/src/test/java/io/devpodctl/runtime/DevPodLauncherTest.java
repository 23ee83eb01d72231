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

package io.devpodctl.runtime;

import java.util.Collections;

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevConfig;
import io.devpodctl.api.service.DevPodException;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.runtime.SystemAbortEvent;
import io.devpodctl.common.util.concurrent.CancellationContext;
import io.devpodctl.common.util.time.Clocks;
import io.devpodctl.runtime.manager.DevPodManager;
import io.devpodctl.testkit.log.RecordingSessionLogs;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DevPodLauncherTest {

    private final DevPodManager manager = mock(DevPodManager.class);
    private final DevPodRuntime runtime = mock(DevPodRuntime.class);

    private final RecordingSessionLogs.RecordingSessionLog log = RecordingSessionLogs.newLog();
    private final DevPodContext context = new DevPodContext(CancellationContext.root(), DevConfig.empty(), log);

    private final DevPodLauncher launcher = new DevPodLauncher(manager, runtime);

    @Before
    public void setUp() {
        when(runtime.getClock()).thenReturn(Clocks.system());
        when(runtime.isSystemExitOnFailure()).thenReturn(false);
    }

    @Test
    public void testRunStartsAndWaits() throws Exception {
        assertThat(launcher.run(context, Collections.singletonList("api"))).isEqualTo(DevPodLauncher.EXIT_OK);

        verify(manager).startMultiple(context, Collections.singletonList("api"));
        verify(manager).waitForAll();
    }

    @Test
    public void testStartFailureIsReported() throws Exception {
        doThrow(DevPodException.alreadyExists("api")).when(manager).startMultiple(any(), anyList());

        assertThat(launcher.run(context, Collections.emptyList())).isEqualTo(DevPodLauncher.EXIT_ERROR);
        assertThat(log.getLines()).anyMatch(line -> line.startsWith("ERROR Error starting dev pods"));
        verify(manager, never()).waitForAll();
        verify(runtime, never()).beforeAbort(any());
    }

    @Test
    public void testFatalErrorAborts() throws Exception {
        doThrow(DevPodException.fatal("cannot continue", null)).when(manager).startMultiple(any(), anyList());

        assertThat(launcher.run(context, Collections.emptyList())).isEqualTo(DevPodLauncher.EXIT_FATAL);

        ArgumentCaptor<SystemAbortEvent> captor = ArgumentCaptor.forClass(SystemAbortEvent.class);
        verify(runtime).beforeAbort(captor.capture());
        assertThat(captor.getValue().getFailureId()).isEqualTo("devPodFatal");
        assertThat(captor.getValue().getReason()).isEqualTo("cannot continue");
        assertThat(captor.getValue().getCause()).containsInstanceOf(DevPodException.class);
    }

    @Test
    public void testMissingConfigurationIsFatal() throws Exception {
        DevPodContext noConfig = new DevPodContext(CancellationContext.root(), null, log);

        assertThat(launcher.run(noConfig, Collections.emptyList())).isEqualTo(DevPodLauncher.EXIT_FATAL);
        verify(manager, never()).startMultiple(any(), anyList());
        verify(runtime).beforeAbort(any());
    }
}
