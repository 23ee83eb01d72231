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

package io.devpodctl.runtime.session;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DevPodStateTest {

    @Test
    public void testTransitions() {
        assertThat(DevPodState.Starting.canTransitionTo(DevPodState.Running)).isTrue();
        assertThat(DevPodState.Running.canTransitionTo(DevPodState.Restarting)).isTrue();
        assertThat(DevPodState.Restarting.canTransitionTo(DevPodState.Stopped)).isTrue();

        assertThat(DevPodState.Starting.canTransitionTo(DevPodState.Restarting)).isFalse();
        assertThat(DevPodState.Stopped.canTransitionTo(DevPodState.Running)).isFalse();
        assertThat(DevPodState.Stopping.canTransitionTo(DevPodState.Running)).isFalse();
    }

    @Test
    public void testTerminalStates() {
        assertThat(DevPodState.Stopped.isTerminal()).isTrue();
        assertThat(DevPodState.Restarting.isTerminal()).isTrue();
        assertThat(DevPodState.Running.isTerminal()).isFalse();
    }
}
