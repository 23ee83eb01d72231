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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a dev pod session. A restarted dev pod is represented by a new session, so the
 * {@link #Restarting} state is terminal for the session that lost its connection.
 */
public enum DevPodState {
    Starting,
    Running,
    Stopping,
    Stopped,
    Restarting;

    public boolean isTerminal() {
        return this == Stopped || this == Restarting;
    }

    public boolean canTransitionTo(DevPodState next) {
        return allowedTransitions(this).contains(next);
    }

    private static Set<DevPodState> allowedTransitions(DevPodState state) {
        switch (state) {
            case Starting:
                return EnumSet.of(Running, Stopping, Stopped);
            case Running:
                return EnumSet.of(Stopping, Stopped, Restarting);
            case Stopping:
                return EnumSet.of(Stopped);
            case Restarting:
                return EnumSet.of(Stopped);
            case Stopped:
            default:
                return EnumSet.noneOf(DevPodState.class);
        }
    }
}
