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

package io.devpodctl.testkit.model.hook;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import io.devpodctl.api.model.HookEvent;
import io.devpodctl.api.service.HookExecutionException;
import io.devpodctl.api.service.HookExecutor;

/**
 * {@link HookExecutor} recording all invocations. Hooks for events registered with {@link #failOn(String)} fail
 * with {@link HookExecutionException}, and those registered with {@link #crashOn(String)} with an unchecked exception.
 */
public class RecordingHookExecutor implements HookExecutor {

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final Set<String> failingEvents = ConcurrentHashMap.newKeySet();
    private final Set<String> crashingEvents = ConcurrentHashMap.newKeySet();

    public RecordingHookExecutor failOn(String eventName) {
        failingEvents.add(eventName);
        return this;
    }

    /**
     * Hooks for the event fail with an unchecked exception.
     */
    public RecordingHookExecutor crashOn(String eventName) {
        crashingEvents.add(eventName);
        return this;
    }

    @Override
    public void executeHooks(HookEvent event, Map<String, Object> payload) throws HookExecutionException {
        invocations.add(new Invocation(event, payload));
        for (String eventName : event.getEventNames()) {
            if (failingEvents.contains(eventName)) {
                throw new HookExecutionException("Simulated hook failure for event " + eventName);
            }
            if (crashingEvents.contains(eventName)) {
                throw new IllegalStateException("Simulated hook crash for event " + eventName);
            }
        }
    }

    public List<Invocation> getInvocations() {
        return new ArrayList<>(invocations);
    }

    /**
     * Returns invocations for which the given name is one of the event names.
     */
    public List<Invocation> getInvocations(String eventName) {
        return invocations.stream()
                .filter(invocation -> invocation.getEvent().getEventNames().contains(eventName))
                .collect(Collectors.toList());
    }

    public static class Invocation {

        private final HookEvent event;
        private final Map<String, Object> payload;

        private Invocation(HookEvent event, Map<String, Object> payload) {
            this.event = event;
            this.payload = payload;
        }

        public HookEvent getEvent() {
            return event;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        @Override
        public String toString() {
            return "Invocation{" +
                    "event=" + event +
                    ", payload=" + payload +
                    '}';
        }
    }
}
