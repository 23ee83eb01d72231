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

package io.devpodctl.api.service;

import java.util.Map;

import io.devpodctl.api.model.HookEvent;
import io.devpodctl.common.util.log.SessionLog;

/**
 * Runs user defined hooks subscribed to lifecycle events.
 */
public interface HookExecutor {

    /**
     * Runs all hooks matching the event, and fails if any of them fails. Used before an action, which must not
     * proceed if a hook failed.
     */
    void executeHooks(HookEvent event, Map<String, Object> payload) throws HookExecutionException;

    /**
     * Runs all hooks matching the event, logging a failure (checked or not) instead of propagating it. Used after
     * an action, which must proceed whatever the hook outcome.
     */
    default void logExecuteHooks(SessionLog log, HookEvent event, Map<String, Object> payload) {
        try {
            executeHooks(event, payload);
        } catch (HookExecutionException | RuntimeException e) {
            log.warn("Error executing hooks for event {}: {}", event.getName(), e.getMessage());
        }
    }
}
