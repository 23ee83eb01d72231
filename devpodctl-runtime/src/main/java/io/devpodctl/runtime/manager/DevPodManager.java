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

package io.devpodctl.runtime.manager;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.runtime.session.DevPodSession;

/**
 * Registry of the dev pod sessions of this process. Start, stop and reset of the same dev pod are mutually
 * exclusive. Sessions terminated by a lost connection are restarted in the background.
 */
public interface DevPodManager {

    /**
     * Starts the selected dev pods concurrently, or all configured dev pods if the selection is empty. Returns
     * after all of them started.
     *
     * @throws io.devpodctl.api.service.DevPodException the first start failure
     */
    void startMultiple(DevPodContext context, List<String> selected) throws InterruptedException;

    /**
     * Starts the dev pod, unless a session for it is already alive.
     *
     * @throws io.devpodctl.api.service.DevPodException with error code AlreadyExists if a session is alive
     */
    void start(DevPodContext context, DevPod devPod) throws InterruptedException;

    /**
     * Stops the dev pod, and reverts the pod replacement recorded for it in the remote cache.
     */
    void reset(DevPodContext context, String name) throws InterruptedException, ClusterClientException;

    /**
     * Stops the dev pod if it is running. Stopping an unknown dev pod has no effect.
     */
    void stop(String name) throws InterruptedException;

    /**
     * Waits for all sessions registered at the time of the call to complete.
     */
    void waitForAll() throws InterruptedException;

    Optional<DevPodSession> getSession(String name);

    Set<String> getDevPodNames();
}
