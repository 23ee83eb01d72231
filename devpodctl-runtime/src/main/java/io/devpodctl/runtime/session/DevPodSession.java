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

import java.util.Optional;

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevPod;
import reactor.core.publisher.Mono;

/**
 * Runtime of a single dev pod. A session is started once, runs its port forwarding and file synchronization
 * as members of one task tree, and is done when that tree completes.
 */
public interface DevPodSession {

    String getName();

    DevPodState getState();

    /**
     * Starts the session services, and returns once all of them passed their initialization. The session runs
     * until it is stopped, the context is cancelled or one of its services fails.
     *
     * @throws io.devpodctl.api.service.DevPodException if any of the services failed to initialize
     */
    void start(DevPodContext context, DevPod devPod) throws InterruptedException;

    /**
     * Stops all session services, and waits for their termination. Calling it more than once has no effect.
     */
    void stop() throws InterruptedException;

    /**
     * Completes when the session task tree completed.
     */
    Mono<Void> whenDone();

    void awaitDone() throws InterruptedException;

    boolean isDone();

    /**
     * True until the session is done.
     */
    boolean isAlive();

    /**
     * Error that terminated the session.
     *
     * @throws IllegalStateException if the session is not done yet
     */
    Optional<Throwable> getError();

    /**
     * Called by the manager when it starts a replacement for a session that lost its connection.
     */
    void markRestarting();

    /**
     * Called by the manager when a session that lost its connection will not be restarted.
     */
    void markStopped();
}
