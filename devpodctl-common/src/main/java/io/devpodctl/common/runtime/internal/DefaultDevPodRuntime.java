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

import java.util.concurrent.ExecutorService;

import com.netflix.spectator.api.Registry;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.runtime.SystemAbortEvent;
import io.devpodctl.common.runtime.SystemAbortListener;
import io.devpodctl.common.util.ExecutorsExt;
import io.devpodctl.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultDevPodRuntime implements DevPodRuntime {

    private static final Logger logger = LoggerFactory.getLogger(DefaultDevPodRuntime.class);

    private static final String WORKER_POOL_NAME = "devpod-worker";

    private final SystemAbortListener systemAbortListener;
    private final Registry registry;
    private final Clock clock;
    private final boolean systemExitOnFailure;
    private final ExecutorService workerPool;

    public DefaultDevPodRuntime(SystemAbortListener systemAbortListener,
                                Registry registry,
                                Clock clock,
                                boolean systemExitOnFailure) {
        this.systemAbortListener = systemAbortListener;
        this.registry = registry;
        this.clock = clock;
        this.systemExitOnFailure = systemExitOnFailure;
        this.workerPool = ExecutorsExt.instrumentedCachedThreadPool(registry, WORKER_POOL_NAME);
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public ExecutorService getWorkerPool() {
        return workerPool;
    }

    @Override
    public boolean isSystemExitOnFailure() {
        return systemExitOnFailure;
    }

    @Override
    public void beforeAbort(SystemAbortEvent event) {
        logger.error("System abort requested: {}", event);
        try {
            systemAbortListener.onSystemAbortEvent(event);
        } catch (Exception e) {
            logger.error("Unexpected exception from the system abort listener", e);
        }
    }
}
