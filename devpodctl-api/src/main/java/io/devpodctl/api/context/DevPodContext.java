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

package io.devpodctl.api.context;

import com.google.common.base.Preconditions;
import io.devpodctl.api.model.DevConfig;
import io.devpodctl.common.util.concurrent.CancellationContext;
import io.devpodctl.common.util.log.SessionLog;

/**
 * Immutable execution context passed down the dev pod call chain: the cancellation context of the caller, the
 * loaded configuration and the log to write to.
 */
public class DevPodContext {

    private final CancellationContext cancellation;
    private final DevConfig config;
    private final SessionLog log;

    public DevPodContext(CancellationContext cancellation, DevConfig config, SessionLog log) {
        this.cancellation = Preconditions.checkNotNull(cancellation, "Cancellation context is null");
        this.config = config;
        this.log = Preconditions.checkNotNull(log, "Log is null");
    }

    public CancellationContext getCancellation() {
        return cancellation;
    }

    /**
     * Loaded configuration, or null if no configuration was loaded.
     */
    public DevConfig getConfig() {
        return config;
    }

    public SessionLog getLog() {
        return log;
    }

    public boolean isDone() {
        return cancellation.isCancelled();
    }

    public DevPodContext withCancellation(CancellationContext cancellation) {
        return new DevPodContext(cancellation, config, log);
    }

    public DevPodContext withLog(SessionLog log) {
        return new DevPodContext(cancellation, config, log);
    }

    @Override
    public String toString() {
        return "DevPodContext{" +
                "cancellation=" + cancellation +
                ", config=" + config +
                '}';
    }
}
