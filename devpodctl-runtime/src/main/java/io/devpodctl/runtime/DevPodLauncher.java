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

import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.service.DevPodException;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.runtime.SystemAbortEvent;
import io.devpodctl.common.util.SystemExt;
import io.devpodctl.runtime.manager.DevPodManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top level entry point. Starts the selected dev pods, and blocks until all of them terminated. This is the only
 * place where a {@link DevPodException.ErrorCode#Fatal} error may terminate the process.
 */
@Singleton
public class DevPodLauncher {

    private static final Logger logger = LoggerFactory.getLogger(DevPodLauncher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_FATAL = -1;

    private final DevPodManager manager;
    private final DevPodRuntime runtime;

    @Inject
    public DevPodLauncher(DevPodManager manager, DevPodRuntime runtime) {
        this.manager = manager;
        this.runtime = runtime;
    }

    /**
     * @return process exit code
     */
    public int run(DevPodContext context, List<String> devPodNames) {
        try {
            if (context.getConfig() == null) {
                throw DevPodException.fatal("Dev pod configuration is not loaded", null);
            }
            manager.startMultiple(context, devPodNames);
            manager.waitForAll();
            return EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.getLog().warn("Interrupted while running dev pods");
            return EXIT_ERROR;
        } catch (DevPodException e) {
            if (DevPodException.hasErrorCode(e, DevPodException.ErrorCode.Fatal)) {
                return abort(context, e);
            }
            context.getLog().error("Error starting dev pods: {}", e.getMessage());
            logger.debug("Dev pod start failure", e);
            return EXIT_ERROR;
        }
    }

    private int abort(DevPodContext context, DevPodException error) {
        context.getLog().error("Fatal error: {}", error.getMessage());
        runtime.beforeAbort(SystemAbortEvent.newBuilder()
                .withFailureId("devPodFatal")
                .withReason(error.getMessage())
                .withCause(error)
                .withTimestamp(runtime.getClock().wallTime())
                .build()
        );
        if (runtime.isSystemExitOnFailure()) {
            SystemExt.forcedProcessExit(EXIT_FATAL);
        }
        return EXIT_FATAL;
    }
}
