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

import javax.inject.Singleton;

import io.devpodctl.common.runtime.SystemAbortEvent;
import io.devpodctl.common.runtime.SystemAbortListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class LoggingSystemAbortListener implements SystemAbortListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSystemAbortListener.class);

    private static final LoggingSystemAbortListener INSTANCE = new LoggingSystemAbortListener();

    @Override
    public void onSystemAbortEvent(SystemAbortEvent event) {
        logger.error("Dev pod process abort requested: {}", event, event.getCause().orElse(null));
    }

    public static LoggingSystemAbortListener getDefault() {
        return INSTANCE;
    }
}
