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

package io.devpodctl.common.util.log;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.devpodctl.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionLogs} writing to SLF4J. Console lines go to the {@link #CONSOLE_LOGGER} category, persistent logs
 * to {@link #FILE_LOGGER_PREFIX}{@code <name>}. Routing the categories to appenders is left to the logging
 * backend configuration.
 */
public class Slf4jSessionLogs implements SessionLogs {

    public static final String CONSOLE_LOGGER = "devpod.console";
    public static final String FILE_LOGGER_PREFIX = "devpod.sessions.";

    private final Logger consoleLogger;
    private final boolean timestamps;
    private final Clock clock;

    private final ConcurrentMap<String, SessionLog> fileLogs = new ConcurrentHashMap<>();

    public Slf4jSessionLogs(boolean timestamps, Clock clock) {
        this.consoleLogger = LoggerFactory.getLogger(CONSOLE_LOGGER);
        this.timestamps = timestamps;
        this.clock = clock;
    }

    @Override
    public SessionLog newConsoleLog(String name) {
        LogLinePipeline pipeline = LogLinePipeline.empty()
                .andThen(LogLineTransformers.levelLabel())
                .andThen(LogLineTransformers.prefix("[" + name + "] ", PrefixColors.forName(name)));
        if (timestamps || consoleLogger.isDebugEnabled()) {
            pipeline = pipeline.andThen(LogLineTransformers.timestamp(clock, true));
        }
        return new Slf4jSessionLog(consoleLogger, pipeline);
    }

    @Override
    public SessionLog getFileLog(String name) {
        return fileLogs.computeIfAbsent(name, n -> new Slf4jSessionLog(
                LoggerFactory.getLogger(FILE_LOGGER_PREFIX + n),
                LogLinePipeline.empty().andThen(LogLineTransformers.levelLabel())
        ));
    }
}
