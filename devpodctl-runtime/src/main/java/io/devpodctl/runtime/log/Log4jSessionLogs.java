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

package io.devpodctl.runtime.log;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.devpodctl.common.util.log.SessionLog;
import io.devpodctl.common.util.log.Slf4jSessionLogs;
import io.devpodctl.common.util.time.Clock;
import org.apache.log4j.Appender;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.RollingFileAppender;

/**
 * {@link Slf4jSessionLogs} with a dedicated rolling file {@code devpod-<name>.log} for each persistent log. If the
 * file cannot be opened, the persistent log falls back to the appenders configured for the parent categories.
 */
public class Log4jSessionLogs extends Slf4jSessionLogs {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Log4jSessionLogs.class);

    private static final String LAYOUT = "%d{ISO8601} %m%n";
    private static final String MAX_FILE_SIZE = "10MB";
    private static final int MAX_BACKUP_INDEX = 5;

    private final Path logDirectory;
    private final ConcurrentMap<String, Appender> appenders = new ConcurrentHashMap<>();

    public Log4jSessionLogs(Path logDirectory, boolean timestamps, Clock clock) {
        super(timestamps, clock);
        this.logDirectory = logDirectory;
    }

    @Override
    public SessionLog getFileLog(String name) {
        appenders.computeIfAbsent(name, this::attachFileAppender);
        return super.getFileLog(name);
    }

    public Path getLogFile(String name) {
        return logDirectory.resolve("devpod-" + name + ".log");
    }

    /**
     * Detaches and closes all session log files.
     */
    public void close() {
        appenders.forEach((name, appender) -> {
            Logger log4jLogger = Logger.getLogger(FILE_LOGGER_PREFIX + name);
            log4jLogger.removeAppender(appender);
            log4jLogger.setAdditivity(true);
            appender.close();
        });
        appenders.clear();
    }

    private Appender attachFileAppender(String name) {
        Path file = getLogFile(name);
        RollingFileAppender appender;
        try {
            appender = new RollingFileAppender(new PatternLayout(LAYOUT), file.toString(), true);
        } catch (IOException e) {
            logger.warn("Cannot open the dev pod log file {}: {}", file, e.getMessage());
            return null;
        }
        appender.setName("devpod-" + name);
        appender.setMaxFileSize(MAX_FILE_SIZE);
        appender.setMaxBackupIndex(MAX_BACKUP_INDEX);

        Logger log4jLogger = Logger.getLogger(FILE_LOGGER_PREFIX + name);
        log4jLogger.addAppender(appender);
        log4jLogger.setAdditivity(false);
        return appender;
    }
}
