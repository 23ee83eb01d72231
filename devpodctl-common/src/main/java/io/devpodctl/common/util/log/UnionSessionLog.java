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

import java.util.Arrays;
import java.util.List;

import org.slf4j.event.Level;

/**
 * Writes each log line to all member logs.
 */
public class UnionSessionLog implements SessionLog {

    private final List<SessionLog> logs;

    public UnionSessionLog(SessionLog... logs) {
        this.logs = Arrays.asList(logs);
    }

    @Override
    public void debug(String format, Object... args) {
        logs.forEach(log -> log.debug(format, args));
    }

    @Override
    public void info(String format, Object... args) {
        logs.forEach(log -> log.info(format, args));
    }

    @Override
    public void warn(String format, Object... args) {
        logs.forEach(log -> log.warn(format, args));
    }

    @Override
    public void error(String format, Object... args) {
        logs.forEach(log -> log.error(format, args));
    }

    @Override
    public void done(String format, Object... args) {
        logs.forEach(log -> log.done(format, args));
    }

    @Override
    public void write(Level level, String message) {
        logs.forEach(log -> log.write(level, message));
    }
}
