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

package io.devpodctl.testkit.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.devpodctl.common.util.log.AbstractSessionLog;
import io.devpodctl.common.util.log.SessionLog;
import io.devpodctl.common.util.log.SessionLogs;
import org.slf4j.event.Level;

/**
 * {@link SessionLogs} keeping all lines in memory. Each line is recorded as '{@code LEVEL message}'.
 */
public class RecordingSessionLogs implements SessionLogs {

    private final Map<String, List<String>> consoleLines = new ConcurrentHashMap<>();
    private final Map<String, List<String>> fileLines = new ConcurrentHashMap<>();
    private final Map<String, SessionLog> fileLogs = new ConcurrentHashMap<>();

    @Override
    public SessionLog newConsoleLog(String name) {
        return new RecordingSessionLog(consoleLines.computeIfAbsent(name, n -> new CopyOnWriteArrayList<>()));
    }

    @Override
    public SessionLog getFileLog(String name) {
        return fileLogs.computeIfAbsent(name, n -> new RecordingSessionLog(fileLines.computeIfAbsent(n, k -> new CopyOnWriteArrayList<>())));
    }

    public List<String> getConsoleLines(String name) {
        return new ArrayList<>(consoleLines.getOrDefault(name, Collections.emptyList()));
    }

    public List<String> getFileLines(String name) {
        return new ArrayList<>(fileLines.getOrDefault(name, Collections.emptyList()));
    }

    /**
     * Creates a log not bound to any name, for use as a caller context log.
     */
    public static RecordingSessionLog newLog() {
        return new RecordingSessionLog(new CopyOnWriteArrayList<>());
    }

    public static class RecordingSessionLog extends AbstractSessionLog {

        private final List<String> lines;

        private RecordingSessionLog(List<String> lines) {
            this.lines = lines;
        }

        public List<String> getLines() {
            return new ArrayList<>(lines);
        }

        @Override
        protected boolean isEnabled(Level level) {
            return true;
        }

        @Override
        protected void write(Level level, String message, Throwable error) {
            lines.add(level + " " + message);
        }
    }
}
