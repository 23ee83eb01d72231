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

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import io.devpodctl.common.util.time.Clock;

/**
 * Factory methods for the standard {@link LogLineTransformer}s.
 */
public final class LogLineTransformers {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private LogLineTransformers() {
    }

    /**
     * Prepends the name prefix, colorized if a color is given.
     */
    public static LogLineTransformer prefix(String prefix, AnsiColor color) {
        String decorated = color == null ? prefix : color.colorize(prefix);
        return (level, line) -> decorated + line;
    }

    /**
     * Prepends wall clock time in the HH:mm:ss format.
     */
    public static LogLineTransformer timestamp(Clock clock, boolean colorize) {
        return (level, line) -> {
            String time = TIME_FORMATTER.format(Instant.ofEpochMilli(clock.wallTime())) + ' ';
            return (colorize ? AnsiColor.BoldWhite.colorize(time) : time) + line;
        };
    }

    /**
     * Labels warning and error lines, so they stand out when levels are not rendered.
     */
    public static LogLineTransformer levelLabel() {
        return (level, line) -> {
            switch (level) {
                case WARN:
                    return "Warning: " + line;
                case ERROR:
                    return "Error: " + line;
                default:
                    return line;
            }
        };
    }
}
