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

import org.slf4j.event.Level;

/**
 * Leveled log of a single dev pod session. Messages use SLF4J style '{}' placeholders. If the last argument is
 * a {@link Throwable}, it is logged with its stack trace.
 */
public interface SessionLog {

    void debug(String format, Object... args);

    void info(String format, Object... args);

    void warn(String format, Object... args);

    void error(String format, Object... args);

    /**
     * Confirmation of a successfully completed operation. Written at the INFO level.
     */
    void done(String format, Object... args);

    /**
     * Writes an already formatted message.
     */
    void write(Level level, String message);
}
