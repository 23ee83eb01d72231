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
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

/**
 * Base class implementing the leveled operations of {@link SessionLog} on top of a single write operation.
 */
public abstract class AbstractSessionLog implements SessionLog {

    @Override
    public void debug(String format, Object... args) {
        log(Level.DEBUG, format, args);
    }

    @Override
    public void info(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        log(Level.WARN, format, args);
    }

    @Override
    public void error(String format, Object... args) {
        log(Level.ERROR, format, args);
    }

    @Override
    public void done(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    @Override
    public void write(Level level, String message) {
        write(level, message, null);
    }

    protected abstract boolean isEnabled(Level level);

    protected abstract void write(Level level, String message, Throwable error);

    private void log(Level level, String format, Object[] args) {
        if (!isEnabled(level)) {
            return;
        }
        FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
        write(level, tuple.getMessage(), tuple.getThrowable());
    }
}
