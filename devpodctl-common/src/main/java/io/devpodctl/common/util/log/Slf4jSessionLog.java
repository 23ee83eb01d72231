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

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * {@link SessionLog} passing each line through a {@link LogLinePipeline} before writing it to an SLF4J logger.
 */
public class Slf4jSessionLog extends AbstractSessionLog {

    private final Logger logger;
    private final LogLinePipeline pipeline;

    public Slf4jSessionLog(Logger logger, LogLinePipeline pipeline) {
        this.logger = Preconditions.checkNotNull(logger, "Logger is null");
        this.pipeline = Preconditions.checkNotNull(pipeline, "Pipeline is null");
    }

    public Logger getLogger() {
        return logger;
    }

    @Override
    protected boolean isEnabled(Level level) {
        switch (level) {
            case ERROR:
                return logger.isErrorEnabled();
            case WARN:
                return logger.isWarnEnabled();
            case INFO:
                return logger.isInfoEnabled();
            case DEBUG:
                return logger.isDebugEnabled();
            default:
                return logger.isTraceEnabled();
        }
    }

    @Override
    protected void write(Level level, String message, Throwable error) {
        String line = pipeline.apply(level, message);
        switch (level) {
            case ERROR:
                logger.error(line, error);
                break;
            case WARN:
                logger.warn(line, error);
                break;
            case INFO:
                logger.info(line, error);
                break;
            case DEBUG:
                logger.debug(line, error);
                break;
            default:
                logger.trace(line, error);
        }
    }
}
