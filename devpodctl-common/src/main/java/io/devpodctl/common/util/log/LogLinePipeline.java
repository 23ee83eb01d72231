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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import org.slf4j.event.Level;

/**
 * Ordered chain of {@link LogLineTransformer}s. Transformers are applied in the order they were added, so
 * the last one produces the outermost decoration.
 */
public class LogLinePipeline {

    private static final LogLinePipeline EMPTY = new LogLinePipeline(Collections.emptyList());

    private final List<LogLineTransformer> transformers;

    private LogLinePipeline(List<LogLineTransformer> transformers) {
        this.transformers = transformers;
    }

    public String apply(Level level, String line) {
        String result = line;
        for (LogLineTransformer transformer : transformers) {
            result = transformer.transform(level, result);
        }
        return result;
    }

    public LogLinePipeline andThen(LogLineTransformer transformer) {
        Preconditions.checkNotNull(transformer, "Transformer is null");
        List<LogLineTransformer> extended = new ArrayList<>(transformers);
        extended.add(transformer);
        return new LogLinePipeline(Collections.unmodifiableList(extended));
    }

    public static LogLinePipeline empty() {
        return EMPTY;
    }
}
