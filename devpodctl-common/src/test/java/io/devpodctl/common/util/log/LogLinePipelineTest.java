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
import org.junit.Test;
import org.slf4j.event.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class LogLinePipelineTest {

    @Test
    public void testEmptyPipelineKeepsLine() {
        assertThat(LogLinePipeline.empty().apply(Level.INFO, "hello")).isEqualTo("hello");
    }

    @Test
    public void testTransformersAreAppliedInOrder() {
        LogLinePipeline pipeline = LogLinePipeline.empty()
                .andThen(LogLineTransformers.levelLabel())
                .andThen(LogLineTransformers.prefix("[api] ", null));

        assertThat(pipeline.apply(Level.INFO, "started")).isEqualTo("[api] started");
        assertThat(pipeline.apply(Level.WARN, "port in use")).isEqualTo("[api] Warning: port in use");
        assertThat(pipeline.apply(Level.ERROR, "failed")).isEqualTo("[api] Error: failed");
    }

    @Test
    public void testAndThenDoesNotModifyOriginal() {
        LogLinePipeline base = LogLinePipeline.empty().andThen(LogLineTransformers.prefix("a", null));
        base.andThen(LogLineTransformers.prefix("b", null));

        assertThat(base.apply(Level.INFO, "-")).isEqualTo("a-");
    }

    @Test
    public void testColorizedPrefix() {
        String line = LogLineTransformers.prefix("[api] ", AnsiColor.Green).transform(Level.INFO, "x");
        assertThat(line).isEqualTo("\u001B[32m[api] \u001B[0mx");
    }

    @Test
    public void testTimestamp() {
        Clock clock = mock(Clock.class);
        long now = 1_600_000_000_000L;
        when(clock.wallTime()).thenReturn(now);

        String expectedTime = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault()).format(Instant.ofEpochMilli(now));
        assertThat(LogLineTransformers.timestamp(clock, false).transform(Level.INFO, "x")).isEqualTo(expectedTime + " x");
    }
}
