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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import io.devpodctl.common.util.time.Clocks;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.assertj.core.api.Assertions.assertThat;

public class Log4jSessionLogsTest {

    @Rule
    public final TemporaryFolder temporaryFolder = new TemporaryFolder();

    private Log4jSessionLogs sessionLogs;

    @After
    public void tearDown() {
        if (sessionLogs != null) {
            sessionLogs.close();
        }
    }

    @Test
    public void testEachDevPodHasOwnLogFile() throws Exception {
        Path logDirectory = temporaryFolder.getRoot().toPath().resolve("logs");
        sessionLogs = new Log4jSessionLogs(logDirectory, false, Clocks.system());

        sessionLogs.getFileLog("api").info("Port forwarding started on {}", "8080:8080");
        sessionLogs.getFileLog("web").error("Restarting because: {}", "broken pipe");

        List<String> apiLines = Files.readAllLines(sessionLogs.getLogFile("api"), StandardCharsets.UTF_8);
        assertThat(apiLines).hasSize(1);
        assertThat(apiLines.get(0)).endsWith("Port forwarding started on 8080:8080");

        List<String> webLines = Files.readAllLines(logDirectory.resolve("devpod-web.log"), StandardCharsets.UTF_8);
        assertThat(webLines).hasSize(1);
        assertThat(webLines.get(0)).contains("broken pipe");
    }

    @Test
    public void testSameInstanceForSameName() {
        sessionLogs = new Log4jSessionLogs(temporaryFolder.getRoot().toPath(), false, Clocks.system());
        assertThat(sessionLogs.getFileLog("api")).isSameAs(sessionLogs.getFileLog("api"));
    }
}
