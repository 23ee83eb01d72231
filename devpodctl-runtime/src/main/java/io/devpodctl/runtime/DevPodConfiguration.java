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

package io.devpodctl.runtime;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "devpod")
public interface DevPodConfiguration {

    /**
     * Delay between attempts to restart a dev pod, which stopped because of a lost connection.
     */
    @DefaultValue("10000")
    long getLostConnectionRestartIntervalMs();

    /**
     * Maximum amount of time to wait for a port forwarder to become ready.
     */
    @DefaultValue("20000")
    long getPortForwardingReadyTimeoutMs();

    /**
     * Delay between attempts to re-establish a broken port forwarding.
     */
    @DefaultValue("15000")
    long getPortForwardingRetryIntervalMs();

    /**
     * Prefix console log lines with the wall clock time.
     */
    @DefaultValue("false")
    boolean isLogTimestamps();

    /**
     * Directory of the per dev pod log files. A relative path is resolved against the working directory.
     */
    @DefaultValue(".devpod/logs")
    String getSessionLogDirectory();

    /**
     * If true, a fatal error terminates the JVM process.
     */
    @DefaultValue("true")
    boolean isSystemExitOnFailure();
}
