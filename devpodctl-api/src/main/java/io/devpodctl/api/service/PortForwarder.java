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

package io.devpodctl.api.service;

/**
 * A single port forwarding connection to a pod, covering all requested port pairs.
 */
public interface PortForwarder {

    /**
     * Runs the forwarding. Blocks until the forwarder is closed (normal return) or fails (exception). Readiness
     * and asynchronous failures are reported to the {@link PortForwarderListener} given at construction time.
     */
    void forwardPorts() throws Exception;

    /**
     * Stops forwarding and releases the local ports. Idempotent.
     */
    void close();
}
