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

import java.util.List;

import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.model.Pod;

/**
 * Cluster API operations needed by dev pod sessions.
 */
public interface ClusterClient {

    /**
     * Creates the selector finding the pod a dev pod is attached to.
     */
    TargetSelector newTargetSelector(DevPod devPod);

    /**
     * Creates a forwarder from local ports to the pod ports. Each port pair has the 'local:remote' format, and is
     * bound to the address at the same index.
     */
    PortForwarder newPortForwarder(Pod pod,
                                   List<String> ports,
                                   List<String> addresses,
                                   PortForwarderListener listener) throws ClusterClientException;

    /**
     * Creates a forwarder from ports opened inside a container to local ports. The given helper binary is injected
     * into the container to accept the remote connections.
     */
    PortForwarder newReversePortForwarder(Pod pod,
                                          String container,
                                          String helperBinary,
                                          List<String> ports,
                                          List<String> addresses,
                                          PortForwarderListener listener) throws ClusterClientException;
}
