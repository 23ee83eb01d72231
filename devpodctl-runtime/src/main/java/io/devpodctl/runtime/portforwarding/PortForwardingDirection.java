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

package io.devpodctl.runtime.portforwarding;

import io.devpodctl.api.model.HookEvent;

/**
 * Direction of a set of port mappings. Forward mappings expose pod ports locally, reverse mappings expose local
 * ports inside a dev container.
 */
public enum PortForwardingDirection {
    Forward("portForwarding", "port_forwarding_config"),
    Reverse("reversePortForwarding", "reverse_port_forwarding_config");

    private final String eventBase;
    private final String payloadKey;

    PortForwardingDirection(String eventBase, String payloadKey) {
        this.eventBase = eventBase;
        this.payloadKey = payloadKey;
    }

    /**
     * Key of the port mapping list in hook payloads.
     */
    public String getPayloadKey() {
        return payloadKey;
    }

    /**
     * Hook event for the given phase, for example 'start:portForwarding' aliased as 'portForwarding.start'.
     */
    public HookEvent event(String phase, String devPodName) {
        return HookEvent.forSingle(phase + ':' + eventBase, devPodName).with(eventBase + '.' + phase);
    }
}
