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

import java.util.List;

import io.devpodctl.api.model.ContainerArchitecture;
import io.devpodctl.api.model.PortMapping;

/**
 * Port mappings established together by a single forwarder.
 */
class PortMappingSet {

    private final PortForwardingDirection direction;
    private final List<PortMapping> mappings;
    private final String container;
    private final ContainerArchitecture arch;

    private PortMappingSet(PortForwardingDirection direction, List<PortMapping> mappings, String container, ContainerArchitecture arch) {
        this.direction = direction;
        this.mappings = mappings;
        this.container = container;
        this.arch = arch;
    }

    PortForwardingDirection getDirection() {
        return direction;
    }

    List<PortMapping> getMappings() {
        return mappings;
    }

    String getContainer() {
        return container;
    }

    ContainerArchitecture getArch() {
        return arch;
    }

    @Override
    public String toString() {
        return "PortMappingSet{" +
                "direction=" + direction +
                ", mappings=" + mappings +
                ", container='" + container + '\'' +
                ", arch=" + arch +
                '}';
    }

    static PortMappingSet forward(List<PortMapping> mappings) {
        return new PortMappingSet(PortForwardingDirection.Forward, mappings, null, null);
    }

    static PortMappingSet reverse(String container, ContainerArchitecture arch, List<PortMapping> mappings) {
        return new PortMappingSet(PortForwardingDirection.Reverse, mappings, container, arch);
    }
}
