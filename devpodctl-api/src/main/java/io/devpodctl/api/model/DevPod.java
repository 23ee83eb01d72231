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

package io.devpodctl.api.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Configuration of a single dev pod. Container level settings can be given either inline (targeting the pod's
 * default or the named container), or as a list of {@link DevContainer}s.
 */
public class DevPod {

    private final String name;
    private final String namespace;
    private final Map<String, String> labelSelector;
    private final String container;
    private final ContainerArchitecture arch;
    private final List<PortMapping> forward;
    private final List<PortMapping> reverseForward;
    private final List<SyncConfig> sync;
    private final List<DevContainer> containers;

    public DevPod(String name,
                  String namespace,
                  Map<String, String> labelSelector,
                  String container,
                  ContainerArchitecture arch,
                  List<PortMapping> forward,
                  List<PortMapping> reverseForward,
                  List<SyncConfig> sync,
                  List<DevContainer> containers) {
        this.name = name;
        this.namespace = namespace;
        this.labelSelector = labelSelector == null ? Collections.emptyMap() : Collections.unmodifiableMap(labelSelector);
        this.container = container;
        this.arch = arch == null ? ContainerArchitecture.Amd64 : arch;
        this.forward = nonNull(forward);
        this.reverseForward = nonNull(reverseForward);
        this.sync = nonNull(sync);
        this.containers = nonNull(containers);
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public Map<String, String> getLabelSelector() {
        return labelSelector;
    }

    public String getContainer() {
        return container;
    }

    public ContainerArchitecture getArch() {
        return arch;
    }

    public List<PortMapping> getForward() {
        return forward;
    }

    public List<PortMapping> getReverseForward() {
        return reverseForward;
    }

    public List<SyncConfig> getSync() {
        return sync;
    }

    public List<DevContainer> getContainers() {
        return containers;
    }

    /**
     * Returns the explicitly configured dev containers, or if there are none, a single dev container built from
     * the inline container settings.
     */
    public List<DevContainer> getDevContainers() {
        if (!containers.isEmpty()) {
            return containers;
        }
        return Collections.singletonList(DevContainer.newBuilder()
                .withContainer(container)
                .withArch(arch)
                .withReverseForward(reverseForward)
                .withSync(sync)
                .build()
        );
    }

    public boolean hasPortForwarding() {
        return !forward.isEmpty() || getDevContainers().stream().anyMatch(c -> !c.getReverseForward().isEmpty());
    }

    public boolean hasSync() {
        return getDevContainers().stream().anyMatch(c -> !c.getSync().isEmpty());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DevPod devPod = (DevPod) o;
        return Objects.equals(name, devPod.name) &&
                Objects.equals(namespace, devPod.namespace) &&
                Objects.equals(labelSelector, devPod.labelSelector) &&
                Objects.equals(container, devPod.container) &&
                arch == devPod.arch &&
                Objects.equals(forward, devPod.forward) &&
                Objects.equals(reverseForward, devPod.reverseForward) &&
                Objects.equals(sync, devPod.sync) &&
                Objects.equals(containers, devPod.containers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, labelSelector, container, arch, forward, reverseForward, sync, containers);
    }

    @Override
    public String toString() {
        return "DevPod{" +
                "name='" + name + '\'' +
                ", namespace='" + namespace + '\'' +
                ", labelSelector=" + labelSelector +
                ", container='" + container + '\'' +
                ", arch=" + arch +
                ", forward=" + forward +
                ", reverseForward=" + reverseForward +
                ", sync=" + sync +
                ", containers=" + containers +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withName(name)
                .withNamespace(namespace)
                .withLabelSelector(labelSelector)
                .withContainer(container)
                .withArch(arch)
                .withForward(forward)
                .withReverseForward(reverseForward)
                .withSync(sync)
                .withContainers(containers);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public static final class Builder {
        private String name;
        private String namespace;
        private Map<String, String> labelSelector;
        private String container;
        private ContainerArchitecture arch;
        private List<PortMapping> forward;
        private List<PortMapping> reverseForward;
        private List<SyncConfig> sync;
        private List<DevContainer> containers;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withLabelSelector(Map<String, String> labelSelector) {
            this.labelSelector = labelSelector;
            return this;
        }

        public Builder withContainer(String container) {
            this.container = container;
            return this;
        }

        public Builder withArch(ContainerArchitecture arch) {
            this.arch = arch;
            return this;
        }

        public Builder withForward(List<PortMapping> forward) {
            this.forward = forward;
            return this;
        }

        public Builder withReverseForward(List<PortMapping> reverseForward) {
            this.reverseForward = reverseForward;
            return this;
        }

        public Builder withSync(List<SyncConfig> sync) {
            this.sync = sync;
            return this;
        }

        public Builder withContainers(List<DevContainer> containers) {
            this.containers = containers;
            return this;
        }

        public DevPod build() {
            Preconditions.checkArgument(name != null && !name.isEmpty(), "Dev pod name not set");
            return new DevPod(name, namespace, labelSelector, container, arch, forward, reverseForward, sync, containers);
        }
    }
}
