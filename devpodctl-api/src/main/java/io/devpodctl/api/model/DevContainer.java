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
import java.util.Objects;

/**
 * Container level part of a dev pod configuration.
 */
public class DevContainer {

    private final String container;
    private final ContainerArchitecture arch;
    private final List<PortMapping> reverseForward;
    private final List<SyncConfig> sync;

    public DevContainer(String container,
                        ContainerArchitecture arch,
                        List<PortMapping> reverseForward,
                        List<SyncConfig> sync) {
        this.container = container;
        this.arch = arch == null ? ContainerArchitecture.Amd64 : arch;
        this.reverseForward = reverseForward == null ? Collections.emptyList() : Collections.unmodifiableList(reverseForward);
        this.sync = sync == null ? Collections.emptyList() : Collections.unmodifiableList(sync);
    }

    /**
     * Container name, or null if the pod's default container is targeted.
     */
    public String getContainer() {
        return container;
    }

    public ContainerArchitecture getArch() {
        return arch;
    }

    public List<PortMapping> getReverseForward() {
        return reverseForward;
    }

    public List<SyncConfig> getSync() {
        return sync;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DevContainer that = (DevContainer) o;
        return Objects.equals(container, that.container) &&
                arch == that.arch &&
                Objects.equals(reverseForward, that.reverseForward) &&
                Objects.equals(sync, that.sync);
    }

    @Override
    public int hashCode() {
        return Objects.hash(container, arch, reverseForward, sync);
    }

    @Override
    public String toString() {
        return "DevContainer{" +
                "container='" + container + '\'' +
                ", arch=" + arch +
                ", reverseForward=" + reverseForward +
                ", sync=" + sync +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String container;
        private ContainerArchitecture arch;
        private List<PortMapping> reverseForward;
        private List<SyncConfig> sync;

        private Builder() {
        }

        public Builder withContainer(String container) {
            this.container = container;
            return this;
        }

        public Builder withArch(ContainerArchitecture arch) {
            this.arch = arch;
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

        public DevContainer build() {
            return new DevContainer(container, arch, reverseForward, sync);
        }
    }
}
