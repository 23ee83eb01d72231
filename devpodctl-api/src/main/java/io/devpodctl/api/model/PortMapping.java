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

import java.util.Objects;

/**
 * Mapping between a local port and a port on the remote side. The remote port defaults to the local port, and
 * the bind address to 'localhost'.
 */
public class PortMapping {

    public static final String DEFAULT_BIND_ADDRESS = "localhost";

    private final Integer localPort;
    private final Integer remotePort;
    private final String bindAddress;

    public PortMapping(Integer localPort, Integer remotePort, String bindAddress) {
        this.localPort = localPort;
        this.remotePort = remotePort;
        this.bindAddress = bindAddress;
    }

    /**
     * Required, but may be missing from an invalid configuration.
     */
    public Integer getLocalPort() {
        return localPort;
    }

    public Integer getRemotePort() {
        return remotePort;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public int getEffectiveRemotePort() {
        return remotePort != null ? remotePort : localPort;
    }

    public String getEffectiveBindAddress() {
        return bindAddress == null || bindAddress.isEmpty() ? DEFAULT_BIND_ADDRESS : bindAddress;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PortMapping that = (PortMapping) o;
        return Objects.equals(localPort, that.localPort) &&
                Objects.equals(remotePort, that.remotePort) &&
                Objects.equals(bindAddress, that.bindAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localPort, remotePort, bindAddress);
    }

    @Override
    public String toString() {
        return "PortMapping{" +
                "localPort=" + localPort +
                ", remotePort=" + remotePort +
                ", bindAddress='" + bindAddress + '\'' +
                '}';
    }

    public static PortMapping of(int localPort) {
        return newBuilder().withLocalPort(localPort).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer localPort;
        private Integer remotePort;
        private String bindAddress;

        private Builder() {
        }

        public Builder withLocalPort(Integer localPort) {
            this.localPort = localPort;
            return this;
        }

        public Builder withRemotePort(Integer remotePort) {
            this.remotePort = remotePort;
            return this;
        }

        public Builder withBindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public PortMapping build() {
            return new PortMapping(localPort, remotePort, bindAddress);
        }
    }
}
