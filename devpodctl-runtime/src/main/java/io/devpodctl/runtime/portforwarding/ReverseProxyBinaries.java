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

import io.devpodctl.api.model.ContainerArchitecture;

/**
 * Names of the helper binaries injected into dev containers to accept reverse forwarded connections.
 */
public final class ReverseProxyBinaries {

    private static final String BINARY_PREFIX = "devpod-helper-linux-";

    private ReverseProxyBinaries() {
    }

    public static String forArchitecture(ContainerArchitecture arch) {
        return BINARY_PREFIX + (arch == null ? ContainerArchitecture.Amd64 : arch).getTag();
    }
}
