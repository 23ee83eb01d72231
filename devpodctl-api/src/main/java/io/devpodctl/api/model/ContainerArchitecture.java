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

/**
 * CPU architecture of a dev container. Selects the reverse port-forwarding helper binary injected into
 * the container.
 */
public enum ContainerArchitecture {
    Amd64("amd64"),
    Arm64("arm64");

    private final String tag;

    ContainerArchitecture(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static ContainerArchitecture fromTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            return Amd64;
        }
        for (ContainerArchitecture value : values()) {
            if (value.tag.equalsIgnoreCase(tag)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported container architecture: " + tag);
    }
}
