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

public class SyncConfig {

    private final String localPath;
    private final String containerPath;

    public SyncConfig(String localPath, String containerPath) {
        this.localPath = localPath;
        this.containerPath = containerPath;
    }

    public String getLocalPath() {
        return localPath;
    }

    public String getContainerPath() {
        return containerPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SyncConfig that = (SyncConfig) o;
        return Objects.equals(localPath, that.localPath) &&
                Objects.equals(containerPath, that.containerPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localPath, containerPath);
    }

    @Override
    public String toString() {
        return "SyncConfig{" +
                "localPath='" + localPath + '\'' +
                ", containerPath='" + containerPath + '\'' +
                '}';
    }
}
