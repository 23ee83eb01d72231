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
 * Remote cache record of a pod substitution made for a dev pod. It holds enough information to revert the
 * replaced workload to its original state.
 */
public class CachedDevPod {

    private final String name;
    private final String namespace;
    private final String targetKind;
    private final String targetName;
    private final String replacedPodName;

    public CachedDevPod(String name, String namespace, String targetKind, String targetName, String replacedPodName) {
        this.name = name;
        this.namespace = namespace;
        this.targetKind = targetKind;
        this.targetName = targetName;
        this.replacedPodName = replacedPodName;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Kind of the workload whose pod was replaced (for example 'Deployment').
     */
    public String getTargetKind() {
        return targetKind;
    }

    public String getTargetName() {
        return targetName;
    }

    public String getReplacedPodName() {
        return replacedPodName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CachedDevPod that = (CachedDevPod) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(targetKind, that.targetKind) &&
                Objects.equals(targetName, that.targetName) &&
                Objects.equals(replacedPodName, that.replacedPodName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, targetKind, targetName, replacedPodName);
    }

    @Override
    public String toString() {
        return "CachedDevPod{" +
                "name='" + name + '\'' +
                ", namespace='" + namespace + '\'' +
                ", targetKind='" + targetKind + '\'' +
                ", targetName='" + targetName + '\'' +
                ", replacedPodName='" + replacedPodName + '\'' +
                '}';
    }
}
