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

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.CachedDevPod;

/**
 * Replaces workload pods with dev pods, and reverts the replacement.
 */
public interface PodReplacer {

    /**
     * Restores the workload replaced for a dev pod.
     *
     * @return true if anything was reverted
     */
    boolean revertReplacePod(DevPodContext context, CachedDevPod devPod) throws ClusterClientException;
}
