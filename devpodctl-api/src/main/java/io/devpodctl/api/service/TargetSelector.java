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

import java.util.Optional;

import io.devpodctl.api.model.Pod;
import io.devpodctl.common.util.concurrent.CancellationContext;
import io.devpodctl.common.util.log.SessionLog;

/**
 * Selects the pod (and container) a dev pod session operates on.
 */
public interface TargetSelector {

    /**
     * Container targeted by this selector. Empty for the pod's default container.
     */
    Optional<String> getContainer();

    /**
     * Returns a selector with the same pod selection criteria, targeting the given container.
     */
    TargetSelector withContainer(String container);

    /**
     * Finds the single pod matching the selection criteria.
     *
     * @return empty if no matching pod exists (yet)
     */
    Optional<Pod> selectSinglePod(CancellationContext context, SessionLog log) throws ClusterClientException;
}
