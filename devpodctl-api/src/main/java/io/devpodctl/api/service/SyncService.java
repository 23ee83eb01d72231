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
import io.devpodctl.api.model.DevPod;
import io.devpodctl.common.util.concurrent.TaskTree;

/**
 * File synchronization between local directories and dev containers.
 */
public interface SyncService {

    /**
     * Starts all syncs configured for the dev pod. Blocks until the initial synchronization completed, and leaves
     * the continuous synchronization running as members of the given tree.
     */
    void startSync(DevPodContext context, DevPod devPod, TargetSelector selector, TaskTree parent) throws Exception;
}
