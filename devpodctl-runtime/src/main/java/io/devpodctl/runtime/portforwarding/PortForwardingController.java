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

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.service.TargetSelector;
import io.devpodctl.common.util.concurrent.TaskTree;

/**
 * Establishes and supervises the port forwarding of a dev pod.
 */
public interface PortForwardingController {

    /**
     * Starts the forward port mappings of the dev pod, and the reverse port mappings of each of its dev
     * containers. Each mapping set is established by a member of the given tree, and after a successful
     * establishment watched by another member, which re-establishes the forwarding when it breaks.
     * <p>
     * Blocks until every mapping set is either ready or failed. Failures are reported through the tree.
     */
    void startPortForwarding(DevPodContext context, DevPod devPod, TargetSelector selector, TaskTree parent) throws InterruptedException;
}
