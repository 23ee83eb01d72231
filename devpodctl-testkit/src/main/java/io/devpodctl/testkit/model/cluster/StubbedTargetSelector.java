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

package io.devpodctl.testkit.model.cluster;

import java.util.Optional;

import io.devpodctl.api.model.Pod;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.api.service.TargetSelector;
import io.devpodctl.common.util.concurrent.CancellationContext;
import io.devpodctl.common.util.log.SessionLog;

class StubbedTargetSelector implements TargetSelector {

    private final StubbedClusterClient client;
    private final String devPodName;
    private final String container;

    StubbedTargetSelector(StubbedClusterClient client, String devPodName, String container) {
        this.client = client;
        this.devPodName = devPodName;
        this.container = container;
    }

    @Override
    public Optional<String> getContainer() {
        return Optional.ofNullable(container);
    }

    @Override
    public TargetSelector withContainer(String container) {
        return new StubbedTargetSelector(client, devPodName, container);
    }

    @Override
    public Optional<Pod> selectSinglePod(CancellationContext context, SessionLog log) throws ClusterClientException {
        return client.selectPod(devPodName);
    }
}
