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

package io.devpodctl.testkit.model.replace;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.CachedDevPod;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.api.service.PodReplacer;

public class StubbedPodReplacer implements PodReplacer {

    private final List<CachedDevPod> reverted = new CopyOnWriteArrayList<>();

    private volatile ClusterClientException revertError;

    public void failWith(ClusterClientException revertError) {
        this.revertError = revertError;
    }

    @Override
    public boolean revertReplacePod(DevPodContext context, CachedDevPod devPod) throws ClusterClientException {
        ClusterClientException error = revertError;
        if (error != null) {
            throw error;
        }
        reverted.add(devPod);
        return devPod.getReplacedPodName() != null;
    }

    public List<CachedDevPod> getReverted() {
        return reverted;
    }
}
