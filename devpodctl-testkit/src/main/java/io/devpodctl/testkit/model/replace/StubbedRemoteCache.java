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

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.devpodctl.api.model.CachedDevPod;
import io.devpodctl.api.service.RemoteCache;

public class StubbedRemoteCache implements RemoteCache {

    private final Map<String, CachedDevPod> devPods = new ConcurrentHashMap<>();

    public StubbedRemoteCache addDevPod(CachedDevPod devPod) {
        devPods.put(devPod.getName(), devPod);
        return this;
    }

    @Override
    public Optional<CachedDevPod> getDevPod(String name) {
        return Optional.ofNullable(devPods.get(name));
    }
}
