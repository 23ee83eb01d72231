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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The 'dev' section of a project configuration: dev pods keyed by name, in declaration order.
 */
public class DevConfig {

    private static final DevConfig EMPTY = new DevConfig(Collections.emptyMap());

    private final Map<String, DevPod> devPods;

    private DevConfig(Map<String, DevPod> devPods) {
        this.devPods = devPods;
    }

    public Map<String, DevPod> getDevPods() {
        return devPods;
    }

    public Optional<DevPod> findDevPod(String name) {
        return Optional.ofNullable(devPods.get(name));
    }

    @Override
    public String toString() {
        return "DevConfig{" +
                "devPods=" + devPods.keySet() +
                '}';
    }

    public static DevConfig empty() {
        return EMPTY;
    }

    public static DevConfig of(List<DevPod> devPods) {
        Map<String, DevPod> byName = new LinkedHashMap<>();
        devPods.forEach(devPod -> byName.put(devPod.getName(), devPod));
        return new DevConfig(Collections.unmodifiableMap(byName));
    }

    public static DevConfig of(DevPod... devPods) {
        Map<String, DevPod> byName = new LinkedHashMap<>();
        for (DevPod devPod : devPods) {
            byName.put(devPod.getName(), devPod);
        }
        return new DevConfig(Collections.unmodifiableMap(byName));
    }
}
