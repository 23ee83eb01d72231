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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lifecycle event hooks can subscribe to. An event has a base name (for example 'start:portForwarding'), the name
 * of the dev pod it is about, and optional alias names (for example 'portForwarding.start').
 */
public class HookEvent {

    private final String name;
    private final String target;
    private final List<String> aliases;

    private HookEvent(String name, String target, List<String> aliases) {
        this.name = name;
        this.target = target;
        this.aliases = aliases;
    }

    public String getName() {
        return name;
    }

    public String getTarget() {
        return target;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * All names matching this event: the target qualified name first, then the base name and the aliases.
     */
    public List<String> getEventNames() {
        List<String> result = new ArrayList<>();
        result.add(name + ':' + target);
        result.add(name);
        result.addAll(aliases);
        return result;
    }

    public HookEvent with(String... moreAliases) {
        List<String> extended = new ArrayList<>(aliases);
        extended.addAll(Arrays.asList(moreAliases));
        return new HookEvent(name, target, Collections.unmodifiableList(extended));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HookEvent hookEvent = (HookEvent) o;
        return Objects.equals(name, hookEvent.name) &&
                Objects.equals(target, hookEvent.target) &&
                Objects.equals(aliases, hookEvent.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, target, aliases);
    }

    @Override
    public String toString() {
        return "HookEvent{" +
                "name='" + name + '\'' +
                ", target='" + target + '\'' +
                ", aliases=" + aliases +
                '}';
    }

    public static HookEvent forSingle(String name, String target) {
        return new HookEvent(name, target, Collections.emptyList());
    }
}
