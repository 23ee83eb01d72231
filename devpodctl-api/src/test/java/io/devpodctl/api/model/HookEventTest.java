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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class HookEventTest {

    @Test
    public void testEventNames() {
        HookEvent event = HookEvent.forSingle("start:portForwarding", "api").with("portForwarding.start");

        assertThat(event.getName()).isEqualTo("start:portForwarding");
        assertThat(event.getEventNames()).containsExactly(
                "start:portForwarding:api",
                "start:portForwarding",
                "portForwarding.start"
        );
    }

    @Test
    public void testWithDoesNotModifyOriginal() {
        HookEvent base = HookEvent.forSingle("stop:sync", "api");
        base.with("sync.stop");
        assertThat(base.getAliases()).isEmpty();
    }
}
