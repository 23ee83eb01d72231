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

package io.devpodctl.common.util.log;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PrefixColorsTest {

    @Test
    public void testColorIsStableForName() {
        assertThat(PrefixColors.forName("api")).isEqualTo(PrefixColors.forName("api"));
        assertThat(PrefixColors.PALETTE).contains(PrefixColors.forName("api"));
    }

    @Test
    public void testNamesSpreadOverPalette() {
        Set<AnsiColor> used = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            used.add(PrefixColors.forName("devpod-" + i));
        }
        assertThat(used).hasSizeGreaterThan(1);
        assertThat(PrefixColors.PALETTE).containsAll(used);
    }
}
