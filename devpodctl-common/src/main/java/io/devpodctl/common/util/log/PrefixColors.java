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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Deterministic assignment of a prefix color to a name.
 */
public final class PrefixColors {

    public static final List<AnsiColor> PALETTE = Collections.unmodifiableList(Arrays.asList(
            AnsiColor.Blue,
            AnsiColor.Green,
            AnsiColor.Yellow,
            AnsiColor.Magenta,
            AnsiColor.Cyan,
            AnsiColor.BoldWhite
    ));

    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed();

    private PrefixColors() {
    }

    public static AnsiColor forName(String name) {
        int hash = HASH_FUNCTION.hashString(name, StandardCharsets.UTF_8).asInt();
        return PALETTE.get(Math.floorMod(hash, PALETTE.size()));
    }
}
