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

package io.devpodctl.common.util.retry.internal;

import java.util.Optional;

import io.devpodctl.common.util.retry.Retryer;

public class NeverRetryer implements Retryer {

    public static final Retryer INSTANCE = new NeverRetryer();

    private NeverRetryer() {
    }

    @Override
    public Optional<Long> getDelayMs() {
        return Optional.empty();
    }

    @Override
    public Retryer retry() {
        return this;
    }
}
