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

package io.devpodctl.api.service;

/**
 * Receives the asynchronous state changes of a {@link PortForwarder}.
 */
public interface PortForwarderListener {

    /**
     * Invoked once all ports are bound and forwarding.
     */
    void onReady();

    /**
     * Invoked when forwarding cannot be established, or breaks after being established.
     */
    void onError(Throwable error);
}
