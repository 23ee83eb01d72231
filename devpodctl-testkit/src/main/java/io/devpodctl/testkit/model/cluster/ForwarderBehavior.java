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

/**
 * How new stubbed port forwarders behave, once {@link StubbedPortForwarder#forwardPorts()} is called.
 */
public enum ForwarderBehavior {
    /**
     * Signal readiness immediately.
     */
    Ready,

    /**
     * Neither readiness nor error is signalled until the test does it explicitly.
     */
    Silent,

    /**
     * {@link StubbedPortForwarder#forwardPorts()} fails immediately.
     */
    Fail
}
