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

package io.devpodctl.runtime.portforwarding;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.google.common.base.Preconditions;
import io.devpodctl.api.model.Pod;
import io.devpodctl.api.service.PortForwarder;
import io.devpodctl.api.service.PortForwarderListener;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Live port forwarding instance of a dev pod. It turns the forwarder callbacks into one-shot readiness and error
 * signals. Only the first error is kept.
 */
class ForwardHandle implements PortForwarderListener {

    private final Pod pod;
    private final List<String> ports;
    private final List<String> addresses;

    private final Sinks.One<Void> readySink = Sinks.one();
    private final Sinks.One<Throwable> errorSink = Sinks.one();

    private volatile PortForwarder forwarder;

    ForwardHandle(Pod pod, List<String> ports, List<String> addresses) {
        this.pod = pod;
        this.ports = ports;
        this.addresses = addresses;
    }

    Mono<Void> whenReady() {
        return readySink.asMono();
    }

    Mono<Throwable> whenFailed() {
        return errorSink.asMono();
    }

    @Override
    public void onReady() {
        readySink.tryEmitEmpty();
    }

    @Override
    public void onError(Throwable error) {
        errorSink.tryEmitValue(error);
    }

    /**
     * Runs the forwarder on the given executor. A failure of {@link PortForwarder#forwardPorts()} is reported as
     * the handle error.
     */
    void start(PortForwarder forwarder, Executor executor) {
        Preconditions.checkState(this.forwarder == null, "Forwarder already started");
        this.forwarder = forwarder;
        try {
            executor.execute(() -> {
                try {
                    forwarder.forwardPorts();
                } catch (Exception e) {
                    onError(e);
                }
            });
        } catch (RejectedExecutionException e) {
            onError(e);
        }
    }

    void close() {
        PortForwarder current = forwarder;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public String toString() {
        return "ForwardHandle{" +
                "pod=" + pod +
                ", ports=" + ports +
                ", addresses=" + addresses +
                '}';
    }
}
