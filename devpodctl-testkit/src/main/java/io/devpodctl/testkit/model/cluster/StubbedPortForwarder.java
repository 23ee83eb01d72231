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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.devpodctl.api.model.Pod;
import io.devpodctl.api.service.PortForwarder;
import io.devpodctl.api.service.PortForwarderListener;

public class StubbedPortForwarder implements PortForwarder {

    private final Pod pod;
    private final String container;
    private final String helperBinary;
    private final List<String> ports;
    private final List<String> addresses;
    private final PortForwarderListener listener;
    private final ForwarderBehavior behavior;

    private final CountDownLatch startedLatch = new CountDownLatch(1);
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    StubbedPortForwarder(Pod pod,
                         String container,
                         String helperBinary,
                         List<String> ports,
                         List<String> addresses,
                         PortForwarderListener listener,
                         ForwarderBehavior behavior) {
        this.pod = pod;
        this.container = container;
        this.helperBinary = helperBinary;
        this.ports = ports;
        this.addresses = addresses;
        this.listener = listener;
        this.behavior = behavior;
    }

    public Pod getPod() {
        return pod;
    }

    /**
     * Target container of a reverse forwarder, null for forward ones.
     */
    public String getContainer() {
        return container;
    }

    public String getHelperBinary() {
        return helperBinary;
    }

    public boolean isReverse() {
        return helperBinary != null;
    }

    public List<String> getPorts() {
        return ports;
    }

    public List<String> getAddresses() {
        return addresses;
    }

    @Override
    public void forwardPorts() throws Exception {
        startedLatch.countDown();
        switch (behavior) {
            case Ready:
                listener.onReady();
                break;
            case Fail:
                throw new IOException("Simulated port forwarding failure on " + pod);
            case Silent:
            default:
                break;
        }
        closedLatch.await();
    }

    @Override
    public void close() {
        closedLatch.countDown();
    }

    public boolean isStarted() {
        return startedLatch.getCount() == 0;
    }

    public boolean isClosed() {
        return closedLatch.getCount() == 0;
    }

    public boolean awaitClosed(long timeout, TimeUnit timeUnit) throws InterruptedException {
        return closedLatch.await(timeout, timeUnit);
    }

    public void signalReady() {
        listener.onReady();
    }

    /**
     * Reports a forwarding error, as if the connection broke after the forwarder became ready.
     */
    public void signalError(Throwable error) {
        listener.onError(error);
    }

    @Override
    public String toString() {
        return "StubbedPortForwarder{" +
                "pod=" + pod +
                ", container='" + container + '\'' +
                ", ports=" + ports +
                ", addresses=" + addresses +
                ", behavior=" + behavior +
                '}';
    }
}
