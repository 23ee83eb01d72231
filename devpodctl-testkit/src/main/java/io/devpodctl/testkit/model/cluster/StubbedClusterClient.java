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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.model.Pod;
import io.devpodctl.api.service.ClusterClient;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.api.service.PortForwarder;
import io.devpodctl.api.service.PortForwarderListener;
import io.devpodctl.api.service.TargetSelector;

/**
 * In-memory {@link ClusterClient}. Dev pods are attached to pods with {@link #addPod(String, Pod)}, and every
 * created forwarder is recorded for inspection.
 */
public class StubbedClusterClient implements ClusterClient {

    private final Map<String, Pod> podsByDevPod = new ConcurrentHashMap<>();
    private final List<StubbedPortForwarder> forwarders = new CopyOnWriteArrayList<>();
    private final AtomicInteger selectionCounter = new AtomicInteger();

    private volatile ForwarderBehavior forwarderBehavior = ForwarderBehavior.Ready;
    private volatile ClusterClientException selectionError;

    public StubbedClusterClient addPod(String devPodName, Pod pod) {
        podsByDevPod.put(devPodName, pod);
        return this;
    }

    public void removePod(String devPodName) {
        podsByDevPod.remove(devPodName);
    }

    public void setForwarderBehavior(ForwarderBehavior forwarderBehavior) {
        this.forwarderBehavior = forwarderBehavior;
    }

    /**
     * If not null, pod selection fails with the given error.
     */
    public void setSelectionError(ClusterClientException selectionError) {
        this.selectionError = selectionError;
    }

    public int getSelectionCount() {
        return selectionCounter.get();
    }

    public List<StubbedPortForwarder> getForwarders() {
        return new ArrayList<>(forwarders);
    }

    public List<StubbedPortForwarder> getForwarders(boolean reverse) {
        return forwarders.stream().filter(f -> f.isReverse() == reverse).collect(Collectors.toList());
    }

    public Optional<StubbedPortForwarder> getLastForwarder() {
        return forwarders.isEmpty() ? Optional.empty() : Optional.of(forwarders.get(forwarders.size() - 1));
    }

    @Override
    public TargetSelector newTargetSelector(DevPod devPod) {
        return new StubbedTargetSelector(this, devPod.getName(), devPod.getContainer());
    }

    @Override
    public PortForwarder newPortForwarder(Pod pod, List<String> ports, List<String> addresses, PortForwarderListener listener) {
        return record(new StubbedPortForwarder(pod, null, null, ports, addresses, listener, forwarderBehavior));
    }

    @Override
    public PortForwarder newReversePortForwarder(Pod pod,
                                                 String container,
                                                 String helperBinary,
                                                 List<String> ports,
                                                 List<String> addresses,
                                                 PortForwarderListener listener) {
        return record(new StubbedPortForwarder(pod, container, helperBinary, ports, addresses, listener, forwarderBehavior));
    }

    Optional<Pod> selectPod(String devPodName) throws ClusterClientException {
        selectionCounter.incrementAndGet();
        ClusterClientException error = selectionError;
        if (error != null) {
            throw error;
        }
        return Optional.ofNullable(podsByDevPod.get(devPodName));
    }

    private StubbedPortForwarder record(StubbedPortForwarder forwarder) {
        forwarders.add(forwarder);
        return forwarder;
    }
}
