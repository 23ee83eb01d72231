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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Registry;
import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevContainer;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.model.Pod;
import io.devpodctl.api.model.PortMapping;
import io.devpodctl.api.service.ClusterClient;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.api.service.DevPodException;
import io.devpodctl.api.service.HookExecutionException;
import io.devpodctl.api.service.HookExecutor;
import io.devpodctl.api.service.PortForwarder;
import io.devpodctl.api.service.TargetSelector;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.util.NetworkExt;
import io.devpodctl.common.util.concurrent.TaskTree;
import io.devpodctl.common.util.log.SessionLog;
import io.devpodctl.common.util.log.SessionLogs;
import io.devpodctl.common.util.retry.Retryer;
import io.devpodctl.common.util.retry.Retryers;
import io.devpodctl.runtime.DevPodConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

@Singleton
public class DefaultPortForwardingController implements PortForwardingController {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPortForwardingController.class);

    private static final String METRIC_ROOT = "devpod.portForwarding.";

    private final ClusterClient clusterClient;
    private final HookExecutor hookExecutor;
    private final SessionLogs sessionLogs;
    private final DevPodConfiguration configuration;
    private final DevPodRuntime runtime;
    private final Registry registry;

    @Inject
    public DefaultPortForwardingController(ClusterClient clusterClient,
                                           HookExecutor hookExecutor,
                                           SessionLogs sessionLogs,
                                           DevPodConfiguration configuration,
                                           DevPodRuntime runtime) {
        this.clusterClient = clusterClient;
        this.hookExecutor = hookExecutor;
        this.sessionLogs = sessionLogs;
        this.configuration = configuration;
        this.runtime = runtime;
        this.registry = runtime.getRegistry();
    }

    @Override
    public void startPortForwarding(DevPodContext context, DevPod devPod, TargetSelector selector, TaskTree parent) throws InterruptedException {
        if (context.getConfig() == null) {
            throw DevPodException.configurationMissing("dev pod configuration");
        }

        List<CountDownLatch> initDone = new ArrayList<>();
        if (!devPod.getForward().isEmpty()) {
            initDone.add(spawnEstablishment(context, devPod.getName(), PortMappingSet.forward(devPod.getForward()), selector, parent));
        }
        for (DevContainer devContainer : devPod.getDevContainers()) {
            if (devContainer.getReverseForward().isEmpty()) {
                continue;
            }
            TargetSelector containerSelector = devContainer.getContainer() == null
                    ? selector
                    : selector.withContainer(devContainer.getContainer());
            PortMappingSet mappingSet = PortMappingSet.reverse(devContainer.getContainer(), devContainer.getArch(), devContainer.getReverseForward());
            initDone.add(spawnEstablishment(context, devPod.getName(), mappingSet, containerSelector, parent));
        }

        for (CountDownLatch latch : initDone) {
            latch.await();
        }
    }

    private CountDownLatch spawnEstablishment(DevPodContext context,
                                              String devPodName,
                                              PortMappingSet mappingSet,
                                              TargetSelector selector,
                                              TaskTree parent) {
        CountDownLatch initDone = new CountDownLatch(1);
        boolean started = parent.spawn(memberContext -> {
            try {
                startWithHooks(context.withCancellation(memberContext), devPodName, mappingSet, selector, parent);
            } catch (Exception e) {
                // Recorded before the barrier is released, so the caller observes it.
                parent.cancel(e);
                throw e;
            } finally {
                initDone.countDown();
            }
        });
        if (!started) {
            logger.debug("[{}] Task tree {} no longer accepts members; {} not started", devPodName, parent.getName(), mappingSet);
            initDone.countDown();
        }
        return initDone;
    }

    private void startWithHooks(DevPodContext context,
                                String devPodName,
                                PortMappingSet mappingSet,
                                TargetSelector selector,
                                TaskTree parent) throws Exception {
        PortForwardingDirection direction = mappingSet.getDirection();
        hookExecutor.executeHooks(direction.event("start", devPodName), newPayload(mappingSet, null));
        try {
            startForwarding(context, devPodName, mappingSet, selector, parent);
        } catch (Exception e) {
            try {
                hookExecutor.executeHooks(direction.event("error", devPodName), newPayload(mappingSet, e));
            } catch (HookExecutionException hookError) {
                hookError.addSuppressed(e);
                throw hookError;
            }
            throw e;
        }
    }

    private void startForwarding(DevPodContext context,
                                 String devPodName,
                                 PortMappingSet mappingSet,
                                 TargetSelector selector,
                                 TaskTree parent) {
        if (context.isDone()) {
            return;
        }

        Optional<Pod> podOpt;
        try {
            podOpt = selector.selectSinglePod(context.getCancellation(), context.getLog());
        } catch (ClusterClientException e) {
            throw DevPodException.podSelectionFailed(e);
        }
        if (!podOpt.isPresent()) {
            context.getLog().debug("No pod found for {}", mappingSet.getDirection());
            return;
        }
        Pod pod = podOpt.get();

        List<String> ports = new ArrayList<>();
        List<String> addresses = new ArrayList<>();
        List<PortMapping> mappings = mappingSet.getMappings();
        for (int i = 0; i < mappings.size(); i++) {
            PortMapping mapping = mappings.get(i);
            if (mapping.getLocalPort() == null) {
                throw DevPodException.undefinedLocalPort(i);
            }
            int localPort = mapping.getLocalPort();
            if (mappingSet.getDirection() == PortForwardingDirection.Forward && !NetworkExt.isLocalPortAvailable(localPort)) {
                context.getLog().warn("Seems like port {} is already in use. Is another application using that port?", localPort);
            }
            ports.add(localPort + ":" + mapping.getEffectiveRemotePort());
            addresses.add(mapping.getEffectiveBindAddress());
        }

        ForwardHandle handle = new ForwardHandle(pod, ports, addresses);
        PortForwarder forwarder;
        try {
            forwarder = mappingSet.getDirection() == PortForwardingDirection.Forward
                    ? clusterClient.newPortForwarder(pod, ports, addresses, handle)
                    : clusterClient.newReversePortForwarder(pod, mappingSet.getContainer(), ReverseProxyBinaries.forArchitecture(mappingSet.getArch()), ports, addresses, handle);
        } catch (ClusterClientException e) {
            throw DevPodException.portForwardingFailed("Error starting port forwarding", e);
        }
        handle.start(forwarder, runtime.getWorkerPool());

        Duration timeout = Duration.ofMillis(configuration.getPortForwardingReadyTimeoutMs());
        Establishment establishment = Mono.firstWithSignal(
                context.getCancellation().whenCancelled().thenReturn(Establishment.CANCELLED),
                handle.whenReady().thenReturn(Establishment.READY),
                handle.whenFailed().map(Establishment::failed)
        ).timeout(timeout, Mono.just(Establishment.TIMED_OUT)).block();

        switch (establishment.getState()) {
            case Cancelled:
                handle.close();
                return;
            case Failed:
                handle.close();
                registry.counter(METRIC_ROOT + "failures", "direction", mappingSet.getDirection().name()).increment();
                throw DevPodException.portForwardingFailed("Error forwarding ports", establishment.getError());
            case TimedOut:
                handle.close();
                registry.counter(METRIC_ROOT + "failures", "direction", mappingSet.getDirection().name()).increment();
                throw DevPodException.portForwardingTimeout(timeout);
            case Ready:
            default:
                break;
        }

        context.getLog().done("Port forwarding started on {} ({}/{})", String.join(", ", ports), pod.getNamespace(), pod.getName());
        registry.counter(METRIC_ROOT + "established", "direction", mappingSet.getDirection().name()).increment();

        if (!parent.spawn(memberContext -> watch(context.withCancellation(memberContext), devPodName, mappingSet, selector, parent, handle))) {
            handle.close();
        }
    }

    private void watch(DevPodContext context,
                       String devPodName,
                       PortMappingSet mappingSet,
                       TargetSelector selector,
                       TaskTree parent,
                       ForwardHandle handle) throws InterruptedException {
        SessionLog fileLog = sessionLogs.getFileLog(devPodName);
        PortForwardingDirection direction = mappingSet.getDirection();

        Throwable error = Mono.firstWithSignal(
                context.getCancellation().whenCancelled().cast(Throwable.class),
                handle.whenFailed()
        ).block();
        handle.close();
        if (error == null) {
            stopPortForwarding(devPodName, mappingSet, fileLog, parent);
            return;
        }

        fileLog.error("Restarting because: {}", error.getMessage());
        registry.counter(METRIC_ROOT + "restarts", "direction", direction.name()).increment();
        hookExecutor.logExecuteHooks(fileLog, direction.event("restart", devPodName), newPayload(mappingSet, error));

        DevPodContext fileContext = context.withLog(fileLog);
        Retryer retryer = Retryers.interval(configuration.getPortForwardingRetryIntervalMs(), TimeUnit.MILLISECONDS);
        while (true) {
            try {
                startForwarding(fileContext, devPodName, mappingSet, selector, parent);
                return;
            } catch (DevPodException e) {
                hookExecutor.logExecuteHooks(fileLog, direction.event("restart", devPodName), newPayload(mappingSet, e));
                long delayMs = retryer.getDelayMs().orElse(0L);
                fileLog.error("Error restarting port forwarding: {}", e.getMessage());
                fileLog.error("Will try again in {}ms", delayMs);
                if (context.getCancellation().await(Duration.ofMillis(delayMs))) {
                    stopPortForwarding(devPodName, mappingSet, fileLog, parent);
                    return;
                }
                retryer = retryer.retry();
            }
        }
    }

    private void stopPortForwarding(String devPodName, PortMappingSet mappingSet, SessionLog fileLog, TaskTree parent) {
        hookExecutor.logExecuteHooks(fileLog, mappingSet.getDirection().event("stop", devPodName), newPayload(mappingSet, null));
        parent.cancel(null);
        fileLog.done("Stopped port forwarding");
    }

    private Map<String, Object> newPayload(PortMappingSet mappingSet, Throwable error) {
        if (error == null) {
            return Collections.singletonMap(mappingSet.getDirection().getPayloadKey(), mappingSet.getMappings());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(mappingSet.getDirection().getPayloadKey(), mappingSet.getMappings());
        payload.put("error", error);
        return payload;
    }

    private static class Establishment {

        enum State {Ready, Failed, TimedOut, Cancelled}

        static final Establishment READY = new Establishment(State.Ready, null);
        static final Establishment TIMED_OUT = new Establishment(State.TimedOut, null);
        static final Establishment CANCELLED = new Establishment(State.Cancelled, null);

        private final State state;
        private final Throwable error;

        private Establishment(State state, Throwable error) {
            this.state = state;
            this.error = error;
        }

        State getState() {
            return state;
        }

        Throwable getError() {
            return error;
        }

        static Establishment failed(Throwable error) {
            return new Establishment(State.Failed, error);
        }
    }
}
