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

package io.devpodctl.runtime.session;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;

import com.google.common.base.Preconditions;
import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.service.ClusterClient;
import io.devpodctl.api.service.DevPodException;
import io.devpodctl.api.service.SyncService;
import io.devpodctl.api.service.TargetSelector;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.util.concurrent.CancellationContext;
import io.devpodctl.common.util.concurrent.TaskTree;
import io.devpodctl.common.util.log.SessionLog;
import io.devpodctl.common.util.log.SessionLogs;
import io.devpodctl.runtime.portforwarding.PortForwardingController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

public class DefaultDevPodSession implements DevPodSession {

    private static final Logger logger = LoggerFactory.getLogger(DefaultDevPodSession.class);

    private final String name;
    private final ClusterClient clusterClient;
    private final PortForwardingController portForwardingController;
    private final SyncService syncService;
    private final SessionLogs sessionLogs;
    private final DevPodRuntime runtime;

    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final Sinks.Empty<Void> doneSink = Sinks.empty();

    private final Object lock = new Object();
    private DevPodState state = DevPodState.Starting;
    private TaskTree tree;
    private SessionLog log;
    private Throwable error;
    private boolean done;

    public DefaultDevPodSession(String name,
                                ClusterClient clusterClient,
                                PortForwardingController portForwardingController,
                                SyncService syncService,
                                SessionLogs sessionLogs,
                                DevPodRuntime runtime) {
        this.name = name;
        this.clusterClient = clusterClient;
        this.portForwardingController = portForwardingController;
        this.syncService = syncService;
        this.sessionLogs = sessionLogs;
        this.runtime = runtime;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DevPodState getState() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public void start(DevPodContext context, DevPod devPod) throws InterruptedException {
        Preconditions.checkArgument(name.equals(devPod.getName()), "Dev pod %s started in session %s", devPod.getName(), name);

        SessionLog sessionLog = sessionLogs.newSessionLog(name);
        TaskTree sessionTree;
        synchronized (lock) {
            Preconditions.checkState(tree == null && state == DevPodState.Starting, "Session %s already started", name);
            sessionTree = TaskTree.newTree("devpod-" + name, context.getCancellation(), runtime.getWorkerPool());
            this.tree = sessionTree;
            this.log = sessionLog;
        }
        sessionTree.whenJoined().thenAccept(this::onTreeDone);

        // Keeps the session alive until it is cancelled.
        if (!sessionTree.spawn(CancellationContext::awaitCancellation)) {
            logger.debug("[{}] Context cancelled before the dev pod session started", name);
            onTreeDone(sessionTree.join());
            return;
        }

        DevPodContext sessionContext = context.withLog(sessionLog).withCancellation(sessionTree.getContext());
        TargetSelector selector = clusterClient.newTargetSelector(devPod);
        try {
            if (devPod.hasPortForwarding()) {
                portForwardingController.startPortForwarding(sessionContext, devPod, selector, sessionTree);
            }
            if (devPod.hasSync()) {
                syncService.startSync(sessionContext, devPod, selector, sessionTree);
            }
        } catch (InterruptedException e) {
            sessionTree.cancel(e);
            throw e;
        } catch (Exception e) {
            sessionTree.cancel(e);
        }

        Optional<Throwable> startupError = sessionTree.getFirstError();
        if (startupError.isPresent()) {
            sessionTree.cancel(null);
            onTreeDone(sessionTree.join());
            throw toSessionFailure(startupError.get());
        }

        synchronized (lock) {
            if (!done) {
                transition(DevPodState.Running);
            }
        }
        logger.debug("[{}] Dev pod session started", name);
    }

    @Override
    public void stop() throws InterruptedException {
        TaskTree current;
        synchronized (lock) {
            transition(DevPodState.Stopping);
            current = tree;
        }
        if (current == null) {
            onTreeDone(Optional.empty());
        } else {
            current.cancel(null);
            onTreeDone(current.join());
        }
        synchronized (lock) {
            transition(DevPodState.Stopped);
        }
    }

    @Override
    public Mono<Void> whenDone() {
        return doneSink.asMono();
    }

    @Override
    public void awaitDone() throws InterruptedException {
        doneLatch.await();
    }

    @Override
    public boolean isDone() {
        synchronized (lock) {
            return done;
        }
    }

    @Override
    public boolean isAlive() {
        return !isDone();
    }

    @Override
    public Optional<Throwable> getError() {
        synchronized (lock) {
            Preconditions.checkState(done, "Session %s is still running", name);
            return Optional.ofNullable(error);
        }
    }

    @Override
    public void markRestarting() {
        synchronized (lock) {
            transition(DevPodState.Restarting);
        }
    }

    @Override
    public void markStopped() {
        synchronized (lock) {
            transition(DevPodState.Stopped);
        }
    }

    private void onTreeDone(Optional<Throwable> treeError) {
        SessionLog sessionLog;
        synchronized (lock) {
            if (done) {
                return;
            }
            this.done = true;
            this.error = treeError.orElse(null);
            if (error == null || !DevPodException.isLostConnection(error) || state != DevPodState.Running) {
                transition(DevPodState.Stopped);
            }
            sessionLog = log;
        }
        if (error != null && sessionLog != null) {
            sessionLog.error("Dev pod stopped: {}", error.getMessage());
        }
        logger.debug("[{}] Dev pod session done (error={})", name, treeError.map(Throwable::getMessage).orElse("none"));
        doneLatch.countDown();
        doneSink.tryEmitEmpty();
    }

    private void transition(DevPodState next) {
        if (state == next) {
            return;
        }
        if (!state.canTransitionTo(next)) {
            logger.debug("[{}] Ignoring state transition {} -> {}", name, state, next);
            return;
        }
        logger.debug("[{}] State transition {} -> {}", name, state, next);
        this.state = next;
    }

    private DevPodException toSessionFailure(Throwable cause) {
        if (cause instanceof DevPodException) {
            return (DevPodException) cause;
        }
        return DevPodException.sessionFailed(name, cause);
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "DefaultDevPodSession{" +
                    "name='" + name + '\'' +
                    ", state=" + state +
                    ", done=" + done +
                    ", error=" + error +
                    '}';
        }
    }
}
