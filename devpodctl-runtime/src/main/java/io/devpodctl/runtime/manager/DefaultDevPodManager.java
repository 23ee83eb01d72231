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

package io.devpodctl.runtime.manager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.CachedDevPod;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.api.service.DevPodException;
import io.devpodctl.api.service.PodReplacer;
import io.devpodctl.api.service.RemoteCache;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.util.concurrent.LockFactory;
import io.devpodctl.common.util.concurrent.TaskTree;
import io.devpodctl.common.util.retry.Retryer;
import io.devpodctl.common.util.retry.Retryers;
import io.devpodctl.runtime.DevPodConfiguration;
import io.devpodctl.runtime.session.DevPodSession;
import io.devpodctl.runtime.session.DevPodSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DefaultDevPodManager implements DevPodManager {

    private static final Logger logger = LoggerFactory.getLogger(DefaultDevPodManager.class);

    private static final String METRIC_ROOT = "devpod.manager.";

    private final LockFactory lockFactory;
    private final DevPodSessionFactory sessionFactory;
    private final RemoteCache remoteCache;
    private final PodReplacer podReplacer;
    private final DevPodConfiguration configuration;
    private final DevPodRuntime runtime;

    private final Counter restartsCounter;
    private final Counter conflictsCounter;

    private final Object registryLock = new Object();
    private final Map<String, DevPodSession> sessions = new HashMap<>();

    @Inject
    public DefaultDevPodManager(LockFactory lockFactory,
                                DevPodSessionFactory sessionFactory,
                                RemoteCache remoteCache,
                                PodReplacer podReplacer,
                                DevPodConfiguration configuration,
                                DevPodRuntime runtime) {
        this.lockFactory = lockFactory;
        this.sessionFactory = sessionFactory;
        this.remoteCache = remoteCache;
        this.podReplacer = podReplacer;
        this.configuration = configuration;
        this.runtime = runtime;

        Registry registry = runtime.getRegistry();
        this.restartsCounter = registry.counter(METRIC_ROOT + "restarts");
        this.conflictsCounter = registry.counter(METRIC_ROOT + "conflicts");
        PolledMeter.using(registry).withName(METRIC_ROOT + "activeSessions").monitorValue(this, DefaultDevPodManager::countAliveSessions);
    }

    @Override
    public void startMultiple(DevPodContext context, List<String> selected) throws InterruptedException {
        if (context.getConfig() == null) {
            throw DevPodException.configurationMissing("dev pod configuration");
        }
        TaskTree tree = TaskTree.newTree("devpod-manager", context.getCancellation(), runtime.getWorkerPool());
        for (DevPod devPod : context.getConfig().getDevPods().values()) {
            if (!selected.isEmpty() && !selected.contains(devPod.getName())) {
                continue;
            }
            // Sessions outlive the start tree, so they are bound to the caller context.
            tree.spawn(memberContext -> start(context, devPod));
        }
        Optional<Throwable> error = tree.join();
        if (error.isPresent()) {
            Throwable cause = error.get();
            if (cause instanceof DevPodException) {
                throw (DevPodException) cause;
            }
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            throw DevPodException.sessionFailed(devPodNamesOf(context, selected), cause);
        }
    }

    @Override
    public void start(DevPodContext context, DevPod devPod) throws InterruptedException {
        startSession(context, devPod, false);
    }

    @Override
    public void reset(DevPodContext context, String name) throws InterruptedException, ClusterClientException {
        Lock lock = lockFactory.getLock(name);
        lock.lockInterruptibly();
        try {
            stopLocked(name);
            Optional<CachedDevPod> cached = remoteCache.getDevPod(name);
            if (cached.isPresent()) {
                boolean reverted = podReplacer.revertReplacePod(context, cached.get());
                logger.debug("[{}] Pod replacement reverted: {}", name, reverted);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop(String name) throws InterruptedException {
        Lock lock = lockFactory.getLock(name);
        lock.lockInterruptibly();
        try {
            stopLocked(name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void waitForAll() throws InterruptedException {
        List<DevPodSession> snapshot;
        synchronized (registryLock) {
            snapshot = new ArrayList<>(sessions.values());
        }
        for (DevPodSession session : snapshot) {
            session.awaitDone();
        }
    }

    @Override
    public Optional<DevPodSession> getSession(String name) {
        synchronized (registryLock) {
            return Optional.ofNullable(sessions.get(name));
        }
    }

    @Override
    public Set<String> getDevPodNames() {
        synchronized (registryLock) {
            return Collections.unmodifiableSet(new TreeSet<>(sessions.keySet()));
        }
    }

    /**
     * Starts a new session for the dev pod. A restart is abandoned (false returned) if the dev pod is no longer
     * registered, as it was stopped or reset after it lost its connection.
     */
    private boolean startSession(DevPodContext context, DevPod devPod, boolean restart) throws InterruptedException {
        String name = devPod.getName();
        DevPodSession session;

        Lock lock = lockFactory.getLock(name);
        lock.lockInterruptibly();
        try {
            synchronized (registryLock) {
                DevPodSession existing = sessions.get(name);
                if (restart && existing == null) {
                    return false;
                }
                if (existing != null && existing.isAlive()) {
                    conflictsCounter.increment();
                    throw DevPodException.alreadyExists(name);
                }
                session = sessionFactory.newSession(name);
                sessions.put(name, session);
            }
            session.start(context, devPod);
        } finally {
            lock.unlock();
        }

        session.whenDone().subscribe(
                next -> {
                },
                e -> logger.warn("[{}] Unexpected error while waiting for the dev pod session to complete", name, e),
                () -> onSessionDone(context, devPod, session)
        );
        return true;
    }

    /**
     * Must be called with the dev pod lock held. The session is stopped outside of the registry lock, so other
     * dev pods are not blocked while it terminates.
     */
    private void stopLocked(String name) throws InterruptedException {
        DevPodSession session;
        synchronized (registryLock) {
            session = sessions.remove(name);
        }
        if (session != null) {
            session.stop();
            logger.info("[{}] Dev pod stopped", name);
        }
    }

    private void onSessionDone(DevPodContext context, DevPod devPod, DevPodSession session) {
        if (context.isDone()) {
            session.markStopped();
            return;
        }
        Optional<Throwable> error = session.getError();
        if (!error.isPresent() || !DevPodException.isLostConnection(error.get())) {
            return;
        }
        session.markRestarting();
        try {
            runtime.getWorkerPool().execute(() -> restart(context, devPod, session));
        } catch (RejectedExecutionException e) {
            logger.warn("[{}] Cannot restart the dev pod; the worker pool is shut down", devPod.getName());
            session.markStopped();
        }
    }

    private void restart(DevPodContext context, DevPod devPod, DevPodSession deadSession) {
        String name = devPod.getName();
        Retryer retryer = Retryers.interval(configuration.getLostConnectionRestartIntervalMs(), TimeUnit.MILLISECONDS);
        while (true) {
            if (context.isDone()) {
                deadSession.markStopped();
                return;
            }
            restartsCounter.increment();
            try {
                if (startSession(context, devPod, true)) {
                    logger.info("[{}] Dev pod restarted", name);
                } else {
                    logger.info("[{}] Dev pod removed; restart abandoned", name);
                    deadSession.markStopped();
                }
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (DevPodException e) {
                if (context.isDone() || DevPodException.hasErrorCode(e, DevPodException.ErrorCode.AlreadyExists)) {
                    return;
                }
                context.getLog().info("Restart dev {} because of: {}", name, e.getMessage());
            }

            long delayMs = retryer.getDelayMs().orElse(0L);
            try {
                if (context.getCancellation().await(Duration.ofMillis(delayMs))) {
                    deadSession.markStopped();
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            retryer = retryer.retry();
        }
    }

    private int countAliveSessions() {
        synchronized (registryLock) {
            return (int) sessions.values().stream().filter(DevPodSession::isAlive).count();
        }
    }

    private static String devPodNamesOf(DevPodContext context, List<String> selected) {
        return selected.isEmpty() ? String.join(",", context.getConfig().getDevPods().keySet()) : String.join(",", selected);
    }
}
