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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.CachedDevPod;
import io.devpodctl.api.model.DevConfig;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.model.Pod;
import io.devpodctl.api.model.PortMapping;
import io.devpodctl.api.model.SyncConfig;
import io.devpodctl.api.service.ClusterClientException;
import io.devpodctl.api.service.DevPodException;
import io.devpodctl.common.runtime.internal.DefaultDevPodRuntime;
import io.devpodctl.common.runtime.internal.LoggingSystemAbortListener;
import io.devpodctl.common.util.archaius2.Archaius2Ext;
import io.devpodctl.common.util.concurrent.CancellationContext;
import io.devpodctl.common.util.concurrent.DefaultLockFactory;
import io.devpodctl.common.util.time.Clocks;
import io.devpodctl.runtime.DevPodConfiguration;
import io.devpodctl.runtime.portforwarding.DefaultPortForwardingController;
import io.devpodctl.runtime.session.DefaultDevPodSessionFactory;
import io.devpodctl.runtime.session.DevPodSession;
import io.devpodctl.runtime.session.DevPodState;
import io.devpodctl.testkit.log.RecordingSessionLogs;
import io.devpodctl.testkit.model.cluster.StubbedClusterClient;
import io.devpodctl.testkit.model.hook.RecordingHookExecutor;
import io.devpodctl.testkit.model.replace.StubbedPodReplacer;
import io.devpodctl.testkit.model.replace.StubbedRemoteCache;
import io.devpodctl.testkit.model.sync.StubbedSyncService;
import org.junit.After;
import org.junit.Test;

import static com.jayway.awaitility.Awaitility.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DefaultDevPodManagerTest {

    private static final long RESTART_INTERVAL_MS = 300;

    private static final DevPod API = DevPod.newBuilder()
            .withName("api")
            .withForward(Collections.singletonList(PortMapping.of(3000)))
            .build();

    private static final DevPod SYNCED = DevPod.newBuilder()
            .withName("synced")
            .withSync(Collections.singletonList(new SyncConfig("./src", "/app")))
            .build();

    private static final DevPod WEB = DevPod.newBuilder().withName("web").build();

    private final Registry registry = new DefaultRegistry();
    private final DefaultDevPodRuntime runtime = new DefaultDevPodRuntime(LoggingSystemAbortListener.getDefault(), registry, Clocks.system(), false);

    private final DevPodConfiguration configuration = Archaius2Ext.newConfiguration(DevPodConfiguration.class,
            "devpod.lostConnectionRestartIntervalMs", Long.toString(RESTART_INTERVAL_MS),
            "devpod.portForwardingReadyTimeoutMs", "1000",
            "devpod.portForwardingRetryIntervalMs", "100"
    );

    private final StubbedClusterClient clusterClient = new StubbedClusterClient()
            .addPod("api", new Pod("default", "api-0"))
            .addPod("web", new Pod("default", "web-0"));
    private final StubbedSyncService syncService = new StubbedSyncService();
    private final RecordingSessionLogs sessionLogs = new RecordingSessionLogs();
    private final StubbedRemoteCache remoteCache = new StubbedRemoteCache();
    private final StubbedPodReplacer podReplacer = new StubbedPodReplacer();

    private final DefaultDevPodManager manager = new DefaultDevPodManager(
            new DefaultLockFactory(),
            new DefaultDevPodSessionFactory(
                    clusterClient,
                    new DefaultPortForwardingController(clusterClient, new RecordingHookExecutor(), sessionLogs, configuration, runtime),
                    syncService,
                    sessionLogs,
                    runtime
            ),
            remoteCache,
            podReplacer,
            configuration,
            runtime
    );

    private final CancellationContext rootContext = CancellationContext.root();
    private final RecordingSessionLogs.RecordingSessionLog callerLog = RecordingSessionLogs.newLog();
    private final DevPodContext context = new DevPodContext(rootContext, DevConfig.of(API, SYNCED, WEB), callerLog);

    @After
    public void tearDown() throws InterruptedException {
        rootContext.cancel(null);
        for (String name : manager.getDevPodNames()) {
            manager.stop(name);
        }
        runtime.getWorkerPool().shutdownNow();
    }

    @Test
    public void testStartAndStopEndToEnd() throws Exception {
        manager.start(context, API);

        assertThat(manager.getDevPodNames()).containsExactly("api");
        assertThat(manager.getSession("api").get().getState()).isEqualTo(DevPodState.Running);
        assertThat(sessionLogs.getConsoleLines("api")).contains("INFO Port forwarding started on 3000:3000 (default/api-0)");
        assertThat(clusterClient.getLastForwarder().get().getAddresses()).containsExactly("localhost");

        manager.stop("api");

        assertThat(manager.getDevPodNames()).doesNotContain("api");
        assertThat(sessionLogs.getFileLines("api")).contains("INFO Stopped port forwarding");
        assertThat(clusterClient.getLastForwarder().get().isClosed()).isTrue();
    }

    @Test
    public void testConcurrentStartsHaveSingleWinner() throws Exception {
        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        try {
            CountDownLatch startLatch = new CountDownLatch(1);
            List<Future<Throwable>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                results.add(executor.submit(startAfter(startLatch, WEB)));
            }
            startLatch.countDown();

            int succeeded = 0;
            int conflicts = 0;
            for (Future<Throwable> result : results) {
                Throwable error = result.get(10, TimeUnit.SECONDS);
                if (error == null) {
                    succeeded++;
                } else if (DevPodException.hasErrorCode(error, DevPodException.ErrorCode.AlreadyExists)) {
                    conflicts++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(conflicts).isEqualTo(attempts - 1);
            assertThat(manager.getSession("web").get().isAlive()).isTrue();
            assertThat(registry.counter("devpod.manager.conflicts").count()).isEqualTo(attempts - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testStartOfRunningDevPodConflicts() throws Exception {
        manager.start(context, WEB);
        assertThatThrownBy(() -> manager.start(context, WEB))
                .isInstanceOf(DevPodException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    public void testStartOnCancelledContextLeavesNoLiveSession() throws Exception {
        CancellationContext cancelled = CancellationContext.root();
        cancelled.cancel(null);
        manager.start(new DevPodContext(cancelled, context.getConfig(), callerLog), API);

        DevPodSession session = manager.getSession("api").get();
        assertThat(session.isAlive()).isFalse();
        assertThat(session.getState()).isEqualTo(DevPodState.Stopped);
        assertThat(clusterClient.getForwarders()).isEmpty();

        CompletableFuture<Void> waitFuture = CompletableFuture.runAsync(() -> {
            try {
                manager.waitForAll();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        waitFuture.get(5, TimeUnit.SECONDS);

        // The dead session does not block a new start with a live context.
        manager.start(context, API);
        assertThat(manager.getSession("api").get().isAlive()).isTrue();
    }

    @Test
    public void testStopIsIdempotent() throws Exception {
        manager.start(context, WEB);
        DevPodSession session = manager.getSession("web").get();

        manager.stop("web");
        manager.stop("web");
        manager.stop("unknown");

        assertThat(manager.getDevPodNames()).isEmpty();
        assertThat(session.getState()).isEqualTo(DevPodState.Stopped);

        // A stopped dev pod can be started again.
        manager.start(context, WEB);
        assertThat(manager.getSession("web").get()).isNotSameAs(session);
    }

    @Test
    public void testLostConnectionRestartsWithBackoff() throws Exception {
        manager.start(context, SYNCED);
        DevPodSession lostSession = manager.getSession("synced").get();

        syncService.failWith(new IOException("cluster unreachable"));
        syncService.breakSync(DevPodException.lostConnection("synced", new IOException("connection reset")));

        // Initial start, immediate restart attempt, then two attempts after the backoff.
        await().atMost(10, TimeUnit.SECONDS).until(() -> syncService.getStartTimesNs().size() >= 4);
        List<Long> startTimes = new ArrayList<>(syncService.getStartTimesNs());
        for (int i = 2; i < 4; i++) {
            assertThat(startTimes.get(i) - startTimes.get(i - 1)).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(RESTART_INTERVAL_MS));
        }
        assertThat(lostSession.getState()).isEqualTo(DevPodState.Restarting);
        assertThat(callerLog.getLines()).anyMatch(line -> line.startsWith("INFO Restart dev synced because of"));

        syncService.failWith(null);
        await().atMost(10, TimeUnit.SECONDS).until(() -> manager.getSession("synced").map(DevPodSession::isAlive).orElse(false));
        assertThat(manager.getSession("synced").get()).isNotSameAs(lostSession);
        assertThat(registry.counter("devpod.manager.restarts").count()).isGreaterThanOrEqualTo(3);

        int attempts = syncService.getStartTimesNs().size();
        Thread.sleep(2 * RESTART_INTERVAL_MS);
        assertThat(syncService.getStartTimesNs()).hasSize(attempts);
    }

    @Test
    public void testRestartAbandonedWhenDevPodStopped() throws Exception {
        manager.start(context, SYNCED);
        DevPodSession lostSession = manager.getSession("synced").get();

        syncService.failWith(new IOException("cluster unreachable"));
        syncService.breakSync(DevPodException.lostConnection("synced", new IOException("connection reset")));
        await().until(() -> syncService.getStartTimesNs().size() >= 2);

        manager.stop("synced");
        Thread.sleep(RESTART_INTERVAL_MS);
        int attempts = syncService.getStartTimesNs().size();
        Thread.sleep(2 * RESTART_INTERVAL_MS);

        assertThat(syncService.getStartTimesNs()).hasSize(attempts);
        assertThat(manager.getDevPodNames()).isEmpty();
        await().until(() -> lostSession.getState() == DevPodState.Stopped);
    }

    @Test
    public void testRestartAbandonedWhenContextCancelled() throws Exception {
        manager.start(context, SYNCED);

        syncService.failWith(new IOException("cluster unreachable"));
        syncService.breakSync(DevPodException.lostConnection("synced", new IOException("connection reset")));
        await().until(() -> syncService.getStartTimesNs().size() >= 2);

        rootContext.cancel(null);
        Thread.sleep(RESTART_INTERVAL_MS);
        int attempts = syncService.getStartTimesNs().size();
        Thread.sleep(2 * RESTART_INTERVAL_MS);

        assertThat(syncService.getStartTimesNs()).hasSize(attempts);
    }

    @Test
    public void testOtherFailuresAreNotRestarted() throws Exception {
        manager.start(context, SYNCED);
        DevPodSession session = manager.getSession("synced").get();

        syncService.breakSync(new IOException("disk full"));

        await().until(session::isDone);
        Thread.sleep(2 * RESTART_INTERVAL_MS);
        assertThat(syncService.getStartTimesNs()).hasSize(1);
        assertThat(session.getState()).isEqualTo(DevPodState.Stopped);
        assertThat(manager.getSession("synced")).isPresent();
        assertThat(session.isAlive()).isFalse();
    }

    @Test
    public void testResetRevertsReplacedPod() throws Exception {
        CachedDevPod cached = new CachedDevPod("web", "default", "Deployment", "web", "web-0");
        remoteCache.addDevPod(cached);
        manager.start(context, WEB);

        manager.reset(context, "web");

        assertThat(manager.getDevPodNames()).isEmpty();
        assertThat(podReplacer.getReverted()).containsExactly(cached);
    }

    @Test
    public void testResetWithoutCachedDevPod() throws Exception {
        manager.start(context, WEB);
        manager.reset(context, "web");

        assertThat(manager.getDevPodNames()).isEmpty();
        assertThat(podReplacer.getReverted()).isEmpty();
    }

    @Test
    public void testResetPropagatesRevertFailure() {
        remoteCache.addDevPod(new CachedDevPod("web", "default", "Deployment", "web", "web-0"));
        ClusterClientException revertError = new ClusterClientException("forbidden");
        podReplacer.failWith(revertError);

        assertThatThrownBy(() -> manager.reset(context, "web")).isSameAs(revertError);
    }

    @Test
    public void testStartMultipleSelected() throws Exception {
        manager.startMultiple(context, Arrays.asList("web", "synced"));
        assertThat(manager.getDevPodNames()).containsExactly("synced", "web");
    }

    @Test
    public void testStartMultipleAll() throws Exception {
        manager.startMultiple(context, Collections.emptyList());
        assertThat(manager.getDevPodNames()).containsExactly("api", "synced", "web");
    }

    @Test
    public void testStartMultiplePropagatesFirstError() {
        syncService.failWith(new IOException("cannot upload"));
        assertThatThrownBy(() -> manager.startMultiple(context, Arrays.asList("web", "synced")))
                .isInstanceOf(DevPodException.class)
                .hasMessageContaining("synced");
    }

    @Test
    public void testWaitForAll() throws Exception {
        manager.startMultiple(context, Arrays.asList("web", "synced"));
        CompletableFuture<Void> waitFuture = CompletableFuture.runAsync(() -> {
            try {
                manager.waitForAll();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        manager.stop("web");
        Thread.sleep(50);
        assertThat(waitFuture).isNotDone();

        manager.stop("synced");
        waitFuture.get(5, TimeUnit.SECONDS);
    }

    private Callable<Throwable> startAfter(CountDownLatch startLatch, DevPod devPod) {
        return () -> {
            startLatch.await();
            try {
                manager.start(context, devPod);
                return null;
            } catch (DevPodException e) {
                return e;
            }
        };
    }
}
