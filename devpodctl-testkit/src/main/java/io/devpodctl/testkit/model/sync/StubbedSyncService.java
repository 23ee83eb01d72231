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

package io.devpodctl.testkit.model.sync;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.devpodctl.api.context.DevPodContext;
import io.devpodctl.api.model.DevPod;
import io.devpodctl.api.service.SyncService;
import io.devpodctl.api.service.TargetSelector;
import io.devpodctl.common.util.concurrent.TaskTree;

/**
 * {@link SyncService} which runs one idle member per sync configuration. Set {@link #failWith(Exception)} to make
 * the initial synchronization fail, or call {@link #breakSync(Throwable)} to terminate a running sync member.
 */
public class StubbedSyncService implements SyncService {

    private final List<String> startedDevPods = new CopyOnWriteArrayList<>();
    private final List<Long> startTimesNs = new CopyOnWriteArrayList<>();
    private final List<TaskTree> trees = new CopyOnWriteArrayList<>();

    private volatile Exception startError;

    /**
     * Makes subsequent starts fail with the given error, or succeed again if null.
     */
    public void failWith(Exception startError) {
        this.startError = startError;
    }

    @Override
    public void startSync(DevPodContext context, DevPod devPod, TargetSelector selector, TaskTree parent) throws Exception {
        startedDevPods.add(devPod.getName());
        startTimesNs.add(System.nanoTime());
        Exception error = startError;
        if (error != null) {
            throw error;
        }
        trees.add(parent);
        devPod.getSync().forEach(syncConfig -> parent.spawn(memberContext -> {
            context.getLog().debug("Syncing {} to {}", syncConfig.getLocalPath(), syncConfig.getContainerPath());
            memberContext.awaitCancellation();
        }));
    }

    /**
     * Fails the task trees of all running syncs with the given error.
     */
    public void breakSync(Throwable error) {
        trees.forEach(tree -> tree.cancel(error));
    }

    public List<String> getStartedDevPods() {
        return startedDevPods;
    }

    /**
     * {@link System#nanoTime()} of each {@link #startSync} call, in call order.
     */
    public List<Long> getStartTimesNs() {
        return startTimesNs;
    }
}
