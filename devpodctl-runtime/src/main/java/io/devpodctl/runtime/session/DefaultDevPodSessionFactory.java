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

import javax.inject.Inject;
import javax.inject.Singleton;

import io.devpodctl.api.service.ClusterClient;
import io.devpodctl.api.service.SyncService;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.util.log.SessionLogs;
import io.devpodctl.runtime.portforwarding.PortForwardingController;

@Singleton
public class DefaultDevPodSessionFactory implements DevPodSessionFactory {

    private final ClusterClient clusterClient;
    private final PortForwardingController portForwardingController;
    private final SyncService syncService;
    private final SessionLogs sessionLogs;
    private final DevPodRuntime runtime;

    @Inject
    public DefaultDevPodSessionFactory(ClusterClient clusterClient,
                                       PortForwardingController portForwardingController,
                                       SyncService syncService,
                                       SessionLogs sessionLogs,
                                       DevPodRuntime runtime) {
        this.clusterClient = clusterClient;
        this.portForwardingController = portForwardingController;
        this.syncService = syncService;
        this.sessionLogs = sessionLogs;
        this.runtime = runtime;
    }

    @Override
    public DevPodSession newSession(String name) {
        return new DefaultDevPodSession(name, clusterClient, portForwardingController, syncService, sessionLogs, runtime);
    }
}
