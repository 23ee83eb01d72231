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

package io.devpodctl.runtime;

import java.nio.file.Paths;
import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.api.Config;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.devpodctl.common.runtime.DevPodRuntime;
import io.devpodctl.common.runtime.SystemAbortListener;
import io.devpodctl.common.runtime.internal.DefaultDevPodRuntime;
import io.devpodctl.common.runtime.internal.LoggingSystemAbortListener;
import io.devpodctl.common.util.archaius2.Archaius2Ext;
import io.devpodctl.common.util.concurrent.DefaultLockFactory;
import io.devpodctl.common.util.concurrent.LockFactory;
import io.devpodctl.common.util.log.SessionLogs;
import io.devpodctl.common.util.time.Clocks;
import io.devpodctl.runtime.log.Log4jSessionLogs;
import io.devpodctl.runtime.manager.DefaultDevPodManager;
import io.devpodctl.runtime.manager.DevPodManager;
import io.devpodctl.runtime.portforwarding.DefaultPortForwardingController;
import io.devpodctl.runtime.portforwarding.PortForwardingController;
import io.devpodctl.runtime.session.DefaultDevPodSessionFactory;
import io.devpodctl.runtime.session.DevPodSessionFactory;

/**
 * Dev pod runtime bindings. The cluster facing collaborators ({@link io.devpodctl.api.service.ClusterClient},
 * {@link io.devpodctl.api.service.HookExecutor}, {@link io.devpodctl.api.service.SyncService},
 * {@link io.devpodctl.api.service.RemoteCache} and {@link io.devpodctl.api.service.PodReplacer}) must be bound
 * by the embedding application.
 */
public class DevPodModule extends AbstractModule {

    private final Config config;

    public DevPodModule(Config config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(SystemAbortListener.class).toInstance(LoggingSystemAbortListener.getDefault());
        bind(LockFactory.class).to(DefaultLockFactory.class);
        bind(PortForwardingController.class).to(DefaultPortForwardingController.class);
        bind(DevPodSessionFactory.class).to(DefaultDevPodSessionFactory.class);
        bind(DevPodManager.class).to(DefaultDevPodManager.class);
        bind(DevPodLauncher.class);
    }

    @Provides
    @Singleton
    public DevPodConfiguration getDevPodConfiguration() {
        return Archaius2Ext.newConfiguration(DevPodConfiguration.class, config);
    }

    @Provides
    @Singleton
    public Registry getRegistry() {
        return new DefaultRegistry();
    }

    @Provides
    @Singleton
    public DevPodRuntime getDevPodRuntime(SystemAbortListener systemAbortListener, Registry registry, DevPodConfiguration configuration) {
        return new DefaultDevPodRuntime(systemAbortListener, registry, Clocks.system(), configuration.isSystemExitOnFailure());
    }

    @Provides
    @Singleton
    public SessionLogs getSessionLogs(DevPodConfiguration configuration, DevPodRuntime runtime) {
        return new Log4jSessionLogs(Paths.get(configuration.getSessionLogDirectory()), configuration.isLogTimestamps(), runtime.getClock());
    }
}
