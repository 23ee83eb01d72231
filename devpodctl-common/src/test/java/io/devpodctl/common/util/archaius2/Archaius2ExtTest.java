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

package io.devpodctl.common.util.archaius2;

import java.util.Collections;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;
import com.netflix.archaius.config.MapConfig;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class Archaius2ExtTest {

    @Test
    public void testConfiguration() {
        assertThat(Archaius2Ext.newConfiguration(MyConfig.class).getIntervalMs()).isEqualTo(1000);
    }

    @Test
    public void testConfigurationWithOverrides() {
        MyConfig config = Archaius2Ext.newConfiguration(MyConfig.class, "my.intervalMs", "10", "my.enabled", "false");
        assertThat(config.getIntervalMs()).isEqualTo(10);
        assertThat(config.isEnabled()).isFalse();
    }

    @Test
    public void testConfigurationFromConfig() {
        MapConfig config = new MapConfig(Collections.singletonMap("my.intervalMs", "20"));
        assertThat(Archaius2Ext.newConfiguration(MyConfig.class, config).getIntervalMs()).isEqualTo(20);
    }

    @Configuration(prefix = "my")
    private interface MyConfig {

        @DefaultValue("1000")
        long getIntervalMs();

        @DefaultValue("true")
        boolean isEnabled();
    }
}
