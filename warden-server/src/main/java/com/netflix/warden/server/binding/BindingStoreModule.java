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

package com.netflix.warden.server.binding;

import java.nio.file.Paths;
import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.api.Config;
import com.netflix.warden.api.binding.service.BindingStore;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.StringExt;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;

public class BindingStoreModule extends AbstractModule {

    @Override
    protected void configure() {
    }

    @Provides
    @Singleton
    public BindingStoreConfiguration getBindingStoreConfiguration(Config config) {
        return Archaius2Ext.newConfiguration(BindingStoreConfiguration.class, config);
    }

    @Provides
    @Singleton
    public BindingStore getBindingStore(BindingStoreConfiguration configuration, WardenRuntime runtime) {
        if (StringExt.isEmpty(configuration.getJournalPath())) {
            return new InMemoryBindingStore(runtime);
        }
        return new JournalingBindingStore(Paths.get(configuration.getJournalPath()), runtime);
    }
}
