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

package com.netflix.warden.server;

import com.google.inject.AbstractModule;
import com.netflix.archaius.api.Config;
import com.netflix.warden.api.namespace.service.NamespaceRegistry;
import com.netflix.warden.api.priority.service.PriorityClassRegistry;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.runtime.WardenRuntimes;
import com.netflix.warden.server.admission.AdmissionModule;
import com.netflix.warden.server.binding.BindingStoreModule;
import com.netflix.warden.server.gateway.GatewayModule;
import com.netflix.warden.server.namespace.InMemoryNamespaceRegistry;
import com.netflix.warden.server.priority.DefaultPriorityClassRegistry;
import com.netflix.warden.server.scheduler.SchedulerModule;

/**
 * Top level module wiring the admission pipeline, the registries, the scheduler and the request gateway.
 */
public class WardenModule extends AbstractModule {

    private final Config config;
    private final WardenRuntime runtime;

    public WardenModule(Config config) {
        this(config, WardenRuntimes.internal());
    }

    public WardenModule(Config config, WardenRuntime runtime) {
        this.config = config;
        this.runtime = runtime;
    }

    @Override
    protected void configure() {
        bind(Config.class).toInstance(config);
        bind(WardenRuntime.class).toInstance(runtime);

        bind(NamespaceRegistry.class).to(InMemoryNamespaceRegistry.class);
        bind(PriorityClassRegistry.class).to(DefaultPriorityClassRegistry.class);

        install(new BindingStoreModule());
        install(new SchedulerModule());
        install(new AdmissionModule());
        install(new GatewayModule());
    }
}
