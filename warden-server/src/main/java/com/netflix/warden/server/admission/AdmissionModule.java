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

package com.netflix.warden.server.admission;

import java.util.LinkedHashSet;
import java.util.Set;
import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;
import com.netflix.archaius.api.Config;
import com.netflix.warden.api.admission.service.AdmissionService;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import com.netflix.warden.server.admission.stage.CreatedByLabelStage;
import com.netflix.warden.server.admission.stage.DefaultResourcesStage;
import com.netflix.warden.server.admission.stage.DefaultTolerationsStage;
import com.netflix.warden.server.admission.stage.NamespaceAutoProvisionStage;
import com.netflix.warden.server.admission.stage.NamespaceLifecycleStage;
import com.netflix.warden.server.admission.stage.PriorityClassAdmissionStage;
import com.netflix.warden.server.admission.stage.PriorityResolutionStage;
import com.netflix.warden.server.admission.stage.WorkloadResourcesStage;
import com.netflix.warden.server.admission.webhook.DefaultWebhookClient;
import com.netflix.warden.server.admission.webhook.WebhookStageFactory;

/**
 * Built-in admission stages are registered with a multibinder, so other modules can contribute their own stages.
 * Webhook stages are created from the configuration.
 */
public class AdmissionModule extends AbstractModule {

    @Override
    protected void configure() {
        Multibinder<AdmissionStage> stages = Multibinder.newSetBinder(binder(), AdmissionStage.class);
        stages.addBinding().to(NamespaceAutoProvisionStage.class);
        stages.addBinding().to(CreatedByLabelStage.class);
        stages.addBinding().to(PriorityResolutionStage.class);
        stages.addBinding().to(DefaultResourcesStage.class);
        stages.addBinding().to(DefaultTolerationsStage.class);
        stages.addBinding().to(NamespaceLifecycleStage.class);
        stages.addBinding().to(PriorityClassAdmissionStage.class);
        stages.addBinding().to(WorkloadResourcesStage.class);
    }

    @Provides
    @Singleton
    public AdmissionConfiguration getAdmissionConfiguration(Config config) {
        return Archaius2Ext.newConfiguration(AdmissionConfiguration.class, config);
    }

    @Provides
    @Singleton
    public AdmissionService getAdmissionService(AdmissionConfiguration configuration,
                                                Set<AdmissionStage> builtInStages,
                                                Config config,
                                                WardenRuntime runtime) {
        WebhookStageFactory webhookStageFactory = new WebhookStageFactory(
                (name, url) -> new DefaultWebhookClient(name, url, runtime)
        );
        Set<AdmissionStage> allStages = new LinkedHashSet<>(builtInStages);
        allStages.addAll(webhookStageFactory.createStages(config));
        return new DefaultAdmissionService(configuration, allStages, runtime);
    }
}
