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

package com.netflix.warden.server.admission.webhook;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.netflix.archaius.api.Config;
import com.netflix.warden.api.admission.model.FailurePolicy;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.StageMatcher;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.common.util.StringExt;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds webhook stages from the <tt>warden.admission.webhooks.&lt;name&gt;.*</tt> properties.
 */
public class WebhookStageFactory {

    private static final Logger logger = LoggerFactory.getLogger(WebhookStageFactory.class);

    public static final String WEBHOOKS_PREFIX = "warden.admission.webhooks";

    private final BiFunction<String, String, WebhookClient> clientFactory;

    public WebhookStageFactory(BiFunction<String, String, WebhookClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    public List<AdmissionStage> createStages(Config config) {
        List<AdmissionStage> stages = new ArrayList<>();
        for (String name : Archaius2Ext.getChildNames(config, WEBHOOKS_PREFIX)) {
            WebhookConfiguration webhookConfiguration = Archaius2Ext.newConfiguration(
                    WebhookConfiguration.class, WEBHOOKS_PREFIX + '.' + name, config
            );
            StageDescriptor descriptor = toDescriptor(name, webhookConfiguration);
            logger.info("Configured webhook stage: {}, url={}", descriptor, webhookConfiguration.getUrl());
            stages.add(new WebhookStage(descriptor, clientFactory.apply(name, webhookConfiguration.getUrl())));
        }
        return stages;
    }

    static StageDescriptor toDescriptor(String name, WebhookConfiguration configuration) {
        Preconditions.checkArgument(StringExt.isNotEmpty(configuration.getUrl()), "Webhook %s url not set", name);

        Set<Operation> operations = StringExt.splitByCommaIntoSet(configuration.getOperations()).stream()
                .map(operation -> StringExt.parseEnumIgnoreCase(operation, Operation.class))
                .collect(Collectors.toSet());
        long timeoutMs = configuration.getTimeoutMs();

        return StageDescriptor.newBuilder()
                .withName(name)
                .withKind(StringExt.parseEnumIgnoreCase(configuration.getKind(), StageKind.class))
                .withOrder(configuration.getOrder())
                .withMatcher(StageMatcher.newBuilder()
                        .withKinds(StringExt.splitByCommaIntoSet(configuration.getKinds()))
                        .withOperations(operations)
                        .withNamespaces(StringExt.splitByCommaIntoSet(configuration.getNamespaces()))
                        .build()
                )
                .withTimeout(timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : null)
                .withFailurePolicy(StringExt.parseEnumIgnoreCase(configuration.getFailurePolicy(), FailurePolicy.class))
                .build();
    }
}
