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

package com.netflix.warden.server.admission.stage;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.StageMatcher;
import com.netflix.warden.api.admission.model.patch.Patch;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import com.netflix.warden.server.payload.PodPayloads;
import reactor.core.publisher.Mono;

/**
 * Fills in missing pod resource requests with configured defaults.
 */
@Singleton
public class DefaultResourcesStage implements AdmissionStage {

    public static final String NAME = "DefaultResources";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Mutating)
            .withOrder(400)
            .withMatcher(StageMatcher.forKind(ResourceKinds.POD, Operation.CREATE))
            .build();

    private final AdmissionConfiguration configuration;

    @Inject
    public DefaultResourcesStage(AdmissionConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        return Mono.fromCallable(() -> {
            ObjectNode payload = request.getPayload();
            boolean cpuMissing = !PodPayloads.getRequestedCpu(payload).isPresent();
            boolean memoryMissing = !PodPayloads.getRequestedMemoryMB(payload).isPresent();
            if (!cpuMissing && !memoryMissing) {
                return StageDecision.noChange();
            }

            Patch.Builder builder = Patch.newBuilder();
            String requests = StagePatches.ensureObject(payload, builder, PayloadFields.SPEC, PayloadFields.RESOURCES, PayloadFields.REQUESTS);
            if (cpuMissing) {
                builder.add(StagePatches.child(requests, PayloadFields.CPU), DoubleNode.valueOf(configuration.getDefaultCpu()));
            }
            if (memoryMissing) {
                builder.add(StagePatches.child(requests, PayloadFields.MEMORY_MB), LongNode.valueOf(configuration.getDefaultMemoryMB()));
            }
            return StageDecision.patch(builder.build());
        });
    }
}
