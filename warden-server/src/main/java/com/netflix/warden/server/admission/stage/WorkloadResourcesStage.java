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

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.StageMatcher;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import com.netflix.warden.server.payload.PodPayloads;
import reactor.core.publisher.Mono;

@Singleton
public class WorkloadResourcesStage implements AdmissionStage {

    public static final String NAME = "WorkloadResources";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Validating)
            .withOrder(300)
            .withMatcher(StageMatcher.forKind(ResourceKinds.POD, Operation.CREATE))
            .build();

    private final AdmissionConfiguration configuration;

    @Inject
    public WorkloadResourcesStage(AdmissionConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        return Mono.fromCallable(() -> {
            ResourceDimension demand;
            try {
                demand = PodPayloads.getDemand(request.getPayload());
            } catch (IllegalArgumentException e) {
                return StageDecision.deny(e.getMessage());
            }
            if (demand.getCpu() <= 0 || demand.getMemoryMB() <= 0) {
                return StageDecision.deny(String.format("resource requests must be positive: cpu=%s, memoryMB=%s", demand.getCpu(), demand.getMemoryMB()));
            }
            if (demand.getCpu() > configuration.getMaxCpu()) {
                return StageDecision.deny(String.format("requested cpu %s exceeds the limit %s", demand.getCpu(), configuration.getMaxCpu()));
            }
            if (demand.getMemoryMB() > configuration.getMaxMemoryMB()) {
                return StageDecision.deny(String.format("requested memoryMB %s exceeds the limit %s", demand.getMemoryMB(), configuration.getMaxMemoryMB()));
            }
            try {
                PodPayloads.toWorkload(request, 0, 0);
            } catch (IllegalArgumentException e) {
                return StageDecision.deny("invalid pod: " + e.getMessage());
            }
            return StageDecision.allow();
        });
    }
}
