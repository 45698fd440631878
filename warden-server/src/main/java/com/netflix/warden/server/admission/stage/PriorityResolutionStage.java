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

import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
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
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.model.PriorityClass;
import com.netflix.warden.api.priority.service.PriorityClassRegistry;
import com.netflix.warden.server.payload.PodPayloads;
import reactor.core.publisher.Mono;

/**
 * Resolves the pod priority class, and writes the effective priority value and preemption policy into the pod
 * spec. A pod without a class gets the default one. Without a default class, the priority is 0.
 * An unknown class name fails the request with an
 * {@link com.netflix.warden.api.priority.service.PriorityClassException.ErrorCode#UnknownPriorityClass} error.
 */
@Singleton
public class PriorityResolutionStage implements AdmissionStage {

    public static final String NAME = "PriorityResolution";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Mutating)
            .withOrder(300)
            .withMatcher(StageMatcher.forKind(ResourceKinds.POD, Operation.CREATE))
            .build();

    private final PriorityClassRegistry priorityClassRegistry;

    @Inject
    public PriorityResolutionStage(PriorityClassRegistry priorityClassRegistry) {
        this.priorityClassRegistry = priorityClassRegistry;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        return Mono.fromCallable(() -> {
            ObjectNode payload = request.getPayload();
            Optional<String> requestedName = PodPayloads.getPriorityClassName(payload);
            Optional<PriorityClass> resolved = priorityClassRegistry.resolve(requestedName);

            int priority = resolved.map(PriorityClass::getValue).orElse(0);
            PreemptionPolicy preemptionPolicy = resolved.map(PriorityClass::getPreemptionPolicy).orElse(PreemptionPolicy.CanPreemptLower);

            Patch.Builder builder = Patch.newBuilder();
            String spec = StagePatches.ensureObject(payload, builder, PayloadFields.SPEC);
            if (!requestedName.isPresent() && resolved.isPresent()) {
                builder.add(StagePatches.child(spec, PayloadFields.PRIORITY_CLASS_NAME), resolved.get().getName());
            }
            builder.add(StagePatches.child(spec, PayloadFields.PRIORITY), IntNode.valueOf(priority));
            builder.add(StagePatches.child(spec, PayloadFields.PREEMPTION_POLICY), TextNode.valueOf(preemptionPolicy.name()));
            return StageDecision.patch(builder.build());
        });
    }
}
