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

import com.google.common.collect.ImmutableSet;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.StageMatcher;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.api.priority.model.PriorityClass;
import com.netflix.warden.api.priority.service.PriorityClassException;
import com.netflix.warden.api.priority.service.PriorityClassRegistry;
import com.netflix.warden.server.payload.PriorityClassPayloads;
import reactor.core.publisher.Mono;

/**
 * Validates priority class creation and updates. A second default class is rejected with
 * {@link PriorityClassException.ErrorCode#DuplicateDefaultPriorityClass}. The registry checks this condition
 * again when the class is stored, so concurrent requests cannot both succeed.
 */
@Singleton
public class PriorityClassAdmissionStage implements AdmissionStage {

    public static final String NAME = "PriorityClassAdmission";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Validating)
            .withOrder(200)
            .withMatcher(StageMatcher.newBuilder()
                    .withKinds(ImmutableSet.of(ResourceKinds.PRIORITY_CLASS))
                    .withOperations(ImmutableSet.of(Operation.CREATE, Operation.UPDATE))
                    .build()
            )
            .build();

    private final PriorityClassRegistry priorityClassRegistry;

    @Inject
    public PriorityClassAdmissionStage(PriorityClassRegistry priorityClassRegistry) {
        this.priorityClassRegistry = priorityClassRegistry;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        return Mono.fromCallable(() -> {
            PriorityClass requested;
            try {
                requested = PriorityClassPayloads.toPriorityClass(request.getPayload());
            } catch (IllegalArgumentException e) {
                return StageDecision.deny(e.getMessage());
            }
            if (requested.getValue() > PriorityClass.HIGHEST_USER_DEFINABLE_PRIORITY) {
                return StageDecision.deny(String.format("priority class value %s exceeds the user definable maximum %s",
                        requested.getValue(), PriorityClass.HIGHEST_USER_DEFINABLE_PRIORITY));
            }

            if (request.getOperation() == Operation.UPDATE) {
                Optional<PriorityClass> existing = priorityClassRegistry.find(requested.getName());
                if (!existing.isPresent()) {
                    throw PriorityClassException.notFound(requested.getName());
                }
                if (existing.get().getValue() != requested.getValue()) {
                    return StageDecision.deny(String.format("priority class %s value cannot be changed", requested.getName()));
                }
            }

            if (requested.isDefault()) {
                Optional<PriorityClass> currentDefault = priorityClassRegistry.findDefault();
                if (currentDefault.isPresent() && !currentDefault.get().getName().equals(requested.getName())) {
                    throw PriorityClassException.duplicateDefault(requested, currentDefault.get());
                }
            }
            return StageDecision.allow();
        });
    }
}
