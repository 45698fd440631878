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

import javax.inject.Singleton;

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
import reactor.core.publisher.Mono;

/**
 * Labels each new pod with the name of the user that created it. A caller provided value is overridden.
 */
@Singleton
public class CreatedByLabelStage implements AdmissionStage {

    public static final String NAME = "CreatedByLabel";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Mutating)
            .withOrder(200)
            .withMatcher(StageMatcher.forKind(ResourceKinds.POD, Operation.CREATE))
            .build();

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        ObjectNode payload = request.getPayload();
        String username = request.getUserInfo().getUsername();

        Patch.Builder builder = Patch.newBuilder();
        String labels = StagePatches.ensureObject(payload, builder, PayloadFields.METADATA, PayloadFields.LABELS);
        builder.add(StagePatches.child(labels, PayloadFields.CREATED_BY_LABEL), username);
        return Mono.just(StageDecision.patch(builder.build()));
    }
}
