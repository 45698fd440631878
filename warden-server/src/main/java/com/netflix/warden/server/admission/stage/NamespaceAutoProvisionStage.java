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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
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
import com.netflix.warden.api.namespace.service.NamespaceRegistry;
import com.netflix.warden.common.util.StringExt;
import reactor.core.publisher.Mono;

/**
 * Marks requests targeting a namespace that does not exist yet. The namespace itself is created by the gateway,
 * once the request is admitted, so a request rejected later in the pipeline leaves nothing behind.
 */
@Singleton
public class NamespaceAutoProvisionStage implements AdmissionStage {

    public static final String NAME = "NamespaceAutoProvision";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Mutating)
            .withOrder(100)
            .withMatcher(StageMatcher.newBuilder().withOperations(ImmutableSet.of(Operation.CREATE)).build())
            .build();

    private final NamespaceRegistry namespaceRegistry;

    @Inject
    public NamespaceAutoProvisionStage(NamespaceRegistry namespaceRegistry) {
        this.namespaceRegistry = namespaceRegistry;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        if (!ResourceKinds.isNamespaced(request.getKind()) || StringExt.isEmpty(request.getNamespace())) {
            return Mono.just(StageDecision.noChange());
        }
        if (namespaceRegistry.find(request.getNamespace()).isPresent()) {
            return Mono.just(StageDecision.noChange());
        }

        ObjectNode payload = request.getPayload();
        Patch.Builder builder = Patch.newBuilder();
        String annotations = StagePatches.ensureObject(payload, builder, PayloadFields.METADATA, PayloadFields.ANNOTATIONS);
        builder.add(StagePatches.child(annotations, PayloadFields.PROVISION_NAMESPACE_ANNOTATION), "true");
        return Mono.just(StageDecision.patch(builder.build()));
    }

    public static boolean isMarkedForProvisioning(AdmissionRequest request) {
        return "true".equals(request.getPayload()
                .path(PayloadFields.METADATA)
                .path(PayloadFields.ANNOTATIONS)
                .path(PayloadFields.PROVISION_NAMESPACE_ANNOTATION)
                .asText(""));
    }
}
