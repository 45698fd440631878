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

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.api.namespace.model.Namespace;
import com.netflix.warden.api.namespace.service.NamespaceRegistry;
import com.netflix.warden.common.util.StringExt;
import reactor.core.publisher.Mono;

/**
 * Rejects object creation in namespaces that do not exist or are being terminated, and protects the system
 * namespaces from deletion.
 */
@Singleton
public class NamespaceLifecycleStage implements AdmissionStage {

    public static final String NAME = "NamespaceLifecycle";

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Validating)
            .withOrder(100)
            .build();

    private final NamespaceRegistry namespaceRegistry;

    @Inject
    public NamespaceLifecycleStage(NamespaceRegistry namespaceRegistry) {
        this.namespaceRegistry = namespaceRegistry;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        return Mono.fromCallable(() -> {
            if (ResourceKinds.NAMESPACE.equals(request.getKind())) {
                if (request.getOperation() == Operation.DELETE && NamespaceRegistry.SYSTEM_NAMESPACES.contains(request.getName())) {
                    return StageDecision.deny(String.format("namespace %s is a system namespace and cannot be deleted", request.getName()));
                }
                return StageDecision.allow();
            }
            if (!ResourceKinds.isNamespaced(request.getKind()) || request.getOperation() != Operation.CREATE) {
                return StageDecision.allow();
            }

            String namespace = request.getNamespace();
            if (StringExt.isEmpty(namespace)) {
                return StageDecision.deny(String.format("%s objects must be created in a namespace", request.getKind()));
            }
            Optional<Namespace> found = namespaceRegistry.find(namespace);
            if (!found.isPresent()) {
                return NamespaceAutoProvisionStage.isMarkedForProvisioning(request)
                        ? StageDecision.allow()
                        : StageDecision.deny(String.format("namespace %s does not exist", namespace));
            }
            if (!found.get().isActive()) {
                return StageDecision.deny(String.format("namespace %s is terminating", namespace));
            }
            return StageDecision.allow();
        });
    }
}
