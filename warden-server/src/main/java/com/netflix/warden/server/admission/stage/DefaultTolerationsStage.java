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

import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.StageMatcher;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.api.admission.model.patch.Patch;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.api.scheduler.model.Toleration;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import reactor.core.publisher.Mono;

/**
 * Adds time bounded tolerations of the node not-ready and unreachable taints, unless the pod already tolerates
 * them explicitly.
 */
@Singleton
public class DefaultTolerationsStage implements AdmissionStage {

    public static final String NAME = "DefaultTolerations";

    public static final String NOT_READY_TAINT = "node.kubernetes.io/not-ready";
    public static final String UNREACHABLE_TAINT = "node.kubernetes.io/unreachable";

    private static final List<String> DEFAULT_TOLERATED = ImmutableList.of(NOT_READY_TAINT, UNREACHABLE_TAINT);

    private static final StageDescriptor DESCRIPTOR = StageDescriptor.newBuilder()
            .withName(NAME)
            .withKind(StageKind.Mutating)
            .withOrder(500)
            .withMatcher(StageMatcher.forKind(ResourceKinds.POD, Operation.CREATE))
            .build();

    private final AdmissionConfiguration configuration;

    @Inject
    public DefaultTolerationsStage(AdmissionConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        ObjectNode payload = request.getPayload();
        JsonNode existing = payload.path(PayloadFields.SPEC).path(PayloadFields.TOLERATIONS);

        Patch.Builder builder = Patch.newBuilder();
        boolean arrayPresent = existing.isArray();
        for (String taintKey : DEFAULT_TOLERATED) {
            if (arrayPresent && hasNoExecuteToleration(existing, taintKey)) {
                continue;
            }
            if (!arrayPresent) {
                String spec = StagePatches.ensureObject(payload, builder, PayloadFields.SPEC);
                String tolerations = StagePatches.child(spec, PayloadFields.TOLERATIONS);
                if (existing.isMissingNode()) {
                    builder.add(tolerations, JsonNodeFactory.instance.arrayNode());
                } else {
                    builder.replace(tolerations, JsonNodeFactory.instance.arrayNode());
                }
                arrayPresent = true;
            }
            builder.add(JsonPatches.pointer(PayloadFields.SPEC, PayloadFields.TOLERATIONS, "-"), newToleration(taintKey));
        }
        return Mono.just(StageDecision.patch(builder.build()));
    }

    private ObjectNode newToleration(String taintKey) {
        ObjectNode toleration = JsonNodeFactory.instance.objectNode();
        toleration.put(PayloadFields.KEY, taintKey);
        toleration.put(PayloadFields.OPERATOR, Toleration.Operator.Exists.name());
        toleration.put(PayloadFields.EFFECT, TaintEffect.NoExecute.name());
        toleration.put(PayloadFields.TOLERATION_SECONDS, configuration.getDefaultTolerationSeconds());
        return toleration;
    }

    private static boolean hasNoExecuteToleration(JsonNode tolerations, String taintKey) {
        for (JsonNode toleration : tolerations) {
            String key = toleration.path(PayloadFields.KEY).asText("");
            String effect = toleration.path(PayloadFields.EFFECT).asText("");
            if (key.equals(taintKey) && (effect.isEmpty() || effect.equals(TaintEffect.NoExecute.name()))) {
                return true;
            }
        }
        return false;
    }
}
