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

package com.netflix.warden.server.payload;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.scheduler.model.NodeSelectorRequirement;
import com.netflix.warden.api.scheduler.model.PreferredAffinityTerm;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.api.scheduler.model.Toleration;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.common.util.StringExt;

/**
 * Reads Pod documents. Malformed fields are reported with {@link IllegalArgumentException}.
 */
public final class PodPayloads {

    private PodPayloads() {
    }

    public static String workloadId(String namespace, String name) {
        return StringExt.isEmpty(namespace) ? name : namespace + '/' + name;
    }

    public static Optional<String> getPriorityClassName(ObjectNode payload) {
        JsonNode value = payload.path(PayloadFields.SPEC).path(PayloadFields.PRIORITY_CLASS_NAME);
        return value.isTextual() && !value.asText().isEmpty() ? Optional.of(value.asText()) : Optional.empty();
    }

    public static Optional<Integer> getPriority(ObjectNode payload) {
        JsonNode value = payload.path(PayloadFields.SPEC).path(PayloadFields.PRIORITY);
        return value.isIntegralNumber() ? Optional.of(value.asInt()) : Optional.empty();
    }

    public static Optional<PreemptionPolicy> getPreemptionPolicy(ObjectNode payload) {
        JsonNode value = payload.path(PayloadFields.SPEC).path(PayloadFields.PREEMPTION_POLICY);
        if (!value.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(StringExt.parseEnumIgnoreCase(value.asText(), PreemptionPolicy.class));
    }

    public static Optional<Double> getRequestedCpu(ObjectNode payload) {
        JsonNode value = requests(payload).path(PayloadFields.CPU);
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        Preconditions.checkArgument(value.isNumber(), "spec.resources.requests.cpu must be a number");
        return Optional.of(value.asDouble());
    }

    public static Optional<Long> getRequestedMemoryMB(ObjectNode payload) {
        JsonNode value = requests(payload).path(PayloadFields.MEMORY_MB);
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        Preconditions.checkArgument(value.isIntegralNumber(), "spec.resources.requests.memoryMB must be an integer");
        return Optional.of(value.asLong());
    }

    public static ResourceDimension getDemand(ObjectNode payload) {
        return ResourceDimension.of(getRequestedCpu(payload).orElse(0.0), getRequestedMemoryMB(payload).orElse(0L));
    }

    public static List<Toleration> getTolerations(ObjectNode payload) {
        JsonNode tolerations = payload.path(PayloadFields.SPEC).path(PayloadFields.TOLERATIONS);
        List<Toleration> result = new ArrayList<>();
        if (!tolerations.isArray()) {
            return result;
        }
        for (JsonNode toleration : tolerations) {
            String operator = toleration.path(PayloadFields.OPERATOR).asText(Toleration.Operator.Equal.name());
            String effect = toleration.path(PayloadFields.EFFECT).asText("");
            JsonNode seconds = toleration.path(PayloadFields.TOLERATION_SECONDS);
            result.add(new Toleration(
                    toleration.path(PayloadFields.KEY).asText(""),
                    StringExt.parseEnumIgnoreCase(operator, Toleration.Operator.class),
                    toleration.path(PayloadFields.VALUE).asText(""),
                    effect.isEmpty() ? null : StringExt.parseEnumIgnoreCase(effect, TaintEffect.class),
                    seconds.isIntegralNumber() ? Optional.of(seconds.asLong()) : Optional.empty()
            ));
        }
        return result;
    }

    public static List<NodeSelectorRequirement> getRequiredAffinity(ObjectNode payload) {
        return parseRequirements(payload.path(PayloadFields.SPEC).path(PayloadFields.AFFINITY).path(PayloadFields.REQUIRED));
    }

    public static List<PreferredAffinityTerm> getPreferredAffinity(ObjectNode payload) {
        JsonNode terms = payload.path(PayloadFields.SPEC).path(PayloadFields.AFFINITY).path(PayloadFields.PREFERRED);
        List<PreferredAffinityTerm> result = new ArrayList<>();
        if (!terms.isArray()) {
            return result;
        }
        for (JsonNode term : terms) {
            result.add(new PreferredAffinityTerm(
                    term.path(PayloadFields.WEIGHT).asInt(PreferredAffinityTerm.MIN_WEIGHT),
                    parseRequirements(term.path(PayloadFields.REQUIREMENTS))
            ));
        }
        return result;
    }

    /**
     * Builds a workload from an admitted Pod creation request. The priority fields must already be resolved.
     */
    public static Workload toWorkload(AdmissionRequest request, long creationSequence, long creationTimestamp) {
        ObjectNode payload = request.getPayload();
        String name = request.getName();
        Preconditions.checkArgument(StringExt.isNotEmpty(name), "metadata.name not set");
        return Workload.newBuilder()
                .withId(workloadId(request.getNamespace(), name))
                .withNamespace(request.getNamespace())
                .withName(name)
                .withPriorityClassName(getPriorityClassName(payload).orElse(""))
                .withPriority(getPriority(payload).orElse(0))
                .withPreemptionPolicy(getPreemptionPolicy(payload).orElse(PreemptionPolicy.CanPreemptLower))
                .withDemand(getDemand(payload))
                .withTolerations(getTolerations(payload))
                .withRequiredAffinity(getRequiredAffinity(payload))
                .withPreferredAffinity(getPreferredAffinity(payload))
                .withCreationSequence(creationSequence)
                .withCreationTimestamp(creationTimestamp)
                .build();
    }

    private static JsonNode requests(ObjectNode payload) {
        return payload.path(PayloadFields.SPEC).path(PayloadFields.RESOURCES).path(PayloadFields.REQUESTS);
    }

    static List<NodeSelectorRequirement> parseRequirements(JsonNode requirements) {
        List<NodeSelectorRequirement> result = new ArrayList<>();
        if (!requirements.isArray()) {
            return result;
        }
        for (JsonNode requirement : requirements) {
            Set<String> values = new LinkedHashSet<>();
            requirement.path(PayloadFields.VALUES).forEach(value -> values.add(value.asText()));
            result.add(new NodeSelectorRequirement(
                    requirement.path(PayloadFields.KEY).asText(""),
                    StringExt.parseEnumIgnoreCase(requirement.path(PayloadFields.OPERATOR).asText(""), NodeSelectorRequirement.Operator.class),
                    ImmutableSet.copyOf(values)
            ));
        }
        return result;
    }
}
