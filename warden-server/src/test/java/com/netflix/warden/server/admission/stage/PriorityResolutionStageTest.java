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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.service.PriorityClassException;
import com.netflix.warden.server.priority.DefaultPriorityClassRegistry;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import com.netflix.warden.testkit.model.PriorityClassGenerator;
import org.junit.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

public class PriorityResolutionStageTest {

    private final DefaultPriorityClassRegistry registry = new DefaultPriorityClassRegistry();
    private final PriorityResolutionStage stage = new PriorityResolutionStage(registry);

    @Test
    public void testNamedClassResolved() {
        registry.create(PriorityClassGenerator.lowPriority());

        ObjectNode result = applyStage(AdmissionRequestGenerator.createPod("default",
                PodPayloadBuilder.newPod("pod1").withPriorityClassName("low").build()
        ));

        assertThat(result.at("/spec/priority").asInt()).isEqualTo(100);
        assertThat(result.at("/spec/preemptionPolicy").asText()).isEqualTo(PreemptionPolicy.NeverPreempt.name());
        assertThat(result.at("/spec/priorityClassName").asText()).isEqualTo("low");
    }

    @Test
    public void testDefaultClassUsedWhenNotNamed() {
        registry.create(PriorityClassGenerator.defaultPriorityClass("standard", 500));

        ObjectNode result = applyStage(AdmissionRequestGenerator.createPod("default", "pod1"));

        assertThat(result.at("/spec/priority").asInt()).isEqualTo(500);
        assertThat(result.at("/spec/priorityClassName").asText()).isEqualTo("standard");
    }

    @Test
    public void testNoClassAndNoDefaultResolvesToZero() {
        ObjectNode result = applyStage(AdmissionRequestGenerator.createPod("default", "pod1"));

        assertThat(result.at("/spec/priority").asInt()).isZero();
        assertThat(result.at("/spec/preemptionPolicy").asText()).isEqualTo(PreemptionPolicy.CanPreemptLower.name());
        assertThat(result.at("/spec/priorityClassName").isMissingNode()).isTrue();
    }

    @Test
    public void testUnknownClassFails() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default",
                PodPayloadBuilder.newPod("pod1").withPriorityClassName("missing").build()
        );
        StepVerifier.create(stage.evaluate(request))
                .expectErrorMatches(error -> PriorityClassException.hasErrorCode(error, PriorityClassException.ErrorCode.UnknownPriorityClass))
                .verify();
    }

    private ObjectNode applyStage(AdmissionRequest request) {
        StageDecision decision = stage.evaluate(request).block();
        return JsonPatches.apply(request.getPayload(), decision.getPatch().get());
    }
}
