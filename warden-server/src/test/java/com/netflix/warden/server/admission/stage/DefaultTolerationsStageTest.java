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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultTolerationsStageTest {

    private final DefaultTolerationsStage stage = new DefaultTolerationsStage(Archaius2Ext.newConfiguration(AdmissionConfiguration.class));

    @Test
    public void testDefaultTolerationsAdded() {
        ObjectNode result = applyStage(AdmissionRequestGenerator.createPod("default", "pod1"));

        JsonNode tolerations = result.at("/spec/tolerations");
        assertThat(tolerations).hasSize(2);
        assertThat(tolerations.get(0).get("key").asText()).isEqualTo("node.kubernetes.io/not-ready");
        assertThat(tolerations.get(0).get("operator").asText()).isEqualTo("Exists");
        assertThat(tolerations.get(0).get("effect").asText()).isEqualTo("NoExecute");
        assertThat(tolerations.get(0).get("tolerationSeconds").asLong()).isEqualTo(300);
        assertThat(tolerations.get(1).get("key").asText()).isEqualTo("node.kubernetes.io/unreachable");
    }

    @Test
    public void testExistingTolerationsKept() {
        ObjectNode result = applyStage(AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("pod1")
                .withToleration("gpu", "Exists", null, TaintEffect.NoSchedule)
                .withToleration("node.kubernetes.io/not-ready", "Exists", null, TaintEffect.NoExecute)
                .build()
        ));

        JsonNode tolerations = result.at("/spec/tolerations");
        assertThat(tolerations).hasSize(3);
        assertThat(tolerations.get(0).get("key").asText()).isEqualTo("gpu");
        assertThat(tolerations.get(2).get("key").asText()).isEqualTo("node.kubernetes.io/unreachable");
    }

    private ObjectNode applyStage(AdmissionRequest request) {
        StageDecision decision = stage.evaluate(request).block();
        return JsonPatches.apply(request.getPayload(), decision.getPatch().get());
    }
}
