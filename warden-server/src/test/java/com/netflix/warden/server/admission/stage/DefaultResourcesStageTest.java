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
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class DefaultResourcesStageTest {

    private final AdmissionConfiguration configuration = Archaius2Ext.newConfiguration(AdmissionConfiguration.class,
            "warden.admission.defaultCpu", "0.5",
            "warden.admission.defaultMemoryMB", "256"
    );

    private final DefaultResourcesStage stage = new DefaultResourcesStage(configuration);

    @Test
    public void testMissingRequestsFilled() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default", "pod1");
        StageDecision decision = stage.evaluate(request).block();
        ObjectNode result = JsonPatches.apply(request.getPayload(), decision.getPatch().get());

        assertThat(result.at("/spec/resources/requests/cpu").asDouble()).isCloseTo(0.5, within(1e-9));
        assertThat(result.at("/spec/resources/requests/memoryMB").asLong()).isEqualTo(256);
    }

    @Test
    public void testOnlyMissingDimensionFilled() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("pod1").withCpu(2).build());
        StageDecision decision = stage.evaluate(request).block();
        ObjectNode result = JsonPatches.apply(request.getPayload(), decision.getPatch().get());

        assertThat(result.at("/spec/resources/requests/cpu").asDouble()).isCloseTo(2, within(1e-9));
        assertThat(result.at("/spec/resources/requests/memoryMB").asLong()).isEqualTo(256);
    }

    @Test
    public void testCompleteRequestsUnchanged() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("pod1").withResources(1, 512).build());
        StageDecision decision = stage.evaluate(request).block();

        assertThat(decision.getPatch().map(patch -> patch.isEmpty()).orElse(true)).isTrue();
    }
}
