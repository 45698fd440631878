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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.UserInfo;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class CreatedByLabelStageTest {

    private final CreatedByLabelStage stage = new CreatedByLabelStage();

    @Test
    public void testLabelAddedWhenMetadataMissing() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject("spec");
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default", payload);

        ObjectNode result = applyStage(request);

        assertThat(result.at("/metadata/labels/created-by").asText()).isEqualTo(AdmissionRequestGenerator.TEST_USER.getUsername());
    }

    @Test
    public void testCallerValueIsOverridden() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default",
                PodPayloadBuilder.newPod("pod1").withLabel("created-by", "mallory").withLabel("app", "web").build()
        ).toBuilder().withUserInfo(UserInfo.of("bob")).build();

        ObjectNode result = applyStage(request);

        assertThat(result.at("/metadata/labels/created-by").asText()).isEqualTo("bob");
        assertThat(result.at("/metadata/labels/app").asText()).isEqualTo("web");
    }

    private ObjectNode applyStage(AdmissionRequest request) {
        StageDecision decision = stage.evaluate(request).block();
        return JsonPatches.apply(request.getPayload(), decision.getPatch().get());
    }
}
