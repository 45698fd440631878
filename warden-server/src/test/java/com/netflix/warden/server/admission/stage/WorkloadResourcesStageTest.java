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
import com.netflix.warden.api.admission.model.AdmissionVerdict;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class WorkloadResourcesStageTest {

    private final WorkloadResourcesStage stage = new WorkloadResourcesStage(Archaius2Ext.newConfiguration(AdmissionConfiguration.class,
            "warden.admission.maxCpu", "8",
            "warden.admission.maxMemoryMB", "16384"
    ));

    @Test
    public void testDemandWithinLimitsAllowed() {
        assertThat(verdictOf(1, 1024).isAllowed()).isTrue();
        assertThat(verdictOf(8, 16384).isAllowed()).isTrue();
    }

    @Test
    public void testNonPositiveDemandDenied() {
        assertThat(verdictOf(0, 1024).isAllowed()).isFalse();
        assertThat(verdictOf(1, 0).isAllowed()).isFalse();
    }

    @Test
    public void testDemandAboveLimitsDenied() {
        assertThat(verdictOf(9, 1024).getReason()).contains("cpu");
        assertThat(verdictOf(1, 16385).getReason()).contains("memoryMB");
    }

    @Test
    public void testMalformedPodFieldsDenied() {
        assertThat(verdictOf(PodPayloadBuilder.newPod("pod1").withResources(1, 1024)
                .withToleration("gpu", "Bogus", "true", TaintEffect.NoSchedule)
                .build()
        ).getReason()).contains("Invalid enum value Bogus");
        assertThat(verdictOf(PodPayloadBuilder.newPod("pod1").withResources(1, 1024)
                .withRequiredAffinity("zone", "Near", "us-east-1a")
                .build()
        ).isAllowed()).isFalse();

        ObjectNode badPolicy = PodPayloadBuilder.newPod("pod1").withResources(1, 1024).build();
        badPolicy.with(PayloadFields.SPEC).put(PayloadFields.PREEMPTION_POLICY, "Sometimes");
        assertThat(verdictOf(badPolicy).isAllowed()).isFalse();
    }

    private AdmissionVerdict verdictOf(double cpu, long memoryMB) {
        return verdictOf(PodPayloadBuilder.newPod("pod1").withResources(cpu, memoryMB).build());
    }

    private AdmissionVerdict verdictOf(ObjectNode pod) {
        return stage.evaluate(AdmissionRequestGenerator.createPod("default", pod)).block().getVerdict().get();
    }
}
