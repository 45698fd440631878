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

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionVerdict;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.common.runtime.WardenRuntimes;
import com.netflix.warden.server.namespace.InMemoryNamespaceRegistry;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class NamespaceStagesTest {

    private final InMemoryNamespaceRegistry namespaceRegistry = new InMemoryNamespaceRegistry(WardenRuntimes.test());

    private final NamespaceAutoProvisionStage autoProvisionStage = new NamespaceAutoProvisionStage(namespaceRegistry);
    private final NamespaceLifecycleStage lifecycleStage = new NamespaceLifecycleStage(namespaceRegistry);

    @Test
    public void testCreateInExistingNamespaceAllowed() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("default", "pod1");

        assertThat(autoProvisionStage.evaluate(request).block().getPatch().get().isEmpty()).isTrue();
        assertThat(verdictOf(request).isAllowed()).isTrue();
    }

    @Test
    public void testCreateInMissingNamespaceDenied() {
        AdmissionVerdict verdict = verdictOf(AdmissionRequestGenerator.createPod("team-a", "pod1"));

        assertThat(verdict.isAllowed()).isFalse();
        assertThat(verdict.getReason()).contains("team-a");
    }

    @Test
    public void testCreateInMissingNamespaceAllowedWhenMarkedForProvisioning() {
        AdmissionRequest request = AdmissionRequestGenerator.createPod("team-a", "pod1");
        StageDecision decision = autoProvisionStage.evaluate(request).block();
        AdmissionRequest marked = request.toBuilder()
                .withPayload(JsonPatches.apply(request.getPayload(), decision.getPatch().get()))
                .build();

        assertThat(NamespaceAutoProvisionStage.isMarkedForProvisioning(marked)).isTrue();
        assertThat(verdictOf(marked).isAllowed()).isTrue();
    }

    @Test
    public void testCreateInTerminatingNamespaceDenied() {
        namespaceRegistry.create("team-b");
        namespaceRegistry.terminate("team-b");

        AdmissionVerdict verdict = verdictOf(AdmissionRequestGenerator.createPod("team-b", "pod1"));

        assertThat(verdict.isAllowed()).isFalse();
        assertThat(verdict.getReason()).contains("terminating");
    }

    @Test
    public void testSystemNamespacesCannotBeDeleted() {
        assertThat(verdictOf(AdmissionRequestGenerator.deleteNamespace("kube-system")).isAllowed()).isFalse();

        namespaceRegistry.create("team-c");
        assertThat(verdictOf(AdmissionRequestGenerator.deleteNamespace("team-c")).isAllowed()).isTrue();
    }

    @Test
    public void testNamespacedCreateWithoutNamespaceDenied() {
        assertThat(verdictOf(AdmissionRequestGenerator.createPod("", "pod1")).isAllowed()).isFalse();
    }

    private AdmissionVerdict verdictOf(AdmissionRequest request) {
        return lifecycleStage.evaluate(request).block().getVerdict().get();
    }
}
