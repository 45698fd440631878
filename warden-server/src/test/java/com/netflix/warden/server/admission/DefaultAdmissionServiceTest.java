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

package com.netflix.warden.server.admission;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionResult;
import com.netflix.warden.api.admission.model.AdmissionVerdict;
import com.netflix.warden.api.admission.model.FailurePolicy;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.patch.Patch;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.api.priority.service.PriorityClassException;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.runtime.WardenRuntimes;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import org.junit.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultAdmissionServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final Registry registry = new DefaultRegistry();
    private final WardenRuntime runtime = WardenRuntimes.internal(registry);

    @Test
    public void testMutatingStagesRunInOrderOnPreviousOutput() {
        TestStage first = TestStage.mutating("first", 10, request -> Mono.just(StageDecision.patch(
                Patch.newBuilder().add("/metadata/labels/step", "first").build()
        )));
        TestStage second = TestStage.mutating("second", 20, request -> {
            String previous = request.getPayload().at("/metadata/labels/step").asText();
            return Mono.just(StageDecision.patch(
                    Patch.newBuilder().add("/metadata/labels/step", previous + ",second").build()
            ));
        });
        DefaultAdmissionService service = newService(ImmutableSet.of(second, first));

        AdmissionResult result = service.admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRequest().getPayload().at("/metadata/labels/step").asText()).isEqualTo("first,second");
        assertThat(service.getStages()).extracting("name").containsExactly("first", "second");
    }

    @Test
    public void testOrderTiesResolvedByName() {
        TestStage b = TestStage.mutating("b", 10, request -> Mono.just(StageDecision.noChange()));
        TestStage a = TestStage.mutating("a", 10, request -> Mono.just(StageDecision.noChange()));
        TestStage v = TestStage.validating("v", 1, request -> Mono.just(StageDecision.allow()));

        assertThat(newService(ImmutableSet.of(v, b, a)).getStages()).extracting("name").containsExactly("a", "b", "v");
    }

    @Test
    public void testValidatingStagesSeeFinalRequestAndCannotModifyIt() {
        TestStage mutating = TestStage.mutating("mutating", 10, request -> Mono.just(StageDecision.patch(
                Patch.newBuilder().add("/metadata/labels/added", "yes").build()
        )));
        TestStage tampering = TestStage.validating("tampering", 10, request -> {
            ObjectNode payload = request.getPayload();
            payload.with("metadata").put("name", "tampered");
            return Mono.just(StageDecision.allow());
        });
        TestStage observer = TestStage.validating("observer", 20, request -> Mono.just(StageDecision.allow()));
        DefaultAdmissionService service = newService(ImmutableSet.of(mutating, tampering, observer));

        AdmissionResult result = service.admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRequest().getName()).isEqualTo("pod1");
        assertThat(observer.getReceived()).hasSize(1);
        AdmissionRequest seen = observer.getReceived().get(0);
        assertThat(seen.getName()).isEqualTo("pod1");
        assertThat(seen.getPayload().at("/metadata/labels/added").asText()).isEqualTo("yes");
        assertThat(seen).isEqualTo(result.getRequest());
    }

    @Test
    public void testFirstDenyShortCircuits() {
        TestStage denying = TestStage.validating("denying", 10, request -> Mono.just(StageDecision.deny("not allowed")));
        TestStage later = TestStage.validating("later", 20, request -> Mono.just(StageDecision.allow()));
        DefaultAdmissionService service = newService(ImmutableSet.of(denying, later));

        AdmissionResult result = service.admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getVerdict()).isEqualTo(AdmissionVerdict.deny("denying", "not allowed"));
        assertThat(later.getReceived()).isEmpty();
        assertThat(registry.counter(registry.createId("warden.admission.stage", "stage", "denying", "result", "deny")).count()).isEqualTo(1);
        assertThat(registry.counter(registry.createId("warden.admission.request", "kind", "Pod", "result", "deny")).count()).isEqualTo(1);
    }

    @Test
    public void testMutatingStageErrorIsMutationFailed() {
        TestStage failing = TestStage.mutating("failing", 10, request -> Mono.error(new IllegalStateException("simulated")));
        TestStage validating = TestStage.validating("validating", 10, request -> Mono.just(StageDecision.allow()));

        StepVerifier.create(newService(ImmutableSet.of(failing, validating)).admit(podRequest()))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.MutationFailed)
                        && "failing".equals(((AdmissionException) error).getStageName()))
                .verify(TIMEOUT);
        assertThat(validating.getReceived()).isEmpty();
    }

    @Test
    public void testMalformedPatchIsMutationFailed() {
        TestStage malformed = TestStage.mutating("malformed", 10, request -> Mono.just(StageDecision.patch(
                Patch.newBuilder().remove("/spec/does/not/exist").build()
        )));

        StepVerifier.create(newService(ImmutableSet.of(malformed)).admit(podRequest()))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.MutationFailed))
                .verify(TIMEOUT);
    }

    @Test
    public void testWrongDecisionKind() {
        TestStage mutatingWithVerdict = TestStage.mutating("mutatingWithVerdict", 10, request -> Mono.just(StageDecision.deny("no")));
        StepVerifier.create(newService(ImmutableSet.of(mutatingWithVerdict)).admit(podRequest()))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.MutationFailed))
                .verify(TIMEOUT);

        TestStage validatingWithPatch = TestStage.validating("validatingWithPatch", 10, request -> Mono.just(StageDecision.patch(
                Patch.newBuilder().add("/metadata/labels/x", "y").build()
        )));
        StepVerifier.create(newService(ImmutableSet.of(validatingWithPatch)).admit(podRequest()))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionFailed))
                .verify(TIMEOUT);
    }

    @Test
    public void testDomainErrorsArePropagated() {
        TestStage resolving = TestStage.mutating("resolving", 10, request -> Mono.error(PriorityClassException.unknownPriorityClass("missing")));

        StepVerifier.create(newService(ImmutableSet.of(resolving)).admit(podRequest()))
                .expectErrorMatches(error -> PriorityClassException.hasErrorCode(error, PriorityClassException.ErrorCode.UnknownPriorityClass))
                .verify(TIMEOUT);
    }

    @Test
    public void testTimeoutWithFailPolicyDenies() {
        TestStage slow = TestStage.validating("slow", 10, request -> Mono.never())
                .withTimeout(Duration.ofMillis(50))
                .withFailurePolicy(FailurePolicy.Fail);

        AdmissionResult result = newService(ImmutableSet.of(slow)).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getVerdict().getStageName()).isEqualTo("slow");
        assertThat(result.getVerdict().getReason()).isEqualTo(DefaultAdmissionService.WEBHOOK_UNAVAILABLE);
    }

    @Test
    public void testTimeoutWithIgnorePolicySkipsStage() {
        TestStage slow = TestStage.mutating("slow", 10, request -> Mono.never())
                .withTimeout(Duration.ofMillis(50))
                .withFailurePolicy(FailurePolicy.Ignore);
        TestStage next = TestStage.mutating("next", 20, request -> Mono.just(StageDecision.noChange()));

        AdmissionResult result = newService(ImmutableSet.of(slow, next)).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isTrue();
        assertThat(next.getReceived()).hasSize(1);
        assertThat(registry.counter(registry.createId("warden.admission.stage",
                "stage", "slow", "result", "skipped", "error", "AdmissionException")).count()).isEqualTo(1);
    }

    @Test
    public void testAdmissionFailedErrorFollowsFailurePolicy() {
        TestStage unavailable = TestStage.validating("unavailable", 10,
                request -> Mono.error(AdmissionException.admissionFailed("unavailable", "connection refused"))
        );

        AdmissionResult result = newService(ImmutableSet.of(unavailable)).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getVerdict().getReason()).isEqualTo(DefaultAdmissionService.WEBHOOK_UNAVAILABLE);
    }

    @Test
    public void testCancellationStopsBetweenStages() throws Exception {
        TestStage delayed = TestStage.mutating("delayed", 10, request -> Mono.delay(Duration.ofMillis(100)).thenReturn(StageDecision.noChange()));
        TestStage next = TestStage.mutating("next", 20, request -> Mono.just(StageDecision.noChange()));

        StepVerifier.create(newService(ImmutableSet.of(delayed, next)).admit(podRequest()))
                .expectSubscription()
                .thenCancel()
                .verify(TIMEOUT);

        TimeUnit.MILLISECONDS.sleep(300);
        assertThat(delayed.getReceived()).hasSize(1);
        assertThat(next.getReceived()).isEmpty();
    }

    @Test
    public void testDisabledStagesAreNotRun() {
        TestStage disabled = TestStage.validating("disabled", 10, request -> Mono.just(StageDecision.deny("should not run")));
        AdmissionConfiguration configuration = Archaius2Ext.newConfiguration(AdmissionConfiguration.class,
                "warden.admission.disabledStages", "disabled"
        );
        DefaultAdmissionService service = new DefaultAdmissionService(configuration, ImmutableSet.of(disabled), runtime);

        assertThat(service.admit(podRequest()).block(TIMEOUT).isAllowed()).isTrue();
        assertThat(disabled.getReceived()).isEmpty();
    }

    @Test
    public void testEmptyStageResultIsNoChange() {
        TestStage empty = TestStage.mutating("empty", 10, request -> Mono.empty());
        TestStage emptyValidating = TestStage.validating("emptyValidating", 10, request -> Mono.empty());

        assertThat(newService(ImmutableSet.of(empty, emptyValidating)).admit(podRequest()).block(TIMEOUT).isAllowed()).isTrue();
    }

    private DefaultAdmissionService newService(Set<AdmissionStage> stages) {
        return new DefaultAdmissionService(Archaius2Ext.newConfiguration(AdmissionConfiguration.class), stages, runtime);
    }

    private static AdmissionRequest podRequest() {
        return AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("pod1").withLabel("app", "web").build());
    }
}
