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

package com.netflix.warden.server.gateway;

import java.time.Duration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.config.MapConfig;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.api.admission.service.AdmissionService;
import com.netflix.warden.api.admission.service.Authorizer;
import com.netflix.warden.api.gateway.AdmissionResponse;
import com.netflix.warden.api.gateway.ResourceGateway;
import com.netflix.warden.api.namespace.model.NamespacePhase;
import com.netflix.warden.api.namespace.service.NamespaceRegistry;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.service.PriorityClassException;
import com.netflix.warden.api.priority.service.PriorityClassRegistry;
import com.netflix.warden.api.scheduler.model.SchedulingResult;
import com.netflix.warden.api.scheduler.model.Taint;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.api.scheduler.model.WorkloadState;
import com.netflix.warden.api.scheduler.service.SchedulerException;
import com.netflix.warden.api.scheduler.service.SchedulingService;
import com.netflix.warden.common.runtime.WardenRuntimes;
import com.netflix.warden.server.WardenModule;
import com.netflix.warden.server.admission.stage.NamespaceLifecycleStage;
import com.netflix.warden.server.admission.stage.WorkloadResourcesStage;
import com.netflix.warden.server.scheduler.DefaultSchedulingService;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DefaultResourceGatewayTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private Injector injector;
    private ResourceGateway gateway;
    private SchedulingService schedulingService;
    private NamespaceRegistry namespaceRegistry;
    private PriorityClassRegistry priorityClassRegistry;

    @Before
    public void setUp() {
        // The background loop is pushed far out, so the tests drive the scheduler explicitly.
        MapConfig config = MapConfig.from(ImmutableMap.of("warden.scheduler.schedulingIntervalMs", "3600000"));
        injector = Guice.createInjector(new WardenModule(config, WardenRuntimes.test()));
        gateway = injector.getInstance(ResourceGateway.class);
        schedulingService = injector.getInstance(SchedulingService.class);
        namespaceRegistry = injector.getInstance(NamespaceRegistry.class);
        priorityClassRegistry = injector.getInstance(PriorityClassRegistry.class);
    }

    @After
    public void tearDown() {
        injector.getInstance(DefaultSchedulingService.class).shutdown();
    }

    @Test
    public void testPodAdmittedIntoProvisionedNamespaceAndBound() {
        submit(AdmissionRequestGenerator.createNode("node1", 8, 8192));

        AdmissionResponse response = submit(AdmissionRequestGenerator.createPod("team-a", "pod1"));

        assertThat(response.isNamespaceProvisioned()).isTrue();
        assertThat(namespaceRegistry.find("team-a")).isPresent();
        assertThat(response.getObject().at("/metadata/labels/" + PayloadFields.CREATED_BY_LABEL).asText()).isEqualTo("alice");
        assertThat(response.getObject().at("/spec/resources/requests/cpu").asDouble()).isEqualTo(0.1);

        assertThat(schedulingService.scheduleAll()).containsExactly(SchedulingResult.bound("team-a/pod1", "node1"));
        assertThat(schedulingService.getStatus("team-a/pod1").getState()).isEqualTo(WorkloadState.Bound);

        AdmissionResponse second = submit(AdmissionRequestGenerator.createPod("team-a", "pod2"));
        assertThat(second.isNamespaceProvisioned()).isFalse();
    }

    @Test
    public void testCreatedByLabelCannotBeSpoofed() {
        AdmissionResponse response = submit(AdmissionRequestGenerator.createPod(
                "default",
                PodPayloadBuilder.newPod("pod1").withLabel(PayloadFields.CREATED_BY_LABEL, "mallory").build()
        ));

        assertThat(response.getObject().at("/metadata/labels/" + PayloadFields.CREATED_BY_LABEL).asText()).isEqualTo("alice");
    }

    @Test
    public void testPriorityClassesAndPreemption() {
        submit(AdmissionRequestGenerator.createPriorityClass("low", 100, true, PreemptionPolicy.NeverPreempt));
        submit(AdmissionRequestGenerator.createPriorityClass("high", 1_000_000, false, PreemptionPolicy.CanPreemptLower));
        assertThat(priorityClassRegistry.list()).hasSize(2);

        StepVerifier.create(gateway.submit(AdmissionRequestGenerator.createPriorityClass("other", 10, true, PreemptionPolicy.CanPreemptLower)))
                .expectErrorMatches(error -> PriorityClassException.hasErrorCode(error, PriorityClassException.ErrorCode.DuplicateDefaultPriorityClass))
                .verify(TIMEOUT);

        submit(AdmissionRequestGenerator.createNode("node1", 2, 2048));
        submit(AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("batch").withResources(2, 2048).build()));
        assertThat(schedulingService.scheduleAll()).containsExactly(SchedulingResult.bound("default/batch", "node1"));

        Workload batch = schedulingService.findWorkload("default/batch").get();
        assertThat(batch.getPriorityClassName()).isEqualTo("low");
        assertThat(batch.getPriority()).isEqualTo(100);

        submit(AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("api").withPriorityClassName("high").withResources(2, 2048).build()));
        SchedulingResult result = schedulingService.scheduleNext().get();

        assertThat(result.getWorkloadId()).isEqualTo("default/api");
        assertThat(result.getPreemptedWorkloadIds()).containsExactly("default/batch");
        assertThat(schedulingService.getStatus("default/batch").getState()).isEqualTo(WorkloadState.Pending);
    }

    @Test
    public void testUnknownPriorityClassRejected() {
        StepVerifier.create(gateway.submit(AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("pod1").withPriorityClassName("missing").build())))
                .expectErrorMatches(error -> PriorityClassException.hasErrorCode(error, PriorityClassException.ErrorCode.UnknownPriorityClass))
                .verify(TIMEOUT);
        assertThat(schedulingService.findWorkload("default/pod1")).isEmpty();
    }

    @Test
    public void testDeniedRequestHasNoSideEffects() {
        StepVerifier.create(gateway.submit(AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("huge").withResources(1024, 1024).build())))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionDenied)
                        && ((AdmissionException) error).getStageName().equals(WorkloadResourcesStage.NAME))
                .verify(TIMEOUT);
        assertThat(schedulingService.getPendingWorkloads()).isEmpty();

        StepVerifier.create(gateway.submit(AdmissionRequestGenerator.deleteNamespace("kube-system")))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionDenied)
                        && ((AdmissionException) error).getStageName().equals(NamespaceLifecycleStage.NAME))
                .verify(TIMEOUT);
        assertThat(namespaceRegistry.find("kube-system").get().isActive()).isTrue();
    }

    @Test
    public void testMalformedPodDeniedBeforeNamespaceProvisioning() {
        ObjectNode pod = PodPayloadBuilder.newPod("pod1").withToleration("gpu", "Bogus", "true", TaintEffect.NoSchedule).build();

        StepVerifier.create(gateway.submit(AdmissionRequestGenerator.createPod("team-x", pod)))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionDenied)
                        && ((AdmissionException) error).getStageName().equals(WorkloadResourcesStage.NAME))
                .verify(TIMEOUT);

        assertThat(namespaceRegistry.find("team-x")).isEmpty();
        assertThat(schedulingService.findWorkload("team-x/pod1")).isEmpty();
    }

    @Test
    public void testProvisionedNamespaceRemovedWhenApplyFails() {
        SchedulingService failingScheduler = mock(SchedulingService.class);
        doThrow(SchedulerException.workloadAlreadyExists("team-y/pod1")).when(failingScheduler).submit(any());
        DefaultResourceGateway failingGateway = new DefaultResourceGateway(
                new AllowAllAuthorizer(), injector.getInstance(AdmissionService.class), namespaceRegistry, priorityClassRegistry, failingScheduler, WardenRuntimes.test()
        );

        StepVerifier.create(failingGateway.submit(AdmissionRequestGenerator.createPod("team-y", "pod1")))
                .expectErrorMatches(error -> SchedulerException.hasErrorCode(error, SchedulerException.ErrorCode.WorkloadAlreadyExists))
                .verify(TIMEOUT);

        assertThat(namespaceRegistry.find("team-y")).isEmpty();
    }

    @Test
    public void testNamespaceTermination() {
        submit(AdmissionRequestGenerator.createNamespace("team-b"));
        submit(AdmissionRequestGenerator.deleteNamespace("team-b"));

        assertThat(namespaceRegistry.find("team-b").get().getPhase()).isEqualTo(NamespacePhase.Terminating);
        StepVerifier.create(gateway.submit(AdmissionRequestGenerator.createPod("team-b", "pod1")))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionDenied))
                .verify(TIMEOUT);
    }

    @Test
    public void testNodeTaintEvictsPods() {
        submit(AdmissionRequestGenerator.createNode("node1", 4, 4096));
        submit(AdmissionRequestGenerator.createPod("default", "pod1"));
        schedulingService.scheduleAll();

        submit(AdmissionRequestGenerator.updateNode("node1", 4, 4096, Taint.of("maintenance", "true", TaintEffect.NoExecute)));

        assertThat(schedulingService.getStatus("default/pod1").getState()).isEqualTo(WorkloadState.Pending);
        assertThat(schedulingService.scheduleAll()).extracting(SchedulingResult::getState).containsExactly(WorkloadState.Unschedulable);
    }

    @Test
    public void testPodDeletion() {
        submit(AdmissionRequestGenerator.createPod("default", "pod1"));
        submit(AdmissionRequestGenerator.deletePod("default", "pod1"));

        assertThat(schedulingService.findWorkload("default/pod1")).isEmpty();
    }

    @Test
    public void testUnauthorizedRequestsAreRejected() {
        AdmissionService admissionService = mock(AdmissionService.class);
        Authorizer authorizer = mock(Authorizer.class);
        DefaultResourceGateway unauthorizedGateway = new DefaultResourceGateway(
                authorizer, admissionService, namespaceRegistry, priorityClassRegistry, schedulingService, WardenRuntimes.test()
        );

        when(authorizer.authorize(any())).thenReturn(Mono.error(new IllegalStateException("bad token")));
        StepVerifier.create(unauthorizedGateway.submit(AdmissionRequestGenerator.createPod("default", "pod1")))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.Unauthorized)
                        && error.getMessage().contains("bad token"))
                .verify(TIMEOUT);

        when(authorizer.authorize(any())).thenReturn(Mono.empty());
        StepVerifier.create(unauthorizedGateway.submit(AdmissionRequestGenerator.createPod("default", "pod1")))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.Unauthorized))
                .verify(TIMEOUT);

        verify(admissionService, never()).admit(any());
    }

    private AdmissionResponse submit(AdmissionRequest request) {
        return gateway.submit(request).block(TIMEOUT);
    }
}
