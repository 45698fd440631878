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

package com.netflix.warden.server.admission.webhook;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableSet;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionResult;
import com.netflix.warden.api.admission.model.FailurePolicy;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.runtime.WardenRuntimes;
import com.netflix.warden.common.util.archaius2.Archaius2Ext;
import com.netflix.warden.server.admission.AdmissionConfiguration;
import com.netflix.warden.server.admission.DefaultAdmissionService;
import com.netflix.warden.testkit.model.AdmissionRequestGenerator;
import com.netflix.warden.testkit.model.PodPayloadBuilder;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockserver.integration.ClientAndServer;
import org.mockserver.matchers.MatchType;
import org.mockserver.model.HttpRequest;
import org.mockserver.model.HttpResponse;
import org.mockserver.model.JsonBody;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockserver.integration.ClientAndServer.startClientAndServer;

public class WebhookStageTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final Duration STAGE_TIMEOUT = Duration.ofSeconds(5);

    private static final String REVIEW_PATH = "/review";

    private final WardenRuntime runtime = WardenRuntimes.internal();

    private ClientAndServer mockServer;
    private DefaultWebhookClient client;

    @Before
    public void setUp() {
        mockServer = startClientAndServer(0);
        client = new DefaultWebhookClient("policy", "http://localhost:" + mockServer.getPort() + REVIEW_PATH, runtime);
    }

    @After
    public void tearDown() {
        mockServer.stop();
    }

    @Test
    public void testValidatingWebhookAllows() {
        respondWith(HttpResponseStatus.OK, "{\"allowed\": true}");

        StepVerifier.create(newStage(StageKind.Validating, FailurePolicy.Fail).evaluate(podRequest()))
                .expectNext(StageDecision.allow())
                .expectComplete()
                .verify(TIMEOUT);

        mockServer.verify(HttpRequest.request()
                .withMethod("POST")
                .withPath(REVIEW_PATH)
                .withBody(JsonBody.json("{\"kind\": \"Pod\", \"operation\": \"CREATE\", \"namespace\": \"default\", \"object\": {\"metadata\": {\"name\": \"pod1\"}}}", MatchType.ONLY_MATCHING_FIELDS))
        );
        assertThat(runtime.getRegistry().timer("warden.admission.webhook.latency", "webhook", "policy", "result", "success").count()).isEqualTo(1);
    }

    @Test
    public void testValidatingWebhookDenies() {
        respondWith(HttpResponseStatus.OK, "{\"allowed\": false, \"reason\": \"image not approved\"}");

        StepVerifier.create(newStage(StageKind.Validating, FailurePolicy.Fail).evaluate(podRequest()))
                .expectNext(StageDecision.deny("image not approved"))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    public void testMutatingWebhookPatch() {
        respondWith(HttpResponseStatus.OK, "{\"allowed\": true, \"patch\": [{\"op\": \"add\", \"path\": \"/metadata/labels/team\", \"value\": \"infra\"}]}");

        AdmissionResult result = newService(newStage(StageKind.Mutating, FailurePolicy.Fail)).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRequest().getPayload().at("/metadata/labels/team").asText()).isEqualTo("infra");
    }

    @Test
    public void testMutatingWebhookRejectionIsMutationFailure() {
        respondWith(HttpResponseStatus.OK, "{\"allowed\": false, \"reason\": \"no\"}");

        StepVerifier.create(newService(newStage(StageKind.Mutating, FailurePolicy.Fail)).admit(podRequest()))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.MutationFailed))
                .verify(TIMEOUT);
    }

    @Test
    public void testServerErrorDeniesWithFailPolicy() {
        respondWith(HttpResponseStatus.INTERNAL_SERVER_ERROR, "");

        AdmissionResult result = newService(newStage(StageKind.Validating, FailurePolicy.Fail)).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getVerdict().getStageName()).isEqualTo("policy");
        assertThat(result.getVerdict().getReason()).isEqualTo(DefaultAdmissionService.WEBHOOK_UNAVAILABLE);
        assertThat(runtime.getRegistry().timer("warden.admission.webhook.latency", "webhook", "policy", "result", "failure").count()).isEqualTo(1);
    }

    @Test
    public void testServerErrorSkippedWithIgnorePolicy() {
        respondWith(HttpResponseStatus.INTERNAL_SERVER_ERROR, "");

        AdmissionResult result = newService(newStage(StageKind.Validating, FailurePolicy.Ignore)).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isTrue();
    }

    @Test
    public void testSlowWebhookTimesOut() {
        mockServer
                .when(HttpRequest.request().withPath(REVIEW_PATH))
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withBody("{\"allowed\": true}")
                        .withDelay(TimeUnit.SECONDS, 5)
                );
        WebhookStage stage = new WebhookStage(
                descriptor(StageKind.Validating, FailurePolicy.Fail).toBuilder().withTimeout(Duration.ofMillis(200)).build(),
                client
        );

        AdmissionResult result = newService(stage).admit(podRequest()).block(TIMEOUT);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getVerdict().getReason()).isEqualTo(DefaultAdmissionService.WEBHOOK_UNAVAILABLE);
    }

    @Test
    public void testMalformedReplyIsAdmissionFailure() {
        respondWith(HttpResponseStatus.OK, "not json");

        StepVerifier.create(client.review(WebhookReviewRequest.from(podRequest())))
                .expectErrorMatches(error -> AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionFailed))
                .verify(TIMEOUT);
    }

    private void respondWith(HttpResponseStatus status, String body) {
        mockServer
                .when(HttpRequest.request().withMethod("POST").withPath(REVIEW_PATH))
                .respond(HttpResponse.response()
                        .withStatusCode(status.code())
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)
                );
    }

    private WebhookStage newStage(StageKind kind, FailurePolicy failurePolicy) {
        return new WebhookStage(descriptor(kind, failurePolicy), client);
    }

    private static StageDescriptor descriptor(StageKind kind, FailurePolicy failurePolicy) {
        return StageDescriptor.newBuilder()
                .withName("policy")
                .withKind(kind)
                .withOrder(1000)
                .withTimeout(STAGE_TIMEOUT)
                .withFailurePolicy(failurePolicy)
                .build();
    }

    private DefaultAdmissionService newService(WebhookStage stage) {
        return new DefaultAdmissionService(Archaius2Ext.newConfiguration(AdmissionConfiguration.class), ImmutableSet.of(stage), runtime);
    }

    private static AdmissionRequest podRequest() {
        return AdmissionRequestGenerator.createPod("default", PodPayloadBuilder.newPod("pod1").withLabel("app", "web").build());
    }
}
