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

import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.api.json.ObjectMappers;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@link WebhookClient} posting admission reviews as JSON documents.
 */
public class DefaultWebhookClient implements WebhookClient {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWebhookClient.class);

    private static final String METRIC_ROOT = "warden.admission.webhook.";

    private static final ObjectMapper MAPPER = ObjectMappers.defaultMapper();

    private final String webhookName;
    private final String url;
    private final WebClient restClient;
    private final Registry registry;
    private final Clock clock;
    private final Id latencyId;

    public DefaultWebhookClient(String webhookName, String url, WardenRuntime runtime) {
        this.webhookName = webhookName;
        this.url = url;
        this.registry = runtime.getRegistry();
        this.clock = runtime.getClock();
        this.latencyId = registry.createId(METRIC_ROOT + "latency", "webhook", webhookName);
        this.restClient = WebClient.builder()
                .baseUrl(url)
                .build();
    }

    @Override
    public Mono<WebhookReviewResponse> review(WebhookReviewRequest request) {
        return Mono.defer(() -> {
            String body;
            try {
                body = MAPPER.writeValueAsString(request);
            } catch (JsonProcessingException e) {
                return Mono.error(AdmissionException.admissionFailed(webhookName, e));
            }

            long startTime = clock.wallTime();
            return restClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            return response.releaseBody().then(Mono.error(AdmissionException.admissionFailed(
                                    webhookName, String.format("webhook %s replied with status %s", url, response.rawStatusCode())
                            )));
                        }
                        return response.bodyToMono(String.class).defaultIfEmpty("{}");
                    })
                    .map(this::parseResponse)
                    .doOnSuccess(reply -> recordLatency("success", startTime))
                    .doOnError(error -> recordLatency("failure", startTime))
                    .onErrorMap(error -> !(error instanceof AdmissionException), error -> {
                        logger.debug("Webhook {} call failed", webhookName, error);
                        return AdmissionException.admissionFailed(webhookName, error);
                    });
        });
    }

    private WebhookReviewResponse parseResponse(String body) {
        try {
            return MAPPER.readValue(body, WebhookReviewResponse.class);
        } catch (JsonProcessingException e) {
            throw AdmissionException.admissionFailed(webhookName, "cannot parse webhook reply: " + e.getOriginalMessage());
        }
    }

    private void recordLatency(String result, long startTime) {
        registry.timer(latencyId.withTag("result", result)).record(clock.wallTime() - startTime, TimeUnit.MILLISECONDS);
    }
}
