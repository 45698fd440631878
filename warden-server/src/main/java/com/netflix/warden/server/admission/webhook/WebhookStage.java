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

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.patch.Patch;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.common.util.CollectionsExt;
import reactor.core.publisher.Mono;

/**
 * Admission stage delegating the decision to an external HTTP endpoint.
 */
public class WebhookStage implements AdmissionStage {

    private final StageDescriptor descriptor;
    private final WebhookClient client;

    public WebhookStage(StageDescriptor descriptor, WebhookClient client) {
        this.descriptor = descriptor;
        this.client = client;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        return client.review(WebhookReviewRequest.from(request)).map(this::toDecision);
    }

    private StageDecision toDecision(WebhookReviewResponse response) {
        if (descriptor.getKind() == StageKind.Mutating) {
            if (!response.isAllowed()) {
                throw AdmissionException.mutationFailed(descriptor.getName(), "mutating webhook rejected the request: " + response.getReason());
            }
            return StageDecision.patch(Patch.of(response.getPatch()));
        }
        if (!CollectionsExt.isNullOrEmpty(response.getPatch())) {
            throw new IllegalStateException("validating webhook " + descriptor.getName() + " returned a patch");
        }
        return response.isAllowed() ? StageDecision.allow() : StageDecision.deny(response.getReason());
    }
}
