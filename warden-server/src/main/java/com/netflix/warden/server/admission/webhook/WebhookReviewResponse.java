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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netflix.warden.api.admission.model.patch.PatchOperation;

/**
 * Webhook reply. Validating webhooks set the 'allowed' flag and optionally a reason, mutating webhooks return
 * a list of JSON patch operations.
 */
public class WebhookReviewResponse {

    private final boolean allowed;
    private final String reason;
    private final List<PatchOperation> patch;

    @JsonCreator
    public WebhookReviewResponse(@JsonProperty("allowed") Boolean allowed,
                                 @JsonProperty("reason") String reason,
                                 @JsonProperty("patch") List<PatchOperation> patch) {
        this.allowed = allowed == null || allowed;
        this.reason = reason == null ? "" : reason;
        this.patch = patch == null ? Collections.emptyList() : patch;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    public List<PatchOperation> getPatch() {
        return patch;
    }
}
