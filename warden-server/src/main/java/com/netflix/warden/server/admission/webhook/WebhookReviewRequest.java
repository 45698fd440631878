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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.UserInfo;

/**
 * Body of the HTTP POST sent to a webhook.
 */
public class WebhookReviewRequest {

    private final String uid;
    private final String kind;
    private final String operation;
    private final String namespace;
    private final UserInfo userInfo;
    private final ObjectNode object;

    @JsonCreator
    public WebhookReviewRequest(@JsonProperty("uid") String uid,
                                @JsonProperty("kind") String kind,
                                @JsonProperty("operation") String operation,
                                @JsonProperty("namespace") String namespace,
                                @JsonProperty("userInfo") UserInfo userInfo,
                                @JsonProperty("object") ObjectNode object) {
        this.uid = uid;
        this.kind = kind;
        this.operation = operation;
        this.namespace = namespace;
        this.userInfo = userInfo;
        this.object = object;
    }

    public String getUid() {
        return uid;
    }

    public String getKind() {
        return kind;
    }

    public String getOperation() {
        return operation;
    }

    public String getNamespace() {
        return namespace;
    }

    public UserInfo getUserInfo() {
        return userInfo;
    }

    public ObjectNode getObject() {
        return object;
    }

    public static WebhookReviewRequest from(AdmissionRequest request) {
        return new WebhookReviewRequest(
                request.getId(),
                request.getKind(),
                request.getOperation().name(),
                request.getNamespace(),
                request.getUserInfo(),
                request.getPayload()
        );
    }
}
