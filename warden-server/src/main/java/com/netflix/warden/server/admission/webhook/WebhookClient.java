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

import reactor.core.publisher.Mono;

public interface WebhookClient {

    /**
     * Sends the review to the webhook endpoint. Transport errors and non 2xx replies are reported as
     * {@link com.netflix.warden.api.admission.service.AdmissionException} with the <tt>AdmissionFailed</tt> code.
     */
    Mono<WebhookReviewResponse> review(WebhookReviewRequest request);
}
