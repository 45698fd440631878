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

package com.netflix.warden.api.gateway;

import com.netflix.warden.api.admission.model.AdmissionRequest;
import reactor.core.publisher.Mono;

/**
 * Entry point for resource mutation requests.
 */
public interface ResourceGateway {

    /**
     * Authorizes, admits and applies the request. Errors:
     * <ul>
     *     <li>{@link com.netflix.warden.api.admission.service.AdmissionException} with the
     *     <tt>AdmissionDenied</tt> code, if a validating stage rejected the request</li>
     *     <li>{@link com.netflix.warden.api.admission.service.AdmissionException} for authorization failures,
     *     mutation failures and invalid requests</li>
     *     <li>{@link com.netflix.warden.api.priority.service.PriorityClassException} for priority class
     *     resolution errors and registry conflicts</li>
     *     <li>{@link com.netflix.warden.api.scheduler.service.SchedulerException} for node and pod conflicts</li>
     * </ul>
     */
    Mono<AdmissionResponse> submit(AdmissionRequest request);
}
