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

package com.netflix.warden.api.admission.service;

import java.util.List;

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionResult;
import com.netflix.warden.api.admission.model.StageDescriptor;
import reactor.core.publisher.Mono;

public interface AdmissionService {

    /**
     * Runs the request through all matching mutating stages, followed by all matching validating stages. A denied
     * request is reported via {@link AdmissionResult#getVerdict()}. Stage failures that cannot be mapped to
     * a verdict are reported as errors.
     * <p>
     * The returned {@link Mono} is lazy, and may be cancelled at any time. Cancellation is observed before the next
     * stage starts.
     */
    Mono<AdmissionResult> admit(AdmissionRequest request);

    /**
     * Stages in execution order (mutating first).
     */
    List<StageDescriptor> getStages();
}
