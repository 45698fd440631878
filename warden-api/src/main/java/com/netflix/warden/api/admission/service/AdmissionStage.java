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

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import reactor.core.publisher.Mono;

/**
 * A single admission step. The pipeline dispatches on {@link StageDescriptor#getKind()}: a mutating stage must
 * emit a patch decision, and a validating stage an allow/deny decision.
 * <p>
 * Stages are configured once and invoked concurrently for independent requests, so implementations must not keep
 * per-request mutable state.
 */
public interface AdmissionStage {

    StageDescriptor getDescriptor();

    /**
     * Evaluates the request. An empty {@link Mono} is treated as no change (mutating) or allow (validating).
     * Errors of type {@link AdmissionException} with code {@link AdmissionException.ErrorCode#AdmissionFailed}
     * are subject to the stage failure policy. Other domain errors are propagated to the caller as is.
     */
    Mono<StageDecision> evaluate(AdmissionRequest request);
}
