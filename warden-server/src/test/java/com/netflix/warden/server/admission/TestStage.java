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

package com.netflix.warden.server.admission;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.FailurePolicy;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.StageMatcher;
import com.netflix.warden.api.admission.service.AdmissionStage;
import reactor.core.publisher.Mono;

/**
 * Stage with a pluggable evaluation function, recording the requests it received.
 */
class TestStage implements AdmissionStage {

    private final StageDescriptor descriptor;
    private final Function<AdmissionRequest, Mono<StageDecision>> evaluator;
    private final List<AdmissionRequest> received = new CopyOnWriteArrayList<>();

    private TestStage(StageDescriptor descriptor, Function<AdmissionRequest, Mono<StageDecision>> evaluator) {
        this.descriptor = descriptor;
        this.evaluator = evaluator;
    }

    @Override
    public StageDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public Mono<StageDecision> evaluate(AdmissionRequest request) {
        received.add(request);
        return evaluator.apply(request);
    }

    List<AdmissionRequest> getReceived() {
        return received;
    }

    TestStage withTimeout(Duration timeout) {
        return new TestStage(descriptor.toBuilder().withTimeout(timeout).build(), evaluator);
    }

    TestStage withFailurePolicy(FailurePolicy failurePolicy) {
        return new TestStage(descriptor.toBuilder().withFailurePolicy(failurePolicy).build(), evaluator);
    }

    static TestStage mutating(String name, int order, Function<AdmissionRequest, Mono<StageDecision>> evaluator) {
        return new TestStage(descriptor(name, StageKind.Mutating, order), evaluator);
    }

    static TestStage validating(String name, int order, Function<AdmissionRequest, Mono<StageDecision>> evaluator) {
        return new TestStage(descriptor(name, StageKind.Validating, order), evaluator);
    }

    private static StageDescriptor descriptor(String name, StageKind kind, int order) {
        return StageDescriptor.newBuilder()
                .withName(name)
                .withKind(kind)
                .withOrder(order)
                .withMatcher(StageMatcher.matchAll())
                .build();
    }
}
