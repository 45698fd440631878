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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionResult;
import com.netflix.warden.api.admission.model.AdmissionVerdict;
import com.netflix.warden.api.admission.model.FailurePolicy;
import com.netflix.warden.api.admission.model.StageDecision;
import com.netflix.warden.api.admission.model.StageDescriptor;
import com.netflix.warden.api.admission.model.StageKind;
import com.netflix.warden.api.admission.model.patch.JsonPatchException;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.api.admission.model.patch.Patch;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.api.admission.service.AdmissionService;
import com.netflix.warden.api.admission.service.AdmissionStage;
import com.netflix.warden.api.priority.service.PriorityClassException;
import com.netflix.warden.api.scheduler.service.SchedulerException;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.StringExt;
import com.netflix.warden.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Runs the matching mutating stages in order, each one on the output of its predecessor, followed by the matching
 * validating stages on the fully mutated request. The first deny ends the evaluation.
 * <p>
 * Stage failures are handled as follows:
 * <ul>
 *     <li>timeouts and {@link AdmissionException.ErrorCode#AdmissionFailed} errors follow the stage failure policy.
 *     With {@link FailurePolicy#Fail} the request is denied, with {@link FailurePolicy#Ignore} the stage is skipped</li>
 *     <li>other {@link AdmissionException}s and typed domain errors are propagated unchanged</li>
 *     <li>any other error of a mutating stage is reported as {@link AdmissionException.ErrorCode#MutationFailed}</li>
 *     <li>any other error of a validating stage is reported as {@link AdmissionException.ErrorCode#AdmissionFailed}</li>
 * </ul>
 */
@Singleton
public class DefaultAdmissionService implements AdmissionService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAdmissionService.class);

    public static final String WEBHOOK_UNAVAILABLE = "admission webhook unavailable";

    private final Duration defaultTimeout;
    private final List<AdmissionStage> mutatingStages;
    private final List<AdmissionStage> validatingStages;
    private final AdmissionMetrics metrics;
    private final Clock clock;

    @Inject
    public DefaultAdmissionService(AdmissionConfiguration configuration,
                                   Set<AdmissionStage> stages,
                                   WardenRuntime runtime) {
        this.defaultTimeout = Duration.ofMillis(configuration.getTimeoutMs());
        this.metrics = new AdmissionMetrics(runtime.getRegistry());
        this.clock = runtime.getClock();

        Set<String> disabled = StringExt.splitByCommaIntoSet(configuration.getDisabledStages());
        List<AdmissionStage> enabled = stages.stream()
                .filter(stage -> {
                    if (disabled.contains(stage.getDescriptor().getName())) {
                        logger.info("Admission stage disabled by configuration: {}", stage.getDescriptor().getName());
                        return false;
                    }
                    return true;
                })
                .collect(Collectors.toList());
        this.mutatingStages = sortedOfKind(enabled, StageKind.Mutating);
        this.validatingStages = sortedOfKind(enabled, StageKind.Validating);

        logger.info("Admission pipeline: mutating={}, validating={}", names(mutatingStages), names(validatingStages));
    }

    @Override
    public Mono<AdmissionResult> admit(AdmissionRequest request) {
        return Mono.defer(() -> mutate(request, 0))
                .doOnSuccess(result -> {
                    if (result == null) {
                        return;
                    }
                    if (result.isAllowed()) {
                        metrics.incrementRequest(request.getKind(), "allow");
                    } else {
                        metrics.incrementRequest(request.getKind(), "deny");
                        logger.info("Request {} denied by stage {}: {}", request.getId(), result.getVerdict().getStageName(), result.getVerdict().getReason());
                    }
                })
                .doOnError(error -> {
                    metrics.incrementRequest(request.getKind(), "error");
                    logger.info("Request {} rejected: {}", request.getId(), error.getMessage());
                })
                .doOnCancel(() -> logger.debug("Admission of request {} cancelled", request.getId()));
    }

    @Override
    public List<StageDescriptor> getStages() {
        List<StageDescriptor> all = new ArrayList<>();
        mutatingStages.forEach(stage -> all.add(stage.getDescriptor()));
        validatingStages.forEach(stage -> all.add(stage.getDescriptor()));
        return all;
    }

    private Mono<AdmissionResult> mutate(AdmissionRequest request, int index) {
        if (index >= mutatingStages.size()) {
            return validate(request, 0);
        }
        AdmissionStage stage = mutatingStages.get(index);
        StageDescriptor descriptor = stage.getDescriptor();
        if (!descriptor.getMatcher().matches(request)) {
            return mutate(request, index + 1);
        }

        return evaluate(stage, request)
                .flatMap(decisionOpt -> {
                    if (!decisionOpt.isPresent()) {
                        return mutate(request, index + 1);
                    }
                    StageDecision decision = decisionOpt.get();
                    if (decision.getKind() != StageKind.Mutating || decision.getVerdict().isPresent()) {
                        metrics.incrementFailure(descriptor.getName(), new IllegalStateException());
                        return Mono.error(AdmissionException.mutationFailed(descriptor.getName(), "mutating stage returned a verdict"));
                    }
                    Patch patch = decision.getPatch().orElse(Patch.empty());
                    if (patch.isEmpty()) {
                        metrics.incrementUnchanged(descriptor.getName());
                        return mutate(request, index + 1);
                    }
                    AdmissionRequest patched;
                    try {
                        ObjectNode payload = JsonPatches.apply(request.getPayload(), patch);
                        patched = request.toBuilder().withPayload(payload).build();
                    } catch (JsonPatchException e) {
                        metrics.incrementFailure(descriptor.getName(), e);
                        return Mono.error(AdmissionException.mutationFailed(descriptor.getName(), e));
                    }
                    metrics.incrementPatched(descriptor.getName());
                    logger.debug("Stage {} patched request {}: {}", descriptor.getName(), request.getId(), patch);
                    return mutate(patched, index + 1);
                })
                .switchIfEmpty(Mono.defer(() -> Mono.just(new AdmissionResult(request, AdmissionVerdict.deny(descriptor.getName(), WEBHOOK_UNAVAILABLE)))));
    }

    private Mono<AdmissionResult> validate(AdmissionRequest request, int index) {
        if (index >= validatingStages.size()) {
            return Mono.just(new AdmissionResult(request, AdmissionVerdict.allow()));
        }
        AdmissionStage stage = validatingStages.get(index);
        StageDescriptor descriptor = stage.getDescriptor();
        if (!descriptor.getMatcher().matches(request)) {
            return validate(request, index + 1);
        }

        return evaluate(stage, request)
                .flatMap(decisionOpt -> {
                    if (!decisionOpt.isPresent()) {
                        return validate(request, index + 1);
                    }
                    StageDecision decision = decisionOpt.get();
                    if (decision.getKind() != StageKind.Validating || decision.getPatch().isPresent()) {
                        metrics.incrementFailure(descriptor.getName(), new IllegalStateException());
                        return Mono.error(AdmissionException.admissionFailed(descriptor.getName(), "validating stage returned a patch"));
                    }
                    AdmissionVerdict verdict = decision.getVerdict().orElse(AdmissionVerdict.allow());
                    if (verdict.isAllowed()) {
                        metrics.incrementAllowed(descriptor.getName());
                        return validate(request, index + 1);
                    }
                    metrics.incrementDenied(descriptor.getName());
                    return Mono.just(new AdmissionResult(request, verdict.attributedTo(descriptor.getName())));
                })
                .switchIfEmpty(Mono.defer(() -> Mono.just(new AdmissionResult(request, AdmissionVerdict.deny(descriptor.getName(), WEBHOOK_UNAVAILABLE)))));
    }

    /**
     * Evaluates a single stage. Emits:
     * <ul>
     *     <li>a decision, if the stage completed</li>
     *     <li>{@link Optional#empty()}, if the stage failed, and its failure policy says to ignore it</li>
     *     <li>no value, if the stage failed, and its failure policy says to deny the request</li>
     *     <li>an error for failures not covered by the failure policy</li>
     * </ul>
     */
    private Mono<Optional<StageDecision>> evaluate(AdmissionStage stage, AdmissionRequest request) {
        StageDescriptor descriptor = stage.getDescriptor();
        String stageName = descriptor.getName();
        Duration timeout = descriptor.getTimeout().orElse(defaultTimeout);

        return Mono.defer(() -> {
            long startTime = clock.wallTime();
            return Mono.defer(() -> stage.evaluate(request))
                    .defaultIfEmpty(descriptor.getKind() == StageKind.Mutating ? StageDecision.noChange() : StageDecision.allow())
                    .timeout(timeout, Mono.error(() -> AdmissionException.admissionFailed(stageName, "timed out after " + timeout.toMillis() + "ms")))
                    .doFinally(signal -> metrics.recordLatency(stageName, clock.wallTime() - startTime))
                    .map(Optional::of)
                    .onErrorResume(error -> handleStageError(descriptor, request, error));
        });
    }

    private Mono<Optional<StageDecision>> handleStageError(StageDescriptor descriptor, AdmissionRequest request, Throwable error) {
        String stageName = descriptor.getName();
        if (AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.AdmissionFailed)) {
            if (descriptor.getFailurePolicy() == FailurePolicy.Ignore) {
                logger.warn("Stage {} failed for request {}, ignoring it: {}", stageName, request.getId(), error.getMessage());
                metrics.incrementSkipped(stageName, error.getClass().getSimpleName());
                return Mono.just(Optional.empty());
            }
            logger.warn("Stage {} failed for request {}, denying the request: {}", stageName, request.getId(), error.getMessage());
            metrics.incrementFailure(stageName, error);
            return Mono.empty();
        }

        metrics.incrementFailure(stageName, error);
        if (isPropagated(error)) {
            return Mono.error(error);
        }
        logger.warn("Unexpected error in stage {} for request {}", stageName, request.getId(), error);
        return descriptor.getKind() == StageKind.Mutating
                ? Mono.error(AdmissionException.mutationFailed(stageName, error))
                : Mono.error(AdmissionException.admissionFailed(stageName, error));
    }

    /**
     * Typed errors produced by the stages on purpose. Any other error indicates a stage malfunction.
     */
    private static boolean isPropagated(Throwable error) {
        return error instanceof AdmissionException
                || error instanceof PriorityClassException
                || error instanceof SchedulerException;
    }

    private static List<AdmissionStage> sortedOfKind(Collection<AdmissionStage> stages, StageKind kind) {
        return stages.stream()
                .filter(stage -> stage.getDescriptor().getKind() == kind)
                .sorted((first, second) -> StageDescriptor.EXECUTION_ORDER.compare(first.getDescriptor(), second.getDescriptor()))
                .collect(ImmutableList.toImmutableList());
    }

    private static List<String> names(List<AdmissionStage> stages) {
        return stages.stream().map(stage -> stage.getDescriptor().getName()).collect(Collectors.toList());
    }
}
