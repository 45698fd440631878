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

package com.netflix.warden.server.gateway;

import java.util.concurrent.atomic.AtomicLong;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionResult;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.service.AdmissionException;
import com.netflix.warden.api.admission.service.AdmissionService;
import com.netflix.warden.api.admission.service.Authorizer;
import com.netflix.warden.api.gateway.AdmissionResponse;
import com.netflix.warden.api.gateway.ResourceGateway;
import com.netflix.warden.api.namespace.service.NamespaceRegistry;
import com.netflix.warden.api.priority.service.PriorityClassRegistry;
import com.netflix.warden.api.scheduler.service.SchedulingService;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.StringExt;
import com.netflix.warden.common.util.time.Clock;
import com.netflix.warden.server.admission.stage.NamespaceAutoProvisionStage;
import com.netflix.warden.server.payload.NodePayloads;
import com.netflix.warden.server.payload.PodPayloads;
import com.netflix.warden.server.payload.PriorityClassPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Authorizes, admits and applies resource requests. Admitted requests are recorded by the audit logger before
 * they are applied.
 */
@Singleton
public class DefaultResourceGateway implements ResourceGateway {

    private static final Logger logger = LoggerFactory.getLogger(DefaultResourceGateway.class);

    private static final Logger auditLogger = LoggerFactory.getLogger("com.netflix.warden.audit");

    private final Authorizer authorizer;
    private final AdmissionService admissionService;
    private final NamespaceRegistry namespaceRegistry;
    private final PriorityClassRegistry priorityClassRegistry;
    private final SchedulingService schedulingService;
    private final Clock clock;

    private final AtomicLong workloadSequence = new AtomicLong();

    @Inject
    public DefaultResourceGateway(Authorizer authorizer,
                                  AdmissionService admissionService,
                                  NamespaceRegistry namespaceRegistry,
                                  PriorityClassRegistry priorityClassRegistry,
                                  SchedulingService schedulingService,
                                  WardenRuntime runtime) {
        this.authorizer = authorizer;
        this.admissionService = admissionService;
        this.namespaceRegistry = namespaceRegistry;
        this.priorityClassRegistry = priorityClassRegistry;
        this.schedulingService = schedulingService;
        this.clock = runtime.getClock();
    }

    @Override
    public Mono<AdmissionResponse> submit(AdmissionRequest request) {
        return authorizer.authorize(request)
                .onErrorMap(error -> !AdmissionException.hasErrorCode(error, AdmissionException.ErrorCode.Unauthorized),
                        error -> AdmissionException.unauthorized(request, error.getMessage())
                )
                .switchIfEmpty(Mono.error(() -> AdmissionException.unauthorized(request, "no identity")))
                .map(userInfo -> request.toBuilder().withUserInfo(userInfo).build())
                .flatMap(admissionService::admit)
                .map(this::apply);
    }

    private AdmissionResponse apply(AdmissionResult result) {
        AdmissionRequest request = result.getRequest();
        if (!result.isAllowed()) {
            auditLogger.info("DENIED id={}, user={}, operation={}, kind={}, namespace={}, name={}, stage={}, reason={}",
                    request.getId(), request.getUserInfo().getUsername(), request.getOperation(), request.getKind(),
                    request.getNamespace(), request.getName(), result.getVerdict().getStageName(), result.getVerdict().getReason()
            );
            throw AdmissionException.denied(result.getVerdict());
        }

        auditLogger.info("ADMITTED id={}, user={}, operation={}, kind={}, namespace={}, name={}, object={}",
                request.getId(), request.getUserInfo().getUsername(), request.getOperation(), request.getKind(),
                request.getNamespace(), request.getName(), request.getPayload()
        );

        boolean provisioned = false;
        if (NamespaceAutoProvisionStage.isMarkedForProvisioning(request) && !namespaceRegistry.find(request.getNamespace()).isPresent()) {
            namespaceRegistry.create(request.getNamespace());
            provisioned = true;
            logger.info("Namespace {} provisioned for request {}", request.getNamespace(), request.getId());
        }

        try {
            switch (request.getKind()) {
                case ResourceKinds.NAMESPACE:
                    applyNamespace(request);
                    break;
                case ResourceKinds.PRIORITY_CLASS:
                    applyPriorityClass(request);
                    break;
                case ResourceKinds.NODE:
                    applyNode(request);
                    break;
                case ResourceKinds.POD:
                    applyPod(request);
                    break;
                default:
                    logger.debug("No handler for kind {}, request {} admitted without side effects", request.getKind(), request.getId());
            }
        } catch (RuntimeException e) {
            if (provisioned) {
                namespaceRegistry.remove(request.getNamespace());
                logger.info("Namespace {} provisioned for failed request {} removed", request.getNamespace(), request.getId());
            }
            if (e instanceof IllegalArgumentException) {
                throw AdmissionException.invalidRequest(request, e.getMessage());
            }
            throw e;
        }
        return new AdmissionResponse(request, provisioned);
    }

    private void applyNamespace(AdmissionRequest request) {
        String name = requireName(request);
        switch (request.getOperation()) {
            case CREATE:
                namespaceRegistry.create(name);
                break;
            case DELETE:
                namespaceRegistry.terminate(name);
                break;
            default:
        }
    }

    private void applyPriorityClass(AdmissionRequest request) {
        switch (request.getOperation()) {
            case CREATE:
                priorityClassRegistry.create(PriorityClassPayloads.toPriorityClass(request.getPayload()));
                break;
            case UPDATE:
                priorityClassRegistry.update(PriorityClassPayloads.toPriorityClass(request.getPayload()));
                break;
            case DELETE:
                priorityClassRegistry.delete(requireName(request));
                break;
            default:
        }
    }

    private void applyNode(AdmissionRequest request) {
        switch (request.getOperation()) {
            case CREATE:
                schedulingService.addPool(NodePayloads.toResourcePool(request.getPayload()));
                break;
            case UPDATE:
                schedulingService.updatePool(NodePayloads.toResourcePool(request.getPayload()));
                break;
            case DELETE:
                schedulingService.removePool(requireName(request));
                break;
            default:
        }
    }

    private void applyPod(AdmissionRequest request) {
        switch (request.getOperation()) {
            case CREATE:
                schedulingService.submit(PodPayloads.toWorkload(request, workloadSequence.incrementAndGet(), clock.wallTime()));
                break;
            case DELETE:
                schedulingService.removeWorkload(PodPayloads.workloadId(request.getNamespace(), requireName(request)));
                break;
            default:
                // Pod specs are immutable once submitted.
                logger.debug("Ignoring pod update request {}", request.getId());
        }
    }

    private static String requireName(AdmissionRequest request) {
        String name = request.getName();
        if (StringExt.isEmpty(name)) {
            throw new IllegalArgumentException("metadata.name not set");
        }
        return name;
    }
}
