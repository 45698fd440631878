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

package com.netflix.warden.testkit.model;

import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.Operation;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.admission.model.ResourceKinds;
import com.netflix.warden.api.admission.model.UserInfo;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.scheduler.model.Taint;

/**
 * Builders of admission requests for the resource kinds with built-in handling.
 */
public final class AdmissionRequestGenerator {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    public static final UserInfo TEST_USER = UserInfo.of("alice", "developers");

    private AdmissionRequestGenerator() {
    }

    public static AdmissionRequest request(Operation operation, String kind, String namespace, ObjectNode payload) {
        return AdmissionRequest.newBuilder()
                .withId("request#" + NEXT_ID.incrementAndGet())
                .withOperation(operation)
                .withKind(kind)
                .withNamespace(namespace)
                .withUserInfo(TEST_USER)
                .withPayload(payload)
                .withCreatedAt(System.currentTimeMillis())
                .build();
    }

    public static AdmissionRequest createPod(String namespace, ObjectNode payload) {
        return request(Operation.CREATE, ResourceKinds.POD, namespace, payload);
    }

    public static AdmissionRequest createPod(String namespace, String name) {
        return createPod(namespace, PodPayloadBuilder.newPod(name).build());
    }

    public static AdmissionRequest deletePod(String namespace, String name) {
        return request(Operation.DELETE, ResourceKinds.POD, namespace, metadata(name));
    }

    public static AdmissionRequest createNamespace(String name) {
        return request(Operation.CREATE, ResourceKinds.NAMESPACE, "", metadata(name));
    }

    public static AdmissionRequest deleteNamespace(String name) {
        return request(Operation.DELETE, ResourceKinds.NAMESPACE, "", metadata(name));
    }

    public static AdmissionRequest createPriorityClass(String name, int value, boolean globalDefault, PreemptionPolicy preemptionPolicy) {
        return request(Operation.CREATE, ResourceKinds.PRIORITY_CLASS, "", priorityClassPayload(name, value, globalDefault, preemptionPolicy));
    }

    public static AdmissionRequest updatePriorityClass(String name, int value, boolean globalDefault, PreemptionPolicy preemptionPolicy) {
        return request(Operation.UPDATE, ResourceKinds.PRIORITY_CLASS, "", priorityClassPayload(name, value, globalDefault, preemptionPolicy));
    }

    public static AdmissionRequest createNode(String name, double cpu, long memoryMB, Taint... taints) {
        return request(Operation.CREATE, ResourceKinds.NODE, "", nodePayload(name, cpu, memoryMB, taints));
    }

    public static AdmissionRequest updateNode(String name, double cpu, long memoryMB, Taint... taints) {
        return request(Operation.UPDATE, ResourceKinds.NODE, "", nodePayload(name, cpu, memoryMB, taints));
    }

    public static ObjectNode metadata(String name) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject(PayloadFields.METADATA).put(PayloadFields.NAME, name);
        return payload;
    }

    public static ObjectNode priorityClassPayload(String name, int value, boolean globalDefault, PreemptionPolicy preemptionPolicy) {
        ObjectNode payload = metadata(name);
        payload.put(PayloadFields.VALUE, value);
        payload.put(PayloadFields.GLOBAL_DEFAULT, globalDefault);
        payload.put(PayloadFields.PREEMPTION_POLICY, preemptionPolicy.name());
        return payload;
    }

    public static ObjectNode nodePayload(String name, double cpu, long memoryMB, Taint... taints) {
        ObjectNode payload = metadata(name);
        ObjectNode spec = payload.putObject(PayloadFields.SPEC);
        spec.putObject(PayloadFields.CAPACITY)
                .put(PayloadFields.CPU, cpu)
                .put(PayloadFields.MEMORY_MB, memoryMB);
        ArrayNode taintArray = spec.putArray(PayloadFields.TAINTS);
        for (Taint taint : taints) {
            taintArray.addObject()
                    .put(PayloadFields.KEY, taint.getKey())
                    .put(PayloadFields.VALUE, taint.getValue())
                    .put(PayloadFields.EFFECT, taint.getEffect().name());
        }
        return payload;
    }
}
