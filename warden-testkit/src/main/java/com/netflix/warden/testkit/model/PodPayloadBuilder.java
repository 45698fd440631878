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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.scheduler.model.TaintEffect;

public class PodPayloadBuilder {

    private final ObjectNode payload;

    private PodPayloadBuilder(String name) {
        this.payload = JsonNodeFactory.instance.objectNode();
        payload.putObject(PayloadFields.METADATA).put(PayloadFields.NAME, name);
        payload.putObject(PayloadFields.SPEC);
    }

    public static PodPayloadBuilder newPod(String name) {
        return new PodPayloadBuilder(name);
    }

    public PodPayloadBuilder withLabel(String key, String value) {
        metadata().with(PayloadFields.LABELS).put(key, value);
        return this;
    }

    public PodPayloadBuilder withPriorityClassName(String priorityClassName) {
        spec().put(PayloadFields.PRIORITY_CLASS_NAME, priorityClassName);
        return this;
    }

    public PodPayloadBuilder withResources(double cpu, long memoryMB) {
        spec().with(PayloadFields.RESOURCES).with(PayloadFields.REQUESTS)
                .put(PayloadFields.CPU, cpu)
                .put(PayloadFields.MEMORY_MB, memoryMB);
        return this;
    }

    public PodPayloadBuilder withCpu(double cpu) {
        spec().with(PayloadFields.RESOURCES).with(PayloadFields.REQUESTS).put(PayloadFields.CPU, cpu);
        return this;
    }

    public PodPayloadBuilder withToleration(String key, String operator, String value, TaintEffect effect) {
        ObjectNode toleration = tolerations().addObject()
                .put(PayloadFields.KEY, key)
                .put(PayloadFields.OPERATOR, operator);
        if (value != null) {
            toleration.put(PayloadFields.VALUE, value);
        }
        if (effect != null) {
            toleration.put(PayloadFields.EFFECT, effect.name());
        }
        return this;
    }

    public PodPayloadBuilder withRequiredAffinity(String key, String operator, String... values) {
        ObjectNode requirement = spec().with(PayloadFields.AFFINITY).withArray(PayloadFields.REQUIRED).addObject()
                .put(PayloadFields.KEY, key)
                .put(PayloadFields.OPERATOR, operator);
        ArrayNode valueArray = requirement.putArray(PayloadFields.VALUES);
        for (String value : values) {
            valueArray.add(value);
        }
        return this;
    }

    public ObjectNode build() {
        return payload.deepCopy();
    }

    private ObjectNode metadata() {
        return (ObjectNode) payload.get(PayloadFields.METADATA);
    }

    private ObjectNode spec() {
        return (ObjectNode) payload.get(PayloadFields.SPEC);
    }

    private ArrayNode tolerations() {
        return spec().withArray(PayloadFields.TOLERATIONS);
    }
}
