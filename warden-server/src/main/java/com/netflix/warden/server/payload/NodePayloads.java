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

package com.netflix.warden.server.payload;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.scheduler.model.ResourcePool;
import com.netflix.warden.api.scheduler.model.Taint;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.common.util.StringExt;

/**
 * Reads Node documents into resource pools.
 */
public final class NodePayloads {

    private NodePayloads() {
    }

    public static ResourcePool toResourcePool(ObjectNode payload) {
        String name = payload.path(PayloadFields.METADATA).path(PayloadFields.NAME).asText("");
        Preconditions.checkArgument(StringExt.isNotEmpty(name), "metadata.name not set");

        JsonNode capacity = payload.path(PayloadFields.SPEC).path(PayloadFields.CAPACITY);
        Preconditions.checkArgument(capacity.isObject(), "spec.capacity not set");
        Preconditions.checkArgument(capacity.path(PayloadFields.CPU).isNumber(), "spec.capacity.cpu must be a number");
        Preconditions.checkArgument(capacity.path(PayloadFields.MEMORY_MB).isIntegralNumber(), "spec.capacity.memoryMB must be an integer");

        Map<String, String> labels = new HashMap<>();
        payload.path(PayloadFields.METADATA).path(PayloadFields.LABELS).fields()
                .forEachRemaining(entry -> labels.put(entry.getKey(), entry.getValue().asText()));

        List<Taint> taints = new ArrayList<>();
        for (JsonNode taint : payload.path(PayloadFields.SPEC).path(PayloadFields.TAINTS)) {
            taints.add(Taint.of(
                    taint.path(PayloadFields.KEY).asText(""),
                    taint.path(PayloadFields.VALUE).asText(""),
                    StringExt.parseEnumIgnoreCase(taint.path(PayloadFields.EFFECT).asText(""), TaintEffect.class)
            ));
        }

        return ResourcePool.newBuilder()
                .withId(name)
                .withCapacity(ResourceDimension.of(capacity.path(PayloadFields.CPU).asDouble(), capacity.path(PayloadFields.MEMORY_MB).asLong()))
                .withLabels(labels)
                .withTaints(taints)
                .build();
    }
}
