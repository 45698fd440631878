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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.netflix.warden.api.admission.model.PayloadFields;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.model.PriorityClass;
import com.netflix.warden.common.util.StringExt;

public final class PriorityClassPayloads {

    private PriorityClassPayloads() {
    }

    public static PriorityClass toPriorityClass(ObjectNode payload) {
        String name = payload.path(PayloadFields.METADATA).path(PayloadFields.NAME).asText("");
        Preconditions.checkArgument(StringExt.isNotEmpty(name), "metadata.name not set");

        JsonNode value = payload.path(PayloadFields.VALUE);
        Preconditions.checkArgument(value.isIntegralNumber() && value.canConvertToInt(), "value must be a 32-bit integer");

        String preemptionPolicy = payload.path(PayloadFields.PREEMPTION_POLICY).asText("");
        return PriorityClass.newBuilder()
                .withName(name)
                .withValue(value.asInt())
                .withDefault(payload.path(PayloadFields.GLOBAL_DEFAULT).asBoolean(false))
                .withPreemptionPolicy(preemptionPolicy.isEmpty()
                        ? PreemptionPolicy.CanPreemptLower
                        : StringExt.parseEnumIgnoreCase(preemptionPolicy, PreemptionPolicy.class))
                .withDescription(payload.path(PayloadFields.DESCRIPTION).asText(""))
                .build();
    }
}
