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

import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.model.PriorityClass;

public final class PriorityClassGenerator {

    private PriorityClassGenerator() {
    }

    public static PriorityClass priorityClass(String name, int value, PreemptionPolicy preemptionPolicy) {
        return PriorityClass.newBuilder()
                .withName(name)
                .withValue(value)
                .withPreemptionPolicy(preemptionPolicy)
                .withDescription("Test priority class " + name)
                .build();
    }

    public static PriorityClass defaultPriorityClass(String name, int value) {
        return priorityClass(name, value, PreemptionPolicy.CanPreemptLower).toBuilder().withDefault(true).build();
    }

    /**
     * Value 1_000_000, allowed to preempt.
     */
    public static PriorityClass highPriority() {
        return priorityClass("high", 1_000_000, PreemptionPolicy.CanPreemptLower);
    }

    /**
     * Value 100, never preempts.
     */
    public static PriorityClass lowPriority() {
        return priorityClass("low", 100, PreemptionPolicy.NeverPreempt);
    }
}
