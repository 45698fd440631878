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

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.model.PriorityClass;
import com.netflix.warden.api.scheduler.model.NodeSelectorRequirement;
import com.netflix.warden.api.scheduler.model.PreferredAffinityTerm;
import com.netflix.warden.api.scheduler.model.Toleration;
import com.netflix.warden.api.scheduler.model.Workload;

/**
 * Produces workloads with increasing creation sequence numbers. Each generator instance starts from 1, so
 * two generators used in the same way produce identical workloads.
 */
public class WorkloadGenerator {

    private final AtomicLong sequence = new AtomicLong();

    public Workload workload(String id, int priority, PreemptionPolicy preemptionPolicy, double cpu, long memoryMB) {
        long next = sequence.incrementAndGet();
        return Workload.newBuilder()
                .withId(id)
                .withNamespace("default")
                .withName(id)
                .withPriority(priority)
                .withPreemptionPolicy(preemptionPolicy)
                .withDemand(ResourceDimension.of(cpu, memoryMB))
                .withCreationSequence(next)
                .withCreationTimestamp(next)
                .build();
    }

    public Workload workload(String id, PriorityClass priorityClass, double cpu, long memoryMB) {
        return workload(id, priorityClass.getValue(), priorityClass.getPreemptionPolicy(), cpu, memoryMB)
                .toBuilder()
                .withPriorityClassName(priorityClass.getName())
                .build();
    }

    public static Workload withTolerations(Workload workload, Toleration... tolerations) {
        return workload.toBuilder().withTolerations(Arrays.asList(tolerations)).build();
    }

    public static Workload withRequiredAffinity(Workload workload, NodeSelectorRequirement... requirements) {
        return workload.toBuilder().withRequiredAffinity(Arrays.asList(requirements)).build();
    }

    public static Workload withPreferredAffinity(Workload workload, PreferredAffinityTerm... terms) {
        return workload.toBuilder().withPreferredAffinity(Arrays.asList(terms)).build();
    }
}
