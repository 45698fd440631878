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

package com.netflix.warden.api.scheduler.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.common.util.StringExt;

/**
 * An admitted unit of work waiting for, or holding, a placement. A workload does not reference the pool it is
 * bound to. Placement is recorded as a separate binding.
 */
public class Workload {

    private final String id;
    private final String namespace;
    private final String name;
    private final String priorityClassName;
    private final int priority;
    private final PreemptionPolicy preemptionPolicy;
    private final ResourceDimension demand;
    private final List<Toleration> tolerations;
    private final List<NodeSelectorRequirement> requiredAffinity;
    private final List<PreferredAffinityTerm> preferredAffinity;
    private final long creationSequence;
    private final long creationTimestamp;

    private Workload(String id,
                     String namespace,
                     String name,
                     String priorityClassName,
                     int priority,
                     PreemptionPolicy preemptionPolicy,
                     ResourceDimension demand,
                     List<Toleration> tolerations,
                     List<NodeSelectorRequirement> requiredAffinity,
                     List<PreferredAffinityTerm> preferredAffinity,
                     long creationSequence,
                     long creationTimestamp) {
        this.id = id;
        this.namespace = namespace;
        this.name = name;
        this.priorityClassName = priorityClassName;
        this.priority = priority;
        this.preemptionPolicy = preemptionPolicy;
        this.demand = demand;
        this.tolerations = tolerations;
        this.requiredAffinity = requiredAffinity;
        this.preferredAffinity = preferredAffinity;
        this.creationSequence = creationSequence;
        this.creationTimestamp = creationTimestamp;
    }

    public String getId() {
        return id;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public String getPriorityClassName() {
        return priorityClassName;
    }

    public int getPriority() {
        return priority;
    }

    public PreemptionPolicy getPreemptionPolicy() {
        return preemptionPolicy;
    }

    public ResourceDimension getDemand() {
        return demand;
    }

    public List<Toleration> getTolerations() {
        return tolerations;
    }

    public List<NodeSelectorRequirement> getRequiredAffinity() {
        return requiredAffinity;
    }

    public List<PreferredAffinityTerm> getPreferredAffinity() {
        return preferredAffinity;
    }

    /**
     * Arrival order. Workloads with equal priority are scheduled, and evicted, in this order.
     */
    public long getCreationSequence() {
        return creationSequence;
    }

    public long getCreationTimestamp() {
        return creationTimestamp;
    }

    public boolean tolerates(Taint taint) {
        for (Toleration toleration : tolerations) {
            if (toleration.tolerates(taint)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Workload workload = (Workload) o;
        return priority == workload.priority &&
                creationSequence == workload.creationSequence &&
                creationTimestamp == workload.creationTimestamp &&
                Objects.equals(id, workload.id) &&
                Objects.equals(namespace, workload.namespace) &&
                Objects.equals(name, workload.name) &&
                Objects.equals(priorityClassName, workload.priorityClassName) &&
                preemptionPolicy == workload.preemptionPolicy &&
                Objects.equals(demand, workload.demand) &&
                Objects.equals(tolerations, workload.tolerations) &&
                Objects.equals(requiredAffinity, workload.requiredAffinity) &&
                Objects.equals(preferredAffinity, workload.preferredAffinity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, namespace, name, priorityClassName, priority, preemptionPolicy, demand, tolerations,
                requiredAffinity, preferredAffinity, creationSequence, creationTimestamp);
    }

    @Override
    public String toString() {
        return "Workload{" +
                "id='" + id + '\'' +
                ", namespace='" + namespace + '\'' +
                ", name='" + name + '\'' +
                ", priorityClassName='" + priorityClassName + '\'' +
                ", priority=" + priority +
                ", preemptionPolicy=" + preemptionPolicy +
                ", demand=" + demand +
                ", tolerations=" + tolerations +
                ", requiredAffinity=" + requiredAffinity +
                ", preferredAffinity=" + preferredAffinity +
                ", creationSequence=" + creationSequence +
                ", creationTimestamp=" + creationTimestamp +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withId(id)
                .withNamespace(namespace)
                .withName(name)
                .withPriorityClassName(priorityClassName)
                .withPriority(priority)
                .withPreemptionPolicy(preemptionPolicy)
                .withDemand(demand)
                .withTolerations(tolerations)
                .withRequiredAffinity(requiredAffinity)
                .withPreferredAffinity(preferredAffinity)
                .withCreationSequence(creationSequence)
                .withCreationTimestamp(creationTimestamp);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String namespace;
        private String name;
        private String priorityClassName;
        private int priority;
        private PreemptionPolicy preemptionPolicy;
        private ResourceDimension demand;
        private List<Toleration> tolerations;
        private List<NodeSelectorRequirement> requiredAffinity;
        private List<PreferredAffinityTerm> preferredAffinity;
        private long creationSequence;
        private long creationTimestamp;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withPriorityClassName(String priorityClassName) {
            this.priorityClassName = priorityClassName;
            return this;
        }

        public Builder withPriority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder withPreemptionPolicy(PreemptionPolicy preemptionPolicy) {
            this.preemptionPolicy = preemptionPolicy;
            return this;
        }

        public Builder withDemand(ResourceDimension demand) {
            this.demand = demand;
            return this;
        }

        public Builder withTolerations(List<Toleration> tolerations) {
            this.tolerations = tolerations;
            return this;
        }

        public Builder withRequiredAffinity(List<NodeSelectorRequirement> requiredAffinity) {
            this.requiredAffinity = requiredAffinity;
            return this;
        }

        public Builder withPreferredAffinity(List<PreferredAffinityTerm> preferredAffinity) {
            this.preferredAffinity = preferredAffinity;
            return this;
        }

        public Builder withCreationSequence(long creationSequence) {
            this.creationSequence = creationSequence;
            return this;
        }

        public Builder withCreationTimestamp(long creationTimestamp) {
            this.creationTimestamp = creationTimestamp;
            return this;
        }

        public Workload build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(id), "Workload id not set");
            return new Workload(
                    id,
                    StringExt.nonNull(namespace),
                    StringExt.isEmpty(name) ? id : name,
                    StringExt.nonNull(priorityClassName),
                    priority,
                    preemptionPolicy == null ? PreemptionPolicy.CanPreemptLower : preemptionPolicy,
                    demand == null ? ResourceDimension.empty() : demand,
                    tolerations == null ? Collections.emptyList() : ImmutableList.copyOf(tolerations),
                    requiredAffinity == null ? Collections.emptyList() : ImmutableList.copyOf(requiredAffinity),
                    preferredAffinity == null ? Collections.emptyList() : ImmutableList.copyOf(preferredAffinity),
                    creationSequence,
                    creationTimestamp
            );
        }
    }
}
