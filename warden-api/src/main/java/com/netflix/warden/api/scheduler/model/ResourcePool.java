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
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.common.util.StringExt;

/**
 * Schedulable unit of capacity (a node). Pool occupancy is not kept here, but computed from the bindings.
 */
public class ResourcePool {

    private final String id;
    private final ResourceDimension capacity;
    private final Map<String, String> labels;
    private final List<Taint> taints;

    private ResourcePool(String id, ResourceDimension capacity, Map<String, String> labels, List<Taint> taints) {
        this.id = id;
        this.capacity = capacity;
        this.labels = labels;
        this.taints = taints;
    }

    public String getId() {
        return id;
    }

    public ResourceDimension getCapacity() {
        return capacity;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public List<Taint> getTaints() {
        return taints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourcePool that = (ResourcePool) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(capacity, that.capacity) &&
                Objects.equals(labels, that.labels) &&
                Objects.equals(taints, that.taints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, capacity, labels, taints);
    }

    @Override
    public String toString() {
        return "ResourcePool{" +
                "id='" + id + '\'' +
                ", capacity=" + capacity +
                ", labels=" + labels +
                ", taints=" + taints +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withId(id)
                .withCapacity(capacity)
                .withLabels(labels)
                .withTaints(taints);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ResourceDimension capacity;
        private Map<String, String> labels;
        private List<Taint> taints;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withCapacity(ResourceDimension capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder withLabels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder withTaints(List<Taint> taints) {
            this.taints = taints;
            return this;
        }

        public ResourcePool build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(id), "Resource pool id not set");
            Preconditions.checkNotNull(capacity, "Resource pool capacity not set");
            return new ResourcePool(
                    id,
                    capacity,
                    labels == null ? Collections.emptyMap() : ImmutableMap.copyOf(labels),
                    taints == null ? Collections.emptyList() : ImmutableList.copyOf(taints)
            );
        }
    }
}
