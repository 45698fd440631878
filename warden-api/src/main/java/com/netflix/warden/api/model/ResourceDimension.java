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

package com.netflix.warden.api.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Encapsulates a resource vector (CPU, memory). The same model represents workload demand, pool capacity and
 * pool occupancy.
 */
public class ResourceDimension {

    private static final ResourceDimension EMPTY = new ResourceDimension(0, 0);

    private final double cpu;
    private final long memoryMB;

    @JsonCreator
    public ResourceDimension(@JsonProperty("cpu") double cpu,
                             @JsonProperty("memoryMB") long memoryMB) {
        this.cpu = cpu;
        this.memoryMB = memoryMB;
    }

    public double getCpu() {
        return cpu;
    }

    public long getMemoryMB() {
        return memoryMB;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourceDimension that = (ResourceDimension) o;
        return Double.compare(that.cpu, cpu) == 0 &&
                memoryMB == that.memoryMB;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cpu, memoryMB);
    }

    @Override
    public String toString() {
        return "ResourceDimension{" +
                "cpu=" + cpu +
                ", memoryMB=" + memoryMB +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder(this);
    }

    public static ResourceDimension empty() {
        return EMPTY;
    }

    public static ResourceDimension of(double cpu, long memoryMB) {
        return new ResourceDimension(cpu, memoryMB);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(ResourceDimension source) {
        return new Builder()
                .withCpus(source.getCpu())
                .withMemoryMB(source.getMemoryMB());
    }

    public static final class Builder {
        private double cpus;
        private long memoryMB;

        private Builder() {
        }

        public Builder withCpus(double cpus) {
            this.cpus = cpus;
            return this;
        }

        public Builder withMemoryMB(long memoryMB) {
            this.memoryMB = memoryMB;
            return this;
        }

        public ResourceDimension build() {
            return new ResourceDimension(cpus, memoryMB);
        }
    }
}
