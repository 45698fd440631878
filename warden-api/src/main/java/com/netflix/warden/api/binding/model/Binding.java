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

package com.netflix.warden.api.binding.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable fact that a workload occupies a resource pool. The revision is assigned by the store, and is strictly
 * increasing across all bindings.
 */
public class Binding {

    private final String workloadId;
    private final String poolId;
    private final long timestamp;
    private final long revision;

    @JsonCreator
    public Binding(@JsonProperty("workloadId") String workloadId,
                   @JsonProperty("poolId") String poolId,
                   @JsonProperty("timestamp") long timestamp,
                   @JsonProperty("revision") long revision) {
        this.workloadId = workloadId;
        this.poolId = poolId;
        this.timestamp = timestamp;
        this.revision = revision;
    }

    public String getWorkloadId() {
        return workloadId;
    }

    public String getPoolId() {
        return poolId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getRevision() {
        return revision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Binding binding = (Binding) o;
        return timestamp == binding.timestamp &&
                revision == binding.revision &&
                Objects.equals(workloadId, binding.workloadId) &&
                Objects.equals(poolId, binding.poolId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workloadId, poolId, timestamp, revision);
    }

    @Override
    public String toString() {
        return "Binding{" +
                "workloadId='" + workloadId + '\'' +
                ", poolId='" + poolId + '\'' +
                ", timestamp=" + timestamp +
                ", revision=" + revision +
                '}';
    }
}
