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
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of a single placement attempt.
 */
public class SchedulingResult {

    private final String workloadId;
    private final WorkloadState state;
    private final Optional<String> poolId;
    private final List<String> preemptedWorkloadIds;
    private final String reason;

    private SchedulingResult(String workloadId,
                             WorkloadState state,
                             Optional<String> poolId,
                             List<String> preemptedWorkloadIds,
                             String reason) {
        this.workloadId = workloadId;
        this.state = state;
        this.poolId = poolId;
        this.preemptedWorkloadIds = preemptedWorkloadIds;
        this.reason = reason;
    }

    public String getWorkloadId() {
        return workloadId;
    }

    public WorkloadState getState() {
        return state;
    }

    public Optional<String> getPoolId() {
        return poolId;
    }

    /**
     * Workloads evicted to make room for this one, in eviction order. Empty unless placed via preemption.
     */
    public List<String> getPreemptedWorkloadIds() {
        return preemptedWorkloadIds;
    }

    public String getReason() {
        return reason;
    }

    public boolean isBound() {
        return state == WorkloadState.Bound;
    }

    public static SchedulingResult bound(String workloadId, String poolId) {
        return new SchedulingResult(workloadId, WorkloadState.Bound, Optional.of(poolId), Collections.emptyList(), "");
    }

    public static SchedulingResult boundAfterPreemption(String workloadId, String poolId, List<String> preemptedWorkloadIds) {
        return new SchedulingResult(workloadId, WorkloadState.Bound, Optional.of(poolId), ImmutableList.copyOf(preemptedWorkloadIds), "");
    }

    public static SchedulingResult unschedulable(String workloadId, String reason) {
        return new SchedulingResult(workloadId, WorkloadState.Unschedulable, Optional.empty(), Collections.emptyList(), reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SchedulingResult that = (SchedulingResult) o;
        return Objects.equals(workloadId, that.workloadId) &&
                state == that.state &&
                Objects.equals(poolId, that.poolId) &&
                Objects.equals(preemptedWorkloadIds, that.preemptedWorkloadIds) &&
                Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workloadId, state, poolId, preemptedWorkloadIds, reason);
    }

    @Override
    public String toString() {
        return "SchedulingResult{" +
                "workloadId='" + workloadId + '\'' +
                ", state=" + state +
                ", poolId=" + poolId +
                ", preemptedWorkloadIds=" + preemptedWorkloadIds +
                ", reason='" + reason + '\'' +
                '}';
    }
}
