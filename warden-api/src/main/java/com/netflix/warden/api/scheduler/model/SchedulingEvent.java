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

import java.util.Objects;
import java.util.Optional;

/**
 * Workload state transition emitted by the scheduler.
 */
public class SchedulingEvent {

    public enum Type {
        Submitted,
        Bound,
        Preempted,
        Evicted,
        Unschedulable,
        Removed
    }

    private final Type type;
    private final String workloadId;
    private final Optional<String> poolId;
    private final String reason;
    private final long timestamp;

    public SchedulingEvent(Type type, String workloadId, Optional<String> poolId, String reason, long timestamp) {
        this.type = type;
        this.workloadId = workloadId;
        this.poolId = poolId;
        this.reason = reason;
        this.timestamp = timestamp;
    }

    public Type getType() {
        return type;
    }

    public String getWorkloadId() {
        return workloadId;
    }

    public Optional<String> getPoolId() {
        return poolId;
    }

    public String getReason() {
        return reason;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SchedulingEvent that = (SchedulingEvent) o;
        return timestamp == that.timestamp &&
                type == that.type &&
                Objects.equals(workloadId, that.workloadId) &&
                Objects.equals(poolId, that.poolId) &&
                Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, workloadId, poolId, reason, timestamp);
    }

    @Override
    public String toString() {
        return "SchedulingEvent{" +
                "type=" + type +
                ", workloadId='" + workloadId + '\'' +
                ", poolId=" + poolId +
                ", reason='" + reason + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
