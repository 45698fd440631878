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

import com.google.common.base.Preconditions;
import com.netflix.warden.common.util.StringExt;

public class WorkloadStatus {

    private final WorkloadState state;
    private final String reason;
    private final long timestamp;

    private WorkloadStatus(WorkloadState state, String reason, long timestamp) {
        this.state = state;
        this.reason = reason;
        this.timestamp = timestamp;
    }

    public WorkloadState getState() {
        return state;
    }

    public String getReason() {
        return reason;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public static WorkloadStatus of(WorkloadState state, String reason, long timestamp) {
        Preconditions.checkNotNull(state, "Workload state not set");
        return new WorkloadStatus(state, StringExt.nonNull(reason), timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WorkloadStatus that = (WorkloadStatus) o;
        return timestamp == that.timestamp &&
                state == that.state &&
                Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, reason, timestamp);
    }

    @Override
    public String toString() {
        return "WorkloadStatus{" +
                "state=" + state +
                ", reason='" + reason + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
