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

package com.netflix.warden.server.scheduler.constraint;

import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.server.scheduler.PoolSnapshot;

/**
 * Hard placement rule. A workload can be placed on a pool only if all constraints succeed.
 */
public interface PlacementConstraint {

    String getName();

    Result evaluate(Workload workload, PoolSnapshot pool);

    /**
     * Whether this constraint depends on the pool occupancy. Capacity dependent constraints are skipped when
     * looking for pools where preemption could make room.
     */
    default boolean isCapacityDependent() {
        return false;
    }

    class Result {

        private static final Result VALID = new Result(true, null);

        private final boolean successful;
        private final String failureReason;

        private Result(boolean successful, String failureReason) {
            this.successful = successful;
            this.failureReason = failureReason;
        }

        public boolean isSuccessful() {
            return successful;
        }

        public String getFailureReason() {
            return failureReason;
        }

        public static Result valid() {
            return VALID;
        }

        public static Result failure(String reason) {
            return new Result(false, reason);
        }

        @Override
        public String toString() {
            return successful ? "Result{valid}" : "Result{failure=" + failureReason + '}';
        }
    }
}
