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

package com.netflix.warden.api.scheduler.service;

import java.util.List;
import java.util.Optional;

import com.netflix.warden.api.scheduler.model.ResourcePool;
import com.netflix.warden.api.scheduler.model.SchedulingEvent;
import com.netflix.warden.api.scheduler.model.SchedulingResult;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.api.scheduler.model.WorkloadStatus;
import reactor.core.publisher.Flux;

/**
 * Places admitted workloads on resource pools. All placement decisions are serialized, so given the same pools,
 * workloads and arrival order the outcome is always the same.
 */
public interface SchedulingService {

    List<ResourcePool> getPools();

    Optional<ResourcePool> findPool(String poolId);

    /**
     * @throws SchedulerException with {@link SchedulerException.ErrorCode#PoolAlreadyExists} if a pool with the same id exists
     */
    void addPool(ResourcePool pool);

    /**
     * Replaces pool definition. Bound workloads not tolerating a newly added {@code NoExecute} taint are evicted,
     * and the unschedulable workloads are retried.
     */
    void updatePool(ResourcePool pool);

    /**
     * Removes the pool. Workloads bound to it are returned to the pending queue.
     */
    void removePool(String poolId);

    /**
     * Adds a workload to the pending queue.
     *
     * @throws SchedulerException with {@link SchedulerException.ErrorCode#WorkloadAlreadyExists} if already known
     */
    void submit(Workload workload);

    /**
     * Unbinds the workload if bound, and forgets it.
     *
     * @throws SchedulerException with {@link SchedulerException.ErrorCode#WorkloadNotFound} if not known
     */
    void removeWorkload(String workloadId);

    Optional<Workload> findWorkload(String workloadId);

    /**
     * @throws SchedulerException with {@link SchedulerException.ErrorCode#WorkloadNotFound} if not known
     */
    WorkloadStatus getStatus(String workloadId);

    /**
     * Pending workloads in queue order (priority descending, then arrival order).
     */
    List<Workload> getPendingWorkloads();

    /**
     * Takes the head of the pending queue and tries to place it.
     */
    Optional<SchedulingResult> scheduleNext();

    /**
     * Runs placement attempts until the pending queue is empty. Workloads requeued by preemption during this
     * call are attempted again.
     */
    List<SchedulingResult> scheduleAll();

    /**
     * Moves all unschedulable workloads back to the pending queue.
     */
    void retryUnschedulable();

    Flux<SchedulingEvent> events();
}
