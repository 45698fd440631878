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

package com.netflix.warden.server.scheduler;

import java.util.List;

import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.model.ResourceDimensions;
import com.netflix.warden.api.scheduler.model.ResourcePool;
import com.netflix.warden.api.scheduler.model.Workload;

/**
 * Resource pool with its current occupancy, as seen by the placement constraints and the fitness calculator.
 */
public class PoolSnapshot {

    private final ResourcePool pool;
    private final List<Workload> boundWorkloads;
    private final ResourceDimension allocated;

    public PoolSnapshot(ResourcePool pool, List<Workload> boundWorkloads) {
        this.pool = pool;
        this.boundWorkloads = boundWorkloads;
        ResourceDimension total = ResourceDimension.empty();
        for (Workload workload : boundWorkloads) {
            total = ResourceDimensions.add(total, workload.getDemand());
        }
        this.allocated = total;
    }

    public ResourcePool getPool() {
        return pool;
    }

    public String getPoolId() {
        return pool.getId();
    }

    /**
     * Bound workloads, in binding order.
     */
    public List<Workload> getBoundWorkloads() {
        return boundWorkloads;
    }

    public ResourceDimension getAllocated() {
        return allocated;
    }

    public ResourceDimension getFree() {
        return ResourceDimensions.subtract(pool.getCapacity(), allocated);
    }

    @Override
    public String toString() {
        return "PoolSnapshot{" +
                "poolId=" + pool.getId() +
                ", capacity=" + pool.getCapacity() +
                ", allocated=" + allocated +
                ", boundWorkloads=" + boundWorkloads.size() +
                '}';
    }
}
