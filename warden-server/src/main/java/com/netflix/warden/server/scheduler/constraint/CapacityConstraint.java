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

import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.model.ResourceDimensions;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.server.scheduler.PoolSnapshot;

public class CapacityConstraint implements PlacementConstraint {

    public static final String NAME = "CapacityConstraint";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isCapacityDependent() {
        return true;
    }

    @Override
    public Result evaluate(Workload workload, PoolSnapshot pool) {
        ResourceDimension free = pool.getFree();
        if (ResourceDimensions.fits(workload.getDemand(), free)) {
            return Result.valid();
        }
        return Result.failure(String.format("insufficient capacity (demand=%s, free=%s)", workload.getDemand(), free));
    }
}
