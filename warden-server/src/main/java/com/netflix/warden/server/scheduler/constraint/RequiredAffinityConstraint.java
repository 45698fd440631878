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

import com.netflix.warden.api.scheduler.model.NodeSelectorRequirement;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.server.scheduler.PoolSnapshot;

public class RequiredAffinityConstraint implements PlacementConstraint {

    public static final String NAME = "RequiredAffinityConstraint";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Result evaluate(Workload workload, PoolSnapshot pool) {
        for (NodeSelectorRequirement requirement : workload.getRequiredAffinity()) {
            if (!requirement.matches(pool.getPool().getLabels())) {
                return Result.failure("required affinity not satisfied: " + requirement);
            }
        }
        return Result.valid();
    }
}
