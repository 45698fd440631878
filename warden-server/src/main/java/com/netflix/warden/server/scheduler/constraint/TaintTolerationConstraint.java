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

import com.netflix.warden.api.scheduler.model.Taint;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.server.scheduler.PoolSnapshot;

/**
 * Pools with 'NoSchedule' or 'NoExecute' taints accept only workloads tolerating all of them.
 * 'PreferNoSchedule' taints are handled by the fitness calculator.
 */
public class TaintTolerationConstraint implements PlacementConstraint {

    public static final String NAME = "TaintTolerationConstraint";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Result evaluate(Workload workload, PoolSnapshot pool) {
        for (Taint taint : pool.getPool().getTaints()) {
            if (taint.getEffect().isHard() && !workload.tolerates(taint)) {
                return Result.failure("untolerated taint " + taint);
            }
        }
        return Result.valid();
    }
}
