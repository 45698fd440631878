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

package com.netflix.warden.server.scheduler.fitness;

import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.model.ResourceDimensions;
import com.netflix.warden.api.scheduler.model.PreferredAffinityTerm;
import com.netflix.warden.api.scheduler.model.Taint;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.server.scheduler.PoolSnapshot;
import com.netflix.warden.server.scheduler.SchedulerConfiguration;

/**
 * Prefers pools with the largest share of resources left free after the placement, adjusted by:
 * <ul>
 *     <li>the sum of matching preferred affinity term weights, scaled by {@link SchedulerConfiguration#getPreferredAffinityWeightScale()}</li>
 *     <li>a penalty for each 'PreferNoSchedule' taint the workload does not tolerate</li>
 * </ul>
 */
public class LeastAllocatedFitnessCalculator implements FitnessCalculator {

    private final SchedulerConfiguration configuration;

    public LeastAllocatedFitnessCalculator(SchedulerConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public double calculateFitness(Workload workload, PoolSnapshot pool) {
        ResourceDimension freeAfter = ResourceDimensions.subtract(pool.getFree(), workload.getDemand());
        double score = ResourceDimensions.freeShare(freeAfter, pool.getPool().getCapacity());

        int affinityWeight = 0;
        for (PreferredAffinityTerm term : workload.getPreferredAffinity()) {
            if (term.matches(pool.getPool().getLabels())) {
                affinityWeight += term.getWeight();
            }
        }
        score += affinityWeight * configuration.getPreferredAffinityWeightScale();

        for (Taint taint : pool.getPool().getTaints()) {
            if (taint.getEffect() == TaintEffect.PreferNoSchedule && !workload.tolerates(taint)) {
                score -= configuration.getPreferNoSchedulePenalty();
            }
        }
        return score;
    }
}
