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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "warden.scheduler")
public interface SchedulerConfiguration {

    /**
     * Interval between iterations of the background scheduling loop.
     */
    @DefaultValue("1000")
    long getSchedulingIntervalMs();

    /**
     * Number of placement attempts for a workload that hit a binding conflict, before it is declared unschedulable.
     */
    @DefaultValue("3")
    int getMaxAlreadyBoundRetries();

    /**
     * Score deducted for each untolerated 'PreferNoSchedule' taint of a pool.
     */
    @DefaultValue("0.5")
    double getPreferNoSchedulePenalty();

    /**
     * Multiplier converting preferred affinity weights (1..100) into score units.
     */
    @DefaultValue("0.01")
    double getPreferredAffinityWeightScale();
}
