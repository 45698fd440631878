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

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Weighted soft affinity. The weight is added to the pool score if all requirements match.
 */
public class PreferredAffinityTerm {

    public static final int MIN_WEIGHT = 1;
    public static final int MAX_WEIGHT = 100;

    private final int weight;
    private final List<NodeSelectorRequirement> requirements;

    public PreferredAffinityTerm(int weight, List<NodeSelectorRequirement> requirements) {
        Preconditions.checkArgument(weight >= MIN_WEIGHT && weight <= MAX_WEIGHT, "Weight must be in range [%s, %s], but is %s", MIN_WEIGHT, MAX_WEIGHT, weight);
        this.weight = weight;
        this.requirements = ImmutableList.copyOf(requirements);
    }

    public int getWeight() {
        return weight;
    }

    public List<NodeSelectorRequirement> getRequirements() {
        return requirements;
    }

    public boolean matches(Map<String, String> labels) {
        for (NodeSelectorRequirement requirement : requirements) {
            if (!requirement.matches(labels)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PreferredAffinityTerm that = (PreferredAffinityTerm) o;
        return weight == that.weight &&
                Objects.equals(requirements, that.requirements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weight, requirements);
    }

    @Override
    public String toString() {
        return "PreferredAffinityTerm{" +
                "weight=" + weight +
                ", requirements=" + requirements +
                '}';
    }
}
