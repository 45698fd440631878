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

package com.netflix.warden.api.priority.service;

import java.util.List;
import java.util.Optional;

import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.priority.model.PriorityClass;

/**
 * Cluster wide registry of priority classes. At most one class may be marked as the default one.
 */
public interface PriorityClassRegistry {

    /**
     * Adds a new priority class. The default flag is checked and set atomically with the insert.
     *
     * @throws PriorityClassException with {@link PriorityClassException.ErrorCode#DuplicateDefaultPriorityClass}
     *                                if the class is marked as default, and another default class exists
     */
    PriorityClass create(PriorityClass priorityClass);

    /**
     * Replaces an existing priority class. The value cannot be changed.
     */
    PriorityClass update(PriorityClass priorityClass);

    /**
     * Removes a priority class. Workloads already admitted keep their resolved priority.
     */
    void delete(String name);

    Optional<PriorityClass> find(String name);

    Optional<PriorityClass> findDefault();

    List<PriorityClass> list();

    /**
     * Resolves the priority class for a workload. For an empty name, returns the default class, if any.
     *
     * @throws PriorityClassException with {@link PriorityClassException.ErrorCode#UnknownPriorityClass} if the
     *                                named class does not exist
     */
    Optional<PriorityClass> resolve(Optional<String> priorityClassName);

    /**
     * Resolves the effective priority value. Unspecified class with no default resolves to 0.
     */
    default int resolvePriority(Optional<String> priorityClassName) {
        return resolve(priorityClassName).map(PriorityClass::getValue).orElse(0);
    }

    /**
     * Resolves the effective preemption policy. Unspecified class with no default resolves to
     * {@link PreemptionPolicy#CanPreemptLower}.
     */
    default PreemptionPolicy resolvePreemptionPolicy(Optional<String> priorityClassName) {
        return resolve(priorityClassName).map(PriorityClass::getPreemptionPolicy).orElse(PreemptionPolicy.CanPreemptLower);
    }
}
