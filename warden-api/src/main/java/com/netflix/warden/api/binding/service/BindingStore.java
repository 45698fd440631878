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

package com.netflix.warden.api.binding.service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.netflix.warden.api.binding.model.Binding;

/**
 * Record of current placements. Read by the scheduler to compute pool occupancy, and by external executors to
 * learn what to run.
 */
public interface BindingStore {

    /**
     * @throws BindingStoreException with {@link BindingStoreException.ErrorCode#AlreadyBound} if the workload has
     *                               an active binding
     */
    Binding bind(String workloadId, String poolId);

    /**
     * Removes the active binding of the workload. No-op if the workload is not bound.
     *
     * @return the removed binding, if there was one
     */
    Optional<Binding> unbind(String workloadId);

    /**
     * Active bindings of a pool, ordered by revision.
     */
    List<Binding> listBindings(String poolId);

    Optional<Binding> findBinding(String workloadId);

    List<Binding> listAll();

    /**
     * Runs the action with exclusive access to the given pool. Occupancy read inside the section cannot change
     * until the section completes.
     */
    <T> T executeInPoolLock(String poolId, Supplier<T> action);
}
