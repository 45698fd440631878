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

package com.netflix.warden.server.binding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.warden.api.binding.model.Binding;
import com.netflix.warden.api.binding.service.BindingStore;
import com.netflix.warden.api.binding.service.BindingStoreException;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.time.Clock;

@Singleton
public class InMemoryBindingStore implements BindingStore {

    private static final Comparator<Binding> REVISION_ORDER = Comparator.comparingLong(Binding::getRevision);

    private final Clock clock;

    private final ConcurrentMap<String, Binding> bindings = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> poolLocks = new ConcurrentHashMap<>();
    private final AtomicLong revisionSequence = new AtomicLong();

    @Inject
    public InMemoryBindingStore(WardenRuntime runtime) {
        this.clock = runtime.getClock();
    }

    @Override
    public Binding bind(String workloadId, String poolId) {
        return bindings.compute(workloadId, (id, existing) -> {
            if (existing != null) {
                throw BindingStoreException.alreadyBound(existing);
            }
            return new Binding(workloadId, poolId, clock.wallTime(), revisionSequence.incrementAndGet());
        });
    }

    @Override
    public Optional<Binding> unbind(String workloadId) {
        return Optional.ofNullable(bindings.remove(workloadId));
    }

    @Override
    public List<Binding> listBindings(String poolId) {
        return bindings.values().stream()
                .filter(binding -> binding.getPoolId().equals(poolId))
                .sorted(REVISION_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Binding> findBinding(String workloadId) {
        return Optional.ofNullable(bindings.get(workloadId));
    }

    @Override
    public List<Binding> listAll() {
        List<Binding> all = new ArrayList<>(bindings.values());
        all.sort(REVISION_ORDER);
        return all;
    }

    @Override
    public <T> T executeInPoolLock(String poolId, Supplier<T> action) {
        ReentrantLock lock = poolLocks.computeIfAbsent(poolId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts back a binding read from a journal, keeping its original revision.
     */
    void restore(Binding binding) {
        bindings.put(binding.getWorkloadId(), binding);
        revisionSequence.accumulateAndGet(binding.getRevision(), Math::max);
    }
}
