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

package com.netflix.warden.server.namespace;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.base.Preconditions;
import com.netflix.warden.api.namespace.model.Namespace;
import com.netflix.warden.api.namespace.model.NamespacePhase;
import com.netflix.warden.api.namespace.service.NamespaceRegistry;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class InMemoryNamespaceRegistry implements NamespaceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryNamespaceRegistry.class);

    private final Clock clock;
    private final ConcurrentMap<String, Namespace> namespaces = new ConcurrentHashMap<>();

    @Inject
    public InMemoryNamespaceRegistry(WardenRuntime runtime) {
        this.clock = runtime.getClock();
        SYSTEM_NAMESPACES.forEach(this::create);
    }

    @Override
    public Namespace create(String name) {
        return namespaces.computeIfAbsent(name, key -> {
            logger.info("Namespace created: {}", key);
            return new Namespace(key, NamespacePhase.Active, clock.wallTime());
        });
    }

    @Override
    public Optional<Namespace> terminate(String name) {
        Namespace updated = namespaces.computeIfPresent(name, (key, current) -> current.withPhase(NamespacePhase.Terminating));
        if (updated != null) {
            logger.info("Namespace moved to the terminating phase: {}", name);
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public Optional<Namespace> remove(String name) {
        Preconditions.checkArgument(!SYSTEM_NAMESPACES.contains(name), "System namespace %s cannot be removed", name);
        Namespace removed = namespaces.remove(name);
        if (removed != null) {
            logger.info("Namespace removed: {}", name);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public Optional<Namespace> find(String name) {
        return Optional.ofNullable(namespaces.get(name));
    }

    @Override
    public List<Namespace> list() {
        List<Namespace> all = new ArrayList<>(namespaces.values());
        all.sort(Comparator.comparing(Namespace::getName));
        return all;
    }
}
