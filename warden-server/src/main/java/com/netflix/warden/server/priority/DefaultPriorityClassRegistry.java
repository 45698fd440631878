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

package com.netflix.warden.server.priority;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Singleton;

import com.google.common.base.Preconditions;
import com.netflix.warden.api.priority.model.PriorityClass;
import com.netflix.warden.api.priority.service.PriorityClassException;
import com.netflix.warden.api.priority.service.PriorityClassRegistry;
import com.netflix.warden.common.util.StringExt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link PriorityClassRegistry}. Writes are serialized, so the check for an existing default class and
 * the insert form a single step. Reads are lock free.
 */
@Singleton
public class DefaultPriorityClassRegistry implements PriorityClassRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPriorityClassRegistry.class);

    private final Map<String, PriorityClass> priorityClasses = new ConcurrentHashMap<>();
    private final Lock writeLock = new ReentrantLock();

    @Override
    public PriorityClass create(PriorityClass priorityClass) {
        validate(priorityClass);
        writeLock.lock();
        try {
            if (priorityClasses.containsKey(priorityClass.getName())) {
                throw PriorityClassException.alreadyExists(priorityClass.getName());
            }
            checkDefault(priorityClass);
            priorityClasses.put(priorityClass.getName(), priorityClass);
        } finally {
            writeLock.unlock();
        }
        logger.info("Priority class created: {}", priorityClass);
        return priorityClass;
    }

    @Override
    public PriorityClass update(PriorityClass priorityClass) {
        validate(priorityClass);
        writeLock.lock();
        try {
            PriorityClass current = priorityClasses.get(priorityClass.getName());
            if (current == null) {
                throw PriorityClassException.notFound(priorityClass.getName());
            }
            if (current.getValue() != priorityClass.getValue()) {
                throw PriorityClassException.invalid(priorityClass.getName(), "value cannot be changed (current=%s, requested=%s)",
                        current.getValue(), priorityClass.getValue());
            }
            checkDefault(priorityClass);
            priorityClasses.put(priorityClass.getName(), priorityClass);
        } finally {
            writeLock.unlock();
        }
        logger.info("Priority class updated: {}", priorityClass);
        return priorityClass;
    }

    @Override
    public void delete(String name) {
        writeLock.lock();
        try {
            if (priorityClasses.remove(name) == null) {
                throw PriorityClassException.notFound(name);
            }
        } finally {
            writeLock.unlock();
        }
        logger.info("Priority class removed: {}", name);
    }

    @Override
    public Optional<PriorityClass> find(String name) {
        return Optional.ofNullable(priorityClasses.get(name));
    }

    @Override
    public Optional<PriorityClass> findDefault() {
        return priorityClasses.values().stream().filter(PriorityClass::isDefault).findFirst();
    }

    @Override
    public List<PriorityClass> list() {
        List<PriorityClass> all = new ArrayList<>(priorityClasses.values());
        all.sort(Comparator.comparing(PriorityClass::getName));
        return all;
    }

    @Override
    public Optional<PriorityClass> resolve(Optional<String> priorityClassName) {
        Optional<String> name = priorityClassName.filter(StringExt::isNotEmpty);
        if (!name.isPresent()) {
            return findDefault();
        }
        PriorityClass priorityClass = priorityClasses.get(name.get());
        if (priorityClass == null) {
            throw PriorityClassException.unknownPriorityClass(name.get());
        }
        return Optional.of(priorityClass);
    }

    /**
     * Must be called with the write lock held.
     */
    private void checkDefault(PriorityClass priorityClass) {
        if (!priorityClass.isDefault()) {
            return;
        }
        for (PriorityClass other : priorityClasses.values()) {
            if (other.isDefault() && !other.getName().equals(priorityClass.getName())) {
                throw PriorityClassException.duplicateDefault(priorityClass, other);
            }
        }
    }

    private static void validate(PriorityClass priorityClass) {
        Preconditions.checkNotNull(priorityClass, "Priority class is null");
        if (StringExt.isEmpty(priorityClass.getName())) {
            throw PriorityClassException.invalid("<empty>", "name not set");
        }
        if (priorityClass.getValue() > PriorityClass.HIGHEST_USER_DEFINABLE_PRIORITY) {
            throw PriorityClassException.invalid(priorityClass.getName(), "value %s above the limit of %s",
                    priorityClass.getValue(), PriorityClass.HIGHEST_USER_DEFINABLE_PRIORITY);
        }
    }
}
