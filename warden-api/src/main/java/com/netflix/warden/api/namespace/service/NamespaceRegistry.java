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

package com.netflix.warden.api.namespace.service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.netflix.warden.api.namespace.model.Namespace;

public interface NamespaceRegistry {

    /**
     * Namespaces that exist from startup, and cannot be deleted.
     */
    Set<String> SYSTEM_NAMESPACES = ImmutableSet.of("default", "kube-system", "kube-public");

    /**
     * Creates a namespace in the active phase. Returns the existing one if present.
     */
    Namespace create(String name);

    /**
     * Moves the namespace to the terminating phase. No new objects can be created in it.
     *
     * @return the updated namespace or empty if not found
     */
    Optional<Namespace> terminate(String name);

    /**
     * Removes a namespace that was provisioned for a request which then failed to apply. System namespaces are
     * never removed.
     *
     * @return the removed namespace or empty if not found
     */
    Optional<Namespace> remove(String name);

    Optional<Namespace> find(String name);

    List<Namespace> list();
}
