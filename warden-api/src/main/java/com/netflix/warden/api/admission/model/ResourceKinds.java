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

package com.netflix.warden.api.admission.model;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Resource kinds with built-in handling. Requests may carry any other kind, which is admitted but not applied.
 */
public final class ResourceKinds {

    public static final String POD = "Pod";
    public static final String PRIORITY_CLASS = "PriorityClass";
    public static final String NAMESPACE = "Namespace";
    public static final String NODE = "Node";

    private static final Set<String> CLUSTER_SCOPED = ImmutableSet.of(PRIORITY_CLASS, NAMESPACE, NODE);

    private ResourceKinds() {
    }

    public static boolean isNamespaced(String kind) {
        return !CLUSTER_SCOPED.contains(kind);
    }
}
