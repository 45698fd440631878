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

package com.netflix.warden.common.util;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A set of additional collections related functions.
 */
public final class CollectionsExt {

    private CollectionsExt() {
    }

    public static <T> boolean isNullOrEmpty(Collection<T> collection) {
        return collection == null || collection.isEmpty();
    }

    public static <T> List<T> nonNull(List<T> collection) {
        return collection == null ? Collections.emptyList() : collection;
    }

    public static <T> Set<T> nonNull(Set<T> collection) {
        return collection == null ? Collections.emptySet() : collection;
    }

    public static <K, V> Map<K, V> nonNull(Map<K, V> map) {
        return map == null ? Collections.emptyMap() : map;
    }

    public static <K, V> Map<K, V> copyAndAdd(Map<K, V> original, K key, V value) {
        if (original.isEmpty()) {
            return Collections.singletonMap(key, value);
        }
        Map<K, V> result = new HashMap<>(original);
        result.put(key, value);
        return result;
    }

    /**
     * Returns true if the matcher set is empty (matches everything) or contains the given value.
     */
    public static <T> boolean emptyOrContains(Set<T> matchers, T value) {
        return isNullOrEmpty(matchers) || matchers.contains(value);
    }
}
