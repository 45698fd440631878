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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class CollectionsExtTest {

    @Test
    public void testCopyAndAdd() {
        Map<String, String> original = ImmutableMap.of("a", "1");

        assertThat(CollectionsExt.copyAndAdd(original, "b", "2")).containsOnlyKeys("a", "b");
        assertThat(original).containsOnlyKeys("a");
        assertThat(CollectionsExt.copyAndAdd(Collections.emptyMap(), "a", "1")).containsEntry("a", "1");
    }

    @Test
    public void testEmptyOrContains() {
        assertThat(CollectionsExt.emptyOrContains(Collections.emptySet(), "any")).isTrue();
        assertThat(CollectionsExt.emptyOrContains(null, "any")).isTrue();
        assertThat(CollectionsExt.emptyOrContains(ImmutableSet.of("a"), "a")).isTrue();
        assertThat(CollectionsExt.emptyOrContains(ImmutableSet.of("a"), "b")).isFalse();
    }
}
