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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class NodeSelectorRequirementTest {

    private static final Map<String, String> LABELS = ImmutableMap.of("zone", "us-east-1a", "type", "m5");

    @Test
    public void testOperators() {
        assertThat(NodeSelectorRequirement.in("zone", "us-east-1a", "us-east-1b").matches(LABELS)).isTrue();
        assertThat(NodeSelectorRequirement.in("zone", "us-east-1c").matches(LABELS)).isFalse();
        assertThat(NodeSelectorRequirement.notIn("type", "r5").matches(LABELS)).isTrue();
        assertThat(NodeSelectorRequirement.notIn("type", "m5").matches(LABELS)).isFalse();
        assertThat(NodeSelectorRequirement.exists("zone").matches(LABELS)).isTrue();
        assertThat(NodeSelectorRequirement.exists("gpu").matches(LABELS)).isFalse();
        assertThat(new NodeSelectorRequirement("gpu", NodeSelectorRequirement.Operator.DoesNotExist, Collections.emptySet()).matches(LABELS)).isTrue();
    }

    @Test
    public void testInRequiresLabelPresence() {
        assertThat(NodeSelectorRequirement.in("missing", "x").matches(LABELS)).isFalse();
        assertThat(NodeSelectorRequirement.notIn("missing", "x").matches(LABELS)).isTrue();
    }
}
