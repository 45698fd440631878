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
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.netflix.warden.common.util.StringExt;

/**
 * Affinity expression evaluated against resource pool labels.
 */
public class NodeSelectorRequirement {

    public enum Operator {
        In,
        NotIn,
        Exists,
        DoesNotExist
    }

    private final String key;
    private final Operator operator;
    private final Set<String> values;

    public NodeSelectorRequirement(String key, Operator operator, Set<String> values) {
        Preconditions.checkArgument(StringExt.isNotEmpty(key), "Selector key not set");
        Preconditions.checkNotNull(operator, "Selector operator not set");
        this.key = key;
        this.operator = operator;
        this.values = values == null ? Collections.emptySet() : ImmutableSet.copyOf(values);
    }

    public String getKey() {
        return key;
    }

    public Operator getOperator() {
        return operator;
    }

    public Set<String> getValues() {
        return values;
    }

    public boolean matches(Map<String, String> labels) {
        String labelValue = labels.get(key);
        switch (operator) {
            case In:
                return labelValue != null && values.contains(labelValue);
            case NotIn:
                return labelValue == null || !values.contains(labelValue);
            case Exists:
                return labelValue != null;
            case DoesNotExist:
                return labelValue == null;
        }
        return false;
    }

    public static NodeSelectorRequirement in(String key, String... values) {
        return new NodeSelectorRequirement(key, Operator.In, ImmutableSet.copyOf(values));
    }

    public static NodeSelectorRequirement notIn(String key, String... values) {
        return new NodeSelectorRequirement(key, Operator.NotIn, ImmutableSet.copyOf(values));
    }

    public static NodeSelectorRequirement exists(String key) {
        return new NodeSelectorRequirement(key, Operator.Exists, Collections.emptySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeSelectorRequirement that = (NodeSelectorRequirement) o;
        return Objects.equals(key, that.key) &&
                operator == that.operator &&
                Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, operator, values);
    }

    @Override
    public String toString() {
        return key + ' ' + operator + ' ' + values;
    }
}
