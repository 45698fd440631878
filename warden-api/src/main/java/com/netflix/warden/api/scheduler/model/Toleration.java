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

import java.util.Objects;
import java.util.Optional;

import com.netflix.warden.common.util.StringExt;

/**
 * Permission for a workload to ignore matching taints. Matching rules:
 * <ul>
 *     <li>an empty key with the {@link Operator#Exists} operator matches every taint</li>
 *     <li>a null effect matches all effects</li>
 *     <li>{@link Operator#Exists} ignores the taint value, {@link Operator#Equal} requires an exact match</li>
 * </ul>
 */
public class Toleration {

    public enum Operator {
        Equal,
        Exists
    }

    private final String key;
    private final Operator operator;
    private final String value;
    private final TaintEffect effect;
    private final Optional<Long> tolerationSeconds;

    public Toleration(String key, Operator operator, String value, TaintEffect effect, Optional<Long> tolerationSeconds) {
        this.key = StringExt.nonNull(key);
        this.operator = operator == null ? Operator.Equal : operator;
        this.value = StringExt.nonNull(value);
        this.effect = effect;
        this.tolerationSeconds = tolerationSeconds;
    }

    public String getKey() {
        return key;
    }

    public Operator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    /**
     * Tolerated effect, or null if all effects are tolerated.
     */
    public TaintEffect getEffect() {
        return effect;
    }

    /**
     * For {@link TaintEffect#NoExecute} taints, how long a bound workload may stay on a pool after the taint
     * is added. Not set means forever.
     */
    public Optional<Long> getTolerationSeconds() {
        return tolerationSeconds;
    }

    public boolean tolerates(Taint taint) {
        if (effect != null && effect != taint.getEffect()) {
            return false;
        }
        if (key.isEmpty()) {
            return operator == Operator.Exists;
        }
        if (!key.equals(taint.getKey())) {
            return false;
        }
        return operator == Operator.Exists || value.equals(taint.getValue());
    }

    public static Toleration exists(String key, TaintEffect effect) {
        return new Toleration(key, Operator.Exists, "", effect, Optional.empty());
    }

    public static Toleration equal(String key, String value, TaintEffect effect) {
        return new Toleration(key, Operator.Equal, value, effect, Optional.empty());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Toleration that = (Toleration) o;
        return Objects.equals(key, that.key) &&
                operator == that.operator &&
                Objects.equals(value, that.value) &&
                effect == that.effect &&
                Objects.equals(tolerationSeconds, that.tolerationSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, operator, value, effect, tolerationSeconds);
    }

    @Override
    public String toString() {
        return "Toleration{" +
                "key='" + key + '\'' +
                ", operator=" + operator +
                ", value='" + value + '\'' +
                ", effect=" + effect +
                ", tolerationSeconds=" + tolerationSeconds +
                '}';
    }
}
