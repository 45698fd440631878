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

package com.netflix.warden.api.priority.model;

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.warden.common.util.StringExt;

public class PriorityClass {

    /**
     * Highest value a user defined priority class may have. Values above are reserved for system classes.
     */
    public static final int HIGHEST_USER_DEFINABLE_PRIORITY = 1_000_000_000;

    private final String name;
    private final int value;
    private final boolean isDefault;
    private final PreemptionPolicy preemptionPolicy;
    private final String description;

    private PriorityClass(String name, int value, boolean isDefault, PreemptionPolicy preemptionPolicy, String description) {
        this.name = name;
        this.value = value;
        this.isDefault = isDefault;
        this.preemptionPolicy = preemptionPolicy;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public int getValue() {
        return value;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public PreemptionPolicy getPreemptionPolicy() {
        return preemptionPolicy;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PriorityClass that = (PriorityClass) o;
        return value == that.value &&
                isDefault == that.isDefault &&
                Objects.equals(name, that.name) &&
                preemptionPolicy == that.preemptionPolicy &&
                Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, isDefault, preemptionPolicy, description);
    }

    @Override
    public String toString() {
        return "PriorityClass{" +
                "name='" + name + '\'' +
                ", value=" + value +
                ", isDefault=" + isDefault +
                ", preemptionPolicy=" + preemptionPolicy +
                ", description='" + description + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withName(name)
                .withValue(value)
                .withDefault(isDefault)
                .withPreemptionPolicy(preemptionPolicy)
                .withDescription(description);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private int value;
        private boolean isDefault;
        private PreemptionPolicy preemptionPolicy;
        private String description;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withValue(int value) {
            this.value = value;
            return this;
        }

        public Builder withDefault(boolean isDefault) {
            this.isDefault = isDefault;
            return this;
        }

        public Builder withPreemptionPolicy(PreemptionPolicy preemptionPolicy) {
            this.preemptionPolicy = preemptionPolicy;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public PriorityClass build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(name), "Priority class name not set");
            return new PriorityClass(
                    name,
                    value,
                    isDefault,
                    preemptionPolicy == null ? PreemptionPolicy.CanPreemptLower : preemptionPolicy,
                    StringExt.nonNull(description)
            );
        }
    }
}
