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

import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.netflix.warden.common.util.StringExt;

/**
 * Static properties of an admission stage.
 */
public class StageDescriptor {

    /**
     * Ascending order index, with the stage name as a tie breaker.
     */
    public static final Comparator<StageDescriptor> EXECUTION_ORDER = Comparator
            .comparingInt(StageDescriptor::getOrder)
            .thenComparing(StageDescriptor::getName);

    private final String name;
    private final StageKind kind;
    private final int order;
    private final StageMatcher matcher;
    private final Optional<Duration> timeout;
    private final FailurePolicy failurePolicy;

    private StageDescriptor(String name,
                            StageKind kind,
                            int order,
                            StageMatcher matcher,
                            Optional<Duration> timeout,
                            FailurePolicy failurePolicy) {
        this.name = name;
        this.kind = kind;
        this.order = order;
        this.matcher = matcher;
        this.timeout = timeout;
        this.failurePolicy = failurePolicy;
    }

    public String getName() {
        return name;
    }

    public StageKind getKind() {
        return kind;
    }

    public int getOrder() {
        return order;
    }

    public StageMatcher getMatcher() {
        return matcher;
    }

    /**
     * Stage specific timeout. If not set, the pipeline default applies.
     */
    public Optional<Duration> getTimeout() {
        return timeout;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StageDescriptor that = (StageDescriptor) o;
        return order == that.order &&
                Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(matcher, that.matcher) &&
                Objects.equals(timeout, that.timeout) &&
                failurePolicy == that.failurePolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, order, matcher, timeout, failurePolicy);
    }

    @Override
    public String toString() {
        return "StageDescriptor{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", order=" + order +
                ", matcher=" + matcher +
                ", timeout=" + timeout +
                ", failurePolicy=" + failurePolicy +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withName(name)
                .withKind(kind)
                .withOrder(order)
                .withMatcher(matcher)
                .withTimeout(timeout.orElse(null))
                .withFailurePolicy(failurePolicy);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private StageKind kind;
        private int order;
        private StageMatcher matcher;
        private Duration timeout;
        private FailurePolicy failurePolicy;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withKind(StageKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder withOrder(int order) {
            this.order = order;
            return this;
        }

        public Builder withMatcher(StageMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public StageDescriptor build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(name), "Stage name not set");
            Preconditions.checkNotNull(kind, "Stage kind not set");
            return new StageDescriptor(
                    name,
                    kind,
                    order,
                    matcher == null ? StageMatcher.matchAll() : matcher,
                    Optional.ofNullable(timeout),
                    failurePolicy == null ? FailurePolicy.Fail : failurePolicy
            );
        }
    }
}
