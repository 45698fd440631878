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

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.netflix.warden.common.util.CollectionsExt;

/**
 * Selects requests an admission stage applies to. An empty set matches any value.
 */
public class StageMatcher {

    private static final StageMatcher MATCH_ALL = newBuilder().build();

    private final Set<String> kinds;
    private final Set<Operation> operations;
    private final Set<String> namespaces;
    private final Set<String> excludedNamespaces;

    private StageMatcher(Set<String> kinds, Set<Operation> operations, Set<String> namespaces, Set<String> excludedNamespaces) {
        this.kinds = kinds;
        this.operations = operations;
        this.namespaces = namespaces;
        this.excludedNamespaces = excludedNamespaces;
    }

    public Set<String> getKinds() {
        return kinds;
    }

    public Set<Operation> getOperations() {
        return operations;
    }

    public Set<String> getNamespaces() {
        return namespaces;
    }

    public Set<String> getExcludedNamespaces() {
        return excludedNamespaces;
    }

    public boolean matches(AdmissionRequest request) {
        return CollectionsExt.emptyOrContains(kinds, request.getKind())
                && CollectionsExt.emptyOrContains(operations, request.getOperation())
                && CollectionsExt.emptyOrContains(namespaces, request.getNamespace())
                && !excludedNamespaces.contains(request.getNamespace());
    }

    public static StageMatcher matchAll() {
        return MATCH_ALL;
    }

    public static StageMatcher forKind(String kind, Operation... operations) {
        return newBuilder().withKinds(ImmutableSet.of(kind)).withOperations(ImmutableSet.copyOf(operations)).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StageMatcher that = (StageMatcher) o;
        return Objects.equals(kinds, that.kinds) &&
                Objects.equals(operations, that.operations) &&
                Objects.equals(namespaces, that.namespaces) &&
                Objects.equals(excludedNamespaces, that.excludedNamespaces);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kinds, operations, namespaces, excludedNamespaces);
    }

    @Override
    public String toString() {
        return "StageMatcher{" +
                "kinds=" + kinds +
                ", operations=" + operations +
                ", namespaces=" + namespaces +
                ", excludedNamespaces=" + excludedNamespaces +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<String> kinds = Collections.emptySet();
        private Set<Operation> operations = Collections.emptySet();
        private Set<String> namespaces = Collections.emptySet();
        private Set<String> excludedNamespaces = Collections.emptySet();

        private Builder() {
        }

        public Builder withKinds(Set<String> kinds) {
            this.kinds = kinds;
            return this;
        }

        public Builder withOperations(Set<Operation> operations) {
            this.operations = operations;
            return this;
        }

        public Builder withNamespaces(Set<String> namespaces) {
            this.namespaces = namespaces;
            return this;
        }

        public Builder withExcludedNamespaces(Set<String> excludedNamespaces) {
            this.excludedNamespaces = excludedNamespaces;
            return this;
        }

        public StageMatcher build() {
            return new StageMatcher(
                    ImmutableSet.copyOf(CollectionsExt.nonNull(kinds)),
                    ImmutableSet.copyOf(CollectionsExt.nonNull(operations)),
                    ImmutableSet.copyOf(CollectionsExt.nonNull(namespaces)),
                    ImmutableSet.copyOf(CollectionsExt.nonNull(excludedNamespaces))
            );
        }
    }
}
