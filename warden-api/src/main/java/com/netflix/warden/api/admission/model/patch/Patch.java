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

package com.netflix.warden.api.admission.model.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.ImmutableList;

/**
 * Ordered list of document edits produced by a mutating stage.
 */
public class Patch {

    private static final Patch EMPTY = new Patch(Collections.emptyList());

    private final List<PatchOperation> operations;

    private Patch(List<PatchOperation> operations) {
        this.operations = operations;
    }

    public List<PatchOperation> getOperations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public static Patch empty() {
        return EMPTY;
    }

    public static Patch of(List<PatchOperation> operations) {
        return operations.isEmpty() ? EMPTY : new Patch(ImmutableList.copyOf(operations));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Patch patch = (Patch) o;
        return Objects.equals(operations, patch.operations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operations);
    }

    @Override
    public String toString() {
        return "Patch{" +
                "operations=" + operations +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<PatchOperation> operations = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String path, JsonNode value) {
            operations.add(PatchOperation.add(path, value));
            return this;
        }

        public Builder add(String path, String value) {
            return add(path, TextNode.valueOf(value));
        }

        public Builder remove(String path) {
            operations.add(PatchOperation.remove(path));
            return this;
        }

        public Builder replace(String path, JsonNode value) {
            operations.add(PatchOperation.replace(path, value));
            return this;
        }

        public boolean isEmpty() {
            return operations.isEmpty();
        }

        public Patch build() {
            return Patch.of(operations);
        }
    }
}
