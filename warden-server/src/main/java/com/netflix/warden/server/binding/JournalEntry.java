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

package com.netflix.warden.server.binding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netflix.warden.api.binding.model.Binding;

/**
 * A single line of the binding journal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
class JournalEntry {

    enum Type {
        @JsonProperty("bind")
        Bind,
        @JsonProperty("unbind")
        Unbind
    }

    private final Type type;
    private final Binding binding;
    private final String workloadId;

    @JsonCreator
    JournalEntry(@JsonProperty("type") Type type,
                 @JsonProperty("binding") Binding binding,
                 @JsonProperty("workloadId") String workloadId) {
        this.type = type;
        this.binding = binding;
        this.workloadId = workloadId;
    }

    public Type getType() {
        return type;
    }

    public Binding getBinding() {
        return binding;
    }

    public String getWorkloadId() {
        return workloadId;
    }

    static JournalEntry bind(Binding binding) {
        return new JournalEntry(Type.Bind, binding, binding.getWorkloadId());
    }

    static JournalEntry unbind(String workloadId) {
        return new JournalEntry(Type.Unbind, null, workloadId);
    }
}
