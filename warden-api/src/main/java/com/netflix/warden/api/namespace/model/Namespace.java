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

package com.netflix.warden.api.namespace.model;

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.warden.common.util.StringExt;

public class Namespace {

    private final String name;
    private final NamespacePhase phase;
    private final long creationTimestamp;

    public Namespace(String name, NamespacePhase phase, long creationTimestamp) {
        Preconditions.checkArgument(StringExt.isNotEmpty(name), "Namespace name not set");
        this.name = name;
        this.phase = phase == null ? NamespacePhase.Active : phase;
        this.creationTimestamp = creationTimestamp;
    }

    public String getName() {
        return name;
    }

    public NamespacePhase getPhase() {
        return phase;
    }

    public long getCreationTimestamp() {
        return creationTimestamp;
    }

    public boolean isActive() {
        return phase == NamespacePhase.Active;
    }

    public Namespace withPhase(NamespacePhase phase) {
        return new Namespace(name, phase, creationTimestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Namespace namespace = (Namespace) o;
        return creationTimestamp == namespace.creationTimestamp &&
                Objects.equals(name, namespace.name) &&
                phase == namespace.phase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, phase, creationTimestamp);
    }

    @Override
    public String toString() {
        return "Namespace{" +
                "name='" + name + '\'' +
                ", phase=" + phase +
                ", creationTimestamp=" + creationTimestamp +
                '}';
    }
}
