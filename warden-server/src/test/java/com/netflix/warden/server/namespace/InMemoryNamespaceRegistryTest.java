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

package com.netflix.warden.server.namespace;

import com.netflix.warden.api.namespace.model.Namespace;
import com.netflix.warden.api.namespace.model.NamespacePhase;
import com.netflix.warden.common.runtime.WardenRuntimes;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InMemoryNamespaceRegistryTest {

    private final InMemoryNamespaceRegistry registry = new InMemoryNamespaceRegistry(WardenRuntimes.test());

    @Test
    public void testSystemNamespacesExist() {
        assertThat(registry.list()).extracting(Namespace::getName).containsExactly("default", "kube-public", "kube-system");
    }

    @Test
    public void testCreateIsIdempotent() {
        Namespace first = registry.create("team-a");
        Namespace second = registry.create("team-a");

        assertThat(second).isSameAs(first);
        assertThat(first.isActive()).isTrue();
    }

    @Test
    public void testTerminate() {
        registry.create("team-a");

        assertThat(registry.terminate("team-a")).map(Namespace::getPhase).contains(NamespacePhase.Terminating);
        assertThat(registry.find("team-a").get().isActive()).isFalse();
        assertThat(registry.terminate("missing")).isEmpty();
    }

    @Test
    public void testRemove() {
        registry.create("team-a");

        assertThat(registry.remove("team-a")).map(Namespace::getName).contains("team-a");
        assertThat(registry.find("team-a")).isEmpty();
        assertThat(registry.remove("team-a")).isEmpty();
        assertThatThrownBy(() -> registry.remove("kube-system")).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.find("kube-system")).isPresent();
    }
}
