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

import com.netflix.warden.api.binding.model.Binding;
import com.netflix.warden.api.binding.service.BindingStoreException;
import com.netflix.warden.common.runtime.WardenRuntimes;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InMemoryBindingStoreTest {

    private final InMemoryBindingStore store = new InMemoryBindingStore(WardenRuntimes.test());

    @Test
    public void testBindAndUnbind() {
        Binding binding = store.bind("w1", "pool1");

        assertThat(binding.getRevision()).isEqualTo(1);
        assertThat(store.findBinding("w1")).contains(binding);
        assertThat(store.unbind("w1")).contains(binding);
        assertThat(store.findBinding("w1")).isEmpty();
    }

    @Test
    public void testUnbindIsIdempotent() {
        store.bind("w1", "pool1");

        assertThat(store.unbind("w1")).isPresent();
        assertThat(store.unbind("w1")).isEmpty();
        assertThat(store.unbind("never-bound")).isEmpty();
    }

    @Test
    public void testSecondBindFails() {
        store.bind("w1", "pool1");

        assertThatThrownBy(() -> store.bind("w1", "pool2"))
                .matches(error -> BindingStoreException.hasErrorCode(error, BindingStoreException.ErrorCode.AlreadyBound))
                .hasMessageContaining("pool1");
        assertThat(store.findBinding("w1")).map(Binding::getPoolId).contains("pool1");
    }

    @Test
    public void testBindingsOrderedByRevision() {
        store.bind("w3", "pool1");
        store.bind("w1", "pool2");
        store.bind("w2", "pool1");

        assertThat(store.listBindings("pool1")).extracting(Binding::getWorkloadId).containsExactly("w3", "w2");
        assertThat(store.listAll()).extracting(Binding::getWorkloadId).containsExactly("w3", "w1", "w2");
    }

    @Test
    public void testRestoreKeepsRevisionSequence() {
        store.restore(new Binding("w1", "pool1", 0, 10));

        assertThat(store.bind("w2", "pool1").getRevision()).isEqualTo(11);
    }

    @Test
    public void testPoolLockIsReentrant() {
        String result = store.executeInPoolLock("pool1", () -> store.executeInPoolLock("pool1", () -> "done"));

        assertThat(result).isEqualTo("done");
    }
}
