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

package com.netflix.warden.testkit.model;

import java.util.Arrays;
import java.util.Collections;

import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.scheduler.model.ResourcePool;
import com.netflix.warden.api.scheduler.model.Taint;
import com.netflix.warden.common.util.CollectionsExt;

public final class ResourcePoolGenerator {

    private ResourcePoolGenerator() {
    }

    public static ResourcePool pool(String id, double cpu, long memoryMB) {
        return ResourcePool.newBuilder()
                .withId(id)
                .withCapacity(ResourceDimension.of(cpu, memoryMB))
                .withLabels(Collections.singletonMap("pool", id))
                .withTaints(Collections.emptyList())
                .build();
    }

    public static ResourcePool withTaints(ResourcePool pool, Taint... taints) {
        return pool.toBuilder().withTaints(Arrays.asList(taints)).build();
    }

    public static ResourcePool withLabel(ResourcePool pool, String key, String value) {
        return pool.toBuilder().withLabels(CollectionsExt.copyAndAdd(pool.getLabels(), key, value)).build();
    }
}
