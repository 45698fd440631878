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

package com.netflix.warden.api.model;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ResourceDimensionsTest {

    @Test
    public void testFitsToleratesCpuRoundingNoise() {
        ResourceDimension total = ResourceDimension.empty();
        for (int i = 0; i < 10; i++) {
            total = ResourceDimensions.add(total, ResourceDimension.of(0.1, 10));
        }
        assertThat(ResourceDimensions.fits(total, ResourceDimension.of(1.0, 100))).isTrue();
        assertThat(ResourceDimensions.fits(ResourceDimension.of(1.0, 101), ResourceDimension.of(1.0, 100))).isFalse();
        assertThat(ResourceDimensions.fits(ResourceDimension.of(1.01, 100), ResourceDimension.of(1.0, 100))).isFalse();
    }

    @Test
    public void testFreeShare() {
        ResourceDimension capacity = ResourceDimension.of(4, 1000);
        assertThat(ResourceDimensions.freeShare(ResourceDimension.of(2, 250), capacity)).isCloseTo(0.375, within(1e-9));
        assertThat(ResourceDimensions.freeShare(ResourceDimension.of(-1, -10), capacity)).isZero();
        assertThat(ResourceDimensions.freeShare(ResourceDimension.of(1, 1), ResourceDimension.empty())).isZero();
    }

    @Test
    public void testIsPositive() {
        assertThat(ResourceDimensions.isPositive(ResourceDimension.of(0.5, 1))).isTrue();
        assertThat(ResourceDimensions.isPositive(ResourceDimension.of(0, 1))).isFalse();
    }
}
