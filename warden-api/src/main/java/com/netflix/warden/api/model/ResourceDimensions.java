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

import java.util.Collection;

/**
 * {@link ResourceDimension} arithmetic.
 */
public final class ResourceDimensions {

    /**
     * CPU values are fractional. Comparisons tolerate rounding noise accumulated by repeated add/subtract.
     */
    private static final double CPU_EPSILON = 1e-9;

    private ResourceDimensions() {
    }

    public static ResourceDimension add(ResourceDimension first, ResourceDimension second) {
        return ResourceDimension.of(first.getCpu() + second.getCpu(), first.getMemoryMB() + second.getMemoryMB());
    }

    public static ResourceDimension add(Collection<ResourceDimension> parts) {
        double cpu = 0;
        long memoryMB = 0;
        for (ResourceDimension part : parts) {
            cpu += part.getCpu();
            memoryMB += part.getMemoryMB();
        }
        return ResourceDimension.of(cpu, memoryMB);
    }

    /**
     * Subtract the second argument from the first. The result may contain negative values.
     */
    public static ResourceDimension subtract(ResourceDimension minuend, ResourceDimension subtrahend) {
        return ResourceDimension.of(minuend.getCpu() - subtrahend.getCpu(), minuend.getMemoryMB() - subtrahend.getMemoryMB());
    }

    /**
     * Returns true if all dimensions of the demand are less or equal to the available resources.
     */
    public static boolean fits(ResourceDimension demand, ResourceDimension available) {
        return demand.getCpu() <= available.getCpu() + CPU_EPSILON
                && demand.getMemoryMB() <= available.getMemoryMB();
    }

    public static boolean isPositive(ResourceDimension resources) {
        return resources.getCpu() > 0 && resources.getMemoryMB() > 0;
    }

    /**
     * Mean share of free resources (0..1) over all dimensions, given the total capacity. Dimensions with zero
     * capacity are ignored.
     */
    public static double freeShare(ResourceDimension free, ResourceDimension capacity) {
        double total = 0;
        int dimensions = 0;
        if (capacity.getCpu() > 0) {
            total += clamp(free.getCpu() / capacity.getCpu());
            dimensions++;
        }
        if (capacity.getMemoryMB() > 0) {
            total += clamp((double) free.getMemoryMB() / capacity.getMemoryMB());
            dimensions++;
        }
        return dimensions == 0 ? 0 : total / dimensions;
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
