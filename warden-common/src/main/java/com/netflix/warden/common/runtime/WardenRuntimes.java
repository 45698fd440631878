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

package com.netflix.warden.common.runtime;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import com.netflix.warden.common.runtime.internal.DefaultWardenRuntime;
import com.netflix.warden.common.util.time.Clock;
import com.netflix.warden.common.util.time.Clocks;
import com.netflix.warden.common.util.time.TestClock;

public final class WardenRuntimes {

    private WardenRuntimes() {
    }

    public static WardenRuntime internal() {
        return new DefaultWardenRuntime(new DefaultRegistry(), Clocks.system());
    }

    public static WardenRuntime internal(Registry registry) {
        return new DefaultWardenRuntime(registry, Clocks.system());
    }

    public static WardenRuntime internal(Registry registry, Clock clock) {
        return new DefaultWardenRuntime(registry, clock);
    }

    public static WardenRuntime test() {
        return test(Clocks.test());
    }

    public static WardenRuntime test(TestClock clock) {
        return new DefaultWardenRuntime(new DefaultRegistry(), clock);
    }
}
