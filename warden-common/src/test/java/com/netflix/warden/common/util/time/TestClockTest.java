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

package com.netflix.warden.common.util.time;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TestClockTest {

    @Test
    public void testAdvanceTime() {
        TestClock clock = Clocks.test(1_000);
        assertThat(clock.wallTime()).isEqualTo(1_000);

        clock.advanceTime(5, TimeUnit.SECONDS);
        assertThat(clock.wallTime()).isEqualTo(6_000);
    }
}
