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

package com.netflix.warden.common.util;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StringExtTest {

    @Test
    public void testSplitByComma() {
        assertThat(StringExt.splitByComma(null)).isEmpty();
        assertThat(StringExt.splitByComma("  ")).isEmpty();
        assertThat(StringExt.splitByComma("a, b ,c")).containsExactly("a", "b", "c");
    }

    @Test
    public void testSplitByCommaIntoSetKeepsOrder() {
        assertThat(StringExt.splitByCommaIntoSet("z,a,z,b")).containsExactly("z", "a", "b");
    }

    @Test
    public void testParseEnumIgnoreCase() {
        assertThat(StringExt.parseEnumIgnoreCase("seconds", TimeUnit.class)).isEqualTo(TimeUnit.SECONDS);
        assertThat(StringExt.parseEnumIgnoreCase(" Minutes ", TimeUnit.class)).isEqualTo(TimeUnit.MINUTES);
        assertThatThrownBy(() -> StringExt.parseEnumIgnoreCase("weeks", TimeUnit.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StringExt.parseEnumIgnoreCase("", TimeUnit.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSafeTrim() {
        assertThat(StringExt.safeTrim(null)).isEmpty();
        assertThat(StringExt.safeTrim(" abc ")).isEqualTo("abc");
        assertThat(StringExt.isNotEmpty(" ")).isTrue();
        assertThat(StringExt.isEmpty(null)).isTrue();
    }
}
