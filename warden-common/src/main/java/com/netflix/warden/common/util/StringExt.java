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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * A collection of string manipulation helpers.
 */
public final class StringExt {

    private static final Pattern COMMA_SPLIT_RE = Pattern.compile("\\s*,\\s*");

    private static final Map<Class<? extends Enum>, Map<String, Object>> ENUM_NAMES_MAP = new ConcurrentHashMap<>();

    private StringExt() {
    }

    /**
     * Return true if the string value is null or an empty string.
     */
    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Return true if the string value is not null, and it is not an empty string.
     */
    public static boolean isNotEmpty(String s) {
        return !isEmpty(s);
    }

    /**
     * Trim the string value, and return an empty string for a null input.
     */
    public static String safeTrim(String s) {
        return s == null || s.isEmpty() ? "" : s.trim();
    }

    /**
     * Return the value if non-null, or an empty string.
     */
    public static String nonNull(String value) {
        return value == null ? "" : value;
    }

    /**
     * Returns a list of comma separated values from the parameter. The white space characters around each value
     * is removed as well.
     */
    public static List<String> splitByComma(String value) {
        if (!isNotEmpty(value)) {
            return Collections.emptyList();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(COMMA_SPLIT_RE.split(trimmed));
    }

    /**
     * See {@link #splitByComma(String)}. Keeps the order of the values.
     */
    public static Set<String> splitByCommaIntoSet(String value) {
        return new LinkedHashSet<>(splitByComma(value));
    }

    /**
     * Parse enum name ignoring case.
     */
    @SuppressWarnings("unchecked")
    public static <E extends Enum<E>> E parseEnumIgnoreCase(String enumName, Class<E> enumType) {
        String trimmed = safeTrim(enumName);
        if (isEmpty(trimmed)) {
            throw new IllegalArgumentException("Empty string passed as enum name");
        }
        Map<String, Object> enumLowerCaseNameMap = getEnumLowerCaseNameMap(enumType);
        E result = (E) enumLowerCaseNameMap.get(trimmed.toLowerCase());
        if (result == null) {
            throw new IllegalArgumentException("Invalid enum value " + trimmed);
        }
        return result;
    }

    private static <E extends Enum<E>> Map<String, Object> getEnumLowerCaseNameMap(Class<E> enumType) {
        return ENUM_NAMES_MAP.computeIfAbsent(enumType, type -> {
            Map<String, Object> result = new HashMap<>();
            for (E value : enumType.getEnumConstants()) {
                result.put(value.name().toLowerCase(), value);
            }
            return result;
        });
    }
}
