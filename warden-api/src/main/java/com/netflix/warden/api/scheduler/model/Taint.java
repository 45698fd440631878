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

package com.netflix.warden.api.scheduler.model;

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.warden.common.util.StringExt;

/**
 * Repelling tag attached to a resource pool.
 */
public class Taint {

    private final String key;
    private final String value;
    private final TaintEffect effect;

    public Taint(String key, String value, TaintEffect effect) {
        Preconditions.checkArgument(StringExt.isNotEmpty(key), "Taint key not set");
        Preconditions.checkNotNull(effect, "Taint effect not set");
        this.key = key;
        this.value = StringExt.nonNull(value);
        this.effect = effect;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public TaintEffect getEffect() {
        return effect;
    }

    public static Taint of(String key, String value, TaintEffect effect) {
        return new Taint(key, value, effect);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Taint taint = (Taint) o;
        return Objects.equals(key, taint.key) &&
                Objects.equals(value, taint.value) &&
                effect == taint.effect;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, effect);
    }

    @Override
    public String toString() {
        return key + '=' + value + ':' + effect;
    }
}
