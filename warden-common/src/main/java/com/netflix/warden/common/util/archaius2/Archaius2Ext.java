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

package com.netflix.warden.common.util.archaius2;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.DefaultPropertyFactory;
import com.netflix.archaius.api.Config;
import com.netflix.archaius.config.MapConfig;

public final class Archaius2Ext {

    private static final Config EMPTY_CONFIG = new MapConfig(Collections.emptyMap());

    private static final ConfigProxyFactory DEFAULT_CONFIG_PROXY_FACTORY = new ConfigProxyFactory(
            EMPTY_CONFIG,
            EMPTY_CONFIG.getDecoder(),
            DefaultPropertyFactory.from(EMPTY_CONFIG)
    );

    private Archaius2Ext() {
    }

    /**
     * Create Archaius based configuration object initialized with default values. Defaults can be overridden
     * by providing key/value pairs as parameters.
     */
    public static <C> C newConfiguration(Class<C> configType, String... keyValuePairs) {
        if (keyValuePairs.length == 0) {
            return DEFAULT_CONFIG_PROXY_FACTORY.newProxy(configType);
        }

        Preconditions.checkArgument(keyValuePairs.length % 2 == 0, "Expected even number of arguments");

        Map<String, String> props = new HashMap<>();
        int len = keyValuePairs.length / 2;
        for (int i = 0; i < len; i++) {
            props.put(keyValuePairs[i * 2], keyValuePairs[i * 2 + 1]);
        }
        return newConfiguration(configType, new MapConfig(props));
    }

    /**
     * Create Archaius based configuration object initialized with default values. Overrides can be provided
     * via the properties parameter.
     */
    public static <C> C newConfiguration(Class<C> configType, Map<String, String> properties) {
        return newConfiguration(configType, new MapConfig(properties));
    }

    /**
     * Create Archaius based configuration object based by the given {@link Config}.
     */
    public static <C> C newConfiguration(Class<C> configType, Config config) {
        ConfigProxyFactory factory = new ConfigProxyFactory(config, config.getDecoder(), DefaultPropertyFactory.from(config));
        return factory.newProxy(configType);
    }

    /**
     * Create Archaius based configuration object with an explicit property prefix.
     */
    public static <C> C newConfiguration(Class<C> configType, String prefix, Config config) {
        ConfigProxyFactory factory = new ConfigProxyFactory(config, config.getDecoder(), DefaultPropertyFactory.from(config));
        return factory.newProxy(configType, prefix);
    }

    /**
     * Returns the distinct names of the first level property groups below the given prefix. For properties:
     * a.x.url=..., a.x.order=..., a.y.url=..., the result for prefix 'a' is [x, y].
     */
    public static Set<String> getChildNames(Config config, String prefix) {
        String fullPrefix = prefix.endsWith(".") ? prefix : prefix + '.';
        Set<String> names = new TreeSet<>();
        for (Iterator<String> it = config.getKeys(); it.hasNext(); ) {
            String key = it.next();
            if (!key.startsWith(fullPrefix) || key.length() <= fullPrefix.length()) {
                continue;
            }
            String remaining = key.substring(fullPrefix.length());
            int dotIdx = remaining.indexOf('.');
            names.add(dotIdx < 0 ? remaining : remaining.substring(0, dotIdx));
        }
        return names;
    }

    /**
     * Write {@link Config} to {@link String}.
     */
    public static String toString(Config config) {
        StringBuilder sb = new StringBuilder("{");
        for (Iterator<String> it = config.getKeys(); it.hasNext(); ) {
            String key = it.next();
            sb.append(key).append('=').append(config.getString(key, ""));
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append('}').toString();
    }
}
