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

package com.netflix.warden.server.admission;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "warden.admission")
public interface AdmissionConfiguration {

    /**
     * Default time limit of a single stage evaluation. Stages may override it.
     */
    @DefaultValue("1000")
    long getTimeoutMs();

    @DefaultValue("0.1")
    double getDefaultCpu();

    @DefaultValue("128")
    long getDefaultMemoryMB();

    @DefaultValue("64")
    double getMaxCpu();

    @DefaultValue("262144")
    long getMaxMemoryMB();

    /**
     * How long pods tolerate the not-ready/unreachable node taints added by default.
     */
    @DefaultValue("300")
    long getDefaultTolerationSeconds();

    /**
     * Comma separated list of built-in stage names to turn off.
     */
    @DefaultValue("")
    String getDisabledStages();
}
