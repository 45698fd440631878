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

package com.netflix.warden.server.admission.webhook;

import com.netflix.archaius.api.annotations.DefaultValue;

/**
 * Configuration of a single webhook stage. Bound to the <tt>warden.admission.webhooks.&lt;name&gt;</tt> prefix,
 * one instance per configured webhook.
 */
public interface WebhookConfiguration {

    String getUrl();

    /**
     * 'Mutating' or 'Validating'.
     */
    @DefaultValue("Validating")
    String getKind();

    @DefaultValue("1000")
    int getOrder();

    /**
     * Stage timeout. Zero or less means the pipeline default.
     */
    @DefaultValue("0")
    long getTimeoutMs();

    /**
     * 'Fail' or 'Ignore'.
     */
    @DefaultValue("Fail")
    String getFailurePolicy();

    /**
     * Comma separated resource kinds. Empty means all.
     */
    @DefaultValue("")
    String getKinds();

    @DefaultValue("")
    String getOperations();

    @DefaultValue("")
    String getNamespaces();
}
