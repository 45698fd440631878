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

package com.netflix.warden.api.admission.model;

/**
 * Field names of the resource documents with built-in handling.
 * <p>
 * Pod: <tt>metadata.{name, labels, annotations}</tt>, <tt>spec.{priorityClassName, priority, preemptionPolicy,
 * resources.requests.{cpu, memoryMB}, tolerations[], affinity.{required[], preferred[]}}</tt>.
 * <p>
 * Node: <tt>metadata.{name, labels}</tt>, <tt>spec.{capacity.{cpu, memoryMB}, taints[]}</tt>.
 * <p>
 * PriorityClass: <tt>metadata.name</tt>, <tt>value</tt>, <tt>globalDefault</tt>, <tt>preemptionPolicy</tt>,
 * <tt>description</tt>.
 * <p>
 * Namespace: <tt>metadata.name</tt>.
 */
public final class PayloadFields {

    public static final String METADATA = "metadata";
    public static final String NAME = "name";
    public static final String LABELS = "labels";
    public static final String ANNOTATIONS = "annotations";

    public static final String SPEC = "spec";
    public static final String PRIORITY_CLASS_NAME = "priorityClassName";
    public static final String PRIORITY = "priority";
    public static final String PREEMPTION_POLICY = "preemptionPolicy";
    public static final String RESOURCES = "resources";
    public static final String REQUESTS = "requests";
    public static final String CPU = "cpu";
    public static final String MEMORY_MB = "memoryMB";
    public static final String TOLERATIONS = "tolerations";
    public static final String AFFINITY = "affinity";
    public static final String REQUIRED = "required";
    public static final String PREFERRED = "preferred";
    public static final String WEIGHT = "weight";
    public static final String REQUIREMENTS = "requirements";

    public static final String KEY = "key";
    public static final String OPERATOR = "operator";
    public static final String VALUE = "value";
    public static final String VALUES = "values";
    public static final String EFFECT = "effect";
    public static final String TOLERATION_SECONDS = "tolerationSeconds";

    public static final String CAPACITY = "capacity";
    public static final String TAINTS = "taints";

    public static final String GLOBAL_DEFAULT = "globalDefault";
    public static final String DESCRIPTION = "description";

    public static final String CREATED_BY_LABEL = "created-by";
    public static final String PROVISION_NAMESPACE_ANNOTATION = "warden.netflix.com/provision-namespace";

    private PayloadFields() {
    }
}
