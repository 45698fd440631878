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

package com.netflix.warden.server.scheduler;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;

class SchedulerMetrics {

    private static final String METRIC_ROOT = "warden.scheduler.";

    private final Registry registry;

    private final Id boundId;
    private final Id unschedulableId;
    private final Id preemptionId;
    private final Id evictionId;
    private final Id bindingConflictId;
    private final Id iterationLatencyId;

    private final AtomicInteger pending = new AtomicInteger();

    SchedulerMetrics(Registry registry) {
        this.registry = registry;
        this.boundId = registry.createId(METRIC_ROOT + "bound");
        this.unschedulableId = registry.createId(METRIC_ROOT + "unschedulable");
        this.preemptionId = registry.createId(METRIC_ROOT + "preemptions");
        this.evictionId = registry.createId(METRIC_ROOT + "evictions");
        this.bindingConflictId = registry.createId(METRIC_ROOT + "bindingConflicts");
        this.iterationLatencyId = registry.createId(METRIC_ROOT + "iterationLatency");

        PolledMeter.using(registry).withName(METRIC_ROOT + "pending").monitorValue(pending);
    }

    void bound(boolean afterPreemption) {
        registry.counter(boundId.withTag("preemption", Boolean.toString(afterPreemption))).increment();
    }

    void unschedulable() {
        registry.counter(unschedulableId).increment();
    }

    void preempted(int victims) {
        registry.counter(preemptionId).increment(victims);
    }

    void evicted(String reason) {
        registry.counter(evictionId.withTag("reason", reason)).increment();
    }

    void bindingConflict() {
        registry.counter(bindingConflictId).increment();
    }

    void pendingQueueSize(int size) {
        pending.set(size);
    }

    void iterationLatency(long elapsedMs) {
        registry.timer(iterationLatencyId).record(elapsedMs, TimeUnit.MILLISECONDS);
    }
}
