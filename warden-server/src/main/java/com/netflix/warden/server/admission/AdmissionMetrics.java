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

import java.util.concurrent.TimeUnit;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;

public class AdmissionMetrics {

    private static final String ADMISSION_METRICS_ROOT = "warden.admission.";
    private static final String STAGE_TAG = "stage";
    private static final String RESULT_TAG = "result";
    private static final String ERROR_TAG = "error";

    private final Registry registry;
    private final Id stageResultId;
    private final Id stageLatencyId;
    private final Id requestResultId;

    public AdmissionMetrics(Registry registry) {
        this.registry = registry;
        this.stageResultId = registry.createId(ADMISSION_METRICS_ROOT + "stage");
        this.stageLatencyId = registry.createId(ADMISSION_METRICS_ROOT + "stageLatency");
        this.requestResultId = registry.createId(ADMISSION_METRICS_ROOT + "request");
    }

    public void incrementAllowed(String stageName) {
        stageCounter(stageName, "allow");
    }

    public void incrementDenied(String stageName) {
        stageCounter(stageName, "deny");
    }

    public void incrementPatched(String stageName) {
        stageCounter(stageName, "patch");
    }

    public void incrementUnchanged(String stageName) {
        stageCounter(stageName, "noChange");
    }

    public void incrementSkipped(String stageName, String reason) {
        registry.counter(stageResultId
                .withTag(STAGE_TAG, stageName)
                .withTag(RESULT_TAG, "skipped")
                .withTag(ERROR_TAG, reason)
        ).increment();
    }

    public void incrementFailure(String stageName, Throwable error) {
        registry.counter(stageResultId
                .withTag(STAGE_TAG, stageName)
                .withTag(RESULT_TAG, "failure")
                .withTag(ERROR_TAG, error.getClass().getSimpleName())
        ).increment();
    }

    public void recordLatency(String stageName, long elapsedMs) {
        registry.timer(stageLatencyId.withTag(STAGE_TAG, stageName)).record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    public void incrementRequest(String kind, String result) {
        registry.counter(requestResultId
                .withTag("kind", kind)
                .withTag(RESULT_TAG, result)
        ).increment();
    }

    private void stageCounter(String stageName, String result) {
        registry.counter(stageResultId
                .withTag(STAGE_TAG, stageName)
                .withTag(RESULT_TAG, result)
        ).increment();
    }
}
