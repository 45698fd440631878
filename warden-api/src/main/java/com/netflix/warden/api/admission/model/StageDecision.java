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

import java.util.Objects;
import java.util.Optional;

import com.netflix.warden.api.admission.model.patch.Patch;

/**
 * Result of a single stage evaluation. A decision carries the {@link StageKind} it was produced for. Mutating
 * decisions hold a patch, validating decisions hold a verdict.
 */
public class StageDecision {

    private static final StageDecision NO_CHANGE = new StageDecision(StageKind.Mutating, Patch.empty(), null);
    private static final StageDecision ALLOW = new StageDecision(StageKind.Validating, null, AdmissionVerdict.allow());

    private final StageKind kind;
    private final Patch patch;
    private final AdmissionVerdict verdict;

    private StageDecision(StageKind kind, Patch patch, AdmissionVerdict verdict) {
        this.kind = kind;
        this.patch = patch;
        this.verdict = verdict;
    }

    public StageKind getKind() {
        return kind;
    }

    public Optional<Patch> getPatch() {
        return Optional.ofNullable(patch);
    }

    public Optional<AdmissionVerdict> getVerdict() {
        return Optional.ofNullable(verdict);
    }

    public static StageDecision noChange() {
        return NO_CHANGE;
    }

    public static StageDecision patch(Patch patch) {
        return patch.isEmpty() ? NO_CHANGE : new StageDecision(StageKind.Mutating, patch, null);
    }

    public static StageDecision allow() {
        return ALLOW;
    }

    public static StageDecision deny(String reason) {
        return new StageDecision(StageKind.Validating, null, AdmissionVerdict.deny(reason));
    }

    public static StageDecision verdict(AdmissionVerdict verdict) {
        return verdict.isAllowed() ? ALLOW : new StageDecision(StageKind.Validating, null, verdict);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StageDecision that = (StageDecision) o;
        return kind == that.kind &&
                Objects.equals(patch, that.patch) &&
                Objects.equals(verdict, that.verdict);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, patch, verdict);
    }

    @Override
    public String toString() {
        return "StageDecision{" +
                "kind=" + kind +
                ", patch=" + patch +
                ", verdict=" + verdict +
                '}';
    }
}
