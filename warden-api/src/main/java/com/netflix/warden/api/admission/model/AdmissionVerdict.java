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

/**
 * Outcome of validation. A deny carries the name of the stage that rejected the request, and a reason that is
 * surfaced verbatim to the caller.
 */
public class AdmissionVerdict {

    private static final AdmissionVerdict ALLOW = new AdmissionVerdict(true, "", "");

    private final boolean allowed;
    private final String stageName;
    private final String reason;

    private AdmissionVerdict(boolean allowed, String stageName, String reason) {
        this.allowed = allowed;
        this.stageName = stageName;
        this.reason = reason;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getStageName() {
        return stageName;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Returns a copy of a deny verdict attributed to the given stage.
     */
    public AdmissionVerdict attributedTo(String stageName) {
        return allowed ? this : new AdmissionVerdict(false, stageName, reason);
    }

    public static AdmissionVerdict allow() {
        return ALLOW;
    }

    public static AdmissionVerdict deny(String reason) {
        return new AdmissionVerdict(false, "", reason);
    }

    public static AdmissionVerdict deny(String stageName, String reason) {
        return new AdmissionVerdict(false, stageName, reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionVerdict that = (AdmissionVerdict) o;
        return allowed == that.allowed &&
                Objects.equals(stageName, that.stageName) &&
                Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowed, stageName, reason);
    }

    @Override
    public String toString() {
        return allowed
                ? "AdmissionVerdict{Allow}"
                : "AdmissionVerdict{Deny, stageName='" + stageName + "', reason='" + reason + "'}";
    }
}
