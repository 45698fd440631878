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
 * Final request (after all mutations), and the validation verdict.
 */
public class AdmissionResult {

    private final AdmissionRequest request;
    private final AdmissionVerdict verdict;

    public AdmissionResult(AdmissionRequest request, AdmissionVerdict verdict) {
        this.request = request;
        this.verdict = verdict;
    }

    public AdmissionRequest getRequest() {
        return request;
    }

    public AdmissionVerdict getVerdict() {
        return verdict;
    }

    public boolean isAllowed() {
        return verdict.isAllowed();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionResult that = (AdmissionResult) o;
        return Objects.equals(request, that.request) &&
                Objects.equals(verdict, that.verdict);
    }

    @Override
    public int hashCode() {
        return Objects.hash(request, verdict);
    }

    @Override
    public String toString() {
        return "AdmissionResult{" +
                "request=" + request +
                ", verdict=" + verdict +
                '}';
    }
}
