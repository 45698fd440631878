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

package com.netflix.warden.api.gateway;

import java.util.Objects;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.AdmissionRequest;

/**
 * Result of an accepted request. Rejections are reported as errors.
 */
public class AdmissionResponse {

    private final AdmissionRequest admittedRequest;
    private final boolean namespaceProvisioned;

    public AdmissionResponse(AdmissionRequest admittedRequest, boolean namespaceProvisioned) {
        this.admittedRequest = admittedRequest;
        this.namespaceProvisioned = namespaceProvisioned;
    }

    /**
     * Request after all mutations, as it was applied.
     */
    public AdmissionRequest getAdmittedRequest() {
        return admittedRequest;
    }

    public ObjectNode getObject() {
        return admittedRequest.getPayload();
    }

    /**
     * True if the target namespace did not exist, and was created as part of this request.
     */
    public boolean isNamespaceProvisioned() {
        return namespaceProvisioned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionResponse that = (AdmissionResponse) o;
        return namespaceProvisioned == that.namespaceProvisioned &&
                Objects.equals(admittedRequest, that.admittedRequest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(admittedRequest, namespaceProvisioned);
    }

    @Override
    public String toString() {
        return "AdmissionResponse{" +
                "admittedRequest=" + admittedRequest +
                ", namespaceProvisioned=" + namespaceProvisioned +
                '}';
    }
}
