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

package com.netflix.warden.api.admission.service;

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.AdmissionVerdict;

import static java.lang.String.format;

public class AdmissionException extends RuntimeException {

    public enum ErrorCode {
        /**
         * A validating stage rejected the request. User correctable.
         */
        AdmissionDenied,

        /**
         * A mutating stage failed. Nothing is persisted.
         */
        MutationFailed,

        /**
         * A stage could not produce a decision (timeout, transport error).
         */
        AdmissionFailed,

        InvalidRequest,

        Unauthorized
    }

    private final ErrorCode errorCode;
    private final String stageName;

    private AdmissionException(ErrorCode errorCode, String stageName, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.stageName = stageName;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Name of the stage that caused the error, or an empty string if not stage related.
     */
    public String getStageName() {
        return stageName;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof AdmissionException) && ((AdmissionException) error).getErrorCode() == errorCode;
    }

    public static AdmissionException denied(AdmissionVerdict verdict) {
        return new AdmissionException(
                ErrorCode.AdmissionDenied,
                verdict.getStageName(),
                format("Request denied by %s: %s", verdict.getStageName(), verdict.getReason()),
                null
        );
    }

    public static AdmissionException mutationFailed(String stageName, Throwable cause) {
        return new AdmissionException(
                ErrorCode.MutationFailed,
                stageName,
                format("Mutating stage %s failed: %s", stageName, cause.getMessage()),
                cause
        );
    }

    public static AdmissionException mutationFailed(String stageName, String reason) {
        return new AdmissionException(ErrorCode.MutationFailed, stageName, format("Mutating stage %s failed: %s", stageName, reason), null);
    }

    public static AdmissionException admissionFailed(String stageName, String reason) {
        return new AdmissionException(ErrorCode.AdmissionFailed, stageName, format("Stage %s failed: %s", stageName, reason), null);
    }

    public static AdmissionException admissionFailed(String stageName, Throwable cause) {
        return new AdmissionException(ErrorCode.AdmissionFailed, stageName, format("Stage %s failed: %s", stageName, cause.getMessage()), cause);
    }

    public static AdmissionException invalidRequest(AdmissionRequest request, String reason) {
        return new AdmissionException(
                ErrorCode.InvalidRequest,
                "",
                format("Invalid %s %s request %s: %s", request.getOperation(), request.getKind(), request.getId(), reason),
                null
        );
    }

    public static AdmissionException unauthorized(AdmissionRequest request, String reason) {
        return new AdmissionException(
                ErrorCode.Unauthorized,
                "",
                format("Request %s not authorized: %s", request.getId(), reason),
                null
        );
    }
}
