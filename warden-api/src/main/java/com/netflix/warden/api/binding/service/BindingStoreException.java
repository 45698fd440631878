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

package com.netflix.warden.api.binding.service;

import com.netflix.warden.api.binding.model.Binding;

import static java.lang.String.format;

public class BindingStoreException extends RuntimeException {

    public enum ErrorCode {
        AlreadyBound,
        JournalFailure
    }

    private final ErrorCode errorCode;

    private BindingStoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof BindingStoreException) && ((BindingStoreException) error).getErrorCode() == errorCode;
    }

    public static BindingStoreException alreadyBound(Binding existing) {
        return new BindingStoreException(
                ErrorCode.AlreadyBound,
                format("Workload %s already bound to pool %s", existing.getWorkloadId(), existing.getPoolId()),
                null
        );
    }

    public static BindingStoreException journalFailure(String path, Throwable cause) {
        return new BindingStoreException(ErrorCode.JournalFailure, format("Binding journal %s failure: %s", path, cause.getMessage()), cause);
    }
}
