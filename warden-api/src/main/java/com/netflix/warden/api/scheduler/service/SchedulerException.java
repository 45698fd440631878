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

package com.netflix.warden.api.scheduler.service;

import static java.lang.String.format;

public class SchedulerException extends RuntimeException {

    public enum ErrorCode {
        WorkloadNotFound,
        WorkloadAlreadyExists,
        PoolNotFound,
        PoolAlreadyExists
    }

    private final ErrorCode errorCode;

    private SchedulerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof SchedulerException) && ((SchedulerException) error).getErrorCode() == errorCode;
    }

    public static SchedulerException workloadNotFound(String workloadId) {
        return new SchedulerException(ErrorCode.WorkloadNotFound, format("Workload %s not found", workloadId));
    }

    public static SchedulerException workloadAlreadyExists(String workloadId) {
        return new SchedulerException(ErrorCode.WorkloadAlreadyExists, format("Workload %s already submitted", workloadId));
    }

    public static SchedulerException poolNotFound(String poolId) {
        return new SchedulerException(ErrorCode.PoolNotFound, format("Resource pool %s not found", poolId));
    }

    public static SchedulerException poolAlreadyExists(String poolId) {
        return new SchedulerException(ErrorCode.PoolAlreadyExists, format("Resource pool %s already exists", poolId));
    }
}
