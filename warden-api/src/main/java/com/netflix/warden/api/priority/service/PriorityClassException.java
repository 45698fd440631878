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

package com.netflix.warden.api.priority.service;

import com.netflix.warden.api.priority.model.PriorityClass;

import static java.lang.String.format;

public class PriorityClassException extends RuntimeException {

    public enum ErrorCode {
        UnknownPriorityClass,
        DuplicateDefaultPriorityClass,
        PriorityClassAlreadyExists,
        PriorityClassNotFound,
        InvalidPriorityClass
    }

    private final ErrorCode errorCode;

    private PriorityClassException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof PriorityClassException) && ((PriorityClassException) error).getErrorCode() == errorCode;
    }

    public static PriorityClassException unknownPriorityClass(String name) {
        return new PriorityClassException(ErrorCode.UnknownPriorityClass, format("Priority class %s not found", name));
    }

    public static PriorityClassException duplicateDefault(PriorityClass requested, PriorityClass existingDefault) {
        return new PriorityClassException(
                ErrorCode.DuplicateDefaultPriorityClass,
                format("Priority class %s cannot be marked as default, as %s is already the default one", requested.getName(), existingDefault.getName())
        );
    }

    public static PriorityClassException alreadyExists(String name) {
        return new PriorityClassException(ErrorCode.PriorityClassAlreadyExists, format("Priority class %s already exists", name));
    }

    public static PriorityClassException notFound(String name) {
        return new PriorityClassException(ErrorCode.PriorityClassNotFound, format("Priority class %s does not exist", name));
    }

    public static PriorityClassException invalid(String name, String reason, Object... args) {
        return new PriorityClassException(ErrorCode.InvalidPriorityClass, format("Invalid priority class %s: %s", name, format(reason, args)));
    }
}
