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

package com.netflix.warden.api.admission.model.patch;

/**
 * Raised when a patch cannot be applied to a document.
 */
public class JsonPatchException extends RuntimeException {

    private final PatchOperation operation;

    private JsonPatchException(PatchOperation operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public PatchOperation getOperation() {
        return operation;
    }

    public static JsonPatchException invalidPath(PatchOperation operation, Throwable cause) {
        return new JsonPatchException(operation, String.format("Invalid JSON pointer '%s': %s", operation.getPath(), cause.getMessage()), cause);
    }

    public static JsonPatchException rootModification(PatchOperation operation) {
        return new JsonPatchException(operation, "Patch cannot modify the document root: " + operation, null);
    }

    public static JsonPatchException parentNotFound(PatchOperation operation) {
        return new JsonPatchException(operation, String.format("Parent of '%s' does not exist", operation.getPath()), null);
    }

    public static JsonPatchException targetNotFound(PatchOperation operation) {
        return new JsonPatchException(operation, String.format("Target '%s' does not exist", operation.getPath()), null);
    }

    public static JsonPatchException notContainer(PatchOperation operation) {
        return new JsonPatchException(operation, String.format("Parent of '%s' is neither an object nor an array", operation.getPath()), null);
    }

    public static JsonPatchException badArrayIndex(PatchOperation operation) {
        return new JsonPatchException(operation, String.format("Array index out of range in '%s'", operation.getPath()), null);
    }

    public static JsonPatchException missingValue(PatchOperation operation) {
        return new JsonPatchException(operation, String.format("Operation %s on '%s' requires a value", operation.getOp(), operation.getPath()), null);
    }
}
