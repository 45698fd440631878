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

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * RFC 6902 (add/remove/replace subset) patch engine for Jackson trees.
 */
public final class JsonPatches {

    private static final String APPEND_INDEX = "-";

    private JsonPatches() {
    }

    /**
     * Applies all operations of the patch to a copy of the document. The input document is never modified, so
     * a failure in the middle of a patch leaves no partial result behind.
     *
     * @throws JsonPatchException if any of the operations cannot be applied
     */
    public static ObjectNode apply(ObjectNode document, Patch patch) {
        if (patch.isEmpty()) {
            return document.deepCopy();
        }
        ObjectNode result = document.deepCopy();
        for (PatchOperation operation : patch.getOperations()) {
            applyOperation(result, operation);
        }
        return result;
    }

    /**
     * Builds a JSON pointer from unescaped path segments.
     */
    public static String pointer(String... segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            sb.append('/').append(segment.replace("~", "~0").replace("/", "~1"));
        }
        return sb.toString();
    }

    private static void applyOperation(ObjectNode document, PatchOperation operation) {
        if (operation.getOp() != PatchOperation.Op.Remove && operation.getValue() == null) {
            throw JsonPatchException.missingValue(operation);
        }

        JsonPointer pointer;
        try {
            pointer = JsonPointer.compile(operation.getPath());
        } catch (IllegalArgumentException e) {
            throw JsonPatchException.invalidPath(operation, e);
        }
        if (pointer.matches()) {
            throw JsonPatchException.rootModification(operation);
        }

        JsonNode parent = document.at(pointer.head());
        if (parent.isMissingNode()) {
            throw JsonPatchException.parentNotFound(operation);
        }
        String segment = pointer.last().getMatchingProperty();

        if (parent.isObject()) {
            applyToObject((ObjectNode) parent, segment, operation);
        } else if (parent.isArray()) {
            applyToArray((ArrayNode) parent, segment, operation);
        } else {
            throw JsonPatchException.notContainer(operation);
        }
    }

    private static void applyToObject(ObjectNode parent, String field, PatchOperation operation) {
        switch (operation.getOp()) {
            case Add:
                parent.set(field, operation.getValue().deepCopy());
                return;
            case Replace:
                if (!parent.has(field)) {
                    throw JsonPatchException.targetNotFound(operation);
                }
                parent.set(field, operation.getValue().deepCopy());
                return;
            case Remove:
                if (!parent.has(field)) {
                    throw JsonPatchException.targetNotFound(operation);
                }
                parent.remove(field);
        }
    }

    private static void applyToArray(ArrayNode parent, String segment, PatchOperation operation) {
        if (APPEND_INDEX.equals(segment)) {
            if (operation.getOp() != PatchOperation.Op.Add) {
                throw JsonPatchException.badArrayIndex(operation);
            }
            parent.add(operation.getValue().deepCopy());
            return;
        }

        int index = parseIndex(segment);
        switch (operation.getOp()) {
            case Add:
                if (index < 0 || index > parent.size()) {
                    throw JsonPatchException.badArrayIndex(operation);
                }
                parent.insert(index, operation.getValue().deepCopy());
                return;
            case Replace:
                if (index < 0 || index >= parent.size()) {
                    throw JsonPatchException.badArrayIndex(operation);
                }
                parent.set(index, operation.getValue().deepCopy());
                return;
            case Remove:
                if (index < 0 || index >= parent.size()) {
                    throw JsonPatchException.badArrayIndex(operation);
                }
                parent.remove(index);
        }
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || (segment.length() > 1 && segment.charAt(0) == '0')) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
