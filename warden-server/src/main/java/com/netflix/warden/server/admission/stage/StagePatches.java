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

package com.netflix.warden.server.admission.stage;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.warden.api.admission.model.patch.JsonPatches;
import com.netflix.warden.api.admission.model.patch.Patch;

/**
 * Helpers for building patches against documents that may lack intermediate objects. JSON patch 'add' requires
 * the parent to exist, so missing parents are added first.
 */
final class StagePatches {

    private StagePatches() {
    }

    /**
     * Adds operations creating each missing object along the path, and returns the pointer to the last one.
     */
    static String ensureObject(ObjectNode payload, Patch.Builder builder, String... segments) {
        JsonNode current = payload;
        List<String> path = new ArrayList<>();
        for (String segment : segments) {
            path.add(segment);
            JsonNode next = current == null ? null : current.get(segment);
            if (next == null || !next.isObject()) {
                String pointer = JsonPatches.pointer(path.toArray(new String[0]));
                if (next == null) {
                    builder.add(pointer, JsonNodeFactory.instance.objectNode());
                } else {
                    builder.replace(pointer, JsonNodeFactory.instance.objectNode());
                }
                current = null;
            } else {
                current = next;
            }
        }
        return JsonPatches.pointer(segments);
    }

    static String child(String parentPointer, String name) {
        return parentPointer + JsonPatches.pointer(name);
    }
}
