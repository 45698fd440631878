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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.netflix.warden.common.util.StringExt;

/**
 * A single RFC 6902 document edit. The path is an RFC 6901 JSON pointer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchOperation {

    public enum Op {
        Add("add"),
        Remove("remove"),
        Replace("replace");

        private final String wireName;

        Op(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static Op fromWireName(String wireName) {
            return StringExt.parseEnumIgnoreCase(wireName, Op.class);
        }
    }

    private final Op op;
    private final String path;
    private final JsonNode value;

    @JsonCreator
    public PatchOperation(@JsonProperty("op") Op op,
                          @JsonProperty("path") String path,
                          @JsonProperty("value") JsonNode value) {
        this.op = op;
        this.path = path;
        this.value = value;
    }

    public Op getOp() {
        return op;
    }

    public String getPath() {
        return path;
    }

    /**
     * Value for add/replace operations, null for remove.
     */
    public JsonNode getValue() {
        return value;
    }

    public static PatchOperation add(String path, JsonNode value) {
        return new PatchOperation(Op.Add, path, value);
    }

    public static PatchOperation remove(String path) {
        return new PatchOperation(Op.Remove, path, null);
    }

    public static PatchOperation replace(String path, JsonNode value) {
        return new PatchOperation(Op.Replace, path, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PatchOperation that = (PatchOperation) o;
        return op == that.op &&
                Objects.equals(path, that.path) &&
                Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, path, value);
    }

    @Override
    public String toString() {
        return "PatchOperation{" +
                "op=" + op +
                ", path='" + path + '\'' +
                ", value=" + value +
                '}';
    }
}
