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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonPatchesTest {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    @Test
    public void testAddCreatesAndReplacesObjectMembers() {
        ObjectNode document = document();
        Patch patch = Patch.newBuilder()
                .add("/metadata/labels/team", "core")
                .add("/metadata/name", "renamed")
                .build();

        ObjectNode result = JsonPatches.apply(document, patch);

        assertThat(result.at("/metadata/labels/team").asText()).isEqualTo("core");
        assertThat(result.at("/metadata/name").asText()).isEqualTo("renamed");
    }

    @Test
    public void testArrayInsertAndAppend() {
        Patch patch = Patch.newBuilder()
                .add("/items/0", "first")
                .add("/items/-", "last")
                .build();

        ObjectNode result = JsonPatches.apply(document(), patch);

        assertThat(result.get("items")).hasSize(3);
        assertThat(result.at("/items/0").asText()).isEqualTo("first");
        assertThat(result.at("/items/1").asText()).isEqualTo("a");
        assertThat(result.at("/items/2").asText()).isEqualTo("last");
    }

    @Test
    public void testRemoveAndReplaceRequireExistingTarget() {
        ObjectNode result = JsonPatches.apply(document(), Patch.newBuilder()
                .remove("/metadata/labels/app")
                .replace("/items/0", TextNode.valueOf("b"))
                .build()
        );
        assertThat(result.at("/metadata/labels").size()).isZero();
        assertThat(result.at("/items/0").asText()).isEqualTo("b");

        assertThatThrownBy(() -> JsonPatches.apply(document(), Patch.newBuilder().remove("/metadata/missing").build()))
                .isInstanceOf(JsonPatchException.class);
        assertThatThrownBy(() -> JsonPatches.apply(document(), Patch.newBuilder().replace("/items/5", TextNode.valueOf("x")).build()))
                .isInstanceOf(JsonPatchException.class);
    }

    @Test
    public void testAddFailsWhenParentMissing() {
        assertThatThrownBy(() -> JsonPatches.apply(document(), Patch.newBuilder().add("/spec/resources/cpu", "1").build()))
                .isInstanceOf(JsonPatchException.class);
    }

    @Test
    public void testFailedPatchLeavesDocumentUntouched() {
        ObjectNode document = document();
        Patch patch = Patch.newBuilder()
                .add("/metadata/labels/team", "core")
                .remove("/does/not/exist")
                .build();

        assertThatThrownBy(() -> JsonPatches.apply(document, patch)).isInstanceOf(JsonPatchException.class);
        assertThat(document.at("/metadata/labels").has("team")).isFalse();
    }

    @Test
    public void testPointerEscaping() {
        assertThat(JsonPatches.pointer("metadata", "annotations", "warden.netflix.com/provision-namespace"))
                .isEqualTo("/metadata/annotations/warden.netflix.com~1provision-namespace");
        assertThat(JsonPatches.pointer("a~b")).isEqualTo("/a~0b");

        ObjectNode result = JsonPatches.apply(document(), Patch.newBuilder()
                .add(JsonPatches.pointer("metadata", "labels", "x/y"), "z")
                .build()
        );
        assertThat(result.get("metadata").get("labels").get("x/y").asText()).isEqualTo("z");
    }

    @Test
    public void testRootModificationRejected() {
        assertThatThrownBy(() -> JsonPatches.apply(document(), Patch.newBuilder().add("", "x").build()))
                .isInstanceOf(JsonPatchException.class);
    }

    private static ObjectNode document() {
        ObjectNode document = FACTORY.objectNode();
        ObjectNode metadata = document.putObject("metadata");
        metadata.put("name", "pod1");
        metadata.putObject("labels").put("app", "web");
        document.putArray("items").add("a");
        return document;
    }
}
