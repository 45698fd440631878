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

package com.netflix.warden.api.admission.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AdmissionRequestTest {

    @Test
    public void testPayloadCannotBeModifiedInPlace() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject(PayloadFields.METADATA).put(PayloadFields.NAME, "pod1");
        AdmissionRequest request = newRequest(payload);

        request.getPayload().with(PayloadFields.METADATA).put(PayloadFields.NAME, "changed");
        payload.with(PayloadFields.METADATA).put(PayloadFields.NAME, "changedAtSource");

        assertThat(request.getName()).isEqualTo("pod1");
    }

    @Test
    public void testStageMatcher() {
        AdmissionRequest request = newRequest(JsonNodeFactory.instance.objectNode());

        assertThat(StageMatcher.matchAll().matches(request)).isTrue();
        assertThat(StageMatcher.forKind(ResourceKinds.POD, Operation.CREATE).matches(request)).isTrue();
        assertThat(StageMatcher.forKind(ResourceKinds.POD, Operation.DELETE).matches(request)).isFalse();
        assertThat(StageMatcher.forKind(ResourceKinds.NODE).matches(request)).isFalse();
        assertThat(StageMatcher.newBuilder().withNamespaces(ImmutableSet.of("other")).build().matches(request)).isFalse();
        assertThat(StageMatcher.newBuilder().withExcludedNamespaces(ImmutableSet.of("team-a")).build().matches(request)).isFalse();
    }

    private static AdmissionRequest newRequest(ObjectNode payload) {
        return AdmissionRequest.newBuilder()
                .withId("request#1")
                .withOperation(Operation.CREATE)
                .withKind(ResourceKinds.POD)
                .withNamespace("team-a")
                .withUserInfo(UserInfo.of("alice"))
                .withPayload(payload)
                .withCreatedAt(0)
                .build();
    }
}
