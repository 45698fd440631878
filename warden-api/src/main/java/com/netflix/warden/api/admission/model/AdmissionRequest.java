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

import java.util.Objects;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.netflix.warden.common.util.StringExt;

/**
 * A resource mutation request. Instances are immutable. The payload is copied on the way in and on the way out,
 * so neither the caller nor an admission stage can change a request in place. Changes are made by building
 * a new request with {@link #toBuilder()}.
 */
public class AdmissionRequest {

    private final String id;
    private final Operation operation;
    private final String kind;
    private final String namespace;
    private final UserInfo userInfo;
    private final ObjectNode payload;
    private final long createdAt;

    private AdmissionRequest(String id,
                             Operation operation,
                             String kind,
                             String namespace,
                             UserInfo userInfo,
                             ObjectNode payload,
                             long createdAt) {
        this.id = id;
        this.operation = operation;
        this.kind = kind;
        this.namespace = namespace;
        this.userInfo = userInfo;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public Operation getOperation() {
        return operation;
    }

    public String getKind() {
        return kind;
    }

    /**
     * Returns the request namespace, or an empty string for cluster scoped resources.
     */
    public String getNamespace() {
        return namespace;
    }

    public UserInfo getUserInfo() {
        return userInfo;
    }

    /**
     * Returns a copy of the payload document.
     */
    public ObjectNode getPayload() {
        return payload.deepCopy();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * Resource name from <tt>metadata.name</tt>, or an empty string if not set.
     */
    public String getName() {
        return payload.path("metadata").path("name").asText("");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionRequest that = (AdmissionRequest) o;
        return createdAt == that.createdAt &&
                Objects.equals(id, that.id) &&
                operation == that.operation &&
                Objects.equals(kind, that.kind) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(userInfo, that.userInfo) &&
                Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operation, kind, namespace, userInfo, payload, createdAt);
    }

    @Override
    public String toString() {
        return "AdmissionRequest{" +
                "id='" + id + '\'' +
                ", operation=" + operation +
                ", kind='" + kind + '\'' +
                ", namespace='" + namespace + '\'' +
                ", userInfo=" + userInfo +
                ", payload=" + payload +
                ", createdAt=" + createdAt +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder(this);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(AdmissionRequest source) {
        return new Builder()
                .withId(source.getId())
                .withOperation(source.getOperation())
                .withKind(source.getKind())
                .withNamespace(source.getNamespace())
                .withUserInfo(source.getUserInfo())
                .withPayload(source.payload)
                .withCreatedAt(source.getCreatedAt());
    }

    public static final class Builder {
        private String id;
        private Operation operation;
        private String kind;
        private String namespace;
        private UserInfo userInfo;
        private ObjectNode payload;
        private long createdAt;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withOperation(Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder withKind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withUserInfo(UserInfo userInfo) {
            this.userInfo = userInfo;
            return this;
        }

        public Builder withPayload(ObjectNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder withCreatedAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AdmissionRequest build() {
            Preconditions.checkNotNull(id, "Request id not set");
            Preconditions.checkNotNull(operation, "Operation not set");
            Preconditions.checkArgument(StringExt.isNotEmpty(kind), "Resource kind not set");
            return new AdmissionRequest(
                    id,
                    operation,
                    kind,
                    StringExt.nonNull(namespace),
                    userInfo == null ? UserInfo.anonymous() : userInfo,
                    payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy(),
                    createdAt
            );
        }
    }
}
