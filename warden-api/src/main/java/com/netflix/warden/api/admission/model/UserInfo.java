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

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSet;

/**
 * Identity of the caller, as established by the authentication layer.
 */
public class UserInfo {

    private static final UserInfo ANONYMOUS = new UserInfo("system:anonymous", Collections.emptySet());

    private final String username;
    private final Set<String> groups;

    @JsonCreator
    public UserInfo(@JsonProperty("username") String username,
                    @JsonProperty("groups") Set<String> groups) {
        this.username = username;
        this.groups = groups == null ? Collections.emptySet() : ImmutableSet.copyOf(groups);
    }

    public String getUsername() {
        return username;
    }

    public Set<String> getGroups() {
        return groups;
    }

    public static UserInfo anonymous() {
        return ANONYMOUS;
    }

    public static UserInfo of(String username, String... groups) {
        return new UserInfo(username, ImmutableSet.copyOf(groups));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UserInfo userInfo = (UserInfo) o;
        return Objects.equals(username, userInfo.username) &&
                Objects.equals(groups, userInfo.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, groups);
    }

    @Override
    public String toString() {
        return "UserInfo{" +
                "username='" + username + '\'' +
                ", groups=" + groups +
                '}';
    }
}
