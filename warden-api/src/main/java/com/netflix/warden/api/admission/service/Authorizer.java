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

package com.netflix.warden.api.admission.service;

import com.netflix.warden.api.admission.model.AdmissionRequest;
import com.netflix.warden.api.admission.model.UserInfo;
import reactor.core.publisher.Mono;

/**
 * Authentication/authorization collaborator consulted before admission.
 */
public interface Authorizer {

    /**
     * Returns the verified identity of the caller, or an {@link AdmissionException} with the
     * {@link AdmissionException.ErrorCode#Unauthorized} code.
     */
    Mono<UserInfo> authorize(AdmissionRequest request);
}
