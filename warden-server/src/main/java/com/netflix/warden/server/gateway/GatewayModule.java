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

package com.netflix.warden.server.gateway;

import com.google.inject.AbstractModule;
import com.netflix.warden.api.admission.service.Authorizer;
import com.netflix.warden.api.gateway.ResourceGateway;

public class GatewayModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(Authorizer.class).to(AllowAllAuthorizer.class);
        bind(ResourceGateway.class).to(DefaultResourceGateway.class);
    }
}
