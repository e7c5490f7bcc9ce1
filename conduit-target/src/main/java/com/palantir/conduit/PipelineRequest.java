/*
 * (c) Copyright 2025 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.conduit;

import com.palantir.logsafe.Preconditions;

/** The unit passed down the policy chain: one request attempt paired with its call's context. */
public final class PipelineRequest {

    private final HttpRequest httpRequest;
    private final PipelineContext context;

    private PipelineRequest(HttpRequest httpRequest, PipelineContext context) {
        this.httpRequest = Preconditions.checkNotNull(httpRequest, "httpRequest");
        this.context = Preconditions.checkNotNull(context, "context");
    }

    public static PipelineRequest of(HttpRequest httpRequest, PipelineContext context) {
        return new PipelineRequest(httpRequest, context);
    }

    public HttpRequest httpRequest() {
        return httpRequest;
    }

    public PipelineContext context() {
        return context;
    }

    @Override
    public String toString() {
        return "PipelineRequest{httpRequest=" + httpRequest + ", context=" + context + '}';
    }
}
