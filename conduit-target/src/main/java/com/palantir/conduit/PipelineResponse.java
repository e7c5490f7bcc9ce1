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

/**
 * The request that was sent, the raw transport response and the call's context. Produced by the transport runner
 * and returned up the chain unchanged in shape.
 */
public final class PipelineResponse {

    private final HttpRequest httpRequest;
    private final HttpResponse httpResponse;
    private final PipelineContext context;

    private PipelineResponse(HttpRequest httpRequest, HttpResponse httpResponse, PipelineContext context) {
        this.httpRequest = Preconditions.checkNotNull(httpRequest, "httpRequest");
        this.httpResponse = Preconditions.checkNotNull(httpResponse, "httpResponse");
        this.context = Preconditions.checkNotNull(context, "context");
    }

    public static PipelineResponse of(HttpRequest httpRequest, HttpResponse httpResponse, PipelineContext context) {
        return new PipelineResponse(httpRequest, httpResponse, context);
    }

    public HttpRequest httpRequest() {
        return httpRequest;
    }

    public HttpResponse httpResponse() {
        return httpResponse;
    }

    public PipelineContext context() {
        return context;
    }

    @Override
    public String toString() {
        return "PipelineResponse{status=" + httpResponse.status() + ", httpRequest=" + httpRequest + '}';
    }
}
