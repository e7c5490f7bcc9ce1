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


package com.palantir.conduit.core;

import com.google.common.collect.ImmutableMap;
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.logsafe.Preconditions;
import java.util.Map;
import java.util.Optional;

/**
 * Sets a fixed set of headers on every request, plus those passed with the per-call option {@code headers} (a
 * {@code Map<String, String>}). Per-call headers win over the fixed ones; both replace values already present.
 */
public final class HeadersPolicy implements SansIoPolicy {

    static final String HEADERS = "headers";

    private static final ContextAttachmentKey<Optional<Map<String, String>>> HEADERS_KEY = CallOptions.newKey();

    private final ImmutableMap<String, String> headers;

    public HeadersPolicy(Map<String, String> headers) {
        this.headers = ImmutableMap.copyOf(Preconditions.checkNotNull(headers, "headers"));
    }

    @Override
    public void onRequest(PipelineRequest request) {
        HttpRequest httpRequest = request.httpRequest();
        headers.forEach(httpRequest::setHeader);
        CallOptions.consumeStringMap(request.context(), HEADERS_KEY, HEADERS)
                .ifPresent(perCall -> perCall.forEach(httpRequest::setHeader));
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return "HeadersPolicy{headerNames=" + headers.keySet() + '}';
    }
}
