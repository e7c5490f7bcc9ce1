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
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.tracing.CloseableSpan;
import com.palantir.tracing.DetachedSpan;
import com.palantir.tracing.api.SpanType;
import java.util.Optional;

/**
 * Records one client span per send, named {@code HTTP <METHOD>} unless {@link TracingOptions#spanName()} says
 * otherwise, and propagates the trace to the server in Zipkin compatible headers. The span is completed with the
 * status code on response, or marked failed on exception. Tracing is skipped for calls whose
 * {@code tracing_options} are disabled.
 */
public final class DistributedTracingPolicy implements SansIoPolicy {

    private static final ContextAttachmentKey<CallSpan> SPAN = ContextAttachmentKey.create(CallSpan.class);
    private static final ContextAttachmentKey<Optional<TracingOptions>> TRACING_OPTIONS_KEY = CallOptions.newKey();

    @Override
    public void onRequest(PipelineRequest request) {
        TracingOptions options = CallOptions.peek(
                        request.context(), TRACING_OPTIONS_KEY, PipelineOptions.TRACING_OPTIONS, TracingOptions.class)
                .orElse(null);
        if (options != null && !options.enabled()) {
            return;
        }
        HttpRequest httpRequest = request.httpRequest();
        String spanName = options != null && options.spanName().isPresent()
                ? options.spanName().get()
                : "HTTP " + httpRequest.method();
        ImmutableMap<String, String> tags =
                ConduitTracing.tracingTags(httpRequest, options == null ? ImmutableMap.of() : options.tags());
        DetachedSpan span = DetachedSpan.start(spanName, SpanType.CLIENT_OUTGOING);
        try (CloseableSpan ignored = span.attach()) {
            ConduitTracing.addTracingHeaders(httpRequest);
        }
        request.context().attachments().put(SPAN, new CallSpan(span, tags));
    }

    @Override
    public void onResponse(PipelineRequest request, PipelineResponse response) {
        CallSpan span = request.context().attachments().remove(SPAN);
        if (span != null) {
            span.span.complete(ConduitTracing.responseTranslator(span.tags), response.httpResponse());
        }
    }

    @Override
    public void onException(PipelineRequest request) {
        CallSpan span = request.context().attachments().remove(SPAN);
        if (span != null) {
            span.span.complete(ConduitTracing.failureTranslator(span.tags), request);
        }
    }

    @Override
    public String toString() {
        return "DistributedTracingPolicy{}";
    }

    private static final class CallSpan {
        private final DetachedSpan span;
        private final ImmutableMap<String, String> tags;

        private CallSpan(DetachedSpan span, ImmutableMap<String, String> tags) {
            this.span = span;
            this.tags = tags;
        }
    }
}
