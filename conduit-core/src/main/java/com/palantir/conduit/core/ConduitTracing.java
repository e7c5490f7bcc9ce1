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
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.HttpResponse;
import com.palantir.tracing.TagTranslator;
import com.palantir.tracing.Tracer;
import com.palantir.tracing.TraceMetadata;
import com.palantir.tracing.api.TraceHttpHeaders;
import com.palantir.tracing.api.TraceTags;
import java.util.Map;
import java.util.Optional;

/** Internal utility functionality to support tracing pipeline calls. */
final class ConduitTracing {

    static ImmutableMap<String, String> tracingTags(HttpRequest request, Map<String, String> extraTags) {
        return ImmutableMap.<String, String>builder()
                .putAll(extraTags)
                .put(TraceTags.HTTP_METHOD, request.method().toString())
                .buildKeepingLast();
    }

    static TagTranslator<HttpResponse> responseTranslator(ImmutableMap<String, String> tags) {
        return new TagTranslator<>() {
            @Override
            public <T> void translate(TagAdapter<T> sink, T target, HttpResponse response) {
                sink.tag(target, tags);
                int status = response.status();
                sink.tag(target, "outcome", Responses.isSuccess(response) ? "success" : "failure");
                sink.tag(target, TraceTags.HTTP_STATUS_CODE, Integer.toString(status));
            }
        };
    }

    static TagTranslator<Object> failureTranslator(ImmutableMap<String, String> tags) {
        return new TagTranslator<>() {
            @Override
            public <T> void translate(TagAdapter<T> sink, T target, Object _data) {
                sink.tag(target, tags);
                sink.tag(target, "outcome", "failure");
            }
        };
    }

    /** Propagates the current trace to the server as Zipkin compatible headers. */
    static void addTracingHeaders(HttpRequest request) {
        Optional<TraceMetadata> maybeMetadata = Tracer.maybeGetTraceMetadata();
        if (maybeMetadata.isEmpty()) {
            return;
        }
        TraceMetadata metadata = maybeMetadata.get();
        request.setHeader(TraceHttpHeaders.TRACE_ID, metadata.getTraceId());
        request.setHeader(TraceHttpHeaders.SPAN_ID, metadata.getSpanId());
        request.setHeader(TraceHttpHeaders.IS_SAMPLED, Tracer.isTraceObservable() ? "1" : "0");
    }

    private ConduitTracing() {}
}
