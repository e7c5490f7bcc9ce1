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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.conduit.AsyncHttpTransport;
import com.palantir.conduit.AsyncSansIoPolicy;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.MultipartMixed;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.RecordingTransport;
import com.palantir.logsafe.exceptions.SafeIoException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class AsyncPipelineTest {

    private final RecordingTransport transport = new RecordingTransport();
    private final AsyncHttpTransport asyncTransport = transport.asAsync();
    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    @Test
    void hooksRunInOrderAndUnwindInReverse() throws Exception {
        transport.respondWith(200);
        AsyncPipeline pipeline = AsyncPipeline.builder()
                .transport(asyncTransport)
                .addPolicy(new RecordingPolicy("a", events))
                .addPolicy(new RecordingPolicy("b", events))
                .build();

        assertThat(pipeline.run(request()).get().httpResponse().status()).isEqualTo(200);
        assertThat(events).containsExactly("a.onRequest", "b.onRequest", "b.onResponse", "a.onResponse");
    }

    @Test
    void pendingHookHoldsBackTheSend() throws Exception {
        transport.respondWith(200);
        SettableFuture<Object> credentialRefresh = SettableFuture.create();
        AsyncSansIoPolicy waiting = new AsyncSansIoPolicy() {
            @Override
            public ListenableFuture<?> onRequest(PipelineRequest _request) {
                events.add("waiting.onRequest");
                return credentialRefresh;
            }

            @Override
            public ListenableFuture<?> onResponse(PipelineRequest _request, PipelineResponse _response) {
                events.add("waiting.onResponse");
                return Futures.immediateVoidFuture();
            }
        };
        AsyncPipeline pipeline = AsyncPipeline.builder()
                .transport(asyncTransport)
                .addPolicy(waiting)
                .addPolicy(new RecordingPolicy("inner", events))
                .build();

        ListenableFuture<PipelineResponse> result = pipeline.run(request());

        assertThat(result).isNotDone();
        assertThat(transport.sends()).isZero();
        assertThat(events).containsExactly("waiting.onRequest");

        credentialRefresh.set("token");

        assertThat(result).isDone();
        assertThat(result.get().httpResponse().status()).isEqualTo(200);
        assertThat(events)
                .containsExactly("waiting.onRequest", "inner.onRequest", "inner.onResponse", "waiting.onResponse");
    }

    @Test
    void transportFailureUnwindsThroughOnException() {
        SafeIoException failure = new SafeIoException("connection reset");
        transport.fail(failure);
        AsyncPipeline pipeline = AsyncPipeline.builder()
                .transport(asyncTransport)
                .addPolicy(new RecordingPolicy("a", events))
                .addPolicy(new RecordingPolicy("b", events))
                .build();

        ListenableFuture<PipelineResponse> result = pipeline.run(request());

        assertThatThrownBy(result::get).isInstanceOf(ExecutionException.class).hasCause(failure);
        assertThat(events).containsExactly("a.onRequest", "b.onRequest", "b.onException", "a.onException");
    }

    @Test
    void failedRequestHookNeverReachesOnException() {
        AsyncSansIoPolicy failing = new AsyncSansIoPolicy() {
            @Override
            public ListenableFuture<?> onRequest(PipelineRequest _request) {
                return Futures.immediateFailedFuture(new SafeIoException("credential unavailable"));
            }

            @Override
            public ListenableFuture<?> onException(PipelineRequest _request) {
                events.add("failing.onException");
                return Futures.immediateVoidFuture();
            }
        };
        AsyncPipeline pipeline = AsyncPipeline.builder()
                .transport(asyncTransport)
                .addPolicy(failing)
                .build();

        ListenableFuture<PipelineResponse> result = pipeline.run(request());

        assertThatThrownBy(result::get).hasCauseInstanceOf(SafeIoException.class);
        assertThat(events).isEmpty();
        assertThat(transport.sends()).isZero();
    }

    @Test
    void throwingHookBecomesAFailedFuture() {
        AsyncSansIoPolicy throwing = new AsyncSansIoPolicy() {
            @Override
            public ListenableFuture<?> onRequest(PipelineRequest _request) {
                throw new IllegalStateException("bug");
            }
        };
        AsyncPipeline pipeline = AsyncPipeline.builder()
                .transport(asyncTransport)
                .addPolicy(throwing)
                .build();

        ListenableFuture<PipelineResponse> result = pipeline.run(request());

        assertThat(result).isDone();
        assertThatThrownBy(result::get).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void throwingTransportBecomesAFailedFuture() {
        AsyncHttpTransport throwing = new AsyncHttpTransport() {
            @Override
            public ListenableFuture<com.palantir.conduit.HttpResponse> send(
                    HttpRequest _request, Map<String, Object> _options) {
                throw new IllegalStateException("transport bug");
            }

            @Override
            public void open() {}

            @Override
            public void close() {}
        };
        AsyncPipeline pipeline = AsyncPipeline.builder().transport(throwing).build();

        assertThatThrownBy(pipeline.run(request())::get).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyPipelineSendsOnceToTheTransport() throws Exception {
        transport.respondWith(202);
        AsyncPipeline pipeline = AsyncPipeline.builder().transport(asyncTransport).build();

        assertThat(pipeline.run(request()).get().httpResponse().status()).isEqualTo(202);
        assertThat(transport.sends()).isEqualTo(1);
    }

    @Test
    void pipelineInternalOptionsNeverReachTheTransport() throws Exception {
        transport.respondWith(200);
        AsyncPipeline pipeline = AsyncPipeline.builder().transport(asyncTransport).build();

        pipeline.run(
                        request(),
                        ImmutableMap.of(
                                PipelineOptions.INSECURE_DOMAIN_CHANGE, true,
                                PipelineOptions.ENABLE_CAE, false,
                                PipelineOptions.TRACING_OPTIONS, TracingOptions.disabled()))
                .get();

        assertThat(transport.options()).containsExactly(ImmutableMap.of());
    }

    @Test
    void invalidArgumentsFailTheFuture() {
        AsyncPipeline pipeline = AsyncPipeline.builder().transport(asyncTransport).build();

        assertThat(pipeline.run(null)).isDone();
        assertThatThrownBy(pipeline.run(null)::get).isInstanceOf(ExecutionException.class);
    }

    @Test
    void multipartPartsArePreparedBeforeTheHead() throws Exception {
        transport.respondWith(202);
        HttpRequest first = part("/first");
        HttpRequest second = part("/second");
        HttpRequest batch = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://example.com/$batch")
                .multipartMixed(MultipartMixed.builder()
                        .addParts(first, second)
                        .addPolicies(new HeadersPolicy(ImmutableMap.of("x-part", "prepared")))
                        .boundary("batch_test")
                        .build())
                .build();
        AsyncPipeline pipeline = AsyncPipeline.builder().transport(asyncTransport).build();

        pipeline.run(batch).get();

        assertThat(first.getFirstHeader("x-part")).contains("prepared");
        assertThat(second.getFirstHeader("x-part")).contains("prepared");
        HttpRequest sent = transport.requests().get(0);
        assertThat(sent.getFirstHeader("Content-Type")).contains("multipart/mixed; boundary=batch_test");
        assertThat(body(sent)).contains("GET https://example.com/first HTTP/1.1", "x-part: prepared");
    }

    @Test
    void openAndCloseDelegateToTheTransport() {
        try (AsyncPipeline pipeline =
                AsyncPipeline.builder().transport(asyncTransport).build().open()) {
            assertThat(pipeline).isNotNull();
        }
        assertThat(transport.opens()).isEqualTo(1);
        assertThat(transport.closes()).isEqualTo(1);
    }

    private static String body(HttpRequest request) throws IOException {
        java.io.ByteArrayOutputStream out = new java.io.ByteArrayOutputStream();
        request.body().orElseThrow().writeTo(out);
        return out.toString(java.nio.charset.StandardCharsets.UTF_8);
    }

    private static HttpRequest part(String path) {
        return HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com" + path)
                .build();
    }

    private static HttpRequest request() {
        return HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com/resource")
                .build();
    }
}
