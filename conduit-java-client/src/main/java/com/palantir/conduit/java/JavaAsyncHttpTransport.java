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


package com.palantir.conduit.java;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.conduit.AsyncHttpTransport;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.HttpResponse;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Non-blocking counterpart of {@link JavaHttpTransport}. Invalid requests and options, and sends on a closed
 * transport, fail the returned future.
 */
public final class JavaAsyncHttpTransport implements AsyncHttpTransport {

    private final ManagedClient client;

    private JavaAsyncHttpTransport(ManagedClient client) {
        this.client = client;
    }

    public static JavaAsyncHttpTransport create() {
        return create(ManagedClient.DEFAULT_REQUEST_TIMEOUT);
    }

    public static JavaAsyncHttpTransport create(Duration requestTimeout) {
        return new JavaAsyncHttpTransport(ManagedClient.create("conduit-java-async-client", requestTimeout));
    }

    public static JavaAsyncHttpTransport of(HttpClient client) {
        return of(client, ManagedClient.DEFAULT_REQUEST_TIMEOUT);
    }

    public static JavaAsyncHttpTransport of(HttpClient client, Duration requestTimeout) {
        return new JavaAsyncHttpTransport(ManagedClient.wrap(client, requestTimeout));
    }

    @Override
    public ListenableFuture<HttpResponse> send(HttpRequest request, Map<String, Object> options) {
        HttpClient httpClient;
        java.net.http.HttpRequest javaRequest;
        try {
            Preconditions.checkNotNull(request, "request");
            Preconditions.checkNotNull(options, "options");
            httpClient = client.client();
            javaRequest = JavaRequests.toJavaRequest(request, options, client.requestTimeout());
        } catch (IOException | RuntimeException e) {
            return Futures.immediateFailedFuture(e);
        }
        return new PendingResponse(
                httpClient.sendAsync(javaRequest, java.net.http.HttpResponse.BodyHandlers.ofInputStream()));
    }

    @Override
    public void open() {
        client.open();
    }

    @Override
    public void close() {
        client.close();
    }

    @Override
    public String toString() {
        return "JavaAsyncHttpTransport{" + client + '}';
    }
}
