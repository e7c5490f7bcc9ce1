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

import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.HttpResponse;
import com.palantir.conduit.HttpTransport;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * A blocking {@link HttpTransport} backed by the JDK {@link HttpClient}. Redirects are never followed by the
 * client itself. The only supported per-call option is {@code timeout}.
 */
public final class JavaHttpTransport implements HttpTransport {

    private final ManagedClient client;

    private JavaHttpTransport(ManagedClient client) {
        this.client = client;
    }

    /** A transport with its own client, closed together with the transport. */
    public static JavaHttpTransport create() {
        return create(ManagedClient.DEFAULT_REQUEST_TIMEOUT);
    }

    public static JavaHttpTransport create(Duration requestTimeout) {
        return new JavaHttpTransport(ManagedClient.create("conduit-java-client", requestTimeout));
    }

    /** A transport sending through the given client, which the caller keeps owning. */
    public static JavaHttpTransport of(HttpClient client) {
        return of(client, ManagedClient.DEFAULT_REQUEST_TIMEOUT);
    }

    public static JavaHttpTransport of(HttpClient client, Duration requestTimeout) {
        return new JavaHttpTransport(ManagedClient.wrap(client, requestTimeout));
    }

    @Override
    public HttpResponse send(HttpRequest request, Map<String, Object> options) throws IOException {
        Preconditions.checkNotNull(request, "request");
        Preconditions.checkNotNull(options, "options");
        HttpClient httpClient = client.client();
        java.net.http.HttpRequest javaRequest =
                JavaRequests.toJavaRequest(request, options, client.requestTimeout());
        try {
            java.net.http.HttpResponse<InputStream> response =
                    httpClient.send(javaRequest, java.net.http.HttpResponse.BodyHandlers.ofInputStream());
            return new JavaResponse(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while sending request");
            interrupted.initCause(e);
            throw interrupted;
        }
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
        return "JavaHttpTransport{" + client + '}';
    }
}
