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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Scripted transport for pipeline tests. Each send consumes the next scripted outcome, records a snapshot of the
 * request and the options it received, and counts lifecycle calls. {@link #asAsync()} exposes the same script as
 * an asynchronous transport.
 */
public final class RecordingTransport implements HttpTransport {

    private final Deque<Outcome> outcomes = new ArrayDeque<>();
    private final List<HttpRequest> requests = new ArrayList<>();
    private final List<Map<String, Object>> options = new ArrayList<>();
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();

    @Nullable
    private volatile Supplier<HttpResponse> defaultResponse = null;

    @CanIgnoreReturnValue
    public synchronized RecordingTransport respond(HttpResponse response) {
        outcomes.add(new Outcome(response, null));
        return this;
    }

    @CanIgnoreReturnValue
    public synchronized RecordingTransport respondWith(int status) {
        return respond(new TestResponse().status(status));
    }

    @CanIgnoreReturnValue
    public synchronized RecordingTransport fail(IOException failure) {
        outcomes.add(new Outcome(null, failure));
        return this;
    }

    /** Responds 200 to every send once the scripted outcomes are used up. */
    @CanIgnoreReturnValue
    public RecordingTransport respondOkByDefault() {
        defaultResponse = TestResponse::new;
        return this;
    }

    @Override
    public synchronized HttpResponse send(HttpRequest request, Map<String, Object> sendOptions) throws IOException {
        requests.add(request.copy());
        options.add(ImmutableMap.copyOf(sendOptions));
        Outcome outcome = outcomes.poll();
        if (outcome == null) {
            Supplier<HttpResponse> fallback = defaultResponse;
            if (fallback == null) {
                throw new SafeIllegalStateException("No scripted outcome left");
            }
            return fallback.get();
        }
        if (outcome.failure != null) {
            throw outcome.failure;
        }
        return outcome.response;
    }

    /** An asynchronous view sharing this transport's script, recordings and lifecycle counters. */
    public AsyncHttpTransport asAsync() {
        RecordingTransport delegate = this;
        return new AsyncHttpTransport() {
            @Override
            public ListenableFuture<HttpResponse> send(HttpRequest request, Map<String, Object> sendOptions) {
                try {
                    return Futures.immediateFuture(delegate.send(request, sendOptions));
                } catch (IOException | RuntimeException e) {
                    return Futures.immediateFailedFuture(e);
                }
            }

            @Override
            public void open() {
                delegate.open();
            }

            @Override
            public void close() {
                delegate.close();
            }
        };
    }

    @Override
    public void open() {
        opens.incrementAndGet();
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }

    public synchronized List<HttpRequest> requests() {
        return ImmutableList.copyOf(requests);
    }

    public synchronized List<Map<String, Object>> options() {
        return ImmutableList.copyOf(options);
    }

    public synchronized int sends() {
        return requests.size();
    }

    public int opens() {
        return opens.get();
    }

    public int closes() {
        return closes.get();
    }

    private static final class Outcome {
        @Nullable
        private final HttpResponse response;

        @Nullable
        private final IOException failure;

        private Outcome(@Nullable HttpResponse response, @Nullable IOException failure) {
            this.response = response;
            this.failure = failure;
        }
    }
}
