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

import com.google.common.util.concurrent.AbstractFuture;
import com.palantir.conduit.HttpResponse;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The response of an in-flight JDK client exchange, as a {@link com.google.common.util.concurrent.ListenableFuture}.
 * Cancelling it aborts the exchange; a response which arrives after cancellation is closed, so its connection is
 * returned to the client.
 */
final class PendingResponse extends AbstractFuture<HttpResponse> {

    private static final SafeLogger log = SafeLoggerFactory.get(PendingResponse.class);

    private final CompletableFuture<java.net.http.HttpResponse<InputStream>> exchange;

    PendingResponse(CompletableFuture<java.net.http.HttpResponse<InputStream>> exchange) {
        this.exchange = exchange;
        exchange.whenComplete((response, throwable) -> {
            if (throwable != null) {
                setException(unwrap(throwable));
                return;
            }
            JavaResponse converted = new JavaResponse(response);
            if (!set(converted)) {
                log.debug(
                        "Closing a response which arrived after cancellation",
                        SafeArg.of("status", converted.status()));
                converted.close();
            }
        });
    }

    @Override
    protected void afterDone() {
        if (isCancelled()) {
            exchange.cancel(wasInterrupted());
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        // derived stages wrap the client's failure
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }
}
