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

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The client shared by the sync and async transports, with the lifecycle both expose. A client built here owns its
 * executor, which is shut down on close; a caller supplied client is left alone.
 */
final class ManagedClient {

    private static final SafeLogger log = SafeLoggerFactory.get(ManagedClient.class);

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Optional<ExecutorService> ownedExecutor;
    private final Duration requestTimeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ManagedClient(HttpClient client, Optional<ExecutorService> ownedExecutor, Duration requestTimeout) {
        this.client = client;
        this.ownedExecutor = ownedExecutor;
        this.requestTimeout = requestTimeout;
    }

    static ManagedClient create(String name, Duration requestTimeout) {
        checkTimeout(requestTimeout);
        ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .build());
        HttpClient client = HttpClient.newBuilder()
                // redirects are a pipeline concern
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor)
                .build();
        return new ManagedClient(client, Optional.of(executor), requestTimeout);
    }

    static ManagedClient wrap(HttpClient client, Duration requestTimeout) {
        Preconditions.checkNotNull(client, "client");
        checkTimeout(requestTimeout);
        return new ManagedClient(client, Optional.empty(), requestTimeout);
    }

    HttpClient client() {
        checkOpen();
        return client;
    }

    Duration requestTimeout() {
        return requestTimeout;
    }

    void checkOpen() {
        if (closed.get()) {
            throw new SafeIllegalStateException("Transport is closed");
        }
    }

    void open() {
        checkOpen();
    }

    void close() {
        if (closed.compareAndSet(false, true)) {
            ownedExecutor.ifPresent(executor -> {
                if (!MoreExecutors.shutdownAndAwaitTermination(executor, 1, TimeUnit.SECONDS)) {
                    log.info("HTTP client executor did not terminate in time", SafeArg.of("timeoutSeconds", 1));
                }
            });
        }
    }

    private static void checkTimeout(Duration requestTimeout) {
        Preconditions.checkNotNull(requestTimeout, "requestTimeout");
        Preconditions.checkArgument(
                !requestTimeout.isZero() && !requestTimeout.isNegative(),
                "requestTimeout must be positive",
                SafeArg.of("requestTimeout", requestTimeout));
    }

    @Override
    public String toString() {
        return "ManagedClient{requestTimeout=" + requestTimeout + ", closed=" + closed.get() + '}';
    }
}
