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

import com.google.common.annotations.VisibleForTesting;
import com.palantir.conduit.HttpPolicy;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SendResult;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Resends requests which failed with an {@link IOException} or a retryable status, sleeping with exponential
 * backoff between attempts. Every attempt sends a fresh copy of the call's request. Once attempts are exhausted
 * the last failure is thrown, or the last response returned.
 */
public final class RetryPolicy extends HttpPolicy {

    private static final SafeLogger log = SafeLoggerFactory.get(RetryPolicy.class);

    private final RetryStrategy strategy;
    private final Sleeper sleeper;

    public RetryPolicy() {
        this(RetryOptions.defaults());
    }

    public RetryPolicy(RetryOptions options) {
        this(
                new RetryStrategy(options, () -> ThreadLocalRandom.current().nextDouble(), Clock.systemUTC()),
                duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos()));
    }

    @VisibleForTesting
    RetryPolicy(RetryStrategy strategy, Sleeper sleeper) {
        this.strategy = strategy;
        this.sleeper = sleeper;
    }

    @Override
    public PipelineResponse send(PipelineRequest request) throws IOException {
        if (!strategy.canRetry(request.httpRequest())) {
            return next().send(request);
        }
        int failures = 0;
        while (true) {
            PipelineRequest attempt = PipelineRequest.of(request.httpRequest().copy(), request.context());
            SendResult result = trySendNext(attempt);
            if (result.isSuccess()) {
                PipelineResponse response = result.response();
                if (!strategy.isRetryableStatus(response.httpResponse())) {
                    return response;
                }
                failures++;
                if (!strategy.hasAttemptsLeft(failures)) {
                    logRetriesExhausted(failures, response.httpResponse().status());
                    return response;
                }
                Duration backoff = strategy.backoff(failures, response.httpResponse());
                logRetry(failures, backoff, response.httpResponse().status(), null);
                response.httpResponse().close();
                sleep(backoff);
            } else {
                IOException failure = result.failure();
                failures++;
                if (!strategy.hasAttemptsLeft(failures)) {
                    throw failure;
                }
                Duration backoff = strategy.backoff(failures);
                logRetry(failures, backoff, null, failure);
                sleep(backoff);
            }
        }
    }

    private void sleep(Duration backoff) throws InterruptedIOException {
        if (backoff.isZero()) {
            return;
        }
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted during retry backoff");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private void logRetry(int failures, Duration backoff, @Nullable Integer status, @Nullable Throwable throwable) {
        if (log.isInfoEnabled()) {
            log.info(
                    "Retrying call after failure {}/{} backoff: {}, status: {}",
                    SafeArg.of("failures", failures),
                    SafeArg.of("maxAttempts", strategy.options().maxAttempts()),
                    SafeArg.of("backoffMillis", backoff.toMillis()),
                    SafeArg.of("status", status),
                    throwable);
        }
    }

    private void logRetriesExhausted(int failures, int status) {
        log.info(
                "Exhausted {} attempts, returning last received response with status {}",
                SafeArg.of("attempts", failures),
                SafeArg.of("status", status));
    }

    @Override
    public String toString() {
        return "RetryPolicy{" + strategy + '}';
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
