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
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningScheduledExecutorService;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.conduit.AsyncHttpPolicy;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.futures.ConduitFutures;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Asynchronous counterpart of {@link RetryPolicy}. Backoff delays are scheduled on a shared scheduler, no thread
 * is blocked while waiting.
 */
public final class AsyncRetryPolicy extends AsyncHttpPolicy {

    private static final SafeLogger log = SafeLoggerFactory.get(AsyncRetryPolicy.class);

    private final RetryStrategy strategy;
    private final ListeningScheduledExecutorService scheduler;

    public AsyncRetryPolicy() {
        this(RetryOptions.defaults());
    }

    public AsyncRetryPolicy(RetryOptions options) {
        this(
                new RetryStrategy(options, () -> ThreadLocalRandom.current().nextDouble(), Clock.systemUTC()),
                ConduitExecutors.sharedRetryScheduler.get());
    }

    @VisibleForTesting
    AsyncRetryPolicy(RetryStrategy strategy, ListeningScheduledExecutorService scheduler) {
        this.strategy = strategy;
        this.scheduler = scheduler;
    }

    @Override
    public ListenableFuture<PipelineResponse> send(PipelineRequest request) {
        if (!strategy.canRetry(request.httpRequest())) {
            return next().send(request);
        }
        return new RetryingCallback(request).execute();
    }

    @Override
    public String toString() {
        return "AsyncRetryPolicy{" + strategy + '}';
    }

    private final class RetryingCallback {
        private final PipelineRequest request;
        private int failures = 0;

        private RetryingCallback(PipelineRequest request) {
            this.request = request;
        }

        ListenableFuture<PipelineResponse> execute() {
            return wrap(sendAttempt());
        }

        private ListenableFuture<PipelineResponse> sendAttempt() {
            PipelineRequest attempt = PipelineRequest.of(request.httpRequest().copy(), request.context());
            return ConduitFutures.invokeSafely(() -> next().send(attempt));
        }

        private ListenableFuture<PipelineResponse> wrap(ListenableFuture<PipelineResponse> input) {
            // Failures are handled first so a failure coming out of a nested retry is never counted twice.
            ListenableFuture<PipelineResponse> result = input;
            result = ConduitFutures.catchingAllAsync(result, this::handleThrowable);
            result = ConduitFutures.transformAsync(result, this::handleResponse);
            return result;
        }

        private ListenableFuture<PipelineResponse> handleResponse(PipelineResponse response) {
            if (!strategy.isRetryableStatus(response.httpResponse())) {
                return Futures.immediateFuture(response);
            }
            if (!strategy.hasAttemptsLeft(++failures)) {
                log.info(
                        "Exhausted {} attempts, returning last received response with status {}",
                        SafeArg.of("attempts", failures),
                        SafeArg.of("status", response.httpResponse().status()));
                return Futures.immediateFuture(response);
            }
            Duration backoff = strategy.backoff(failures, response.httpResponse());
            logRetry(backoff, response.httpResponse().status(), null);
            response.httpResponse().close();
            return scheduleRetry(backoff);
        }

        private ListenableFuture<PipelineResponse> handleThrowable(Throwable throwable) {
            // Only retry IOExceptions. Other failures, particularly RuntimeException and Error are not
            // meant to be recovered from.
            if (!(throwable instanceof IOException) || !strategy.hasAttemptsLeft(++failures)) {
                return Futures.immediateFailedFuture(throwable);
            }
            Duration backoff = strategy.backoff(failures);
            logRetry(backoff, null, throwable);
            return scheduleRetry(backoff);
        }

        @SuppressWarnings("FutureReturnValueIgnored")
        private ListenableFuture<PipelineResponse> scheduleRetry(Duration backoff) {
            if (backoff.isZero()) {
                return wrap(sendAttempt());
            }
            SettableFuture<PipelineResponse> responseFuture = SettableFuture.create();
            // The scheduled task is never cancelled, it closes responses nobody is waiting for instead.
            scheduler.schedule(
                    () -> {
                        if (responseFuture.isDone()) {
                            return;
                        }
                        ListenableFuture<PipelineResponse> delegateResult = sendAttempt();
                        ConduitFutures.addDirectCallback(delegateResult, new FutureCallback<>() {
                            @Override
                            public void onSuccess(PipelineResponse result) {
                                if (!responseFuture.set(result)) {
                                    result.httpResponse().close();
                                }
                            }

                            @Override
                            public void onFailure(Throwable failure) {
                                if (delegateResult.isCancelled()) {
                                    responseFuture.cancel(false);
                                } else if (!responseFuture.setException(failure)) {
                                    log.info("Response future completed before the retried attempt failed", failure);
                                }
                            }
                        });
                        ConduitFutures.addDirectListener(responseFuture, () -> {
                            if (responseFuture.isCancelled()) {
                                delegateResult.cancel(false);
                            }
                        });
                    },
                    backoff.toNanos(),
                    TimeUnit.NANOSECONDS);
            return wrap(responseFuture);
        }

        private void logRetry(Duration backoff, @Nullable Integer status, @Nullable Throwable throwable) {
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
    }
}
