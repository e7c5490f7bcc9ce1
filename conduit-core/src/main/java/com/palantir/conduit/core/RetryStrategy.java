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

import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.HttpResponse;
import com.palantir.conduit.RequestBody;
import com.palantir.logsafe.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.DoubleSupplier;

/** Retry decisions shared by the synchronous and asynchronous retry policies. */
final class RetryStrategy {

    private final RetryOptions options;
    private final DoubleSupplier jitter;
    private final Clock clock;

    RetryStrategy(RetryOptions options, DoubleSupplier jitter, Clock clock) {
        this.options = Preconditions.checkNotNull(options, "options");
        this.jitter = Preconditions.checkNotNull(jitter, "jitter");
        this.clock = Preconditions.checkNotNull(clock, "clock");
    }

    RetryOptions options() {
        return options;
    }

    /** Requests whose body can only be written once are sent exactly once. */
    boolean canRetry(HttpRequest request) {
        Optional<RequestBody> maybeBody = request.body();
        return options.maxAttempts() > 1 && (maybeBody.isEmpty() || maybeBody.get().repeatable());
    }

    boolean hasAttemptsLeft(int failures) {
        return failures < options.maxAttempts();
    }

    boolean isRetryableStatus(HttpResponse response) {
        return options.retryableStatusCodes().contains(response.status());
    }

    /**
     * Backoff before the attempt following a retryable response. A server provided hint wins, bounded by
     * {@link RetryOptions#maxRetryAfter()}.
     */
    Duration backoff(int failures, HttpResponse response) {
        return Responses.retryAfter(response, clock.instant())
                .map(hint -> hint.compareTo(options.maxRetryAfter()) > 0 ? options.maxRetryAfter() : hint)
                .orElseGet(() -> backoff(failures));
    }

    /** Exponential backoff with full jitter, capped at {@link RetryOptions#maxBackoff()}. */
    Duration backoff(int failures) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        // bound the exponent so the multiplier can't overflow, the cap applies long before
        double upperBound = Math.pow(2, Math.min(failures - 1, 30));
        long nanos = Math.round(options.backoffSlotSize().toNanos() * jitter.getAsDouble() * upperBound);
        return Duration.ofNanos(Math.min(nanos, options.maxBackoff().toNanos()));
    }

    @Override
    public String toString() {
        return "RetryStrategy{" + options + '}';
    }
}
