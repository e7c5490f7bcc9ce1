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

import com.google.common.collect.ImmutableSet;
import com.palantir.conduit.ConduitImmutablesStyle;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.time.Duration;
import java.util.Set;
import org.immutables.value.Value;

/** Configuration shared by {@link RetryPolicy} and {@link AsyncRetryPolicy}. */
@ConduitImmutablesStyle
@Value.Immutable
public interface RetryOptions {

    /** Total number of sends per call, the first one included. */
    @Value.Default
    default int maxAttempts() {
        return 4;
    }

    /** Base of the exponential backoff between attempts. */
    @Value.Default
    default Duration backoffSlotSize() {
        return Duration.ofMillis(250);
    }

    /** Upper bound of a computed backoff. Server provided retry hints are bounded by {@link #maxRetryAfter()}. */
    @Value.Default
    default Duration maxBackoff() {
        return Duration.ofSeconds(30);
    }

    /** Upper bound of a delay requested by the server through a retry-after header. */
    @Value.Default
    default Duration maxRetryAfter() {
        return Duration.ofMinutes(5);
    }

    @Value.Default
    default Set<Integer> retryableStatusCodes() {
        return ImmutableSet.of(408, 429, 500, 502, 503, 504);
    }

    @Value.Check
    default void check() {
        Preconditions.checkArgument(
                maxAttempts() >= 1, "maxAttempts must be at least 1", SafeArg.of("maxAttempts", maxAttempts()));
        Preconditions.checkArgument(
                !backoffSlotSize().isNegative(),
                "backoffSlotSize must not be negative",
                SafeArg.of("backoffSlotSize", backoffSlotSize()));
        Preconditions.checkArgument(
                !maxBackoff().isNegative(), "maxBackoff must not be negative", SafeArg.of("maxBackoff", maxBackoff()));
        Preconditions.checkArgument(
                !maxRetryAfter().isNegative(),
                "maxRetryAfter must not be negative",
                SafeArg.of("maxRetryAfter", maxRetryAfter()));
    }

    static RetryOptions defaults() {
        return builder().build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableRetryOptions.Builder {}
}
