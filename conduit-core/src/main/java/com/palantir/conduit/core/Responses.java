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

import com.google.common.net.HttpHeaders;
import com.google.common.primitives.Longs;
import com.palantir.conduit.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Utility functionality for {@link HttpResponse} handling. */
final class Responses {

    private static final String RETRY_AFTER_MS = "retry-after-ms";
    private static final String X_MS_RETRY_AFTER_MS = "x-ms-retry-after-ms";

    static boolean isSuccess(HttpResponse response) {
        return response.status() / 100 == 2;
    }

    static boolean isRedirect(HttpResponse response) {
        switch (response.status()) {
            case 301:
            case 302:
            case 303:
            case 307:
            case 308:
                // a 308 without Location may be a 'Resume Incomplete' rather than a redirect
                return response.getFirstHeader(HttpHeaders.LOCATION).isPresent();
            default:
                return false;
        }
    }

    /**
     * The delay the server asked for, from {@code retry-after-ms}, {@code x-ms-retry-after-ms} or
     * {@code Retry-After} (delta seconds or an HTTP date), in that order of preference. Unparseable or negative
     * values are ignored.
     */
    static Optional<Duration> retryAfter(HttpResponse response, Instant now) {
        for (String header : new String[] {RETRY_AFTER_MS, X_MS_RETRY_AFTER_MS}) {
            Optional<Long> millis = response.getFirstHeader(header).map(String::trim).map(Longs::tryParse);
            if (millis.isPresent() && millis.get() >= 0) {
                return Optional.of(Duration.ofMillis(millis.get()));
            }
        }
        Optional<String> retryAfter = response.getFirstHeader(HttpHeaders.RETRY_AFTER).map(String::trim);
        if (retryAfter.isEmpty()) {
            return Optional.empty();
        }
        Long seconds = Longs.tryParse(retryAfter.get());
        if (seconds != null) {
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        }
        try {
            Instant date = ZonedDateTime.parse(retryAfter.get(), DateTimeFormatter.RFC_1123_DATE_TIME)
                    .toInstant();
            Duration delay = Duration.between(now, date);
            return Optional.of(delay.isNegative() ? Duration.ZERO : delay);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Responses() {}
}
