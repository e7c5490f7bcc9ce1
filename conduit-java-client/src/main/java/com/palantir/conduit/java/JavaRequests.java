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

import com.google.common.collect.ImmutableSet;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.RequestBody;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Converts pipeline requests into {@link java.net.http.HttpRequest requests} of the JDK client. */
final class JavaRequests {

    private static final SafeLogger log = SafeLoggerFactory.get(JavaRequests.class);

    private static final String CONTENT_TYPE = "content-type";

    // Managed by the JDK client, setting them fails the request.
    private static final ImmutableSet<String> RESTRICTED_HEADERS =
            ImmutableSet.of("connection", "content-length", "expect", "host", "upgrade");

    private static final ImmutableSet<HttpMethod> BODILESS_METHODS =
            ImmutableSet.of(HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS);

    static java.net.http.HttpRequest toJavaRequest(
            HttpRequest request, Map<String, Object> options, Duration defaultTimeout) throws IOException {
        Duration timeout = timeout(options, defaultTimeout);
        Optional<RequestBody> body = request.body();
        if (body.isPresent() && BODILESS_METHODS.contains(request.method())) {
            throw new SafeIllegalArgumentException(
                    request.method() + " requests must not have a request body",
                    SafeArg.of("method", request.method()));
        }
        java.net.http.HttpRequest.Builder builder =
                java.net.http.HttpRequest.newBuilder().uri(request.uri()).timeout(timeout);
        request.headers().forEach((name, value) -> {
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                log.debug("Dropping header managed by the HTTP client", SafeArg.of("header", name));
            } else {
                builder.header(name, value);
            }
        });
        if (body.isPresent() && !request.headers().containsKey(CONTENT_TYPE)) {
            builder.header(CONTENT_TYPE, body.get().contentType());
        }
        builder.method(request.method().name(), toBodyPublisher(body));
        return builder.build();
    }

    /** Reads the {@code timeout} option. Any other option is a caller error. */
    static Duration timeout(Map<String, Object> options, Duration defaultTimeout) {
        Duration timeout = defaultTimeout;
        for (Map.Entry<String, Object> option : options.entrySet()) {
            if (!PipelineOptions.TIMEOUT.equals(option.getKey())) {
                throw new SafeIllegalArgumentException(
                        "Unsupported transport option", SafeArg.of("option", option.getKey()));
            }
            if (!(option.getValue() instanceof Duration)) {
                throw new SafeIllegalArgumentException(
                        "The timeout option must be a java.time.Duration",
                        SafeArg.of("actualType", option.getValue().getClass()));
            }
            timeout = (Duration) option.getValue();
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new SafeIllegalArgumentException("timeout must be positive", SafeArg.of("timeout", timeout));
        }
        return timeout;
    }

    private static java.net.http.HttpRequest.BodyPublisher toBodyPublisher(Optional<RequestBody> body)
            throws IOException {
        if (body.isEmpty()) {
            return java.net.http.HttpRequest.BodyPublishers.noBody();
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        body.get().writeTo(bytes);
        return java.net.http.HttpRequest.BodyPublishers.ofByteArray(bytes.toByteArray());
    }

    private JavaRequests() {}
}
