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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.net.HttpHeaders;
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.net.URI;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Logs every request and its outcome at debug level. Header names are always logged, header values only for an
 * allow-list of headers that never carry credentials, the others are logged as {@code REDACTED}. The query string
 * is logged as an unsafe argument.
 */
public final class HttpLoggingPolicy implements SansIoPolicy {

    private static final SafeLogger log = SafeLoggerFactory.get(HttpLoggingPolicy.class);

    static final String REDACTED = "REDACTED";

    static final ImmutableSet<String> DEFAULT_ALLOWED_HEADERS = ImmutableSet.of(
            HttpHeaders.ACCEPT,
            HttpHeaders.CACHE_CONTROL,
            HttpHeaders.CONNECTION,
            HttpHeaders.CONTENT_LENGTH,
            HttpHeaders.CONTENT_TYPE,
            HttpHeaders.DATE,
            HttpHeaders.ETAG,
            HttpHeaders.EXPIRES,
            HttpHeaders.IF_MATCH,
            HttpHeaders.IF_MODIFIED_SINCE,
            HttpHeaders.IF_NONE_MATCH,
            HttpHeaders.IF_UNMODIFIED_SINCE,
            HttpHeaders.LAST_MODIFIED,
            HttpHeaders.PRAGMA,
            HttpHeaders.RETRY_AFTER,
            HttpHeaders.SERVER,
            HttpHeaders.TRANSFER_ENCODING,
            HttpHeaders.USER_AGENT,
            HttpHeaders.X_REQUEST_ID,
            "retry-after-ms",
            "x-ms-retry-after-ms");

    private static final ContextAttachmentKey<Long> START_NANOS = ContextAttachmentKey.create(Long.class);

    private final ImmutableSet<String> allowedHeaders;

    public HttpLoggingPolicy() {
        this(ImmutableSet.of());
    }

    /** Logs the values of the given headers in addition to the default allow-list. */
    public HttpLoggingPolicy(Collection<String> additionalAllowedHeaders) {
        Preconditions.checkNotNull(additionalAllowedHeaders, "additionalAllowedHeaders");
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String header : DEFAULT_ALLOWED_HEADERS) {
            builder.add(header.toLowerCase(Locale.ROOT));
        }
        for (String header : additionalAllowedHeaders) {
            builder.add(header.toLowerCase(Locale.ROOT));
        }
        this.allowedHeaders = builder.build();
    }

    @Override
    public void onRequest(PipelineRequest request) {
        if (!log.isDebugEnabled()) {
            return;
        }
        request.context().attachments().put(START_NANOS, System.nanoTime());
        URI uri = request.httpRequest().uri();
        log.debug(
                "Sending request {} {}",
                SafeArg.of("method", request.httpRequest().method()),
                UnsafeArg.of("url", withoutQuery(uri)),
                UnsafeArg.of("query", uri.getRawQuery()),
                SafeArg.of("headers", redactedHeaders(request.httpRequest().headers())));
    }

    @Override
    public void onResponse(PipelineRequest request, PipelineResponse response) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug(
                "Received response {} for {}",
                SafeArg.of("status", response.httpResponse().status()),
                SafeArg.of("method", request.httpRequest().method()),
                SafeArg.of("elapsedMillis", elapsedMillis(request)),
                SafeArg.of("headers", redactedHeaders(response.httpResponse().headers())));
    }

    @Override
    public void onException(PipelineRequest request) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug(
                "Request {} failed",
                SafeArg.of("method", request.httpRequest().method()),
                UnsafeArg.of("url", withoutQuery(request.httpRequest().uri())),
                SafeArg.of("elapsedMillis", elapsedMillis(request)));
    }

    /** Header names mapped to their values, or to {@code REDACTED} for headers outside the allow-list. */
    @VisibleForTesting
    Map<String, String> redactedHeaders(ListMultimap<String, String> headers) {
        Map<String, String> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, Collection<String>> entry : headers.asMap().entrySet()) {
            String name = entry.getKey();
            result.put(
                    name,
                    allowedHeaders.contains(name.toLowerCase(Locale.ROOT))
                            ? String.join(", ", entry.getValue())
                            : REDACTED);
        }
        return result;
    }

    private static String withoutQuery(URI uri) {
        String value = uri.toString();
        int queryStart = value.indexOf('?');
        return queryStart < 0 ? value : value.substring(0, queryStart);
    }

    @Nullable
    private static Long elapsedMillis(PipelineRequest request) {
        Long start = request.context().attachments().getOrDefault(START_NANOS, null);
        return start == null ? null : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    @Override
    public String toString() {
        return "HttpLoggingPolicy{allowedHeaders=" + allowedHeaders + '}';
    }
}
