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
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineContext;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineResponse;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/** Redirect decisions shared by the synchronous and asynchronous redirect policies. */
final class Redirects {

    private static final SafeLogger log = SafeLoggerFactory.get(Redirects.class);

    /** Per-call option, a {@link Boolean}. {@code false} disables redirect handling for the call. */
    static final String PERMIT_REDIRECTS = "permit_redirects";

    static final int DEFAULT_MAX_REDIRECTS = 30;

    private static final ContextAttachmentKey<Optional<Boolean>> PERMIT_REDIRECTS_KEY = CallOptions.newKey();

    private final int maxRedirects;

    Redirects(int maxRedirects) {
        Preconditions.checkArgument(
                maxRedirects >= 0, "maxRedirects must not be negative", SafeArg.of("maxRedirects", maxRedirects));
        this.maxRedirects = maxRedirects;
    }

    int maxRedirects() {
        return maxRedirects;
    }

    boolean permitted(PipelineContext context) {
        return CallOptions.consume(context, PERMIT_REDIRECTS_KEY, PERMIT_REDIRECTS, Boolean.class)
                .orElse(true);
    }

    /**
     * The request to send next if {@code response} is a redirect that should be followed, otherwise empty. The
     * returned request is a fresh copy, the redirected request is left untouched.
     */
    Optional<HttpRequest> follow(PipelineResponse response, URI origin, int redirectsSoFar) {
        if (!Responses.isRedirect(response.httpResponse())) {
            return Optional.empty();
        }
        if (redirectsSoFar >= maxRedirects) {
            log.info(
                    "Not following redirect, the limit was reached",
                    SafeArg.of("maxRedirects", maxRedirects),
                    SafeArg.of("status", response.httpResponse().status()));
            return Optional.empty();
        }
        HttpRequest current = response.httpRequest();
        String location = response.httpResponse().getFirstHeader(HttpHeaders.LOCATION).get();
        URI target;
        try {
            target = current.uri().resolve(location);
        } catch (IllegalArgumentException e) {
            log.info("Not following redirect with an invalid location", UnsafeArg.of("location", location), e);
            return Optional.empty();
        }
        HttpRequest next = current.copy();
        next.setUri(target);
        if (switchesToGet(response.httpResponse().status(), current.method())) {
            next.setMethod(HttpMethod.GET);
            next.setBody(null);
            next.setMultipartMixed(null);
            next.removeHeader(HttpHeaders.CONTENT_TYPE);
            next.removeHeader(HttpHeaders.CONTENT_LENGTH);
        } else if (next.body().isPresent() && !next.body().get().repeatable()) {
            log.info(
                    "Not following redirect which would resend a non-repeatable body",
                    SafeArg.of("status", response.httpResponse().status()));
            return Optional.empty();
        }
        if (!sameOrigin(origin, target)) {
            response.context().options().put(PipelineOptions.INSECURE_DOMAIN_CHANGE, true);
        }
        log.debug(
                "Following redirect",
                SafeArg.of("status", response.httpResponse().status()),
                SafeArg.of("redirects", redirectsSoFar + 1),
                UnsafeArg.of("location", target));
        return Optional.of(next);
    }

    private static boolean switchesToGet(int status, HttpMethod method) {
        if (status == 303) {
            return method != HttpMethod.HEAD;
        }
        if (status == 301 || status == 302) {
            return method != HttpMethod.GET && method != HttpMethod.HEAD;
        }
        return false;
    }

    static boolean sameOrigin(URI first, URI second) {
        return Objects.equals(lower(first.getScheme()), lower(second.getScheme()))
                && Objects.equals(lower(first.getHost()), lower(second.getHost()))
                && effectivePort(first) == effectivePort(second);
    }

    @Nullable
    private static String lower(@Nullable String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        String scheme = lower(uri.getScheme());
        if ("https".equals(scheme)) {
            return 443;
        }
        if ("http".equals(scheme)) {
            return 80;
        }
        return -1;
    }
}
