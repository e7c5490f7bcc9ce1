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

import com.palantir.conduit.HttpPolicy;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Follows 301, 302, 303, 307 and 308 redirects carrying a {@code Location} header. 303 responses, and 301 or 302
 * responses to anything but GET and HEAD, are followed with a bodiless GET; otherwise method and body are kept.
 * A redirect leaving the original origin sets {@link com.palantir.conduit.PipelineOptions#INSECURE_DOMAIN_CHANGE}
 * so that {@link SensitiveHeaderCleanupPolicy} drops credentials. Redirect responses which are followed are closed.
 *
 * <p>Per-call option {@code permit_redirects} ({@link Boolean}) set to {@code false} disables redirects.
 */
public final class RedirectPolicy extends HttpPolicy {

    private final Redirects redirects;

    public RedirectPolicy() {
        this(Redirects.DEFAULT_MAX_REDIRECTS);
    }

    public RedirectPolicy(int maxRedirects) {
        this.redirects = new Redirects(maxRedirects);
    }

    @Override
    public PipelineResponse send(PipelineRequest request) throws IOException {
        if (!redirects.permitted(request.context())) {
            return next().send(request);
        }
        URI origin = request.httpRequest().uri();
        PipelineResponse response = next().send(request);
        int redirectCount = 0;
        while (true) {
            Optional<HttpRequest> redirected = redirects.follow(response, origin, redirectCount);
            if (redirected.isEmpty()) {
                return response;
            }
            response.httpResponse().close();
            redirectCount++;
            response = next().send(PipelineRequest.of(redirected.get(), request.context()));
        }
    }

    @Override
    public String toString() {
        return "RedirectPolicy{maxRedirects=" + redirects.maxRedirects() + '}';
    }
}
