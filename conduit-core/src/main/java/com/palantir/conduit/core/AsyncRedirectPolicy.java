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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.conduit.AsyncHttpPolicy;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.futures.ConduitFutures;
import java.net.URI;
import java.util.Optional;

/** Asynchronous counterpart of {@link RedirectPolicy}. */
public final class AsyncRedirectPolicy extends AsyncHttpPolicy {

    private final Redirects redirects;

    public AsyncRedirectPolicy() {
        this(Redirects.DEFAULT_MAX_REDIRECTS);
    }

    public AsyncRedirectPolicy(int maxRedirects) {
        this.redirects = new Redirects(maxRedirects);
    }

    @Override
    public ListenableFuture<PipelineResponse> send(PipelineRequest request) {
        boolean permitted;
        try {
            permitted = redirects.permitted(request.context());
        } catch (RuntimeException e) {
            return Futures.immediateFailedFuture(e);
        }
        if (!permitted) {
            return next().send(request);
        }
        return sendFollowing(request, request.httpRequest().uri(), 0);
    }

    private ListenableFuture<PipelineResponse> sendFollowing(PipelineRequest request, URI origin, int redirectCount) {
        ListenableFuture<PipelineResponse> sent = ConduitFutures.invokeSafely(() -> next().send(request));
        return ConduitFutures.transformAsync(
                sent,
                response -> {
                    Optional<HttpRequest> redirected = redirects.follow(response, origin, redirectCount);
                    if (redirected.isEmpty()) {
                        return Futures.immediateFuture(response);
                    }
                    response.httpResponse().close();
                    return sendFollowing(
                            PipelineRequest.of(redirected.get(), request.context()), origin, redirectCount + 1);
                },
                AsyncRedirectPolicy::closeResponse);
    }

    private static void closeResponse(PipelineResponse response) {
        response.httpResponse().close();
    }

    @Override
    public String toString() {
        return "AsyncRedirectPolicy{maxRedirects=" + redirects.maxRedirects() + '}';
    }
}
