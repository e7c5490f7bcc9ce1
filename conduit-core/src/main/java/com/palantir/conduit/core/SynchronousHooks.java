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
import com.palantir.conduit.AsyncSansIoPolicy;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;

/** Exposes a synchronous {@link SansIoPolicy} to the asynchronous pipeline. Hooks run on the completing thread. */
final class SynchronousHooks implements AsyncSansIoPolicy {

    private final SansIoPolicy delegate;

    SynchronousHooks(SansIoPolicy delegate) {
        this.delegate = delegate;
    }

    @Override
    public ListenableFuture<?> onRequest(PipelineRequest request) {
        delegate.onRequest(request);
        return Futures.immediateVoidFuture();
    }

    @Override
    public ListenableFuture<?> onResponse(PipelineRequest request, PipelineResponse response) {
        delegate.onResponse(request, response);
        return Futures.immediateVoidFuture();
    }

    @Override
    public ListenableFuture<?> onException(PipelineRequest request) {
        delegate.onException(request);
        return Futures.immediateVoidFuture();
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
