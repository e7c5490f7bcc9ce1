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

package com.palantir.conduit;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

/**
 * Asynchronous variant of {@link SansIoPolicy} whose hooks may wait on non-blocking work, for example a credential
 * refresh. The pipeline waits for each returned future before moving on, so ordering guarantees are those of the
 * synchronous variant. A failed future behaves like a throwing synchronous hook.
 */
public interface AsyncSansIoPolicy {

    default ListenableFuture<?> onRequest(PipelineRequest _request) {
        return Futures.immediateVoidFuture();
    }

    default ListenableFuture<?> onResponse(PipelineRequest _request, PipelineResponse _response) {
        return Futures.immediateVoidFuture();
    }

    default ListenableFuture<?> onException(PipelineRequest _request) {
        return Futures.immediateVoidFuture();
    }
}
