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

import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import javax.annotation.Nullable;

/**
 * Asynchronous counterpart of {@link HttpPolicy}. Waiting (for example a backoff delay) must be expressed as a
 * future completing later, never as a blocked thread.
 *
 * <h4>Behavior</h4>
 * Implementations of {@link #send} must never throw. A failed {@link ListenableFuture} must be returned instead.
 */
public abstract class AsyncHttpPolicy {

    @Nullable
    private AsyncHttpPolicy next;

    public abstract ListenableFuture<PipelineResponse> send(PipelineRequest request);

    protected final AsyncHttpPolicy next() {
        Preconditions.checkState(
                next != null,
                "Policy is not linked into a pipeline",
                SafeArg.of("policy", getClass().getSimpleName()));
        return next;
    }

    /** Links this policy to the following one. Invoked once by the owning pipeline while it is being built. */
    public final void setNext(AsyncHttpPolicy value) {
        Preconditions.checkNotNull(value, "next");
        Preconditions.checkState(
                next == null,
                "Policy is already linked into a pipeline",
                SafeArg.of("policy", getClass().getSimpleName()));
        this.next = value;
    }
}
