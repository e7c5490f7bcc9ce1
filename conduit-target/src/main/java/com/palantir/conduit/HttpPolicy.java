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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * A chain link with full control over calling onward: it may call {@link #next()} zero, one or many times. This is
 * the basis for retry, redirect and short-circuiting behavior.
 *
 * <p>A policy is linked into exactly one chain, when the pipeline owning it is built. The link never changes
 * afterwards, so a policy must not be shared between pipelines.
 */
public abstract class HttpPolicy {

    @Nullable
    private HttpPolicy next;

    /**
     * Sends the request through the rest of the chain.
     *
     * @throws IOException if the transport failed and this policy chose not to recover
     */
    public abstract PipelineResponse send(PipelineRequest request) throws IOException;

    /** The following link. */
    protected final HttpPolicy next() {
        Preconditions.checkState(
                next != null,
                "Policy is not linked into a pipeline",
                SafeArg.of("policy", getClass().getSimpleName()));
        return next;
    }

    /** Sends to the following link, capturing an {@link IOException} as a value. */
    protected final SendResult trySendNext(PipelineRequest request) {
        try {
            return SendResult.success(next().send(request));
        } catch (IOException e) {
            return SendResult.failure(e);
        }
    }

    /** Links this policy to the following one. Invoked once by the owning pipeline while it is being built. */
    public final void setNext(HttpPolicy value) {
        Preconditions.checkNotNull(value, "next");
        Preconditions.checkState(
                next == null,
                "Policy is already linked into a pipeline",
                SafeArg.of("policy", getClass().getSimpleName()));
        this.next = value;
    }
}
