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

/**
 * A policy which observes and mutates requests and responses without controlling how the chain progresses. The
 * pipeline adapts it into a chain link which, for every send, calls {@link #onRequest} exactly once and then exactly
 * one of {@link #onResponse} or {@link #onException}.
 *
 * <p>Hooks must not perform network I/O themselves. Per-call state belongs in
 * {@link PipelineContext#attachments()}; any state kept on the policy instance is shared by concurrent calls and
 * must be synchronized by the policy.
 */
public interface SansIoPolicy {

    /** Inspects or mutates the request before it is sent. Throwing aborts the call before any network I/O. */
    default void onRequest(PipelineRequest _request) {}

    /** Inspects or mutates the response after a successful send. */
    default void onResponse(PipelineRequest _request, PipelineResponse _response) {}

    /**
     * Invoked when the downstream send failed. The failure keeps propagating once this hook returns; there is no
     * way to suppress it from here.
     */
    default void onException(PipelineRequest _request) {}
}
