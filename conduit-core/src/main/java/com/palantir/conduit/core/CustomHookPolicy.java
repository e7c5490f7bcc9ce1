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

import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import java.util.Optional;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Hands the raw request and response to caller supplied callbacks. Per-call options {@code raw_request_hook}
 * ({@code Consumer<PipelineRequest>}) and {@code raw_response_hook} ({@code Consumer<PipelineResponse>}) take
 * precedence over the callbacks this policy was created with.
 */
public final class CustomHookPolicy implements SansIoPolicy {

    static final String RAW_REQUEST_HOOK = "raw_request_hook";
    static final String RAW_RESPONSE_HOOK = "raw_response_hook";

    private static final ContextAttachmentKey<Optional<Consumer<PipelineRequest>>> REQUEST_HOOK_KEY =
            CallOptions.newKey();
    private static final ContextAttachmentKey<Optional<Consumer<PipelineResponse>>> RESPONSE_HOOK_KEY =
            CallOptions.newKey();

    @Nullable
    private final Consumer<PipelineRequest> requestHook;

    @Nullable
    private final Consumer<PipelineResponse> responseHook;

    public CustomHookPolicy() {
        this(null, null);
    }

    public CustomHookPolicy(
            @Nullable Consumer<PipelineRequest> requestHook, @Nullable Consumer<PipelineResponse> responseHook) {
        this.requestHook = requestHook;
        this.responseHook = responseHook;
    }

    @Override
    public void onRequest(PipelineRequest request) {
        Optional<Consumer<PipelineRequest>> perCall =
                CallOptions.consumeCallback(request.context(), REQUEST_HOOK_KEY, RAW_REQUEST_HOOK);
        // the response hook is consumed here too so it never reaches the transport
        CallOptions.consumeCallback(request.context(), RESPONSE_HOOK_KEY, RAW_RESPONSE_HOOK);
        Consumer<PipelineRequest> hook = perCall.orElse(requestHook);
        if (hook != null) {
            hook.accept(request);
        }
    }

    @Override
    public void onResponse(PipelineRequest request, PipelineResponse response) {
        Optional<Consumer<PipelineResponse>> perCall =
                CallOptions.consumeCallback(request.context(), RESPONSE_HOOK_KEY, RAW_RESPONSE_HOOK);
        Consumer<PipelineResponse> hook = perCall.orElse(responseHook);
        if (hook != null) {
            hook.accept(response);
        }
    }

    @Override
    public String toString() {
        return "CustomHookPolicy{requestHook=" + (requestHook != null) + ", responseHook=" + (responseHook != null)
                + '}';
    }
}
