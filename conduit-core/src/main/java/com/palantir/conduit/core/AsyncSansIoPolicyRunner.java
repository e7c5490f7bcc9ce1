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
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.conduit.AsyncHttpPolicy;
import com.palantir.conduit.AsyncSansIoPolicy;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.futures.ConduitFutures;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.exceptions.SafeNullPointerException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Asynchronous counterpart of {@link SansIoPolicyRunner}. Each hook's future completes before the chain moves on,
 * so hook ordering matches the synchronous pipeline.
 */
final class AsyncSansIoPolicyRunner extends AsyncHttpPolicy {

    private final AsyncSansIoPolicy policy;

    AsyncSansIoPolicyRunner(AsyncSansIoPolicy policy) {
        this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    @Override
    public ListenableFuture<PipelineResponse> send(PipelineRequest request) {
        ListenableFuture<?> beforeSend = invokeHook(() -> policy.onRequest(request));
        return ConduitFutures.transformAsync(beforeSend, _ignored -> sendAndObserve(request));
    }

    private ListenableFuture<PipelineResponse> sendAndObserve(PipelineRequest request) {
        ListenableFuture<PipelineResponse> sent = ConduitFutures.invokeSafely(() -> next().send(request));
        // onResponse failures happen after this stage, so they never reach onException
        ListenableFuture<PipelineResponse> observedFailure =
                ConduitFutures.catchingAllAsync(sent, throwable -> notifyException(request, throwable));
        return ConduitFutures.transformAsync(
                observedFailure,
                response -> ConduitFutures.transform(
                        invokeHook(() -> policy.onResponse(request, response)), _ignored -> response),
                response -> response.httpResponse().close());
    }

    private ListenableFuture<PipelineResponse> notifyException(PipelineRequest request, Throwable original) {
        ListenableFuture<?> hook = invokeHook(() -> policy.onException(request));
        SettableFuture<PipelineResponse> result = SettableFuture.create();
        ConduitFutures.addDirectListener(hook, () -> {
            try {
                Futures.getDone(hook);
            } catch (ExecutionException e) {
                original.addSuppressed(e.getCause());
            } catch (CancellationException e) {
                original.addSuppressed(e);
            }
            result.setException(original);
        });
        return result;
    }

    private static ListenableFuture<?> invokeHook(Supplier<ListenableFuture<?>> hook) {
        try {
            ListenableFuture<?> result = hook.get();
            return result == null
                    ? Futures.immediateFailedFuture(new SafeNullPointerException("Policy hook returned null"))
                    : result;
        } catch (RuntimeException | Error e) {
            return Futures.immediateFailedFuture(e);
        }
    }

    @Override
    public String toString() {
        return "AsyncSansIoPolicyRunner{" + policy + '}';
    }
}
