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

package com.palantir.conduit.futures;

import com.google.common.util.concurrent.AbstractFuture;
import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * One stage of an asynchronous policy chain: once the input completes, continues with the success or the failure
 * continuation on the completing thread, and completes with the future that continuation returns.
 *
 * <p>Cancelling this future cancels whichever stage is running, the input before it completes and the continuation
 * after. A value the input produced while this future was being cancelled is handed to the {@code discard}
 * callback, so resources such as response bodies are released rather than dropped.
 */
final class ChainedFuture<I, O> extends AbstractFuture<O> implements Runnable {

    private static final SafeLogger log = SafeLoggerFactory.get(ChainedFuture.class);

    private final ListenableFuture<? extends I> input;

    @Nullable
    private volatile AsyncFunction<? super I, ? extends O> onSuccess;

    @Nullable
    private volatile AsyncFunction<? super Throwable, ? extends O> onFailure;

    @Nullable
    private volatile Consumer<? super I> discard;

    private ChainedFuture(
            ListenableFuture<? extends I> input,
            @Nullable AsyncFunction<? super I, ? extends O> onSuccess,
            @Nullable AsyncFunction<? super Throwable, ? extends O> onFailure,
            @Nullable Consumer<? super I> discard) {
        this.input = input;
        this.onSuccess = onSuccess;
        this.onFailure = onFailure;
        this.discard = discard;
    }

    /** Continues with {@code onSuccess}; failures of the input propagate unchanged. */
    static <I, O> ListenableFuture<O> onSuccess(
            ListenableFuture<? extends I> input,
            AsyncFunction<? super I, ? extends O> function,
            @Nullable Consumer<? super I> discard) {
        return start(new ChainedFuture<I, O>(input, function, null, discard));
    }

    /** Continues with {@code onFailure} whatever the failure type; values and cancellation pass through. */
    static <T> ListenableFuture<T> onFailure(
            ListenableFuture<? extends T> input, AsyncFunction<? super Throwable, ? extends T> function) {
        return start(new ChainedFuture<T, T>(input, null, function, null));
    }

    private static <I, O> ChainedFuture<I, O> start(ChainedFuture<I, O> future) {
        future.input.addListener(future, ConduitFutures.safeDirectExecutor());
        return future;
    }

    @Override
    public void run() {
        if (input.isCancelled()) {
            cancel(false);
            return;
        }
        I value = null;
        Throwable failure = null;
        try {
            value = Futures.getDone(input);
        } catch (ExecutionException e) {
            failure = e.getCause();
        } catch (RuntimeException | Error e) {
            failure = e;
        }
        if (isDone()) {
            // cancelled while the input was completing
            if (failure == null) {
                discard(value);
            }
            return;
        }
        try {
            ListenableFuture<? extends O> next = failure == null ? continueWith(value) : recoverFrom(failure);
            if (next == null) {
                setException(new NullPointerException("Continuation returned a null future"));
            } else {
                setFuture(next);
            }
        } catch (Throwable t) {
            setException(t);
        }
    }

    @SuppressWarnings("unchecked")
    private ListenableFuture<? extends O> continueWith(I value) throws Exception {
        AsyncFunction<? super I, ? extends O> function = onSuccess;
        // a failure-only stage has I == O
        return function == null ? (ListenableFuture<? extends O>) input : function.apply(value);
    }

    private ListenableFuture<? extends O> recoverFrom(Throwable failure) throws Exception {
        AsyncFunction<? super Throwable, ? extends O> function = onFailure;
        return function == null ? Futures.immediateFailedFuture(failure) : function.apply(failure);
    }

    private void discard(I value) {
        Consumer<? super I> callback = discard;
        if (callback == null || value == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            log.warn("Failed to discard the result of a cancelled stage", SafeArg.of("stage", toString()), e);
        }
    }

    @Override
    protected void afterDone() {
        if (isCancelled()) {
            input.cancel(wasInterrupted());
        }
        // continuations may hold on to a whole call, release them once this stage is settled
        onSuccess = null;
        onFailure = null;
        if (!isCancelled()) {
            discard = null;
        }
    }

    @Override
    protected String pendingToString() {
        return "input=[" + input + "]";
    }
}
