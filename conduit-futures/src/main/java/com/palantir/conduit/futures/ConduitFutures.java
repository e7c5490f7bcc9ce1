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

import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Future plumbing shared by the asynchronous pipeline links. Every continuation runs on the thread completing
 * the input future, so a chain of policies adds no thread hops.
 *
 * <p>The asynchronous transformations keep cancellation pointed at whichever stage is currently running, so a
 * cancelled call never lets an in-flight response complete unobserved.
 * @see <a href="https://github.com/google/guava/issues/3975">guava#3975</a>
 */
public final class ConduitFutures {

    public static <I, O> ListenableFuture<O> transform(
            ListenableFuture<I> input, Function<? super I, ? extends O> function) {
        return Futures.transform(input, function::apply, safeDirectExecutor());
    }

    /** @see ChainedFuture */
    public static <I, O> ListenableFuture<O> transformAsync(
            ListenableFuture<I> input, AsyncFunction<? super I, ? extends O> function) {
        return ChainedFuture.onSuccess(input, function, null);
    }

    /**
     * Like {@link #transformAsync(ListenableFuture, AsyncFunction)}, releasing the input's value with
     * {@code discard} when the result was cancelled before the function could take ownership of it.
     */
    public static <I, O> ListenableFuture<O> transformAsync(
            ListenableFuture<I> input, AsyncFunction<? super I, ? extends O> function, Consumer<? super I> discard) {
        return ChainedFuture.onSuccess(input, function, Preconditions.checkNotNull(discard, "discard"));
    }

    /** Like {@link #transformAsync}, but runs on failure of the input, whatever the failure type. */
    public static <T> ListenableFuture<T> catchingAllAsync(
            ListenableFuture<T> input, AsyncFunction<Throwable, T> function) {
        return ChainedFuture.onFailure(input, function);
    }

    @CanIgnoreReturnValue
    public static <T> ListenableFuture<T> addDirectCallback(ListenableFuture<T> future, FutureCallback<T> callback) {
        Futures.addCallback(future, callback, safeDirectExecutor());
        return future;
    }

    @CanIgnoreReturnValue
    public static <T> ListenableFuture<T> addDirectListener(ListenableFuture<T> future, Runnable listener) {
        future.addListener(listener, safeDirectExecutor());
        return future;
    }

    /**
     * Runs the supplier, returning its future, or a failed future if the supplier threw. Used at the boundary to
     * user supplied asynchronous code which is required never to throw, but might.
     */
    public static <T> ListenableFuture<T> invokeSafely(AsyncSupplier<T> supplier) {
        try {
            ListenableFuture<T> result = supplier.get();
            if (result == null) {
                return Futures.immediateFailedFuture(new NullPointerException("Asynchronous supplier returned null"));
            }
            return result;
        } catch (Throwable t) {
            return Futures.immediateFailedFuture(t);
        }
    }

    public static Executor safeDirectExecutor() {
        return SafeDirectExecutor.INSTANCE;
    }

    private ConduitFutures() {}

    @FunctionalInterface
    public interface AsyncSupplier<T> {
        ListenableFuture<T> get() throws Exception;
    }
}
