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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.util.concurrent.AbstractFuture;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ConduitFuturesTest {

    @Test
    void testTransform_success() throws Exception {
        SettableFuture<String> original = SettableFuture.create();
        ListenableFuture<String> doubled = ConduitFutures.transform(original, value -> value + value);
        original.set("a");
        assertThat(doubled.get()).isEqualTo("aa");
    }

    @Test
    void testTransformAsync_success() throws Exception {
        SettableFuture<String> one = SettableFuture.create();
        SettableFuture<String> two = SettableFuture.create();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(one, _value -> two);
        assertThat(transformed).isNotDone();
        one.set("a");
        assertThat(transformed).isNotDone();
        two.set("b");
        assertThat(transformed).isDone();
        assertThat(transformed.get()).isEqualTo("b");
    }

    @Test
    void testTransformAsync_resultCancel_othersUnset() {
        SettableFuture<String> one = SettableFuture.create();
        SettableFuture<String> two = SettableFuture.create();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(one, _value -> two);
        assertThat(transformed.cancel(false)).isTrue();
        assertThat(one).isCancelled();
        assertThat(transformed).isCancelled();
    }

    @Test
    void testTransformAsync_resultCancel_afterFirstSet() {
        SettableFuture<String> one = SettableFuture.create();
        SettableFuture<String> two = SettableFuture.create();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(one, _value -> two);
        one.set("a");
        assertThat(transformed.cancel(false)).isTrue();
        assertThat(one).isNotCancelled();
        assertThat(two).isCancelled();
        assertThatThrownBy(transformed::get).isInstanceOf(CancellationException.class);
    }

    @Test
    void testTransformAsync_discardsValueProducedAfterCancel() {
        UncancellableFuture<String> one = new UncancellableFuture<>();
        List<String> discarded = new ArrayList<>();
        AtomicInteger applied = new AtomicInteger();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(
                one,
                value -> {
                    applied.incrementAndGet();
                    return Futures.immediateFuture(value);
                },
                discarded::add);

        assertThat(transformed.cancel(false)).isTrue();
        one.set("response");

        assertThat(transformed).isCancelled();
        assertThat(applied).hasValue(0);
        assertThat(discarded).containsExactly("response");
    }

    @Test
    void testTransformAsync_ownedValueIsNotDiscarded() throws Exception {
        SettableFuture<String> one = SettableFuture.create();
        SettableFuture<String> two = SettableFuture.create();
        List<String> discarded = new ArrayList<>();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(one, _value -> two, discarded::add);

        one.set("a");
        assertThat(transformed.cancel(true)).isTrue();

        assertThat(two).isCancelled();
        assertThat(discarded).isEmpty();
    }

    @Test
    void testTransformAsync_nullFutureFails() {
        SettableFuture<String> one = SettableFuture.create();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(one, _value -> null);
        one.set("a");
        assertThatThrownBy(transformed::get).hasCauseInstanceOf(NullPointerException.class);
    }

    @Test
    void testTransformAsync_functionThrows() {
        SettableFuture<String> one = SettableFuture.create();
        ListenableFuture<String> transformed = ConduitFutures.transformAsync(one, _value -> {
            throw new IOException("boom");
        });
        one.set("a");
        assertThatThrownBy(transformed::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void testCatchingAllAsync_recovers() throws Exception {
        SettableFuture<String> original = SettableFuture.create();
        ListenableFuture<String> recovered =
                ConduitFutures.catchingAllAsync(original, throwable -> Futures.immediateFuture(throwable.getMessage()));
        original.setException(new IOException("recovered"));
        assertThat(recovered.get()).isEqualTo("recovered");
    }

    @Test
    void testCatchingAllAsync_cancelReachesFallbackStage() {
        SettableFuture<String> original = SettableFuture.create();
        SettableFuture<String> fallback = SettableFuture.create();
        ListenableFuture<String> recovered = ConduitFutures.catchingAllAsync(original, _throwable -> fallback);
        original.setException(new IOException("first attempt"));

        assertThat(recovered.cancel(false)).isTrue();

        assertThat(fallback).isCancelled();
    }

    @Test
    void testCatchingAllAsync_successPassesThrough() throws Exception {
        ListenableFuture<String> recovered = ConduitFutures.catchingAllAsync(
                Futures.immediateFuture("value"), _throwable -> Futures.immediateFuture("fallback"));
        assertThat(recovered.get()).isEqualTo("value");
    }

    @Test
    void testCatchingAllAsync_cancelledInputSkipsFallback() {
        SettableFuture<String> original = SettableFuture.create();
        AtomicInteger fallbacks = new AtomicInteger();
        ListenableFuture<String> recovered = ConduitFutures.catchingAllAsync(original, _throwable -> {
            fallbacks.incrementAndGet();
            return Futures.immediateFuture("fallback");
        });
        original.cancel(false);
        assertThat(recovered).isCancelled();
        assertThat(fallbacks).hasValue(0);
    }

    @Test
    void testDirectCallbackRunsOnCompletingThread() {
        SettableFuture<String> future = SettableFuture.create();
        AtomicReference<Thread> callbackThread = new AtomicReference<>();
        ConduitFutures.addDirectCallback(future, new FutureCallback<String>() {
            @Override
            public void onSuccess(String _result) {
                callbackThread.set(Thread.currentThread());
            }

            @Override
            public void onFailure(Throwable _throwable) {}
        });
        future.set("done");
        assertThat(callbackThread).hasValue(Thread.currentThread());
    }

    @Test
    void testThrowingListenerDoesNotEscape() {
        SettableFuture<String> future = SettableFuture.create();
        ConduitFutures.addDirectListener(future, () -> {
            throw new IllegalStateException("listener failure");
        });
        assertThatCode(() -> future.set("done")).doesNotThrowAnyException();
        assertThat(future).isDone();
    }

    @Test
    void testInvokeSafely_convertsThrowToFailedFuture() {
        ListenableFuture<String> result = ConduitFutures.invokeSafely(() -> {
            throw new IllegalArgumentException("bad");
        });
        assertThat(result).isDone();
        assertThatThrownBy(result::get).hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInvokeSafely_rejectsNullFuture() {
        ListenableFuture<String> result = ConduitFutures.invokeSafely(() -> null);
        assertThatThrownBy(result::get).hasCauseInstanceOf(NullPointerException.class);
    }

    /** A transport future which has already committed to its response and ignores cancellation. */
    private static final class UncancellableFuture<T> extends AbstractFuture<T> {
        @Override
        public boolean set(T value) {
            return super.set(value);
        }

        @Override
        public boolean cancel(boolean _mayInterruptIfRunning) {
            return false;
        }
    }
}
