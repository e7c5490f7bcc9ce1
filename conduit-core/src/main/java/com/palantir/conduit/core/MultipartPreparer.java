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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.MultipartMixed;
import com.palantir.conduit.PipelineContext;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.conduit.futures.ConduitFutures;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Prepares the parts of a multipart request before the composite request enters the policy chain. Every part gets
 * a fresh detached context built from the bundle's options and has the bundle's request hooks applied to it, with
 * up to {@code concurrency} parts in flight. Nested bundles are prepared before the part that carries them.
 */
final class MultipartPreparer {

    private static final SafeLogger log = SafeLoggerFactory.get(MultipartPreparer.class);

    static final int DEFAULT_CONCURRENCY = 4;

    private final int concurrency;

    MultipartPreparer(int concurrency) {
        Preconditions.checkArgument(
                concurrency >= 1, "multipartConcurrency must be positive", SafeArg.of("concurrency", concurrency));
        this.concurrency = concurrency;
    }

    int concurrency() {
        return concurrency;
    }

    /** Prepares the bundle and serializes it into the request body. Requests without a bundle are left untouched. */
    void prepare(HttpRequest request) throws IOException {
        Optional<MultipartMixed> bundle = request.multipartMixed();
        if (bundle.isEmpty()) {
            return;
        }
        prepareParts(bundle.get());
        request.prepareMultipartBody();
    }

    /** Asynchronous variant of {@link #prepare}: the returned future completes once the body has been set. */
    ListenableFuture<?> prepareAsync(HttpRequest request) {
        Optional<MultipartMixed> maybeBundle = request.multipartMixed();
        if (maybeBundle.isEmpty()) {
            return Futures.immediateVoidFuture();
        }
        MultipartMixed bundle = maybeBundle.get();
        ListeningExecutorService executor = ConduitExecutors.newMultipartExecutor(threads(bundle));
        ListenableFuture<?> result;
        try {
            ImmutableList.Builder<ListenableFuture<Object>> parts = ImmutableList.builder();
            for (HttpRequest part : bundle.parts()) {
                parts.add(executor.submit(() -> {
                    preparePart(part, bundle);
                    return part;
                }));
            }
            result = ConduitFutures.transformAsync(Futures.allAsList(parts.build()), _parts -> {
                request.prepareMultipartBody();
                return Futures.immediateVoidFuture();
            });
        } catch (RuntimeException e) {
            executor.shutdownNow();
            return Futures.immediateFailedFuture(e);
        }
        ConduitFutures.addDirectListener(result, executor::shutdown);
        return result;
    }

    private void prepareParts(MultipartMixed bundle) throws IOException {
        ListeningExecutorService executor = ConduitExecutors.newMultipartExecutor(threads(bundle));
        try {
            ImmutableList.Builder<ListenableFuture<Object>> parts = ImmutableList.builder();
            for (HttpRequest part : bundle.parts()) {
                parts.add(executor.submit(() -> {
                    preparePart(part, bundle);
                    return part;
                }));
            }
            awaitAll(parts.build());
        } finally {
            executor.shutdownNow();
        }
    }

    private void preparePart(HttpRequest part, MultipartMixed bundle) throws IOException {
        Optional<MultipartMixed> changeSet = part.multipartMixed();
        if (changeSet.isPresent()) {
            prepareParts(changeSet.get());
        }
        PipelineRequest request = PipelineRequest.of(part, PipelineContext.detached(bundle.options()));
        for (SansIoPolicy policy : bundle.policies()) {
            policy.onRequest(request);
        }
    }

    private int threads(MultipartMixed bundle) {
        return Math.min(concurrency, bundle.parts().size());
    }

    /** Waits for every part in order, rethrowing the first failure as its original type. */
    private static void awaitAll(List<ListenableFuture<Object>> parts) throws IOException {
        for (ListenableFuture<Object> part : parts) {
            try {
                part.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                InterruptedIOException interrupted =
                        new InterruptedIOException("Interrupted preparing multipart parts");
                interrupted.initCause(e);
                throw interrupted;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.debug("Failed to prepare a multipart part", cause);
                Throwables.throwIfInstanceOf(cause, IOException.class);
                Throwables.throwIfUnchecked(cause);
                throw new SafeRuntimeException("Failed to prepare multipart part", cause);
            }
        }
    }
}
