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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.conduit.AsyncHttpPolicy;
import com.palantir.conduit.AsyncHttpTransport;
import com.palantir.conduit.AsyncSansIoPolicy;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineContext;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.conduit.futures.ConduitFutures;
import com.palantir.logsafe.Preconditions;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Non-blocking counterpart of {@link Pipeline}. {@link #run} returns immediately and never throws; every failure,
 * including invalid arguments, is reported through the returned future.
 */
@ThreadSafe
public final class AsyncPipeline implements Closeable {

    private final AsyncHttpTransport transport;
    private final AsyncHttpPolicy head;
    private final MultipartPreparer multipart;

    private AsyncPipeline(AsyncHttpTransport transport, AsyncHttpPolicy head, MultipartPreparer multipart) {
        this.transport = transport;
        this.head = head;
        this.multipart = multipart;
    }

    public static Builder builder() {
        return new Builder();
    }

    @CanIgnoreReturnValue
    public AsyncPipeline open() {
        transport.open();
        return this;
    }

    @Override
    public void close() {
        transport.close();
    }

    public ListenableFuture<PipelineResponse> run(HttpRequest request) {
        return run(request, ImmutableMap.of());
    }

    public ListenableFuture<PipelineResponse> run(HttpRequest request, Map<String, ?> options) {
        PipelineContext context;
        ListenableFuture<?> prepared;
        try {
            Preconditions.checkNotNull(request, "request");
            context = PipelineContext.of(transport, Preconditions.checkNotNull(options, "options"));
            prepared = multipart.prepareAsync(request);
        } catch (RuntimeException e) {
            return Futures.immediateFailedFuture(e);
        }
        PipelineRequest pipelineRequest = PipelineRequest.of(request, context);
        return ConduitFutures.transformAsync(
                prepared, _ignored -> ConduitFutures.invokeSafely(() -> head.send(pipelineRequest)));
    }

    @Override
    public String toString() {
        return "AsyncPipeline{head=" + head + '}';
    }

    public static final class Builder {

        @Nullable
        private AsyncHttpTransport transport;

        private final List<AsyncHttpPolicy> policies = new ArrayList<>();
        private int multipartConcurrency = MultipartPreparer.DEFAULT_CONCURRENCY;

        private Builder() {}

        public Builder transport(AsyncHttpTransport value) {
            this.transport = Preconditions.checkNotNull(value, "transport");
            return this;
        }

        /** Appends a synchronous observing policy. Its hooks run on whichever thread completes the previous step. */
        public Builder addPolicy(SansIoPolicy value) {
            Preconditions.checkNotNull(value, "policy");
            policies.add(new AsyncSansIoPolicyRunner(new SynchronousHooks(value)));
            return this;
        }

        public Builder addPolicy(AsyncSansIoPolicy value) {
            Preconditions.checkNotNull(value, "policy");
            policies.add(new AsyncSansIoPolicyRunner(value));
            return this;
        }

        /** Appends a chaining policy. The instance is linked into the built pipeline and can't be reused. */
        public Builder addPolicy(AsyncHttpPolicy value) {
            policies.add(Preconditions.checkNotNull(value, "policy"));
            return this;
        }

        /** Upper bound on multipart parts prepared concurrently. Defaults to 4. */
        public Builder multipartConcurrency(int value) {
            this.multipartConcurrency = value;
            return this;
        }

        public AsyncPipeline build() {
            AsyncHttpTransport checkedTransport = Preconditions.checkNotNull(transport, "transport is required");
            MultipartPreparer multipart = new MultipartPreparer(multipartConcurrency);
            List<AsyncHttpPolicy> nodes = ImmutableList.<AsyncHttpPolicy>builder()
                    .addAll(policies)
                    .add(new AsyncTransportRunner(checkedTransport))
                    .build();
            for (int i = 0; i < nodes.size() - 1; i++) {
                nodes.get(i).setNext(nodes.get(i + 1));
            }
            return new AsyncPipeline(checkedTransport, nodes.get(0), multipart);
        }
    }
}
