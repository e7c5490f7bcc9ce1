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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.conduit.HttpPolicy;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.HttpTransport;
import com.palantir.conduit.PipelineContext;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.logsafe.Preconditions;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * An ordered chain of policies in front of one {@link HttpTransport}. Request hooks run in policy order, response
 * hooks in reverse order. The chain is fixed when the pipeline is built and a pipeline may serve concurrent calls;
 * all per-call state lives in the {@link PipelineContext} created by {@link #run}.
 *
 * <pre>{@code
 * try (Pipeline pipeline = Pipeline.builder()
 *         .transport(transport)
 *         .addPolicy(new RetryPolicy())
 *         .addPolicy(new HttpLoggingPolicy())
 *         .build()
 *         .open()) {
 *     PipelineResponse response = pipeline.run(request);
 * }
 * }</pre>
 */
@ThreadSafe
public final class Pipeline implements Closeable {

    private final HttpTransport transport;
    private final HttpPolicy head;
    private final MultipartPreparer multipart;

    private Pipeline(HttpTransport transport, HttpPolicy head, MultipartPreparer multipart) {
        this.transport = transport;
        this.head = head;
        this.multipart = multipart;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Opens the transport. Returns this pipeline for use in a try-with-resources statement. */
    @CanIgnoreReturnValue
    public Pipeline open() {
        transport.open();
        return this;
    }

    /** Closes the transport. */
    @Override
    public void close() {
        transport.close();
    }

    public PipelineResponse run(HttpRequest request) throws IOException {
        return run(request, ImmutableMap.of());
    }

    /**
     * Sends the request through the chain with the given per-call options. A multipart bundle carried by the
     * request is prepared and serialized first. HTTP error statuses are returned as responses.
     *
     * @throws IOException if the transport failed and no policy recovered
     */
    public PipelineResponse run(HttpRequest request, Map<String, ?> options) throws IOException {
        Preconditions.checkNotNull(request, "request");
        Preconditions.checkNotNull(options, "options");
        multipart.prepare(request);
        PipelineContext context = PipelineContext.of(transport, options);
        return head.send(PipelineRequest.of(request, context));
    }

    @Override
    public String toString() {
        return "Pipeline{head=" + head + '}';
    }

    public static final class Builder {

        @Nullable
        private HttpTransport transport;

        private final List<HttpPolicy> policies = new ArrayList<>();
        private int multipartConcurrency = MultipartPreparer.DEFAULT_CONCURRENCY;

        private Builder() {}

        public Builder transport(HttpTransport value) {
            this.transport = Preconditions.checkNotNull(value, "transport");
            return this;
        }

        /** Appends a policy which only observes requests and responses. */
        public Builder addPolicy(SansIoPolicy value) {
            Preconditions.checkNotNull(value, "policy");
            policies.add(new SansIoPolicyRunner(value));
            return this;
        }

        /** Appends a chaining policy. The instance is linked into the built pipeline and can't be reused. */
        public Builder addPolicy(HttpPolicy value) {
            policies.add(Preconditions.checkNotNull(value, "policy"));
            return this;
        }

        /** Upper bound on multipart parts prepared concurrently. Defaults to 4. */
        public Builder multipartConcurrency(int value) {
            this.multipartConcurrency = value;
            return this;
        }

        public Pipeline build() {
            HttpTransport checkedTransport = Preconditions.checkNotNull(transport, "transport is required");
            MultipartPreparer multipart = new MultipartPreparer(multipartConcurrency);
            List<HttpPolicy> nodes = ImmutableList.<HttpPolicy>builder()
                    .addAll(policies)
                    .add(new TransportRunner(checkedTransport))
                    .build();
            for (int i = 0; i < nodes.size() - 1; i++) {
                nodes.get(i).setNext(nodes.get(i + 1));
            }
            return new Pipeline(checkedTransport, nodes.get(0), multipart);
        }
    }
}
