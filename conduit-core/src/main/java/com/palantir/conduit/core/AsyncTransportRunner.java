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
import com.palantir.conduit.AsyncHttpPolicy;
import com.palantir.conduit.AsyncHttpTransport;
import com.palantir.conduit.HttpResponse;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.futures.ConduitFutures;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;

/** The terminal link of every asynchronous chain. */
final class AsyncTransportRunner extends AsyncHttpPolicy {

    private static final SafeLogger log = SafeLoggerFactory.get(AsyncTransportRunner.class);

    private final AsyncHttpTransport transport;

    AsyncTransportRunner(AsyncHttpTransport transport) {
        this.transport = Preconditions.checkNotNull(transport, "transport");
    }

    @Override
    public ListenableFuture<PipelineResponse> send(PipelineRequest request) {
        ListenableFuture<HttpResponse> response;
        try {
            response = transport.send(request.httpRequest(), TransportRunner.transportOptions(request));
        } catch (RuntimeException | Error e) {
            log.error(
                    "Asynchronous transports should never throw. This may be a bug in the transport implementation",
                    SafeArg.of("transport", transport.getClass()),
                    e);
            return Futures.immediateFailedFuture(e);
        }
        return ConduitFutures.transform(
                response, value -> PipelineResponse.of(request.httpRequest(), value, request.context()));
    }

    @Override
    public String toString() {
        return "AsyncTransportRunner{" + transport + '}';
    }
}
