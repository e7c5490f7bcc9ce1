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

import com.palantir.conduit.HttpPolicy;
import com.palantir.conduit.HttpResponse;
import com.palantir.conduit.HttpTransport;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/** The terminal link of every synchronous chain: hands the request to the transport. */
final class TransportRunner extends HttpPolicy {

    private final HttpTransport transport;

    TransportRunner(HttpTransport transport) {
        this.transport = Preconditions.checkNotNull(transport, "transport");
    }

    @Override
    public PipelineResponse send(PipelineRequest request) throws IOException {
        Map<String, Object> options = transportOptions(request);
        HttpResponse response = transport.send(request.httpRequest(), options);
        return PipelineResponse.of(request.httpRequest(), response, request.context());
    }

    /** Removes the pipeline-internal keys from the call's options and returns a read-only view for the transport. */
    static Map<String, Object> transportOptions(PipelineRequest request) {
        Map<String, Object> options = request.context().options();
        options.keySet().removeAll(PipelineOptions.PIPELINE_INTERNAL);
        return Collections.unmodifiableMap(options);
    }

    @Override
    public String toString() {
        return "TransportRunner{" + transport + '}';
    }
}
