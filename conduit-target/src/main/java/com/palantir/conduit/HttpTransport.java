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

package com.palantir.conduit;

import java.io.IOException;
import java.util.Map;

/** Performs the network I/O for one request, blocking the calling thread until a response is available. */
public interface HttpTransport extends Transport {

    /**
     * Sends the request. The {@code options} are the per-call options left after the pipeline removed its
     * internal keys (see {@link PipelineOptions#PIPELINE_INTERNAL}); implementations reject keys they do not
     * understand.
     *
     * @throws IOException on connection, TLS or timeout failures. HTTP error statuses are returned, not thrown.
     */
    HttpResponse send(HttpRequest request, Map<String, Object> options) throws IOException;
}
