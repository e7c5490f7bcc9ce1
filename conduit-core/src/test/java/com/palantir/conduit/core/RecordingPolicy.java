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

import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import java.util.List;

/** Appends {@code <name>.<hook>} to a shared event log for every hook invocation. */
final class RecordingPolicy implements SansIoPolicy {

    private final String name;
    private final List<String> events;

    RecordingPolicy(String name, List<String> events) {
        this.name = name;
        this.events = events;
    }

    @Override
    public void onRequest(PipelineRequest _request) {
        events.add(name + ".onRequest");
    }

    @Override
    public void onResponse(PipelineRequest _request, PipelineResponse _response) {
        events.add(name + ".onResponse");
    }

    @Override
    public void onException(PipelineRequest _request) {
        events.add(name + ".onException");
    }
}
