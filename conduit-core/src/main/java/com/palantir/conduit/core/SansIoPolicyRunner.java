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
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;

/**
 * Adapts a {@link SansIoPolicy} into a chain link. Each send invokes {@code onRequest} once, then exactly one of
 * {@code onResponse} or {@code onException}. Failures of the downstream send are rethrown unchanged.
 */
final class SansIoPolicyRunner extends HttpPolicy {

    private final SansIoPolicy policy;

    SansIoPolicyRunner(SansIoPolicy policy) {
        this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    @Override
    public PipelineResponse send(PipelineRequest request) throws IOException {
        policy.onRequest(request);
        PipelineResponse response;
        try {
            response = next().send(request);
        } catch (IOException | RuntimeException | Error e) {
            notifyException(request, e);
            throw e;
        }
        policy.onResponse(request, response);
        return response;
    }

    private void notifyException(PipelineRequest request, Throwable original) {
        try {
            policy.onException(request);
        } catch (RuntimeException | Error e) {
            original.addSuppressed(e);
        }
    }

    @Override
    public String toString() {
        return "SansIoPolicyRunner{" + policy + '}';
    }
}
