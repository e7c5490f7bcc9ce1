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

import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * Outcome of sending a request to the next link: either a response or the I/O failure the downstream raised.
 * Chaining policies branch on this value instead of catching exceptions, which keeps retry and redirect control
 * flow explicit. Runtime exceptions are never captured here; they are not meant to be recovered from.
 */
public final class SendResult {

    @Nullable
    private final PipelineResponse response;

    @Nullable
    private final IOException failure;

    private SendResult(@Nullable PipelineResponse response, @Nullable IOException failure) {
        this.response = response;
        this.failure = failure;
    }

    public static SendResult success(PipelineResponse response) {
        return new SendResult(Preconditions.checkNotNull(response, "response"), null);
    }

    public static SendResult failure(IOException failure) {
        return new SendResult(null, Preconditions.checkNotNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return response != null;
    }

    public PipelineResponse response() {
        Preconditions.checkState(response != null, "Result is a failure");
        return response;
    }

    public IOException failure() {
        Preconditions.checkState(failure != null, "Result is a success");
        return failure;
    }

    /** Returns the response, or throws the captured failure unchanged. */
    public PipelineResponse getOrThrow() throws IOException {
        if (failure != null) {
            throw failure;
        }
        return response();
    }

    @Override
    public String toString() {
        return isSuccess() ? "SendResult{response=" + response + '}' : "SendResult{failure=" + failure + '}';
    }
}
