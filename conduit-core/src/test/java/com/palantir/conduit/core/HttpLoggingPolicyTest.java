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

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.RecordingTransport;
import com.palantir.conduit.TestResponse;
import com.palantir.logsafe.exceptions.SafeIoException;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

class HttpLoggingPolicyTest {

    @Test
    void redactsHeadersOutsideTheAllowList() {
        HttpLoggingPolicy policy = new HttpLoggingPolicy();

        assertThat(policy.redactedHeaders(ImmutableListMultimap.of(
                        "Authorization", "Bearer secret",
                        "content-type", "application/json",
                        "x-custom", "value",
                        "Accept", "application/json",
                        "Accept", "text/plain")))
                .containsEntry("Authorization", HttpLoggingPolicy.REDACTED)
                .containsEntry("content-type", "application/json")
                .containsEntry("x-custom", HttpLoggingPolicy.REDACTED)
                .containsEntry("Accept", "application/json, text/plain");
    }

    @Test
    void additionalHeadersAreLoggedCaseInsensitively() {
        HttpLoggingPolicy policy = new HttpLoggingPolicy(ImmutableList.of("X-Custom"));

        assertThat(policy.redactedHeaders(ImmutableListMultimap.of("x-custom", "value")))
                .containsEntry("x-custom", "value");
    }

    @Test
    void logsEveryOutcomeWithoutInterfering() throws Exception {
        RecordingTransport transport =
                new RecordingTransport().respond(new TestResponse().status(404).withHeader("x-secret", "s"));
        transport.fail(new SafeIoException("connection reset"));
        Pipeline pipeline = Pipeline.builder()
                .transport(transport)
                .addPolicy(new HttpLoggingPolicy())
                .build();
        HttpRequest request = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com/items?sig=secret")
                .putHeader("Authorization", "Bearer secret")
                .build();

        assertThat(pipeline.run(request).httpResponse().status()).isEqualTo(404);
        Assertions.assertThatThrownBy(() -> pipeline.run(request)).isInstanceOf(SafeIoException.class);
        assertThat(transport.requests().get(0).getFirstHeader("Authorization")).contains("Bearer secret");
    }
}
