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
import com.google.common.collect.ImmutableMap;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineContext;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.RecordingTransport;
import com.palantir.logsafe.exceptions.SafeIoException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SensitiveHeaderCleanupPolicyTest {

    @Test
    void keepsHeadersWithoutDomainChange() {
        PipelineRequest request = request(ImmutableMap.of());

        new SensitiveHeaderCleanupPolicy().onRequest(request);

        assertThat(request.httpRequest().getFirstHeader("Authorization")).contains("Bearer secret");
    }

    @Test
    void removesAuthorizationAfterDomainChange() {
        PipelineRequest request = request(ImmutableMap.of(PipelineOptions.INSECURE_DOMAIN_CHANGE, true));

        new SensitiveHeaderCleanupPolicy().onRequest(request);

        assertThat(request.httpRequest().headers().keySet()).containsExactly("x-api-key");
        assertThat(request.context().options()).containsEntry(PipelineOptions.INSECURE_DOMAIN_CHANGE, true);
    }

    @Test
    void removesAdditionalHeadersCaseInsensitively() {
        PipelineRequest request = request(ImmutableMap.of(PipelineOptions.INSECURE_DOMAIN_CHANGE, true));

        new SensitiveHeaderCleanupPolicy(ImmutableList.of("X-Api-Key")).onRequest(request);

        assertThat(request.httpRequest().headers().isEmpty()).isTrue();
    }

    @Test
    void cleanupCanBeDisabledPerCall() {
        PipelineRequest request = request(ImmutableMap.of(
                PipelineOptions.INSECURE_DOMAIN_CHANGE, true, SensitiveHeaderCleanupPolicy.DISABLE_CLEANUP, true));

        new SensitiveHeaderCleanupPolicy().onRequest(request);

        assertThat(request.httpRequest().getFirstHeader("Authorization")).contains("Bearer secret");
        assertThat(request.context().options()).doesNotContainKey(SensitiveHeaderCleanupPolicy.DISABLE_CLEANUP);
    }

    @Test
    void retriedAttemptsAfterDomainChangeStayClean() throws Exception {
        RecordingTransport transport = new RecordingTransport()
                .respond(RedirectPolicyTest.redirect(302, "https://other.example.org/target"))
                .fail(new SafeIoException("connection reset"))
                .respondWith(200);
        Pipeline pipeline = Pipeline.builder()
                .transport(transport)
                .addPolicy(new RedirectPolicy())
                .addPolicy(new RetryPolicy(
                        new RetryStrategy(RetryOptions.defaults(), () -> 1.0, Clock.systemUTC()),
                        (Duration _duration) -> {}))
                .addPolicy(new SensitiveHeaderCleanupPolicy())
                .build();

        pipeline.run(HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com/start")
                .putHeader("Authorization", "Bearer secret")
                .build());

        assertThat(transport.requests())
                .extracting(sent -> sent.getFirstHeader("Authorization").orElse("none"))
                .containsExactly("Bearer secret", "none", "none");
    }

    private static PipelineRequest request(Map<String, ?> options) {
        HttpRequest httpRequest = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com/")
                .putHeader("Authorization", "Bearer secret")
                .putHeader("x-api-key", "key")
                .build();
        return PipelineRequest.of(httpRequest, PipelineContext.detached(options));
    }
}
