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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineContext;
import com.palantir.conduit.PipelineRequest;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HeadersPolicyTest {

    private final HeadersPolicy policy = new HeadersPolicy(ImmutableMap.of("x-client", "conduit", "Accept", "*/*"));

    @Test
    void setsFixedHeadersReplacingExistingValues() {
        PipelineRequest request = request(ImmutableMap.of());

        policy.onRequest(request);

        assertThat(request.httpRequest().headers().get("accept")).containsExactly("*/*");
        assertThat(request.httpRequest().getFirstHeader("X-Client")).contains("conduit");
    }

    @Test
    void perCallHeadersWin() {
        PipelineRequest request =
                request(ImmutableMap.of(HeadersPolicy.HEADERS, ImmutableMap.of("x-client", "override", "x-id", "7")));

        policy.onRequest(request);

        assertThat(request.httpRequest().getFirstHeader("x-client")).contains("override");
        assertThat(request.httpRequest().getFirstHeader("x-id")).contains("7");
        assertThat(request.context().options()).isEmpty();
    }

    @Test
    void perCallHeadersMustBeAMap() {
        assertThatThrownBy(() -> policy.onRequest(request(ImmutableMap.of(HeadersPolicy.HEADERS, "x-id: 7"))))
                .isInstanceOf(SafeIllegalArgumentException.class);
    }

    @Test
    void perCallHeaderValuesMustBeStrings() {
        PipelineRequest request = request(ImmutableMap.of(HeadersPolicy.HEADERS, ImmutableMap.of("x-id", 7)));
        assertThatThrownBy(() -> policy.onRequest(request))
                .isInstanceOf(SafeIllegalArgumentException.class)
                .hasMessageContaining("Option must map strings to strings");
        assertThat(request.httpRequest().getFirstHeader("x-id")).isEmpty();
    }

    private static PipelineRequest request(Map<String, ?> options) {
        HttpRequest httpRequest = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com/")
                .putHeader("Accept", "application/json")
                .build();
        return PipelineRequest.of(httpRequest, PipelineContext.detached(options));
    }
}
