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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeNullPointerException;
import java.net.URI;
import org.junit.jupiter.api.Test;

public final class HttpRequestTest {

    @Test
    public void testRequestHeaderInsensitivity() {
        HttpRequest request = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://localhost/foo")
                .putHeader("Foo", "bar")
                .build();
        assertThat(request.headers().containsKey("foo")).isTrue();
        assertThat(request.headers().containsKey("FOO")).isTrue();
        assertThat(request.getFirstHeader("fOO")).hasValue("bar");
    }

    @Test
    public void testSetHeaderReplacesAllValues() {
        HttpRequest request = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://localhost/foo")
                .putHeader("accept", "a")
                .putHeader("Accept", "b")
                .build();
        request.setHeader("ACCEPT", "c");
        assertThat(request.headers().get("accept")).containsExactly("c");
    }

    @Test
    public void testHeadersAreRedacted() {
        String sentinel = "shouldnotbelogged";
        HttpRequest request = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://localhost/foo")
                .putHeader("authorization", "Bearer " + sentinel)
                .build();
        assertThat(request).asString().doesNotContain(sentinel).contains("authorization");
    }

    @Test
    void copy_is_independent_of_original() {
        RequestBody body = RequestBodies.ofUtf8("hello", "text/plain");
        HttpRequest original = HttpRequest.builder()
                .method(HttpMethod.PUT)
                .uri("https://localhost/a")
                .putHeader("x-original", "1")
                .body(body)
                .build();

        HttpRequest copy = original.copy();
        copy.setHeader("x-copy", "2");
        copy.setUri(URI.create("https://other/b"));
        copy.setMethod(HttpMethod.GET);

        assertThat(original.headers().containsKey("x-copy")).isFalse();
        assertThat(original.uri()).isEqualTo(URI.create("https://localhost/a"));
        assertThat(original.method()).isEqualTo(HttpMethod.PUT);
        assertThat(copy.getFirstHeader("x-original")).hasValue("1");
        assertThat(copy.body()).containsSame(body);
    }

    @Test
    void builder_requires_method_and_uri() {
        assertThatThrownBy(() -> HttpRequest.builder().uri("https://localhost").build())
                .isInstanceOf(SafeNullPointerException.class)
                .hasMessageContaining("method is required");
        assertThatThrownBy(() -> HttpRequest.builder().method(HttpMethod.GET).build())
                .isInstanceOf(SafeNullPointerException.class)
                .hasMessageContaining("uri is required");
    }

    @Test
    void builder_rejects_invalid_uri() {
        assertThatThrownBy(() -> HttpRequest.builder().uri("http://local host/ bad"))
                .isInstanceOf(SafeIllegalArgumentException.class);
    }
}
