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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public final class MultipartMixedTest {

    @Test
    void serializes_parts_as_application_http() throws IOException {
        HttpRequest first = HttpRequest.builder()
                .method(HttpMethod.DELETE)
                .uri("https://account.table.core/Table(1)")
                .putHeader("If-Match", "*")
                .build();
        HttpRequest second = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://account.table.core/Table")
                .body(RequestBodies.ofUtf8("{\"a\":1}", "application/json"))
                .build();
        HttpRequest batch = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://account.table.core/$batch")
                .multipartMixed(MultipartMixed.builder()
                        .addParts(first, second)
                        .boundary("batch_abc")
                        .build())
                .build();

        batch.prepareMultipartBody();

        assertThat(batch.getFirstHeader("content-type")).hasValue("multipart/mixed; boundary=batch_abc");
        assertThat(bodyOf(batch))
                .isEqualTo("--batch_abc\r\n"
                        + "Content-Type: application/http\r\n"
                        + "Content-Transfer-Encoding: binary\r\n"
                        + "Content-ID: 0\r\n"
                        + "\r\n"
                        + "DELETE https://account.table.core/Table(1) HTTP/1.1\r\n"
                        + "If-Match: *\r\n"
                        + "\r\n"
                        + "\r\n"
                        + "--batch_abc\r\n"
                        + "Content-Type: application/http\r\n"
                        + "Content-Transfer-Encoding: binary\r\n"
                        + "Content-ID: 1\r\n"
                        + "\r\n"
                        + "POST https://account.table.core/Table HTTP/1.1\r\n"
                        + "Content-Type: application/json\r\n"
                        + "\r\n"
                        + "{\"a\":1}\r\n"
                        + "--batch_abc--\r\n");
    }

    @Test
    void serializes_nested_change_sets() throws IOException {
        HttpRequest changeSet = HttpRequest.builder()
                .method(HttpMethod.PATCH)
                .uri("https://host/changeset")
                .multipartMixed(MultipartMixed.builder()
                        .addParts(HttpRequest.builder()
                                .method(HttpMethod.PUT)
                                .uri("https://host/entity")
                                .build())
                        .boundary("changeset_1")
                        .build())
                .build();
        HttpRequest batch = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://host/$batch")
                .multipartMixed(MultipartMixed.builder()
                        .addParts(changeSet)
                        .boundary("batch_1")
                        .build())
                .build();

        batch.prepareMultipartBody();

        assertThat(bodyOf(batch))
                .startsWith("--batch_1\r\nContent-Type: multipart/mixed; boundary=changeset_1\r\n\r\n--changeset_1\r\n")
                .contains("PUT https://host/entity HTTP/1.1\r\n")
                .endsWith("--changeset_1--\r\n--batch_1--\r\n");
    }

    @Test
    void content_ids_run_on_through_change_sets() throws IOException {
        HttpRequest changeSet = HttpRequest.builder()
                .method(HttpMethod.PATCH)
                .uri("https://host/changeset")
                .multipartMixed(MultipartMixed.builder()
                        .addParts(part("b"), part("c"))
                        .boundary("changeset_1")
                        .build())
                .build();
        HttpRequest batch = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://host/$batch")
                .multipartMixed(MultipartMixed.builder()
                        .addParts(part("a"), changeSet, part("d"))
                        .boundary("batch_1")
                        .build())
                .build();

        batch.prepareMultipartBody();

        List<String> contentIds = bodyOf(batch)
                .lines()
                .filter(line -> line.startsWith("Content-ID: "))
                .collect(Collectors.toList());
        assertThat(contentIds).containsExactly("Content-ID: 0", "Content-ID: 1", "Content-ID: 2", "Content-ID: 3");
        assertThat(bodyOf(batch).indexOf("/entity/c")).isLessThan(bodyOf(batch).indexOf("/entity/d"));
    }

    @Test
    void requests_without_bundle_are_untouched() throws IOException {
        HttpRequest request = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://host/")
                .build();
        request.prepareMultipartBody();
        assertThat(request.body()).isEmpty();
        assertThat(request.headers().isEmpty()).isTrue();
    }

    @Test
    void generates_a_boundary_by_default() {
        MultipartMixed bundle = MultipartMixed.builder()
                .addParts(HttpRequest.builder()
                        .method(HttpMethod.GET)
                        .uri("https://host/")
                        .build())
                .build();
        assertThat(bundle.boundary()).startsWith("batch_");
    }

    @Test
    void requires_parts() {
        assertThatThrownBy(() -> MultipartMixed.builder().build()).isInstanceOf(SafeIllegalArgumentException.class);
    }

    private static HttpRequest part(String name) {
        return HttpRequest.builder()
                .method(HttpMethod.DELETE)
                .uri("https://host/entity/" + name)
                .build();
    }

    private static String bodyOf(HttpRequest request) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        request.body().orElseThrow().writeTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }
}
