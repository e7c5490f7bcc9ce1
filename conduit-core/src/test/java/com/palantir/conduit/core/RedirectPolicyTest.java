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
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.palantir.conduit.HttpMethod;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineResponse;
import com.palantir.conduit.RecordingTransport;
import com.palantir.conduit.RequestBodies;
import com.palantir.conduit.RequestBody;
import com.palantir.conduit.TestResponse;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class RedirectPolicyTest {

    @Mock
    private RequestBody streamingBody;

    private final RecordingTransport transport = new RecordingTransport();

    @Test
    public void testFollowsRedirectAndClosesTheRedirectResponse() throws Exception {
        TestResponse moved = redirect(301, "https://example.com/new");
        transport.respond(moved).respondWith(200);

        PipelineResponse response = pipeline(new RedirectPolicy()).run(get("https://example.com/old"));

        assertThat(response.httpResponse().status()).isEqualTo(200);
        assertThat(response.httpRequest().uri()).isEqualTo(URI.create("https://example.com/new"));
        assertThat(moved.isClosed()).isTrue();
        assertThat(transport.requests())
                .extracting(HttpRequest::uri)
                .containsExactly(URI.create("https://example.com/old"), URI.create("https://example.com/new"));
    }

    @Test
    public void testRelativeLocationIsResolvedAgainstTheRequest() throws Exception {
        transport.respond(redirect(307, "../other?x=1")).respondWith(200);

        pipeline(new RedirectPolicy()).run(get("https://example.com/a/b/c"));

        assertThat(transport.requests().get(1).uri()).isEqualTo(URI.create("https://example.com/a/other?x=1"));
    }

    @Test
    public void testFoundAfterPostSwitchesToBodilessGet() throws Exception {
        transport.respond(redirect(302, "/result")).respondWith(200);
        HttpRequest post = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://example.com/form")
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .body(RequestBodies.ofUtf8("{}", "application/json"))
                .build();

        pipeline(new RedirectPolicy()).run(post);

        HttpRequest followed = transport.requests().get(1);
        assertThat(followed.method()).isEqualTo(HttpMethod.GET);
        assertThat(followed.body()).isEmpty();
        assertThat(followed.headers().containsKey("Content-Type")).isFalse();
        assertThat(followed.getFirstHeader("Accept")).contains("application/json");
        assertThat(post.method()).isEqualTo(HttpMethod.POST);
    }

    @Test
    public void testSeeOtherSwitchesToGet() throws Exception {
        transport.respond(redirect(303, "/status")).respondWith(200);

        pipeline(new RedirectPolicy()).run(request(HttpMethod.PUT, "https://example.com/items/1"));

        assertThat(transport.requests().get(1).method()).isEqualTo(HttpMethod.GET);
    }

    @Test
    public void testTemporaryRedirectPreservesMethodAndBody() throws Exception {
        transport.respond(redirect(307, "/v2/items")).respond(redirect(308, "/v3/items")).respondWith(201);
        RequestBody body = RequestBodies.ofUtf8("{\"name\":\"x\"}", "application/json");
        HttpRequest post = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://example.com/v1/items")
                .body(body)
                .build();

        PipelineResponse response = pipeline(new RedirectPolicy()).run(post);

        assertThat(response.httpResponse().status()).isEqualTo(201);
        assertThat(transport.requests()).allSatisfy(sent -> {
            assertThat(sent.method()).isEqualTo(HttpMethod.POST);
            assertThat(sent.body()).containsSame(body);
        });
    }

    @Test
    public void testNonRepeatableBodyIsNotResent() throws Exception {
        when(streamingBody.repeatable()).thenReturn(false);
        transport.respond(redirect(307, "/elsewhere"));
        HttpRequest post = HttpRequest.builder()
                .method(HttpMethod.POST)
                .uri("https://example.com/upload")
                .body(streamingBody)
                .build();

        PipelineResponse response = pipeline(new RedirectPolicy()).run(post);

        assertThat(response.httpResponse().status()).isEqualTo(307);
        assertThat(transport.sends()).isEqualTo(1);
    }

    @Test
    public void testStopsAtTheRedirectLimit() throws Exception {
        TestResponse last = redirect(302, "/loop");
        transport.respond(redirect(302, "/loop")).respond(redirect(302, "/loop")).respond(last);

        PipelineResponse response = pipeline(new RedirectPolicy(2)).run(get("https://example.com/loop"));

        assertThat(response.httpResponse()).isSameAs(last);
        assertThat(last.isClosed()).isFalse();
        assertThat(transport.sends()).isEqualTo(3);
    }

    @Test
    public void testRedirectsCanBeDisabledPerCall() throws Exception {
        transport.respond(redirect(301, "/new"));

        PipelineResponse response = pipeline(new RedirectPolicy())
                .run(get("https://example.com/old"), ImmutableMap.of(Redirects.PERMIT_REDIRECTS, false));

        assertThat(response.httpResponse().status()).isEqualTo(301);
        assertThat(transport.options().get(0)).isEmpty();
    }

    @Test
    public void testLocationlessRedirectIsReturned() throws Exception {
        transport.respondWith(302);

        assertThat(pipeline(new RedirectPolicy())
                        .run(get("https://example.com/"))
                        .httpResponse()
                        .status())
                .isEqualTo(302);
    }

    @Test
    public void testCrossOriginRedirectDropsAuthorization() throws Exception {
        transport
                .respond(redirect(302, "https://example.com/same"))
                .respond(redirect(302, "https://attacker.example.org/steal"))
                .respondWith(200);
        Pipeline pipeline = Pipeline.builder()
                .transport(transport)
                .addPolicy(new RedirectPolicy())
                .addPolicy(new SensitiveHeaderCleanupPolicy())
                .build();
        HttpRequest request = HttpRequest.builder()
                .method(HttpMethod.GET)
                .uri("https://example.com/start")
                .putHeader("Authorization", "Bearer secret")
                .build();

        pipeline.run(request);

        assertThat(transport.requests())
                .extracting(sent -> sent.getFirstHeader("Authorization").orElse("none"))
                .containsExactly("Bearer secret", "Bearer secret", "none");
        assertThat(transport.options()).allSatisfy(options -> assertThat(options)
                .doesNotContainKey(com.palantir.conduit.PipelineOptions.INSECURE_DOMAIN_CHANGE));
    }

    @Test
    public void testSameOriginComparesSchemeHostAndEffectivePort() {
        assertThat(Redirects.sameOrigin(URI.create("https://Example.com/a"), URI.create("https://example.com:443/b")))
                .isTrue();
        assertThat(Redirects.sameOrigin(URI.create("https://example.com/a"), URI.create("http://example.com/a")))
                .isFalse();
        assertThat(Redirects.sameOrigin(URI.create("https://example.com/a"), URI.create("https://example.com:8443/")))
                .isFalse();
        assertThat(Redirects.sameOrigin(URI.create("https://example.com/a"), URI.create("https://api.example.com/")))
                .isFalse();
    }

    private Pipeline pipeline(RedirectPolicy policy) {
        return Pipeline.builder().transport(transport).addPolicy(policy).build();
    }

    static TestResponse redirect(int status, String location) {
        return new TestResponse().status(status).withHeader("Location", location);
    }

    private static HttpRequest get(String uri) {
        return request(HttpMethod.GET, uri);
    }

    private static HttpRequest request(HttpMethod method, String uri) {
        return HttpRequest.builder().method(method).uri(uri).build();
    }
}
