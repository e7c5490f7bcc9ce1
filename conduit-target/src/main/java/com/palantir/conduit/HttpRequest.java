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

import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An outbound HTTP request. Unlike most values in this library a request is mutable: policies inject headers,
 * rewrite the URI on redirects and replace the body before the request reaches the transport. Each call owns its
 * request, policies which send more than once work on {@link #copy() copies}.
 */
@NotThreadSafe
public final class HttpRequest {

    private static final String CONTENT_TYPE = "Content-Type";

    private HttpMethod method;
    private URI uri;
    private final ListMultimap<String, String> headers;
    private Optional<RequestBody> body;
    private Optional<MultipartMixed> multipartMixed;

    private HttpRequest(Builder builder) {
        this.method = Preconditions.checkNotNull(builder.method, "method is required");
        this.uri = Preconditions.checkNotNull(builder.uri, "uri is required");
        this.headers = newHeaders();
        this.headers.putAll(builder.headers);
        this.body = builder.body;
        this.multipartMixed = builder.multipartMixed;
    }

    public HttpMethod method() {
        return method;
    }

    public void setMethod(HttpMethod value) {
        this.method = Preconditions.checkNotNull(value, "method");
    }

    public URI uri() {
        return uri;
    }

    public void setUri(URI value) {
        this.uri = Preconditions.checkNotNull(value, "uri");
    }

    /**
     * The mutable HTTP headers of this request. Header names are compared in a case-insensitive fashion as per
     * https://tools.ietf.org/html/rfc7540#section-8.1.2.
     */
    public ListMultimap<String, String> headers() {
        return headers;
    }

    public Optional<String> getFirstHeader(String name) {
        List<String> values = headers.get(name);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /** Replaces all values of the given header. */
    public void setHeader(String name, String value) {
        Preconditions.checkArgumentNotNull(name, "Header name must not be null");
        Preconditions.checkArgumentNotNull(value, "Header value must not be null");
        headers.replaceValues(name, List.of(value));
    }

    public void removeHeader(String name) {
        headers.removeAll(name);
    }

    /** The HTTP request body for this request or empty if this request does not contain a body. */
    public Optional<RequestBody> body() {
        return body;
    }

    public void setBody(@Nullable RequestBody value) {
        this.body = Optional.ofNullable(value);
    }

    /** The batch of sub-requests this request carries, if any. */
    public Optional<MultipartMixed> multipartMixed() {
        return multipartMixed;
    }

    public void setMultipartMixed(@Nullable MultipartMixed value) {
        this.multipartMixed = Optional.ofNullable(value);
    }

    /**
     * Serializes the {@link #multipartMixed() bundle} into a {@code multipart/mixed} body and sets the matching
     * {@code Content-Type}. Does nothing for requests without a bundle. Parts are serialized as they are at the
     * time of the call, so any per-part preparation must have completed beforehand.
     */
    public void prepareMultipartBody() throws IOException {
        if (multipartMixed.isEmpty()) {
            return;
        }
        MultipartMixed bundle = multipartMixed.get();
        String contentType = MultipartBodies.contentType(bundle);
        setHeader(CONTENT_TYPE, contentType);
        body = Optional.of(RequestBodies.of(MultipartBodies.serialize(bundle), contentType));
    }

    /**
     * Returns an independent request with the same method, uri, headers and bundle. The body instance is shared,
     * callers must check {@link RequestBody#repeatable()} before sending it twice.
     */
    public HttpRequest copy() {
        return builder().from(this).build();
    }

    @Override
    public String toString() {
        return "HttpRequest{"
                // Values are excluded to avoid the risk of logging credentials
                + "method="
                + method
                + ", uri="
                + uri
                + ", headerKeys="
                + headers.keySet()
                + ", body="
                + body
                + ", multipart="
                + multipartMixed.isPresent()
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    private static ListMultimap<String, String> newHeaders() {
        return MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER)
                .arrayListValues()
                .build();
    }

    @NotThreadSafe
    public static final class Builder {

        @Nullable
        private HttpMethod method;

        @Nullable
        private URI uri;

        private final ListMultimap<String, String> headers = newHeaders();
        private Optional<RequestBody> body = Optional.empty();
        private Optional<MultipartMixed> multipartMixed = Optional.empty();

        private Builder() {}

        public Builder from(HttpRequest existing) {
            Preconditions.checkNotNull(existing, "HttpRequest.builder().from() requires a non-null instance");
            method = existing.method;
            uri = existing.uri;
            headers.clear();
            headers.putAll(existing.headers);
            body = existing.body;
            multipartMixed = existing.multipartMixed;
            return this;
        }

        public Builder method(HttpMethod value) {
            this.method = Preconditions.checkNotNull(value, "method");
            return this;
        }

        public Builder uri(URI value) {
            this.uri = Preconditions.checkNotNull(value, "uri");
            return this;
        }

        public Builder uri(String value) {
            Preconditions.checkNotNull(value, "uri");
            try {
                return uri(URI.create(value));
            } catch (IllegalArgumentException e) {
                throw new SafeIllegalArgumentException("Invalid uri", e, SafeArg.of("reason", e.getMessage()));
            }
        }

        public Builder putHeader(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            headers.put(key, value);
            return this;
        }

        public Builder putAllHeaders(Multimap<String, ? extends String> entries) {
            if (entries.containsKey(null)) {
                throw new SafeIllegalArgumentException("Header name must not be null");
            }
            headers.putAll(entries);
            return this;
        }

        public Builder body(RequestBody value) {
            this.body = Optional.of(Preconditions.checkNotNull(value, "body"));
            return this;
        }

        public Builder multipartMixed(MultipartMixed value) {
            this.multipartMixed = Optional.of(Preconditions.checkNotNull(value, "multipartMixed"));
            return this;
        }

        public HttpRequest build() {
            return new HttpRequest(this);
        }
    }
}
