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


package com.palantir.conduit.java;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.palantir.conduit.HttpResponse;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.io.InputStream;

/** A JDK client response whose body is still streaming. */
final class JavaResponse implements HttpResponse {

    private static final SafeLogger log = SafeLoggerFactory.get(JavaResponse.class);

    private final java.net.http.HttpResponse<InputStream> response;
    private final ListMultimap<String, String> headers;

    JavaResponse(java.net.http.HttpResponse<InputStream> response) {
        this.response = response;
        this.headers = MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER)
                .arrayListValues()
                .build();
        response.headers().map().forEach((name, values) -> {
            // HTTP/2 pseudo headers are not headers
            if (!name.startsWith(":")) {
                headers.putAll(name, values);
            }
        });
    }

    @Override
    public InputStream body() {
        return response.body();
    }

    @Override
    public int status() {
        return response.statusCode();
    }

    @Override
    public ListMultimap<String, String> headers() {
        return headers;
    }

    @Override
    public void close() {
        try {
            response.body().close();
        } catch (IOException e) {
            log.warn("Failed to close response", SafeArg.of("status", status()), e);
        }
    }

    @Override
    public String toString() {
        return "JavaResponse{status=" + status() + ", version=" + response.version() + '}';
    }
}
