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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.net.HttpHeaders;
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.SansIoPolicy;
import java.util.Optional;

/**
 * Sets the {@code User-Agent} header to {@code <base> conduit/<version>}. A per-call {@code user_agent} option
 * ({@link String}) is prepended to it.
 */
public final class UserAgentPolicy implements SansIoPolicy {

    static final String USER_AGENT = "user_agent";

    private static final String LIBRARY_NAME = "conduit";
    private static final String DEFAULT_VERSION = "0.0.0";
    private static final ContextAttachmentKey<Optional<String>> USER_AGENT_KEY = CallOptions.newKey();

    private final String userAgent;

    public UserAgentPolicy() {
        this("");
    }

    /** The {@code base} identifies the application, for example {@code my-service/1.2.3}. May be empty. */
    public UserAgentPolicy(String base) {
        this.userAgent = userAgent(Strings.nullToEmpty(base).trim(), libraryVersion());
    }

    @VisibleForTesting
    static String userAgent(String base, String version) {
        String library = LIBRARY_NAME + '/' + version;
        return base.isEmpty() ? library : base + ' ' + library;
    }

    @Override
    public void onRequest(PipelineRequest request) {
        Optional<String> perCall =
                CallOptions.consume(request.context(), USER_AGENT_KEY, USER_AGENT, String.class);
        request.httpRequest()
                .setHeader(HttpHeaders.USER_AGENT, perCall.map(prefix -> prefix + ' ' + userAgent)
                        .orElse(userAgent));
    }

    public String userAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        return "UserAgentPolicy{userAgent=" + userAgent + '}';
    }

    private static String libraryVersion() {
        String maybeVersion = UserAgentPolicy.class.getPackage().getImplementationVersion();
        return maybeVersion != null ? maybeVersion : DEFAULT_VERSION;
    }
}
