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

import com.google.common.collect.ImmutableSet;
import com.google.common.net.HttpHeaders;
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.HttpRequest;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Collection;
import java.util.Optional;

/**
 * Removes credentials from requests which a redirect sent to a different origin. Place it after the redirect
 * policy, nearest to the transport. The {@code insecure_domain_change} flag is read but left in place, the
 * transport runner removes it. Once a call has changed origin, every later send of that call is cleaned.
 *
 * <p>Per-call option {@code disable_sensitive_header_cleanup} ({@link Boolean}) skips the cleanup.
 */
public final class SensitiveHeaderCleanupPolicy implements SansIoPolicy {

    private static final SafeLogger log = SafeLoggerFactory.get(SensitiveHeaderCleanupPolicy.class);

    static final String DISABLE_CLEANUP = "disable_sensitive_header_cleanup";

    private static final ContextAttachmentKey<Optional<Boolean>> DISABLE_CLEANUP_KEY = CallOptions.newKey();
    private static final ContextAttachmentKey<Boolean> DOMAIN_CHANGED = ContextAttachmentKey.create(Boolean.class);

    private final ImmutableSet<String> sensitiveHeaders;

    public SensitiveHeaderCleanupPolicy() {
        this(ImmutableSet.of());
    }

    /** Removes {@code Authorization} and the given additional headers. */
    public SensitiveHeaderCleanupPolicy(Collection<String> additionalHeaders) {
        Preconditions.checkNotNull(additionalHeaders, "additionalHeaders");
        this.sensitiveHeaders = ImmutableSet.<String>builder()
                .add(HttpHeaders.AUTHORIZATION)
                .addAll(additionalHeaders)
                .build();
    }

    @Override
    public void onRequest(PipelineRequest request) {
        boolean disabled = CallOptions.consume(request.context(), DISABLE_CLEANUP_KEY, DISABLE_CLEANUP, Boolean.class)
                .orElse(false);
        boolean domainChanged = request.context()
                .option(PipelineOptions.INSECURE_DOMAIN_CHANGE, Boolean.class)
                .orElse(false);
        // The transport runner strips the flag after every send, retried attempts rely on the remembered value.
        if (domainChanged) {
            request.context().attachments().put(DOMAIN_CHANGED, Boolean.TRUE);
        } else {
            domainChanged = request.context().attachments().getOrDefault(DOMAIN_CHANGED, false);
        }
        if (disabled || !domainChanged) {
            return;
        }
        HttpRequest httpRequest = request.httpRequest();
        for (String header : sensitiveHeaders) {
            if (httpRequest.headers().containsKey(header)) {
                httpRequest.removeHeader(header);
                log.debug("Removed sensitive header after a cross-origin redirect", SafeArg.of("header", header));
            }
        }
    }

    @Override
    public String toString() {
        return "SensitiveHeaderCleanupPolicy{headers=" + sensitiveHeaders + '}';
    }
}
