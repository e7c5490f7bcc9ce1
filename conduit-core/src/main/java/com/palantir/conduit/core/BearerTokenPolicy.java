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
import com.google.common.collect.ImmutableList;
import com.google.common.net.HttpHeaders;
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.PipelineOptions;
import com.palantir.conduit.PipelineRequest;
import com.palantir.conduit.SansIoPolicy;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeUncheckedIoException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * Authorizes requests with a bearer token from a {@link TokenCredential}. Tokens are cached and refreshed once
 * they are within five minutes of expiry; concurrent calls share one refresh. Only https requests are accepted.
 *
 * <p>A credential failure aborts the call with a {@link SafeUncheckedIoException} before anything is sent.
 *
 * <p>Reads the {@code enable_cae} option ({@link Boolean}), which overrides the default given at construction for
 * every attempt of the call.
 */
public final class BearerTokenPolicy implements SansIoPolicy {

    private static final SafeLogger log = SafeLoggerFactory.get(BearerTokenPolicy.class);

    static final Duration REFRESH_BEFORE_EXPIRY = Duration.ofMinutes(5);

    private static final ContextAttachmentKey<Optional<Boolean>> ENABLE_CAE_KEY = CallOptions.newKey();

    private final TokenCredential credential;
    private final ImmutableList<String> scopes;
    private final boolean enableCae;
    private final Clock clock;

    @GuardedBy("this")
    @Nullable
    private AccessToken cachedToken;

    @GuardedBy("this")
    private boolean cachedTokenCae;

    public BearerTokenPolicy(TokenCredential credential, Collection<String> scopes) {
        this(credential, scopes, false);
    }

    public BearerTokenPolicy(TokenCredential credential, Collection<String> scopes, boolean enableCae) {
        this(credential, scopes, enableCae, Clock.systemUTC());
    }

    @VisibleForTesting
    BearerTokenPolicy(TokenCredential credential, Collection<String> scopes, boolean enableCae, Clock clock) {
        this.credential = Preconditions.checkNotNull(credential, "credential");
        this.scopes = ImmutableList.copyOf(Preconditions.checkNotNull(scopes, "scopes"));
        Preconditions.checkArgument(!this.scopes.isEmpty(), "At least one scope is required");
        this.enableCae = enableCae;
        this.clock = Preconditions.checkNotNull(clock, "clock");
    }

    @Override
    public void onRequest(PipelineRequest request) {
        String scheme = request.httpRequest().uri().getScheme();
        if (!"https".equalsIgnoreCase(scheme)) {
            throw new SafeIllegalArgumentException(
                    "Bearer token authentication is not permitted for non-TLS protected (non-https) URLs",
                    SafeArg.of("scheme", scheme));
        }
        boolean cae = CallOptions.peek(request.context(), ENABLE_CAE_KEY, PipelineOptions.ENABLE_CAE, Boolean.class)
                .orElse(enableCae);
        AccessToken token = token(cae);
        request.httpRequest().setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token.token());
    }

    private synchronized AccessToken token(boolean cae) {
        if (cachedToken != null && cachedTokenCae == cae && !needsRefresh(cachedToken)) {
            return cachedToken;
        }
        TokenRequestContext context = TokenRequestContext.builder()
                .scopes(scopes)
                .enableCae(cae)
                .build();
        try {
            AccessToken token = credential.getToken(context);
            Preconditions.checkNotNull(token, "TokenCredential returned no token");
            log.debug(
                    "Acquired a bearer token",
                    UnsafeArg.of("scopes", scopes),
                    SafeArg.of("enableCae", cae),
                    SafeArg.of("expiresOn", token.expiresOn()));
            cachedToken = token;
            cachedTokenCae = cae;
            return token;
        } catch (IOException e) {
            throw new SafeUncheckedIoException("Failed to acquire a bearer token", e, SafeArg.of("enableCae", cae));
        }
    }

    private boolean needsRefresh(AccessToken token) {
        return !clock.instant().plus(REFRESH_BEFORE_EXPIRY).isBefore(token.expiresOn());
    }

    @Override
    public String toString() {
        return "BearerTokenPolicy{scopes=" + scopes + ", enableCae=" + enableCae + '}';
    }
}
