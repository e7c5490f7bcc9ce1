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

import com.google.common.collect.ImmutableSet;

/** Well-known keys of the per-call option bag carried by {@link PipelineContext#options()}. */
public final class PipelineOptions {

    /**
     * Set to {@code true} by redirect handling when a redirect crossed to a different scheme, host or port. Tells
     * sensitive header cleanup to drop credentials before the redirected request is sent.
     */
    public static final String INSECURE_DOMAIN_CHANGE = "insecure_domain_change";

    /** Requests continuous access evaluation support when acquiring bearer tokens. */
    public static final String ENABLE_CAE = "enable_cae";

    /** Per-call tracing configuration read by tracing policies. */
    public static final String TRACING_OPTIONS = "tracing_options";

    /** Per-call request timeout, a {@link java.time.Duration}, consumed by transports. */
    public static final String TIMEOUT = "timeout";

    /**
     * Pipeline-internal signaling keys. Policies read them, transports never understand them, so the transport
     * runner removes all of them before handing the option bag to the transport.
     */
    public static final ImmutableSet<String> PIPELINE_INTERNAL =
            ImmutableSet.of(INSECURE_DOMAIN_CHANGE, ENABLE_CAE, TRACING_OPTIONS);

    private PipelineOptions() {}
}
