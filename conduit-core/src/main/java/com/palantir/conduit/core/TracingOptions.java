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

import com.palantir.conduit.ConduitImmutablesStyle;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** Per-call tracing configuration, passed as the {@code tracing_options} option. */
@ConduitImmutablesStyle
@Value.Immutable
public interface TracingOptions {

    @Value.Default
    default boolean enabled() {
        return true;
    }

    /** Overrides the default span name {@code HTTP <METHOD>}. */
    Optional<String> spanName();

    /** Added to the span on completion. */
    Map<String, String> tags();

    static TracingOptions disabled() {
        return builder().enabled(false).build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableTracingOptions.Builder {}
}
