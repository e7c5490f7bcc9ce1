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
import com.palantir.logsafe.Preconditions;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** What {@link BearerTokenPolicy} asks a {@link TokenCredential} for. */
@ConduitImmutablesStyle
@Value.Immutable
public interface TokenRequestContext {

    List<String> scopes();

    /** Whether the token should support continuous access evaluation. */
    @Value.Default
    default boolean enableCae() {
        return false;
    }

    Optional<String> tenantId();

    @Value.Check
    default void check() {
        Preconditions.checkArgument(!scopes().isEmpty(), "At least one scope is required");
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableTokenRequestContext.Builder {}
}
