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

import com.palantir.logsafe.Preconditions;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.immutables.value.Value;

/**
 * A batch of independent sub-requests sent as one {@code multipart/mixed} request. Before the composite request
 * enters the policy chain, every part is prepared by running the {@link #policies()} request hooks against it with
 * {@link #options()} as its per-call options. A part may itself carry a bundle (a change set), which is prepared
 * first.
 */
@ConduitImmutablesStyle
@Value.Immutable
public interface MultipartMixed {

    List<HttpRequest> parts();

    /** Request hooks applied to every part. Only {@link SansIoPolicy#onRequest} is invoked. */
    List<SansIoPolicy> policies();

    Map<String, Object> options();

    @Value.Default
    default String boundary() {
        return "batch_" + UUID.randomUUID();
    }

    @Value.Check
    default void check() {
        Preconditions.checkArgument(!parts().isEmpty(), "A multipart request requires at least one part");
        Preconditions.checkArgument(!boundary().isEmpty(), "boundary must not be empty");
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableMultipartMixed.Builder {}
}
