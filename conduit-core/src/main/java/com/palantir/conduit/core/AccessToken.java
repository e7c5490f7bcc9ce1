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
import java.time.Instant;
import org.immutables.value.Value;

/** A bearer token and the instant it stops being valid. */
@ConduitImmutablesStyle
@Value.Immutable
public interface AccessToken {

    @Value.Parameter
    @Value.Redacted
    String token();

    @Value.Parameter
    Instant expiresOn();

    static AccessToken of(String token, Instant expiresOn) {
        return ImmutableAccessToken.of(token, expiresOn);
    }
}
