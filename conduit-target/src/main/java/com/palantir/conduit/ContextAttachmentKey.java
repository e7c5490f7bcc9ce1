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
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;

/**
 * Identity-compared key for call-scoped state a policy keeps in a {@link PipelineContext}. Keys are usually held in
 * a private static field of the policy owning the state, so no other policy can read or overwrite it.
 */
public final class ContextAttachmentKey<V> {

    private final Class<? super V> valueType;

    private ContextAttachmentKey(Class<? super V> valueType) {
        this.valueType = valueType;
    }

    /**
     * Creates a key for values of the given type. Generic value types are keyed by their raw class, for example
     * {@code ContextAttachmentKey.<Optional<String>>create(Optional.class)}.
     */
    public static <T> ContextAttachmentKey<T> create(Class<? super T> valueType) {
        return new ContextAttachmentKey<>(Preconditions.checkNotNull(valueType, "valueType"));
    }

    V checkValue(V value) {
        Preconditions.checkNotNull(value, "Attachment value must not be null");
        if (!valueType.isInstance(value)) {
            throw new SafeIllegalArgumentException(
                    "Unexpected attachment type",
                    SafeArg.of("expected", valueType),
                    SafeArg.of("actualType", value.getClass()));
        }
        return value;
    }

    @Override
    public String toString() {
        return "ContextAttachmentKey{" + valueType.getSimpleName() + '}';
    }
}
