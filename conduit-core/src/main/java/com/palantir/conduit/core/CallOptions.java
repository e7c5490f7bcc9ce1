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

import com.google.common.collect.ImmutableMap;
import com.palantir.conduit.ContextAttachmentKey;
import com.palantir.conduit.PipelineContext;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads per-call options on behalf of a policy. The value seen by the first attempt of a call is remembered in the
 * context, so retried and redirected attempts see the same value even after the option has left the option bag.
 */
final class CallOptions {

    /** Removes the option from the bag, so it never reaches the transport. */
    static <T> Optional<T> consume(
            PipelineContext context, ContextAttachmentKey<Optional<T>> memo, String key, Class<T> type) {
        return context.attachments().computeIfAbsent(memo, () -> context.popOption(key, type));
    }

    /** Leaves the option in the bag, for options the transport runner strips itself. */
    static <T> Optional<T> peek(
            PipelineContext context, ContextAttachmentKey<Optional<T>> memo, String key, Class<T> type) {
        return context.attachments().computeIfAbsent(memo, () -> context.option(key, type));
    }

    /** Consumes a {@link Consumer} option. The element type cannot be checked at runtime. */
    @SuppressWarnings("unchecked")
    static <T> Optional<Consumer<T>> consumeCallback(
            PipelineContext context, ContextAttachmentKey<Optional<Consumer<T>>> memo, String key) {
        return context.attachments()
                .computeIfAbsent(memo, () -> context.popOption(key, Consumer.class)
                        .map(callback -> (Consumer<T>) callback));
    }

    /** Consumes a {@code Map<String, String>} option, rejecting any entry that is not a pair of strings. */
    static Optional<Map<String, String>> consumeStringMap(
            PipelineContext context, ContextAttachmentKey<Optional<Map<String, String>>> memo, String key) {
        return context.attachments()
                .computeIfAbsent(memo, () -> context.popOption(key, Map.class)
                        .<Map<String, String>>map(values -> toStringMap(key, values)));
    }

    static <T> ContextAttachmentKey<Optional<T>> newKey() {
        return ContextAttachmentKey.create(Optional.class);
    }

    private static ImmutableMap<String, String> toStringMap(String key, Map<?, ?> values) {
        ImmutableMap.Builder<String, String> result = ImmutableMap.builderWithExpectedSize(values.size());
        values.forEach((name, value) -> {
            if (!(name instanceof String) || !(value instanceof String)) {
                throw new SafeIllegalArgumentException(
                        "Option must map strings to strings",
                        SafeArg.of("option", key),
                        SafeArg.of("nameType", name == null ? null : name.getClass()),
                        SafeArg.of("valueType", value == null ? null : value.getClass()));
            }
            result.put((String) name, (String) value);
        });
        return result.buildOrThrow();
    }

    private CallOptions() {}
}
