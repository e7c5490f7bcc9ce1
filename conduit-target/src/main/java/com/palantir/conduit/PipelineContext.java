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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Per-call state: the mutable option bag supplied to {@code run}, a back reference to the transport executing the
 * call, and typed attachments in which policies keep call-scoped data. A fresh context is created for every call
 * and is shared by every attempt of that call, never across calls.
 */
public final class PipelineContext {

    @Nullable
    private final Transport transport;

    private final Map<String, Object> options;
    private final ContextAttachments attachments = ContextAttachments.create();

    private PipelineContext(@Nullable Transport transport, Map<String, ?> options) {
        this.transport = transport;
        this.options = new LinkedHashMap<>(options.size());
        options.forEach((key, value) -> {
            Preconditions.checkArgument(key != null, "Option name must not be null");
            Preconditions.checkArgument(value != null, "Option value must not be null", SafeArg.of("option", key));
            this.options.put(key, value);
        });
    }

    public static PipelineContext of(Transport transport, Map<String, ?> options) {
        Preconditions.checkNotNull(transport, "transport");
        Preconditions.checkNotNull(options, "options");
        return new PipelineContext(transport, options);
    }

    /** A context with no transport, used while preparing the parts of a multipart request. */
    public static PipelineContext detached(Map<String, ?> options) {
        Preconditions.checkNotNull(options, "options");
        return new PipelineContext(null, options);
    }

    /** The transport executing this call, or empty for detached contexts. */
    public Optional<Transport> transport() {
        return Optional.ofNullable(transport);
    }

    /** The mutable per-call options. Policies consume their own keys by removing them. */
    public Map<String, Object> options() {
        return options;
    }

    public <T> Optional<T> option(String key, Class<T> type) {
        return Optional.ofNullable(options.get(key)).map(value -> cast(key, value, type));
    }

    /** Removes and returns the given option. */
    public <T> Optional<T> popOption(String key, Class<T> type) {
        return Optional.ofNullable(options.remove(key)).map(value -> cast(key, value, type));
    }

    public ContextAttachments attachments() {
        return attachments;
    }

    private static <T> T cast(String key, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new SafeIllegalArgumentException(
                    "Unexpected option type",
                    SafeArg.of("option", key),
                    SafeArg.of("expected", type),
                    SafeArg.of("actualType", value.getClass()));
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "PipelineContext{transport=" + transport + ", optionKeys=" + options.keySet() + '}';
    }
}
