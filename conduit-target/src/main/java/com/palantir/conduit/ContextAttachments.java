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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Typed call-scoped state of a {@link PipelineContext}. Every attempt of a call sees the same attachments, so a
 * policy uses them to carry state from one attempt to the next. Safe for concurrent use by the asynchronous
 * pipeline, where hooks of one call may run on different threads.
 */
public final class ContextAttachments {

    @SuppressWarnings("DangerousIdentityKey")
    private final Map<ContextAttachmentKey<?>, Object> values = new ConcurrentHashMap<>(0);

    private ContextAttachments() {}

    static ContextAttachments create() {
        return new ContextAttachments();
    }

    /** Stores a value, returning the previous one if any. */
    @Nullable
    @SuppressWarnings("unchecked")
    public <V> V put(ContextAttachmentKey<V> key, V value) {
        Preconditions.checkNotNull(key, "key");
        return (V) values.put(key, key.checkValue(value));
    }

    @Nullable
    @SuppressWarnings("unchecked")
    public <V> V getOrDefault(ContextAttachmentKey<V> key, @Nullable V defaultValue) {
        Preconditions.checkNotNull(key, "key");
        return (V) values.getOrDefault(key, defaultValue);
    }

    /**
     * Returns the stored value, first storing the one produced by {@code initial} when there is none. The supplier
     * runs at most once per key and call, and must not touch these attachments.
     */
    @SuppressWarnings("unchecked")
    public <V> V computeIfAbsent(ContextAttachmentKey<V> key, Supplier<? extends V> initial) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(initial, "initial");
        return (V) values.computeIfAbsent(key, _ignored -> key.checkValue(initial.get()));
    }

    @Nullable
    @SuppressWarnings("unchecked")
    public <V> V remove(ContextAttachmentKey<V> key) {
        Preconditions.checkNotNull(key, "key");
        return (V) values.remove(key);
    }
}
