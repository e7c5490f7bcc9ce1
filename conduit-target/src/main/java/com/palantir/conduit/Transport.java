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

import java.io.Closeable;

/**
 * Lifecycle shared by {@link HttpTransport} and {@link AsyncHttpTransport}. A pipeline owns exactly one transport
 * and delegates its own {@code open}/{@code close} to it.
 */
public interface Transport extends Closeable {

    /** Acquires connection resources. Opening an already open transport is a no-op. */
    void open();

    /** Releases connection resources. Must not throw, and must be safe to call more than once. */
    @Override
    void close();
}
