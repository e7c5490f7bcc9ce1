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

import com.google.common.util.concurrent.ListenableFuture;
import java.util.Map;

/**
 * Non-blocking counterpart of {@link HttpTransport}.
 *
 * <h4>Behavior</h4>
 * Implementations of {@link #send} must return immediately and must never throw. A failed
 * {@link ListenableFuture} must be returned instead.
 */
public interface AsyncHttpTransport extends Transport {

    ListenableFuture<HttpResponse> send(HttpRequest request, Map<String, Object> options);
}
