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
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;

/** Factories for common {@link RequestBody} shapes. */
public final class RequestBodies {

    /** A repeatable body backed by the given bytes. The array is not copied and must not be mutated. */
    public static RequestBody of(byte[] content, String contentType) {
        Preconditions.checkNotNull(content, "content");
        Preconditions.checkNotNull(contentType, "contentType");
        return new BytesRequestBody(content, contentType);
    }

    public static RequestBody ofUtf8(String content, String contentType) {
        Preconditions.checkNotNull(content, "content");
        return of(content.getBytes(StandardCharsets.UTF_8), contentType);
    }

    private RequestBodies() {}

    private static final class BytesRequestBody implements RequestBody {
        private final byte[] content;
        private final String contentType;

        private BytesRequestBody(byte[] content, String contentType) {
            this.content = content;
            this.contentType = contentType;
        }

        @Override
        public void writeTo(OutputStream output) throws IOException {
            output.write(content);
        }

        @Override
        public String contentType() {
            return contentType;
        }

        @Override
        public boolean repeatable() {
            return true;
        }

        @Override
        public OptionalLong contentLength() {
            return OptionalLong.of(content.length);
        }

        @Override
        public void close() {}

        @Override
        public String toString() {
            return "BytesRequestBody{contentType=" + contentType + ", length=" + content.length + '}';
        }
    }
}
