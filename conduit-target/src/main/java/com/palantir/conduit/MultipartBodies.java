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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/** Renders a {@link MultipartMixed} bundle as a {@code multipart/mixed} body of {@code application/http} parts. */
final class MultipartBodies {

    private static final String CRLF = "\r\n";

    static String contentType(MultipartMixed bundle) {
        return "multipart/mixed; boundary=" + bundle.boundary();
    }

    static byte[] serialize(MultipartMixed bundle) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeBundle(bundle, out, 0);
        return out.toByteArray();
    }

    /**
     * Writes the bundle, numbering its messages from {@code nextContentId}. Content-IDs run on through nested
     * change sets so every message of the batch has its own. Returns the next unused Content-ID.
     */
    private static int writeBundle(MultipartMixed bundle, ByteArrayOutputStream out, int nextContentId)
            throws IOException {
        int contentId = nextContentId;
        for (HttpRequest part : bundle.parts()) {
            writeLine(out, "--" + bundle.boundary());
            Optional<MultipartMixed> changeSet = part.multipartMixed();
            if (changeSet.isPresent()) {
                writeLine(out, "Content-Type: " + contentType(changeSet.get()));
                writeLine(out, "");
                contentId = writeBundle(changeSet.get(), out, contentId);
            } else {
                writeLine(out, "Content-Type: application/http");
                writeLine(out, "Content-Transfer-Encoding: binary");
                writeLine(out, "Content-ID: " + contentId++);
                writeLine(out, "");
                writeMessage(part, out);
            }
        }
        writeLine(out, "--" + bundle.boundary() + "--");
        return contentId;
    }

    private static void writeMessage(HttpRequest part, ByteArrayOutputStream out) throws IOException {
        writeLine(out, part.method() + " " + part.uri() + " HTTP/1.1");
        for (Map.Entry<String, String> header : part.headers().entries()) {
            writeLine(out, header.getKey() + ": " + header.getValue());
        }
        Optional<RequestBody> body = part.body();
        if (body.isPresent() && !part.headers().containsKey("Content-Type")) {
            writeLine(out, "Content-Type: " + body.get().contentType());
        }
        writeLine(out, "");
        if (body.isPresent()) {
            body.get().writeTo(out);
        }
        writeLine(out, "");
    }

    private static void writeLine(ByteArrayOutputStream out, String line) {
        out.writeBytes((line + CRLF).getBytes(StandardCharsets.UTF_8));
    }

    private MultipartBodies() {}
}
