package io.hubfetch.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import jakarta.servlet.http.HttpServletResponse;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/// Ready made {@link Responder}s for hub endpoints.
public final class Responders {

    private Responders() {
    }

    /// Serves content like a hub serves product archives: `Range` requests are answered with
    /// `206 Partial Content`, other requests with `200`. `HEAD` requests get headers only.
    ///
    /// @param content the content
    /// @param headers additional response headers
    /// @return the responder
    public static Responder bytes(byte[] content, Map<String, String> headers) {
        return (request, response) -> {
            headers.forEach(response::setHeader);
            response.setHeader("Accept-Ranges", "bytes");
            if (response.getContentType() == null) {
                response.setContentType("application/octet-stream");
            }
            long start = 0;
            long end = content.length - 1L;
            String range = request.getHeader("Range");
            if (range != null && range.startsWith("bytes=")) {
                String[] bounds = range.substring("bytes=".length()).split("-", 2);
                start = Long.parseLong(bounds[0].trim());
                if (bounds.length > 1 && !bounds[1].isBlank()) {
                    end = Math.min(end, Long.parseLong(bounds[1].trim()));
                }
                if (start >= content.length) {
                    response.setStatus(416);
                    response.setHeader("Content-Range", "bytes */" + content.length);
                    return;
                }
                response.setStatus(206);
                response.setHeader("Content-Range", "bytes " + start + "-" + end + "/" + content.length);
            } else {
                response.setStatus(200);
            }
            int length = (int) (end - start + 1);
            response.setContentLength(Math.max(length, 0));
            if (!"HEAD".equals(request.getMethod()) && length > 0) {
                try (OutputStream out = response.getOutputStream()) {
                    out.write(content, (int) start, length);
                }
            }
        };
    }

    /// @param content the content
    /// @return a responder serving the content with range support
    public static Responder bytes(byte[] content) {
        return bytes(content, Map.of());
    }

    /// @param status the status code
    /// @param body the body text, may be empty
    /// @param contentType the content type of the body
    /// @param headers additional response headers
    /// @return a responder with a fixed status, body and headers
    public static Responder status(int status, String body, String contentType, Map<String, String> headers) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return (request, response) -> {
            response.setStatus(status);
            headers.forEach(response::setHeader);
            response.setContentType(contentType);
            response.setContentLength(bytes.length);
            if (!"HEAD".equals(request.getMethod())) {
                response.getOutputStream().write(bytes);
            }
        };
    }

    /// @param status the status code
    /// @param headers response headers
    /// @return a responder with a fixed status and headers and an empty body
    public static Responder status(int status, Map<String, String> headers) {
        return status(status, "", "text/plain", headers);
    }

    /// @param status the status code
    /// @return a responder with a fixed status and an empty body
    public static Responder status(int status) {
        return status(status, Map.of());
    }

    /// @param body the body text
    /// @return a `200 text/plain` responder
    public static Responder text(String body) {
        return status(HttpServletResponse.SC_OK, body, "text/plain;charset=utf-8", Map.of());
    }

    /// @param json the JSON document
    /// @return a `200 application/json` responder
    public static Responder json(String json) {
        return status(HttpServletResponse.SC_OK, json, "application/json", Map.of());
    }
}
