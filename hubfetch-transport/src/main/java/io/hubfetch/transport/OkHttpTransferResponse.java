package io.hubfetch.transport;

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

import io.hubfetch.api.transport.TransferResponse;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/// {@link TransferResponse} over an open OkHttp response.
class OkHttpTransferResponse implements TransferResponse {
    private final Response response;

    OkHttpTransferResponse(Response response) {
        this.response = response;
    }

    @Override
    public int statusCode() {
        return response.code();
    }

    @Override
    public String reason() {
        return response.message();
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(response.header(name));
    }

    @Override
    public InputStream body() throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new IOException("Response body is null");
        }
        return body.byteStream();
    }

    @Override
    public void close() {
        response.close();
    }
}
