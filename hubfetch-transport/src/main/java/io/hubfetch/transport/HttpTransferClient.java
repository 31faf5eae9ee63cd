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

import io.hubfetch.api.transport.ByteRange;
import io.hubfetch.api.transport.TransferClient;
import io.hubfetch.api.transport.TransferResponse;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// OkHttp implementation of {@link TransferClient}.
///
/// Responses are returned whatever their status, so callers can interpret the hub's status
/// codes themselves.
public class HttpTransferClient implements TransferClient {
    private static final Logger logger = LogManager.getLogger(HttpTransferClient.class);

    private final OkHttpClient http;

    /// @param http the client, usually from {@link HubHttpClients}
    public HttpTransferClient(OkHttpClient http) {
        this.http = http;
    }

    @Override
    public TransferResponse get(String url, ByteRange range) throws IOException {
        Request.Builder request = new Request.Builder().url(url).get();
        if (range != null) {
            request.header("Range", range.toHeaderValue());
        }
        logger.debug("GET {}{}", url, range == null ? "" : " (" + range + ")");
        return new OkHttpTransferResponse(http.newCall(request.build()).execute());
    }
}
