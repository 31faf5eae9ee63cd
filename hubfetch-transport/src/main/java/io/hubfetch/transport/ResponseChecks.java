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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.hubfetch.api.errors.DataHubException;
import io.hubfetch.api.transport.TransferResponse;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/// Maps unsuccessful hub responses to {@link DataHubException}s.
///
/// The hub explains refused requests in a `cause-message` header or, for OData requests, in a
/// JSON error document of the form `{"error": {"message": {"value": "..."}}}`.
final class ResponseChecks {
    private static final Gson gson = new Gson();

    private ResponseChecks() {
    }

    /// @param response a response
    /// @param what a description of the request, used in the message
    /// @throws DataHubException the most specific exception for the status code, if not 2xx
    static void check(Response response, String what) {
        if (response.isSuccessful()) {
            return;
        }
        String status = response.message().isEmpty()
            ? String.valueOf(response.code())
            : response.code() + " " + response.message();
        throw DataHubException.forResponse(response.code(), what + " failed with HTTP " + status, causeOf(response));
    }

    /// @param response an unsuccessful response
    /// @return the hub's explanation, or null if it gave none
    static String causeOf(Response response) {
        String header = response.header(TransferResponse.CAUSE_MESSAGE_HEADER);
        if (header != null && !header.isBlank()) {
            return header;
        }
        ResponseBody body = response.body();
        if (body == null) {
            return null;
        }
        try {
            String text = body.string();
            if (!text.trim().startsWith("{")) {
                return null;
            }
            ODataModel.ErrorEnvelope envelope = gson.fromJson(text, ODataModel.ErrorEnvelope.class);
            if (envelope == null || envelope.error == null || envelope.error.message == null) {
                return null;
            }
            return envelope.error.message.value;
        } catch (IOException | JsonParseException e) {
            return "unreadable error response: " + e.getMessage();
        }
    }
}
