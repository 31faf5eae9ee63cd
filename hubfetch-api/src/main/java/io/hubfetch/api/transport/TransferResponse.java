package io.hubfetch.api.transport;

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

import io.hubfetch.api.errors.DataHubException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/// An open response to a transfer request. The body must be consumed or the response closed.
public interface TransferResponse extends Closeable {

    /// Header the hub uses to explain refused or failed requests
    String CAUSE_MESSAGE_HEADER = "cause-message";

    /// @return the HTTP status code
    int statusCode();

    /// @return the HTTP reason phrase, possibly empty
    String reason();

    /// @param name a header name, matched case-insensitively
    /// @return the first value of the header
    Optional<String> header(String name);

    /// @return the response body stream
    /// @throws IOException if the body cannot be opened
    InputStream body() throws IOException;

    /// @return true for 2xx status codes
    default boolean isSuccessful() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /// Builds the exception for an unsuccessful response, using the hub's `cause-message`
    /// header when present.
    ///
    /// @param what a description of the request, used in the message
    /// @return the most specific exception for the status code
    default DataHubException toException(String what) {
        String status = reason().isEmpty() ? String.valueOf(statusCode()) : statusCode() + " " + reason();
        return DataHubException.forResponse(statusCode(), what + " failed with HTTP " + status,
            header(CAUSE_MESSAGE_HEADER).orElse(null));
    }

    @Override
    void close();
}
