package io.hubfetch.api.errors;

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

/// The hub answered in an unexpected way, typically while under maintenance or overloaded.
/// Treated as transient.
public class ServerErrorException extends DataHubException {

    /// @param message the error message
    public ServerErrorException(String message) {
        super(message);
    }

    /// @param message the error message
    /// @param cause the underlying cause
    public ServerErrorException(String message, Throwable cause) {
        super(message, cause);
    }

    /// @param message the error message
    /// @param statusCode the HTTP status code
    /// @param causeMessage the server supplied cause, or null
    public ServerErrorException(String message, int statusCode, String causeMessage) {
        super(message, statusCode, causeMessage);
    }
}
