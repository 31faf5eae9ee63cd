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

/// Base class for failures reported by the data hub or raised while talking to it.
///
/// The HTTP status code and the server supplied `cause-message` header are kept when the
/// failure originates from a response, so callers can log them or branch on them without
/// holding on to the response itself.
public class DataHubException extends RuntimeException {

    /// Marker for failures that did not come from an HTTP response
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String causeMessage;

    /// Creates an exception that is not tied to a server response.
    /// @param message the error message
    public DataHubException(String message) {
        this(message, NO_STATUS, null, null);
    }

    /// Creates an exception that is not tied to a server response.
    /// @param message the error message
    /// @param cause the underlying cause
    public DataHubException(String message, Throwable cause) {
        this(message, NO_STATUS, null, cause);
    }

    /// Creates an exception for a server response.
    /// @param message the error message
    /// @param statusCode the HTTP status code of the response
    /// @param causeMessage the server supplied cause, or null
    public DataHubException(String message, int statusCode, String causeMessage) {
        this(message, statusCode, causeMessage, null);
    }

    /// Creates an exception for a server response with an underlying cause.
    /// @param message the error message
    /// @param statusCode the HTTP status code of the response
    /// @param causeMessage the server supplied cause, or null
    /// @param cause the underlying cause, or null
    public DataHubException(String message, int statusCode, String causeMessage, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.causeMessage = causeMessage;
    }

    /// Maps an unsuccessful response to the most specific exception type.
    ///
    /// @param statusCode the HTTP status code
    /// @param message a message describing the failed request
    /// @param causeMessage the server supplied cause, or null
    /// @return the exception to throw
    public static DataHubException forResponse(int statusCode, String message, String causeMessage) {
        String text = causeMessage != null && !causeMessage.isBlank() ? message + ": " + causeMessage : message;
        if (statusCode == 401) {
            return new UnauthorizedException(text, statusCode, causeMessage);
        }
        if (statusCode == 404) {
            return new NotFoundException(text, statusCode, causeMessage);
        }
        if (statusCode >= 500) {
            return new ServerErrorException(text, statusCode, causeMessage);
        }
        return new DataHubException(text, statusCode, causeMessage);
    }

    /// @return the HTTP status code, or {@link #NO_STATUS}
    public int getStatusCode() {
        return statusCode;
    }

    /// @return the server supplied cause message, or null
    public String getCauseMessage() {
        return causeMessage;
    }

    @Override
    public String toString() {
        if (statusCode == NO_STATUS) {
            return getClass().getSimpleName() + ": " + getMessage();
        }
        return getClass().getSimpleName() + " (HTTP status " + statusCode + "): " + getMessage();
    }
}
