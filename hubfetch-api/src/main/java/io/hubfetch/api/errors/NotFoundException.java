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

/// The requested product or node does not exist on the hub.
public class NotFoundException extends DataHubException {

    /// @param message the error message
    public NotFoundException(String message) {
        super(message);
    }

    /// @param message the error message
    /// @param statusCode the HTTP status code
    /// @param causeMessage the server supplied cause, or null
    public NotFoundException(String message, int statusCode, String causeMessage) {
        super(message, statusCode, causeMessage);
    }
}
