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

/// Verification was requested but the descriptor carries no checksum in a supported algorithm.
///
/// This is not a mismatch: nothing was verified, and callers must not treat it as success.
public class ChecksumUnavailableException extends DataHubException {

    /// @param message the error message
    public ChecksumUnavailableException(String message) {
        super(message);
    }
}
