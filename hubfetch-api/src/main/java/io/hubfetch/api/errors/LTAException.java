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

/// Retrieval of a product from the Long Term Archive failed.
///
/// Whether the failure is worth retrying depends on its {@link LtaFailure}: a request the
/// hub did not accept right now may succeed later, an exhausted user quota or an elapsed
/// overall timeout will not.
public class LTAException extends DataHubException {

    /// Classification of archive retrieval failures
    public enum LtaFailure {
        /// the user's offline retrieval quota is exhausted
        QUOTA_EXCEEDED(true),
        /// the hub did not accept the retrieval request at this time
        NOT_ACCEPTED(false),
        /// the product did not come online within the configured timeout
        TIMEOUT(true);

        private final boolean terminal;

        LtaFailure(boolean terminal) {
            this.terminal = terminal;
        }

        /// @return true if retrying cannot help
        public boolean isTerminal() {
            return terminal;
        }
    }

    private final LtaFailure failure;

    /// @param message the error message
    /// @param failure the failure classification
    public LTAException(String message, LtaFailure failure) {
        super(message);
        this.failure = failure;
    }

    /// @param message the error message
    /// @param failure the failure classification
    /// @param statusCode the HTTP status code
    /// @param causeMessage the server supplied cause, or null
    public LTAException(String message, LtaFailure failure, int statusCode, String causeMessage) {
        super(message, statusCode, causeMessage);
        this.failure = failure;
    }

    /// @return the failure classification
    public LtaFailure getFailure() {
        return failure;
    }

    /// @return true if retrying the retrieval cannot help
    public boolean isTerminal() {
        return failure.isTerminal();
    }
}
