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

/// A transfer or retrieval was stopped because its batch was cancelled. Never retried.
public class DownloadCancelledException extends DataHubException {

    /// @param message the error message
    public DownloadCancelledException(String message) {
        super(message);
    }

    /// @param message the error message
    /// @param cause the underlying cause, usually an {@link InterruptedException}
    public DownloadCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
