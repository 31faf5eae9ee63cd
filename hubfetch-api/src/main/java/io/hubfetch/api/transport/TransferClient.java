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

import java.io.IOException;

/// Raw, already authenticated access to the hub's byte streams.
///
/// Implementations return whatever the server answered; interpreting status codes is left to the
/// caller, because the same code means different things for a download and for an archive probe.
public interface TransferClient {

    /// Issues a GET request, optionally restricted to a byte range.
    ///
    /// @param url the resource URL
    /// @param range the byte range to request, or null for the whole resource
    /// @return the open response
    /// @throws IOException if the request cannot be sent or the connection fails
    TransferResponse get(String url, ByteRange range) throws IOException;
}
