package io.hubfetch.api.catalog;

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

/// Anything that can be fetched as a single file: a whole product archive or one node of a product.
public interface Transferable {

    /// @return the URL that streams the file content
    String url();

    /// @return the declared size in bytes
    long size();

    /// @return the declared checksum, or null if the hub declared none in a supported algorithm
    Checksum checksum();
}
