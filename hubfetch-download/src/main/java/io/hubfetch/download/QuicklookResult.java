package io.hubfetch.download;

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

import java.nio.file.Path;

/// Outcome of one quicklook download.
///
/// @param productId the product id
/// @param title the product title
/// @param path where the image is or would have been written
/// @param downloadedBytes the number of bytes written, 0 if the file already existed
/// @param error why the quicklook could not be downloaded, or null on success
public record QuicklookResult(String productId, String title, Path path, long downloadedBytes, String error) {

    /// @return true if the image is on disk
    public boolean isSuccessful() {
        return error == null;
    }
}
