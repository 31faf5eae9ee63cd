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

import java.util.Map;

/// Outcome of a batch download.
///
/// Every requested id has a status. Failed products have an exception, downloaded products a
/// {@link ResolvedProduct}.
///
/// @param statuses the final status per product id
/// @param exceptions the last failure per product id
/// @param products the downloaded products per id
public record BatchResult(
    Map<String, DownloadStatus> statuses,
    Map<String, Exception> exceptions,
    Map<String, ResolvedProduct> products
) {
    public BatchResult {
        statuses = Map.copyOf(statuses);
        exceptions = Map.copyOf(exceptions);
        products = Map.copyOf(products);
    }

    /// @return an empty result
    public static BatchResult empty() {
        return new BatchResult(Map.of(), Map.of(), Map.of());
    }

    /// @param id a product id
    /// @return true if the product was downloaded
    public boolean isDownloaded(String id) {
        DownloadStatus status = statuses.get(id);
        return status != null && status.isSuccessful();
    }

    /// @return the number of downloaded products
    public long downloadedCount() {
        return statuses.values().stream().filter(DownloadStatus::isSuccessful).count();
    }
}
