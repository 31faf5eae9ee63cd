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

/// Metadata of one product as read from the catalog.
///
/// Descriptors are immutable. The only attribute that changes during a download run is the
/// online flag, and that change produces a new descriptor via {@link #withOnline(boolean)}.
///
/// @param id the product identifier, stable across archive states
/// @param title the product name, used for local file names
/// @param size the declared size of the product archive in bytes
/// @param checksum the declared checksum, or null
/// @param online whether the product is resident in fast storage
/// @param url the URL that streams the product archive
/// @param quicklookUrl the URL of the product's quicklook image, or null
public record ProductDescriptor(
    String id,
    String title,
    long size,
    Checksum checksum,
    boolean online,
    String url,
    String quicklookUrl
) implements Transferable {
    public ProductDescriptor {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Product id is required");
        if (title == null || title.isBlank()) throw new IllegalArgumentException("Product title is required");
        if (size < 0) throw new IllegalArgumentException("Product size cannot be negative: " + size);
        if (url == null || url.isBlank()) throw new IllegalArgumentException("Product url is required");
    }

    /// @param online the re-derived online flag
    /// @return a copy of this descriptor with the given online flag
    public ProductDescriptor withOnline(boolean online) {
        if (online == this.online) {
            return this;
        }
        return new ProductDescriptor(id, title, size, checksum, online, url, quicklookUrl);
    }
}
