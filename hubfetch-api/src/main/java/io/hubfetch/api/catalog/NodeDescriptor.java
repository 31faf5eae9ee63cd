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

/// One file inside a multi-file product package, as listed by the product manifest.
///
/// @param productId the owning product's id
/// @param nodePath the path inside the package as written in the manifest, e.g. `./preview/quick-look.png`
/// @param size the declared size in bytes
/// @param checksum the declared checksum, or null
/// @param url the URL that streams the node content
public record NodeDescriptor(
    String productId,
    String nodePath,
    long size,
    Checksum checksum,
    String url
) implements Transferable {
    public NodeDescriptor {
        if (productId == null) throw new IllegalArgumentException("Owning product id is required");
        if (nodePath == null || nodePath.isBlank()) throw new IllegalArgumentException("Node path is required");
        if (size < 0) throw new IllegalArgumentException("Node size cannot be negative: " + size);
        if (url == null || url.isBlank()) throw new IllegalArgumentException("Node url is required");
    }

    /// @return the node path without a leading `./`
    public String relativePath() {
        return nodePath.startsWith("./") ? nodePath.substring(2) : nodePath;
    }
}
