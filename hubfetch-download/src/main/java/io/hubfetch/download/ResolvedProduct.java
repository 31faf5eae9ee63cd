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

import io.hubfetch.api.catalog.NodeDescriptor;
import io.hubfetch.api.catalog.ProductDescriptor;

import java.nio.file.Path;
import java.util.Map;

/// A product after a successful download.
///
/// @param descriptor the product metadata, with the online flag as observed during the run
/// @param path the downloaded archive, or the product directory in node mode
/// @param downloadedBytes the number of bytes transferred by this run
/// @param nodes the nodes written in node mode keyed by node path, including the manifest; empty otherwise
public record ResolvedProduct(
    ProductDescriptor descriptor,
    Path path,
    long downloadedBytes,
    Map<String, NodeDescriptor> nodes
) {
    public ResolvedProduct {
        if (descriptor == null) throw new IllegalArgumentException("Product descriptor is required");
        if (path == null) throw new IllegalArgumentException("Product path is required");
        nodes = nodes == null ? Map.of() : Map.copyOf(nodes);
    }

    /// @return the product id
    public String id() {
        return descriptor.id();
    }
}
