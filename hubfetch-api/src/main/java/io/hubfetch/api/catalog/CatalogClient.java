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

import java.io.IOException;

/// The narrow view of the remote catalog that the download core depends on.
///
/// Implementations report hub failures with the types in {@link io.hubfetch.api.errors},
/// distinguishing a missing product ({@link io.hubfetch.api.errors.NotFoundException}),
/// rejected credentials ({@link io.hubfetch.api.errors.UnauthorizedException}) and
/// server trouble ({@link io.hubfetch.api.errors.ServerErrorException}).
public interface CatalogClient {

    /// Reads the metadata of one product.
    ///
    /// @param id the product id
    /// @return the product descriptor
    /// @throws IOException if the catalog cannot be reached
    ProductDescriptor getProductMetadata(String id) throws IOException;

    /// @param id the product id
    /// @return true if the product is resident in fast storage, false if it is archived
    /// @throws IOException if the catalog cannot be reached
    boolean isOnline(String id) throws IOException;

    /// Determines the file name the product archive is stored under locally.
    /// This may require a request to the hub.
    ///
    /// @param product the product
    /// @return the file name, without directory
    /// @throws IOException if the hub cannot be reached
    String resolveLocalFilename(ProductDescriptor product) throws IOException;

    /// Describes the manifest file of a product package. The manifest carries no checksum.
    ///
    /// @param product the product
    /// @return the manifest node
    /// @throws IOException if the hub cannot be reached
    NodeDescriptor getManifestNode(ProductDescriptor product) throws IOException;

    /// @param product the owning product
    /// @param nodePath the path of a node inside the product package
    /// @return the URL that streams the node content
    String nodeUrl(ProductDescriptor product, String nodePath);
}
