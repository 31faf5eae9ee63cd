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

import io.hubfetch.api.catalog.CatalogClient;
import io.hubfetch.api.catalog.ProductDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/// Checks previously downloaded product archives against the catalog.
///
/// A file is intact when its size and checksum match the product metadata. Missing files count
/// as corrupt. Files of products without a declared checksum are checked by size only.
public class FileIntegrityChecker {
    private static final Logger logger = LogManager.getLogger(FileIntegrityChecker.class);

    private final CatalogClient catalog;
    private final ChecksumVerifier verifier;

    /// @param catalog the product catalog
    /// @param verifier the checksum verifier
    public FileIntegrityChecker(CatalogClient catalog, ChecksumVerifier verifier) {
        this.catalog = catalog;
        this.verifier = verifier;
    }

    /// Checks the archives of the given products in a directory.
    ///
    /// @param ids the product ids
    /// @param directory the directory holding the archives
    /// @param delete whether to delete corrupt files that exist
    /// @return the missing or corrupt files with the product they belong to
    /// @throws IOException if the catalog cannot be reached or a file cannot be read
    public Map<Path, ProductDescriptor> checkFiles(Collection<String> ids, Path directory, boolean delete)
        throws IOException {
        Map<Path, ProductDescriptor> corrupt = new LinkedHashMap<>();
        for (String id : new LinkedHashSet<>(ids)) {
            ProductDescriptor product = catalog.getProductMetadata(id);
            Path path = directory.resolve(catalog.resolveLocalFilename(product));
            if (!Files.exists(path)) {
                logger.info("{} does not exist on disk", path);
                corrupt.put(path, product);
                continue;
            }
            if (!isIntact(path, product)) {
                logger.info("{} is corrupt", path);
                corrupt.put(path, product);
                if (delete) {
                    Files.delete(path);
                    logger.info("Deleted corrupt file {}", path);
                }
            }
        }
        return corrupt;
    }

    private boolean isIntact(Path path, ProductDescriptor product) throws IOException {
        if (Files.size(path) != product.size()) {
            return false;
        }
        if (product.checksum() == null) {
            logger.warn("No checksum declared for {}, checked size only", product.title());
            return true;
        }
        return verifier.verify(path, product.checksum());
    }
}
