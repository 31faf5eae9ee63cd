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

import java.util.Locale;
import java.util.Optional;

/// Digest algorithms the hub declares for products and product nodes.
public enum ChecksumAlgorithm {
    MD5("MD5", "MD5"),
    SHA3_256("SHA3-256", "SHA3-256");

    private final String hubName;
    private final String digestName;

    ChecksumAlgorithm(String hubName, String digestName) {
        this.hubName = hubName;
        this.digestName = digestName;
    }

    /// @return the name used by the hub, e.g. in manifests and OData responses
    public String getHubName() {
        return hubName;
    }

    /// @return the standard {@link java.security.MessageDigest} algorithm name
    public String getDigestName() {
        return digestName;
    }

    /// Looks up an algorithm by the name the hub uses for it, ignoring case.
    ///
    /// @param name the hub's algorithm name, for example `md5` or `SHA3-256`
    /// @return the algorithm, or empty if it is not supported
    public static Optional<ChecksumAlgorithm> fromHubName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ChecksumAlgorithm algorithm : values()) {
            if (algorithm.hubName.equals(normalized)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}
