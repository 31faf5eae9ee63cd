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

/// A server declared checksum.
///
/// @param algorithm the digest algorithm
/// @param hexDigest the expected digest as hex, in either case
public record Checksum(ChecksumAlgorithm algorithm, String hexDigest) {
    public Checksum {
        if (algorithm == null) throw new IllegalArgumentException("Checksum algorithm is required");
        if (hexDigest == null || hexDigest.isBlank()) throw new IllegalArgumentException("Checksum digest is required");
    }

    /// Compares a computed digest with this checksum, ignoring case.
    ///
    /// @param actualHex the computed digest as hex
    /// @return true if both digests are equal
    public boolean matches(String actualHex) {
        return actualHex != null && hexDigest.trim().toLowerCase(Locale.ROOT).equals(actualHex.toLowerCase(Locale.ROOT));
    }

    /// Creates a checksum from the algorithm name and value as the hub reports them.
    ///
    /// @param algorithmName the hub's algorithm name
    /// @param value the digest
    /// @return the checksum, or null if the algorithm is not supported or the value is missing
    public static Checksum ofHubValues(String algorithmName, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ChecksumAlgorithm.fromHubName(algorithmName)
            .map(algorithm -> new Checksum(algorithm, value.trim()))
            .orElse(null);
    }
}
