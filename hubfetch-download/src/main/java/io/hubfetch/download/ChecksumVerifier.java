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

import io.hubfetch.api.catalog.Checksum;
import io.hubfetch.api.catalog.ChecksumAlgorithm;
import io.hubfetch.api.errors.ChecksumUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.function.LongConsumer;

/// Verifies local files against server declared checksums.
///
/// Files are streamed through the digest in fixed size blocks and are never held in memory.
public class ChecksumVerifier {
    private static final Logger logger = LogManager.getLogger(ChecksumVerifier.class);

    /// Read block size (8KB)
    static final int BLOCK_SIZE = 8192;

    /// Compares the digest of a file with the expected checksum.
    ///
    /// @param file the file to check
    /// @param expected the declared checksum, or null if the hub declared none
    /// @return true if the digests match, ignoring case
    /// @throws ChecksumUnavailableException if no supported checksum is available
    /// @throws IOException if the file cannot be read
    public boolean verify(Path file, Checksum expected) throws IOException {
        return verify(file, expected, null);
    }

    /// Compares the digest of a file with the expected checksum, reporting progress.
    ///
    /// @param file the file to check
    /// @param expected the declared checksum, or null if the hub declared none
    /// @param progress receives the running count of bytes hashed, may be null
    /// @return true if the digests match, ignoring case
    /// @throws ChecksumUnavailableException if no supported checksum is available
    /// @throws IOException if the file cannot be read
    public boolean verify(Path file, Checksum expected, LongConsumer progress) throws IOException {
        if (expected == null) {
            throw new ChecksumUnavailableException(
                "No MD5 or SHA3-256 checksum available to verify " + file.getFileName());
        }
        String actual = digestHex(file, expected.algorithm(), progress);
        boolean matches = expected.matches(actual);
        if (!matches) {
            logger.debug("{} checksum of {} is {}, expected {}",
                expected.algorithm().getHubName(), file, actual, expected.hexDigest());
        }
        return matches;
    }

    /// Computes the hex digest of a file.
    ///
    /// @param file the file to hash
    /// @param algorithm the digest algorithm
    /// @param progress receives the running count of bytes hashed, may be null
    /// @return the lower case hex digest
    /// @throws IOException if the file cannot be read
    public static String digestHex(Path file, ChecksumAlgorithm algorithm, LongConsumer progress) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        byte[] block = new byte[BLOCK_SIZE];
        long hashed = 0;
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(block)) != -1) {
                digest.update(block, 0, read);
                hashed += read;
                if (progress != null) {
                    progress.accept(hashed);
                }
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest(ChecksumAlgorithm algorithm) {
        try {
            return MessageDigest.getInstance(algorithm.getDigestName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest " + algorithm.getDigestName() + " is not available in this JVM", e);
        }
    }
}
