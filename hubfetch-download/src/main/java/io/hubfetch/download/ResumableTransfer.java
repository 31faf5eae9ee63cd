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

import io.hubfetch.api.catalog.Transferable;
import io.hubfetch.api.errors.InvalidChecksumException;
import io.hubfetch.api.errors.ServerErrorException;
import io.hubfetch.api.transport.ByteRange;
import io.hubfetch.api.transport.TransferClient;
import io.hubfetch.api.transport.TransferResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/// Transfers one file from the hub into place, resuming where an earlier attempt stopped.
///
/// Data is written to `<path>.incomplete` and renamed to `<path>` only when complete and, if
/// requested, verified. The suffix is what makes a later run, possibly in another process,
/// continue instead of starting over, so it must not change.
///
/// Existing state is handled as follows:
/// - `<path>` exists: nothing is transferred and the file is not verified again
/// - the incomplete file is larger than the declared size: it is deleted and the transfer restarts
/// - it has exactly the declared size: it is verified (if enabled) and promoted, or deleted on mismatch
/// - it is smaller: the transfer continues with a `Range: bytes=<size>-` request
public class ResumableTransfer {
    private static final Logger logger = LogManager.getLogger(ResumableTransfer.class);

    /// Suffix of files that are still being transferred
    public static final String INCOMPLETE_SUFFIX = ".incomplete";
    /// Default chunk size (1MB)
    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    private final TransferClient client;
    private final ConcurrencyLimiter limiter;
    private final ChecksumVerifier verifier;
    private final int chunkSize;

    /// @param client the transfer client
    /// @param limiter the limiter that gates each request and chunk read
    /// @param verifier the checksum verifier
    public ResumableTransfer(TransferClient client, ConcurrencyLimiter limiter, ChecksumVerifier verifier) {
        this(client, limiter, verifier, DEFAULT_CHUNK_SIZE);
    }

    /// @param client the transfer client
    /// @param limiter the limiter that gates each request and chunk read
    /// @param verifier the checksum verifier
    /// @param chunkSize the number of bytes read per permit
    public ResumableTransfer(TransferClient client, ConcurrencyLimiter limiter, ChecksumVerifier verifier, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.client = client;
        this.limiter = limiter;
        this.verifier = verifier;
        this.chunkSize = chunkSize;
    }

    /// @param path a final file path
    /// @return the path the file is written to while incomplete
    public static Path incompletePath(Path path) {
        return path.resolveSibling(path.getFileName().toString() + INCOMPLETE_SUFFIX);
    }

    /// Transfers a file to the given path.
    ///
    /// @param target what to transfer
    /// @param path the final file path
    /// @param verifyChecksum whether to verify the completed file against the declared checksum
    /// @param stop the batch stop signal, checked before every chunk
    /// @return the number of bytes transferred by this call, 0 if the file was already complete
    /// @throws InvalidChecksumException if the completed file does not match its checksum
    /// @throws io.hubfetch.api.errors.ChecksumUnavailableException if verification is requested but no checksum is declared
    /// @throws io.hubfetch.api.errors.DownloadCancelledException if the stop signal is set mid transfer
    /// @throws IOException if reading from the hub or writing locally fails
    /// @throws InterruptedException if interrupted while waiting for a permit
    public long transfer(Transferable target, Path path, boolean verifyChecksum, StopSignal stop)
        throws IOException, InterruptedException {
        return transfer(target, path, verifyChecksum, stop, ProgressListener.NONE);
    }

    /// Transfers a file to the given path, reporting progress.
    ///
    /// @param target what to transfer
    /// @param path the final file path
    /// @param verifyChecksum whether to verify the completed file against the declared checksum
    /// @param stop the batch stop signal, checked before every chunk
    /// @param progress receives the progress of the transfer and of the verification
    /// @return the number of bytes transferred by this call, 0 if the file was already complete
    /// @throws InvalidChecksumException if the completed file does not match its checksum
    /// @throws IOException if reading from the hub or writing locally fails
    /// @throws InterruptedException if interrupted while waiting for a permit
    public long transfer(Transferable target, Path path, boolean verifyChecksum, StopSignal stop,
                         ProgressListener progress) throws IOException, InterruptedException {
        if (Files.exists(path)) {
            logger.debug("{} already exists, skipping transfer", path);
            return 0;
        }

        Path temp = incompletePath(path);
        boolean complete = false;
        if (Files.exists(temp)) {
            long size = Files.size(temp);
            if (size > target.size()) {
                logger.warn("Existing incomplete file {} is larger than the expected final size ({} vs {} bytes). Deleting it.",
                    temp, size, target.size());
                Files.delete(temp);
            } else if (size == target.size()) {
                if (verifyChecksum && !verify(target, temp, progress)) {
                    logger.warn("Existing incomplete file {} appears to be fully downloaded but its checksum is incorrect. Deleting it.",
                        temp);
                    Files.delete(temp);
                } else {
                    complete = true;
                }
            } else if (size > 0) {
                logger.info("Download will resume from existing incomplete file {} at byte {}.", temp, size);
            }
        }

        long transferred = 0;
        if (!complete) {
            Path parent = temp.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            transferred = fetchInto(target, temp, stop, progress);

            long finalSize = Files.size(temp);
            if (finalSize != target.size()) {
                throw new ServerErrorException("Transfer of " + path.getFileName() + " ended after " + finalSize
                    + " of " + target.size() + " bytes");
            }
            if (verifyChecksum && !verify(target, temp, progress)) {
                Files.delete(temp);
                throw new InvalidChecksumException("File corrupt: checksums do not match for " + path.getFileName());
            }
        }

        promote(temp, path);
        return transferred;
    }

    private boolean verify(Transferable target, Path temp, ProgressListener progress) throws IOException {
        TransferProgress hashed = TransferProgress.of(temp, target.size(), 0);
        return verifier.verify(temp, target.checksum(), bytes -> {
            hashed.currentBytes().set(bytes);
            progress.onVerify(hashed);
        });
    }

    private long fetchInto(Transferable target, Path temp, StopSignal stop, ProgressListener progress)
        throws IOException, InterruptedException {
        long existing = Files.exists(temp) ? Files.size(temp) : 0;
        ByteRange range = existing > 0 ? ByteRange.from(existing) : null;
        String what = "Download of " + temp.getFileName();

        stop.throwIfSet(what);
        TransferResponse response = limiter.withTransferPermit(() -> client.get(target.url(), range));
        try (response) {
            if (!response.isSuccessful()) {
                throw response.toException(what);
            }
            boolean append = existing > 0 && response.statusCode() == 206;
            if (existing > 0 && !append) {
                logger.warn("Server answered the range request for {} with HTTP {}, restarting from zero",
                    target.url(), response.statusCode());
            }
            logger.debug("Transferring {} into {} from byte {}", target.url(), temp, append ? existing : 0);

            TransferProgress written = TransferProgress.of(temp, target.size(), append ? existing : 0);
            InputStream in = response.body();
            byte[] chunk = new byte[chunkSize];
            long transferred = 0;
            try (OutputStream out = Files.newOutputStream(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING)) {
                while (true) {
                    stop.throwIfSet(what);
                    int read = limiter.withTransferPermit(() -> in.readNBytes(chunk, 0, chunk.length));
                    if (read <= 0) {
                        break;
                    }
                    out.write(chunk, 0, read);
                    transferred += read;
                    written.currentBytes().addAndGet(read);
                    progress.onTransfer(written);
                    logger.trace("{}: {} bytes written", temp.getFileName(), transferred);
                }
            }
            logger.debug("Transferred {} bytes into {}", transferred, temp);
            return transferred;
        }
    }

    private static void promote(Path temp, Path path) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
