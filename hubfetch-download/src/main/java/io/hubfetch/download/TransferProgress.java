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

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/// Progress of reading or writing one file.
///
/// @param path the file being written or verified
/// @param totalBytes the declared size of the file
/// @param currentBytes the number of bytes handled so far, including bytes kept from an earlier attempt
public record TransferProgress(
    Path path,
    long totalBytes,
    AtomicLong currentBytes
) {
    /// @param path the file being written or verified
    /// @param totalBytes the declared size of the file
    /// @param startBytes the number of bytes already present
    /// @return a progress tracker starting at startBytes
    public static TransferProgress of(Path path, long totalBytes, long startBytes) {
        return new TransferProgress(path, totalBytes, new AtomicLong(startBytes));
    }

    /// @return the number of bytes handled so far
    public long getCurrentBytes() {
        return currentBytes.get();
    }

    /// @return a value between 0.0 and 1.0, 1.0 for empty files
    public double getProgress() {
        return totalBytes > 0 ? (double) currentBytes.get() / totalBytes : 1.0;
    }

    /// @return true once every declared byte was handled
    public boolean isDone() {
        return currentBytes.get() >= totalBytes;
    }
}
