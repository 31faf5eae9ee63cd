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

import io.hubfetch.download.nodes.NodeFilter;

import java.nio.file.Path;
import java.time.Duration;

/// Settings of one download run.
///
/// A {@link Downloader} holds a base configuration. Individual calls may pass a derived copy,
/// typically built with {@link #toBuilder()}, so per call overrides never leak into other runs.
///
/// @param directory the directory products are written to
/// @param nodeFilter selects the files of a product package to download, or null to download whole archives
/// @param verifyChecksum whether to verify each completed file against its declared checksum
/// @param failFast whether the first product failure aborts the whole batch
/// @param maxAttempts the number of transfer attempts per product, at least 1
/// @param maxConcurrentTransfers the number of concurrent transfer connections
/// @param maxConcurrentTriggers the number of concurrent archive retrieval requests
/// @param ltaRetryDelay the delay between archive retrieval requests and online polls
/// @param downloadRetryDelay the delay before a failed transfer is retried
/// @param ltaTimeout the longest time to wait for an archived product, or null for no limit
/// @param progress receives transfer, verification and batch progress
public record DownloadConfig(
    Path directory,
    NodeFilter nodeFilter,
    boolean verifyChecksum,
    boolean failFast,
    int maxAttempts,
    int maxConcurrentTransfers,
    int maxConcurrentTriggers,
    Duration ltaRetryDelay,
    Duration downloadRetryDelay,
    Duration ltaTimeout,
    ProgressListener progress
) {
    public DownloadConfig {
        if (directory == null) throw new IllegalArgumentException("Download directory is required");
        if (maxAttempts < 1) throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        if (maxConcurrentTransfers <= 0) throw new IllegalArgumentException("Concurrent transfers must be positive");
        if (maxConcurrentTriggers <= 0) throw new IllegalArgumentException("Concurrent triggers must be positive");
        if (ltaRetryDelay == null || ltaRetryDelay.isNegative()) throw new IllegalArgumentException("LTA retry delay is required");
        if (downloadRetryDelay == null || downloadRetryDelay.isNegative()) throw new IllegalArgumentException("Download retry delay is required");
        if (ltaTimeout != null && (ltaTimeout.isNegative() || ltaTimeout.isZero())) {
            throw new IllegalArgumentException("LTA timeout must be positive when set");
        }
        if (progress == null) {
            progress = ProgressListener.NONE;
        }
    }

    /// @return true if products are downloaded file by file from their manifest
    public boolean isNodeMode() {
        return nodeFilter != null;
    }

    /// @return a builder with the default settings, writing to the working directory
    public static Builder builder() {
        return new Builder();
    }

    /// @return the default settings, writing to the working directory
    public static DownloadConfig defaults() {
        return builder().build();
    }

    /// @return a builder initialized from this configuration
    public Builder toBuilder() {
        return new Builder()
            .directory(directory)
            .nodeFilter(nodeFilter)
            .verifyChecksum(verifyChecksum)
            .failFast(failFast)
            .maxAttempts(maxAttempts)
            .maxConcurrentTransfers(maxConcurrentTransfers)
            .maxConcurrentTriggers(maxConcurrentTriggers)
            .ltaRetryDelay(ltaRetryDelay)
            .downloadRetryDelay(downloadRetryDelay)
            .ltaTimeout(ltaTimeout)
            .progress(progress);
    }

    /// Fluent builder for {@link DownloadConfig}.
    public static class Builder {
        private Path directory = Path.of(".");
        private NodeFilter nodeFilter;
        private boolean verifyChecksum = true;
        private boolean failFast = false;
        private int maxAttempts = 10;
        private int maxConcurrentTransfers = 2;
        private int maxConcurrentTriggers = 1;
        private Duration ltaRetryDelay = Duration.ofSeconds(60);
        private Duration downloadRetryDelay = Duration.ofSeconds(10);
        private Duration ltaTimeout;
        private ProgressListener progress = ProgressListener.NONE;

        /// @param directory the directory products are written to
        /// @return this builder for method chaining
        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        /// @param nodeFilter the node filter, or null to download whole archives
        /// @return this builder for method chaining
        public Builder nodeFilter(NodeFilter nodeFilter) {
            this.nodeFilter = nodeFilter;
            return this;
        }

        /// @param verifyChecksum whether to verify completed files
        /// @return this builder for method chaining
        public Builder verifyChecksum(boolean verifyChecksum) {
            this.verifyChecksum = verifyChecksum;
            return this;
        }

        /// @param failFast whether the first failure aborts the batch
        /// @return this builder for method chaining
        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        /// @param maxAttempts the number of transfer attempts per product
        /// @return this builder for method chaining
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /// @param maxConcurrentTransfers the number of concurrent transfer connections
        /// @return this builder for method chaining
        public Builder maxConcurrentTransfers(int maxConcurrentTransfers) {
            this.maxConcurrentTransfers = maxConcurrentTransfers;
            return this;
        }

        /// @param maxConcurrentTriggers the number of concurrent archive retrieval requests
        /// @return this builder for method chaining
        public Builder maxConcurrentTriggers(int maxConcurrentTriggers) {
            this.maxConcurrentTriggers = maxConcurrentTriggers;
            return this;
        }

        /// @param ltaRetryDelay the delay between retrieval requests and online polls
        /// @return this builder for method chaining
        public Builder ltaRetryDelay(Duration ltaRetryDelay) {
            this.ltaRetryDelay = ltaRetryDelay;
            return this;
        }

        /// @param downloadRetryDelay the delay before a failed transfer is retried
        /// @return this builder for method chaining
        public Builder downloadRetryDelay(Duration downloadRetryDelay) {
            this.downloadRetryDelay = downloadRetryDelay;
            return this;
        }

        /// @param ltaTimeout the longest time to wait for an archived product, or null for no limit
        /// @return this builder for method chaining
        public Builder ltaTimeout(Duration ltaTimeout) {
            this.ltaTimeout = ltaTimeout;
            return this;
        }

        /// @param progress the progress listener, or null to ignore progress
        /// @return this builder for method chaining
        public Builder progress(ProgressListener progress) {
            this.progress = progress;
            return this;
        }

        /// @return the configuration
        /// @throws IllegalArgumentException if a setting is invalid
        public DownloadConfig build() {
            return new DownloadConfig(directory, nodeFilter, verifyChecksum, failFast, maxAttempts,
                maxConcurrentTransfers, maxConcurrentTriggers, ltaRetryDelay, downloadRetryDelay, ltaTimeout, progress);
        }
    }
}
