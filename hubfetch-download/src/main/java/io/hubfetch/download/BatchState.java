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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/// Shared state of one {@link Downloader#downloadAll} call.
///
/// Workers only move statuses forward through {@link #advance}. The discovery phases set the
/// starting status of each product directly with {@link #initialize}.
class BatchState {
    private final Map<String, DownloadStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, Exception> exceptions = new ConcurrentHashMap<>();
    private final Map<String, ResolvedProduct> products = new ConcurrentHashMap<>();
    private final AtomicReference<Exception> lastError = new AtomicReference<>();
    private final AtomicInteger retrieved = new AtomicInteger();
    private final StopSignal stop = new StopSignal();

    void initialize(String id, DownloadStatus status) {
        statuses.put(id, status);
    }

    /// @return true if the status changed
    boolean advance(String id, DownloadStatus next) {
        boolean[] changed = new boolean[1];
        statuses.compute(id, (key, current) -> {
            if (current == null || current.canAdvanceTo(next)) {
                changed[0] = current != next;
                return next;
            }
            return current;
        });
        return changed[0];
    }

    DownloadStatus status(String id) {
        return statuses.get(id);
    }

    void recordFailure(String id, Exception error) {
        exceptions.put(id, error);
        lastError.set(error);
    }

    void recordDownload(ResolvedProduct product) {
        products.put(product.id(), product);
        exceptions.remove(product.id());
        advance(product.id(), DownloadStatus.DOWNLOADED);
    }

    /// @return the number of archived products that came online so far
    int recordRetrieval() {
        return retrieved.incrementAndGet();
    }

    int downloadedCount() {
        return products.size();
    }

    int size() {
        return statuses.size();
    }

    boolean hasFailed(String id) {
        return exceptions.containsKey(id);
    }

    boolean anyDownloaded() {
        return statuses.values().stream().anyMatch(DownloadStatus::isSuccessful);
    }

    Exception lastError() {
        return lastError.get();
    }

    StopSignal stop() {
        return stop;
    }

    BatchResult toResult() {
        return new BatchResult(statuses, exceptions, products);
    }
}
