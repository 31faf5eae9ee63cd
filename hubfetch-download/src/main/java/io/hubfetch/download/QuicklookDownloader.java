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
import io.hubfetch.api.errors.DataHubException;
import io.hubfetch.api.errors.DownloadCancelledException;
import io.hubfetch.api.errors.UnauthorizedException;
import io.hubfetch.api.transport.TransferClient;
import io.hubfetch.api.transport.TransferResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/// Downloads the JPEG preview images of products.
///
/// Images are written as `<title>.jpeg`. Requests count against the transfer quota of the
/// limiter they are given.
public class QuicklookDownloader {
    private static final Logger logger = LogManager.getLogger(QuicklookDownloader.class);

    static final String JPEG = "image/jpeg";

    private final CatalogClient catalog;
    private final TransferClient client;
    private final ConcurrencyLimiter limiter;
    private final int workers;

    /// Outcome of {@link #downloadAllQuicklooks}.
    ///
    /// @param downloaded the successful downloads per product id
    /// @param failed the reason per product id for quicklooks that could not be downloaded
    public record Batch(Map<String, QuicklookResult> downloaded, Map<String, String> failed) {
        public Batch {
            downloaded = Map.copyOf(downloaded);
            failed = Map.copyOf(failed);
        }
    }

    /// @param catalog the product catalog
    /// @param client the transfer client
    /// @param limiter the limiter gating the requests
    /// @param workers the number of concurrent quicklook downloads
    public QuicklookDownloader(CatalogClient catalog, TransferClient client, ConcurrencyLimiter limiter, int workers) {
        this.catalog = catalog;
        this.client = client;
        this.limiter = limiter;
        this.workers = workers;
    }

    /// Downloads the quicklook of one product.
    ///
    /// An existing image file is kept without a request. A response that is not a JPEG image is
    /// reported in the result and nothing is written.
    ///
    /// @param id the product id
    /// @param directory the target directory
    /// @return the outcome
    /// @throws DataHubException if the hub refused the metadata or image request
    /// @throws IOException if the hub cannot be reached or the file cannot be written
    public QuicklookResult downloadQuicklook(String id, Path directory) throws IOException {
        ProductDescriptor product = catalog.getProductMetadata(id);
        Path path = directory.resolve(product.title() + ".jpeg");
        if (product.quicklookUrl() == null) {
            return new QuicklookResult(id, product.title(), path, 0, "No quicklook available");
        }
        logger.info("Downloading quicklook {} to {}", product.title(), path);
        if (Files.exists(path)) {
            return new QuicklookResult(id, product.title(), path, 0, null);
        }

        byte[] content;
        String contentType;
        try {
            TransferResponse response = limiter.withTransferPermit(() -> client.get(product.quicklookUrl(), null));
            try (response) {
                if (!response.isSuccessful()) {
                    throw response.toException("Quicklook download for " + id);
                }
                contentType = response.header("Content-Type").orElse("");
                try (InputStream in = response.body()) {
                    content = in.readAllBytes();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Quicklook download for " + id + " was interrupted", e);
        }

        if (!isJpeg(contentType)) {
            return new QuicklookResult(id, product.title(), path, 0, "Quicklook is not jpeg but " + contentType);
        }
        Files.createDirectories(directory);
        Files.write(path, content);
        return new QuicklookResult(id, product.title(), path, content.length, null);
    }

    /// Downloads the quicklooks of several products concurrently.
    ///
    /// @param ids the product ids, duplicates are ignored
    /// @param directory the target directory
    /// @return the downloaded and failed quicklooks
    /// @throws UnauthorizedException if the credentials were rejected
    public Batch downloadAllQuicklooks(Collection<String> ids, Path directory) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(ids));
        logger.info("Will download {} quicklooks", unique.size());
        Map<String, QuicklookResult> downloaded = new LinkedHashMap<>();
        Map<String, String> failed = new LinkedHashMap<>();
        if (unique.isEmpty()) {
            return new Batch(downloaded, failed);
        }

        ExecutorService pool = WorkerThreads.newPool("quicklook", Math.min(workers, unique.size()));
        try {
            Map<String, Future<QuicklookResult>> tasks = new LinkedHashMap<>();
            for (String id : unique) {
                tasks.put(id, pool.submit(() -> downloadQuicklook(id, directory)));
            }
            for (Map.Entry<String, Future<QuicklookResult>> task : tasks.entrySet()) {
                String id = task.getKey();
                try {
                    QuicklookResult result = task.getValue().get();
                    if (result.isSuccessful()) {
                        downloaded.put(id, result);
                    } else {
                        failed.put(id, result.error());
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof UnauthorizedException) {
                        throw (UnauthorizedException) cause;
                    }
                    logger.error("Quicklook download for {} failed: {}", id, cause.toString());
                    failed.put(id, String.valueOf(cause.getMessage()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Quicklook downloads were interrupted", e);
        } finally {
            pool.shutdownNow();
        }
        return new Batch(downloaded, failed);
    }

    private static boolean isJpeg(String contentType) {
        int semicolon = contentType.indexOf(';');
        String mime = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return JPEG.equals(mime.trim().toLowerCase(Locale.ROOT));
    }
}
