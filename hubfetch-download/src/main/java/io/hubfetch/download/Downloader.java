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
import io.hubfetch.api.catalog.NodeDescriptor;
import io.hubfetch.api.catalog.ProductDescriptor;
import io.hubfetch.api.errors.ChecksumUnavailableException;
import io.hubfetch.api.errors.DataHubException;
import io.hubfetch.api.errors.DownloadCancelledException;
import io.hubfetch.api.errors.InvalidChecksumException;
import io.hubfetch.api.errors.UnauthorizedException;
import io.hubfetch.api.transport.TransferClient;
import io.hubfetch.download.nodes.ManifestParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/// Downloads products from the hub, retrieving archived ones from the Long Term Archive first.
///
/// A batch run ({@link #downloadAll}) works in four phases:
/// 1. metadata of every product is read and each is marked online or offline
/// 2. products already present in the download directory are marked downloaded without any
///    retrieval or transfer, so they use up no archive quota
/// 3. download workers and retrieval workers run in two separate pools, so waiting for archived
///    products can never occupy every download thread. A download worker for an archived product
///    waits until its retrieval worker reports it online
/// 4. the calling thread collects what the workers report and updates the batch state
///
/// All requests share the instance's {@link ConcurrencyLimiter}, which is sized from the base
/// configuration and can be changed while downloads run with {@link #resizeQuotas}. The
/// concurrency settings of a per call configuration size that call's worker pools.
public class Downloader {
    private static final Logger logger = LogManager.getLogger(Downloader.class);

    /// How often a waiting download worker checks the stop signal
    static final Duration GATE_POLL_INTERVAL = Duration.ofMillis(250);
    /// How long an aborted batch waits for its workers to wind down
    static final Duration ABORT_GRACE = Duration.ofSeconds(10);

    static final String MANIFEST_NAME = "manifest.safe";
    static final String PRODUCT_DIR_SUFFIX = ".SAFE";

    private final CatalogClient catalog;
    private final TransferClient client;
    private final DownloadConfig config;
    private final ConcurrencyLimiter limiter;
    private final ChecksumVerifier verifier;
    private final ResumableTransfer transfer;
    private final RetrievalTrigger trigger;
    private final ManifestParser manifestParser;

    /// @param catalog the product catalog
    /// @param client the transfer client
    public Downloader(CatalogClient catalog, TransferClient client) {
        this(catalog, client, DownloadConfig.defaults());
    }

    /// @param catalog the product catalog
    /// @param client the transfer client
    /// @param config the base configuration
    public Downloader(CatalogClient catalog, TransferClient client, DownloadConfig config) {
        this.catalog = catalog;
        this.client = client;
        this.config = config;
        this.limiter = new ConcurrencyLimiter(config.maxConcurrentTransfers(), config.maxConcurrentTriggers());
        this.verifier = new ChecksumVerifier();
        this.transfer = new ResumableTransfer(client, limiter, verifier);
        this.trigger = new RetrievalTrigger(catalog, client, limiter);
        this.manifestParser = new ManifestParser(catalog);
    }

    /// @return the base configuration
    public DownloadConfig getConfig() {
        return config;
    }

    /// @return the limiter shared by all requests of this downloader
    public ConcurrencyLimiter getLimiter() {
        return limiter;
    }

    /// Changes the request quotas. Requests already holding a permit are not affected.
    ///
    /// @param maxTransfers the new number of concurrent transfer connections
    /// @param maxTriggers the new number of concurrent archive retrieval requests
    public void resizeQuotas(int maxTransfers, int maxTriggers) {
        limiter.resizeTransfers(maxTransfers);
        limiter.resizeTriggers(maxTriggers);
        logger.info("Request quotas set to {} transfers and {} retrieval requests", maxTransfers, maxTriggers);
    }

    /// @return a quicklook downloader sharing this downloader's quotas
    public QuicklookDownloader quicklookDownloader() {
        return new QuicklookDownloader(catalog, client, limiter, config.maxConcurrentTransfers());
    }

    /// @return an integrity checker for files downloaded by this downloader
    public FileIntegrityChecker integrityChecker() {
        return new FileIntegrityChecker(catalog, verifier);
    }

    /// Downloads products with the base configuration.
    ///
    /// @param ids the product ids, duplicates are ignored
    /// @return the outcome per product
    /// @throws IOException see {@link #downloadAll(Collection, DownloadConfig)}
    public BatchResult downloadAll(Collection<String> ids) throws IOException {
        return downloadAll(ids, config);
    }

    /// Downloads products, retrieving archived ones first.
    ///
    /// A failing product does not stop the others unless fail fast is configured. Rejected
    /// credentials always abort the whole batch.
    ///
    /// @param ids the product ids, duplicates are ignored
    /// @param config the configuration of this run
    /// @return the outcome per product
    /// @throws UnauthorizedException if the credentials were rejected
    /// @throws DownloadCancelledException if the calling thread was interrupted
    /// @throws IOException if fail fast is set and a product failed with an I/O error, or
    ///     no product was downloaded and the last failure was one
    public BatchResult downloadAll(Collection<String> ids, DownloadConfig config) throws IOException {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(ids));
        if (unique.isEmpty()) {
            return BatchResult.empty();
        }
        logger.info("Will download {} products using {} workers", unique.size(), config.maxConcurrentTransfers());

        BatchState state = new BatchState();
        Map<String, ProductDescriptor> available = discover(unique, config, state);
        Map<String, Path> archivePaths = new LinkedHashMap<>();
        if (!config.isNodeMode()) {
            skipDownloaded(available, archivePaths, config, state);
        }

        if (!available.isEmpty()) {
            runWorkers(available, archivePaths, config, state);
        }

        if (!state.anyDownloaded()) {
            Exception last = state.lastError();
            if (last == null) {
                throw new DataHubException("Downloading all products failed for an unknown reason");
            }
            throw rethrow(last);
        }
        return state.toResult();
    }

    private Map<String, ProductDescriptor> discover(List<String> ids, DownloadConfig config, BatchState state)
        throws IOException {
        Map<String, ProductDescriptor> available = new LinkedHashMap<>();
        for (String id : ids) {
            state.initialize(id, DownloadStatus.UNAVAILABLE);
            try {
                ProductDescriptor product = catalog.getProductMetadata(id);
                available.put(id, product);
                state.initialize(id, product.online() ? DownloadStatus.ONLINE : DownloadStatus.OFFLINE);
            } catch (UnauthorizedException e) {
                throw e;
            } catch (DataHubException | IOException e) {
                state.recordFailure(id, e);
                if (config.failFast()) {
                    throw e;
                }
                logger.error("Getting product info for {} failed, can't download: {}", id, e.toString());
            }
        }
        return available;
    }

    // Also applies to online products: an existing file needs no transfer either.
    private void skipDownloaded(Map<String, ProductDescriptor> available, Map<String, Path> archivePaths,
                                DownloadConfig config, BatchState state) throws IOException {
        for (ProductDescriptor product : new ArrayList<>(available.values())) {
            String id = product.id();
            try {
                String filename = catalog.resolveLocalFilename(product);
                Path path = config.directory().resolve(filename);
                if (Files.exists(path)) {
                    logger.info("Skipping already downloaded {}.", filename);
                    state.recordDownload(new ResolvedProduct(product, path, 0, Map.of()));
                    config.progress().onProductDownloaded(state.downloadedCount(), state.size());
                    available.remove(id);
                } else {
                    archivePaths.put(id, path);
                    if (!product.online()) {
                        logger.info("{} ({}) is in LTA and will be triggered.", product.title(), id);
                    }
                }
            } catch (UnauthorizedException e) {
                throw e;
            } catch (DataHubException | IOException e) {
                state.initialize(id, DownloadStatus.UNAVAILABLE);
                state.recordFailure(id, e);
                available.remove(id);
                if (config.failFast()) {
                    throw e;
                }
                logger.error("Resolving the file name of {} failed, can't download: {}", id, e.toString());
            }
        }
    }

    private void runWorkers(Map<String, ProductDescriptor> available, Map<String, Path> archivePaths,
                            DownloadConfig config, BatchState state) throws IOException {
        List<ProductDescriptor> online = new ArrayList<>();
        List<ProductDescriptor> offline = new ArrayList<>();
        for (ProductDescriptor product : available.values()) {
            (product.online() ? online : offline).add(product);
        }

        BlockingQueue<WorkerOutcome> outcomes = new LinkedBlockingQueue<>();
        ExecutorService downloadPool = WorkerThreads.newPool("dl", Math.min(config.maxConcurrentTransfers(), available.size()));
        ExecutorService triggerPool = offline.isEmpty()
            ? null
            : WorkerThreads.newPool("trigger", Math.min(config.maxConcurrentTriggers(), offline.size()));
        boolean completed = false;

        try {
            Map<String, CompletableFuture<ProductDescriptor>> gates = new LinkedHashMap<>();
            for (ProductDescriptor product : online) {
                gates.put(product.id(), CompletableFuture.completedFuture(product));
            }
            for (ProductDescriptor product : offline) {
                CompletableFuture<ProductDescriptor> gate = new CompletableFuture<>();
                gates.put(product.id(), gate);
                triggerPool.execute(() -> outcomes.add(runTrigger(product, gate, config, state)));
            }
            // online products are queued first so they start while archived ones are retrieved
            for (ProductDescriptor product : online) {
                submitDownload(downloadPool, outcomes, product, gates.get(product.id()), archivePaths, config, state);
            }
            for (ProductDescriptor product : offline) {
                submitDownload(downloadPool, outcomes, product, gates.get(product.id()), archivePaths, config, state);
            }

            int expected = available.size() + offline.size();
            for (int received = 0; received < expected; received++) {
                aggregate(outcomes.take(), config, state, offline.size());
            }
            completed = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Batch download was interrupted", e);
        } finally {
            if (completed) {
                downloadPool.shutdown();
                if (triggerPool != null) {
                    triggerPool.shutdown();
                }
            } else {
                abort(state, downloadPool, triggerPool);
            }
        }
    }

    private void submitDownload(ExecutorService pool, BlockingQueue<WorkerOutcome> outcomes, ProductDescriptor product,
                                CompletableFuture<ProductDescriptor> gate, Map<String, Path> archivePaths,
                                DownloadConfig config, BatchState state) {
        Path archivePath = archivePaths.get(product.id());
        pool.execute(() -> outcomes.add(runDownload(product, gate, archivePath, config, state)));
    }

    private void aggregate(WorkerOutcome outcome, DownloadConfig config, BatchState state, int offlineCount)
        throws IOException {
        String id = outcome.productId();
        switch (outcome.kind()) {
            case OK:
                if (outcome.role() == WorkerOutcome.Role.DOWNLOAD) {
                    state.recordDownload(outcome.product());
                    config.progress().onProductDownloaded(state.downloadedCount(), state.size());
                } else {
                    config.progress().onProductRetrieved(state.recordRetrieval(), offlineCount);
                }
                break;
            case FAILED:
                Exception error = outcome.error();
                state.recordFailure(id, error);
                if (config.failFast() || error instanceof UnauthorizedException) {
                    throw rethrow(error);
                }
                logger.error("{} failed: {}", id, error.toString());
                break;
            case CANCELLED:
                logger.debug("{} worker for {} was cancelled", outcome.role(), id);
                break;
            case SKIPPED:
                logger.debug("Download of {} skipped, it did not come online", id);
                break;
        }
    }

    private static void abort(BatchState state, ExecutorService downloadPool, ExecutorService triggerPool) {
        state.stop().set();
        downloadPool.shutdownNow();
        if (triggerPool != null) {
            triggerPool.shutdownNow();
        }
        try {
            long deadline = System.nanoTime() + ABORT_GRACE.toNanos();
            if (!downloadPool.awaitTermination(ABORT_GRACE.toNanos(), TimeUnit.NANOSECONDS)) {
                logger.warn("Download workers did not stop within {}", ABORT_GRACE);
            }
            if (triggerPool != null
                && !triggerPool.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                logger.warn("Retrieval workers did not stop within {}", ABORT_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private WorkerOutcome runTrigger(ProductDescriptor product, CompletableFuture<ProductDescriptor> gate,
                                     DownloadConfig config, BatchState state) {
        String id = product.id();
        try {
            ProductDescriptor ready = trigger.awaitOnline(product, status -> state.advance(id, status),
                config.ltaRetryDelay(), config.ltaTimeout(), state.stop());
            gate.complete(ready);
            return WorkerOutcome.online(id);
        } catch (DownloadCancelledException e) {
            gate.completeExceptionally(e);
            return WorkerOutcome.cancelled(id, WorkerOutcome.Role.TRIGGER);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            gate.completeExceptionally(e);
            return WorkerOutcome.cancelled(id, WorkerOutcome.Role.TRIGGER);
        } catch (Exception e) {
            gate.completeExceptionally(e);
            return WorkerOutcome.failed(id, WorkerOutcome.Role.TRIGGER, e);
        }
    }

    private WorkerOutcome runDownload(ProductDescriptor product, CompletableFuture<ProductDescriptor> gate,
                                      Path archivePath, DownloadConfig config, BatchState state) {
        String id = product.id();
        try {
            ProductDescriptor ready = awaitGate(id, gate, state.stop());
            if (ready == null) {
                return WorkerOutcome.skipped(id);
            }
            ResolvedProduct resolved = downloadWithRetry(ready, archivePath, config, state.stop(),
                status -> state.advance(id, status));
            return WorkerOutcome.downloaded(resolved);
        } catch (DownloadCancelledException e) {
            return WorkerOutcome.cancelled(id, WorkerOutcome.Role.DOWNLOAD);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkerOutcome.cancelled(id, WorkerOutcome.Role.DOWNLOAD);
        } catch (Exception e) {
            return WorkerOutcome.failed(id, WorkerOutcome.Role.DOWNLOAD, e);
        }
    }

    /// @return the online product, or null if its retrieval failed
    private static ProductDescriptor awaitGate(String id, CompletableFuture<ProductDescriptor> gate, StopSignal stop)
        throws InterruptedException {
        while (true) {
            stop.throwIfSet("Download of " + id);
            try {
                return gate.get(GATE_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.trace("Still waiting for {} to come online", id);
            } catch (ExecutionException e) {
                return null;
            }
        }
    }

    private ResolvedProduct downloadWithRetry(ProductDescriptor product, Path archivePath, DownloadConfig config,
                                              StopSignal stop, Consumer<DownloadStatus> listener)
        throws IOException, InterruptedException {
        String what = "Download of " + product.id();
        Exception last = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            stop.throwIfSet(what);
            if (attempt > 1 && stop.await(config.downloadRetryDelay())) {
                throw new DownloadCancelledException(what + " was cancelled");
            }
            try {
                listener.accept(DownloadStatus.DOWNLOAD_STARTED);
                return transferProduct(product, archivePath, config, stop);
            } catch (DownloadCancelledException | UnauthorizedException | ChecksumUnavailableException e) {
                throw e;
            } catch (InvalidChecksumException e) {
                logger.warn("Invalid checksum. The downloaded file for '{}' is corrupted.", product.title());
                last = e;
            } catch (RuntimeException | IOException e) {
                logger.error("There was an error downloading {}", product.title(), e);
                last = e;
            }
            logger.info("{} retries left", config.maxAttempts() - attempt);
        }
        logger.info("No retries left for {}. Terminating.", product.title());
        throw rethrow(last);
    }

    private ResolvedProduct transferProduct(ProductDescriptor product, Path archivePath, DownloadConfig config,
                                            StopSignal stop) throws IOException, InterruptedException {
        Files.createDirectories(config.directory());
        if (!config.isNodeMode()) {
            Path path = archivePath != null
                ? archivePath
                : config.directory().resolve(catalog.resolveLocalFilename(product));
            long bytes = transfer.transfer(product, path, config.verifyChecksum(), stop, config.progress());
            return new ResolvedProduct(product, path, bytes, Map.of());
        }

        Path productDir = config.directory().resolve(product.title() + PRODUCT_DIR_SUFFIX);
        Files.createDirectories(productDir);
        NodeDescriptor manifest = catalog.getManifestNode(product);
        Path manifestPath = productDir.resolve(MANIFEST_NAME);
        long bytes = transfer.transfer(manifest, manifestPath, false, stop, config.progress());

        Map<String, NodeDescriptor> written = new LinkedHashMap<>();
        written.put(manifest.nodePath(), manifest);
        for (NodeDescriptor node : manifestParser.parse(product, manifestPath)) {
            if (!config.nodeFilter().accept(node)) {
                continue;
            }
            Path target = resolveInside(productDir, node);
            logger.info("Downloading {} node to {}", product.id(), target);
            logger.debug("Node URL for {}: {}", product.id(), node.url());
            bytes += transfer.transfer(node, target, config.verifyChecksum(), stop, config.progress());
            written.put(node.nodePath(), node);
        }
        return new ResolvedProduct(product, productDir, bytes, written);
    }

    private static Path resolveInside(Path productDir, NodeDescriptor node) {
        Path base = productDir.toAbsolutePath().normalize();
        Path target = base.resolve(node.relativePath()).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new DataHubException("Node path " + node.nodePath() + " points outside of " + productDir);
        }
        return target;
    }

    /// Downloads one product with the base configuration.
    ///
    /// @param id the product id
    /// @return the downloaded product
    /// @throws IOException see {@link #download(String, DownloadConfig, StopSignal)}
    public ResolvedProduct download(String id) throws IOException {
        return download(id, config, new StopSignal());
    }

    /// Downloads one product.
    ///
    /// @param id the product id
    /// @param config the configuration of this call
    /// @return the downloaded product
    /// @throws IOException see {@link #download(String, DownloadConfig, StopSignal)}
    public ResolvedProduct download(String id, DownloadConfig config) throws IOException {
        return download(id, config, new StopSignal());
    }

    /// Downloads one product on the calling thread, waiting for archive retrieval if needed.
    ///
    /// @param id the product id
    /// @param config the configuration of this call
    /// @param stop a stop signal that cancels the call when set
    /// @return the downloaded product
    /// @throws io.hubfetch.api.errors.LTAException if retrieval from the archive failed for good
    /// @throws InvalidChecksumException if every attempt produced a corrupt file
    /// @throws DownloadCancelledException if the stop signal was set or the thread interrupted
    /// @throws IOException if the last attempt failed with an I/O error
    public ResolvedProduct download(String id, DownloadConfig config, StopSignal stop) throws IOException {
        try {
            ProductDescriptor product = catalog.getProductMetadata(id);
            Path archivePath = null;
            if (!config.isNodeMode()) {
                archivePath = config.directory().resolve(catalog.resolveLocalFilename(product));
                logger.info("Downloading {} to {}", id, archivePath);
                if (Files.exists(archivePath)) {
                    return new ResolvedProduct(product, archivePath, 0, Map.of());
                }
            }
            if (!product.online()) {
                product = trigger.awaitOnline(product, status -> logger.debug("{} is {}", id, status),
                    config.ltaRetryDelay(), config.ltaTimeout(), stop);
            }
            return downloadWithRetry(product, archivePath, config, stop, status -> logger.debug("{} is {}", id, status));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Download of " + id + " was interrupted", e);
        }
    }

    /// Requests retrieval of an archived product.
    ///
    /// @param id the product id
    /// @return true if the retrieval was accepted, false if the product is already online
    /// @throws io.hubfetch.api.errors.LTAException if the hub refused the request
    /// @throws IOException if the hub cannot be reached
    public boolean triggerOfflineRetrieval(String id) throws IOException {
        ProductDescriptor product = catalog.getProductMetadata(id);
        try {
            return trigger.triggerOfflineRetrieval(product);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Retrieval request for " + id + " was interrupted", e);
        }
    }

    private static IOException rethrow(Exception e) {
        if (e instanceof RuntimeException) {
            throw (RuntimeException) e;
        }
        if (e instanceof IOException) {
            return (IOException) e;
        }
        throw new DataHubException(e.getMessage(), e);
    }
}
