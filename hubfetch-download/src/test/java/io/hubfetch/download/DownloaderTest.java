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

import io.hubfetch.api.catalog.ProductDescriptor;
import io.hubfetch.api.errors.DataHubException;
import io.hubfetch.api.errors.InvalidChecksumException;
import io.hubfetch.api.errors.LTAException;
import io.hubfetch.api.errors.NotFoundException;
import io.hubfetch.api.errors.ServerErrorException;
import io.hubfetch.api.errors.UnauthorizedException;
import io.hubfetch.download.nodes.NodeFilters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class DownloaderTest {

    private final FakeCatalog catalog = new FakeCatalog();
    private final FakeTransferClient client = new FakeTransferClient();

    private static DownloadConfig config(Path directory) {
        return DownloadConfig.builder()
            .directory(directory)
            .maxAttempts(3)
            .ltaRetryDelay(Duration.ofMillis(10))
            .downloadRetryDelay(Duration.ZERO)
            .build();
    }

    private ProductDescriptor online(String id, String content) {
        byte[] bytes = FakeCatalog.bytes(content);
        client.serve(FakeCatalog.urlOf(id), bytes);
        return catalog.add(id, bytes, true);
    }

    private ProductDescriptor archived(String id, String content) {
        byte[] bytes = FakeCatalog.bytes(content);
        client.archived(FakeCatalog.urlOf(id), bytes);
        return catalog.add(id, bytes, false);
    }

    @Test
    public void testDownloadAllOnlineProducts(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        online("b", "second product");
        online("c", "third product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "b", "c"));

        assertEquals(3, result.downloadedCount());
        for (String id : List.of("a", "b", "c")) {
            assertEquals(DownloadStatus.DOWNLOADED, result.statuses().get(id));
            assertEquals(tempDir.resolve("P_" + id + ".zip"), result.products().get(id).path());
        }
        assertEquals("second product", Files.readString(tempDir.resolve("P_b.zip")));
        assertTrue(result.exceptions().isEmpty());
    }

    @Test
    public void testDuplicateIdsAreDownloadedOnce(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "a", "a"));

        assertEquals(Set.of("a"), result.statuses().keySet());
        assertEquals(1, catalog.metadataCalls.get());
        assertEquals(1, client.requests().size());
    }

    @Test
    public void testEmptyBatch(@TempDir Path tempDir) throws Exception {
        BatchResult result = new Downloader(catalog, client, config(tempDir)).downloadAll(List.of());
        assertTrue(result.statuses().isEmpty());
    }

    @Test
    public void testExistingFilesAreSkippedWithoutRetrieval(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        archived("b", "archived product");
        Files.writeString(tempDir.resolve("P_a.zip"), "first product");
        Files.writeString(tempDir.resolve("P_b.zip"), "archived product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "b"));

        assertTrue(result.isDownloaded("a"));
        assertTrue(result.isDownloaded("b"));
        assertEquals(0, result.products().get("b").downloadedBytes());
        assertTrue(client.requests().isEmpty(), "Existing files need neither retrieval nor transfer");
        assertEquals(0, catalog.onlinePolls("b"));
    }

    @Test
    public void testUnavailableProductDoesNotStopOthers(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "missing"));

        assertTrue(result.isDownloaded("a"));
        assertEquals(DownloadStatus.UNAVAILABLE, result.statuses().get("missing"));
        assertInstanceOf(NotFoundException.class, result.exceptions().get("missing"));
    }

    @Test
    public void testFailFastOnMetadataError(@TempDir Path tempDir) {
        online("a", "first product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));
        DownloadConfig failFast = config(tempDir).toBuilder().failFast(true).build();

        assertThrows(NotFoundException.class, () -> downloader.downloadAll(List.of("missing", "a"), failFast));
        assertTrue(client.requests().isEmpty());
    }

    @Test
    public void testUnauthorizedAbortsBatch(@TempDir Path tempDir) {
        online("a", "first product");
        catalog.failMetadata("b", new UnauthorizedException("Invalid user name or password"));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        assertThrows(UnauthorizedException.class, () -> downloader.downloadAll(List.of("a", "b")));
    }

    @Test
    public void testUnauthorizedTransferAbortsBatch(@TempDir Path tempDir) {
        ProductDescriptor a = online("a", "first product");
        client.script(a.url(), range -> FakeResponse.status(401));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        assertThrows(UnauthorizedException.class, () -> downloader.downloadAll(List.of("a")));
        assertEquals(1, client.requests().size(), "Rejected credentials are not retried");
    }

    @Test
    public void testCorruptTransferIsRetried(@TempDir Path tempDir) throws Exception {
        byte[] content = FakeCatalog.bytes("hello world");
        ProductDescriptor a = catalog.add("a", content, true);
        client.script(a.url(),
            range -> new FakeResponse(200, FakeCatalog.bytes("jello world"), Map.of()),
            range -> FakeTransferClient.respondWith(content, range));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a"));

        assertTrue(result.isDownloaded("a"));
        assertEquals(2, client.requests().size());
        assertEquals("hello world", Files.readString(tempDir.resolve("P_a.zip")));
    }

    @Test
    public void testAttemptsAreLimited(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        ProductDescriptor b = catalog.add("b", FakeCatalog.bytes("hello world"), true);
        client.script(b.url(), range -> new FakeResponse(200, FakeCatalog.bytes("jello world"), Map.of()));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "b"));

        assertTrue(result.isDownloaded("a"));
        assertFalse(result.isDownloaded("b"));
        assertEquals(DownloadStatus.DOWNLOAD_STARTED, result.statuses().get("b"));
        assertInstanceOf(InvalidChecksumException.class, result.exceptions().get("b"));
        assertEquals(3, client.requestsFor(b.url()).size());
        assertFalse(Files.exists(tempDir.resolve("P_b.zip")));
    }

    @Test
    public void testAllFailedRethrowsLastError(@TempDir Path tempDir) {
        ProductDescriptor a = catalog.add("a", FakeCatalog.bytes("hello world"), true);
        client.script(a.url(), range -> FakeResponse.status(500, "broken"));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        ServerErrorException e = assertThrows(ServerErrorException.class, () -> downloader.downloadAll(List.of("a")));
        assertEquals("broken", e.getCauseMessage());
        assertEquals(3, client.requests().size());
    }

    @Test
    public void testFailFastOnTransferError(@TempDir Path tempDir) {
        ProductDescriptor a = catalog.add("a", FakeCatalog.bytes("hello world"), true);
        client.script(a.url(), range -> FakeResponse.status(404));
        online("b", "second product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));
        DownloadConfig failFast = config(tempDir).toBuilder().failFast(true).maxConcurrentTransfers(1).build();

        assertThrows(NotFoundException.class, () -> downloader.downloadAll(List.of("a", "b"), failFast));
    }

    @Test
    public void testFailFastCancelsTransferInFlight(@TempDir Path tempDir) {
        byte[] slowContent = FakeCatalog.bytes("x".repeat(200));
        ProductDescriptor b = catalog.add("b", slowContent, true);
        SlowResponse slow = new SlowResponse(slowContent, Duration.ofMillis(50));
        client.script(b.url(), range -> slow);
        ProductDescriptor a = catalog.add("a", FakeCatalog.bytes("hello world"), true);
        client.script(a.url(), range -> {
            try {
                slow.started.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return FakeResponse.status(404);
        });
        Downloader downloader = new Downloader(catalog, client, config(tempDir));
        DownloadConfig failFast = config(tempDir).toBuilder().failFast(true).maxAttempts(1).build();

        long start = System.nanoTime();
        assertThrows(NotFoundException.class, () -> downloader.downloadAll(List.of("a", "b"), failFast));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(elapsed.compareTo(Duration.ofSeconds(5)) < 0, "The slow transfer was not cancelled: " + elapsed);
        assertTrue(slow.interrupted, "The in flight read should be interrupted");
        assertFalse(Files.exists(tempDir.resolve("P_b.zip")), "A cancelled product is never promoted");
        assertEquals(1, client.requestsFor(b.url()).size(), "A cancelled product is not retried");
    }

    @Test
    public void testChecksumFailuresRecoverWithinAttemptLimit(@TempDir Path tempDir) throws Exception {
        byte[] content = FakeCatalog.bytes("hello world");
        ProductDescriptor a = catalog.add("a", content, true);
        client.script(a.url(),
            range -> new FakeResponse(200, FakeCatalog.bytes("jello world"), Map.of()),
            range -> new FakeResponse(200, FakeCatalog.bytes("hello wyrld"), Map.of()),
            range -> FakeTransferClient.respondWith(content, range));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a"));

        assertEquals(DownloadStatus.DOWNLOADED, result.statuses().get("a"));
        assertTrue(result.exceptions().isEmpty(), "A product that finally succeeded carries no error");
        assertEquals(3, client.transfersFor(a.url()).size());
        assertEquals("hello world", Files.readString(tempDir.resolve("P_a.zip")));
    }

    @Test
    public void testUnauthorizedMetadataAbortsBeforeAnyTransfer(@TempDir Path tempDir) {
        online("a", "first product");
        archived("b", "archived product");
        catalog.failMetadata("c", new UnauthorizedException("Invalid user name or password"));
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        assertThrows(UnauthorizedException.class, () -> downloader.downloadAll(List.of("a", "b", "c")));
        assertTrue(client.requests().isEmpty(), "Neither a transfer nor a retrieval request is made");
        assertFalse(Files.exists(tempDir.resolve("P_a.zip")));
        assertFalse(Files.exists(tempDir.resolve("P_b.zip")));
        assertEquals(0, catalog.onlinePolls("b"));
    }

    @Test
    public void testBatchProgress(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        archived("b", "archived product");
        catalog.onlineSequence("b", false, true);
        online("c", "third product");
        Files.writeString(tempDir.resolve("P_c.zip"), "third product");
        RecordingProgress progress = new RecordingProgress();
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        downloader.downloadAll(List.of("a", "b", "c"), config(tempDir).toBuilder().progress(progress).build());

        assertEquals(List.of("1/3", "2/3", "3/3"), progress.downloaded);
        assertEquals(List.of("1/1"), progress.retrieved);
        assertTrue(progress.transferred.contains(13L), "Progress of a reaches its declared size");
        assertTrue(progress.transferred.contains(16L), "Progress of b reaches its declared size");
        assertTrue(progress.hashed.containsAll(List.of(13L, 16L)));
    }

    @Test
    public void testArchivedProductIsRetrievedThenDownloaded(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        ProductDescriptor b = archived("b", "archived product");
        catalog.onlineSequence("b", false, false, true);
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "b"));

        assertEquals(2, result.downloadedCount());
        assertTrue(result.products().get("b").descriptor().online());
        assertEquals("archived product", Files.readString(tempDir.resolve("P_b.zip")));
        assertEquals(2, client.requestsFor(b.url()).size(), "One retrieval request and one transfer");
    }

    @Test
    public void testQuotaExceededFailsOnlyTheArchivedProduct(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        ProductDescriptor b = catalog.add("b", FakeCatalog.bytes("archived product"), false);
        client.script(b.url(), range -> FakeResponse.status(403, "Offline products retrieval quota exceeded"));
        catalog.onlineSequence("b", false);
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        BatchResult result = downloader.downloadAll(List.of("a", "b"));

        assertTrue(result.isDownloaded("a"));
        assertEquals(DownloadStatus.OFFLINE, result.statuses().get("b"));
        LTAException e = assertInstanceOf(LTAException.class, result.exceptions().get("b"));
        assertEquals(LTAException.LtaFailure.QUOTA_EXCEEDED, e.getFailure());
        assertFalse(Files.exists(tempDir.resolve("P_b.zip")));
    }

    @Test
    public void testNodeModeDownloadsSelectedFiles(@TempDir Path tempDir) throws Exception {
        ProductDescriptor p = online("p", "unused archive");
        byte[] raster = FakeCatalog.bytes("measurement raster");
        byte[] annotation = FakeCatalog.bytes("<product/>");
        byte[] preview = FakeCatalog.bytes("png bytes");
        byte[] manifest = new Manifests()
            .node("measurement", "./measurement/s1a-iw-grd.tiff", raster)
            .node("annotation", "./annotation/s1a-iw-grd.xml", annotation)
            .node("quicklook", "./preview/quick-look.png", preview)
            .bytes();
        catalog.manifestSize("p", manifest.length);
        client.serve(catalog.nodeUrl(p, "manifest.safe"), manifest)
            .serve(catalog.nodeUrl(p, "measurement/s1a-iw-grd.tiff"), raster)
            .serve(catalog.nodeUrl(p, "annotation/s1a-iw-grd.xml"), annotation)
            .serve(catalog.nodeUrl(p, "preview/quick-look.png"), preview);
        DownloadConfig nodes = config(tempDir).toBuilder().nodeFilter(NodeFilters.pathExcludes("**/*.tiff")).build();
        Downloader downloader = new Downloader(catalog, client, nodes);

        BatchResult result = downloader.downloadAll(List.of("p"));

        Path productDir = tempDir.resolve("P_p.SAFE");
        ResolvedProduct resolved = result.products().get("p");
        assertEquals(productDir, resolved.path());
        assertEquals(Set.of("./manifest.safe", "./annotation/s1a-iw-grd.xml", "./preview/quick-look.png"),
            resolved.nodes().keySet());
        assertTrue(Files.exists(productDir.resolve("manifest.safe")));
        assertEquals("<product/>", Files.readString(productDir.resolve("annotation/s1a-iw-grd.xml")));
        assertFalse(Files.exists(productDir.resolve("measurement/s1a-iw-grd.tiff")));
        assertTrue(client.requestsFor(p.url()).isEmpty(), "Node mode never fetches the archive");
    }

    @Test
    public void testNodePathsMayNotEscapeProductDirectory(@TempDir Path tempDir) {
        ProductDescriptor p = online("p", "unused archive");
        byte[] evil = FakeCatalog.bytes("evil");
        byte[] manifest = new Manifests().node("evil", "./../../evil.sh", evil).bytes();
        catalog.manifestSize("p", manifest.length);
        client.serve(catalog.nodeUrl(p, "manifest.safe"), manifest)
            .serve(catalog.nodeUrl(p, "../../evil.sh"), evil);
        DownloadConfig nodes = config(tempDir).toBuilder().nodeFilter(NodeFilters.all()).maxAttempts(1).build();
        Downloader downloader = new Downloader(catalog, client, nodes);

        assertThrows(DataHubException.class, () -> downloader.downloadAll(List.of("p")));
        assertFalse(Files.exists(tempDir.getParent().resolve("evil.sh")));
    }

    @Test
    public void testSingleDownload(@TempDir Path tempDir) throws Exception {
        online("a", "first product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        ResolvedProduct first = downloader.download("a");
        assertEquals(13, first.downloadedBytes());
        assertEquals("first product", Files.readString(first.path()));

        ResolvedProduct again = downloader.download("a");
        assertEquals(0, again.downloadedBytes());
        assertEquals(1, client.requests().size());
    }

    @Test
    public void testSingleDownloadOfArchivedProduct(@TempDir Path tempDir) throws Exception {
        archived("b", "archived product");
        catalog.onlineSequence("b", false, true);
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        ResolvedProduct product = downloader.download("b");

        assertTrue(product.descriptor().online());
        assertEquals("archived product", Files.readString(product.path()));
    }

    @Test
    public void testTriggerOfflineRetrieval(@TempDir Path tempDir) throws Exception {
        archived("b", "archived product");
        online("a", "first product");
        Downloader downloader = new Downloader(catalog, client, config(tempDir));

        assertTrue(downloader.triggerOfflineRetrieval("b"));
        assertFalse(downloader.triggerOfflineRetrieval("a"));
        assertThrows(NotFoundException.class, () -> downloader.triggerOfflineRetrieval("missing"));
    }

    @Test
    public void testResizeQuotas(@TempDir Path tempDir) {
        Downloader downloader = new Downloader(catalog, client, config(tempDir));
        downloader.resizeQuotas(4, 2);
        assertEquals(4, downloader.getLimiter().getMaxTransfers());
        assertEquals(2, downloader.getLimiter().getMaxTriggers());
    }
}
