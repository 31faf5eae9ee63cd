package io.hubfetch.command;

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

import io.hubfetch.api.errors.DataHubException;
import io.hubfetch.download.BatchResult;
import io.hubfetch.download.DownloadConfig;
import io.hubfetch.download.DownloadStatus;
import io.hubfetch.download.Downloader;
import io.hubfetch.download.ResolvedProduct;
import io.hubfetch.download.nodes.NodeFilter;
import io.hubfetch.download.nodes.NodeFilters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Download products, retrieving archived ones from the Long Term Archive first
@CommandLine.Command(name = "download",
    header = "Download products from the data hub",
    description = "Downloads products by id. Archived products are retrieved from the Long Term Archive first. "
        + "Interrupted downloads resume where they stopped.",
    exitCodeList = {"0: all products downloaded", "1: error"})
public class CMD_download implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_download.class);

    @CommandLine.Mixin
    private HubConnectionOptions connection = new HubConnectionOptions();

    @CommandLine.Parameters(description = "Product ids", arity = "1..*")
    private List<String> ids = new ArrayList<>();

    @CommandLine.Option(names = {"--path", "-p"}, description = "Download directory", defaultValue = ".")
    private Path path;

    @CommandLine.Option(names = {"--no-checksum"}, description = "Skip checksum verification of downloaded files")
    private boolean noChecksum = false;

    @CommandLine.Option(names = {"--fail-fast"}, description = "Abort all downloads on the first failure")
    private boolean failFast = false;

    @CommandLine.Option(names = {"--max-attempts"}, description = "Transfer attempts per product")
    private Integer maxAttempts;

    @CommandLine.Option(names = {"--concurrent"}, description = "Concurrent transfers")
    private Integer concurrent;

    @CommandLine.Option(names = {"--concurrent-triggers"}, description = "Concurrent archive retrieval requests")
    private Integer concurrentTriggers;

    @CommandLine.Option(names = {"--lta-retry-delay"}, converter = DurationConverter.class,
        description = "Delay between archive retrieval requests, e.g. 60s")
    private Duration ltaRetryDelay;

    @CommandLine.Option(names = {"--lta-timeout"}, converter = DurationConverter.class,
        description = "Longest wait for an archived product, e.g. 2h")
    private Duration ltaTimeout;

    @CommandLine.Option(names = {"--nodes"}, description = "Download the product package file by file")
    private boolean nodes = false;

    @CommandLine.Option(names = {"--include"}, description = "Only download package files matching this glob")
    private List<String> includes = new ArrayList<>();

    @CommandLine.Option(names = {"--exclude"}, description = "Skip package files matching this glob")
    private List<String> excludes = new ArrayList<>();

    @CommandLine.Option(names = {"--max-node-size"}, description = "Skip package files larger than this many bytes")
    private Long maxNodeSize;

    @Override
    public Integer call() {
        HubSettings settings = connection.settings();
        DownloadConfig config;
        try {
            config = buildConfig(settings);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid options: " + e.getMessage());
            return 1;
        }

        HubConnectionOptions.Connection hub = connection.connect(settings);
        Downloader downloader = new Downloader(hub.catalog(), hub.transfer(), config);
        try {
            BatchResult result = downloader.downloadAll(ids);
            report(result);
            return result.downloadedCount() == result.statuses().size() ? 0 : 1;
        } catch (DataHubException | IOException e) {
            logger.error("Download failed", e);
            System.err.println("Download failed: " + e.getMessage());
            return 1;
        }
    }

    DownloadConfig buildConfig(HubSettings settings) {
        return DownloadConfig.builder()
            .directory(path)
            .verifyChecksum(!noChecksum)
            .failFast(failFast)
            .maxAttempts(maxAttempts != null ? maxAttempts : settings.maxAttempts())
            .maxConcurrentTransfers(concurrent != null ? concurrent : settings.concurrentDownloads())
            .maxConcurrentTriggers(concurrentTriggers != null ? concurrentTriggers : settings.concurrentTriggers())
            .ltaRetryDelay(ltaRetryDelay != null ? ltaRetryDelay : settings.ltaRetryDelay())
            .ltaTimeout(ltaTimeout != null ? ltaTimeout : settings.ltaTimeout())
            .nodeFilter(nodeFilter())
            .progress(new ProgressLog())
            .build();
    }

    NodeFilter nodeFilter() {
        if (!nodes && includes.isEmpty() && excludes.isEmpty() && maxNodeSize == null) {
            return null;
        }
        NodeFilter filter = NodeFilters.all();
        if (!includes.isEmpty()) {
            filter = filter.and(NodeFilters.or(includes.stream().map(NodeFilters::pathMatches).toArray(NodeFilter[]::new)));
        }
        for (String exclude : excludes) {
            filter = filter.and(NodeFilters.pathExcludes(exclude));
        }
        if (maxNodeSize != null) {
            filter = filter.and(NodeFilters.maxSize(maxNodeSize));
        }
        return filter;
    }

    private static void report(BatchResult result) {
        for (Map.Entry<String, DownloadStatus> entry : result.statuses().entrySet()) {
            String id = entry.getKey();
            ResolvedProduct product = result.products().get(id);
            Exception error = result.exceptions().get(id);
            String detail = product != null ? product.path().toString() : error != null ? error.getMessage() : "";
            System.out.println(id + "\t" + entry.getValue() + "\t" + detail);
        }
        System.out.println(result.downloadedCount() + " of " + result.statuses().size() + " products downloaded");
    }
}
