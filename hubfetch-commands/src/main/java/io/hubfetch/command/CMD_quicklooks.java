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
import io.hubfetch.download.ConcurrencyLimiter;
import io.hubfetch.download.QuicklookDownloader;
import io.hubfetch.download.QuicklookResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Download product quicklook images
@CommandLine.Command(name = "quicklooks",
    header = "Download product quicklook images",
    description = "Downloads the JPEG preview of each product as <title>.jpeg",
    exitCodeList = {"0: all quicklooks downloaded", "1: error"})
public class CMD_quicklooks implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_quicklooks.class);

    @CommandLine.Mixin
    private HubConnectionOptions connection = new HubConnectionOptions();

    @CommandLine.Parameters(description = "Product ids", arity = "1..*")
    private List<String> ids = new ArrayList<>();

    @CommandLine.Option(names = {"--path", "-p"}, description = "Download directory", defaultValue = ".")
    private Path path;

    @Override
    public Integer call() {
        HubSettings settings = connection.settings();
        HubConnectionOptions.Connection hub = connection.connect(settings);
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(settings.concurrentDownloads(), settings.concurrentTriggers());
        QuicklookDownloader quicklooks =
            new QuicklookDownloader(hub.catalog(), hub.transfer(), limiter, settings.concurrentDownloads());
        try {
            QuicklookDownloader.Batch batch = quicklooks.downloadAllQuicklooks(ids, path);
            for (Map.Entry<String, QuicklookResult> entry : batch.downloaded().entrySet()) {
                System.out.println(entry.getKey() + "\t" + entry.getValue().path());
            }
            for (Map.Entry<String, String> entry : batch.failed().entrySet()) {
                System.out.println(entry.getKey() + "\tfailed: " + entry.getValue());
            }
            return batch.failed().isEmpty() ? 0 : 1;
        } catch (DataHubException e) {
            logger.error("Quicklook download failed", e);
            System.err.println("Quicklook download failed: " + e.getMessage());
            return 1;
        }
    }
}
