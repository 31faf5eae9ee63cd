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
import io.hubfetch.download.DownloadConfig;
import io.hubfetch.download.Downloader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Request retrieval of archived products without downloading them
@CommandLine.Command(name = "trigger",
    header = "Request retrieval of archived products",
    description = "Asks the hub to restore products from the Long Term Archive. Products that are online are reported as such.",
    exitCodeList = {"0: every request accepted or product online", "1: error"})
public class CMD_trigger implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_trigger.class);

    @CommandLine.Mixin
    private HubConnectionOptions connection = new HubConnectionOptions();

    @CommandLine.Parameters(description = "Product ids", arity = "1..*")
    private List<String> ids = new ArrayList<>();

    @Override
    public Integer call() {
        HubSettings settings = connection.settings();
        HubConnectionOptions.Connection hub = connection.connect(settings);
        DownloadConfig config = DownloadConfig.builder()
            .maxConcurrentTransfers(settings.concurrentDownloads())
            .maxConcurrentTriggers(settings.concurrentTriggers())
            .build();
        Downloader downloader = new Downloader(hub.catalog(), hub.transfer(), config);

        int failures = 0;
        for (String id : ids) {
            try {
                boolean triggered = downloader.triggerOfflineRetrieval(id);
                System.out.println(id + "\t" + (triggered ? "retrieval accepted" : "online"));
            } catch (DataHubException | IOException e) {
                logger.error("Retrieval request for {} failed", id, e);
                System.out.println(id + "\tfailed: " + e.getMessage());
                failures++;
            }
        }
        return failures == 0 ? 0 : 1;
    }
}
