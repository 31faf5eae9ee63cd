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

import io.hubfetch.api.catalog.ProductDescriptor;
import io.hubfetch.api.errors.DataHubException;
import io.hubfetch.download.ChecksumVerifier;
import io.hubfetch.download.FileIntegrityChecker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Verify downloaded products against their declared size and checksum
@CommandLine.Command(name = "check",
    header = "Verify downloaded products",
    description = "Compares downloaded product archives with the size and checksum declared by the hub. "
        + "Missing files are reported as corrupt.",
    exitCodeList = {"0: all files intact", "1: corrupt or missing files, or error"})
public class CMD_check implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_check.class);

    @CommandLine.Mixin
    private HubConnectionOptions connection = new HubConnectionOptions();

    @CommandLine.Parameters(description = "Product ids", arity = "1..*")
    private List<String> ids = new ArrayList<>();

    @CommandLine.Option(names = {"--path", "-p"}, description = "Directory holding the products", defaultValue = ".")
    private Path path;

    @CommandLine.Option(names = {"--delete"}, description = "Delete corrupt files")
    private boolean delete = false;

    @Override
    public Integer call() {
        HubConnectionOptions.Connection hub = connection.connect(connection.settings());
        FileIntegrityChecker checker = new FileIntegrityChecker(hub.catalog(), new ChecksumVerifier());
        try {
            Map<Path, ProductDescriptor> corrupt = checker.checkFiles(ids, path, delete);
            for (Map.Entry<Path, ProductDescriptor> entry : corrupt.entrySet()) {
                System.out.println(entry.getValue().id() + "\tcorrupt\t" + entry.getKey());
            }
            System.out.println(corrupt.size() + " of " + ids.size() + " files corrupt or missing");
            return corrupt.isEmpty() ? 0 : 1;
        } catch (DataHubException | IOException e) {
            logger.error("Check failed", e);
            System.err.println("Check failed: " + e.getMessage());
            return 1;
        }
    }
}
