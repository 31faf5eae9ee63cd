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

import io.hubfetch.transport.HttpTransferClient;
import io.hubfetch.transport.HubHttpClients;
import io.hubfetch.transport.ODataCatalogClient;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;

/// Connection options shared by all subcommands. Options override `settings.yaml`.
public class HubConnectionOptions {
    private static final Logger logger = LogManager.getLogger(HubConnectionOptions.class);

    @CommandLine.Option(names = {"--configdir"},
        description = "The directory holding settings.yaml",
        defaultValue = "~/.config/hubfetch")
    private Path configdir;

    @CommandLine.Option(names = {"--api-url"}, description = "The data hub API root URL")
    private String apiUrl;

    @CommandLine.Option(names = {"--user", "-u"}, description = "The data hub user name")
    private String user;

    @CommandLine.Option(names = {"--password-env"},
        description = "The environment variable holding the data hub password")
    private String passwordEnv;

    /// The connected hub clients.
    ///
    /// @param catalog the catalog client
    /// @param transfer the transfer client
    public record Connection(ODataCatalogClient catalog, HttpTransferClient transfer) {
    }

    /// @return the settings file merged with the command line options
    public HubSettings settings() {
        Path expanded = Path.of(configdir.toString()
            .replace("~", System.getProperty("user.home"))
            .replace("${HOME}", System.getProperty("user.home")));
        HubSettings loaded = HubSettings.load(expanded);
        return new HubSettings(
            apiUrl != null ? apiUrl : loaded.apiUrl(),
            user != null ? user : loaded.user(),
            passwordEnv != null ? passwordEnv : loaded.passwordEnv(),
            loaded.concurrentDownloads(),
            loaded.concurrentTriggers(),
            loaded.maxAttempts(),
            loaded.ltaRetryDelay(),
            loaded.ltaTimeout());
    }

    /// @param settings the effective settings
    /// @return clients for the configured hub
    public Connection connect(HubSettings settings) {
        String password = settings.password();
        if (settings.user() != null && password == null) {
            logger.warn("No password found in environment variable {}", settings.passwordEnv());
        }
        OkHttpClient http = HubHttpClients.create(settings.user(), password);
        return new Connection(new ODataCatalogClient(http, settings.apiUrl()), new HttpTransferClient(http));
    }
}
