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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Download products from a satellite data hub
@CommandLine.Command(name = "hubfetch",
    header = "Download products from a satellite data hub",
    description = "Concurrent, resumable and checksum verified product downloads with Long Term Archive retrieval",
    mixinStandardHelpOptions = true,
    version = "hubfetch 0.1.0",
    subcommands = {
        CMD_download.class,
        CMD_trigger.class,
        CMD_check.class,
        CMD_quicklooks.class,
        CommandLine.HelpCommand.class
    })
public class CMD_hubfetch implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_hubfetch.class);

    /// Create the CMD_hubfetch command
    public CMD_hubfetch() {}

    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /// Runs the command line without exiting the JVM.
    ///
    /// @param args Command line arguments
    /// @return the exit code
    public static int run(String... args) {
        CommandLine commandLine = new CommandLine(new CMD_hubfetch())
            .setCaseInsensitiveEnumValuesAllowed(true);
        logger.debug("executing commandline");
        return commandLine.execute(args);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
