package io.hubfetch.testserver;

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
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;

/// JUnit Jupiter extension sharing one {@link DataHubServerFixture} per JVM.
///
/// The server starts when first needed and stops when the JVM exits. Routes and recorded
/// requests are cleared before each test.
///
/// ```java
/// @ExtendWith(DataHubServerExtension.class)
/// public class MyTest {
///     @Test
///     public void test() {
///         DataHubServerExtension.getServer().route("/file", Responders.text("x"));
///     }
/// }
/// ```
public class DataHubServerExtension implements BeforeAllCallback, BeforeEachCallback {
    private static final Logger logger = LogManager.getLogger(DataHubServerExtension.class);
    private static final Object lock = new Object();
    private static DataHubServerFixture server;

    /// Starts the shared server if it is not running. Thread safe and idempotent.
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                DataHubServerFixture fixture = new DataHubServerFixture();
                try {
                    fixture.start();
                } catch (IOException e) {
                    logger.error("Failed to start data hub test server", e);
                    throw new RuntimeException("Failed to start data hub test server", e);
                }
                server = fixture;
                Runtime.getRuntime().addShutdownHook(new Thread(fixture::close));
            }
        }
    }

    /// @return the shared server, started
    public static DataHubServerFixture getServer() {
        initialize();
        return server;
    }

    /// @return the root URL of the shared server, ending with a slash
    public static String getBaseUrl() {
        return getServer().getBaseUrl();
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        getServer().reset();
    }
}
