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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// A Jetty server playing the part of a data hub in tests.
///
/// Routes are keyed by the decoded request path plus query, e.g.
/// `/odata/v1/Products('p1')?$format=json`, and match regardless of the request method. A route
/// may be a sequence of responders, consumed one per request with the last one repeating, which
/// is how tests script a product going from archived to online or a flaky transfer.
///
/// Every request is recorded so tests can assert on hit counts and `Range` headers.
///
/// ```java
/// try (DataHubServerFixture hub = new DataHubServerFixture()) {
///     hub.start();
///     hub.route("/file", Responders.bytes(content));
///     // ... requests against hub.getBaseUrl() + "file"
///     assertEquals(1, hub.hits("/file"));
/// }
/// ```
public class DataHubServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DataHubServerFixture.class);

    /// A request as seen by the fixture.
    ///
    /// @param method the HTTP method
    /// @param target the decoded path plus query
    /// @param range the `Range` header, or null
    /// @param authorization the `Authorization` header, or null
    public record RecordedRequest(String method, String target, String range, String authorization) {
    }

    private final Map<String, List<Responder>> routes = new ConcurrentHashMap<>();
    private final Map<String, Integer> positions = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private Server server;
    private int port;

    /// Starts the server on a free local port.
    ///
    /// @throws IOException if the server cannot be started
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder("hub", new ScriptServlet()), "/*");
        server.setHandler(context);

        try {
            server.start();
            logger.info("Data hub test server started on port {}", port);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /// @return the root URL of the server, ending with a slash
    public String getBaseUrl() {
        return "http://127.0.0.1:" + port + "/";
    }

    /// @return the port the server listens on
    public int getPort() {
        return port;
    }

    /// Scripts a route. Replaces any earlier script for the same target.
    ///
    /// @param target the decoded path plus query, starting with `/`
    /// @param responders the responders, used in order with the last one repeating
    /// @return this fixture for method chaining
    public DataHubServerFixture route(String target, Responder... responders) {
        if (responders.length == 0) {
            throw new IllegalArgumentException("At least one responder is required for " + target);
        }
        routes.put(target, List.of(responders));
        positions.put(target, 0);
        return this;
    }

    /// Removes all routes and recorded requests.
    public void reset() {
        routes.clear();
        positions.clear();
        requests.clear();
    }

    /// @return all requests received since the last reset, in arrival order
    public List<RecordedRequest> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    /// @param target a route target
    /// @return the requests received for the target
    public List<RecordedRequest> requestsFor(String target) {
        List<RecordedRequest> found = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (request.target().equals(target)) {
                found.add(request);
            }
        }
        return found;
    }

    /// @param target a route target
    /// @return the number of requests received for the target
    public int hits(String target) {
        return requestsFor(target).size();
    }

    /// @param target a route target
    /// @return the `Range` header of the most recent request for the target, or null
    public String lastRange(String target) {
        List<RecordedRequest> found = requestsFor(target);
        return found.isEmpty() ? null : found.get(found.size() - 1).range();
    }

    private Responder next(String target) {
        List<Responder> script = routes.get(target);
        if (script == null) {
            return null;
        }
        int position = positions.merge(target, 1, Integer::sum) - 1;
        return script.get(Math.min(position, script.size() - 1));
    }

    private class ScriptServlet extends HttpServlet {
        @Override
        protected void service(HttpServletRequest request, HttpServletResponse response) throws IOException {
            String query = request.getQueryString();
            URI uri = URI.create(request.getRequestURI() + (query == null ? "" : "?" + query));
            String target = uri.getPath() + (uri.getQuery() == null ? "" : "?" + uri.getQuery());
            requests.add(new RecordedRequest(request.getMethod(), target, request.getHeader("Range"),
                request.getHeader("Authorization")));
            logger.debug("{} {} (Range: {})", request.getMethod(), target, request.getHeader("Range"));

            Responder responder = next(target);
            if (responder == null) {
                byte[] body = ("No route for " + target).getBytes(StandardCharsets.UTF_8);
                response.setStatus(HttpServletResponse.SC_NOT_FOUND);
                response.setContentType("text/plain");
                response.getOutputStream().write(body);
                return;
            }
            responder.respond(request, response);
        }
    }

    /// Stops the server.
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Data hub test server stopped");
            } catch (Exception e) {
                logger.error("Error stopping data hub test server", e);
            }
        }
    }

    private static int findAvailablePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
