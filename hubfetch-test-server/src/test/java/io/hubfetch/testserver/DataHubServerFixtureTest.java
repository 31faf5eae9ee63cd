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

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DataHubServerFixtureTest {

    private static DataHubServerFixture hub;
    private static final OkHttpClient http = new OkHttpClient();

    @BeforeAll
    public static void startServer() throws IOException {
        hub = new DataHubServerFixture();
        hub.start();
    }

    @AfterAll
    public static void stopServer() {
        hub.close();
    }

    @BeforeEach
    public void reset() {
        hub.reset();
    }

    private Response get(String path, String range) throws IOException {
        Request.Builder request = new Request.Builder().url(hub.getBaseUrl() + path);
        if (range != null) {
            request.header("Range", range);
        }
        return http.newCall(request.build()).execute();
    }

    @Test
    public void testRangeRequests() throws IOException {
        hub.route("/file", Responders.bytes("0123456789".getBytes(StandardCharsets.UTF_8)));

        try (Response response = get("file", null)) {
            assertEquals(200, response.code());
            assertEquals("0123456789", response.body().string());
        }
        try (Response response = get("file", "bytes=3-")) {
            assertEquals(206, response.code());
            assertEquals("bytes 3-9/10", response.header("Content-Range"));
            assertEquals("3456789", response.body().string());
        }
        try (Response response = get("file", "bytes=0-1")) {
            assertEquals(206, response.code());
            assertEquals("01", response.body().string());
        }
        try (Response response = get("file", "bytes=10-")) {
            assertEquals(416, response.code());
        }

        assertEquals(4, hub.hits("/file"));
        assertEquals("bytes=10-", hub.lastRange("/file"));
    }

    @Test
    public void testScriptedSequenceRepeatsLastResponder() throws IOException {
        hub.route("/odata/v1/Products('p1')/Online/$value", Responders.text("false"), Responders.text("true"));

        String path = "odata/v1/Products('p1')/Online/$value";
        for (String expected : new String[] {"false", "true", "true"}) {
            try (Response response = get(path, null)) {
                assertEquals(expected, response.body().string());
            }
        }
        assertEquals(3, hub.hits("/odata/v1/Products('p1')/Online/$value"));
    }

    @Test
    public void testUnroutedRequestsAreRecorded() throws IOException {
        try (Response response = get("odata/v1/Products('x')?$format=json", null)) {
            assertEquals(404, response.code());
            assertEquals("No route for /odata/v1/Products('x')?$format=json", response.body().string());
        }
        DataHubServerFixture.RecordedRequest request = hub.requests().get(0);
        assertEquals("GET", request.method());
        assertEquals("/odata/v1/Products('x')?$format=json", request.target());
        assertNull(request.authorization());
    }

    @Test
    public void testResetClearsRoutes() throws IOException {
        hub.route("/gone", Responders.status(202));
        hub.reset();
        try (Response response = get("gone", null)) {
            assertEquals(404, response.code());
        }
        assertThrows(IllegalArgumentException.class, () -> hub.route("/empty"));
    }
}
