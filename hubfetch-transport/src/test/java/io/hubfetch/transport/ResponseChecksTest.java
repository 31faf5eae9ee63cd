package io.hubfetch.transport;

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
import io.hubfetch.api.errors.UnauthorizedException;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseChecksTest {

    private static Response response(int code, String body, String causeHeader) {
        Response.Builder builder = new Response.Builder()
            .request(new Request.Builder().url("http://hub.example.org/odata/v1/Products").build())
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message("")
            .body(ResponseBody.create(body, MediaType.get("application/json")));
        if (causeHeader != null) {
            builder.header("cause-message", causeHeader);
        }
        return builder.build();
    }

    @Test
    public void testCausePrefersHeader() {
        assertEquals("from header", ResponseChecks.causeOf(response(503, "{\"error\":{\"message\":{\"value\":\"from body\"}}}",
            "from header")));
        assertEquals("from body", ResponseChecks.causeOf(response(503, "{\"error\":{\"message\":{\"value\":\"from body\"}}}",
            null)));
        assertNull(ResponseChecks.causeOf(response(503, "<html>busy</html>", null)));
    }

    @Test
    public void testCheck() {
        ResponseChecks.check(response(200, "{}", null), "Anything");

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
            () -> ResponseChecks.check(response(401, "", null), "Metadata request for x"));
        assertEquals("Metadata request for x failed with HTTP 401", e.getMessage());

        DataHubException other = assertThrows(DataHubException.class,
            () -> ResponseChecks.check(response(409, "", "conflict"), "Request"));
        assertEquals(409, other.getStatusCode());
        assertEquals("Request failed with HTTP 409: conflict", other.getMessage());
    }
}
