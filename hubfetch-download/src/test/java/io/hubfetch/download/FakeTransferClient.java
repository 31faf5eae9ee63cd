package io.hubfetch.download;

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

import io.hubfetch.api.transport.ByteRange;
import io.hubfetch.api.transport.TransferClient;
import io.hubfetch.api.transport.TransferResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/// In memory {@link TransferClient} serving byte content with range support.
///
/// URLs can be scripted with a sequence of handlers, one per request with the last one
/// repeating. Unscripted URLs with content are served like the hub serves archives.
class FakeTransferClient implements TransferClient {

    @FunctionalInterface
    interface Handler {
        TransferResponse handle(ByteRange range) throws IOException;
    }

    record Request(String url, ByteRange range) {
    }

    private final Map<String, byte[]> content = new ConcurrentHashMap<>();
    private final Map<String, List<Handler>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> positions = new ConcurrentHashMap<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    FakeTransferClient serve(String url, byte[] bytes) {
        content.put(url, bytes);
        return this;
    }

    FakeTransferClient script(String url, Handler... handlers) {
        scripts.put(url, List.of(handlers));
        positions.put(url, new AtomicInteger());
        return this;
    }

    /// Serves content like an archived product: the two byte retrieval probe is accepted with
    /// HTTP 202, any other request streams the content.
    FakeTransferClient archived(String url, byte[] bytes) {
        return script(url, range -> range != null && !range.isOpenEnded()
            ? FakeResponse.status(202)
            : respondWith(bytes, range));
    }

    Handler content(byte[] bytes) {
        return range -> respondWith(bytes, range);
    }

    @Override
    public TransferResponse get(String url, ByteRange range) throws IOException {
        requests.add(new Request(url, range));
        List<Handler> script = scripts.get(url);
        if (script != null) {
            int position = positions.get(url).getAndIncrement();
            return script.get(Math.min(position, script.size() - 1)).handle(range);
        }
        byte[] bytes = content.get(url);
        if (bytes == null) {
            return FakeResponse.status(404);
        }
        return respondWith(bytes, range);
    }

    static TransferResponse respondWith(byte[] bytes, ByteRange range) {
        if (range == null) {
            return new FakeResponse(200, bytes, Map.of());
        }
        if (range.start() >= bytes.length) {
            return FakeResponse.status(416);
        }
        int end = range.isOpenEnded() ? bytes.length - 1 : (int) Math.min(range.end(), bytes.length - 1);
        return new FakeResponse(206, Arrays.copyOfRange(bytes, (int) range.start(), end + 1), Map.of());
    }

    List<Request> requests() {
        return new ArrayList<>(requests);
    }

    List<Request> requestsFor(String url) {
        List<Request> found = new ArrayList<>();
        for (Request request : requests) {
            if (request.url().equals(url)) {
                found.add(request);
            }
        }
        return found;
    }

    /// @return requests that transfer content, i.e. not the two byte retrieval probes
    List<Request> transfersFor(String url) {
        List<Request> found = new ArrayList<>();
        for (Request request : requestsFor(url)) {
            if (request.range() == null || request.range().isOpenEnded()) {
                found.add(request);
            }
        }
        return found;
    }
}
