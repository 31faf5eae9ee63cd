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

import io.hubfetch.api.transport.TransferResponse;

import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/// A 200 response whose body yields one byte per delay, like a stalled connection.
///
/// Reads fail with {@link InterruptedIOException} when the reading thread is interrupted.
class SlowResponse implements TransferResponse {
    private final byte[] body;
    private final Duration delay;
    final CountDownLatch started = new CountDownLatch(1);
    volatile boolean interrupted;
    volatile boolean closed;

    SlowResponse(byte[] body, Duration delay) {
        this.body = body;
        this.delay = delay;
    }

    @Override
    public int statusCode() {
        return 200;
    }

    @Override
    public String reason() {
        return "";
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.empty();
    }

    @Override
    public InputStream body() {
        return new InputStream() {
            private int position;

            @Override
            public int read() throws InterruptedIOException {
                if (position >= body.length) {
                    return -1;
                }
                started.countDown();
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    interrupted = true;
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Read interrupted after " + position + " bytes");
                }
                return body[position++] & 0xff;
            }

            @Override
            public int read(byte[] b, int off, int len) throws InterruptedIOException {
                if (len == 0) {
                    return 0;
                }
                int value = read();
                if (value < 0) {
                    return -1;
                }
                b[off] = (byte) value;
                return 1;
            }
        };
    }

    @Override
    public void close() {
        closed = true;
    }
}
