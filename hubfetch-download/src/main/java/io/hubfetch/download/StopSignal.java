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

import io.hubfetch.api.errors.DownloadCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// A one-shot cancellation flag shared by all workers of a batch.
///
/// Waits on the signal end as soon as it is set, so every sleep in the download and retrieval
/// paths goes through {@link #await(Duration)} rather than {@link Thread#sleep(long)}.
public class StopSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    /// Sets the signal. Idempotent.
    public void set() {
        latch.countDown();
    }

    /// @return true once the signal has been set
    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /// Waits for the signal for at most the given duration.
    ///
    /// @param timeout the longest time to wait
    /// @return true if the signal was set, false if the time elapsed first
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isSet();
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /// @param what a description of the work being cancelled, used in the exception message
    /// @throws DownloadCancelledException if the signal is set
    public void throwIfSet(String what) {
        if (isSet()) {
            throw new DownloadCancelledException(what + " was cancelled");
        }
    }
}
