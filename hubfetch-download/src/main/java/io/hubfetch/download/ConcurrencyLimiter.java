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

import java.io.IOException;
import java.util.concurrent.Semaphore;

/// Bounds concurrent requests against the two server side quotas.
///
/// Every request that counts against the hub's limit on concurrent transfer connections runs
/// inside {@link #withTransferPermit}, including small probes and each individual chunk read of a
/// long transfer. Archive retrieval requests additionally run inside {@link #withTriggerPermit}.
/// When both are needed the trigger permit is acquired first.
///
/// Resizing replaces the semaphore. A holder always releases on the semaphore it acquired from,
/// so outstanding permits stay valid and new acquisitions see the new capacity.
public class ConcurrencyLimiter {

    /// An I/O action executed while holding a permit.
    /// @param <T> the result type
    @FunctionalInterface
    public interface PermitAction<T> {
        /// @return the action result
        /// @throws IOException if the action fails
        /// @throws InterruptedException if the action waits for a nested permit and is interrupted
        T run() throws IOException, InterruptedException;
    }

    private volatile Semaphore transferPermits;
    private volatile Semaphore triggerPermits;
    private volatile int maxTransfers;
    private volatile int maxTriggers;

    /// @param maxTransfers the maximum number of concurrent transfer requests
    /// @param maxTriggers the maximum number of concurrent archive retrieval requests
    public ConcurrencyLimiter(int maxTransfers, int maxTriggers) {
        resizeTransfers(maxTransfers);
        resizeTriggers(maxTriggers);
    }

    /// Runs an action while holding a transfer permit.
    ///
    /// @param action the action
    /// @param <T> the result type
    /// @return the action's result
    /// @throws IOException if the action fails
    /// @throws InterruptedException if interrupted while waiting for a permit
    public <T> T withTransferPermit(PermitAction<T> action) throws IOException, InterruptedException {
        return runHolding(transferPermits, action);
    }

    /// Runs an action while holding a trigger permit.
    ///
    /// @param action the action
    /// @param <T> the result type
    /// @return the action's result
    /// @throws IOException if the action fails
    /// @throws InterruptedException if interrupted while waiting for a permit
    public <T> T withTriggerPermit(PermitAction<T> action) throws IOException, InterruptedException {
        return runHolding(triggerPermits, action);
    }

    private static <T> T runHolding(Semaphore semaphore, PermitAction<T> action)
        throws IOException, InterruptedException {
        semaphore.acquire();
        try {
            return action.run();
        } finally {
            semaphore.release();
        }
    }

    /// @param maxTransfers the new maximum number of concurrent transfer requests
    public synchronized void resizeTransfers(int maxTransfers) {
        if (maxTransfers <= 0) {
            throw new IllegalArgumentException("Transfer quota must be positive: " + maxTransfers);
        }
        this.maxTransfers = maxTransfers;
        this.transferPermits = new Semaphore(maxTransfers, true);
    }

    /// @param maxTriggers the new maximum number of concurrent archive retrieval requests
    public synchronized void resizeTriggers(int maxTriggers) {
        if (maxTriggers <= 0) {
            throw new IllegalArgumentException("Trigger quota must be positive: " + maxTriggers);
        }
        this.maxTriggers = maxTriggers;
        this.triggerPermits = new Semaphore(maxTriggers, true);
    }

    /// @return the current transfer quota
    public int getMaxTransfers() {
        return maxTransfers;
    }

    /// @return the current trigger quota
    public int getMaxTriggers() {
        return maxTriggers;
    }

    /// @return transfer permits currently free on the active semaphore
    public int availableTransferPermits() {
        return transferPermits.availablePermits();
    }

    /// @return trigger permits currently free on the active semaphore
    public int availableTriggerPermits() {
        return triggerPermits.availablePermits();
    }
}
