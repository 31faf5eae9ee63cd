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

import io.hubfetch.api.catalog.CatalogClient;
import io.hubfetch.api.catalog.ProductDescriptor;
import io.hubfetch.api.errors.DownloadCancelledException;
import io.hubfetch.api.errors.LTAException;
import io.hubfetch.api.errors.LTAException.LtaFailure;
import io.hubfetch.api.errors.ServerErrorException;
import io.hubfetch.api.errors.UnauthorizedException;
import io.hubfetch.api.transport.ByteRange;
import io.hubfetch.api.transport.TransferClient;
import io.hubfetch.api.transport.TransferResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/// Requests retrieval of archived products and waits for them to come online.
///
/// A retrieval is requested by asking for the first two bytes of the product. Requesting zero
/// bytes is rejected by the hub, and requesting more would start a real transfer of an online
/// product.
public class RetrievalTrigger {
    private static final Logger logger = LogManager.getLogger(RetrievalTrigger.class);

    static final String CONCURRENT_FLOWS = "concurrent flows";
    private static final ByteRange PROBE_RANGE = ByteRange.of(0, 1);

    private final CatalogClient catalog;
    private final TransferClient client;
    private final ConcurrencyLimiter limiter;

    /// @param catalog the catalog used to poll the online flag
    /// @param client the transfer client used for the retrieval request
    /// @param limiter the limiter that gates retrieval requests
    public RetrievalTrigger(CatalogClient catalog, TransferClient client, ConcurrencyLimiter limiter) {
        this.catalog = catalog;
        this.client = client;
        this.limiter = limiter;
    }

    private record ProbeReply(int statusCode, String reason, String cause) {
    }

    /// Requests retrieval of an archived product.
    ///
    /// @param product the product
    /// @return true if the retrieval was accepted, false if the product is already online
    /// @throws LTAException if the hub refused the request, see {@link LtaFailure}
    /// @throws UnauthorizedException if the credentials were rejected
    /// @throws ServerErrorException for any other unexpected response
    /// @throws IOException if the hub cannot be reached
    /// @throws InterruptedException if interrupted while waiting for a permit
    public boolean triggerOfflineRetrieval(ProductDescriptor product) throws IOException, InterruptedException {
        ProbeReply reply = limiter.withTriggerPermit(() -> limiter.withTransferPermit(() -> probe(product)));
        int code = reply.statusCode();
        String cause = reply.cause();

        if (code == 200 || code == 206) {
            logger.debug("{} is online", product.id());
            return false;
        }
        if (code == 202) {
            logger.debug("{} accepted for retrieval", product.id());
            return true;
        }
        if (code == 403 && cause != null && cause.contains(CONCURRENT_FLOWS)) {
            logger.debug("{} is online but the concurrent downloads limit was exceeded", product.id());
            return false;
        }
        if (code == 403) {
            String msg = "User quota exceeded: " + cause;
            logger.error(msg);
            throw new LTAException(msg, LtaFailure.QUOTA_EXCEEDED, code, cause);
        }
        if (code == 503) {
            String msg = "Request not accepted: " + cause;
            logger.error(msg);
            throw new LTAException(msg, LtaFailure.NOT_ACCEPTED, code, cause);
        }
        if (code == 401) {
            throw new UnauthorizedException("Invalid user name or password", code, cause);
        }
        String msg = "Unexpected response " + code + (reply.reason().isEmpty() ? "" : " " + reply.reason()) + ": " + cause;
        logger.error(msg);
        throw new ServerErrorException(msg, code, cause);
    }

    private ProbeReply probe(ProductDescriptor product) throws IOException {
        try (TransferResponse response = client.get(product.url(), PROBE_RANGE)) {
            return new ProbeReply(response.statusCode(), response.reason(),
                response.header(TransferResponse.CAUSE_MESSAGE_HEADER).orElse(null));
        }
    }

    /// Requests retrieval of an archived product and waits until it is online.
    ///
    /// The request is repeated while the hub does not accept it. Once accepted, the online flag
    /// is polled until it turns true. Every wait between polls ends early when the stop signal
    /// is set.
    ///
    /// @param product the product
    /// @param listener receives {@link DownloadStatus#TRIGGERED} and {@link DownloadStatus#ONLINE}
    /// @param retryDelay the delay between polls and retried requests
    /// @param timeout the longest time to wait, or null to wait indefinitely
    /// @param stop the batch stop signal
    /// @return the descriptor with its online flag set
    /// @throws LTAException with {@link LtaFailure#QUOTA_EXCEEDED} or {@link LtaFailure#TIMEOUT}
    /// @throws DownloadCancelledException if the stop signal is set
    /// @throws IOException if the hub cannot be reached
    /// @throws InterruptedException if interrupted while waiting
    public ProductDescriptor awaitOnline(ProductDescriptor product, Consumer<DownloadStatus> listener,
                                         Duration retryDelay, Duration timeout, StopSignal stop)
        throws IOException, InterruptedException {
        String what = "Retrieval of " + product.id();
        Instant deadline = timeout == null ? null : Instant.now().plus(timeout);
        boolean triggering = true;

        while (!pollOnline(product)) {
            stop.throwIfSet(what);
            if (triggering) {
                try {
                    if (triggerOfflineRetrieval(product)) {
                        triggering = false;
                        listener.accept(DownloadStatus.TRIGGERED);
                        logger.info("{} accepted for retrieval", product.id());
                    } else {
                        break;
                    }
                } catch (LTAException e) {
                    if (e.isTerminal()) {
                        throw e;
                    }
                    logger.info("Request for {} was not accepted: {}. Retrying in {}",
                        product.id(), e.getMessage(), retryDelay);
                } catch (ServerErrorException e) {
                    logger.info("Request for {} failed: {}. Retrying in {}",
                        product.id(), e.getMessage(), retryDelay);
                }
            }

            Duration wait = retryDelay;
            if (deadline != null) {
                Duration remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    throw new LTAException(product.id() + " did not come online within " + timeout, LtaFailure.TIMEOUT);
                }
                if (remaining.compareTo(wait) < 0) {
                    wait = remaining;
                }
            }
            if (stop.await(wait)) {
                throw new DownloadCancelledException(what + " was cancelled");
            }
        }

        logger.info("{} retrieval from LTA completed", product.id());
        listener.accept(DownloadStatus.ONLINE);
        return product.withOnline(true);
    }

    private boolean pollOnline(ProductDescriptor product) throws IOException {
        try {
            return catalog.isOnline(product.id());
        } catch (ServerErrorException e) {
            logger.info("Polling the online flag of {} failed: {}", product.id(), e.getMessage());
            return false;
        }
    }
}
