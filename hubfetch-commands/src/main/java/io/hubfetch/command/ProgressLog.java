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

import io.hubfetch.download.ProgressListener;
import io.hubfetch.download.TransferProgress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// Logs download progress: batch counts at info level, file progress in quarter steps at debug level.
class ProgressLog implements ProgressListener {
    private static final Logger logger = LogManager.getLogger(ProgressLog.class);

    private static final int STEPS = 4;

    private final Map<Path, Integer> loggedSteps = new ConcurrentHashMap<>();

    @Override
    public void onTransfer(TransferProgress progress) {
        if (crossedStep(progress)) {
            logger.debug("{}: {}% of {} bytes written", progress.path().getFileName(),
                Math.round(progress.getProgress() * 100), progress.totalBytes());
        }
    }

    @Override
    public void onVerify(TransferProgress progress) {
        if (progress.isDone()) {
            logger.debug("{}: checksum computed over {} bytes", progress.path().getFileName(), progress.totalBytes());
        }
    }

    @Override
    public void onProductDownloaded(int done, int total) {
        logger.info("Downloaded {} of {} products", done, total);
    }

    @Override
    public void onProductRetrieved(int done, int total) {
        logger.info("Retrieved {} of {} products from the Long Term Archive", done, total);
    }

    /// @return true if the file moved into a later quarter since it was last logged
    boolean crossedStep(TransferProgress progress) {
        int step = (int) Math.floor(Math.min(1.0, progress.getProgress()) * STEPS);
        Integer previous = loggedSteps.put(progress.path(), step);
        if (progress.isDone()) {
            loggedSteps.remove(progress.path());
        }
        return previous == null ? step > 0 : step > previous;
    }
}
