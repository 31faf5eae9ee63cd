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

/// Receives progress of a download run.
///
/// Batch runs call the listener from several worker threads at once, so implementations must be
/// thread safe. Every method defaults to doing nothing.
public interface ProgressListener {

    /// A listener that ignores all progress
    ProgressListener NONE = new ProgressListener() {
    };

    /// Called after every chunk written to a file.
    /// @param progress the progress of the file
    default void onTransfer(TransferProgress progress) {
    }

    /// Called while a completed file is checked against its declared checksum.
    /// @param progress the number of bytes hashed so far
    default void onVerify(TransferProgress progress) {
    }

    /// Called when a product of a batch run is downloaded or found already present.
    /// @param done the number of products downloaded so far
    /// @param total the number of products in the batch
    default void onProductDownloaded(int done, int total) {
    }

    /// Called when an archived product of a batch run came online.
    /// @param done the number of products retrieved so far
    /// @param total the number of archived products in the batch
    default void onProductRetrieved(int done, int total) {
    }
}
