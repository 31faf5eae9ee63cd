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

/// Progress of one product within a download batch.
///
/// Declaration order is the order of progress. Within a batch a status only moves forward,
/// {@link #UNAVAILABLE} is terminal and {@link #DOWNLOADED} never regresses.
public enum DownloadStatus {
    /// no usable metadata, the product takes no further part in the batch
    UNAVAILABLE,
    /// known to be archived in the Long Term Archive
    OFFLINE,
    /// retrieval from the archive was requested and accepted
    TRIGGERED,
    /// resident in fast storage and ready to transfer
    ONLINE,
    /// a download worker has started transferring
    DOWNLOAD_STARTED,
    /// transfer complete and, if requested, checksum verified
    DOWNLOADED;

    /// @return true only for {@link #DOWNLOADED}
    public boolean isSuccessful() {
        return this == DOWNLOADED;
    }

    /// @param next a proposed new status
    /// @return true if moving from this status to next keeps the batch progression monotonic
    public boolean canAdvanceTo(DownloadStatus next) {
        if (this == UNAVAILABLE || this == DOWNLOADED) {
            return false;
        }
        return next.ordinal() >= this.ordinal();
    }
}
