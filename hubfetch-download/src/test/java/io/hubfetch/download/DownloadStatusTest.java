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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DownloadStatusTest {

    @Test
    public void testProgressOnlyMovesForward() {
        assertTrue(DownloadStatus.OFFLINE.canAdvanceTo(DownloadStatus.TRIGGERED));
        assertTrue(DownloadStatus.TRIGGERED.canAdvanceTo(DownloadStatus.ONLINE));
        assertTrue(DownloadStatus.ONLINE.canAdvanceTo(DownloadStatus.DOWNLOAD_STARTED));
        assertTrue(DownloadStatus.DOWNLOAD_STARTED.canAdvanceTo(DownloadStatus.DOWNLOAD_STARTED),
            "A retry reports DOWNLOAD_STARTED again");
        assertTrue(DownloadStatus.OFFLINE.canAdvanceTo(DownloadStatus.DOWNLOADED));

        assertFalse(DownloadStatus.ONLINE.canAdvanceTo(DownloadStatus.TRIGGERED));
        assertFalse(DownloadStatus.DOWNLOAD_STARTED.canAdvanceTo(DownloadStatus.ONLINE));
    }

    @Test
    public void testTerminalStatuses() {
        for (DownloadStatus next : DownloadStatus.values()) {
            assertFalse(DownloadStatus.UNAVAILABLE.canAdvanceTo(next), "UNAVAILABLE -> " + next);
            assertFalse(DownloadStatus.DOWNLOADED.canAdvanceTo(next), "DOWNLOADED -> " + next);
        }
        assertTrue(DownloadStatus.DOWNLOADED.isSuccessful());
        assertFalse(DownloadStatus.ONLINE.isSuccessful());
    }

    @Test
    public void testBatchStateIgnoresRegressions() {
        BatchState state = new BatchState();
        state.initialize("a", DownloadStatus.OFFLINE);
        assertTrue(state.advance("a", DownloadStatus.ONLINE));
        assertFalse(state.advance("a", DownloadStatus.TRIGGERED));
        assertEquals(DownloadStatus.ONLINE, state.status("a"));

        state.initialize("b", DownloadStatus.UNAVAILABLE);
        assertFalse(state.advance("b", DownloadStatus.DOWNLOADED));
        assertEquals(DownloadStatus.UNAVAILABLE, state.status("b"));
        assertFalse(state.anyDownloaded());
    }
}
