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

import io.hubfetch.download.TransferProgress;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ProgressLogTest {

    @Test
    public void testLogsEachQuarterOnce() {
        ProgressLog log = new ProgressLog();
        TransferProgress progress = TransferProgress.of(Path.of("P_a.zip.incomplete"), 100, 0);
        List<Long> logged = new ArrayList<>();

        for (int i = 0; i < 10; i++) {
            progress.currentBytes().addAndGet(10);
            if (log.crossedStep(progress)) {
                logged.add(progress.getCurrentBytes());
            }
        }

        assertThat(logged).containsExactly(30L, 50L, 80L, 100L);
    }

    @Test
    public void testResumedTransferStartsPastFirstQuarter() {
        ProgressLog log = new ProgressLog();
        TransferProgress progress = TransferProgress.of(Path.of("P_b.zip.incomplete"), 100, 60);

        progress.currentBytes().addAndGet(5);
        assertThat(log.crossedStep(progress)).isTrue();
        progress.currentBytes().addAndGet(5);
        assertThat(log.crossedStep(progress)).isFalse();
        progress.currentBytes().addAndGet(30);
        assertThat(log.crossedStep(progress)).isTrue();
    }
}
