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

import io.hubfetch.api.catalog.ProductDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FileIntegrityCheckerTest {

    private final FakeCatalog catalog = new FakeCatalog();
    private final FileIntegrityChecker checker = new FileIntegrityChecker(catalog, new ChecksumVerifier());

    @Test
    public void testFindsMissingAndCorruptFiles(@TempDir Path tempDir) throws Exception {
        catalog.add("good", FakeCatalog.bytes("hello world"), true);
        catalog.add("corrupt", FakeCatalog.bytes("hello world"), true);
        catalog.add("short", FakeCatalog.bytes("hello world"), true);
        ProductDescriptor missing = catalog.add("missing", FakeCatalog.bytes("hello world"), true);
        Files.writeString(tempDir.resolve("P_good.zip"), "hello world");
        Files.writeString(tempDir.resolve("P_corrupt.zip"), "jello world");
        Files.writeString(tempDir.resolve("P_short.zip"), "hello");

        Map<Path, ProductDescriptor> bad = checker.checkFiles(List.of("good", "corrupt", "short", "missing"), tempDir, false);

        assertEquals(Set.of(tempDir.resolve("P_corrupt.zip"), tempDir.resolve("P_short.zip"), tempDir.resolve("P_missing.zip")),
            bad.keySet());
        assertEquals(missing, bad.get(tempDir.resolve("P_missing.zip")));
        assertTrue(Files.exists(tempDir.resolve("P_corrupt.zip")), "Nothing is deleted unless requested");
    }

    @Test
    public void testDeletesCorruptFiles(@TempDir Path tempDir) throws Exception {
        catalog.add("corrupt", FakeCatalog.bytes("hello world"), true);
        catalog.add("good", FakeCatalog.bytes("hello world"), true);
        Files.writeString(tempDir.resolve("P_corrupt.zip"), "jello world");
        Files.writeString(tempDir.resolve("P_good.zip"), "hello world");

        Map<Path, ProductDescriptor> bad = checker.checkFiles(List.of("corrupt", "good"), tempDir, true);

        assertEquals(Set.of(tempDir.resolve("P_corrupt.zip")), bad.keySet());
        assertFalse(Files.exists(tempDir.resolve("P_corrupt.zip")));
        assertTrue(Files.exists(tempDir.resolve("P_good.zip")));
    }

    @Test
    public void testSizeOnlyWithoutChecksum(@TempDir Path tempDir) throws Exception {
        catalog.add(new ProductDescriptor("n", "P_n", 11, null, true, FakeCatalog.urlOf("n"), null));
        Files.writeString(tempDir.resolve("P_n.zip"), "jello world");

        assertTrue(checker.checkFiles(List.of("n"), tempDir, true).isEmpty());
    }
}
