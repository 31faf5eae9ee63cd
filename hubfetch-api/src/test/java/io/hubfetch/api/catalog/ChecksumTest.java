package io.hubfetch.api.catalog;

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

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ChecksumTest {

    @Test
    public void testAlgorithmLookup() {
        assertEquals(Optional.of(ChecksumAlgorithm.MD5), ChecksumAlgorithm.fromHubName("md5"));
        assertEquals(Optional.of(ChecksumAlgorithm.SHA3_256), ChecksumAlgorithm.fromHubName(" SHA3-256 "));
        assertEquals(Optional.empty(), ChecksumAlgorithm.fromHubName("CRC32"));
        assertEquals(Optional.empty(), ChecksumAlgorithm.fromHubName(null));
    }

    @Test
    public void testOfHubValues() {
        Checksum checksum = Checksum.ofHubValues("MD5", " 900150983CD24FB0D6963F7D28E17F72 ");
        assertNotNull(checksum);
        assertEquals("900150983CD24FB0D6963F7D28E17F72", checksum.hexDigest());
        assertTrue(checksum.matches("900150983cd24fb0d6963f7d28e17f72"));
        assertFalse(checksum.matches("5eb63bbbe01eeed093cb22bb8f5acdc3"));
        assertFalse(checksum.matches(null));

        assertNull(Checksum.ofHubValues("MD5", ""));
        assertNull(Checksum.ofHubValues("CRC32", "1234"));
    }

    @Test
    public void testDescriptors() {
        ProductDescriptor product = new ProductDescriptor("id", "title", 10, null, false, "http://hub/$value", null);
        assertSame(product, product.withOnline(false));
        assertTrue(product.withOnline(true).online());
        assertEquals("id", product.withOnline(true).id());
        assertThrows(IllegalArgumentException.class,
            () -> new ProductDescriptor("id", "title", -1, null, true, "http://hub/$value", null));

        NodeDescriptor node = new NodeDescriptor("id", "./measurement/a.tiff", 5, null, "http://hub/a");
        assertEquals("measurement/a.tiff", node.relativePath());
        assertEquals("b.xml", new NodeDescriptor("id", "b.xml", 5, null, "http://hub/b").relativePath());
    }
}
