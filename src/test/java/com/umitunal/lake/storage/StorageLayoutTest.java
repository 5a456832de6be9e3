/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.lake.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the StorageLayout class.
 */
class StorageLayoutTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreateDirectories() throws IOException {
        StorageLayout layout = new StorageLayout(tempDir);
        layout.createDirectories();

        assertTrue(Files.isDirectory(layout.hotRoot()));
        assertTrue(Files.isDirectory(layout.coldRoot()));
        assertTrue(Files.isDirectory(layout.backupRoot()));
        assertTrue(Files.isDirectory(layout.walDirectory()));
        assertTrue(Files.isDirectory(layout.checkpointDirectory()));
        assertTrue(Files.isDirectory(layout.catalogFile().getParent()));
        assertTrue(Files.isDirectory(layout.indexFile().getParent()));
    }

    @Test
    void testResolveAndKeyOfAreInverse() {
        StorageLayout layout = new StorageLayout(tempDir);
        String key = "orders/acme/region=N/1_1.col";

        Path hot = layout.resolve(key, Tier.HOT);
        Path cold = layout.resolve(key, Tier.COLD);

        assertTrue(hot.startsWith(layout.hotRoot()));
        assertTrue(cold.startsWith(layout.coldRoot()));
        assertEquals(key, layout.keyOf(hot, Tier.HOT));
        assertEquals(key, layout.keyOf(cold, Tier.COLD));
    }

    @Test
    void testResolveRejectsEscapingKeys() {
        StorageLayout layout = new StorageLayout(tempDir);

        assertThrows(IllegalArgumentException.class, () -> layout.resolve("../outside.col", Tier.HOT));
        assertThrows(IllegalArgumentException.class, () -> layout.resolve("orders/../../cold/x.col", Tier.HOT));
    }

    @Test
    void testDataFileKey() {
        assertEquals("orders/acme/1_2.col", StorageLayout.dataFileKey("orders", "acme", List.of(), "1_2.col"));
        assertEquals("orders/acme/region=N/day=1/1_2.col",
            StorageLayout.dataFileKey("orders", "acme", List.of("region=N", "day=1"), "1_2.col"));
    }

    @Test
    void testKeyParts() {
        String key = "orders/acme/region=N/1_2.col";

        assertEquals("orders", StorageLayout.sourceOf(key));
        assertEquals("acme", StorageLayout.tenantOf(key));
        assertEquals("orders/acme/region=N", StorageLayout.directoryOf(key));

        assertEquals("orders", StorageLayout.sourceOf("orders"));
        assertNull(StorageLayout.tenantOf("orders/acme"));
        assertEquals("", StorageLayout.directoryOf("file.col"));
    }

    @Test
    void testPartitionSegmentEscaping() {
        assertEquals("region=N", StorageLayout.partitionSegment("region", "N"));
        assertEquals("region=__null__", StorageLayout.partitionSegment("region", null));
        assertEquals("path=a%2Fb", StorageLayout.partitionSegment("path", "a/b"));
        assertEquals("expr=x%3Dy", StorageLayout.partitionSegment("expr", "x=y"));
        assertEquals("pct=50%25", StorageLayout.partitionSegment("pct", "50%"));
        assertEquals("dir=%2E%2E", StorageLayout.partitionSegment("dir", ".."));
        assertEquals("day=7", StorageLayout.partitionSegment("day", 7L));
    }
}
