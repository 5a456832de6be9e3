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

package com.umitunal.lake.wal.checkpoint;

import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.storage.ObjectMappers;
import com.umitunal.lake.storage.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the CheckpointManager class.
 */
class CheckpointManagerTest {

    @TempDir
    Path tempDir;

    private CheckpointManager checkpointManager;

    @BeforeEach
    void setUp() throws IOException {
        checkpointManager = new CheckpointManager(tempDir.resolve("checkpoints"), ObjectMappers.create(), 2);
    }

    private static FileMetadata file(String path, Tier tier) {
        return new FileMetadata(path, "orders", "acme", 128, 4, 1000L, 2000L, tier,
            List.of("id", "amount"), 1000L, 7L, Map.of("partition.region", "N"));
    }

    @Test
    void testNoCheckpointInitially() throws IOException {
        assertTrue(checkpointManager.latest().isEmpty());
        assertEquals(0, checkpointManager.count());
    }

    @Test
    void testLatestReturnsNewest() throws IOException {
        FileMetadata hot = file("orders/acme/region=N/1_1_000.col", Tier.HOT);
        FileMetadata cold = file("orders/acme/region=N/1_2_000.col", Tier.COLD);
        checkpointManager.write(1000L, "wal_a.log", List.of(hot));
        checkpointManager.write(2000L, "wal_b.log", List.of(hot, cold));

        Optional<Checkpoint> latest = checkpointManager.latest();

        assertTrue(latest.isPresent());
        assertEquals("wal_b.log", latest.get().segment());
        assertEquals(2000L, latest.get().createdAt());
        assertEquals(List.of(hot, cold), latest.get().files());
    }

    @Test
    void testOldCheckpointsRemoved() throws IOException {
        checkpointManager.write(1000L, "wal_a.log", List.of());
        checkpointManager.write(2000L, "wal_b.log", List.of());
        checkpointManager.write(3000L, "wal_c.log", List.of());

        assertEquals(2, checkpointManager.count());
        assertFalse(Files.exists(tempDir.resolve("checkpoints").resolve("checkpoint_0000000001000.json")));
    }

    @Test
    void testUnreadableCheckpointPassedOver() throws IOException {
        checkpointManager.write(1000L, "wal_a.log", List.of());
        Files.writeString(tempDir.resolve("checkpoints").resolve("checkpoint_0000000009000.json"), "{ not json");

        assertEquals("wal_a.log", checkpointManager.latest().orElseThrow().segment());
    }
}
