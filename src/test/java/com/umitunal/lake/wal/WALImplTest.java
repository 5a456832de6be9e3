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

package com.umitunal.lake.wal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.config.WalConfig;
import com.umitunal.lake.storage.ObjectMappers;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.testutil.MutableClock;
import com.umitunal.lake.wal.checkpoint.CheckpointManager;
import com.umitunal.lake.wal.manager.WALManager;
import com.umitunal.lake.wal.manager.WALManagerImpl;
import com.umitunal.lake.wal.reader.WALReaderImpl;
import com.umitunal.lake.wal.record.OperationKind;
import com.umitunal.lake.wal.record.OperationStatus;
import com.umitunal.lake.wal.record.WalEntry;
import com.umitunal.lake.wal.record.WalEntryCodec;
import com.umitunal.lake.wal.writer.WALWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the WALImpl class.
 */
class WALImplTest {
    private WAL wal;
    private MutableClock clock;
    private ObjectMapper objectMapper;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        objectMapper = ObjectMappers.create();
        wal = open(WalConfig.getDefault());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (wal != null) {
            wal.close();
        }
    }

    private WAL open(WalConfig config) throws IOException {
        return new WALImpl(tempDir.resolve("wal"), tempDir.resolve("checkpoints"), config, objectMapper, clock);
    }

    private List<WalEntry> readAll(WAL target) throws IOException {
        List<WalEntry> entries = new ArrayList<>();
        target.replay(entries::add);
        return entries;
    }

    @Test
    void testBufferFlushesAtThreshold() throws IOException {
        for (int i = 0; i < 49; i++) {
            wal.begin(wal.newOperationId(), OperationKind.WRITE, Map.of("n", i));
        }

        // below the threshold nothing reaches the segment
        assertEquals(49, wal.status().bufferedEntries());
        assertEquals(0, wal.status().flushedEntries());

        wal.begin(wal.newOperationId(), OperationKind.WRITE, Map.of("n", 49));

        assertEquals(0, wal.status().bufferedEntries());
        assertEquals(50, wal.status().flushedEntries());
        assertEquals(50, wal.status().pendingOperations());
    }

    @Test
    void testFutureCompletesWhenFlushed() throws IOException {
        CompletableFuture<Void> durable = wal.begin("op-1", OperationKind.WRITE, Map.of("source", "events"));
        assertFalse(durable.isDone());

        wal.flush();

        assertTrue(durable.isDone());
        assertFalse(durable.isCompletedExceptionally());
    }

    @Test
    void testReplayAfterReopen() throws IOException {
        wal.begin("op-1", OperationKind.WRITE, Map.of("source", "events", "tenant", "acme"));
        wal.markCompleted("op-1", OperationKind.WRITE, Map.of("files", List.of("events/acme/a.col")));
        wal.begin("op-2", OperationKind.DELETE, Map.of("prefix", "events/acme"));
        wal.markFailed("op-2", OperationKind.DELETE, "disk full");
        wal.close();

        wal = open(WalConfig.getDefault());
        List<WalEntry> entries = readAll(wal);

        assertEquals(4, entries.size());
        assertEquals("op-1", entries.get(0).operationId());
        assertEquals(OperationStatus.PENDING, entries.get(0).status());
        assertEquals("acme", entries.get(0).payload().get("tenant"));
        assertEquals(OperationStatus.COMPLETED, entries.get(1).status());
        assertEquals(List.of("events/acme/a.col"), entries.get(1).payload().get("files"));
        assertEquals(OperationKind.DELETE, entries.get(3).kind());
        assertEquals(OperationStatus.FAILED, entries.get(3).status());
        assertEquals("disk full", entries.get(3).error());
        assertTrue(wal.pendingOperations().isEmpty());
    }

    @Test
    void testFailPendingOperationsAfterRestart() throws IOException {
        wal.begin("op-done", OperationKind.WRITE, Map.of());
        wal.markCompleted("op-done", OperationKind.WRITE, Map.of());
        wal.begin("op-crashed", OperationKind.COMPACT, Map.of("source", "events"));
        wal.close();

        wal = open(WalConfig.getDefault());
        wal.replay(entry -> { });
        assertEquals(Set.of("op-crashed"), wal.pendingOperations());

        assertEquals(1, wal.failPendingOperations("replayed during recovery"));
        assertTrue(wal.pendingOperations().isEmpty());

        WalEntry last = readAll(wal).get(3);
        assertEquals("op-crashed", last.operationId());
        assertEquals(OperationKind.COMPACT, last.kind());
        assertEquals(OperationStatus.FAILED, last.status());
        assertEquals("replayed during recovery", last.error());
    }

    @Test
    void testFlushFailureRejectsFurtherAppends() throws IOException {
        WALWriter writer = mock(WALWriter.class);
        when(writer.writeBatch(anyList())).thenThrow(new IOException("disk full"));
        WALManager manager = new WALManagerImpl(tempDir.resolve("broken"), 1024 * 1024, clock);
        WAL broken = new WALImpl(WalConfig.getDefault(), manager, writer,
            new WALReaderImpl(new WalEntryCodec(objectMapper, false)),
            new CheckpointManager(tempDir.resolve("broken-checkpoints"), objectMapper, 3), clock);

        CompletableFuture<Void> durable = broken.begin("op-1", OperationKind.WRITE, Map.of());

        WalFlushException e = assertThrows(WalFlushException.class, broken::flush);
        assertEquals("disk full", e.getCause().getMessage());
        assertTrue(durable.isCompletedExceptionally());
        assertTrue(broken.status().failed());

        // the log stays unusable until it is reopened
        assertThrows(WalFlushException.class, () -> broken.begin("op-2", OperationKind.WRITE, Map.of()));
        broken.close();
    }

    @Test
    void testReclaimKeepsCurrentAndPendingSegments() throws IOException {
        wal.close();
        // every batch rolls over to a new segment
        wal = open(WalConfig.getDefault().withMaxSegmentBytes(1));

        wal.begin("op-open", OperationKind.WRITE, Map.of());
        wal.flush();
        wal.begin("op-closed", OperationKind.WRITE, Map.of());
        wal.flush();
        wal.markCompleted("op-closed", OperationKind.WRITE, Map.of());
        wal.flush();
        // the empty segment left by the first open, the three rolled ones and the current one
        int before = wal.status().segmentCount();
        assertEquals(5, before);

        clock.advance(Duration.ofHours(25));
        int reclaimed = wal.reclaimSegments();

        // the segment holding the PENDING record of op-open survives
        assertEquals(3, reclaimed);
        assertEquals(before - reclaimed, wal.status().segmentCount());
        assertEquals(Set.of("op-open"), wal.pendingOperations());
    }

    @Test
    void testCheckpointWrittenAfterConfiguredEntries() throws IOException {
        wal.close();
        wal = open(WalConfig.getDefault().withCheckpointEvery(2));
        FileMetadata entry = new FileMetadata("events/acme/1_1_000.col", "events", "acme", 10, 1,
            null, null, Tier.HOT, List.of("id"), 1L, 1L, Map.of());
        wal.setCheckpointSource(() -> List.of(entry));

        wal.begin("op-1", OperationKind.WRITE, Map.of());
        wal.flush();
        assertTrue(wal.latestCheckpoint().isEmpty());

        wal.markCompleted("op-1", OperationKind.WRITE, Map.of());
        wal.flush();

        assertTrue(wal.latestCheckpoint().isPresent());
        assertEquals(List.of(entry), wal.latestCheckpoint().get().files());
        assertEquals(1, wal.status().checkpointCount());
    }
}
