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

package com.umitunal.lake.core.migration;

import com.umitunal.lake.api.MigrationResult;
import com.umitunal.lake.api.RecordBatchIterator;
import com.umitunal.lake.api.WriteResult;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.config.EngineConfig;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.engine.EngineContext;
import com.umitunal.lake.core.source.DataSource;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the TierMigrator class.
 */
class TierMigratorTest {
    private EngineContext context;
    private DataSource source;
    private TierMigrator migrator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        context = EngineContext.open(EngineConfig.getDefault().withDataDirectory(tempDir.toString()), clock);
        source = new DataSource(SourceConfig.of("events"), context);
        migrator = new TierMigrator(context);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (context != null) {
            context.wal().close();
        }
    }

    private String writeAt(String tenant, String timestamp) throws IOException {
        WriteResult result = source.write(tenant, List.of(Map.of("id", 1, "timestamp", timestamp)));
        return result.paths().get(0);
    }

    private FileMetadata entry(String path) {
        return context.catalog().get(path).orElseThrow();
    }

    @Test
    void testOldFilesMovedToColdTier() throws IOException {
        String old = writeAt("acme", "2024-01-01T00:00:00Z");
        String recent = writeAt("acme", "2024-02-28T00:00:00Z");

        MigrationResult result = migrator.migrateCold(30);

        assertEquals(List.of(old), result.moved());
        assertEquals(1, result.movedCount());
        assertEquals(Tier.COLD, entry(old).tier());
        assertEquals(Tier.HOT, entry(recent).tier());
        assertTrue(Files.exists(context.layout().resolve(old, Tier.COLD)));
        assertFalse(Files.exists(context.layout().resolve(old, Tier.HOT)));
        assertTrue(Files.exists(context.layout().resolve(recent, Tier.HOT)));
    }

    @Test
    void testColdFilesStillSearchable() throws IOException {
        writeAt("acme", "2024-01-01T00:00:00Z");
        migrator.migrateCold(30);

        int rows = 0;
        try (RecordBatchIterator batches = source.search(QueryFilter.all(), null, 0, null)) {
            while (batches.hasNext()) {
                rows += batches.next().size();
            }
        }
        assertEquals(1, rows);
    }

    @Test
    void testFilesWithoutTimeRangeSkipped() throws IOException {
        WriteResult result = source.write("acme", List.of(Map.of("id", 1)));
        String untimed = result.paths().get(0);

        MigrationResult migration = migrator.migrateCold(0);

        assertTrue(migration.moved().isEmpty());
        assertEquals(List.of(untimed), migration.skipped());
        assertEquals(Tier.HOT, entry(untimed).tier());
    }

    @Test
    void testMissingHotFileReported() throws IOException {
        String old = writeAt("acme", "2024-01-01T00:00:00Z");
        Files.delete(context.layout().resolve(old, Tier.HOT));

        MigrationResult result = migrator.migrateCold(30);

        assertTrue(result.moved().isEmpty());
        assertEquals(List.of(old), result.missing());
        assertEquals(Tier.HOT, entry(old).tier());
    }

    @Test
    void testSecondPassIsNoOp() throws IOException {
        writeAt("acme", "2024-01-01T00:00:00Z");

        assertEquals(1, migrator.migrateCold(30).movedCount());
        MigrationResult second = migrator.migrateCold(30);

        assertEquals(0, second.movedCount());
        assertTrue(second.missing().isEmpty());
        assertTrue(second.skipped().isEmpty());
    }

    @Test
    void testMigrationLoggedAsCompleted() throws IOException {
        writeAt("acme", "2024-01-01T00:00:00Z");

        MigrationResult result = migrator.migrateCold(30);
        context.wal().flush();

        assertNotNull(result.operationId());
        assertFalse(context.wal().pendingOperations().contains(result.operationId()));
    }

    @Test
    void testNegativeCutoffRejected() {
        assertThrows(IllegalArgumentException.class, () -> migrator.migrateCold(-1));
    }
}
