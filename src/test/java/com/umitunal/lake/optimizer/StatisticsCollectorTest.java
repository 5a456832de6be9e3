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

package com.umitunal.lake.optimizer;

import com.umitunal.lake.config.EngineConfig;
import com.umitunal.lake.config.OptimizerConfig;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.engine.EngineContext;
import com.umitunal.lake.core.source.DataSource;
import com.umitunal.lake.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the StatisticsCollector class.
 */
class StatisticsCollectorTest {
    private EngineContext context;
    private MutableClock clock;
    private StatisticsCollector collector;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        context = EngineContext.open(EngineConfig.getDefault().withDataDirectory(tempDir.toString()), clock);
        collector = new StatisticsCollector(context.catalog(), context.columnFileIO(), context.layout(),
            OptimizerConfig.getDefault(), clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (context != null) {
            context.wal().close();
        }
    }

    private void write(String sourceId, int fromId, int toId) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int id = fromId; id < toId; id++) {
            Map<String, Object> row = new HashMap<>();
            row.put("id", id);
            row.put("status", id % 3 == 0 ? "open" : "closed");
            if (id % 5 != 0) {
                row.put("note", "n" + id);
            }
            rows.add(row);
        }
        new DataSource(SourceConfig.of(sourceId), context).write("acme", rows);
    }

    @Test
    void testRefreshCollectsSizesAndColumns() throws IOException {
        write("orders", 0, 10);
        write("orders", 10, 20);

        TableStatistics statistics = collector.refresh("orders");

        assertEquals("orders", statistics.sourceId());
        assertEquals(20, statistics.rowCount());
        assertEquals(2, statistics.fileCount());
        assertTrue(statistics.sizeBytes() > 0);
        assertEquals(clock.millis(), statistics.collectedAt());

        ColumnStatistics id = statistics.column("id");
        assertEquals("LONG", id.dataType());
        assertEquals(20, id.distinctCount());
        assertEquals(0L, id.minValue());
        assertEquals(19L, id.maxValue());
        assertEquals(2, statistics.column("status").distinctCount());
        assertEquals(4, statistics.column("note").nullCount());
    }

    @Test
    void testUnknownSourceHasEmptyStatistics() {
        TableStatistics statistics = collector.statisticsFor("missing");

        assertEquals(0, statistics.rowCount());
        assertEquals(0, statistics.fileCount());
        assertTrue(statistics.columns().isEmpty());
    }

    @Test
    void testStatisticsCachedUntilInvalidated() throws IOException {
        write("orders", 0, 10);
        TableStatistics first = collector.statisticsFor("orders");

        write("orders", 10, 20);
        assertSame(first, collector.statisticsFor("orders"));

        collector.invalidate("orders");
        assertEquals(20, collector.statisticsFor("orders").rowCount());
    }

    @Test
    void testRefreshCachedRecollectsEverySource() throws IOException {
        write("orders", 0, 5);
        write("users", 0, 5);
        collector.statisticsFor("orders");
        collector.statisticsFor("users");
        write("orders", 5, 10);

        assertEquals(2, collector.refreshCached());
        assertEquals(10, collector.cached("orders").rowCount());
        assertEquals(2, collector.cachedCount());
    }

    @Test
    void testUnreadableFileSkippedWhenSampling() throws IOException {
        write("orders", 0, 5);
        String path = context.catalog().list("orders").get(0).path();
        Files.write(context.layout().resolve(path, context.catalog().get(path).orElseThrow().tier()),
            new byte[]{1, 2, 3});

        TableStatistics statistics = collector.refresh("orders");

        assertEquals(5, statistics.rowCount());
        assertTrue(statistics.columns().isEmpty());
    }

    @Test
    void testMemoryPressureClearsCache() throws IOException {
        write("orders", 0, 5);
        collector.statisticsFor("orders");

        collector.onMemoryPressure(90.0);

        assertEquals(0, collector.cachedCount());
        assertNull(collector.cached("orders"));
    }

    @Test
    void testCacheBudgetEvictsOldestFirst() throws IOException {
        write("orders", 0, 5);
        write("users", 0, 5);
        collector.statisticsFor("orders");
        clock.advance(Duration.ofMinutes(1));
        collector.statisticsFor("users");

        // each entry is estimated at 512 bytes plus 256 per column
        collector.onCacheBudget(1600);

        assertNull(collector.cached("orders"));
        assertNotNull(collector.cached("users"));
    }
}
