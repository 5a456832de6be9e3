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

package com.umitunal.lake.catalog;

import com.umitunal.lake.columnfile.ColumnFileIO;
import com.umitunal.lake.columnfile.ColumnFileIOImpl;
import com.umitunal.lake.storage.ObjectMappers;
import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the CatalogImpl class.
 */
class CatalogImplTest {
    private StorageLayout layout;
    private ColumnFileIO columnFileIO;
    private FileMetadataExtractor extractor;
    private MutableClock clock;
    private Catalog catalog;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        layout = new StorageLayout(tempDir);
        layout.createDirectories();
        columnFileIO = new ColumnFileIOImpl("timestamp");
        extractor = new FileMetadataExtractor(layout, columnFileIO);
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        catalog = open();
    }

    private Catalog open() throws IOException {
        return new CatalogImpl(layout, new JsonCatalogRepository(layout.catalogFile(), ObjectMappers.create()), clock);
    }

    private FileMetadata writeFile(String key, Map<String, Object> row) throws IOException {
        return extractor.toMetadata(key, Tier.HOT,
            columnFileIO.write(layout.resolve(key, Tier.HOT), List.of(row), 1L, clock.millis(), false));
    }

    @Test
    void testRegisterAndList() throws IOException {
        FileMetadata a = writeFile("events/acme/1_1_000.col", Map.of("id", 1));
        FileMetadata b = writeFile("events/globex/1_2_000.col", Map.of("id", 2));
        FileMetadata c = writeFile("events2/acme/1_3_000.col", Map.of("id", 3));
        catalog.registerAll(List.of(a, b, c));

        assertEquals(2, catalog.list("events").size());
        assertEquals(List.of(a), catalog.list("events/acme"));
        assertEquals(3, catalog.list("").size());
        assertEquals(Set.of("events", "events2"), catalog.sources());
        assertEquals("acme", catalog.get("events/acme/1_1_000.col").orElseThrow().tenant());
        assertTrue(catalog.get("missing.col").isEmpty());
    }

    @Test
    void testEntriesSurviveReopen() throws IOException {
        FileMetadata entry = writeFile("events/acme/region=N/1_1_000.col", Map.of("id", 1, "region", "N"));
        catalog.register(entry);

        Catalog reopened = open();

        assertEquals(entry, reopened.get(entry.path()).orElseThrow());
        assertEquals("N", entry.tags().get("partition.region"));
        assertEquals(1, reopened.stats().totalFiles());
    }

    @Test
    void testFilesForQueryChecksColumnsAndSkipsStaleEntries() throws IOException {
        FileMetadata withRegion = writeFile("events/acme/1_1_000.col", Map.of("id", 1, "region", "N"));
        FileMetadata withoutRegion = writeFile("events/acme/1_2_000.col", Map.of("id", 2));
        FileMetadata stale = writeFile("events/acme/1_3_000.col", Map.of("id", 3, "region", "S"));
        catalog.registerAll(List.of(withRegion, withoutRegion, stale));
        Files.delete(layout.resolve(stale.path(), Tier.HOT));

        assertEquals(List.of(withRegion), catalog.filesForQuery("events", Set.of("region")));
        assertEquals(2, catalog.filesForQuery("events", Set.of()).size());
        assertEquals(List.of(stale), catalog.staleEntries());
    }

    @Test
    void testReplaceFilesSwapsEntries() throws IOException {
        FileMetadata a = writeFile("events/acme/1_1_000.col", Map.of("id", 1));
        FileMetadata b = writeFile("events/acme/1_2_000.col", Map.of("id", 2));
        catalog.registerAll(List.of(a, b));
        FileMetadata merged = writeFile("events/acme/1_3_compacted.col", Map.of("id", 1));

        catalog.replaceFiles(List.of(a.path(), b.path()), merged);

        assertEquals(List.of(merged), catalog.list("events"));
        assertEquals(1, catalog.schemas().size());
        assertEquals(1, catalog.schemas().get(0).fileCount());
    }

    @Test
    void testMoveToTierMovesFile() throws IOException {
        FileMetadata entry = writeFile("events/acme/1_1_000.col", Map.of("id", 1));
        catalog.register(entry);

        FileMetadata moved = catalog.moveToTier(entry.path(), Tier.COLD);

        assertEquals(Tier.COLD, moved.tier());
        assertFalse(Files.exists(layout.resolve(entry.path(), Tier.HOT)));
        assertTrue(Files.exists(layout.resolve(entry.path(), Tier.COLD)));
        assertEquals(1, catalog.stats().coldFiles());
        assertThrows(IllegalArgumentException.class, () -> catalog.moveToTier("unknown.col", Tier.COLD));
    }

    @Test
    void testSchemasGroupedByColumnSet() throws IOException {
        catalog.registerAll(List.of(
            writeFile("events/acme/1_1_000.col", Map.of("id", 1, "region", "N")),
            writeFile("events/acme/1_2_000.col", Map.of("region", "S", "id", 2)),
            writeFile("events/acme/1_3_000.col", Map.of("id", 3))));

        assertEquals(2, catalog.stats().schemaCount());
        assertEquals(List.of("id", "region"), catalog.schemaFor("events/acme/1_2_000.col").orElseThrow().columns());
        assertTrue(catalog.satisfies("events/acme/1_1_000.col", List.of("region")));
        assertFalse(catalog.satisfies("events/acme/1_3_000.col", List.of("region")));
    }

    @Test
    void testFailedPersistRollsBack() throws IOException {
        CatalogRepository repository = mock(CatalogRepository.class);
        when(repository.load()).thenReturn(List.of());
        Catalog failing = new CatalogImpl(layout, repository, clock);
        FileMetadata entry = writeFile("events/acme/1_1_000.col", Map.of("id", 1));
        doThrow(new IOException("read-only")).when(repository).save(anyCollection());

        assertThrows(IOException.class, () -> failing.register(entry));

        assertTrue(failing.get(entry.path()).isEmpty());
        assertEquals(0, failing.stats().schemaCount());
    }

    @Test
    void testRestoreReplacesEntries() throws IOException {
        FileMetadata a = writeFile("events/acme/1_1_000.col", Map.of("id", 1));
        FileMetadata b = writeFile("events/acme/1_2_000.col", Map.of("id", 2));
        catalog.register(a);

        catalog.restore(List.of(b));

        assertEquals(List.of(b), catalog.snapshot());
        assertEquals(List.of(b), open().snapshot());
    }
}
