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

package com.umitunal.lake.columnfile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ColumnFileIOImpl class.
 */
class ColumnFileIOImplTest {
    private ColumnFileIO columnFileIO;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        columnFileIO = new ColumnFileIOImpl("timestamp");
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void testWriteAndReadRows() throws IOException {
        Path file = tempDir.resolve("events/acme/1_1_000.col");
        List<Map<String, Object>> rows = List.of(
            row("id", 1, "region", "N", "amount", 10.5, "active", true, "timestamp", 1_000L),
            row("id", 2, "region", "S", "amount", 7, "active", false, "timestamp", 3_000L)
        );

        ColumnFileInfo info = columnFileIO.write(file, rows, 42L, 99L, false);

        assertTrue(Files.exists(file));
        assertEquals(2, info.rowCount());
        assertEquals(42L, info.writeId());
        assertEquals(99L, info.createdAt());
        assertEquals(1_000L, info.minTimestamp());
        assertEquals(3_000L, info.maxTimestamp());
        assertEquals(Files.size(file), info.sizeBytes());

        ColumnFileData data = columnFileIO.read(file);
        assertEquals(2, data.rows().size());
        Map<String, Object> first = data.rows().get(0);
        assertEquals(1L, first.get("id"));
        assertEquals("N", first.get("region"));
        assertEquals(10.5, first.get("amount"));
        assertEquals(true, first.get("active"));
        // an integral value in a fractional column widens
        assertEquals(7.0, data.rows().get(1).get("amount"));
    }

    @Test
    void testColumnTypesInferred() throws IOException {
        Path file = tempDir.resolve("types.col");
        List<Map<String, Object>> rows = List.of(
            row("count", 1, "ratio", 0.5, "flag", true, "mixed", 1),
            row("count", 2L, "ratio", 2, "flag", false, "mixed", "two")
        );

        ColumnFileInfo info = columnFileIO.write(file, rows, 1L, 1L, false);

        Map<String, ColumnType> types = new HashMap<>();
        for (ColumnDescriptor column : info.columns()) {
            types.put(column.name(), column.type());
        }
        assertEquals(ColumnType.LONG, types.get("count"));
        assertEquals(ColumnType.DOUBLE, types.get("ratio"));
        assertEquals(ColumnType.BOOLEAN, types.get("flag"));
        assertEquals(ColumnType.STRING, types.get("mixed"));
        assertEquals("1", columnFileIO.read(file).rows().get(0).get("mixed"));
    }

    @Test
    void testMissingAndNullCellsAreOmitted() throws IOException {
        Path file = tempDir.resolve("sparse.col");
        Map<String, Object> withNull = row("id", 2);
        withNull.put("note", null);
        List<Map<String, Object>> rows = List.of(row("id", 1, "note", "first"), withNull, row("other", "x"));

        columnFileIO.write(file, rows, 1L, 1L, false);
        List<Map<String, Object>> read = columnFileIO.read(file).rows();

        assertEquals(Map.of("id", 1L, "note", "first"), read.get(0));
        assertEquals(Map.of("id", 2L), read.get(1));
        assertEquals(Map.of("other", "x"), read.get(2));
    }

    @Test
    void testCompressedFile() throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            rows.add(row("id", i, "region", "north-east", "timestamp", "2024-01-01T00:00:00Z"));
        }
        Path plain = tempDir.resolve("plain.col");
        Path compressed = tempDir.resolve("compressed.col");

        columnFileIO.write(plain, rows, 1L, 1L, false);
        ColumnFileInfo info = columnFileIO.write(compressed, rows, 1L, 1L, true);

        assertTrue(info.compressed());
        assertTrue(Files.size(compressed) < Files.size(plain));
        ColumnFileData data = columnFileIO.read(compressed);
        assertEquals(500, data.rows().size());
        assertEquals(499L, data.rows().get(499).get("id"));
        assertEquals(1704067200000L, data.info().minTimestamp());
    }

    @Test
    void testReadInfoReadsHeaderOnly() throws IOException {
        Path file = tempDir.resolve("info.col");
        columnFileIO.write(file, List.of(row("a", 1, "b", "x")), 7L, 8L, true);

        ColumnFileInfo info = columnFileIO.readInfo(file);

        assertEquals(1, info.rowCount());
        assertEquals(List.of("a", "b"), info.columnNames());
        assertEquals(7L, info.writeId());
        assertNull(info.minTimestamp());
        assertTrue(info.compressed());
    }

    @Test
    void testCorruptFileRejected() throws IOException {
        Path file = tempDir.resolve("corrupt.col");
        columnFileIO.write(file, List.of(row("id", 1, "name", "alpha")), 1L, 1L, false);
        byte[] content = Files.readAllBytes(file);
        content[content.length - 12] ^= 0x7F;
        Files.write(file, content);

        IOException e = assertThrows(IOException.class, () -> columnFileIO.read(file));
        assertTrue(e.getMessage().contains("Checksum mismatch"));
    }

    @Test
    void testNotAColumnFile() throws IOException {
        Path file = tempDir.resolve("garbage.col");
        Files.write(file, new byte[128]);

        assertThrows(IOException.class, () -> columnFileIO.readInfo(file));
    }
}
