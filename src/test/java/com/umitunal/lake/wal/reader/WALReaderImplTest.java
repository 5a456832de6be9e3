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

package com.umitunal.lake.wal.reader;

import com.umitunal.lake.storage.ObjectMappers;
import com.umitunal.lake.wal.record.OperationKind;
import com.umitunal.lake.wal.record.WalEntry;
import com.umitunal.lake.wal.record.WalEntryCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the WALReaderImpl class.
 */
class WALReaderImplTest {

    @TempDir
    Path tempDir;

    private WalEntryCodec codec;
    private WALReaderImpl reader;
    private Path segment;

    @BeforeEach
    void setUp() {
        codec = new WalEntryCodec(ObjectMappers.create(), false);
        reader = new WALReaderImpl(codec);
        segment = tempDir.resolve("wal_20240301T100000000_000000.log");
    }

    private byte[] frames(WalEntry... entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (WalEntry entry : entries) {
            ByteBuffer frame = codec.encode(entry);
            byte[] bytes = new byte[frame.remaining()];
            frame.get(bytes);
            out.write(bytes);
        }
        return out.toByteArray();
    }

    private static WalEntry entry(int n) {
        return WalEntry.pending("op-" + n, OperationKind.WRITE, Map.of("n", n), 1000L + n);
    }

    private List<String> readIds(int expectedSkipped) throws IOException {
        List<String> ids = new ArrayList<>();
        int skipped = reader.readSegment(segment, e -> ids.add(e.operationId()));
        assertEquals(expectedSkipped, skipped);
        return ids;
    }

    @Test
    void testReadSegmentInOrder() throws IOException {
        Files.write(segment, frames(entry(1), entry(2), entry(3)));

        assertEquals(List.of("op-1", "op-2", "op-3"), readIds(0));
    }

    @Test
    void testEmptySegment() throws IOException {
        Files.write(segment, new byte[0]);

        assertTrue(readIds(0).isEmpty());
    }

    @Test
    void testTruncatedTailIgnored() throws IOException {
        byte[] complete = frames(entry(1), entry(2));
        byte[] third = frames(entry(3));
        byte[] torn = new byte[complete.length + third.length - 5];
        System.arraycopy(complete, 0, torn, 0, complete.length);
        System.arraycopy(third, 0, torn, complete.length, third.length - 5);
        Files.write(segment, torn);

        assertEquals(List.of("op-1", "op-2"), readIds(1));
    }

    @Test
    void testPartialHeaderIgnored() throws IOException {
        byte[] complete = frames(entry(1));
        byte[] withStub = new byte[complete.length + 3];
        System.arraycopy(complete, 0, withStub, 0, complete.length);
        Files.write(segment, withStub);

        assertEquals(List.of("op-1"), readIds(0));
    }

    @Test
    void testCorruptFrameSkipped() throws IOException {
        int firstLength = frames(entry(1)).length;
        byte[] bytes = frames(entry(1), entry(2), entry(3));
        // flip a byte inside the body of the second frame
        bytes[firstLength + WalEntryCodec.FRAME_HEADER_SIZE + 2] ^= 0x21;
        Files.write(segment, bytes);

        assertEquals(List.of("op-1", "op-3"), readIds(1));
    }

    @Test
    void testMissingSegment() {
        assertThrows(NoSuchFileException.class, () -> reader.readSegment(tempDir.resolve("nope.log"), e -> { }));
    }
}
