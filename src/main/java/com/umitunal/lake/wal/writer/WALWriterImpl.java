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

package com.umitunal.lake.wal.writer;

import com.umitunal.lake.wal.file.WALFile;
import com.umitunal.lake.wal.manager.WALManager;
import com.umitunal.lake.wal.record.WalEntry;
import com.umitunal.lake.wal.record.WalEntryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Implementation of the WALWriter interface.
 */
public class WALWriterImpl implements WALWriter {
    private static final Logger logger = LoggerFactory.getLogger(WALWriterImpl.class);

    private final WALManager walManager;
    private final WalEntryCodec codec;

    /**
     * Creates a new WALWriterImpl.
     *
     * @param walManager the WAL manager
     * @param codec the frame codec
     */
    public WALWriterImpl(WALManager walManager, WalEntryCodec codec) {
        this.walManager = walManager;
        this.codec = codec;
    }

    @Override
    public synchronized String writeBatch(List<WalEntry> entries) throws IOException {
        WALFile segment = walManager.getCurrentFile();
        if (entries.isEmpty()) {
            return segment.getName();
        }

        // encode everything first so a serialization error leaves the segment untouched
        List<ByteBuffer> frames = new ArrayList<>(entries.size());
        int totalBytes = 0;
        for (WalEntry entry : entries) {
            ByteBuffer frame = codec.encode(entry);
            totalBytes += frame.remaining();
            frames.add(frame);
        }

        ByteBuffer batch = ByteBuffer.allocate(totalBytes);
        for (ByteBuffer frame : frames) {
            batch.put(frame);
        }
        batch.flip();

        segment.append(batch);
        segment.force();
        logger.debug("Appended " + entries.size() + " entries (" + totalBytes + " bytes) to " + segment.getName());

        if (segment.size() >= walManager.getMaxLogSizeBytes()) {
            walManager.rotateLog();
        }
        return segment.getName();
    }
}
