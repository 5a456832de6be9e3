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

import com.umitunal.lake.wal.record.WalEntry;
import com.umitunal.lake.wal.record.WalEntryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Consumer;

/**
 * Implementation of the WALReader interface.
 */
public class WALReaderImpl implements WALReader {
    private static final Logger logger = LoggerFactory.getLogger(WALReaderImpl.class);

    private final WalEntryCodec codec;

    /**
     * Creates a new WALReaderImpl.
     *
     * @param codec the frame codec
     */
    public WALReaderImpl(WalEntryCodec codec) {
        this.codec = codec;
    }

    @Override
    public int readSegment(Path segment, Consumer<WalEntry> handler) throws IOException {
        int skipped = 0;
        try (FileChannel channel = FileChannel.open(segment, StandardOpenOption.READ)) {
            long size = channel.size();
            long position = 0;
            ByteBuffer header = ByteBuffer.allocate(WalEntryCodec.FRAME_HEADER_SIZE);

            while (position + WalEntryCodec.FRAME_HEADER_SIZE <= size) {
                header.clear();
                readFully(channel, header, position);
                header.flip();
                int bodyLength = header.getInt();
                int crc = header.getInt();
                byte flags = header.get();

                long bodyStart = position + WalEntryCodec.FRAME_HEADER_SIZE;
                if (bodyLength < 0 || bodyStart + bodyLength > size) {
                    logger.warn("Truncated WAL frame at offset " + position + " in " + segment.getFileName()
                        + ", ignoring the rest of the segment");
                    skipped++;
                    break;
                }

                ByteBuffer body = ByteBuffer.allocate(bodyLength);
                readFully(channel, body, bodyStart);
                position = bodyStart + bodyLength;

                WalEntry entry;
                try {
                    entry = codec.decode(body.array(), crc, flags);
                } catch (IOException e) {
                    logger.warn("Skipping unreadable WAL frame at offset " + (bodyStart - WalEntryCodec.FRAME_HEADER_SIZE)
                        + " in " + segment.getFileName() + ": " + e.getMessage());
                    skipped++;
                    continue;
                }
                handler.accept(entry);
            }
        }
        return skipped;
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, pos);
            if (n < 0) {
                throw new IOException("Unexpected end of WAL segment");
            }
            pos += n;
        }
    }
}
