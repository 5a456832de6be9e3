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

package com.umitunal.lake.wal.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Implementation of the WALFile interface backed by a FileChannel.
 */
public class WALFileImpl implements WALFile {
    private static final Logger logger = LoggerFactory.getLogger(WALFileImpl.class);

    private final Path path;
    private final long sequenceNumber;
    private final long createdAt;
    private final FileChannel channel;

    /**
     * Creates a new segment file. Fails if the file already exists.
     *
     * @param path the path of the segment
     * @param sequenceNumber the sequence number of this segment
     * @param createdAt the creation time in epoch millis
     * @throws IOException if an I/O error occurs
     */
    public WALFileImpl(Path path, long sequenceNumber, long createdAt) throws IOException {
        this.path = path;
        this.sequenceNumber = sequenceNumber;
        this.createdAt = createdAt;
        this.channel = FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE,
            StandardOpenOption.APPEND);
        logger.debug("Opened WAL segment: " + path);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    @Override
    public long getSequenceNumber() {
        return sequenceNumber;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public void append(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    @Override
    public void force() throws IOException {
        channel.force(true);
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.close();
            logger.debug("Closed WAL segment: " + path);
        }
    }

    @Override
    public String toString() {
        return "WALFile{" +
                "path=" + path +
                ", sequenceNumber=" + sequenceNumber +
                '}';
    }
}
