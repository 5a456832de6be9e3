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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * Interface for a single write-ahead log segment.
 * A segment is append-only; it is never modified once rotated out.
 */
public interface WALFile extends AutoCloseable {

    /**
     * @return the path of the segment
     */
    Path getPath();

    /**
     * @return the segment's file name, which orders segments by creation
     */
    String getName();

    /**
     * @return the sequence number embedded in the segment name
     */
    long getSequenceNumber();

    /**
     * @return creation time of the segment in epoch millis, taken from its name
     */
    long getCreatedAt();

    /**
     * Appends the remaining bytes of the buffer.
     *
     * @throws IOException if an I/O error occurs
     */
    void append(ByteBuffer buffer) throws IOException;

    /**
     * Forces appended data to the storage device.
     *
     * @throws IOException if an I/O error occurs
     */
    void force() throws IOException;

    /**
     * @return the current size of the segment in bytes
     * @throws IOException if an I/O error occurs
     */
    long size() throws IOException;

    @Override
    void close() throws IOException;
}
