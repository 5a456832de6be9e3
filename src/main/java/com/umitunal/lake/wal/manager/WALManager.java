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

package com.umitunal.lake.wal.manager;

import com.umitunal.lake.wal.file.WALFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for managing write-ahead log segments.
 * Segments are named {@code wal_<yyyyMMdd'T'HHmmssSSS>_<sequence>.log} so that both the
 * creation time and the creation order can be read from the name.
 */
public interface WALManager {

    /**
     * @return the segment currently receiving appends
     */
    WALFile getCurrentFile();

    /**
     * Closes the current segment and opens a new one.
     *
     * @return the new segment
     * @throws IOException if an I/O error occurs
     */
    WALFile rotateLog() throws IOException;

    /**
     * @return every segment in the directory, in creation order
     * @throws IOException if an I/O error occurs
     */
    List<Path> findLogFiles() throws IOException;

    /**
     * @return the creation time encoded in a segment name, or -1 if the name cannot be parsed
     */
    long createdAtOf(Path segment);

    /**
     * Deletes a rotated segment. The current segment cannot be deleted.
     *
     * @throws IOException if an I/O error occurs
     */
    void deleteLog(Path segment) throws IOException;

    Path getDirectory();

    long getMaxLogSizeBytes();

    /**
     * Closes the current segment.
     *
     * @throws IOException if an I/O error occurs
     */
    void close() throws IOException;
}
