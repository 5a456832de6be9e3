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

import com.umitunal.lake.wal.record.WalEntry;

import java.io.IOException;
import java.util.List;

/**
 * Interface for writing entries to write-ahead log segments.
 */
public interface WALWriter {

    /**
     * Appends a batch of entries to the current segment, forces it to disk and rotates the
     * segment if it grew past its size cap. The whole batch lands in one segment.
     *
     * @param entries the entries, in log order
     * @return the name of the segment the batch was written to
     * @throws IOException if an I/O error occurs
     */
    String writeBatch(List<WalEntry> entries) throws IOException;
}
