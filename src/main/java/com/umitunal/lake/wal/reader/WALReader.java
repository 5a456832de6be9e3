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

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Interface for reading entries back from write-ahead log segments.
 */
public interface WALReader {

    /**
     * Reads one segment front to back. A frame that fails to decode is logged and skipped;
     * a truncated tail ends the segment.
     *
     * @param segment the segment file
     * @param handler receives every decoded entry in order
     * @return the number of frames that were skipped
     * @throws IOException if the segment cannot be opened
     */
    int readSegment(Path segment, Consumer<WalEntry> handler) throws IOException;
}
