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

package com.umitunal.lake.core.compaction;

import com.umitunal.lake.catalog.FileMetadata;

import java.util.List;

/**
 * Decides when a source needs compaction and which files are merged together.
 */
public interface CompactionStrategy {

    /**
     * Classifies the hot files of a source.
     *
     * @param files the source's hot files
     * @param now current time in epoch millis
     */
    FileAnalysis analyze(List<FileMetadata> files, long now);

    /**
     * @return true if the analysis crosses a normal compaction threshold
     */
    boolean shouldCompact(FileAnalysis analysis);

    /**
     * @return true if the source must be compacted even outside the maintenance window
     */
    boolean isUrgent(FileAnalysis analysis);

    /**
     * Groups files into batches, each of which becomes one output file.
     * Every batch holds at least two files from the same directory.
     */
    List<List<FileMetadata>> selectBatches(FileAnalysis analysis);

    String getName();
}
