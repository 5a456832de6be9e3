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
 * Size and age breakdown of the hot files of one source.
 *
 * @param totalFiles number of files analyzed
 * @param smallFiles files below the minimum size, in catalog order
 * @param largeFileCount files above the maximum size
 * @param oldFileCount files older than the age threshold
 * @param totalBytes combined size of every file analyzed
 */
public record FileAnalysis(
    int totalFiles,
    List<FileMetadata> smallFiles,
    int largeFileCount,
    int oldFileCount,
    long totalBytes
) {

    public FileAnalysis {
        smallFiles = List.copyOf(smallFiles);
    }

    public int smallFileCount() {
        return smallFiles.size();
    }
}
