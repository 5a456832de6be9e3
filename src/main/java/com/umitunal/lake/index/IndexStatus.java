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

package com.umitunal.lake.index;

import java.util.Map;

/**
 * Read-only snapshot of the index manager.
 *
 * @param indexedColumns number of columns with at least one entry
 * @param indexedFiles number of files with at least one entry
 * @param totalEntries number of (column, file) entries
 * @param entriesPerColumn entry count per column
 * @param lastUpdated time of the last change, in epoch millis
 */
public record IndexStatus(
    int indexedColumns,
    int indexedFiles,
    long totalEntries,
    Map<String, Integer> entriesPerColumn,
    long lastUpdated
) {

    public IndexStatus {
        entriesPerColumn = Map.copyOf(entriesPerColumn);
    }
}
