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

import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.query.QueryFilter;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-column, per-file statistics used to prune files before they are read.
 * Every change is persisted before the call returns.
 */
public interface IndexManager {

    /**
     * Computes and stores entries for a file, replacing any previous entries for it.
     *
     * @param filePath key of the file
     * @param rows the rows stored in the file
     * @param indexColumns columns to index; empty indexes every column present
     * @throws IOException if the index cannot be persisted
     */
    void update(String filePath, List<Map<String, Object>> rows, List<String> indexColumns) throws IOException;

    /**
     * Removes the candidates that provably hold no row matching the filter. Files or columns
     * without an entry are kept. The result keeps the candidates' order.
     */
    List<FileMetadata> prune(List<FileMetadata> candidates, QueryFilter filter);

    /**
     * @return false only if the file provably holds no row matching the filter
     */
    boolean mayMatch(String filePath, QueryFilter filter);

    /**
     * Drops every entry of the given files.
     *
     * @throws IOException if the index cannot be persisted
     */
    void remove(Collection<String> filePaths) throws IOException;

    /**
     * Swaps the entries of compaction inputs for entries of the output, with a single persist.
     *
     * @throws IOException if the index cannot be persisted
     */
    void replace(Collection<String> inputPaths, String outputPath, List<Map<String, Object>> rows,
                 List<String> indexColumns) throws IOException;

    Optional<ColumnIndexEntry> entry(String column, String filePath);

    /**
     * @return every entry of a column across files
     */
    List<ColumnIndexEntry> entriesForColumn(String column);

    /**
     * @return true if some file of the source has an entry for the column
     */
    boolean hasIndex(String sourceId, String column);

    /**
     * @return true if the file has at least one entry
     */
    boolean isIndexed(String filePath);

    IndexStatus status();
}
