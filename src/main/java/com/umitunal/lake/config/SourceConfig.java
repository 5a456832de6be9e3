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

package com.umitunal.lake.config;

import java.util.List;

/**
 * Per-source (dataset) write and index settings.
 *
 * @param sourceId the dataset name, also the first segment of every file path
 * @param partitionColumns columns whose values fan a batch out into {@code col=value} sub-directories
 * @param indexColumns columns to index; empty means every column
 * @param compress whether column blocks are deflate-compressed
 */
public record SourceConfig(
    String sourceId,
    List<String> partitionColumns,
    List<String> indexColumns,
    boolean compress
) {

    public SourceConfig {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        if (sourceId.contains("/") || sourceId.contains("\\")) {
            throw new IllegalArgumentException("sourceId must not contain path separators");
        }
        partitionColumns = partitionColumns == null ? List.of() : List.copyOf(partitionColumns);
        indexColumns = indexColumns == null ? List.of() : List.copyOf(indexColumns);
    }

    /**
     * Creates an unpartitioned source that indexes every column.
     */
    public static SourceConfig of(String sourceId) {
        return new SourceConfig(sourceId, List.of(), List.of(), false);
    }

    public SourceConfig withPartitionColumns(List<String> partitionColumns) {
        return new SourceConfig(sourceId, partitionColumns, indexColumns, compress);
    }

    public SourceConfig withIndexColumns(List<String> indexColumns) {
        return new SourceConfig(sourceId, partitionColumns, indexColumns, compress);
    }

    public SourceConfig withCompress(boolean compress) {
        return new SourceConfig(sourceId, partitionColumns, indexColumns, compress);
    }
}
