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

package com.umitunal.lake.catalog;

import com.umitunal.lake.storage.Tier;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Catalog entry for one data file.
 *
 * @param path key of the file relative to its tier root
 * @param sourceId dataset the file belongs to
 * @param tenant tenant the file belongs to
 * @param sizeBytes size on disk
 * @param rowCount number of rows
 * @param minTimestamp smallest time column value, or null
 * @param maxTimestamp largest time column value, or null
 * @param tier current storage tier
 * @param columns column names in storage order
 * @param createdAt creation time in epoch millis
 * @param writeId id of the write that produced the file
 * @param tags free-form labels
 */
public record FileMetadata(
    String path,
    String sourceId,
    String tenant,
    long sizeBytes,
    long rowCount,
    Long minTimestamp,
    Long maxTimestamp,
    Tier tier,
    List<String> columns,
    long createdAt,
    long writeId,
    Map<String, String> tags
) {

    public FileMetadata {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        tier = tier == null ? Tier.HOT : tier;
        columns = columns == null ? List.of() : List.copyOf(columns);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public FileMetadata withTier(Tier tier) {
        return new FileMetadata(path, sourceId, tenant, sizeBytes, rowCount, minTimestamp, maxTimestamp,
            tier, columns, createdAt, writeId, tags);
    }

    public boolean hasColumns(Collection<String> required) {
        return columns.containsAll(required);
    }
}
