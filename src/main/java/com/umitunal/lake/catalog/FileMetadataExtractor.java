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

import com.umitunal.lake.columnfile.ColumnFileIO;
import com.umitunal.lake.columnfile.ColumnFileInfo;
import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.storage.Tier;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives catalog entries from data files themselves.
 * The live write path, compaction and log replay all describe files through this class,
 * so re-applying an operation always produces the same entry.
 */
public class FileMetadataExtractor {

    private final StorageLayout layout;
    private final ColumnFileIO columnFileIO;

    public FileMetadataExtractor(StorageLayout layout, ColumnFileIO columnFileIO) {
        this.layout = layout;
        this.columnFileIO = columnFileIO;
    }

    /**
     * Reads the header of the file stored under {@code key} in {@code tier}.
     *
     * @throws IOException if the file is missing or not a valid column file
     */
    public FileMetadata describe(String key, Tier tier) throws IOException {
        ColumnFileInfo info = columnFileIO.readInfo(layout.resolve(key, tier));
        return toMetadata(key, tier, info);
    }

    /**
     * Builds an entry from header facts already at hand.
     */
    public FileMetadata toMetadata(String key, Tier tier, ColumnFileInfo info) {
        return new FileMetadata(
            key,
            StorageLayout.sourceOf(key),
            StorageLayout.tenantOf(key),
            info.sizeBytes(),
            info.rowCount(),
            info.minTimestamp(),
            info.maxTimestamp(),
            tier,
            info.columnNames(),
            info.createdAt(),
            info.writeId(),
            tagsOf(key));
    }

    /**
     * @return partition column to escaped value, taken from the {@code col=value} directories of a key
     */
    public static Map<String, String> partitionsOf(String key) {
        Map<String, String> partitions = new LinkedHashMap<>();
        String[] parts = key.split("/");
        for (int i = 2; i < parts.length - 1; i++) {
            int eq = parts[i].indexOf('=');
            if (eq > 0) {
                partitions.put(parts[i].substring(0, eq), parts[i].substring(eq + 1));
            }
        }
        return partitions;
    }

    private static Map<String, String> tagsOf(String key) {
        Map<String, String> tags = new LinkedHashMap<>();
        partitionsOf(key).forEach((column, value) -> tags.put("partition." + column, value));
        return tags;
    }
}
