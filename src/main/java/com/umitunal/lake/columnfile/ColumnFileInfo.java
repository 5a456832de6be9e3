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

package com.umitunal.lake.columnfile;

import java.util.List;

/**
 * Facts about a column file read from its header.
 *
 * @param sizeBytes size of the file on disk
 * @param rowCount number of rows
 * @param columns column descriptors in storage order
 * @param createdAt creation time in epoch millis
 * @param writeId id of the write that produced the file
 * @param minTimestamp smallest value of the time column, or null when the file has none
 * @param maxTimestamp largest value of the time column, or null when the file has none
 * @param compressed whether column blocks are deflate-compressed
 */
public record ColumnFileInfo(
    long sizeBytes,
    int rowCount,
    List<ColumnDescriptor> columns,
    long createdAt,
    long writeId,
    Long minTimestamp,
    Long maxTimestamp,
    boolean compressed
) {

    public ColumnFileInfo {
        columns = List.copyOf(columns);
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDescriptor::name).toList();
    }
}
