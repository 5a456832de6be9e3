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

import java.util.List;

/**
 * Statistics of one column in one file.
 * {@code minValue} and {@code maxValue} bound every non-null value in the file;
 * {@code uniqueValues} is present only when the column had few distinct values, and is then complete.
 *
 * @param filePath key of the indexed file
 * @param column the column
 * @param minValue smallest non-null value, or null if every cell is null
 * @param maxValue largest non-null value, or null if every cell is null
 * @param uniqueValues all distinct non-null values, or null when above the cardinality threshold
 * @param nullCount number of rows whose cell is null or missing
 * @param rowCount number of rows in the file
 * @param createdAt time the entry was computed, in epoch millis
 */
public record ColumnIndexEntry(
    String filePath,
    String column,
    Object minValue,
    Object maxValue,
    List<Object> uniqueValues,
    long nullCount,
    long rowCount,
    long createdAt
) {

    public ColumnIndexEntry {
        uniqueValues = uniqueValues == null ? null : List.copyOf(uniqueValues);
    }

    public boolean hasUniqueValues() {
        return uniqueValues != null;
    }
}
