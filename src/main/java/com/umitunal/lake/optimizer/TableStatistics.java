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

package com.umitunal.lake.optimizer;

import java.util.Map;

/**
 * Size of a source plus sampled column statistics.
 */
public record TableStatistics(
    String sourceId,
    long rowCount,
    int fileCount,
    long sizeBytes,
    Map<String, ColumnStatistics> columns,
    long collectedAt
) {

    public TableStatistics {
        columns = Map.copyOf(columns);
    }

    public static TableStatistics empty(String sourceId) {
        return new TableStatistics(sourceId, 0, 0, 0, Map.of(), 0);
    }

    public ColumnStatistics column(String name) {
        return columns.get(name);
    }
}
