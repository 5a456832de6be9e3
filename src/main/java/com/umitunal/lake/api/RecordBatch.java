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

package com.umitunal.lake.api;

import java.util.List;
import java.util.Map;

/**
 * Rows read from one data file that matched a filter.
 *
 * @param sourceId dataset the rows belong to
 * @param filePath key of the file the rows were read from
 * @param rows matching rows in file order
 */
public record RecordBatch(String sourceId, String filePath, List<Map<String, Object>> rows) {

    public RecordBatch {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
