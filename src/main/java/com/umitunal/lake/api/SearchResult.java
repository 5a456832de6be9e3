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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gathered result of a search over one or more sources.
 *
 * @param batches batches of every source that answered, in source order
 * @param errors source id to error message for sources that failed
 */
public record SearchResult(List<RecordBatch> batches, Map<String, String> errors) {

    public SearchResult {
        batches = List.copyOf(batches);
        errors = Map.copyOf(errors);
    }

    public List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (RecordBatch batch : batches) {
            rows.addAll(batch.rows());
        }
        return rows;
    }

    public long totalRows() {
        long total = 0;
        for (RecordBatch batch : batches) {
            total += batch.size();
        }
        return total;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
