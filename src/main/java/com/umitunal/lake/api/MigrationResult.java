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

/**
 * Outcome of a hot to cold migration pass.
 *
 * @param operationId log operation that guarded the pass
 * @param moved keys moved to the cold tier
 * @param missing keys whose hot file was not found
 * @param skipped keys without a time range
 */
public record MigrationResult(String operationId, List<String> moved, List<String> missing, List<String> skipped) {

    public MigrationResult {
        moved = List.copyOf(moved);
        missing = List.copyOf(missing);
        skipped = List.copyOf(skipped);
    }

    public int movedCount() {
        return moved.size();
    }
}
