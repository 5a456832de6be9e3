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
 * Outcome of a successful write.
 *
 * @param operationId log operation that guarded the write
 * @param paths keys of the files written, one per partition
 * @param rowCount number of rows written
 */
public record WriteResult(String operationId, List<String> paths, long rowCount) {

    public WriteResult {
        paths = List.copyOf(paths);
    }
}
