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

package com.umitunal.lake.core.source;

/**
 * Per-source totals taken from the catalog.
 *
 * @param lastWriteAt creation time of the newest file, 0 if the source has none
 */
public record SourceStatistics(
    String sourceId,
    int fileCount,
    long totalBytes,
    long totalRows,
    int hotFiles,
    int coldFiles,
    long lastWriteAt
) {
}
