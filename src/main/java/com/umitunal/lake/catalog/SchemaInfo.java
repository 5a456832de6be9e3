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

import java.util.List;

/**
 * A schema signature and the files that carry it.
 *
 * @param columns sorted column names forming the signature
 * @param firstSeen time the signature was first registered
 * @param lastUpdated time a file with this signature was last registered
 * @param fileCount number of cataloged files with this signature
 */
public record SchemaInfo(List<String> columns, long firstSeen, long lastUpdated, int fileCount) {

    public SchemaInfo {
        columns = List.copyOf(columns);
    }
}
