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

import java.io.IOException;
import java.util.Map;

/**
 * Durable storage of column index entries, keyed by column then file path.
 */
public interface IndexRepository {

    /**
     * @return the stored index, empty if nothing was stored yet
     * @throws IOException if the store exists but cannot be read
     */
    Map<String, Map<String, ColumnIndexEntry>> load() throws IOException;

    /**
     * Replaces the stored index.
     *
     * @throws IOException if an I/O error occurs
     */
    void save(Map<String, Map<String, ColumnIndexEntry>> index) throws IOException;
}
