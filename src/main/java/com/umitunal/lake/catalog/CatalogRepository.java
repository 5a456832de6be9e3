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

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Durable storage of catalog entries. The catalog keeps the authoritative copy in memory
 * and writes every change through to the repository.
 */
public interface CatalogRepository {

    /**
     * @return every stored entry, empty if nothing was stored yet
     * @throws IOException if the store exists but cannot be read
     */
    List<FileMetadata> load() throws IOException;

    /**
     * Replaces the stored entries with the given ones.
     *
     * @throws IOException if an I/O error occurs
     */
    void save(Collection<FileMetadata> entries) throws IOException;
}
