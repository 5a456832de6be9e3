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

import com.umitunal.lake.storage.Tier;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the data files known to the engine.
 * Mutations are serialized by a single writer lock and written through to durable storage;
 * reads return snapshot copies.
 */
public interface Catalog {

    /**
     * Upserts an entry. An entry without a tier is registered as HOT.
     *
     * @throws IOException if the change cannot be persisted
     */
    void register(FileMetadata metadata) throws IOException;

    /**
     * Upserts several entries with a single persist.
     *
     * @throws IOException if the change cannot be persisted
     */
    void registerAll(Collection<FileMetadata> entries) throws IOException;

    Optional<FileMetadata> get(String path);

    /**
     * Removes entries. Unknown paths are ignored.
     *
     * @return the number of entries removed
     * @throws IOException if the change cannot be persisted
     */
    int removeAll(Collection<String> paths) throws IOException;

    /**
     * @param prefix a dataset or dataset/tenant prefix; empty for every entry
     * @return entries under the prefix, ordered by path
     */
    List<FileMetadata> list(String prefix);

    /**
     * @return the datasets that have at least one entry
     */
    Set<String> sources();

    CatalogStats stats();

    /**
     * Returns the files of a source that can answer a query: the entry's column set covers
     * the required columns and the file exists in its tier. Newest first.
     */
    List<FileMetadata> filesForQuery(String sourceId, Set<String> requiredColumns);

    /**
     * Atomically swaps compaction inputs for their output.
     *
     * @throws IOException if the change cannot be persisted
     */
    void replaceFiles(Collection<String> inputPaths, FileMetadata output) throws IOException;

    /**
     * Renames the file of an entry into the target tier and flips its tier flag,
     * both under the catalog lock.
     *
     * @return the updated entry
     * @throws java.nio.file.NoSuchFileException if the file is missing from its current tier
     * @throws IOException if the rename or persist fails
     */
    FileMetadata moveToTier(String path, Tier target) throws IOException;

    /**
     * @return a copy of every entry
     */
    List<FileMetadata> snapshot();

    /**
     * Replaces every entry with the given snapshot.
     *
     * @throws IOException if the change cannot be persisted
     */
    void restore(Collection<FileMetadata> entries) throws IOException;

    /**
     * @return entries whose file is missing from the expected tier location
     */
    List<FileMetadata> staleEntries();

    Optional<SchemaInfo> schemaFor(String path);

    List<SchemaInfo> schemas();

    /**
     * Answers from the schema registry whether a file carries the given columns.
     */
    boolean satisfies(String path, Collection<String> requiredColumns);
}
