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

package com.umitunal.lake.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.lake.catalog.Catalog;
import com.umitunal.lake.catalog.CatalogImpl;
import com.umitunal.lake.catalog.FileMetadataExtractor;
import com.umitunal.lake.catalog.JsonCatalogRepository;
import com.umitunal.lake.columnfile.ColumnFileIO;
import com.umitunal.lake.columnfile.ColumnFileIOImpl;
import com.umitunal.lake.config.EngineConfig;
import com.umitunal.lake.index.IndexManager;
import com.umitunal.lake.index.IndexManagerImpl;
import com.umitunal.lake.index.JsonIndexRepository;
import com.umitunal.lake.storage.ObjectMappers;
import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.wal.WAL;
import com.umitunal.lake.wal.WALImpl;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The shared collaborators of one engine instance, passed explicitly to every component.
 */
public final class EngineContext {

    private final EngineConfig config;
    private final StorageLayout layout;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ColumnFileIO columnFileIO;
    private final FileMetadataExtractor extractor;
    private final WAL wal;
    private final Catalog catalog;
    private final IndexManager indexManager;
    private final AtomicLong lastWriteId = new AtomicLong();

    public EngineContext(EngineConfig config, StorageLayout layout, ObjectMapper objectMapper, Clock clock,
                         ColumnFileIO columnFileIO, WAL wal, Catalog catalog, IndexManager indexManager) {
        this.config = config;
        this.layout = layout;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.columnFileIO = columnFileIO;
        this.extractor = new FileMetadataExtractor(layout, columnFileIO);
        this.wal = wal;
        this.catalog = catalog;
        this.indexManager = indexManager;
    }

    /**
     * Creates the directory layout and opens the log, catalog and index stored under the data directory.
     *
     * @throws IOException if any persisted state cannot be opened
     */
    public static EngineContext open(EngineConfig config, Clock clock) throws IOException {
        StorageLayout layout = new StorageLayout(Path.of(config.dataDirectory()));
        layout.createDirectories();
        ObjectMapper objectMapper = ObjectMappers.create();
        ColumnFileIO columnFileIO = new ColumnFileIOImpl(config.timestampColumn());
        WAL wal = new WALImpl(layout.walDirectory(), layout.checkpointDirectory(), config.wal(), objectMapper, clock);
        try {
            Catalog catalog = new CatalogImpl(layout, new JsonCatalogRepository(layout.catalogFile(), objectMapper), clock);
            IndexManager indexManager = new IndexManagerImpl(
                new JsonIndexRepository(layout.indexFile(), objectMapper), config.uniqueValueThreshold(), clock);
            return new EngineContext(config, layout, objectMapper, clock, columnFileIO, wal, catalog, indexManager);
        } catch (IOException | RuntimeException e) {
            try {
                wal.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    /**
     * @return a write id greater than every id handed out before by this context
     */
    public long nextWriteId() {
        long floor = clock.millis() * 1000;
        return lastWriteId.updateAndGet(previous -> Math.max(previous + 1, floor));
    }

    public EngineConfig config() {
        return config;
    }

    public StorageLayout layout() {
        return layout;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public Clock clock() {
        return clock;
    }

    public ColumnFileIO columnFileIO() {
        return columnFileIO;
    }

    public FileMetadataExtractor extractor() {
        return extractor;
    }

    public WAL wal() {
        return wal;
    }

    public Catalog catalog() {
        return catalog;
    }

    public IndexManager indexManager() {
        return indexManager;
    }
}
