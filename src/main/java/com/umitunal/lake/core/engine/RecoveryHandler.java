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

import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.wal.record.OperationStatus;
import com.umitunal.lake.wal.record.WalEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Re-applies completed log operations to the catalog and index.
 *
 * <p>Catalog entries are always re-derived from the data file headers, never from the logged payload,
 * so applying an entry that is already reflected in the catalog changes nothing. Files that no longer
 * exist where an operation left them are skipped; a later operation moved or removed them.</p>
 */
class RecoveryHandler implements Consumer<WalEntry> {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryHandler.class);

    private final EngineContext context;
    private int applied;

    RecoveryHandler(EngineContext context) {
        this.context = context;
    }

    @Override
    public void accept(WalEntry entry) {
        if (entry.status() != OperationStatus.COMPLETED) {
            return;
        }
        try {
            switch (entry.kind()) {
                case WRITE -> registerExisting(keys(entry, "files"), Tier.HOT);
                case DELETE -> forget(keys(entry, "files"));
                case COMPACT -> applyCompaction(keys(entry, "inputs"), (String) entry.payload().get("output"));
                case MIGRATE -> registerExisting(keys(entry, "moved"), Tier.COLD);
            }
            applied++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to replay " + entry.kind() + " " + entry.operationId(), e);
        }
    }

    int applied() {
        return applied;
    }

    private void registerExisting(List<String> keys, Tier tier) throws IOException {
        List<FileMetadata> found = new ArrayList<>();
        for (String key : keys) {
            if (!Files.exists(context.layout().resolve(key, tier))) {
                logger.debug("Replay skips " + key + ": not present in " + tier);
                continue;
            }
            FileMetadata described = context.extractor().describe(key, tier);
            Optional<FileMetadata> current = context.catalog().get(key);
            if (current.isEmpty() || !current.get().equals(described)) {
                found.add(described);
            }
        }
        if (!found.isEmpty()) {
            context.catalog().registerAll(found);
        }
    }

    private void forget(List<String> keys) throws IOException {
        context.catalog().removeAll(keys);
        context.indexManager().remove(keys);
    }

    private void applyCompaction(List<String> inputs, String output) throws IOException {
        if (output == null || !Files.exists(context.layout().resolve(output, Tier.HOT))) {
            logger.debug("Replay skips compaction output " + output + ": not present in hot tier");
            return;
        }
        FileMetadata described = context.extractor().describe(output, Tier.HOT);
        if (!context.catalog().get(output).equals(Optional.of(described))
            || inputs.stream().anyMatch(key -> context.catalog().get(key).isPresent())) {
            context.catalog().replaceFiles(inputs, described);
        }
        context.indexManager().remove(inputs);
    }

    private static List<String> keys(WalEntry entry, String field) {
        Object value = entry.payload().get(field);
        List<String> keys = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                keys.add(String.valueOf(item));
            }
        }
        return keys;
    }
}
