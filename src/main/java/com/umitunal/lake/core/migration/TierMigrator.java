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

package com.umitunal.lake.core.migration;

import com.umitunal.lake.api.MigrationResult;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.core.engine.EngineContext;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.wal.record.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves hot files whose newest row is older than a cutoff into the cold tier.
 */
public class TierMigrator {
    private static final Logger logger = LoggerFactory.getLogger(TierMigrator.class);

    private final EngineContext context;

    public TierMigrator(EngineContext context) {
        this.context = context;
    }

    /**
     * Migrates every eligible hot file. Files without a time range and files missing from the hot tier
     * are logged and reported, never fatal.
     *
     * @param cutoffDays files whose max timestamp is older than now minus this many days are moved
     * @throws IOException if the pass could not be logged
     */
    public MigrationResult migrateCold(int cutoffDays) throws IOException {
        if (cutoffDays < 0) {
            throw new IllegalArgumentException("cutoffDays must not be negative");
        }
        long cutoff = context.clock().millis() - Duration.ofDays(cutoffDays).toMillis();
        logger.info("Cold storage migration, cutoff " + Instant.ofEpochMilli(cutoff) + " (older than "
            + cutoffDays + " days)");

        String operationId = context.wal().newOperationId();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("cutoffDays", cutoffDays);
        payload.put("cutoff", cutoff);
        context.wal().begin(operationId, OperationKind.MIGRATE, payload);
        context.wal().flush();

        List<String> moved = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (FileMetadata entry : context.catalog().snapshot()) {
            if (entry.tier() != Tier.HOT) {
                continue;
            }
            if (entry.maxTimestamp() == null) {
                logger.debug("Skipping " + entry.path() + ": no time range");
                skipped.add(entry.path());
                continue;
            }
            if (entry.maxTimestamp() >= cutoff) {
                continue;
            }
            try {
                context.catalog().moveToTier(entry.path(), Tier.COLD);
                moved.add(entry.path());
            } catch (NoSuchFileException e) {
                logger.warn("File missing in hot tier: " + entry.path());
                missing.add(entry.path());
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Failed to migrate " + entry.path() + ": " + e.getMessage());
                skipped.add(entry.path());
            }
        }

        Map<String, Object> completion = new LinkedHashMap<>(payload);
        completion.put("moved", moved);
        context.wal().markCompleted(operationId, OperationKind.MIGRATE, completion);
        if (moved.isEmpty()) {
            logger.info("No eligible files to migrate");
        } else {
            logger.info("Migrated " + moved.size() + " files to cold storage");
        }
        return new MigrationResult(operationId, moved, missing, skipped);
    }
}
