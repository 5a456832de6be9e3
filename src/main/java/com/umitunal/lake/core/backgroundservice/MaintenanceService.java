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

package com.umitunal.lake.core.backgroundservice;

import com.umitunal.lake.core.compaction.CompactionManager;
import com.umitunal.lake.wal.WAL;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Background service that reclaims expired log segments and purges old compaction backups.
 * Compaction also triggers it asynchronously after moving inputs into the backup area.
 */
public class MaintenanceService extends AbstractBackgroundService {

    private final WAL wal;
    private final CompactionManager compactionManager;
    private final long intervalMinutes;

    public MaintenanceService(WAL wal, CompactionManager compactionManager, long intervalMinutes) {
        super("Maintenance");
        this.wal = wal;
        this.compactionManager = compactionManager;
        this.intervalMinutes = intervalMinutes;
    }

    @Override
    public void start() {
        scheduleTask(1, intervalMinutes, TimeUnit.MINUTES);
    }

    @Override
    protected void doExecute() {
        try {
            int segments = wal.reclaimSegments();
            if (segments > 0) {
                logger.info("Reclaimed " + segments + " expired log segments");
            }
        } catch (IOException e) {
            logger.error("Failed to reclaim log segments", e);
        }

        try {
            int folders = compactionManager.purgeExpiredBackups();
            if (folders > 0) {
                logger.info("Purged " + folders + " expired backup folders");
            }
        } catch (IOException e) {
            logger.error("Failed to purge compaction backups", e);
        }
    }
}
