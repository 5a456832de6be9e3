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

import com.umitunal.lake.config.WalConfig;
import com.umitunal.lake.wal.WAL;
import com.umitunal.lake.wal.WalFlushException;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Background service that flushes buffered log entries on a timer.
 * A flush failure puts the log into its failed state and stops this loop; writers see the
 * failure on their next append.
 */
public class WalFlushService extends AbstractBackgroundService {

    private final WAL wal;
    private final WalConfig config;

    public WalFlushService(WAL wal, WalConfig config) {
        super("WAL-Flush");
        this.wal = wal;
        this.config = config;
    }

    @Override
    public void start() {
        scheduleTask(config.flushIntervalMillis(), config.flushIntervalMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    protected void doExecute() {
        try {
            wal.flush();
        } catch (WalFlushException e) {
            logger.error("Write-ahead log is in a failed state, stopping the flush loop", e);
            cancelSchedule();
        } catch (IOException e) {
            logger.error("Write-ahead log flush failed, stopping the flush loop", e);
            cancelSchedule();
        }
    }
}
