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

import com.umitunal.lake.optimizer.StatisticsCollector;

import java.util.concurrent.TimeUnit;

/**
 * Background service that re-collects optimizer statistics of every cached source.
 */
public class StatisticsRefreshService extends AbstractBackgroundService {

    private final StatisticsCollector statisticsCollector;
    private final long intervalMinutes;

    public StatisticsRefreshService(StatisticsCollector statisticsCollector, long intervalMinutes) {
        super("StatisticsRefresh");
        this.statisticsCollector = statisticsCollector;
        this.intervalMinutes = intervalMinutes;
    }

    @Override
    public void start() {
        scheduleTask(intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
    }

    @Override
    protected void doExecute() {
        int refreshed = statisticsCollector.refreshCached();
        logger.debug("Refreshed statistics of " + refreshed + " sources");
    }
}
