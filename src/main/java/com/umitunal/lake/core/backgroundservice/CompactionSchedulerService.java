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

import com.umitunal.lake.config.CompactionPolicy;
import com.umitunal.lake.core.compaction.CompactionManager;

import java.util.concurrent.TimeUnit;

/**
 * Background service that runs a compaction pass every {@code intervalMinutes}.
 * Whether a pass covers every source or only urgent ones is decided by the manager from the
 * maintenance window.
 */
public class CompactionSchedulerService extends AbstractBackgroundService {

    private final CompactionManager compactionManager;
    private final CompactionPolicy policy;

    public CompactionSchedulerService(CompactionManager compactionManager, CompactionPolicy policy) {
        super("Compaction");
        this.compactionManager = compactionManager;
        this.policy = policy;
    }

    @Override
    public void start() {
        scheduleTask(policy.intervalMinutes(), policy.intervalMinutes(), TimeUnit.MINUTES);
    }

    @Override
    protected void doExecute() {
        compactionManager.runScheduledPass();
    }
}
