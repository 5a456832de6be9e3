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
import com.umitunal.lake.config.ScalingPolicy;
import com.umitunal.lake.core.compaction.CompactionManager;
import com.umitunal.lake.core.scaling.AutoScaler;
import com.umitunal.lake.core.scaling.ScalingAction;
import com.umitunal.lake.optimizer.StatisticsCollector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the compaction, auto-scaling and statistics refresh services.
 */
class ScheduledServicesTest {

    @Test
    void testCompactionSchedulerRunsScheduledPass() {
        CompactionManager compactionManager = mock(CompactionManager.class);
        CompactionSchedulerService service = new CompactionSchedulerService(compactionManager,
            CompactionPolicy.getDefault());
        try {
            service.executeNow();
            verify(compactionManager, times(1)).runScheduledPass();
        } finally {
            service.shutdown();
        }
    }

    @Test
    void testCompactionFailureLogged() {
        CompactionManager compactionManager = mock(CompactionManager.class);
        doThrow(new IllegalStateException("boom")).when(compactionManager).runScheduledPass();
        CompactionSchedulerService service = new CompactionSchedulerService(compactionManager,
            CompactionPolicy.getDefault());
        try {
            assertDoesNotThrow(service::executeNow);
        } finally {
            service.shutdown();
        }
    }

    @Test
    void testAutoScalingRunsCycle() {
        AutoScaler autoScaler = mock(AutoScaler.class);
        when(autoScaler.runCycle()).thenReturn(ScalingAction.SCALE_UP);
        when(autoScaler.currentWorkers()).thenReturn(3);
        AutoScalingService service = new AutoScalingService(autoScaler, ScalingPolicy.getDefault());
        try {
            service.executeNow();
            verify(autoScaler, times(1)).runCycle();
            verify(autoScaler, times(1)).currentWorkers();
        } finally {
            service.shutdown();
        }
    }

    @Test
    void testStatisticsRefreshRefreshesCache() {
        StatisticsCollector collector = mock(StatisticsCollector.class);
        when(collector.refreshCached()).thenReturn(4);
        StatisticsRefreshService service = new StatisticsRefreshService(collector, 15);
        try {
            service.executeNow();
            verify(collector, times(1)).refreshCached();
        } finally {
            service.shutdown();
        }
    }
}
