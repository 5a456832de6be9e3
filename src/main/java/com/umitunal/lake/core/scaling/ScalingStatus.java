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

package com.umitunal.lake.core.scaling;

/**
 * Read-only snapshot of the auto-scaler.
 *
 * @param recentMetrics latest sample, null before the first cycle
 * @param lastScaleUp time of the last scale up in epoch millis, null if none
 * @param lastScaleDown time of the last scale down in epoch millis, null if none
 * @param cacheBudgetBytes budget last pushed to memory pressure listeners
 */
public record ScalingStatus(
    int currentWorkers,
    boolean scalingInProgress,
    int activeQueries,
    int queuedQueries,
    MetricsSnapshot recentMetrics,
    Long lastScaleUp,
    Long lastScaleDown,
    long cacheBudgetBytes,
    int historySize
) {
}
