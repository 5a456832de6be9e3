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
 * One sample of system and query load.
 *
 * @param timestamp sample time in epoch millis
 * @param cpuPercent system CPU usage, 0-100
 * @param memoryPercent physical memory usage, 0-100
 * @param activeQueries queries running when sampled
 * @param queueLength queries waiting for a worker
 * @param avgQueryLatencyMillis mean latency of queries completed since the previous sample
 * @param ioWait I/O wait indicator reported by the metrics provider
 */
public record MetricsSnapshot(
    long timestamp,
    double cpuPercent,
    double memoryPercent,
    int activeQueries,
    int queueLength,
    double avgQueryLatencyMillis,
    double ioWait
) {
}
