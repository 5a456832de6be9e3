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

package com.umitunal.lake.config;

/**
 * Thresholds and limits for the auto-scaler.
 *
 * @param cpuScaleUpPercent CPU percentage above which workers are added
 * @param cpuScaleDownPercent CPU percentage below which workers may be removed
 * @param memoryScaleUpPercent memory percentage above which workers are added
 * @param memoryScaleDownPercent memory percentage below which workers may be removed
 * @param maxConcurrentQueries reference query concurrency used for the load ratio
 * @param queueThreshold queued query count above which workers are added
 * @param latencyThresholdMillis average query latency above which workers are added
 * @param minWorkers lower bound of the worker pool
 * @param maxWorkers upper bound of the worker pool
 * @param scaleUpFactor multiplier applied when scaling up
 * @param scaleDownFactor multiplier applied when scaling down
 * @param scaleUpCooldownSeconds minimum time between two scale-ups
 * @param scaleDownCooldownSeconds minimum time between two scale-downs
 * @param historySize number of metric snapshots retained
 * @param evaluationWindow number of most recent snapshots averaged per decision
 * @param memoryHighWaterPercent memory percentage above which caches are asked to evict
 * @param cacheBudgetFraction fraction of available memory offered to caches
 * @param monitorIntervalSeconds interval in seconds between monitoring cycles
 */
public record ScalingPolicy(
    double cpuScaleUpPercent,
    double cpuScaleDownPercent,
    double memoryScaleUpPercent,
    double memoryScaleDownPercent,
    int maxConcurrentQueries,
    int queueThreshold,
    long latencyThresholdMillis,
    int minWorkers,
    int maxWorkers,
    double scaleUpFactor,
    double scaleDownFactor,
    long scaleUpCooldownSeconds,
    long scaleDownCooldownSeconds,
    int historySize,
    int evaluationWindow,
    double memoryHighWaterPercent,
    double cacheBudgetFraction,
    int monitorIntervalSeconds
) {

    public ScalingPolicy {
        if (cpuScaleDownPercent >= cpuScaleUpPercent) {
            throw new IllegalArgumentException("cpuScaleDownPercent must be below cpuScaleUpPercent");
        }
        if (memoryScaleDownPercent >= memoryScaleUpPercent) {
            throw new IllegalArgumentException("memoryScaleDownPercent must be below memoryScaleUpPercent");
        }
        if (maxConcurrentQueries <= 0) {
            throw new IllegalArgumentException("maxConcurrentQueries must be positive");
        }
        if (queueThreshold < 0) {
            throw new IllegalArgumentException("queueThreshold must not be negative");
        }
        if (latencyThresholdMillis <= 0) {
            throw new IllegalArgumentException("latencyThresholdMillis must be positive");
        }
        if (minWorkers <= 0 || maxWorkers < minWorkers) {
            throw new IllegalArgumentException("workers must satisfy 0 < minWorkers <= maxWorkers");
        }
        if (scaleUpFactor <= 1.0) {
            throw new IllegalArgumentException("scaleUpFactor must be greater than 1");
        }
        if (scaleDownFactor <= 0.0 || scaleDownFactor >= 1.0) {
            throw new IllegalArgumentException("scaleDownFactor must be between 0 and 1");
        }
        if (scaleUpCooldownSeconds < 0 || scaleDownCooldownSeconds < 0) {
            throw new IllegalArgumentException("cooldowns must not be negative");
        }
        if (historySize <= 0 || evaluationWindow <= 0 || evaluationWindow > historySize) {
            throw new IllegalArgumentException("evaluationWindow must be positive and fit in historySize");
        }
        if (cacheBudgetFraction <= 0.0 || cacheBudgetFraction > 1.0) {
            throw new IllegalArgumentException("cacheBudgetFraction must be in (0, 1]");
        }
        if (monitorIntervalSeconds <= 0) {
            throw new IllegalArgumentException("monitorIntervalSeconds must be positive");
        }
    }

    /**
     * Creates a default policy: CPU 70/30, memory 80/40, 50 concurrent queries,
     * queue 10, latency 30s, 2 to 100 workers scaled by 1.5 and 0.7 with 5 and 10 minute
     * cooldowns, 100 snapshots averaged 3 at a time, eviction above 85% memory,
     * 30% of available memory for caches, a cycle every 30 seconds.
     *
     * @return a default policy
     */
    public static ScalingPolicy getDefault() {
        return new ScalingPolicy(70.0, 30.0, 80.0, 40.0, 50, 10, 30_000L, 2, 100, 1.5, 0.7,
            300, 600, 100, 3, 85.0, 0.3, 30);
    }

    public ScalingPolicy withWorkerBounds(int minWorkers, int maxWorkers) {
        return new ScalingPolicy(cpuScaleUpPercent, cpuScaleDownPercent, memoryScaleUpPercent, memoryScaleDownPercent,
            maxConcurrentQueries, queueThreshold, latencyThresholdMillis, minWorkers, maxWorkers, scaleUpFactor,
            scaleDownFactor, scaleUpCooldownSeconds, scaleDownCooldownSeconds, historySize, evaluationWindow,
            memoryHighWaterPercent, cacheBudgetFraction, monitorIntervalSeconds);
    }

    public ScalingPolicy withCooldowns(long scaleUpCooldownSeconds, long scaleDownCooldownSeconds) {
        return new ScalingPolicy(cpuScaleUpPercent, cpuScaleDownPercent, memoryScaleUpPercent, memoryScaleDownPercent,
            maxConcurrentQueries, queueThreshold, latencyThresholdMillis, minWorkers, maxWorkers, scaleUpFactor,
            scaleDownFactor, scaleUpCooldownSeconds, scaleDownCooldownSeconds, historySize, evaluationWindow,
            memoryHighWaterPercent, cacheBudgetFraction, monitorIntervalSeconds);
    }
}
