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

import java.util.List;

/**
 * Configuration record for the cost-based optimizer.
 *
 * @param maxConcurrency upper bound on the parallelism factor of a plan
 * @param partitionColumns column names treated as partition keys when pruning
 * @param sampleFiles number of files sampled per source when collecting column statistics
 * @param distinctSampleLimit maximum size of a per-column distinct-value sample
 * @param distinctPerFile maximum number of distinct values added from one file
 * @param executionHistorySize number of executions remembered per plan id
 * @param feedbackMinSamples executions required before the cost model is adjusted
 * @param statisticsRefreshMinutes interval in minutes between background statistics refreshes
 */
public record OptimizerConfig(
    int maxConcurrency,
    List<String> partitionColumns,
    int sampleFiles,
    int distinctSampleLimit,
    int distinctPerFile,
    int executionHistorySize,
    int feedbackMinSamples,
    int statisticsRefreshMinutes
) {

    public OptimizerConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        partitionColumns = partitionColumns == null ? List.of() : List.copyOf(partitionColumns);
        if (sampleFiles <= 0 || distinctSampleLimit <= 0 || distinctPerFile <= 0) {
            throw new IllegalArgumentException("sampling limits must be positive");
        }
        if (executionHistorySize <= 0 || feedbackMinSamples <= 0) {
            throw new IllegalArgumentException("history sizes must be positive");
        }
        if (statisticsRefreshMinutes <= 0) {
            throw new IllegalArgumentException("statisticsRefreshMinutes must be positive");
        }
    }

    /**
     * Creates a default configuration: parallelism up to 8, the usual date-like partition
     * columns, statistics sampled from 3 files (1000 distinct values, 100 per file),
     * 100 executions kept per plan, feedback after 5 executions, refresh every 15 minutes.
     *
     * @return a default configuration
     */
    public static OptimizerConfig getDefault() {
        return new OptimizerConfig(8, List.of("date", "timestamp", "year", "month", "day"),
            3, 1000, 100, 100, 5, 15);
    }

    public OptimizerConfig withMaxConcurrency(int maxConcurrency) {
        return new OptimizerConfig(maxConcurrency, partitionColumns, sampleFiles, distinctSampleLimit,
            distinctPerFile, executionHistorySize, feedbackMinSamples, statisticsRefreshMinutes);
    }

    public OptimizerConfig withPartitionColumns(List<String> partitionColumns) {
        return new OptimizerConfig(maxConcurrency, partitionColumns, sampleFiles, distinctSampleLimit,
            distinctPerFile, executionHistorySize, feedbackMinSamples, statisticsRefreshMinutes);
    }
}
