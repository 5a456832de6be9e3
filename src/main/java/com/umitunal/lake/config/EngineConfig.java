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
 * Configuration record for a LakeEngine.
 * This record groups the data directory with the settings of every engine component.
 *
 * @param dataDirectory root directory holding the hot, cold, backup, wal and metadata areas
 * @param timestampColumn column whose values give a file its time range
 * @param uniqueValueThreshold a column index keeps its distinct values only below this count
 * @param wal write-ahead log settings
 * @param compaction compaction policy
 * @param scaling auto-scaling policy
 * @param optimizer optimizer settings
 */
public record EngineConfig(
    String dataDirectory,
    String timestampColumn,
    int uniqueValueThreshold,
    WalConfig wal,
    CompactionPolicy compaction,
    ScalingPolicy scaling,
    OptimizerConfig optimizer
) {

    /**
     * Validates that all parameters are valid.
     *
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public EngineConfig {
        if (dataDirectory == null || dataDirectory.isBlank()) {
            throw new IllegalArgumentException("dataDirectory must not be blank");
        }
        if (timestampColumn == null || timestampColumn.isBlank()) {
            throw new IllegalArgumentException("timestampColumn must not be blank");
        }
        if (uniqueValueThreshold <= 0) {
            throw new IllegalArgumentException("uniqueValueThreshold must be positive");
        }
        if (wal == null || compaction == null || scaling == null || optimizer == null) {
            throw new IllegalArgumentException("component configurations must not be null");
        }
    }

    /**
     * Creates a default configuration rooted at "./lake" with a "timestamp" time column,
     * unique-value sets kept below 100 distinct values, and default component settings.
     *
     * @return a default configuration
     */
    public static EngineConfig getDefault() {
        return new EngineConfig("./lake", "timestamp", 100, WalConfig.getDefault(),
            CompactionPolicy.getDefault(), ScalingPolicy.getDefault(), OptimizerConfig.getDefault());
    }

    public EngineConfig withDataDirectory(String dataDirectory) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }

    public EngineConfig withTimestampColumn(String timestampColumn) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }

    public EngineConfig withUniqueValueThreshold(int uniqueValueThreshold) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }

    public EngineConfig withWal(WalConfig wal) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }

    public EngineConfig withCompaction(CompactionPolicy compaction) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }

    public EngineConfig withScaling(ScalingPolicy scaling) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }

    public EngineConfig withOptimizer(OptimizerConfig optimizer) {
        return new EngineConfig(dataDirectory, timestampColumn, uniqueValueThreshold, wal, compaction, scaling, optimizer);
    }
}
