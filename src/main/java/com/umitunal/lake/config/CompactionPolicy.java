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
 * Policy parameters for the compaction manager.
 *
 * @param minFileSizeBytes files below this size count as small
 * @param targetFileSizeBytes preferred size of a compacted output file
 * @param maxFileSizeBytes files above this size count as large
 * @param smallFileThreshold number of small files that makes a source eligible
 * @param totalFileThreshold number of files that makes a source eligible
 * @param ageThresholdHours files older than this count as old
 * @param maxConcurrentCompactions cap on jobs running at the same time
 * @param batchSize maximum number of input files per job
 * @param maintenanceStartHour first hour (inclusive) of the maintenance window
 * @param maintenanceEndHour last hour (exclusive) of the maintenance window
 * @param intervalMinutes interval in minutes between scheduler runs
 * @param backupRetentionDays days a dated backup directory is kept before purge
 */
public record CompactionPolicy(
    long minFileSizeBytes,
    long targetFileSizeBytes,
    long maxFileSizeBytes,
    int smallFileThreshold,
    int totalFileThreshold,
    int ageThresholdHours,
    int maxConcurrentCompactions,
    int batchSize,
    int maintenanceStartHour,
    int maintenanceEndHour,
    int intervalMinutes,
    int backupRetentionDays
) {

    public CompactionPolicy {
        if (minFileSizeBytes <= 0 || targetFileSizeBytes < minFileSizeBytes || maxFileSizeBytes < targetFileSizeBytes) {
            throw new IllegalArgumentException("file sizes must satisfy 0 < min <= target <= max");
        }
        if (smallFileThreshold < 2) {
            throw new IllegalArgumentException("smallFileThreshold must be at least 2");
        }
        if (totalFileThreshold <= 0) {
            throw new IllegalArgumentException("totalFileThreshold must be positive");
        }
        if (ageThresholdHours <= 0) {
            throw new IllegalArgumentException("ageThresholdHours must be positive");
        }
        if (maxConcurrentCompactions <= 0) {
            throw new IllegalArgumentException("maxConcurrentCompactions must be positive");
        }
        if (batchSize < 2) {
            throw new IllegalArgumentException("batchSize must be at least 2");
        }
        if (maintenanceStartHour < 0 || maintenanceStartHour > 23 || maintenanceEndHour < 0 || maintenanceEndHour > 24) {
            throw new IllegalArgumentException("maintenance window hours out of range");
        }
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive");
        }
        if (backupRetentionDays <= 0) {
            throw new IllegalArgumentException("backupRetentionDays must be positive");
        }
    }

    /**
     * Creates a default policy with:
     * - small files below 50MB, target 256MB, large above 512MB
     * - 10 small files or 100 files make a source eligible
     * - files older than 6 hours count as old
     * - 3 concurrent jobs of at most 20 files
     * - maintenance window 02:00 to 06:00, scheduler every 60 minutes
     * - backups kept for 7 days
     *
     * @return a default policy
     */
    public static CompactionPolicy getDefault() {
        long mb = 1024L * 1024;
        return new CompactionPolicy(50 * mb, 256 * mb, 512 * mb, 10, 100, 6, 3, 20, 2, 6, 60, 7);
    }

    public CompactionPolicy withSmallFileThreshold(int smallFileThreshold) {
        return new CompactionPolicy(minFileSizeBytes, targetFileSizeBytes, maxFileSizeBytes, smallFileThreshold,
            totalFileThreshold, ageThresholdHours, maxConcurrentCompactions, batchSize, maintenanceStartHour,
            maintenanceEndHour, intervalMinutes, backupRetentionDays);
    }

    public CompactionPolicy withTotalFileThreshold(int totalFileThreshold) {
        return new CompactionPolicy(minFileSizeBytes, targetFileSizeBytes, maxFileSizeBytes, smallFileThreshold,
            totalFileThreshold, ageThresholdHours, maxConcurrentCompactions, batchSize, maintenanceStartHour,
            maintenanceEndHour, intervalMinutes, backupRetentionDays);
    }

    public CompactionPolicy withMaxConcurrentCompactions(int maxConcurrentCompactions) {
        return new CompactionPolicy(minFileSizeBytes, targetFileSizeBytes, maxFileSizeBytes, smallFileThreshold,
            totalFileThreshold, ageThresholdHours, maxConcurrentCompactions, batchSize, maintenanceStartHour,
            maintenanceEndHour, intervalMinutes, backupRetentionDays);
    }

    public CompactionPolicy withBatchSize(int batchSize) {
        return new CompactionPolicy(minFileSizeBytes, targetFileSizeBytes, maxFileSizeBytes, smallFileThreshold,
            totalFileThreshold, ageThresholdHours, maxConcurrentCompactions, batchSize, maintenanceStartHour,
            maintenanceEndHour, intervalMinutes, backupRetentionDays);
    }

    public CompactionPolicy withMaintenanceWindow(int maintenanceStartHour, int maintenanceEndHour) {
        return new CompactionPolicy(minFileSizeBytes, targetFileSizeBytes, maxFileSizeBytes, smallFileThreshold,
            totalFileThreshold, ageThresholdHours, maxConcurrentCompactions, batchSize, maintenanceStartHour,
            maintenanceEndHour, intervalMinutes, backupRetentionDays);
    }

    /**
     * Returns true if the given hour of day falls in the maintenance window.
     * A window whose start is after its end wraps around midnight.
     */
    public boolean inMaintenanceWindow(int hourOfDay) {
        if (maintenanceStartHour <= maintenanceEndHour) {
            return hourOfDay >= maintenanceStartHour && hourOfDay < maintenanceEndHour;
        }
        return hourOfDay >= maintenanceStartHour || hourOfDay < maintenanceEndHour;
    }
}
