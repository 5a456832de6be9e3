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
 * Configuration record for the write-ahead log.
 *
 * @param bufferThreshold number of buffered entries that triggers an immediate flush
 * @param flushIntervalMillis interval in milliseconds between timer-driven flushes
 * @param maxSegmentBytes size of the active segment that triggers rotation
 * @param retentionHours age in hours after which a segment without pending operations is reclaimed
 * @param compress whether entry frames are deflate-compressed
 * @param checkpointEvery number of flushed entries between catalog checkpoints, 0 disables checkpointing
 * @param checkpointsToKeep number of checkpoint files retained
 */
public record WalConfig(
    int bufferThreshold,
    long flushIntervalMillis,
    long maxSegmentBytes,
    int retentionHours,
    boolean compress,
    int checkpointEvery,
    int checkpointsToKeep
) {

    public WalConfig {
        if (bufferThreshold <= 0) {
            throw new IllegalArgumentException("bufferThreshold must be positive");
        }
        if (flushIntervalMillis <= 0) {
            throw new IllegalArgumentException("flushIntervalMillis must be positive");
        }
        if (maxSegmentBytes <= 0) {
            throw new IllegalArgumentException("maxSegmentBytes must be positive");
        }
        if (retentionHours <= 0) {
            throw new IllegalArgumentException("retentionHours must be positive");
        }
        if (checkpointEvery < 0) {
            throw new IllegalArgumentException("checkpointEvery must not be negative");
        }
        if (checkpointsToKeep <= 0) {
            throw new IllegalArgumentException("checkpointsToKeep must be positive");
        }
    }

    /**
     * Creates a default configuration with:
     * - flush at 50 buffered entries or every 500 ms
     * - 5MB segments kept for 24 hours
     * - no compression
     * - a checkpoint every 1000 entries, 3 checkpoints kept
     *
     * @return a default configuration
     */
    public static WalConfig getDefault() {
        return new WalConfig(50, 500, 5L * 1024 * 1024, 24, false, 1000, 3);
    }

    public WalConfig withBufferThreshold(int bufferThreshold) {
        return new WalConfig(bufferThreshold, flushIntervalMillis, maxSegmentBytes, retentionHours,
            compress, checkpointEvery, checkpointsToKeep);
    }

    public WalConfig withMaxSegmentBytes(long maxSegmentBytes) {
        return new WalConfig(bufferThreshold, flushIntervalMillis, maxSegmentBytes, retentionHours,
            compress, checkpointEvery, checkpointsToKeep);
    }

    public WalConfig withRetentionHours(int retentionHours) {
        return new WalConfig(bufferThreshold, flushIntervalMillis, maxSegmentBytes, retentionHours,
            compress, checkpointEvery, checkpointsToKeep);
    }

    public WalConfig withCompress(boolean compress) {
        return new WalConfig(bufferThreshold, flushIntervalMillis, maxSegmentBytes, retentionHours,
            compress, checkpointEvery, checkpointsToKeep);
    }

    public WalConfig withCheckpointEvery(int checkpointEvery) {
        return new WalConfig(bufferThreshold, flushIntervalMillis, maxSegmentBytes, retentionHours,
            compress, checkpointEvery, checkpointsToKeep);
    }
}
