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

package com.umitunal.lake.core.compaction;

import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.config.CompactionPolicy;
import com.umitunal.lake.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A compaction strategy that merges small files of the same partition directory.
 *
 * <p>A source qualifies when its small files or its old files reach the small-file threshold,
 * or its file count reaches the total-file threshold. Small files are grouped by directory and
 * cut into batches bounded by the batch size and, softly, by the target file size.</p>
 */
public class SmallFileCompactionStrategy implements CompactionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SmallFileCompactionStrategy.class);

    private static final long HOUR_MILLIS = 3_600_000L;

    private final CompactionPolicy policy;

    public SmallFileCompactionStrategy(CompactionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public FileAnalysis analyze(List<FileMetadata> files, long now) {
        long ageCutoff = now - policy.ageThresholdHours() * HOUR_MILLIS;
        List<FileMetadata> small = new ArrayList<>();
        int large = 0;
        int old = 0;
        long totalBytes = 0;
        for (FileMetadata file : files) {
            totalBytes += file.sizeBytes();
            if (file.sizeBytes() < policy.minFileSizeBytes()) {
                small.add(file);
            } else if (file.sizeBytes() > policy.maxFileSizeBytes()) {
                large++;
            }
            if (file.createdAt() < ageCutoff) {
                old++;
            }
        }
        return new FileAnalysis(files.size(), small, large, old, totalBytes);
    }

    @Override
    public boolean shouldCompact(FileAnalysis analysis) {
        return analysis.smallFileCount() >= policy.smallFileThreshold()
            || analysis.totalFiles() >= policy.totalFileThreshold()
            || analysis.oldFileCount() >= policy.smallFileThreshold();
    }

    @Override
    public boolean isUrgent(FileAnalysis analysis) {
        return analysis.smallFileCount() > policy.smallFileThreshold() * 2
            || analysis.totalFiles() > policy.totalFileThreshold() * 2;
    }

    @Override
    public List<List<FileMetadata>> selectBatches(FileAnalysis analysis) {
        Map<String, List<FileMetadata>> byDirectory = new LinkedHashMap<>();
        for (FileMetadata file : analysis.smallFiles()) {
            byDirectory.computeIfAbsent(StorageLayout.directoryOf(file.path()), k -> new ArrayList<>()).add(file);
        }

        List<List<FileMetadata>> batches = new ArrayList<>();
        for (Map.Entry<String, List<FileMetadata>> directory : byDirectory.entrySet()) {
            List<FileMetadata> current = new ArrayList<>();
            long currentBytes = 0;
            for (FileMetadata file : directory.getValue()) {
                boolean full = current.size() >= policy.batchSize()
                    || (current.size() >= 2 && currentBytes + file.sizeBytes() > policy.targetFileSizeBytes());
                if (full) {
                    batches.add(current);
                    current = new ArrayList<>();
                    currentBytes = 0;
                }
                current.add(file);
                currentBytes += file.sizeBytes();
            }
            if (current.size() >= 2) {
                batches.add(current);
            } else if (!current.isEmpty()) {
                logger.debug("Leaving single small file in " + directory.getKey() + " for a later cycle");
            }
        }
        return batches;
    }

    @Override
    public String getName() {
        return "small-file";
    }
}
