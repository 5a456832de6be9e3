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

import java.util.List;

/**
 * Read-only snapshot of the compaction manager.
 *
 * @param totalFilesReduced inputs merged minus outputs written
 * @param totalBytesReduced input bytes minus output bytes
 * @param currentJobs jobs running when the snapshot was taken
 */
public record CompactionStatus(
    int activeJobs,
    int completedJobs,
    int failedJobs,
    long totalCompactions,
    long totalFilesReduced,
    long totalBytesReduced,
    List<CompactionJob> currentJobs
) {

    public CompactionStatus {
        currentJobs = List.copyOf(currentJobs);
    }
}
