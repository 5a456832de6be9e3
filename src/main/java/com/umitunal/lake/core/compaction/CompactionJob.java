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
 * One merge of a batch of input files into a single output file.
 *
 * @param outputFile key of the output file, null until it is written
 * @param estimatedSizeBytes combined size of the inputs
 * @param partitionColumns partition columns detected from the input directory
 * @param error failure message, null unless the job failed
 */
public record CompactionJob(
    String jobId,
    String sourceId,
    List<String> inputFiles,
    String outputFile,
    long startedAt,
    long estimatedSizeBytes,
    List<String> partitionColumns,
    CompactionJobState state,
    String error
) {

    public CompactionJob {
        inputFiles = List.copyOf(inputFiles);
        partitionColumns = List.copyOf(partitionColumns);
    }

    public static CompactionJob pending(String jobId, String sourceId, List<String> inputFiles, long startedAt,
                                        long estimatedSizeBytes, List<String> partitionColumns) {
        return new CompactionJob(jobId, sourceId, inputFiles, null, startedAt, estimatedSizeBytes,
            partitionColumns, CompactionJobState.PENDING, null);
    }

    public CompactionJob running() {
        return withState(CompactionJobState.RUNNING, outputFile, null);
    }

    public CompactionJob completed(String output) {
        return withState(CompactionJobState.COMPLETED, output, null);
    }

    public CompactionJob failed(String message) {
        return withState(CompactionJobState.FAILED, outputFile, message);
    }

    private CompactionJob withState(CompactionJobState next, String output, String message) {
        return new CompactionJob(jobId, sourceId, inputFiles, output, startedAt, estimatedSizeBytes,
            partitionColumns, next, message);
    }
}
