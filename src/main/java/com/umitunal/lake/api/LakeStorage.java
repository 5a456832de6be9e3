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

package com.umitunal.lake.api;

import com.umitunal.lake.catalog.CatalogStats;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.compaction.CompactionStatus;
import com.umitunal.lake.core.scaling.ScalingStatus;
import com.umitunal.lake.core.source.SourceStatistics;
import com.umitunal.lake.index.IndexStatus;
import com.umitunal.lake.optimizer.ExecutionPlan;
import com.umitunal.lake.optimizer.OptimizerStatistics;
import com.umitunal.lake.query.Aggregation;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.wal.WalStatus;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Multi-tenant data lake storage.
 * Mutating operations are guarded by the write-ahead log; read operations degrade to partial results
 * rather than failing on a single bad file or source.
 */
public interface LakeStorage extends AutoCloseable {

    /**
     * Registers or replaces the configuration of a dataset. Datasets written without registration use defaults.
     */
    void registerSource(SourceConfig config);

    /**
     * Writes a batch of rows for a tenant of a dataset.
     *
     * @param dataset the dataset (source) id
     * @param tenant the tenant the rows belong to
     * @param rows the rows, column name to value
     * @return the guarding operation id and the written file keys
     * @throws com.umitunal.lake.wal.WalFlushException if the write could not be logged durably
     * @throws com.umitunal.lake.core.source.WriteFailedException if the write failed after it was logged
     */
    WriteResult write(String dataset, String tenant, List<Map<String, Object>> rows) throws IOException;

    /**
     * Searches one or more sources in parallel and gathers the matching rows.
     *
     * @param sourceIds sources to search; null or empty searches every known source
     * @param limit maximum rows across all sources, or null
     * @param offset matching rows to skip across all sources
     * @param token cancellation token, may be null
     * @throws QueryCancelledException if the token was cancelled during the scan
     */
    SearchResult search(List<String> sourceIds, QueryFilter filter, Integer limit, int offset, CancellationToken token);

    /**
     * Returns a lazy iterator over one source. Files are read only as batches are consumed.
     */
    RecordBatchIterator searchLazily(String sourceId, QueryFilter filter, Integer limit, int offset,
                                     CancellationToken token);

    /**
     * Computes aggregations over one or more sources in parallel.
     *
     * @param sourceIds sources to aggregate; null or empty covers every known source
     * @throws QueryCancelledException if the token was cancelled during the scan
     */
    AggregateResult aggregate(List<String> sourceIds, QueryFilter filter, List<Aggregation> aggregations,
                              CancellationToken token);

    /**
     * Chooses the cheapest execution plan for a query. Never fails; falls back to a default plan.
     */
    ExecutionPlan optimize(QueryFilter filter, List<Aggregation> aggregations, List<String> sourceIds, Integer limit);

    /**
     * Reports how a plan actually performed.
     */
    void recordExecution(ExecutionPlan plan, double actualTimeMillis, long actualRows, boolean success);

    /**
     * Compacts a source now if it crosses a threshold.
     *
     * @return false for unknown sources or when the pass failed
     */
    boolean compact(String sourceId);

    /**
     * Moves hot files older than the cutoff into the cold tier.
     */
    MigrationResult migrateCold(int cutoffDays) throws IOException;

    /**
     * Deletes every file under a logical prefix such as {@code dataset} or {@code dataset/tenant}.
     *
     * @return number of files deleted
     */
    int deleteFiles(String prefix) throws IOException;

    SourceStatistics sourceStatistics(String sourceId);

    WalStatus walStatus();

    IndexStatus indexStatus();

    CompactionStatus compactionStatus();

    ScalingStatus scalingStatus();

    OptimizerStatistics optimizerStatistics();

    CatalogStats catalogStats();

    /**
     * Stops background work, flushes the log and releases resources.
     */
    @Override
    void close() throws IOException;
}
