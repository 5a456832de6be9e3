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

package com.umitunal.lake.core.source;

import com.umitunal.lake.api.CancellationToken;
import com.umitunal.lake.api.RecordBatchIterator;
import com.umitunal.lake.api.WriteResult;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.columnfile.ColumnFileData;
import com.umitunal.lake.columnfile.ColumnFileInfo;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.engine.EngineContext;
import com.umitunal.lake.query.Aggregation;
import com.umitunal.lake.query.AggregationAccumulator;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.wal.record.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write and read orchestration for one dataset.
 *
 * <p>A write is logged and made durable before any file is touched, then fans the batch out into
 * one column file per partition, registers the files in the catalog, indexes them and finally
 * marks the log entry completed with the written keys. Searches and aggregations go through
 * catalog candidates, index pruning and a file-by-file scan.</p>
 */
public class DataSource {
    private static final Logger logger = LoggerFactory.getLogger(DataSource.class);

    private final SourceConfig config;
    private final EngineContext context;

    public DataSource(SourceConfig config, EngineContext context) {
        this.config = config;
        this.context = context;
    }

    public String getSourceId() {
        return config.sourceId();
    }

    public SourceConfig getConfig() {
        return config;
    }

    /**
     * Writes a batch of rows for a tenant.
     *
     * @return the operation id and the keys of the written files
     * @throws IllegalArgumentException if the tenant is invalid or the batch is empty
     * @throws com.umitunal.lake.wal.WalFlushException if the log entry could not be made durable
     * @throws WriteFailedException if the write failed after it was logged
     */
    public WriteResult write(String tenant, List<Map<String, Object>> rows) throws IOException {
        validateTenant(tenant);
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("rows must not be empty");
        }
        for (Map<String, Object> row : rows) {
            if (row == null) {
                throw new IllegalArgumentException("rows must not contain null");
            }
        }

        String operationId = context.wal().newOperationId();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", config.sourceId());
        payload.put("tenant", tenant);
        payload.put("rows", rows.size());
        context.wal().begin(operationId, OperationKind.WRITE, payload);
        context.wal().flush();

        try {
            List<String> written = writeFiles(tenant, rows);
            Map<String, Object> completion = new LinkedHashMap<>(payload);
            completion.put("files", written);
            context.wal().markCompleted(operationId, OperationKind.WRITE, completion);
            logger.info("Wrote " + rows.size() + " rows for " + config.sourceId() + "/" + tenant
                + " into " + written.size() + " files");
            return new WriteResult(operationId, written, rows.size());
        } catch (IOException | RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            logger.error("Write " + operationId + " for " + config.sourceId() + " failed", e);
            WriteFailedException failure = new WriteFailedException(operationId, message, e);
            try {
                context.wal().markFailed(operationId, OperationKind.WRITE, message);
            } catch (IOException markError) {
                failure.addSuppressed(markError);
            }
            throw failure;
        }
    }

    private List<String> writeFiles(String tenant, List<Map<String, Object>> rows) throws IOException {
        long writeId = context.nextWriteId();
        long createdAt = context.clock().millis();

        Map<List<String>, List<Map<String, Object>>> partitions = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<String> segments = new ArrayList<>(config.partitionColumns().size());
            for (String column : config.partitionColumns()) {
                segments.add(StorageLayout.partitionSegment(column, row.get(column)));
            }
            partitions.computeIfAbsent(segments, k -> new ArrayList<>()).add(row);
        }

        List<FileMetadata> entries = new ArrayList<>(partitions.size());
        List<List<Map<String, Object>>> partitionRows = new ArrayList<>(partitions.size());
        int part = 0;
        for (Map.Entry<List<String>, List<Map<String, Object>>> partition : partitions.entrySet()) {
            String fileName = String.format("%d_%d_%03d%s", createdAt, writeId, part++, StorageLayout.DATA_FILE_SUFFIX);
            String key = StorageLayout.dataFileKey(config.sourceId(), tenant, partition.getKey(), fileName);
            ColumnFileInfo info = context.columnFileIO().write(
                context.layout().resolve(key, Tier.HOT), partition.getValue(), writeId, createdAt, config.compress());
            entries.add(context.extractor().toMetadata(key, Tier.HOT, info));
            partitionRows.add(partition.getValue());
        }

        context.catalog().registerAll(entries);
        for (int i = 0; i < entries.size(); i++) {
            context.indexManager().update(entries.get(i).path(), partitionRows.get(i), config.indexColumns());
        }
        return entries.stream().map(FileMetadata::path).toList();
    }

    /**
     * Returns a lazy iterator over the rows matching the filter, newest files first.
     * Files are only read as batches are consumed.
     *
     * @param limit maximum rows to return, or null for no limit
     * @param offset matching rows to skip before the first returned row
     */
    public RecordBatchIterator search(QueryFilter filter, Integer limit, int offset, CancellationToken token) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        List<FileMetadata> files = candidates(filter);
        return new FileScanIterator(config.sourceId(), files, filter, limit, offset,
            token == null ? CancellationToken.none() : token, context.layout(), context.columnFileIO());
    }

    /**
     * Folds every matching row of every candidate file into a fresh accumulator.
     */
    public AggregationAccumulator aggregate(QueryFilter filter, List<Aggregation> aggregations, CancellationToken token) {
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        AggregationAccumulator accumulator = new AggregationAccumulator(aggregations);
        for (FileMetadata file : candidates(filter)) {
            cancellation.throwIfCancelled();
            ColumnFileData data;
            try {
                data = context.columnFileIO().read(context.layout().resolve(file.path(), file.tier()));
            } catch (IOException e) {
                logger.warn("Skipping unreadable file " + file.path() + ": " + e.getMessage());
                continue;
            }
            for (Map<String, Object> row : data.rows()) {
                if (filter.matches(row)) {
                    accumulator.accept(row);
                }
            }
        }
        return accumulator;
    }

    /**
     * @return files that may hold matching rows, newest first
     */
    public List<FileMetadata> candidates(QueryFilter filter) {
        List<FileMetadata> files = context.catalog().filesForQuery(config.sourceId(), filter.requiredColumns());
        return context.indexManager().prune(files, filter);
    }

    /**
     * Deletes every file of this source under a logical prefix, together with its catalog and index entries.
     *
     * @param prefix the source id, or a path below it such as {@code source/tenant}
     * @return number of files removed
     */
    public int deleteFiles(String prefix) throws IOException {
        if (prefix == null || !(prefix.equals(config.sourceId()) || prefix.startsWith(config.sourceId() + "/"))) {
            throw new IllegalArgumentException("prefix must lie under source " + config.sourceId() + ": " + prefix);
        }
        String operationId = context.wal().newOperationId();
        context.wal().begin(operationId, OperationKind.DELETE, Map.of("prefix", prefix));
        context.wal().flush();

        try {
            List<FileMetadata> entries = context.catalog().list(prefix);
            List<String> keys = new ArrayList<>(entries.size());
            for (FileMetadata entry : entries) {
                Path file = context.layout().resolve(entry.path(), entry.tier());
                if (!Files.deleteIfExists(file)) {
                    logger.warn("File already missing while deleting " + entry.path());
                }
                keys.add(entry.path());
            }
            context.catalog().removeAll(keys);
            context.indexManager().remove(keys);
            context.wal().markCompleted(operationId, OperationKind.DELETE, Map.of("prefix", prefix, "files", keys));
            logger.info("Deleted " + keys.size() + " files under " + prefix);
            return keys.size();
        } catch (IOException | RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            WriteFailedException failure = new WriteFailedException(operationId, message, e);
            try {
                context.wal().markFailed(operationId, OperationKind.DELETE, message);
            } catch (IOException markError) {
                failure.addSuppressed(markError);
            }
            throw failure;
        }
    }

    public SourceStatistics statistics() {
        int files = 0;
        int hot = 0;
        int cold = 0;
        long bytes = 0;
        long rows = 0;
        long lastWrite = 0;
        for (FileMetadata entry : context.catalog().list(config.sourceId())) {
            files++;
            bytes += entry.sizeBytes();
            rows += entry.rowCount();
            if (entry.tier() == Tier.COLD) {
                cold++;
            } else {
                hot++;
            }
            lastWrite = Math.max(lastWrite, entry.createdAt());
        }
        return new SourceStatistics(config.sourceId(), files, bytes, rows, hot, cold, lastWrite);
    }

    private static void validateTenant(String tenant) {
        if (tenant == null || tenant.isBlank()) {
            throw new IllegalArgumentException("tenant must not be blank");
        }
        if (tenant.contains("/") || tenant.contains("\\") || tenant.equals(".") || tenant.equals("..")) {
            throw new IllegalArgumentException("tenant must not contain path separators: " + tenant);
        }
    }
}
