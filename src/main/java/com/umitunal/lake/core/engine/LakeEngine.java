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

package com.umitunal.lake.core.engine;

import com.umitunal.lake.api.AggregateResult;
import com.umitunal.lake.api.CancellationToken;
import com.umitunal.lake.api.LakeStorage;
import com.umitunal.lake.api.MigrationResult;
import com.umitunal.lake.api.QueryCancelledException;
import com.umitunal.lake.api.RecordBatch;
import com.umitunal.lake.api.RecordBatchIterator;
import com.umitunal.lake.api.SearchResult;
import com.umitunal.lake.api.WriteResult;
import com.umitunal.lake.catalog.CatalogStats;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.columnfile.ColumnFileData;
import com.umitunal.lake.config.EngineConfig;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.backgroundservice.AutoScalingService;
import com.umitunal.lake.core.backgroundservice.BackgroundService;
import com.umitunal.lake.core.backgroundservice.CompactionSchedulerService;
import com.umitunal.lake.core.backgroundservice.MaintenanceService;
import com.umitunal.lake.core.backgroundservice.StatisticsRefreshService;
import com.umitunal.lake.core.backgroundservice.WalFlushService;
import com.umitunal.lake.core.compaction.CompactionManager;
import com.umitunal.lake.core.compaction.CompactionStatus;
import com.umitunal.lake.core.compaction.SmallFileCompactionStrategy;
import com.umitunal.lake.core.migration.TierMigrator;
import com.umitunal.lake.core.scaling.AutoScaler;
import com.umitunal.lake.core.scaling.JmxSystemMetricsProvider;
import com.umitunal.lake.core.scaling.ScalingAction;
import com.umitunal.lake.core.scaling.ScalingStatus;
import com.umitunal.lake.core.scaling.SystemMetricsProvider;
import com.umitunal.lake.core.source.DataSource;
import com.umitunal.lake.core.source.SourceStatistics;
import com.umitunal.lake.index.IndexStatus;
import com.umitunal.lake.optimizer.CostModel;
import com.umitunal.lake.optimizer.CostModelRegistry;
import com.umitunal.lake.optimizer.ExecutionPlan;
import com.umitunal.lake.optimizer.OptimizerStatistics;
import com.umitunal.lake.optimizer.QueryOptimizer;
import com.umitunal.lake.optimizer.StatisticsCollector;
import com.umitunal.lake.query.Aggregation;
import com.umitunal.lake.query.AggregationAccumulator;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.wal.ReplayResult;
import com.umitunal.lake.wal.WalStatus;
import com.umitunal.lake.wal.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * File-based data lake engine.
 *
 * <p>Rows are written through a write-ahead log into partitioned column files which are cataloged
 * and indexed per column. Searches and aggregations fan out over sources on a query pool whose size
 * the auto-scaler adjusts. Background services flush the log, schedule compaction, reclaim old log
 * segments and backups, run the auto-scaler and refresh optimizer statistics.</p>
 *
 * <p>On startup the catalog is loaded, or restored from the latest checkpoint when it is missing,
 * and completed log operations are replayed on top of it. Operations left pending by a crash are
 * marked failed.</p>
 */
public class LakeEngine implements LakeStorage {
    private static final Logger logger = LoggerFactory.getLogger(LakeEngine.class);

    private static final long MAINTENANCE_INTERVAL_MINUTES = 60;

    private final EngineContext context;
    private final Map<String, DataSource> sources = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor queryPool;
    private final AutoScaler autoScaler;
    private final CompactionManager compactionManager;
    private final TierMigrator tierMigrator;
    private final StatisticsCollector statisticsCollector;
    private final QueryOptimizer optimizer;
    private final List<BackgroundService> services = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile MaintenanceService maintenanceService;

    /**
     * Opens the engine with the system clock and JMX metrics, and starts the background services.
     */
    public LakeEngine(EngineConfig config) throws IOException {
        this(config, Clock.systemUTC(), new JmxSystemMetricsProvider(), true);
    }

    /**
     * @param startServices whether to schedule the background services; they can always be run
     *                      on demand through {@link #runMaintenanceNow()}
     */
    public LakeEngine(EngineConfig config, Clock clock, SystemMetricsProvider metricsProvider, boolean startServices)
        throws IOException {
        boolean catalogExisted = Files.exists(new StorageLayout(Path.of(config.dataDirectory())).catalogFile());
        this.context = EngineContext.open(config, clock);
        try {
            recover(catalogExisted);
        } catch (IOException | RuntimeException e) {
            context.wal().close();
            throw e;
        }
        context.wal().setCheckpointSource(context.catalog()::snapshot);

        this.autoScaler = new AutoScaler(config.scaling(), config.scaling().minWorkers(), metricsProvider, clock);
        int workers = autoScaler.currentWorkers();
        AtomicInteger threadCount = new AtomicInteger();
        this.queryPool = new ThreadPoolExecutor(workers, workers, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
            r -> {
                Thread thread = new Thread(r, "LakeEngine-Query-" + threadCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        autoScaler.addListener(this::resizeQueryPool);

        this.statisticsCollector = new StatisticsCollector(context.catalog(), context.columnFileIO(), context.layout(),
            config.optimizer(), clock);
        autoScaler.addMemoryPressureListener(statisticsCollector);
        this.optimizer = new QueryOptimizer(statisticsCollector, context.indexManager(),
            new CostModelRegistry(CostModel.getDefault()), config.optimizer(),
            sourceId -> sourceConfig(sourceId).partitionColumns(), clock);

        this.compactionManager = new CompactionManager(context, config.compaction(),
            new SmallFileCompactionStrategy(config.compaction()), this::sourceConfig, this::backupsWritten);
        this.tierMigrator = new TierMigrator(context);

        this.maintenanceService = new MaintenanceService(context.wal(), compactionManager, MAINTENANCE_INTERVAL_MINUTES);
        services.add(new WalFlushService(context.wal(), config.wal()));
        services.add(new CompactionSchedulerService(compactionManager, config.compaction()));
        services.add(maintenanceService);
        services.add(new AutoScalingService(autoScaler, config.scaling()));
        services.add(new StatisticsRefreshService(statisticsCollector, config.optimizer().statisticsRefreshMinutes()));
        if (startServices) {
            services.forEach(BackgroundService::start);
        }
        logger.info("LakeEngine initialized with data directory: " + config.dataDirectory());
    }

    //--------------------------------------------------------------------------
    // Recovery
    //--------------------------------------------------------------------------

    private void recover(boolean catalogExisted) throws IOException {
        String startSegment = null;
        Optional<Checkpoint> checkpoint = context.wal().latestCheckpoint();
        if (checkpoint.isPresent()) {
            if (!catalogExisted) {
                logger.warn("Catalog file missing, restoring " + checkpoint.get().files().size()
                    + " entries from checkpoint of segment " + checkpoint.get().segment());
                context.catalog().restore(checkpoint.get().files());
            }
            startSegment = checkpoint.get().segment();
        }

        RecoveryHandler handler = new RecoveryHandler(context);
        ReplayResult result = context.wal().replayFrom(startSegment, handler);
        int failed = context.wal().failPendingOperations("replayed during recovery");
        logger.info("Recovery replayed " + result.entriesApplied() + " log entries from " + result.segmentsRead()
            + " segments (" + result.entriesSkipped() + " undecodable, " + result.handlerErrors()
            + " not applied), marked " + failed + " interrupted operations failed");

        reindexMissing();
    }

    private void reindexMissing() {
        for (FileMetadata entry : context.catalog().snapshot()) {
            if (context.indexManager().isIndexed(entry.path())) {
                continue;
            }
            Path file = context.layout().resolve(entry.path(), entry.tier());
            if (!Files.exists(file)) {
                continue;
            }
            try {
                ColumnFileData data = context.columnFileIO().read(file);
                context.indexManager().update(entry.path(), data.rows(), sourceConfig(entry.sourceId()).indexColumns());
                logger.info("Rebuilt index entries of " + entry.path());
            } catch (IOException e) {
                logger.warn("Failed to rebuild index entries of " + entry.path() + ": " + e.getMessage());
            }
        }
    }

    //--------------------------------------------------------------------------
    // Sources and writes
    //--------------------------------------------------------------------------

    @Override
    public void registerSource(SourceConfig config) {
        sources.put(config.sourceId(), new DataSource(config, context));
        statisticsCollector.invalidate(config.sourceId());
        logger.info("Registered source " + config.sourceId());
    }

    private DataSource source(String sourceId) {
        return sources.computeIfAbsent(sourceId, id -> new DataSource(SourceConfig.of(id), context));
    }

    /**
     * Looks up a source for reading without registering it.
     */
    private DataSource existingSource(String sourceId) {
        DataSource source = sources.get(sourceId);
        return source != null ? source : new DataSource(SourceConfig.of(sourceId), context);
    }

    private SourceConfig sourceConfig(String sourceId) {
        DataSource source = sources.get(sourceId);
        return source != null ? source.getConfig() : SourceConfig.of(sourceId);
    }

    @Override
    public WriteResult write(String dataset, String tenant, List<Map<String, Object>> rows) throws IOException {
        ensureOpen();
        WriteResult result = source(dataset).write(tenant, rows);
        statisticsCollector.invalidate(dataset);
        return result;
    }

    @Override
    public int deleteFiles(String prefix) throws IOException {
        ensureOpen();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        String sourceId = StorageLayout.sourceOf(prefix);
        int deleted = existingSource(sourceId).deleteFiles(prefix);
        statisticsCollector.invalidate(sourceId);
        return deleted;
    }

    //--------------------------------------------------------------------------
    // Queries
    //--------------------------------------------------------------------------

    @Override
    public SearchResult search(List<String> sourceIds, QueryFilter filter, Integer limit, int offset,
                               CancellationToken token) {
        ensureOpen();
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        QueryFilter effective = filter == null ? QueryFilter.all() : filter;
        Integer perSourceLimit = limit == null ? null : (int) Math.min(Integer.MAX_VALUE, (long) limit + offset);
        Map<String, List<RecordBatch>> perSource = new LinkedHashMap<>();
        Map<String, String> errors = fanOut(resolveSources(sourceIds), sourceId -> {
            List<RecordBatch> batches = new ArrayList<>();
            try (RecordBatchIterator iterator = existingSource(sourceId).search(effective, perSourceLimit, 0, token)) {
                while (iterator.hasNext()) {
                    batches.add(iterator.next());
                }
            }
            return batches;
        }, perSource);

        List<RecordBatch> combined = new ArrayList<>();
        perSource.values().forEach(combined::addAll);
        return new SearchResult(window(combined, limit, offset), errors);
    }

    private static List<RecordBatch> window(List<RecordBatch> batches, Integer limit, int offset) {
        List<RecordBatch> result = new ArrayList<>();
        long toSkip = offset;
        long remaining = limit == null ? Long.MAX_VALUE : limit;
        for (RecordBatch batch : batches) {
            if (remaining <= 0) {
                break;
            }
            List<Map<String, Object>> rows = batch.rows();
            int from = (int) Math.min(toSkip, rows.size());
            toSkip -= from;
            int to = (int) Math.min(rows.size(), from + remaining);
            if (to > from) {
                result.add(new RecordBatch(batch.sourceId(), batch.filePath(), rows.subList(from, to)));
                remaining -= to - from;
            }
        }
        return result;
    }

    @Override
    public RecordBatchIterator searchLazily(String sourceId, QueryFilter filter, Integer limit, int offset,
                                            CancellationToken token) {
        ensureOpen();
        return existingSource(sourceId).search(filter == null ? QueryFilter.all() : filter, limit, offset, token);
    }

    @Override
    public AggregateResult aggregate(List<String> sourceIds, QueryFilter filter, List<Aggregation> aggregations,
                                     CancellationToken token) {
        ensureOpen();
        if (aggregations == null || aggregations.isEmpty()) {
            throw new IllegalArgumentException("aggregations must not be empty");
        }
        QueryFilter effective = filter == null ? QueryFilter.all() : filter;
        Map<String, AggregationAccumulator> perSource = new LinkedHashMap<>();
        Map<String, String> errors = fanOut(resolveSources(sourceIds),
            sourceId -> existingSource(sourceId).aggregate(effective, aggregations, token), perSource);

        AggregationAccumulator merged = new AggregationAccumulator(aggregations);
        perSource.values().forEach(merged::merge);
        return new AggregateResult(merged.results(), errors);
    }

    private List<String> resolveSources(List<String> sourceIds) {
        if (sourceIds != null && !sourceIds.isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(sourceIds));
        }
        Set<String> all = new LinkedHashSet<>(context.catalog().sources());
        all.addAll(sources.keySet());
        return new ArrayList<>(all);
    }

    @FunctionalInterface
    private interface SourceTask<T> {
        T run(String sourceId) throws Exception;
    }

    /**
     * Runs one task per source on the query pool and gathers every outcome. A failing source is
     * reported in the returned error map without affecting the others; a cancellation is rethrown
     * once every task has finished.
     */
    private <T> Map<String, String> fanOut(List<String> sourceIds, SourceTask<T> task, Map<String, T> results) {
        Map<String, Future<T>> futures = new LinkedHashMap<>();
        for (String sourceId : sourceIds) {
            String queryId = UUID.randomUUID().toString();
            autoScaler.enqueue(queryId);
            Callable<T> tracked = () -> {
                autoScaler.dequeue(queryId);
                autoScaler.registerQueryStart(queryId);
                try {
                    return task.run(sourceId);
                } finally {
                    autoScaler.registerQueryComplete(queryId);
                }
            };
            futures.put(sourceId, queryPool.submit(tracked));
        }

        Map<String, String> errors = new LinkedHashMap<>();
        QueryCancelledException cancelled = null;
        for (Map.Entry<String, Future<T>> future : futures.entrySet()) {
            try {
                results.put(future.getKey(), future.getValue().get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof QueryCancelledException queryCancelled) {
                    cancelled = queryCancelled;
                    continue;
                }
                logger.error("Query on source " + future.getKey() + " failed", cause);
                errors.put(future.getKey(), cause.getMessage() == null ? cause.getClass().getSimpleName()
                    : cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new QueryCancelledException("interrupted while waiting for sources");
            }
        }
        if (cancelled != null) {
            throw cancelled;
        }
        return errors;
    }

    private void resizeQueryPool(int previous, int current, ScalingAction action) {
        if (current > queryPool.getMaximumPoolSize()) {
            queryPool.setMaximumPoolSize(current);
            queryPool.setCorePoolSize(current);
        } else {
            queryPool.setCorePoolSize(current);
            queryPool.setMaximumPoolSize(current);
        }
        logger.info("Query pool resized from " + previous + " to " + current + " workers after " + action);
    }

    //--------------------------------------------------------------------------
    // Optimizer
    //--------------------------------------------------------------------------

    @Override
    public ExecutionPlan optimize(QueryFilter filter, List<Aggregation> aggregations, List<String> sourceIds,
                                  Integer limit) {
        return optimizer.optimize(filter == null ? QueryFilter.all() : filter,
            aggregations == null ? List.of() : aggregations, resolveSources(sourceIds), limit);
    }

    @Override
    public void recordExecution(ExecutionPlan plan, double actualTimeMillis, long actualRows, boolean success) {
        optimizer.recordExecution(plan, actualTimeMillis, actualRows, success);
    }

    //--------------------------------------------------------------------------
    // Maintenance
    //--------------------------------------------------------------------------

    @Override
    public boolean compact(String sourceId) {
        ensureOpen();
        boolean result = compactionManager.compact(sourceId);
        statisticsCollector.invalidate(sourceId);
        return result;
    }

    @Override
    public MigrationResult migrateCold(int cutoffDays) throws IOException {
        ensureOpen();
        return tierMigrator.migrateCold(cutoffDays);
    }

    private void backupsWritten() {
        MaintenanceService service = maintenanceService;
        if (service != null) {
            service.triggerAsync();
        }
    }

    /**
     * Runs every background task once on the calling thread.
     */
    public void runMaintenanceNow() {
        services.forEach(BackgroundService::executeNow);
    }

    public AutoScaler getAutoScaler() {
        return autoScaler;
    }

    public CompactionManager getCompactionManager() {
        return compactionManager;
    }

    public EngineContext getContext() {
        return context;
    }

    int queryPoolSize() {
        return queryPool.getCorePoolSize();
    }

    //--------------------------------------------------------------------------
    // Status
    //--------------------------------------------------------------------------

    @Override
    public SourceStatistics sourceStatistics(String sourceId) {
        return existingSource(sourceId).statistics();
    }

    @Override
    public WalStatus walStatus() {
        return context.wal().status();
    }

    @Override
    public IndexStatus indexStatus() {
        return context.indexManager().status();
    }

    @Override
    public CompactionStatus compactionStatus() {
        return compactionManager.status();
    }

    @Override
    public ScalingStatus scalingStatus() {
        return autoScaler.status();
    }

    @Override
    public OptimizerStatistics optimizerStatistics() {
        return optimizer.statistics();
    }

    @Override
    public CatalogStats catalogStats() {
        return context.catalog().stats();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("LakeEngine is closed");
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing LakeEngine");
        for (BackgroundService service : services) {
            service.shutdown();
        }
        compactionManager.close();
        queryPool.shutdown();
        try {
            if (!queryPool.awaitTermination(5, TimeUnit.SECONDS)) {
                queryPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            queryPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        context.wal().close();
        logger.info("LakeEngine closed");
    }
}
