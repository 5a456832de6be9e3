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
import com.umitunal.lake.catalog.FileMetadataExtractor;
import com.umitunal.lake.columnfile.ColumnFileInfo;
import com.umitunal.lake.config.CompactionPolicy;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.engine.EngineContext;
import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.storage.Tier;
import com.umitunal.lake.wal.record.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Merges small hot files of a source into larger ones.
 *
 * <p>Each job is guarded by a COMPACT log entry. It reads its inputs, writes one output file in the
 * inputs' directory, swaps the catalog and index entries, and moves the inputs into the dated backup
 * area. At most {@code maxConcurrentCompactions} jobs run at once; batches that find no free slot
 * wait for the next pass. A failed job is recorded and does not affect its siblings.</p>
 */
public class CompactionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CompactionManager.class);

    private static final int HISTORY_LIMIT = 100;

    private final EngineContext context;
    private final CompactionPolicy policy;
    private final CompactionStrategy strategy;
    private final Function<String, SourceConfig> sourceConfigs;
    private final Runnable backupsWritten;
    private final BackupArea backupArea;

    private final ExecutorService jobExecutor;
    private final Semaphore slots;
    private final Map<String, CompactionJob> activeJobs = new ConcurrentHashMap<>();
    private final Set<String> claimedFiles = ConcurrentHashMap.newKeySet();
    private final Deque<CompactionJob> completedJobs = new ArrayDeque<>();
    private final Deque<CompactionJob> failedJobs = new ArrayDeque<>();
    private final AtomicLong totalCompactions = new AtomicLong();
    private final AtomicLong totalFilesReduced = new AtomicLong();
    private final AtomicLong totalBytesReduced = new AtomicLong();

    /**
     * @param sourceConfigs returns the configuration of a source; unregistered sources get defaults
     * @param backupsWritten invoked after a pass moved inputs into the backup area
     */
    public CompactionManager(EngineContext context, CompactionPolicy policy, CompactionStrategy strategy,
                             Function<String, SourceConfig> sourceConfigs, Runnable backupsWritten) {
        this.context = context;
        this.policy = policy;
        this.strategy = strategy;
        this.sourceConfigs = sourceConfigs;
        this.backupsWritten = backupsWritten;
        this.backupArea = new BackupArea(context.layout(), context.clock());
        this.slots = new Semaphore(policy.maxConcurrentCompactions());
        AtomicInteger threadCount = new AtomicInteger();
        this.jobExecutor = Executors.newFixedThreadPool(policy.maxConcurrentCompactions(), r -> {
            Thread thread = new Thread(r, "LakeEngine-Compaction-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * One scheduler pass: every source inside the maintenance window, only urgent sources outside it.
     */
    public void runScheduledPass() {
        int hour = ZonedDateTime.now(context.clock()).getHour();
        boolean maintenance = policy.inMaintenanceWindow(hour);
        logger.info("Starting compaction pass (" + (maintenance ? "maintenance window" : "urgent only") + ")");
        for (String sourceId : context.catalog().sources()) {
            try {
                FileAnalysis analysis = strategy.analyze(hotFiles(sourceId), context.clock().millis());
                if (maintenance ? strategy.shouldCompact(analysis) : strategy.isUrgent(analysis)) {
                    runJobs(sourceId, analysis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Compaction pass interrupted");
                return;
            } catch (RuntimeException e) {
                logger.error("Compaction pass failed for source " + sourceId, e);
            }
        }
        logger.info("Compaction pass completed");
    }

    /**
     * Compacts one source now if its files cross a threshold.
     *
     * @return false if the source is unknown or the pass failed
     */
    public boolean compact(String sourceId) {
        if (!context.catalog().sources().contains(sourceId)) {
            logger.error("Compaction requested for unknown source: " + sourceId);
            return false;
        }
        try {
            logger.info("Manual compaction triggered for source: " + sourceId);
            FileAnalysis analysis = strategy.analyze(hotFiles(sourceId), context.clock().millis());
            if (strategy.shouldCompact(analysis)) {
                runJobs(sourceId, analysis);
            } else {
                logger.info("Source " + sourceId + " does not need compaction");
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            logger.error("Manual compaction failed for " + sourceId, e);
            return false;
        }
    }

    private List<FileMetadata> hotFiles(String sourceId) {
        List<FileMetadata> files = new ArrayList<>();
        for (FileMetadata entry : context.catalog().list(sourceId)) {
            if (entry.tier() == Tier.HOT && !claimedFiles.contains(entry.path())
                && Files.exists(context.layout().resolve(entry.path(), Tier.HOT))) {
                files.add(entry);
            }
        }
        return files;
    }

    private void runJobs(String sourceId, FileAnalysis analysis) throws InterruptedException {
        SourceConfig sourceConfig = sourceConfigs.apply(sourceId);
        List<Future<Boolean>> submitted = new ArrayList<>();
        for (List<FileMetadata> batch : strategy.selectBatches(analysis)) {
            if (!slots.tryAcquire()) {
                logger.info("Compaction slots exhausted, deferring remaining batches of " + sourceId);
                break;
            }
            if (!claim(batch)) {
                slots.release();
                continue;
            }
            try {
                submitted.add(jobExecutor.submit(() -> {
                    try {
                        return runJob(sourceId, sourceConfig, batch);
                    } finally {
                        release(batch);
                        slots.release();
                    }
                }));
            } catch (RuntimeException e) {
                release(batch);
                slots.release();
                throw e;
            }
        }

        boolean movedInputs = false;
        for (Future<Boolean> future : submitted) {
            try {
                movedInputs |= future.get();
            } catch (ExecutionException e) {
                logger.error("Compaction job of " + sourceId + " terminated unexpectedly", e.getCause());
            }
        }
        if (movedInputs) {
            backupsWritten.run();
        }
    }

    private boolean claim(List<FileMetadata> batch) {
        List<String> claimed = new ArrayList<>(batch.size());
        for (FileMetadata file : batch) {
            if (!claimedFiles.add(file.path())) {
                claimedFiles.removeAll(claimed);
                return false;
            }
            claimed.add(file.path());
        }
        return true;
    }

    private void release(List<FileMetadata> batch) {
        for (FileMetadata file : batch) {
            claimedFiles.remove(file.path());
        }
    }

    /**
     * @return true if the job completed and moved its inputs into the backup area
     */
    private boolean runJob(String sourceId, SourceConfig sourceConfig, List<FileMetadata> batch) {
        List<FileMetadata> inputs = new ArrayList<>(batch);
        inputs.sort(Comparator.comparingLong(FileMetadata::createdAt)
            .thenComparingLong(FileMetadata::writeId)
            .thenComparing(FileMetadata::path));
        List<String> inputKeys = inputs.stream().map(FileMetadata::path).toList();
        long inputBytes = inputs.stream().mapToLong(FileMetadata::sizeBytes).sum();
        List<String> partitionColumns = new ArrayList<>(FileMetadataExtractor.partitionsOf(inputKeys.get(0)).keySet());

        CompactionJob job = CompactionJob.pending(UUID.randomUUID().toString(), sourceId, inputKeys,
            context.clock().millis(), inputBytes, partitionColumns).running();
        activeJobs.put(job.jobId(), job);
        logger.info("Starting compaction job " + job.jobId() + " for " + inputs.size() + " files (estimated "
            + inputBytes + " bytes)");

        String operationId = context.wal().newOperationId();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", sourceId);
        payload.put("inputs", inputKeys);
        try {
            context.wal().begin(operationId, OperationKind.COMPACT, payload);
            context.wal().flush();
        } catch (IOException e) {
            recordFailure(job, e);
            return false;
        }

        String outputKey = null;
        boolean swapped = false;
        try {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (FileMetadata input : inputs) {
                rows.addAll(context.columnFileIO().read(context.layout().resolve(input.path(), Tier.HOT)).rows());
            }

            long writeId = context.nextWriteId();
            long createdAt = context.clock().millis();
            String fileName = String.format("%d_%d_compacted%s", createdAt, writeId, StorageLayout.DATA_FILE_SUFFIX);
            String directory = StorageLayout.directoryOf(inputKeys.get(0));
            outputKey = directory.isEmpty() ? fileName : directory + "/" + fileName;
            ColumnFileInfo info = context.columnFileIO().write(context.layout().resolve(outputKey, Tier.HOT), rows,
                writeId, createdAt, sourceConfig.compress());
            FileMetadata output = context.extractor().toMetadata(outputKey, Tier.HOT, info);

            context.catalog().replaceFiles(inputKeys, output);
            swapped = true;
            context.indexManager().replace(inputKeys, outputKey, rows, sourceConfig.indexColumns());

            backupInputs(inputKeys);

            Map<String, Object> completion = new LinkedHashMap<>(payload);
            completion.put("output", outputKey);
            context.wal().markCompleted(operationId, OperationKind.COMPACT, completion);

            activeJobs.remove(job.jobId());
            remember(completedJobs, job.completed(outputKey));
            totalCompactions.incrementAndGet();
            totalFilesReduced.addAndGet(inputs.size() - 1L);
            totalBytesReduced.addAndGet(inputBytes - info.sizeBytes());
            logger.info("Compaction job " + job.jobId() + " completed: " + rows.size() + " rows into " + outputKey);
            return true;
        } catch (IOException | RuntimeException e) {
            if (!swapped && outputKey != null) {
                deleteOrphan(outputKey);
            }
            try {
                context.wal().markFailed(operationId, OperationKind.COMPACT, messageOf(e));
            } catch (IOException markError) {
                e.addSuppressed(markError);
            }
            recordFailure(job, e);
            return swapped;
        }
    }

    private void backupInputs(List<String> inputKeys) {
        for (String key : inputKeys) {
            try {
                backupArea.store(key, context.layout().resolve(key, Tier.HOT));
            } catch (IOException e) {
                logger.warn("Failed to move compacted input " + key + " to backup: " + e.getMessage());
            }
        }
    }

    private void deleteOrphan(String outputKey) {
        try {
            Files.deleteIfExists(context.layout().resolve(outputKey, Tier.HOT));
        } catch (IOException e) {
            logger.warn("Failed to delete unregistered compaction output " + outputKey + ": " + e.getMessage());
        }
    }

    private void recordFailure(CompactionJob job, Exception e) {
        logger.error("Compaction job " + job.jobId() + " failed", e);
        activeJobs.remove(job.jobId());
        remember(failedJobs, job.failed(messageOf(e)));
    }

    private static String messageOf(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static void remember(Deque<CompactionJob> history, CompactionJob job) {
        synchronized (history) {
            history.addLast(job);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
    }

    /**
     * Deletes dated backup folders older than the configured retention.
     *
     * @return number of folders deleted
     */
    public int purgeExpiredBackups() throws IOException {
        return backupArea.purgeExpired(policy.backupRetentionDays());
    }

    public List<CompactionJob> completedJobs() {
        synchronized (completedJobs) {
            return new ArrayList<>(completedJobs);
        }
    }

    public List<CompactionJob> failedJobs() {
        synchronized (failedJobs) {
            return new ArrayList<>(failedJobs);
        }
    }

    public CompactionStatus status() {
        List<CompactionJob> current = new ArrayList<>(activeJobs.values());
        return new CompactionStatus(current.size(), completedJobs().size(), failedJobs().size(),
            totalCompactions.get(), totalFilesReduced.get(), totalBytesReduced.get(), current);
    }

    public CompactionStrategy getStrategy() {
        return strategy;
    }

    public Path backupRoot() {
        return context.layout().backupRoot();
    }

    @Override
    public void close() {
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Compaction jobs did not finish in time, forcing shutdown");
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
