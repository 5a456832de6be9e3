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

package com.umitunal.lake.wal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.config.WalConfig;
import com.umitunal.lake.wal.checkpoint.Checkpoint;
import com.umitunal.lake.wal.checkpoint.CheckpointManager;
import com.umitunal.lake.wal.manager.WALManager;
import com.umitunal.lake.wal.manager.WALManagerImpl;
import com.umitunal.lake.wal.reader.WALReader;
import com.umitunal.lake.wal.reader.WALReaderImpl;
import com.umitunal.lake.wal.record.OperationKind;
import com.umitunal.lake.wal.record.OperationStatus;
import com.umitunal.lake.wal.record.WalEntry;
import com.umitunal.lake.wal.record.WalEntryCodec;
import com.umitunal.lake.wal.writer.WALWriter;
import com.umitunal.lake.wal.writer.WALWriterImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Implementation of the WAL interface.
 * This class coordinates the WALManager, WALReader and WALWriter, buffers appended entries
 * and tracks which segments still hold pending operations.
 */
public class WALImpl implements WAL {
    private static final Logger logger = LoggerFactory.getLogger(WALImpl.class);

    private static final long MILLIS_PER_HOUR = 60L * 60 * 1000;

    private final WalConfig config;
    private final WALManager manager;
    private final WALReader reader;
    private final WALWriter writer;
    private final CheckpointManager checkpoints;
    private final Clock clock;

    private final Object lock = new Object();
    private final List<WalEntry> buffer = new ArrayList<>();
    private final List<CompletableFuture<Void>> bufferFutures = new ArrayList<>();

    // operation id -> segment holding its PENDING record
    private final Map<String, String> pendingSegments = new HashMap<>();

    private WalFlushException failure;
    private long flushedEntries;
    private long failedOperations;
    private long lastFlushAt;
    private long entriesSinceCheckpoint;
    private volatile Supplier<List<FileMetadata>> checkpointSource;

    /**
     * Creates a new WALImpl with segments in {@code directory} and checkpoints in {@code checkpointDirectory}.
     *
     * @throws IOException if an I/O error occurs
     */
    public WALImpl(Path directory, Path checkpointDirectory, WalConfig config, ObjectMapper objectMapper, Clock clock)
            throws IOException {
        this(config, new WALManagerImpl(directory, config.maxSegmentBytes(), clock),
            new WalEntryCodec(objectMapper, config.compress()),
            new CheckpointManager(checkpointDirectory, objectMapper, config.checkpointsToKeep()), clock);
    }

    private WALImpl(WalConfig config, WALManager manager, WalEntryCodec codec, CheckpointManager checkpoints,
                    Clock clock) {
        this(config, manager, new WALWriterImpl(manager, codec), new WALReaderImpl(codec), checkpoints, clock);
    }

    /**
     * Creates a WALImpl from explicit collaborators.
     */
    public WALImpl(WalConfig config, WALManager manager, WALWriter writer, WALReader reader,
                   CheckpointManager checkpoints, Clock clock) {
        this.config = config;
        this.manager = manager;
        this.writer = writer;
        this.reader = reader;
        this.checkpoints = checkpoints;
        this.clock = clock;
        logger.info("WAL initialized in directory: " + manager.getDirectory());
    }

    @Override
    public String newOperationId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public CompletableFuture<Void> append(WalEntry entry) throws IOException {
        CompletableFuture<Void> durable = new CompletableFuture<>();
        boolean flushNow;
        synchronized (lock) {
            if (failure != null) {
                throw new WalFlushException("WAL is unavailable after a failed flush", failure);
            }
            buffer.add(entry);
            bufferFutures.add(durable);
            flushNow = buffer.size() >= config.bufferThreshold();
        }
        if (flushNow) {
            flush();
        }
        return durable;
    }

    @Override
    public CompletableFuture<Void> begin(String operationId, OperationKind kind, Map<String, Object> payload)
            throws IOException {
        return append(WalEntry.pending(operationId, kind, payload, clock.millis()));
    }

    @Override
    public CompletableFuture<Void> markCompleted(String operationId, OperationKind kind, Map<String, Object> payload)
            throws IOException {
        return append(WalEntry.completed(operationId, kind, payload, clock.millis()));
    }

    @Override
    public CompletableFuture<Void> markFailed(String operationId, OperationKind kind, String error) throws IOException {
        return append(WalEntry.failed(operationId, kind, error, clock.millis()));
    }

    @Override
    public void flush() throws IOException {
        List<WalEntry> batch;
        List<CompletableFuture<Void>> futures;
        synchronized (lock) {
            if (failure != null) {
                throw new WalFlushException("WAL is unavailable after a failed flush", failure);
            }
            if (buffer.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(buffer);
            futures = new ArrayList<>(bufferFutures);
            buffer.clear();
            bufferFutures.clear();

            try {
                String segment = writer.writeBatch(batch);
                for (WalEntry entry : batch) {
                    track(entry, segment);
                }
                flushedEntries += batch.size();
                entriesSinceCheckpoint += batch.size();
                lastFlushAt = clock.millis();
            } catch (IOException | RuntimeException e) {
                failure = new WalFlushException("Failed to flush " + batch.size() + " WAL entries", e);
                logger.error("WAL flush failed, rejecting further appends", e);
                futures.forEach(f -> f.completeExceptionally(failure));
                throw failure;
            }
        }
        futures.forEach(f -> f.complete(null));
        maybeCheckpoint();
    }

    // caller holds the lock
    private void track(WalEntry entry, String segment) {
        if (entry.status() == OperationStatus.PENDING) {
            pendingSegments.put(entry.operationId(), segment);
        } else {
            pendingSegments.remove(entry.operationId());
            if (entry.status() == OperationStatus.FAILED) {
                failedOperations++;
            }
        }
    }

    private void maybeCheckpoint() {
        Supplier<List<FileMetadata>> source = checkpointSource;
        if (config.checkpointEvery() == 0 || source == null) {
            return;
        }
        synchronized (lock) {
            if (entriesSinceCheckpoint < config.checkpointEvery()) {
                return;
            }
            entriesSinceCheckpoint = 0;
        }
        try {
            checkpoints.write(clock.millis(), manager.getCurrentFile().getName(), source.get());
        } catch (IOException e) {
            logger.warn("Failed to write catalog checkpoint", e);
        }
    }

    @Override
    public ReplayResult replay(Consumer<WalEntry> handler) throws IOException {
        return replayFrom(null, handler);
    }

    @Override
    public ReplayResult replayFrom(String segmentName, Consumer<WalEntry> handler) throws IOException {
        List<Path> segments = manager.findLogFiles();
        boolean applying = segmentName == null
            || segments.stream().noneMatch(p -> p.getFileName().toString().equals(segmentName));
        if (!applying) {
            logger.info("Replaying WAL from checkpointed segment " + segmentName);
        }

        long applied = 0;
        long skipped = 0;
        long handlerErrors = 0;
        int segmentsRead = 0;
        for (Path segment : segments) {
            String name = segment.getFileName().toString();
            if (!applying && name.equals(segmentName)) {
                applying = true;
            }
            List<WalEntry> entries = new ArrayList<>();
            skipped += reader.readSegment(segment, entries::add);
            segmentsRead++;

            synchronized (lock) {
                for (WalEntry entry : entries) {
                    track(entry, name);
                }
            }
            if (!applying) {
                continue;
            }
            for (WalEntry entry : entries) {
                try {
                    handler.accept(entry);
                    applied++;
                } catch (RuntimeException e) {
                    handlerErrors++;
                    logger.warn("Replay handler failed for operation " + entry.operationId() + " ("
                        + entry.kind() + "/" + entry.status() + "): " + e.getMessage());
                }
            }
        }
        logger.info("WAL replay read " + segmentsRead + " segments: " + applied + " entries applied, "
            + skipped + " skipped, " + handlerErrors + " rejected");
        return new ReplayResult(segmentsRead, applied, skipped, handlerErrors);
    }

    @Override
    public int failPendingOperations(String reason) throws IOException {
        List<String> pending;
        synchronized (lock) {
            pending = new ArrayList<>(pendingSegments.keySet());
        }
        // the kind of a pending operation is not tracked, so recover it from the log itself
        Map<String, OperationKind> kinds = new HashMap<>();
        if (!pending.isEmpty()) {
            Set<String> wanted = new HashSet<>(pending);
            for (Path segment : manager.findLogFiles()) {
                reader.readSegment(segment, entry -> {
                    if (wanted.contains(entry.operationId())) {
                        kinds.put(entry.operationId(), entry.kind());
                    }
                });
            }
        }
        for (String operationId : pending) {
            markFailed(operationId, kinds.getOrDefault(operationId, OperationKind.WRITE), reason);
        }
        flush();
        if (!pending.isEmpty()) {
            logger.warn("Marked " + pending.size() + " pending WAL operations as failed: " + reason);
        }
        return pending.size();
    }

    @Override
    public Set<String> pendingOperations() {
        synchronized (lock) {
            return Set.copyOf(pendingSegments.keySet());
        }
    }

    @Override
    public void setCheckpointSource(Supplier<List<FileMetadata>> snapshotSupplier) {
        this.checkpointSource = snapshotSupplier;
    }

    @Override
    public Optional<Checkpoint> latestCheckpoint() throws IOException {
        return checkpoints.latest();
    }

    @Override
    public int reclaimSegments() throws IOException {
        long cutoff = clock.millis() - config.retentionHours() * MILLIS_PER_HOUR;
        String current = manager.getCurrentFile().getName();
        Set<String> protectedSegments;
        synchronized (lock) {
            protectedSegments = new HashSet<>(pendingSegments.values());
        }

        int deleted = 0;
        for (Path segment : manager.findLogFiles()) {
            String name = segment.getFileName().toString();
            long createdAt = manager.createdAtOf(segment);
            if (name.equals(current) || createdAt < 0 || createdAt >= cutoff || protectedSegments.contains(name)) {
                continue;
            }
            try {
                manager.deleteLog(segment);
                deleted++;
            } catch (IOException e) {
                logger.warn("Failed to delete expired WAL segment " + name, e);
            }
        }
        if (deleted > 0) {
            logger.info("Reclaimed " + deleted + " expired WAL segments");
        }
        return deleted;
    }

    @Override
    public WalStatus status() {
        int segmentCount = 0;
        long totalBytes = 0;
        int checkpointCount = 0;
        try {
            for (Path segment : manager.findLogFiles()) {
                segmentCount++;
                totalBytes += Files.size(segment);
            }
            checkpointCount = checkpoints.count();
        } catch (IOException e) {
            logger.warn("Could not stat WAL segments: " + e.getMessage());
        }
        synchronized (lock) {
            return new WalStatus(segmentCount, totalBytes, manager.getCurrentFile().getName(), buffer.size(),
                pendingSegments.size(), failedOperations, flushedEntries, lastFlushAt, config.retentionHours(),
                checkpointCount, failure != null);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            boolean healthy;
            synchronized (lock) {
                healthy = failure == null;
            }
            if (healthy) {
                flush();
            }
        } finally {
            manager.close();
            logger.info("WAL closed");
        }
    }
}
