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

import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.wal.checkpoint.Checkpoint;
import com.umitunal.lake.wal.record.OperationKind;
import com.umitunal.lake.wal.record.WalEntry;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Interface for Write-Ahead Log (WAL) operations.
 * The WAL records the intent of every catalog mutation before it is applied and its outcome
 * afterwards, so the catalog can be reconstructed after a restart.
 */
public interface WAL extends AutoCloseable {

    /**
     * @return a new unique operation id
     */
    String newOperationId();

    /**
     * Buffers an entry. When the buffer reaches its threshold the caller flushes it synchronously.
     *
     * @param entry the entry to log
     * @return a future completed once the entry is on disk, or completed exceptionally with
     *         a {@link WalFlushException} if the flush fails
     * @throws WalFlushException if an earlier flush failed
     * @throws IOException if the threshold flush fails
     */
    CompletableFuture<Void> append(WalEntry entry) throws IOException;

    /**
     * Logs a PENDING entry for a new operation.
     *
     * @return the entry's durability future
     * @throws IOException see {@link #append(WalEntry)}
     */
    CompletableFuture<Void> begin(String operationId, OperationKind kind, Map<String, Object> payload)
        throws IOException;

    /**
     * Logs the successful outcome of an operation.
     *
     * @throws IOException see {@link #append(WalEntry)}
     */
    CompletableFuture<Void> markCompleted(String operationId, OperationKind kind, Map<String, Object> payload)
        throws IOException;

    /**
     * Logs the failure of an operation.
     *
     * @throws IOException see {@link #append(WalEntry)}
     */
    CompletableFuture<Void> markFailed(String operationId, OperationKind kind, String error) throws IOException;

    /**
     * Writes every buffered entry to the active segment and forces it to disk.
     *
     * @throws WalFlushException if the entries cannot be written; the log stays failed afterwards
     */
    void flush() throws IOException;

    /**
     * Reads all segments in creation order and hands every entry to the handler.
     *
     * @return replay counters
     * @throws IOException if a segment cannot be opened
     */
    ReplayResult replay(Consumer<WalEntry> handler) throws IOException;

    /**
     * Like {@link #replay(Consumer)} but only entries from the named segment onwards reach the handler.
     * Earlier segments are still scanned to track which operations are pending.
     *
     * @throws IOException if a segment cannot be opened
     */
    ReplayResult replayFrom(String segmentName, Consumer<WalEntry> handler) throws IOException;

    /**
     * Marks every operation still pending as failed and flushes.
     *
     * @return the number of operations marked failed
     * @throws IOException see {@link #flush()}
     */
    int failPendingOperations(String reason) throws IOException;

    /**
     * @return ids of operations without a terminal record
     */
    Set<String> pendingOperations();

    /**
     * Registers the supplier of catalog snapshots used for periodic checkpoints.
     */
    void setCheckpointSource(Supplier<List<FileMetadata>> snapshotSupplier);

    /**
     * @return the newest readable checkpoint, if any
     * @throws IOException if checkpoints cannot be listed
     */
    Optional<Checkpoint> latestCheckpoint() throws IOException;

    /**
     * Deletes rotated segments older than the retention window that hold no pending operation.
     *
     * @return the number of segments deleted
     * @throws IOException if the segment directory cannot be listed
     */
    int reclaimSegments() throws IOException;

    WalStatus status();

    /**
     * Flushes remaining entries and closes the active segment.
     *
     * @throws IOException if the final flush fails
     */
    @Override
    void close() throws IOException;
}
