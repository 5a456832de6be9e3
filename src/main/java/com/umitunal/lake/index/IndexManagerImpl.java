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

package com.umitunal.lake.index;

import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.columnfile.ColumnType;
import com.umitunal.lake.query.ColumnPredicate;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.query.ValueComparator;
import com.umitunal.lake.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Implementation of the IndexManager interface.
 * Cell values are normalized to the column type the file stores, so min/max always bound
 * what a reader of the file will see.
 */
public class IndexManagerImpl implements IndexManager {
    private static final Logger logger = LoggerFactory.getLogger(IndexManagerImpl.class);

    private final IndexRepository repository;
    private final int uniqueValueThreshold;
    private final Clock clock;

    // column -> file path -> entry
    private final Map<String, Map<String, ColumnIndexEntry>> index;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile long lastUpdated;

    /**
     * Creates an index manager and loads the stored index.
     *
     * @param uniqueValueThreshold distinct values are recorded only below this count
     * @throws IOException if a stored index exists but cannot be read
     */
    public IndexManagerImpl(IndexRepository repository, int uniqueValueThreshold, Clock clock) throws IOException {
        this.repository = repository;
        this.uniqueValueThreshold = uniqueValueThreshold;
        this.clock = clock;
        this.index = new TreeMap<>();
        repository.load().forEach((column, entries) -> index.put(column, new TreeMap<>(entries)));
        logger.info("Index manager initialized with " + index.size() + " indexed columns");
    }

    @Override
    public void update(String filePath, List<Map<String, Object>> rows, List<String> indexColumns) throws IOException {
        Map<String, ColumnIndexEntry> computed = computeEntries(filePath, rows, indexColumns);
        lock.writeLock().lock();
        try {
            Map<String, Map<String, ColumnIndexEntry>> before = deepCopy();
            removeUnlocked(List.of(filePath));
            computed.forEach((column, entry) -> index.computeIfAbsent(column, k -> new TreeMap<>()).put(filePath, entry));
            persistOrRollback(before);
            logger.debug("Indexed " + computed.size() + " columns of " + filePath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<FileMetadata> prune(List<FileMetadata> candidates, QueryFilter filter) {
        if (filter.isEmpty()) {
            return new ArrayList<>(candidates);
        }
        List<FileMetadata> survivors = new ArrayList<>(candidates.size());
        lock.readLock().lock();
        try {
            for (FileMetadata candidate : candidates) {
                if (mayMatchUnlocked(candidate.path(), filter)) {
                    survivors.add(candidate);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        if (survivors.size() < candidates.size()) {
            logger.debug("Index pruned " + (candidates.size() - survivors.size()) + " of " + candidates.size()
                + " files for filter " + filter);
        }
        return survivors;
    }

    @Override
    public boolean mayMatch(String filePath, QueryFilter filter) {
        lock.readLock().lock();
        try {
            return mayMatchUnlocked(filePath, filter);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean mayMatchUnlocked(String filePath, QueryFilter filter) {
        for (ColumnPredicate predicate : filter.predicates()) {
            Map<String, ColumnIndexEntry> entries = index.get(predicate.column());
            ColumnIndexEntry entry = entries == null ? null : entries.get(filePath);
            if (entry != null && !IndexPruner.mayMatch(entry, predicate)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void remove(Collection<String> filePaths) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, Map<String, ColumnIndexEntry>> before = deepCopy();
            if (removeUnlocked(filePaths)) {
                persistOrRollback(before);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void replace(Collection<String> inputPaths, String outputPath, List<Map<String, Object>> rows,
                        List<String> indexColumns) throws IOException {
        Map<String, ColumnIndexEntry> computed = computeEntries(outputPath, rows, indexColumns);
        lock.writeLock().lock();
        try {
            Map<String, Map<String, ColumnIndexEntry>> before = deepCopy();
            List<String> removed = new ArrayList<>(inputPaths);
            removed.add(outputPath);
            removeUnlocked(removed);
            computed.forEach((column, entry) -> index.computeIfAbsent(column, k -> new TreeMap<>()).put(outputPath, entry));
            persistOrRollback(before);
            logger.info("Replaced index entries of " + inputPaths.size() + " files with " + outputPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ColumnIndexEntry> entry(String column, String filePath) {
        lock.readLock().lock();
        try {
            Map<String, ColumnIndexEntry> entries = index.get(column);
            return Optional.ofNullable(entries == null ? null : entries.get(filePath));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ColumnIndexEntry> entriesForColumn(String column) {
        lock.readLock().lock();
        try {
            Map<String, ColumnIndexEntry> entries = index.get(column);
            return entries == null ? List.of() : new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean hasIndex(String sourceId, String column) {
        lock.readLock().lock();
        try {
            Map<String, ColumnIndexEntry> entries = index.get(column);
            if (entries == null) {
                return false;
            }
            for (String path : entries.keySet()) {
                if (StorageLayout.sourceOf(path).equals(sourceId)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isIndexed(String filePath) {
        lock.readLock().lock();
        try {
            for (Map<String, ColumnIndexEntry> entries : index.values()) {
                if (entries.containsKey(filePath)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public IndexStatus status() {
        lock.readLock().lock();
        try {
            Map<String, Integer> perColumn = new LinkedHashMap<>();
            Set<String> files = new HashSet<>();
            long total = 0;
            for (Map.Entry<String, Map<String, ColumnIndexEntry>> column : index.entrySet()) {
                perColumn.put(column.getKey(), column.getValue().size());
                files.addAll(column.getValue().keySet());
                total += column.getValue().size();
            }
            return new IndexStatus(index.size(), files.size(), total, perColumn, lastUpdated);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Map<String, ColumnIndexEntry> computeEntries(String filePath, List<Map<String, Object>> rows,
                                                         List<String> indexColumns) {
        Set<String> columns = new LinkedHashSet<>();
        if (indexColumns == null || indexColumns.isEmpty()) {
            for (Map<String, Object> row : rows) {
                columns.addAll(row.keySet());
            }
        } else {
            for (String column : indexColumns) {
                for (Map<String, Object> row : rows) {
                    if (row.containsKey(column)) {
                        columns.add(column);
                        break;
                    }
                }
            }
        }

        long now = clock.millis();
        Map<String, ColumnIndexEntry> entries = new LinkedHashMap<>();
        for (String column : columns) {
            List<Object> raw = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                raw.add(row.get(column));
            }
            entries.put(column, computeEntry(filePath, column, raw, now));
        }
        return entries;
    }

    private ColumnIndexEntry computeEntry(String filePath, String column, List<Object> raw, long now) {
        ColumnType type = ColumnType.infer(raw);
        TreeSet<Object> distinct = new TreeSet<>(ValueComparator.INSTANCE);
        Object min = null;
        Object max = null;
        long nullCount = 0;
        boolean collectDistinct = true;

        for (Object cell : raw) {
            Object value = type.normalize(cell);
            if (value == null) {
                nullCount++;
                continue;
            }
            if (min == null || ValueComparator.INSTANCE.compare(value, min) < 0) {
                min = value;
            }
            if (max == null || ValueComparator.INSTANCE.compare(value, max) > 0) {
                max = value;
            }
            if (collectDistinct) {
                distinct.add(value);
                if (distinct.size() >= uniqueValueThreshold) {
                    collectDistinct = false;
                    distinct.clear();
                }
            }
        }
        List<Object> uniqueValues = collectDistinct ? new ArrayList<>(distinct) : null;
        return new ColumnIndexEntry(filePath, column, min, max, uniqueValues, nullCount, raw.size(), now);
    }

    // caller holds the write lock
    private boolean removeUnlocked(Collection<String> filePaths) {
        boolean changed = false;
        var columns = index.values().iterator();
        while (columns.hasNext()) {
            Map<String, ColumnIndexEntry> entries = columns.next();
            for (String path : filePaths) {
                changed |= entries.remove(path) != null;
            }
            if (entries.isEmpty()) {
                columns.remove();
            }
        }
        return changed;
    }

    private Map<String, Map<String, ColumnIndexEntry>> deepCopy() {
        Map<String, Map<String, ColumnIndexEntry>> copy = new TreeMap<>();
        index.forEach((column, entries) -> copy.put(column, new TreeMap<>(entries)));
        return copy;
    }

    // caller holds the write lock
    private void persistOrRollback(Map<String, Map<String, ColumnIndexEntry>> before) throws IOException {
        try {
            repository.save(index);
            lastUpdated = clock.millis();
        } catch (IOException e) {
            logger.error("Failed to persist index, rolling back in-memory changes", e);
            index.clear();
            index.putAll(before);
            throw e;
        }
    }
}
