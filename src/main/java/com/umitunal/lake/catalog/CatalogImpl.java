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

package com.umitunal.lake.catalog;

import com.umitunal.lake.storage.StorageLayout;
import com.umitunal.lake.storage.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Implementation of the Catalog interface.
 * The authoritative copy lives in a sorted map; every mutation is persisted through the
 * repository before the lock is released. A failed persist rolls the in-memory map back.
 */
public class CatalogImpl implements Catalog {
    private static final Logger logger = LoggerFactory.getLogger(CatalogImpl.class);

    private final StorageLayout layout;
    private final CatalogRepository repository;
    private final Clock clock;

    private final TreeMap<String, FileMetadata> entries = new TreeMap<>();
    private final SchemaRegistry schemaRegistry = new SchemaRegistry();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Creates a catalog and loads the entries stored in the repository.
     *
     * @throws IOException if stored entries exist but cannot be read
     */
    public CatalogImpl(StorageLayout layout, CatalogRepository repository, Clock clock) throws IOException {
        this.layout = layout;
        this.repository = repository;
        this.clock = clock;

        for (FileMetadata entry : repository.load()) {
            entries.put(entry.path(), entry);
        }
        rebuildSchemas();
        logger.info("Catalog initialized with " + entries.size() + " entries");
    }

    @Override
    public void register(FileMetadata metadata) throws IOException {
        registerAll(List.of(metadata));
    }

    @Override
    public void registerAll(Collection<FileMetadata> newEntries) throws IOException {
        if (newEntries.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Map<String, FileMetadata> before = new TreeMap<>(entries);
            long now = clock.millis();
            for (FileMetadata entry : newEntries) {
                entries.put(entry.path(), entry);
                schemaRegistry.register(entry, now);
            }
            persistOrRollback(before);
            logger.debug("Registered " + newEntries.size() + " catalog entries");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<FileMetadata> get(String path) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(path));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int removeAll(Collection<String> paths) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, FileMetadata> before = new TreeMap<>(entries);
            int removed = 0;
            for (String path : paths) {
                if (entries.remove(path) != null) {
                    schemaRegistry.unregister(path);
                    removed++;
                }
            }
            if (removed > 0) {
                persistOrRollback(before);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<FileMetadata> list(String prefix) {
        lock.readLock().lock();
        try {
            if (prefix == null || prefix.isEmpty()) {
                return new ArrayList<>(entries.values());
            }
            String dirPrefix = prefix.endsWith("/") ? prefix : prefix + "/";
            List<FileMetadata> result = new ArrayList<>();
            FileMetadata exact = entries.get(prefix);
            if (exact != null) {
                result.add(exact);
            }
            result.addAll(entries.subMap(dirPrefix, true, dirPrefix + Character.MAX_VALUE, true).values());
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> sources() {
        lock.readLock().lock();
        try {
            Set<String> sources = new TreeSet<>();
            for (FileMetadata entry : entries.values()) {
                sources.add(entry.sourceId() != null ? entry.sourceId() : StorageLayout.sourceOf(entry.path()));
            }
            return sources;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CatalogStats stats() {
        lock.readLock().lock();
        try {
            long bytes = 0;
            long rows = 0;
            long hot = 0;
            for (FileMetadata entry : entries.values()) {
                bytes += entry.sizeBytes();
                rows += entry.rowCount();
                if (entry.tier() == Tier.HOT) {
                    hot++;
                }
            }
            return new CatalogStats(entries.size(), bytes, rows, hot, entries.size() - hot, schemaRegistry.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<FileMetadata> filesForQuery(String sourceId, Set<String> requiredColumns) {
        List<FileMetadata> candidates = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (FileMetadata entry : list(sourceId)) {
                if (schemaRegistry.satisfies(entry.path(), requiredColumns)) {
                    candidates.add(entry);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        List<FileMetadata> result = new ArrayList<>(candidates.size());
        for (FileMetadata entry : candidates) {
            if (isStale(entry)) {
                logger.warn("Skipping stale catalog entry, file missing: " + entry.path() + " (" + entry.tier() + ")");
            } else {
                result.add(entry);
            }
        }
        result.sort(Comparator.comparingLong(FileMetadata::createdAt)
            .thenComparingLong(FileMetadata::writeId)
            .thenComparing(FileMetadata::path)
            .reversed());
        return result;
    }

    @Override
    public void replaceFiles(Collection<String> inputPaths, FileMetadata output) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, FileMetadata> before = new TreeMap<>(entries);
            for (String path : inputPaths) {
                entries.remove(path);
                schemaRegistry.unregister(path);
            }
            entries.put(output.path(), output);
            schemaRegistry.register(output, clock.millis());
            persistOrRollback(before);
            logger.info("Replaced " + inputPaths.size() + " catalog entries with " + output.path());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public FileMetadata moveToTier(String path, Tier target) throws IOException {
        lock.writeLock().lock();
        try {
            FileMetadata entry = entries.get(path);
            if (entry == null) {
                throw new IllegalArgumentException("Unknown catalog entry: " + path);
            }
            if (entry.tier() == target) {
                return entry;
            }
            Path from = layout.resolve(path, entry.tier());
            Path to = layout.resolve(path, target);
            if (!Files.exists(from)) {
                throw new NoSuchFileException(from.toString());
            }
            Files.createDirectories(to.getParent());
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);

            Map<String, FileMetadata> before = new TreeMap<>(entries);
            FileMetadata moved = entry.withTier(target);
            entries.put(path, moved);
            try {
                persistOrRollback(before);
            } catch (IOException e) {
                Files.move(to, from, StandardCopyOption.ATOMIC_MOVE);
                throw e;
            }
            logger.debug("Moved " + path + " from " + entry.tier() + " to " + target);
            return moved;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<FileMetadata> snapshot() {
        return list("");
    }

    @Override
    public void restore(Collection<FileMetadata> restored) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, FileMetadata> before = new TreeMap<>(entries);
            entries.clear();
            for (FileMetadata entry : restored) {
                entries.put(entry.path(), entry);
            }
            rebuildSchemas();
            persistOrRollback(before);
            logger.info("Catalog restored with " + entries.size() + " entries");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<FileMetadata> staleEntries() {
        List<FileMetadata> stale = new ArrayList<>();
        for (FileMetadata entry : snapshot()) {
            if (isStale(entry)) {
                stale.add(entry);
            }
        }
        return stale;
    }

    @Override
    public Optional<SchemaInfo> schemaFor(String path) {
        lock.readLock().lock();
        try {
            return schemaRegistry.schemaFor(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SchemaInfo> schemas() {
        lock.readLock().lock();
        try {
            return schemaRegistry.schemas();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean satisfies(String path, Collection<String> requiredColumns) {
        lock.readLock().lock();
        try {
            return schemaRegistry.satisfies(path, requiredColumns);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean isStale(FileMetadata entry) {
        return !Files.exists(layout.resolve(entry.path(), entry.tier()));
    }

    private void rebuildSchemas() {
        schemaRegistry.clear();
        entries.values().stream()
            .sorted(Comparator.comparingLong(FileMetadata::createdAt))
            .forEach(entry -> schemaRegistry.register(entry, entry.createdAt()));
    }

    // caller holds the write lock
    private void persistOrRollback(Map<String, FileMetadata> before) throws IOException {
        try {
            repository.save(entries.values());
        } catch (IOException e) {
            logger.error("Failed to persist catalog, rolling back in-memory changes", e);
            entries.clear();
            entries.putAll(before);
            rebuildSchemas();
            throw e;
        }
    }
}
