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

package com.umitunal.lake.optimizer;

import com.umitunal.lake.catalog.Catalog;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.columnfile.ColumnDescriptor;
import com.umitunal.lake.columnfile.ColumnFileData;
import com.umitunal.lake.columnfile.ColumnFileIO;
import com.umitunal.lake.config.OptimizerConfig;
import com.umitunal.lake.core.scaling.MemoryPressureListener;
import com.umitunal.lake.query.ValueComparator;
import com.umitunal.lake.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects and caches per-source statistics for the optimizer.
 * Sizes come from the catalog; column statistics are sampled from the newest few files.
 */
public class StatisticsCollector implements MemoryPressureListener {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsCollector.class);

    private static final long BASE_ENTRY_BYTES = 512;
    private static final long COLUMN_ENTRY_BYTES = 256;

    private final Catalog catalog;
    private final ColumnFileIO columnFileIO;
    private final StorageLayout layout;
    private final OptimizerConfig config;
    private final Clock clock;
    private final Map<String, TableStatistics> cache = new ConcurrentHashMap<>();
    private volatile long cacheBudgetBytes = Long.MAX_VALUE;

    public StatisticsCollector(Catalog catalog, ColumnFileIO columnFileIO, StorageLayout layout,
                               OptimizerConfig config, Clock clock) {
        this.catalog = catalog;
        this.columnFileIO = columnFileIO;
        this.layout = layout;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @return cached statistics, collecting them first if the source is not cached
     */
    public TableStatistics statisticsFor(String sourceId) {
        TableStatistics cached = cache.get(sourceId);
        return cached != null ? cached : refresh(sourceId);
    }

    /**
     * @return cached statistics or null, never collecting
     */
    public TableStatistics cached(String sourceId) {
        return cache.get(sourceId);
    }

    /**
     * Collects statistics for a source and replaces the cached copy.
     */
    public TableStatistics refresh(String sourceId) {
        List<FileMetadata> files = catalog.filesForQuery(sourceId, Set.of());
        long rows = 0;
        long bytes = 0;
        for (FileMetadata file : files) {
            rows += file.rowCount();
            bytes += file.sizeBytes();
        }

        Map<String, ColumnSample> samples = new LinkedHashMap<>();
        int sampled = 0;
        for (FileMetadata file : files) {
            if (sampled >= config.sampleFiles()) {
                break;
            }
            try {
                sample(columnFileIO.read(layout.resolve(file.path(), file.tier())), samples);
                sampled++;
            } catch (IOException e) {
                logger.warn("Error sampling " + file.path() + " for statistics: " + e.getMessage());
            }
        }

        Map<String, ColumnStatistics> columns = new LinkedHashMap<>();
        samples.forEach((name, sample) -> columns.put(name, sample.toStatistics(name)));
        TableStatistics statistics = new TableStatistics(sourceId, rows, files.size(), bytes, columns, clock.millis());
        cache.put(sourceId, statistics);
        enforceBudget();
        logger.debug("Collected statistics for " + sourceId + ": " + rows + " rows, " + files.size() + " files, "
            + bytes + " bytes");
        return statistics;
    }

    /**
     * Re-collects every cached source.
     *
     * @return number of sources refreshed
     */
    public int refreshCached() {
        List<String> sources = new ArrayList<>(cache.keySet());
        for (String sourceId : sources) {
            refresh(sourceId);
        }
        return sources.size();
    }

    public void invalidate(String sourceId) {
        cache.remove(sourceId);
    }

    public int cachedCount() {
        return cache.size();
    }

    @Override
    public void onMemoryPressure(double memoryPercent) {
        int dropped = cache.size();
        cache.clear();
        logger.info("Dropped statistics of " + dropped + " sources under memory pressure (" + memoryPercent + "%)");
    }

    @Override
    public void onCacheBudget(long budgetBytes) {
        cacheBudgetBytes = budgetBytes;
        enforceBudget();
    }

    private void enforceBudget() {
        long budget = cacheBudgetBytes;
        if (estimatedBytes() <= budget) {
            return;
        }
        List<TableStatistics> oldestFirst = new ArrayList<>(cache.values());
        oldestFirst.sort(Comparator.comparingLong(TableStatistics::collectedAt));
        for (TableStatistics statistics : oldestFirst) {
            if (estimatedBytes() <= budget) {
                break;
            }
            cache.remove(statistics.sourceId());
            logger.debug("Evicted statistics of " + statistics.sourceId() + " to fit the cache budget");
        }
    }

    private long estimatedBytes() {
        long total = 0;
        for (TableStatistics statistics : cache.values()) {
            total += BASE_ENTRY_BYTES + statistics.columns().size() * COLUMN_ENTRY_BYTES;
        }
        return total;
    }

    private void sample(ColumnFileData data, Map<String, ColumnSample> samples) {
        for (ColumnDescriptor descriptor : data.info().columns()) {
            ColumnSample sample = samples.computeIfAbsent(descriptor.name(), k -> new ColumnSample(descriptor.type().name()));
            Set<Object> fileDistinct = new LinkedHashSet<>();
            for (Map<String, Object> row : data.rows()) {
                Object value = row.get(descriptor.name());
                if (value == null) {
                    sample.nullCount++;
                    continue;
                }
                sample.observe(value);
                if (fileDistinct.size() < config.distinctPerFile()) {
                    fileDistinct.add(value);
                }
            }
            for (Object value : fileDistinct) {
                if (sample.distinct.size() >= config.distinctSampleLimit()) {
                    break;
                }
                sample.distinct.add(value);
            }
        }
    }

    private static final class ColumnSample {
        private final String dataType;
        private final Set<Object> distinct = new HashSet<>();
        private long nullCount;
        private Object min;
        private Object max;

        private ColumnSample(String dataType) {
            this.dataType = dataType;
        }

        private void observe(Object value) {
            try {
                if (min == null || ValueComparator.INSTANCE.compare(value, min) < 0) {
                    min = value;
                }
                if (max == null || ValueComparator.INSTANCE.compare(value, max) > 0) {
                    max = value;
                }
            } catch (IllegalArgumentException e) {
                // mixed types across sampled files; keep the first bound
            }
        }

        private ColumnStatistics toStatistics(String column) {
            return new ColumnStatistics(column, dataType, distinct.size(), nullCount, min, max);
        }
    }
}
