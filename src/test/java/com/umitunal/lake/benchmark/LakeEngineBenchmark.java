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

package com.umitunal.lake.benchmark;

import com.umitunal.lake.api.AggregateResult;
import com.umitunal.lake.api.SearchResult;
import com.umitunal.lake.api.WriteResult;
import com.umitunal.lake.config.EngineConfig;
import com.umitunal.lake.config.SourceConfig;
import com.umitunal.lake.core.engine.LakeEngine;
import com.umitunal.lake.core.scaling.JmxSystemMetricsProvider;
import com.umitunal.lake.optimizer.ExecutionPlan;
import com.umitunal.lake.query.Aggregation;
import com.umitunal.lake.query.AggregationType;
import com.umitunal.lake.query.ColumnPredicate;
import com.umitunal.lake.query.QueryFilter;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * JMH Benchmarks for LakeEngine operations.
 *
 * To run the benchmark from an IDE, run {@link #main(String[])} or {@link LakeEngineBenchmarkRunner}.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2G", "-Xmx2G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class LakeEngineBenchmark {

    private static final int PRELOADED_FILES = 50;
    private static final int ROWS_PER_FILE = 200;
    private static final String[] REGIONS = {"N", "S", "E", "W"};
    private static final String[] TENANTS = {"acme", "globex", "initech"};

    private LakeEngine engine;
    private Path tempDir;
    private Random random;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("lake-benchmark");
        engine = new LakeEngine(EngineConfig.getDefault().withDataDirectory(tempDir.toString()),
            Clock.systemUTC(), new JmxSystemMetricsProvider(), false);
        engine.registerSource(SourceConfig.of("orders").withPartitionColumns(List.of("region")));

        // Fixed seed for reproducibility
        random = new Random(42);
        for (int i = 0; i < PRELOADED_FILES; i++) {
            engine.write("orders", TENANTS[i % TENANTS.length], generateRows(ROWS_PER_FILE));
        }
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        if (engine != null) {
            engine.close();
        }
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    System.err.println("Failed to delete: " + path);
                }
            });
        }
    }

    private List<Map<String, Object>> generateRows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new HashMap<>();
            row.put("id", random.nextInt(1_000_000));
            row.put("region", REGIONS[random.nextInt(REGIONS.length)]);
            row.put("amount", random.nextInt(10_000));
            row.put("customer", "c-" + random.nextInt(500));
            rows.add(row);
        }
        return rows;
    }

    /**
     * Benchmark for a small write, one file per partition.
     */
    @Benchmark
    public void benchmarkWrite(Blackhole blackhole) throws IOException {
        WriteResult result = engine.write("orders", TENANTS[random.nextInt(TENANTS.length)], generateRows(50));
        blackhole.consume(result);
    }

    /**
     * Benchmark for an equality search the value index can prune.
     */
    @Benchmark
    public void benchmarkIndexedSearch(Blackhole blackhole) {
        QueryFilter filter = QueryFilter.of(ColumnPredicate.eq("customer", "c-" + random.nextInt(500)));
        SearchResult result = engine.search(List.of("orders"), filter, 100, 0, null);
        blackhole.consume(result);
    }

    /**
     * Benchmark for a range search with paging.
     */
    @Benchmark
    public void benchmarkRangeSearchWithOffset(Blackhole blackhole) {
        QueryFilter filter = QueryFilter.of(ColumnPredicate.gte("amount", 9_000));
        SearchResult result = engine.search(List.of("orders"), filter, 50, 50, null);
        blackhole.consume(result);
    }

    /**
     * Benchmark for aggregating a whole partition.
     */
    @Benchmark
    public void benchmarkAggregate(Blackhole blackhole) {
        QueryFilter filter = QueryFilter.of(ColumnPredicate.eq("region", REGIONS[random.nextInt(REGIONS.length)]));
        AggregateResult result = engine.aggregate(List.of("orders"), filter,
            List.of(Aggregation.count(), Aggregation.of(AggregationType.AVG, "amount")), null);
        blackhole.consume(result);
    }

    /**
     * Benchmark for planning with cached statistics.
     */
    @Benchmark
    public void benchmarkOptimize(Blackhole blackhole) {
        ExecutionPlan plan = engine.optimize(QueryFilter.of(ColumnPredicate.eq("region", "N")),
            List.of(Aggregation.count()), List.of("orders"), null);
        blackhole.consume(plan);
    }

    /**
     * Main method to run the benchmark from IDE.
     */
    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(LakeEngineBenchmark.class.getSimpleName())
            .build();
        new Runner(options).run();
    }
}
