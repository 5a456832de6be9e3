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

import com.umitunal.lake.config.OptimizerConfig;
import com.umitunal.lake.index.IndexManager;
import com.umitunal.lake.query.Aggregation;
import com.umitunal.lake.query.ColumnPredicate;
import com.umitunal.lake.query.QueryFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Cost-based optimizer choosing between sequential, parallel, index-assisted and partition-pruned plans.
 *
 * <p>Statistics of uncached sources are collected first. Candidates are generated in a fixed order and
 * the cheapest total cost wins, ties going to the earlier candidate. Any failure while planning yields
 * the fixed-cost default plan. Reported executions feed back into the cost model once enough of them
 * exist for a plan id.</p>
 */
public class QueryOptimizer {
    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final double SCAN_MEMORY_CAP_MB = 100.0;
    private static final double TIME_PER_COST_UNIT_MILLIS = 100.0;
    private static final int ASSUMED_PARTITIONS = 10;
    private static final long DEFAULT_AGGREGATION_INPUT_ROWS = 1000;

    private final StatisticsCollector statisticsCollector;
    private final IndexManager indexManager;
    private final CostModelRegistry costModels;
    private final OptimizerConfig config;
    private final Function<String, List<String>> sourcePartitionColumns;
    private final Clock clock;

    private final Map<String, Deque<ExecutionRecord>> executionHistory = new ConcurrentHashMap<>();
    private final AtomicLong plansGenerated = new AtomicLong();
    private final AtomicLong fallbackPlans = new AtomicLong();

    /**
     * @param sourcePartitionColumns partition columns configured for a source, empty when unknown
     */
    public QueryOptimizer(StatisticsCollector statisticsCollector, IndexManager indexManager,
                          CostModelRegistry costModels, OptimizerConfig config,
                          Function<String, List<String>> sourcePartitionColumns, Clock clock) {
        this.statisticsCollector = statisticsCollector;
        this.indexManager = indexManager;
        this.costModels = costModels;
        this.config = config;
        this.sourcePartitionColumns = sourcePartitionColumns;
        this.clock = clock;
    }

    /**
     * Generates candidate plans and returns the cheapest one, or the default plan if planning fails.
     *
     * @param limit maximum rows requested, or null
     */
    public ExecutionPlan optimize(QueryFilter filter, List<Aggregation> aggregations, List<String> sourceIds,
                                  Integer limit) {
        try {
            logger.info("Optimizing query execution plan");
            CostModel model = costModels.current();
            Map<String, TableStatistics> statistics = new LinkedHashMap<>();
            for (String sourceId : sourceIds) {
                statistics.put(sourceId, statisticsCollector.statisticsFor(sourceId));
            }

            List<ExecutionPlan> candidates = new ArrayList<>();
            ExecutionPlan sequential = sequentialPlan(filter, aggregations, statistics, limit, model);
            candidates.add(sequential);
            candidates.add(parallelPlan(sequential, sourceIds.size(), model));
            indexPlan(sequential, filter, sourceIds, model).ifPresent(candidates::add);
            partitionPrunedPlan(sequential, filter, sourceIds, model).ifPresent(candidates::add);

            ExecutionPlan best = selectBest(candidates);
            plansGenerated.incrementAndGet();
            logger.info("Selected plan " + best.planId() + " with estimated cost " + best.cost().total());
            return best;
        } catch (RuntimeException e) {
            logger.error("Error optimizing query, using default plan", e);
            fallbackPlans.incrementAndGet();
            return defaultPlan();
        }
    }

    private ExecutionPlan sequentialPlan(QueryFilter filter, List<Aggregation> aggregations,
                                         Map<String, TableStatistics> statistics, Integer limit, CostModel model) {
        List<PlanOperator> operators = new ArrayList<>();
        PlanCost total = PlanCost.ZERO;
        long rowsIntoAggregation = 0;
        long lastRowsOut = 0;

        for (Map.Entry<String, TableStatistics> source : statistics.entrySet()) {
            TableStatistics table = source.getValue();
            PlanCost scan = scanCost(table, model);
            operators.add(PlanOperator.scan(source.getKey(), scan, table.rowCount()));
            total = total.plus(scan);
            long rowsOut = table.rowCount();

            if (!filter.isEmpty()) {
                double selectivity = SelectivityEstimator.estimate(filter, table);
                PlanCost filterCost = PlanCost.of(table.rowCount() * selectivity * model.cpuPerRow() * 0.5, 0, 0, 0);
                rowsOut = (long) (table.rowCount() * selectivity);
                operators.add(PlanOperator.filter(source.getKey(), filterCost, rowsOut, selectivity));
                total = total.plus(filterCost);
            }
            rowsIntoAggregation += rowsOut;
            lastRowsOut = rowsOut;
        }

        if (!aggregations.isEmpty()) {
            long inputRows = statistics.isEmpty() ? DEFAULT_AGGREGATION_INPUT_ROWS : rowsIntoAggregation;
            PlanCost aggregate = PlanCost.of(inputRows * aggregations.size() * model.cpuPerRow() * 2, 0,
                inputRows * 0.001, 0);
            operators.add(PlanOperator.aggregate(aggregate));
            total = total.plus(aggregate);
            lastRowsOut = 1;
        }

        if (limit != null) {
            operators.add(PlanOperator.limit(Math.min(limit, lastRowsOut)));
        }

        return new ExecutionPlan(PlanType.SEQUENTIAL.planId(), PlanType.SEQUENTIAL, operators, total,
            total.total() * TIME_PER_COST_UNIT_MILLIS, 1, List.of(), Map.of(), model.version());
    }

    private PlanCost scanCost(TableStatistics table, CostModel model) {
        double sizeMb = table.sizeBytes() / BYTES_PER_MB;
        return PlanCost.of(
            table.rowCount() * model.cpuPerRow(),
            sizeMb * model.ioPerMb(),
            Math.min(sizeMb, SCAN_MEMORY_CAP_MB) * model.memoryPerMb(),
            0);
    }

    private ExecutionPlan parallelPlan(ExecutionPlan sequential, int sourceCount, CostModel model) {
        int parallelism = Math.max(1, Math.min(sourceCount, config.maxConcurrency()));
        PlanCost base = sequential.cost();
        PlanCost cost = PlanCost.of(base.cpu() / parallelism, base.io() / parallelism, base.memory() * parallelism,
            base.network());
        return new ExecutionPlan(PlanType.PARALLEL.planId(), PlanType.PARALLEL, sequential.operators(), cost,
            cost.total() * TIME_PER_COST_UNIT_MILLIS / parallelism, parallelism, List.of(), Map.of(), model.version());
    }

    private Optional<ExecutionPlan> indexPlan(ExecutionPlan sequential, QueryFilter filter, List<String> sourceIds,
                                              CostModel model) {
        List<String> usage = new ArrayList<>();
        for (String sourceId : sourceIds) {
            for (String column : filter.columns()) {
                if (indexManager.hasIndex(sourceId, column)) {
                    usage.add(sourceId + "." + column);
                }
            }
        }
        if (usage.isEmpty()) {
            return Optional.empty();
        }
        PlanCost base = sequential.cost();
        PlanCost cost = PlanCost.of(base.cpu() * model.indexBenefit(), base.io() * model.indexBenefit(),
            base.memory(), base.network());
        return Optional.of(new ExecutionPlan(PlanType.INDEX.planId(), PlanType.INDEX, sequential.operators(), cost,
            cost.total() * TIME_PER_COST_UNIT_MILLIS, 1, usage, Map.of(), model.version()));
    }

    private Optional<ExecutionPlan> partitionPrunedPlan(ExecutionPlan sequential, QueryFilter filter,
                                                        List<String> sourceIds, CostModel model) {
        Map<String, PruningSummary> pruning = new LinkedHashMap<>();
        for (String sourceId : sourceIds) {
            PruningSummary summary = estimatePartitionPruning(sourceId, filter);
            if (summary.prunedRatio() > 0) {
                pruning.put(sourceId, summary);
            }
        }
        if (pruning.isEmpty()) {
            return Optional.empty();
        }
        double averageRatio = pruning.values().stream().mapToDouble(PruningSummary::prunedRatio).average().orElse(0);
        double benefit = 1.0 - averageRatio * model.partitionPruning();
        PlanCost base = sequential.cost();
        PlanCost cost = PlanCost.of(base.cpu() * benefit, base.io() * benefit, base.memory() * benefit,
            base.network());
        return Optional.of(new ExecutionPlan(PlanType.PARTITION_PRUNED.planId(), PlanType.PARTITION_PRUNED,
            sequential.operators(), cost, cost.total() * TIME_PER_COST_UNIT_MILLIS, 1, List.of(), pruning,
            model.version()));
    }

    /**
     * Estimates pruning from the first predicate on a partition-like column: equality prunes 90 %,
     * an open range 50 %, anything else nothing. The partitions scanned are truncated, so an
     * equality estimate reports none.
     */
    PruningSummary estimatePartitionPruning(String sourceId, QueryFilter filter) {
        List<String> partitionColumns = new ArrayList<>();
        for (String column : config.partitionColumns()) {
            partitionColumns.add(column.toLowerCase(Locale.ROOT));
        }
        for (String column : sourcePartitionColumns.apply(sourceId)) {
            partitionColumns.add(column.toLowerCase(Locale.ROOT));
        }

        double ratio = 0.0;
        for (ColumnPredicate predicate : filter.predicates()) {
            if (partitionColumns.contains(predicate.column().toLowerCase(Locale.ROOT))) {
                if (predicate instanceof ColumnPredicate.Eq) {
                    ratio = 0.9;
                } else if (predicate instanceof ColumnPredicate.Gt || predicate instanceof ColumnPredicate.Gte
                    || predicate instanceof ColumnPredicate.Lt || predicate instanceof ColumnPredicate.Lte) {
                    ratio = 0.5;
                }
                break;
            }
        }
        return new PruningSummary(ratio, (int) ((1.0 - ratio) * ASSUMED_PARTITIONS), ASSUMED_PARTITIONS);
    }

    private ExecutionPlan selectBest(List<ExecutionPlan> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalStateException("No execution plans generated");
        }
        ExecutionPlan best = candidates.get(0);
        for (ExecutionPlan candidate : candidates) {
            logger.debug("  " + candidate.planId() + ": cost=" + candidate.cost().total() + ", time="
                + candidate.estimatedTimeMillis() + "ms, parallelism=" + candidate.parallelism());
            if (candidate.cost().total() < best.cost().total()) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * The fixed-cost fallback plan.
     */
    public ExecutionPlan defaultPlan() {
        PlanCost cost = new PlanCost(10, 10, 5, 0, 25);
        return new ExecutionPlan(PlanType.DEFAULT.planId(), PlanType.DEFAULT,
            List.of(PlanOperator.scan(null, cost, 1000)), cost, 1000, 1, List.of(), Map.of(),
            costModels.current().version());
    }

    /**
     * Records an observed execution and, once enough successful executions of the plan id exist,
     * nudges the cost model toward the observed ratio of actual to estimated time.
     */
    public void recordExecution(ExecutionPlan plan, double actualTimeMillis, long actualRows, boolean success) {
        Deque<ExecutionRecord> history = executionHistory.computeIfAbsent(plan.planId(), k -> new ArrayDeque<>());
        List<ExecutionRecord> recent;
        synchronized (history) {
            history.addLast(new ExecutionRecord(clock.millis(), actualTimeMillis, plan.estimatedTimeMillis(),
                actualRows, success));
            while (history.size() > config.executionHistorySize()) {
                history.removeFirst();
            }
            recent = new ArrayList<>(history);
        }

        List<ExecutionRecord> successful = recent.stream().filter(ExecutionRecord::success).toList();
        if (successful.size() < config.feedbackMinSamples()) {
            return;
        }
        List<ExecutionRecord> window = successful.subList(successful.size() - config.feedbackMinSamples(),
            successful.size());
        double actual = window.stream().mapToDouble(ExecutionRecord::actualTimeMillis).average().orElse(0);
        double estimated = window.stream().mapToDouble(ExecutionRecord::estimatedTimeMillis).average().orElse(0);
        if (estimated <= 0) {
            return;
        }
        double ratio = Math.max(0.5, Math.min(2.0, actual / estimated));
        costModels.update(model -> model.adjustedBy(ratio));
    }

    public List<ExecutionRecord> executionHistory(String planId) {
        Deque<ExecutionRecord> history = executionHistory.get(planId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public CostModel costModel() {
        return costModels.current();
    }

    public OptimizerStatistics statistics() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        executionHistory.forEach((planId, history) -> {
            synchronized (history) {
                counts.put(planId, history.size());
            }
        });
        return new OptimizerStatistics(statisticsCollector.cachedCount(), costModels.current(), counts,
            plansGenerated.get(), fallbackPlans.get());
    }
}
