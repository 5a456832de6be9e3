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
import com.umitunal.lake.query.AggregationType;
import com.umitunal.lake.query.ColumnPredicate;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the QueryOptimizer class.
 */
class QueryOptimizerTest {
    private static final long MB = 1024L * 1024L;

    private StatisticsCollector statisticsCollector;
    private IndexManager indexManager;
    private CostModelRegistry costModels;
    private QueryOptimizer optimizer;

    @BeforeEach
    void setUp() {
        statisticsCollector = mock(StatisticsCollector.class);
        indexManager = mock(IndexManager.class);
        costModels = new CostModelRegistry(CostModel.getDefault());
        when(statisticsCollector.statisticsFor("orders"))
            .thenReturn(new TableStatistics("orders", 1_000_000, 10, 100 * MB, Map.of(), 0));
        when(statisticsCollector.statisticsFor("users"))
            .thenReturn(new TableStatistics("users", 10_000, 2, 10 * MB, Map.of(), 0));
        optimizer = new QueryOptimizer(statisticsCollector, indexManager, costModels, OptimizerConfig.getDefault(),
            sourceId -> sourceId.equals("orders") ? List.of("region") : List.of(),
            new MutableClock(Instant.parse("2024-03-01T10:00:00Z")));
    }

    @Test
    void testSingleSourcePrefersSequentialOnTie() {
        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("orders"), null);

        assertEquals("sequential_plan", plan.planId());
        assertEquals(PlanType.SEQUENTIAL, plan.type());
        assertEquals(1, plan.parallelism());
        // 1M rows of cpu plus 100 MB of io and memory
        assertEquals(1011.0, plan.cost().total(), 1e-9);
        assertEquals(plan.cost().total() * 100, plan.estimatedTimeMillis(), 1e-6);
        assertEquals(1, plan.operators().size());
        assertEquals(OperatorType.SCAN, plan.operators().get(0).type());
    }

    @Test
    void testMultipleSourcesPreferParallel() {
        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("orders", "users"), null);

        assertEquals("parallel_plan", plan.planId());
        assertEquals(2, plan.parallelism());
        assertEquals(2, plan.operators().size());
    }

    @Test
    void testIndexedColumnSelectsIndexPlan() {
        when(indexManager.hasIndex("orders", "customer")).thenReturn(true);
        QueryFilter filter = QueryFilter.of(ColumnPredicate.eq("customer", "c-1"));

        ExecutionPlan plan = optimizer.optimize(filter, List.of(), List.of("orders"), null);

        assertEquals("index_plan", plan.planId());
        assertEquals(List.of("orders.customer"), plan.indexUsage());
        // scan 1000 + filter 250 cpu, scaled by the index benefit, plus 8 io and 1 memory
        assertEquals(1009.0, plan.cost().total(), 1e-9);
    }

    @Test
    void testPartitionPredicateSelectsPrunedPlan() {
        when(indexManager.hasIndex("orders", "date")).thenReturn(true);
        QueryFilter filter = QueryFilter.of(ColumnPredicate.eq("date", "2024-03-01"));

        ExecutionPlan plan = optimizer.optimize(filter, List.of(), List.of("orders"), null);

        assertEquals("partition_pruned_plan", plan.planId());
        PruningSummary pruning = plan.filePruning().get("orders");
        assertNotNull(pruning);
        assertEquals(0.9, pruning.prunedRatio(), 1e-9);
        assertEquals(1261.0 * (1.0 - 0.9 * 0.7), plan.cost().total(), 1e-6);
    }

    @Test
    void testPartitionPruningEstimates() {
        assertEquals(0.9, optimizer.estimatePartitionPruning("users",
            QueryFilter.of(ColumnPredicate.eq("Year", 2024))).prunedRatio(), 1e-9);
        assertEquals(0.5, optimizer.estimatePartitionPruning("orders",
            QueryFilter.of(ColumnPredicate.gt("region", "M"))).prunedRatio(), 1e-9);
        assertEquals(0.0, optimizer.estimatePartitionPruning("users",
            QueryFilter.of(ColumnPredicate.gt("region", "M"))).prunedRatio(), 1e-9);
        assertEquals(0.0, optimizer.estimatePartitionPruning("orders",
            QueryFilter.of(ColumnPredicate.like("region", "N%"))).prunedRatio(), 1e-9);

        PruningSummary summary = optimizer.estimatePartitionPruning("orders",
            QueryFilter.of(ColumnPredicate.eq("region", "N")));
        assertEquals(0, summary.estimatedPartitionsScanned());
        assertEquals(10, summary.totalPartitions());
        assertEquals(5, optimizer.estimatePartitionPruning("orders",
            QueryFilter.of(ColumnPredicate.lte("region", "M"))).estimatedPartitionsScanned());
        assertEquals(10, optimizer.estimatePartitionPruning("orders",
            QueryFilter.all()).estimatedPartitionsScanned());
    }

    @Test
    void testAggregationAndLimitOperators() {
        List<Aggregation> aggregations = List.of(Aggregation.count(), Aggregation.of(AggregationType.SUM, "amount"));

        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), aggregations, List.of("orders"), 10);

        List<PlanOperator> operators = plan.operators();
        assertEquals(OperatorType.AGGREGATE, operators.get(operators.size() - 2).type());
        PlanOperator limit = operators.get(operators.size() - 1);
        assertEquals(OperatorType.LIMIT, limit.type());
        assertEquals(1, limit.rowsOut());
    }

    @Test
    void testFilterOperatorUsesSelectivity() {
        when(statisticsCollector.statisticsFor("orders")).thenReturn(new TableStatistics("orders", 1_000_000, 10,
            100 * MB, Map.of("status", new ColumnStatistics("status", "STRING", 4, 0, "a", "d")), 0));

        ExecutionPlan plan = optimizer.optimize(QueryFilter.of(ColumnPredicate.eq("status", "a")), List.of(),
            List.of("orders"), 100);

        PlanOperator filter = plan.operators().get(1);
        assertEquals(OperatorType.FILTER, filter.type());
        assertEquals(0.25, filter.selectivity(), 1e-9);
        assertEquals(250_000, filter.rowsOut());
        assertEquals(100, plan.operators().get(2).rowsOut());
    }

    @Test
    void testPlanningFailureFallsBackToDefault() {
        when(statisticsCollector.statisticsFor("broken")).thenThrow(new IllegalStateException("catalog gone"));

        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("broken"), null);

        assertEquals("default_plan", plan.planId());
        assertEquals(25.0, plan.cost().total(), 1e-9);
        assertEquals(1000.0, plan.estimatedTimeMillis(), 1e-9);
        assertEquals(1, optimizer.statistics().fallbackPlans());
        assertEquals(0, optimizer.statistics().plansGenerated());
    }

    @Test
    void testFeedbackAdjustsCostModelAfterEnoughSamples() {
        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("orders"), null);
        double slow = plan.estimatedTimeMillis() * 2;

        for (int i = 0; i < 4; i++) {
            optimizer.recordExecution(plan, slow, 100, true);
        }
        assertEquals(1, optimizer.costModel().version());

        optimizer.recordExecution(plan, slow, 100, true);
        CostModel adjusted = optimizer.costModel();
        assertEquals(2, adjusted.version());
        assertEquals(0.001 * 1.1, adjusted.cpuPerRow(), 1e-12);
        assertEquals(0.1 * 1.1, adjusted.ioPerMb(), 1e-12);
        assertEquals(0.01, adjusted.memoryPerMb(), 1e-12);
        assertEquals(5, optimizer.statistics().executionHistory().get("sequential_plan"));
    }

    @Test
    void testFeedbackRatioIsClamped() {
        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("orders"), null);

        for (int i = 0; i < 5; i++) {
            optimizer.recordExecution(plan, plan.estimatedTimeMillis() * 100, 100, true);
        }

        assertEquals(0.001 * 1.1, optimizer.costModel().cpuPerRow(), 1e-12);
    }

    @Test
    void testFailedExecutionsIgnoredByFeedback() {
        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("orders"), null);

        for (int i = 0; i < 5; i++) {
            optimizer.recordExecution(plan, plan.estimatedTimeMillis() * 2, 0, false);
        }

        assertEquals(1, optimizer.costModel().version());
        assertEquals(5, optimizer.executionHistory("sequential_plan").size());
        assertTrue(optimizer.executionHistory("index_plan").isEmpty());
    }

    @Test
    void testPlansCarryCostModelVersion() {
        costModels.update(model -> model.adjustedBy(1.5));

        ExecutionPlan plan = optimizer.optimize(QueryFilter.all(), List.of(), List.of("orders"), null);

        assertEquals(2, plan.costModelVersion());
        assertEquals(1, optimizer.statistics().plansGenerated());
    }
}
