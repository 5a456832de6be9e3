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

import com.umitunal.lake.query.ColumnPredicate;
import com.umitunal.lake.query.QueryFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SelectivityEstimator class.
 */
class SelectivityEstimatorTest {
    private TableStatistics statistics;

    @BeforeEach
    void setUp() {
        statistics = new TableStatistics("orders", 1000, 1, 1024, Map.of(
            "status", new ColumnStatistics("status", "STRING", 50, 0, "a", "z"),
            "amount", new ColumnStatistics("amount", "LONG", 1000, 0, 1L, 1000L),
            "empty", new ColumnStatistics("empty", "STRING", 0, 10, null, null)), 0);
    }

    private double estimate(ColumnPredicate... predicates) {
        return SelectivityEstimator.estimate(QueryFilter.of(predicates), statistics);
    }

    @Test
    void testEmptyFilterKeepsEverything() {
        assertEquals(1.0, SelectivityEstimator.estimate(QueryFilter.all(), statistics), 1e-12);
    }

    @Test
    void testPredicateEstimates() {
        assertEquals(0.02, estimate(ColumnPredicate.eq("status", "a")), 1e-12);
        assertEquals(0.3, estimate(ColumnPredicate.gt("amount", 5)), 1e-12);
        assertEquals(0.3, estimate(ColumnPredicate.lte("amount", 5)), 1e-12);
        assertEquals(0.2, estimate(ColumnPredicate.like("status", "a%")), 1e-12);
        assertEquals(0.06, estimate(ColumnPredicate.in("status", List.of("a", "b", "c"))), 1e-12);
        assertEquals(0.5, estimate(ColumnPredicate.eq("unknown", 1)), 1e-12);
    }

    @Test
    void testInNeverExceedsOne() {
        assertEquals(1.0, estimate(ColumnPredicate.in("empty", List.of("a", "b"))), 1e-12);
    }

    @Test
    void testZeroDistinctTreatedAsOne() {
        assertEquals(1.0, estimate(ColumnPredicate.eq("empty", "a")), 1e-12);
    }

    @Test
    void testPredicatesMultiply() {
        assertEquals(0.02 * 0.3, estimate(ColumnPredicate.eq("status", "a"), ColumnPredicate.gt("amount", 5)), 1e-12);
    }

    @Test
    void testSelectivityHasFloor() {
        double result = estimate(ColumnPredicate.eq("amount", 1), ColumnPredicate.eq("status", "a"));
        assertEquals(0.001, result, 1e-12);
    }

    @Test
    void testMissingStatistics() {
        assertEquals(0.25, SelectivityEstimator.estimate(
            QueryFilter.of(ColumnPredicate.eq("a", 1), ColumnPredicate.eq("b", 2)), null), 1e-12);
    }
}
