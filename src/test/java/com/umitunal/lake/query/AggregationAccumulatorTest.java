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

package com.umitunal.lake.query;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the AggregationAccumulator class.
 */
class AggregationAccumulatorTest {

    private static Map<String, Object> row(String column, Object value) {
        Map<String, Object> row = new HashMap<>();
        row.put(column, value);
        return row;
    }

    @Test
    void testAllFunctions() {
        List<Aggregation> aggregations = List.of(
            Aggregation.count(),
            Aggregation.of(AggregationType.COUNT, "amount"),
            Aggregation.of(AggregationType.SUM, "amount"),
            Aggregation.of(AggregationType.AVG, "amount"),
            Aggregation.of(AggregationType.MIN, "amount"),
            Aggregation.of(AggregationType.MAX, "amount"));
        AggregationAccumulator accumulator = new AggregationAccumulator(aggregations);

        accumulator.accept(row("amount", 10L));
        accumulator.accept(row("amount", 30L));
        accumulator.accept(row("amount", null));
        accumulator.accept(row("other", 1L));

        Map<String, Object> results = accumulator.results();
        assertEquals(List.of("count_all", "count_amount", "sum_amount", "avg_amount", "min_amount", "max_amount"),
            List.copyOf(results.keySet()));
        assertEquals(4L, results.get("count_all"));
        assertEquals(2L, results.get("count_amount"));
        assertEquals(40L, results.get("sum_amount"));
        assertEquals(20.0, results.get("avg_amount"));
        assertEquals(10L, results.get("min_amount"));
        assertEquals(30L, results.get("max_amount"));
    }

    @Test
    void testEmptyInput() {
        AggregationAccumulator accumulator = new AggregationAccumulator(List.of(
            Aggregation.count(),
            Aggregation.of(AggregationType.SUM, "x"),
            Aggregation.of(AggregationType.AVG, "x"),
            Aggregation.of(AggregationType.MAX, "x")));

        Map<String, Object> results = accumulator.results();

        assertEquals(0L, results.get("count_all"));
        assertNull(results.get("sum_x"));
        assertNull(results.get("avg_x"));
        assertNull(results.get("max_x"));
    }

    @Test
    void testMergeComputesGlobalAverage() {
        List<Aggregation> aggregations = List.of(
            Aggregation.of(AggregationType.AVG, "v"),
            Aggregation.of(AggregationType.MIN, "v"));
        AggregationAccumulator first = new AggregationAccumulator(aggregations);
        first.accept(row("v", 1L));
        AggregationAccumulator second = new AggregationAccumulator(aggregations);
        second.accept(row("v", 2L));
        second.accept(row("v", 3L));
        second.accept(row("v", 4L));

        first.merge(second);

        // (1 + 2 + 3 + 4) / 4 rather than the mean of the two partial averages
        assertEquals(2.5, first.results().get("avg_v"));
        assertEquals(1L, first.results().get("min_v"));
    }

    @Test
    void testFractionalSum() {
        AggregationAccumulator accumulator = new AggregationAccumulator(List.of(
            Aggregation.of(AggregationType.SUM, "v")));
        accumulator.accept(row("v", 1L));
        accumulator.accept(row("v", 0.5));

        assertEquals(1.5, accumulator.results().get("sum_v"));
    }

    @Test
    void testStringExtremes() {
        AggregationAccumulator accumulator = new AggregationAccumulator(List.of(
            Aggregation.of(AggregationType.MIN, "region"),
            Aggregation.of(AggregationType.MAX, "region")));
        for (String region : List.of("N", "S", "E", "W")) {
            accumulator.accept(row("region", region));
        }

        assertEquals("E", accumulator.results().get("min_region"));
        assertEquals("W", accumulator.results().get("max_region"));
    }

    @Test
    void testInvalidAggregations() {
        assertThrows(IllegalArgumentException.class, () -> new Aggregation(AggregationType.SUM, "*", null));
        assertThrows(IllegalArgumentException.class, () -> new AggregationAccumulator(List.of(
            Aggregation.of(AggregationType.SUM, "v"), Aggregation.of(AggregationType.SUM, "v"))));
    }

    @Test
    void testLongSumBeyondRangeFallsBackToDouble() {
        List<Aggregation> sum = List.of(Aggregation.of(AggregationType.SUM, "amount"));
        AggregationAccumulator accumulator = new AggregationAccumulator(sum);

        accumulator.accept(row("amount", Long.MAX_VALUE));
        accumulator.accept(row("amount", 1L));

        Object result = accumulator.results().get("sum_amount");
        assertInstanceOf(Double.class, result);
        assertEquals(9.223372036854775808E18, (Double) result);
    }

    @Test
    void testMergedLongSumBeyondRangeFallsBackToDouble() {
        List<Aggregation> sum = List.of(Aggregation.of(AggregationType.SUM, "amount"));
        AggregationAccumulator first = new AggregationAccumulator(sum);
        AggregationAccumulator second = new AggregationAccumulator(sum);
        first.accept(row("amount", Long.MAX_VALUE));
        second.accept(row("amount", Long.MAX_VALUE));

        first.merge(second);

        Object result = first.results().get("sum_amount");
        assertInstanceOf(Double.class, result);
        assertTrue((Double) result > 0);

        AggregationAccumulator small = new AggregationAccumulator(sum);
        small.accept(row("amount", -5L));
        small.accept(row("amount", 7));
        assertEquals(2L, small.results().get("sum_amount"));
    }
}
