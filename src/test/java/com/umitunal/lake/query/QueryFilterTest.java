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
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryFilter and row-level predicate evaluation.
 */
class QueryFilterTest {

    private static final Map<String, Object> ROW = Map.of(
        "id", 7L,
        "amount", 12.5,
        "region", "north",
        "active", true);

    @Test
    void testEmptyFilterMatchesEverything() {
        assertTrue(QueryFilter.all().matches(ROW));
        assertTrue(QueryFilter.all().matches(Map.of()));
        assertTrue(QueryFilter.all().isEmpty());
        assertEquals("TRUE", QueryFilter.all().toString());
    }

    @Test
    void testComparisonsAcrossNumericTypes() {
        assertTrue(QueryFilter.of(ColumnPredicate.eq("id", 7)).matches(ROW));
        assertTrue(QueryFilter.of(ColumnPredicate.eq("id", 7.0)).matches(ROW));
        assertTrue(QueryFilter.of(ColumnPredicate.gt("amount", 12)).matches(ROW));
        assertFalse(QueryFilter.of(ColumnPredicate.gte("amount", 13)).matches(ROW));
        assertTrue(QueryFilter.of(ColumnPredicate.lt("id", 8L)).matches(ROW));
        assertTrue(QueryFilter.of(ColumnPredicate.lte("id", 7)).matches(ROW));
    }

    @Test
    void testConjunction() {
        QueryFilter filter = QueryFilter.of(ColumnPredicate.eq("region", "north"))
            .and(ColumnPredicate.gt("amount", 10));
        assertTrue(filter.matches(ROW));
        assertFalse(filter.and(ColumnPredicate.eq("active", false)).matches(ROW));
        assertEquals(Set.of("region", "amount"), filter.columns());
    }

    @Test
    void testMissingColumnAndIncomparableValues() {
        assertFalse(QueryFilter.of(ColumnPredicate.gt("missing", 1)).matches(ROW));
        assertTrue(QueryFilter.of(ColumnPredicate.eq("missing", null)).matches(ROW));
        // a string never orders against a number
        assertFalse(QueryFilter.of(ColumnPredicate.gt("region", 1)).matches(ROW));
        assertFalse(QueryFilter.of(ColumnPredicate.eq("region", 1)).matches(ROW));
    }

    @Test
    void testInPredicate() {
        assertTrue(QueryFilter.of(ColumnPredicate.in("region", List.of("south", "north"))).matches(ROW));
        assertFalse(QueryFilter.of(ColumnPredicate.in("region", List.of("south"))).matches(ROW));
        assertTrue(QueryFilter.of(ColumnPredicate.in("id", List.of(1, 7))).matches(ROW));
        assertThrows(IllegalArgumentException.class, () -> ColumnPredicate.in("id", List.of()));
    }

    @Test
    void testLikePatterns() {
        assertTrue(LikePattern.matches("nor%", "north"));
        assertTrue(LikePattern.matches("%th", "north"));
        assertTrue(LikePattern.matches("n_rth", "north"));
        assertFalse(LikePattern.matches("n_th", "north"));
        // without wildcards the pattern matches as a substring
        assertTrue(LikePattern.matches("ort", "north"));
        // regex metacharacters are literal
        assertTrue(LikePattern.matches("a.b%", "a.bc"));
        assertFalse(LikePattern.matches("a.b%", "axbc"));
        assertFalse(LikePattern.matches("%", null));
    }

    @Test
    void testLikeOnNonStringCell() {
        Map<String, Object> row = new HashMap<>();
        row.put("code", 12345L);
        assertTrue(QueryFilter.of(ColumnPredicate.like("code", "123%")).matches(row));
        assertFalse(QueryFilter.of(ColumnPredicate.like("other", "%")).matches(row));
    }

    @Test
    void testComparisonRequiresValue() {
        assertThrows(IllegalArgumentException.class, () -> ColumnPredicate.gt("id", null));
        assertThrows(IllegalArgumentException.class, () -> ColumnPredicate.eq(" ", 1));
    }

    @Test
    void testRequiredColumnsSkipNullEquality() {
        QueryFilter filter = QueryFilter.of(ColumnPredicate.eq("region", null), ColumnPredicate.gt("id", 1),
            ColumnPredicate.eq("status", "open"), ColumnPredicate.like("note", "%"));

        assertEquals(Set.of("region", "id", "status", "note"), filter.columns());
        assertEquals(Set.of("id", "status", "note"), filter.requiredColumns());
        assertTrue(QueryFilter.all().requiredColumns().isEmpty());
    }
}
