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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A conjunction of column predicates. An empty filter matches every row.
 */
public final class QueryFilter {

    private static final QueryFilter ALL = new QueryFilter(List.of());

    private final List<ColumnPredicate> predicates;

    private QueryFilter(List<ColumnPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public static QueryFilter all() {
        return ALL;
    }

    public static QueryFilter of(ColumnPredicate... predicates) {
        return new QueryFilter(Arrays.asList(predicates));
    }

    public static QueryFilter of(List<ColumnPredicate> predicates) {
        return new QueryFilter(predicates);
    }

    public QueryFilter and(ColumnPredicate predicate) {
        List<ColumnPredicate> combined = new ArrayList<>(predicates);
        combined.add(predicate);
        return new QueryFilter(combined);
    }

    public List<ColumnPredicate> predicates() {
        return predicates;
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    /**
     * @return the distinct columns referenced, in first-seen order
     */
    public Set<String> columns() {
        Set<String> columns = new LinkedHashSet<>();
        for (ColumnPredicate predicate : predicates) {
            columns.add(predicate.column());
        }
        return columns;
    }

    /**
     * Columns a file must carry to hold a matching row. A predicate that a null cell satisfies,
     * such as equality with null, is left out because files without the column can still match.
     *
     * @return the required columns, in first-seen order
     */
    public Set<String> requiredColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (ColumnPredicate predicate : predicates) {
            if (!RowPredicateEvaluator.test(predicate, Map.of())) {
                columns.add(predicate.column());
            }
        }
        return columns;
    }

    public boolean matches(Map<String, Object> row) {
        for (ColumnPredicate predicate : predicates) {
            if (!RowPredicateEvaluator.test(predicate, row)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QueryFilter other && predicates.equals(other.predicates);
    }

    @Override
    public int hashCode() {
        return predicates.hashCode();
    }

    @Override
    public String toString() {
        return predicates.isEmpty() ? "TRUE" : String.join(" AND ", predicates.stream().map(Object::toString).toList());
    }
}
