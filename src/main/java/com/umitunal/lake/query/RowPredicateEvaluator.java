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

import java.util.Map;

/**
 * Evaluates a predicate against one row.
 * A missing column behaves like a null cell; values that cannot be compared do not match.
 */
final class RowPredicateEvaluator implements ColumnPredicate.Visitor<Boolean> {

    private static final ValueComparator COMPARATOR = ValueComparator.INSTANCE;

    private final Map<String, Object> row;

    private RowPredicateEvaluator(Map<String, Object> row) {
        this.row = row;
    }

    static boolean test(ColumnPredicate predicate, Map<String, Object> row) {
        try {
            return predicate.accept(new RowPredicateEvaluator(row));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public Boolean visitEq(ColumnPredicate.Eq predicate) {
        return COMPARATOR.equalValues(row.get(predicate.column()), predicate.value());
    }

    @Override
    public Boolean visitGt(ColumnPredicate.Gt predicate) {
        Object cell = row.get(predicate.column());
        return cell != null && COMPARATOR.compare(cell, predicate.value()) > 0;
    }

    @Override
    public Boolean visitGte(ColumnPredicate.Gte predicate) {
        Object cell = row.get(predicate.column());
        return cell != null && COMPARATOR.compare(cell, predicate.value()) >= 0;
    }

    @Override
    public Boolean visitLt(ColumnPredicate.Lt predicate) {
        Object cell = row.get(predicate.column());
        return cell != null && COMPARATOR.compare(cell, predicate.value()) < 0;
    }

    @Override
    public Boolean visitLte(ColumnPredicate.Lte predicate) {
        Object cell = row.get(predicate.column());
        return cell != null && COMPARATOR.compare(cell, predicate.value()) <= 0;
    }

    @Override
    public Boolean visitIn(ColumnPredicate.In predicate) {
        return COMPARATOR.contains(predicate.values(), row.get(predicate.column()));
    }

    @Override
    public Boolean visitLike(ColumnPredicate.Like predicate) {
        Object cell = row.get(predicate.column());
        return cell != null && LikePattern.matches(predicate.pattern(), cell.toString());
    }
}
