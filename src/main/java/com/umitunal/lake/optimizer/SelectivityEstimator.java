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

/**
 * Estimates the fraction of rows a filter keeps from sampled column statistics.
 */
public final class SelectivityEstimator {

    static final double MIN_SELECTIVITY = 0.001;
    static final double UNKNOWN_COLUMN = 0.5;
    static final double RANGE = 0.3;
    static final double LIKE = 0.2;

    private SelectivityEstimator() {
    }

    /**
     * @return the product of the per-predicate estimates, never below {@value #MIN_SELECTIVITY}
     */
    public static double estimate(QueryFilter filter, TableStatistics statistics) {
        double selectivity = 1.0;
        for (ColumnPredicate predicate : filter.predicates()) {
            ColumnStatistics column = statistics == null ? null : statistics.column(predicate.column());
            selectivity *= column == null ? UNKNOWN_COLUMN : predicate.accept(new PredicateSelectivity(column));
        }
        return Math.max(selectivity, MIN_SELECTIVITY);
    }

    private record PredicateSelectivity(ColumnStatistics column) implements ColumnPredicate.Visitor<Double> {

        private int distinct() {
            return Math.max(column.distinctCount(), 1);
        }

        @Override
        public Double visitEq(ColumnPredicate.Eq predicate) {
            return 1.0 / distinct();
        }

        @Override
        public Double visitGt(ColumnPredicate.Gt predicate) {
            return RANGE;
        }

        @Override
        public Double visitGte(ColumnPredicate.Gte predicate) {
            return RANGE;
        }

        @Override
        public Double visitLt(ColumnPredicate.Lt predicate) {
            return RANGE;
        }

        @Override
        public Double visitLte(ColumnPredicate.Lte predicate) {
            return RANGE;
        }

        @Override
        public Double visitIn(ColumnPredicate.In predicate) {
            return Math.min((double) predicate.values().size() / distinct(), 1.0);
        }

        @Override
        public Double visitLike(ColumnPredicate.Like predicate) {
            return LIKE;
        }
    }
}
