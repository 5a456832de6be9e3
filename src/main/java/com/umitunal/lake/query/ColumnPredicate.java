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

import java.util.List;

/**
 * A single condition on one column.
 * The set of variants is closed; every consumer handles all of them through {@link Visitor}.
 */
public sealed interface ColumnPredicate
    permits ColumnPredicate.Eq, ColumnPredicate.Gt, ColumnPredicate.Gte, ColumnPredicate.Lt,
            ColumnPredicate.Lte, ColumnPredicate.In, ColumnPredicate.Like {

    /**
     * @return the column this predicate applies to
     */
    String column();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over the predicate variants.
     *
     * @param <R> the result type
     */
    interface Visitor<R> {
        R visitEq(Eq predicate);

        R visitGt(Gt predicate);

        R visitGte(Gte predicate);

        R visitLt(Lt predicate);

        R visitLte(Lte predicate);

        R visitIn(In predicate);

        R visitLike(Like predicate);
    }

    static Eq eq(String column, Object value) {
        return new Eq(column, value);
    }

    static Gt gt(String column, Object value) {
        return new Gt(column, value);
    }

    static Gte gte(String column, Object value) {
        return new Gte(column, value);
    }

    static Lt lt(String column, Object value) {
        return new Lt(column, value);
    }

    static Lte lte(String column, Object value) {
        return new Lte(column, value);
    }

    static In in(String column, List<?> values) {
        return new In(column, List.copyOf(values));
    }

    static Like like(String column, String pattern) {
        return new Like(column, pattern);
    }

    private static void requireColumn(String column) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be blank");
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("comparison value must not be null");
        }
    }

    /**
     * Equality; a null value matches null cells.
     */
    record Eq(String column, Object value) implements ColumnPredicate {
        public Eq {
            requireColumn(column);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEq(this);
        }

        @Override
        public String toString() {
            return column + " = " + value;
        }
    }

    record Gt(String column, Object value) implements ColumnPredicate {
        public Gt {
            requireColumn(column);
            requireValue(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGt(this);
        }

        @Override
        public String toString() {
            return column + " > " + value;
        }
    }

    record Gte(String column, Object value) implements ColumnPredicate {
        public Gte {
            requireColumn(column);
            requireValue(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGte(this);
        }

        @Override
        public String toString() {
            return column + " >= " + value;
        }
    }

    record Lt(String column, Object value) implements ColumnPredicate {
        public Lt {
            requireColumn(column);
            requireValue(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLt(this);
        }

        @Override
        public String toString() {
            return column + " < " + value;
        }
    }

    record Lte(String column, Object value) implements ColumnPredicate {
        public Lte {
            requireColumn(column);
            requireValue(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLte(this);
        }

        @Override
        public String toString() {
            return column + " <= " + value;
        }
    }

    record In(String column, List<Object> values) implements ColumnPredicate {
        public In {
            requireColumn(column);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("IN requires at least one value");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIn(this);
        }

        @Override
        public String toString() {
            return column + " IN " + values;
        }
    }

    /**
     * SQL-style pattern: {@code %} matches any run, {@code _} one character.
     * A pattern without wildcards matches as a substring.
     */
    record Like(String column, String pattern) implements ColumnPredicate {
        public Like {
            requireColumn(column);
            if (pattern == null) {
                throw new IllegalArgumentException("pattern must not be null");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLike(this);
        }

        @Override
        public String toString() {
            return column + " LIKE '" + pattern + "'";
        }
    }
}
