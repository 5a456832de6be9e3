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

package com.umitunal.lake.index;

import com.umitunal.lake.query.ColumnPredicate;
import com.umitunal.lake.query.ValueComparator;

/**
 * Decides from a column index entry whether a file may contain a row matching a predicate.
 * Answers may be false positives, never false negatives.
 */
final class IndexPruner implements ColumnPredicate.Visitor<Boolean> {

    private static final ValueComparator COMPARATOR = ValueComparator.INSTANCE;

    private final ColumnIndexEntry entry;

    private IndexPruner(ColumnIndexEntry entry) {
        this.entry = entry;
    }

    /**
     * @return false only if no row of the file can satisfy the predicate; any evaluation error answers true
     */
    static boolean mayMatch(ColumnIndexEntry entry, ColumnPredicate predicate) {
        try {
            return predicate.accept(new IndexPruner(entry));
        } catch (RuntimeException e) {
            return true;
        }
    }

    @Override
    public Boolean visitEq(ColumnPredicate.Eq predicate) {
        return mayContain(predicate.value());
    }

    @Override
    public Boolean visitGt(ColumnPredicate.Gt predicate) {
        return entry.maxValue() != null && COMPARATOR.compare(entry.maxValue(), predicate.value()) > 0;
    }

    @Override
    public Boolean visitGte(ColumnPredicate.Gte predicate) {
        return entry.maxValue() != null && COMPARATOR.compare(entry.maxValue(), predicate.value()) >= 0;
    }

    @Override
    public Boolean visitLt(ColumnPredicate.Lt predicate) {
        return entry.minValue() != null && COMPARATOR.compare(entry.minValue(), predicate.value()) < 0;
    }

    @Override
    public Boolean visitLte(ColumnPredicate.Lte predicate) {
        return entry.minValue() != null && COMPARATOR.compare(entry.minValue(), predicate.value()) <= 0;
    }

    @Override
    public Boolean visitIn(ColumnPredicate.In predicate) {
        for (Object value : predicate.values()) {
            if (mayContain(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitLike(ColumnPredicate.Like predicate) {
        return true;
    }

    private boolean mayContain(Object value) {
        if (value == null) {
            return entry.nullCount() > 0;
        }
        if (entry.hasUniqueValues()) {
            return COMPARATOR.contains(entry.uniqueValues(), value);
        }
        if (entry.minValue() == null || entry.maxValue() == null) {
            return false;
        }
        return COMPARATOR.compare(entry.minValue(), value) <= 0 && COMPARATOR.compare(value, entry.maxValue()) <= 0;
    }
}
