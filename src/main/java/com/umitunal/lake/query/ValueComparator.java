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

import java.util.Collection;
import java.util.Comparator;

/**
 * Orders cell values across the types a column file can hold.
 * Numbers compare numerically regardless of their boxed type, so an {@code Integer}
 * from a query and a {@code Long} read from disk are equal when their values are.
 */
public final class ValueComparator implements Comparator<Object> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    private ValueComparator() {
    }

    /**
     * @throws IllegalArgumentException if either value is null or the two types are not comparable
     */
    @Override
    public int compare(Object left, Object right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Cannot order null values");
        }
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return Boolean.compare(l, r);
        }
        throw new IllegalArgumentException("Cannot compare " + left.getClass().getSimpleName()
            + " with " + right.getClass().getSimpleName());
    }

    /**
     * Null-aware equality that never throws; values of incomparable types are unequal.
     */
    public boolean equalValues(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        try {
            return compare(left, right) == 0;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean contains(Collection<?> values, Object candidate) {
        for (Object value : values) {
            if (equalValues(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer
            || number instanceof Short || number instanceof Byte;
    }
}
