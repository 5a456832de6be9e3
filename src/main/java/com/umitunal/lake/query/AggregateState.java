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
 * Partial state of one aggregate. States fold rows and merge with each other,
 * so AVG over several files or sources is the total sum over the total count.
 */
public final class AggregateState {

    private static final ValueComparator COMPARATOR = ValueComparator.INSTANCE;

    private final Aggregation aggregation;
    private long count;
    private double sum;
    private boolean integralSum = true;
    private long longSum;
    private Object extreme;

    public AggregateState(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    public void accept(Map<String, Object> row) {
        if (aggregation.countsRows()) {
            count++;
            return;
        }
        Object value = row.get(aggregation.column());
        if (value == null) {
            return;
        }
        switch (aggregation.type()) {
            case COUNT -> count++;
            case SUM, AVG -> {
                if (value instanceof Number number) {
                    addNumber(number);
                }
            }
            case MIN, MAX -> acceptExtreme(value);
        }
    }

    // values of a type that cannot be ordered against the current extreme are ignored
    private void acceptExtreme(Object value) {
        count++;
        if (extreme == null) {
            extreme = value;
            return;
        }
        try {
            int cmp = COMPARATOR.compare(value, extreme);
            if (aggregation.type() == AggregationType.MIN ? cmp < 0 : cmp > 0) {
                extreme = value;
            }
        } catch (IllegalArgumentException e) {
            count--;
        }
    }

    private void addNumber(Number number) {
        count++;
        sum += number.doubleValue();
        if (number instanceof Long || number instanceof Integer) {
            addToLongSum(number.longValue());
        } else {
            integralSum = false;
        }
    }

    // an exact sum that leaves the long range falls back to the double sum
    private void addToLongSum(long value) {
        if (!integralSum) {
            return;
        }
        try {
            longSum = Math.addExact(longSum, value);
        } catch (ArithmeticException e) {
            integralSum = false;
        }
    }

    public void merge(AggregateState other) {
        if (!aggregation.equals(other.aggregation)) {
            throw new IllegalArgumentException("Cannot merge " + other.aggregation + " into " + aggregation);
        }
        count += other.count;
        sum += other.sum;
        integralSum &= other.integralSum;
        addToLongSum(other.longSum);
        if (other.extreme != null) {
            long before = count;
            acceptExtreme(other.extreme);
            count = before;
        }
    }

    /**
     * @return the final value; null for SUM, AVG, MIN and MAX over no values
     */
    public Object result() {
        return switch (aggregation.type()) {
            case COUNT -> count;
            case SUM -> count == 0 ? null : (integralSum ? (Object) longSum : (Object) sum);
            case AVG -> count == 0 ? null : sum / count;
            case MIN, MAX -> extreme;
        };
    }

    public long count() {
        return count;
    }
}
