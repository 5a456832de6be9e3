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

/**
 * One aggregate to compute.
 *
 * @param type the function
 * @param column the input column, or "*" for COUNT over rows
 * @param alias the result name; defaults to {@code <type>_<column>}
 */
public record Aggregation(AggregationType type, String column, String alias) {

    public Aggregation {
        if (type == null) {
            throw new IllegalArgumentException("aggregation type must not be null");
        }
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("aggregation column must not be blank");
        }
        if ("*".equals(column) && type != AggregationType.COUNT) {
            throw new IllegalArgumentException(type + " requires a column");
        }
        if (alias == null || alias.isBlank()) {
            alias = type.name().toLowerCase() + "_" + ("*".equals(column) ? "all" : column);
        }
    }

    public static Aggregation count() {
        return new Aggregation(AggregationType.COUNT, "*", null);
    }

    public static Aggregation of(AggregationType type, String column) {
        return new Aggregation(type, column, null);
    }

    public boolean countsRows() {
        return "*".equals(column);
    }
}
