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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds rows into one {@link AggregateState} per requested aggregation.
 */
public final class AggregationAccumulator {

    private final Map<String, AggregateState> states = new LinkedHashMap<>();

    public AggregationAccumulator(List<Aggregation> aggregations) {
        for (Aggregation aggregation : aggregations) {
            if (states.putIfAbsent(aggregation.alias(), new AggregateState(aggregation)) != null) {
                throw new IllegalArgumentException("Duplicate aggregation alias: " + aggregation.alias());
            }
        }
    }

    public void accept(Map<String, Object> row) {
        for (AggregateState state : states.values()) {
            state.accept(row);
        }
    }

    public void merge(AggregationAccumulator other) {
        for (Map.Entry<String, AggregateState> entry : other.states.entrySet()) {
            AggregateState mine = states.get(entry.getKey());
            if (mine == null) {
                throw new IllegalArgumentException("Unknown aggregation alias: " + entry.getKey());
            }
            mine.merge(entry.getValue());
        }
    }

    /**
     * @return alias to final value, in request order
     */
    public Map<String, Object> results() {
        Map<String, Object> results = new LinkedHashMap<>();
        states.forEach((alias, state) -> results.put(alias, state.result()));
        return results;
    }
}
