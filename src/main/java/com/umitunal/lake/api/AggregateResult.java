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

package com.umitunal.lake.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregation values keyed by alias, merged over every source that answered.
 *
 * @param values alias to value; null for an aggregation without input
 * @param errors source id to error message for sources that failed
 */
public record AggregateResult(Map<String, Object> values, Map<String, String> errors) {

    public AggregateResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        errors = Map.copyOf(errors);
    }

    public Object get(String alias) {
        return values.get(alias);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
