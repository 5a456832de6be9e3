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

/**
 * Sampled statistics of one column.
 *
 * @param distinctCount distinct values seen in the sample, capped by the sample limit
 * @param minValue smallest sampled value, null if none
 * @param maxValue largest sampled value, null if none
 */
public record ColumnStatistics(
    String column,
    String dataType,
    int distinctCount,
    long nullCount,
    Object minValue,
    Object maxValue
) {
}
