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

import java.util.Map;

/**
 * Read-only snapshot of the optimizer.
 *
 * @param executionHistory plan id to number of recorded executions
 */
public record OptimizerStatistics(
    int tablesAnalyzed,
    CostModel costModel,
    Map<String, Integer> executionHistory,
    long plansGenerated,
    long fallbackPlans
) {

    public OptimizerStatistics {
        executionHistory = Map.copyOf(executionHistory);
    }
}
