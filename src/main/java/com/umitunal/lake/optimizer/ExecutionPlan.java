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

import java.util.List;
import java.util.Map;

/**
 * A costed query execution plan.
 *
 * @param planId id execution feedback is recorded under
 * @param estimatedTimeMillis rough latency estimate derived from the total cost
 * @param parallelism number of sources scanned concurrently
 * @param indexUsage {@code source.column} pairs the plan relies on
 * @param filePruning per-source partition pruning estimates
 * @param costModelVersion version of the cost model the plan was costed with
 */
public record ExecutionPlan(
    String planId,
    PlanType type,
    List<PlanOperator> operators,
    PlanCost cost,
    double estimatedTimeMillis,
    int parallelism,
    List<String> indexUsage,
    Map<String, PruningSummary> filePruning,
    long costModelVersion
) {

    public ExecutionPlan {
        operators = List.copyOf(operators);
        indexUsage = List.copyOf(indexUsage);
        filePruning = Map.copyOf(filePruning);
    }
}
