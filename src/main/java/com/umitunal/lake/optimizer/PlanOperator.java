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
 * One step of an execution plan.
 *
 * @param sourceId source the operator works on, null for operators over every source
 * @param rowsOut estimated rows produced
 * @param selectivity estimated fraction of rows kept, 1 for operators that do not filter
 */
public record PlanOperator(OperatorType type, String sourceId, PlanCost cost, long rowsOut, double selectivity) {

    public static PlanOperator scan(String sourceId, PlanCost cost, long rowsOut) {
        return new PlanOperator(OperatorType.SCAN, sourceId, cost, rowsOut, 1.0);
    }

    public static PlanOperator filter(String sourceId, PlanCost cost, long rowsOut, double selectivity) {
        return new PlanOperator(OperatorType.FILTER, sourceId, cost, rowsOut, selectivity);
    }

    public static PlanOperator aggregate(PlanCost cost) {
        return new PlanOperator(OperatorType.AGGREGATE, null, cost, 1, 1.0);
    }

    public static PlanOperator limit(long rowsOut) {
        return new PlanOperator(OperatorType.LIMIT, null, PlanCost.ZERO, rowsOut, 1.0);
    }
}
