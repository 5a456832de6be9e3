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
 * Candidate plan shapes, in generation order.
 */
public enum PlanType {
    SEQUENTIAL("sequential_plan"),
    PARALLEL("parallel_plan"),
    INDEX("index_plan"),
    PARTITION_PRUNED("partition_pruned_plan"),
    DEFAULT("default_plan");

    private final String planId;

    PlanType(String planId) {
        this.planId = planId;
    }

    /**
     * @return the id execution feedback is grouped under
     */
    public String planId() {
        return planId;
    }
}
