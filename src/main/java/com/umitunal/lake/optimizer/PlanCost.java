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
 * Estimated cost of a plan or operator, in abstract cost units.
 */
public record PlanCost(double cpu, double io, double memory, double network, double total) {

    public static final PlanCost ZERO = new PlanCost(0, 0, 0, 0, 0);

    /**
     * Creates a cost whose total is the sum of its components.
     */
    public static PlanCost of(double cpu, double io, double memory, double network) {
        return new PlanCost(cpu, io, memory, network, cpu + io + memory + network);
    }

    public PlanCost plus(PlanCost other) {
        return of(cpu + other.cpu, io + other.io, memory + other.memory, network + other.network);
    }
}
