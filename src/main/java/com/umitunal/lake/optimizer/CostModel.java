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
 * Immutable cost factors. Every adjustment produces a new version.
 *
 * @param cpuPerRow cost of processing one row
 * @param ioPerMb cost of reading one megabyte
 * @param memoryPerMb cost of holding one megabyte
 * @param networkPerMb cost of moving one megabyte
 * @param indexBenefit multiplier applied to cpu and io when an index helps
 * @param partitionPruning weight of the pruned partition ratio
 */
public record CostModel(
    long version,
    double cpuPerRow,
    double ioPerMb,
    double memoryPerMb,
    double networkPerMb,
    double indexBenefit,
    double partitionPruning
) {

    public static CostModel getDefault() {
        return new CostModel(1, 0.001, 0.1, 0.01, 0.05, 0.8, 0.7);
    }

    /**
     * Moves the cpu and io factors by a tenth of the observed deviation.
     *
     * @param ratio observed over estimated time, already clamped
     */
    public CostModel adjustedBy(double ratio) {
        double step = 1.0 + (ratio - 1.0) * 0.1;
        return new CostModel(version + 1, cpuPerRow * step, ioPerMb * step, memoryPerMb, networkPerMb,
            indexBenefit, partitionPruning);
    }
}
