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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the CostModel and CostModelRegistry classes.
 */
class CostModelTest {

    @Test
    void testAdjustedByMovesCpuAndIoOnly() {
        CostModel model = CostModel.getDefault();

        CostModel faster = model.adjustedBy(0.5);

        assertEquals(2, faster.version());
        assertEquals(0.001 * 0.95, faster.cpuPerRow(), 1e-12);
        assertEquals(0.1 * 0.95, faster.ioPerMb(), 1e-12);
        assertEquals(model.memoryPerMb(), faster.memoryPerMb());
        assertEquals(model.indexBenefit(), faster.indexBenefit());
        assertEquals(model.partitionPruning(), faster.partitionPruning());
    }

    @Test
    void testRegistryUpdateReplacesCurrent() {
        CostModelRegistry registry = new CostModelRegistry(CostModel.getDefault());

        CostModel next = registry.update(model -> model.adjustedBy(2.0));

        assertSame(next, registry.current());
        assertEquals(2, registry.current().version());
        assertEquals(0.001 * 1.1, registry.current().cpuPerRow(), 1e-12);
    }
}
