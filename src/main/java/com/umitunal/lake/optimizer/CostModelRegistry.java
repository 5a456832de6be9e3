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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * Holds the current cost model. {@link #update} is the only way to change it.
 */
public class CostModelRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CostModelRegistry.class);

    private volatile CostModel current;

    public CostModelRegistry(CostModel initial) {
        this.current = initial;
    }

    public CostModel current() {
        return current;
    }

    public synchronized CostModel update(UnaryOperator<CostModel> change) {
        CostModel previous = current;
        CostModel next = change.apply(previous);
        current = next;
        logger.info("Cost model updated to version " + next.version() + " (cpuPerRow=" + next.cpuPerRow()
            + ", ioPerMb=" + next.ioPerMb() + ")");
        return next;
    }
}
