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

package com.umitunal.lake.core.scaling;

/**
 * A cache that can shrink when the auto-scaler detects memory pressure.
 */
public interface MemoryPressureListener {

    /**
     * Called when memory usage is above the high-water mark. Implementations should drop what they can.
     *
     * @param memoryPercent the observed memory usage
     */
    void onMemoryPressure(double memoryPercent);

    /**
     * Called every cycle with the memory budget the cache should stay within.
     */
    void onCacheBudget(long budgetBytes);
}
