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

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads host metrics from the platform operating system MXBean.
 * Falls back to JVM heap figures when the extended bean is not available.
 */
public class JmxSystemMetricsProvider implements SystemMetricsProvider {

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public double cpuPercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean extended) {
            double load = extended.getCpuLoad();
            return load < 0 ? 0.0 : load * 100.0;
        }
        double average = osBean.getSystemLoadAverage();
        if (average < 0) {
            return 0.0;
        }
        return Math.min(100.0, average / osBean.getAvailableProcessors() * 100.0);
    }

    @Override
    public double memoryPercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean extended) {
            long total = extended.getTotalMemorySize();
            if (total > 0) {
                return (total - extended.getFreeMemorySize()) * 100.0 / total;
            }
        }
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return used * 100.0 / runtime.maxMemory();
    }

    @Override
    public long availableMemoryBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean extended) {
            return extended.getFreeMemorySize();
        }
        Runtime runtime = Runtime.getRuntime();
        return runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
    }

    @Override
    public double ioWait() {
        // not exposed through JMX
        return 0.0;
    }
}
