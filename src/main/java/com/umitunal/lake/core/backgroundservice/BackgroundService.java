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

package com.umitunal.lake.core.backgroundservice;

import java.util.concurrent.TimeUnit;

/**
 * A periodic maintenance loop of the engine.
 * Each service owns one scheduler thread.
 */
public interface BackgroundService {

    /**
     * Starts the service and schedules its periodic task.
     */
    void start();

    /**
     * Runs the task once on the calling thread, regardless of the schedule.
     * Errors are logged, never thrown.
     */
    void executeNow();

    /**
     * Stops scheduling and waits briefly for a running task to finish.
     */
    void shutdown();

    /**
     * @return true if the service terminated before the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Stops scheduling and interrupts a running task.
     */
    void shutdownNow();
}
